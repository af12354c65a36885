package io.lighting.renamer.context;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 默认的磁盘加载器。读取失败时返回空值并记录 debug 日志，不向模板抛出异常。
 */
public final class FileProbes {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileProbes.class);

    private FileProbes() {
    }

    public static FileMetadata readMetadata(Path path) {
        if (path == null) {
            return FileMetadata.missing();
        }
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new FileMetadata(true, attributes.size(), attributes.creationTime().toInstant(),
                attributes.lastModifiedTime().toInstant(), attributes.lastAccessTime().toInstant());
        } catch (NoSuchFileException ex) {
            return FileMetadata.missing();
        } catch (IOException ex) {
            LOGGER.debug("Cannot read attributes of {}", path, ex);
            return FileMetadata.missing();
        }
    }

    /**
     * 只解码图片头部；不是图片或无法识别时返回 {@link ImageDimensions#NONE}。
     */
    public static ImageDimensions readImageDimensions(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return ImageDimensions.NONE;
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
            if (input == null) {
                return ImageDimensions.NONE;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return ImageDimensions.NONE;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return new ImageDimensions(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException ex) {
            LOGGER.debug("Cannot read image header of {}", path, ex);
            return ImageDimensions.NONE;
        }
    }
}
