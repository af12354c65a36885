package io.lighting.renamer.context;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileProbesTest {

    @Test
    void readsImageHeader(@TempDir Path dir) throws Exception {
        Path image = dir.resolve("pixel.png");
        ImageIO.write(new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB), "png", image.toFile());

        assertEquals(new ImageDimensions(3, 2), FileProbes.readImageDimensions(image));
    }

    @Test
    void nonImagesHaveNoDimensions(@TempDir Path dir) throws Exception {
        Path text = Files.writeString(dir.resolve("notes.txt"), "hello");

        assertEquals(ImageDimensions.NONE, FileProbes.readImageDimensions(text));
        assertEquals(ImageDimensions.NONE, FileProbes.readImageDimensions(dir.resolve("absent.png")));
        assertEquals(ImageDimensions.NONE, FileProbes.readImageDimensions(dir));
    }

    @Test
    void readsMetadata(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("data.bin"), "12345");
        Instant modified = Instant.parse("2022-01-02T03:04:05Z");
        Files.setLastModifiedTime(file, FileTime.from(modified));

        FileMetadata metadata = FileProbes.readMetadata(file);

        assertTrue(metadata.exists());
        assertEquals(5, metadata.size());
        assertEquals(modified, metadata.lastModifiedTime());
    }

    @Test
    void missingFileHasMissingMetadata(@TempDir Path dir) {
        FileMetadata metadata = FileProbes.readMetadata(dir.resolve("absent.txt"));

        assertFalse(metadata.exists());
        assertEquals(FileMetadata.missing(), metadata);
    }
}
