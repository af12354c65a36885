package io.lighting.renamer.context;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.function.Function;

/**
 * 基于文件路径的上下文。名称字段在构造时计算，图片尺寸与文件属性在首次访问时才读取磁盘。
 */
public final class FileEvaluationContext implements EvaluationContext {
    private final String name;
    private final String ext;
    private final String fullName;
    private final String fullPath;
    private final String dirName;
    private final int index;
    private final int totalCount;
    private final LocalDate today;
    private final LocalDateTime now;
    private final Memoized<ImageDimensions> image;
    private final Memoized<FileMetadata> file;

    private FileEvaluationContext(Builder builder) {
        Path path = builder.path;
        String fileName = path == null || path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        this.name = builder.name != null ? builder.name : dot >= 0 ? fileName.substring(0, dot) : fileName;
        this.ext = builder.ext != null ? builder.ext : dot >= 0 ? fileName.substring(dot + 1) : "";
        this.fullName = builder.fullName != null ? builder.fullName
            : path != null ? fileName : ext.isEmpty() ? name : name + "." + ext;
        this.fullPath = builder.fullPath != null ? builder.fullPath : path != null ? path.toString() : fullName;
        this.dirName = builder.dirName != null ? builder.dirName : parentName(path);
        if (builder.index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + builder.index);
        }
        if (builder.totalCount < 0) {
            throw new IllegalArgumentException("totalCount must not be negative: " + builder.totalCount);
        }
        if (builder.totalCount > 0 && builder.index >= builder.totalCount) {
            throw new IllegalArgumentException("index " + builder.index + " is outside a batch of "
                + builder.totalCount);
        }
        this.index = builder.index;
        this.totalCount = builder.totalCount;
        this.now = LocalDateTime.now(builder.clock);
        this.today = now.toLocalDate();
        Function<Path, ImageDimensions> imageLoader = builder.imageLoader;
        Function<Path, FileMetadata> metadataLoader = builder.metadataLoader;
        this.image = new Memoized<>(() -> path == null ? ImageDimensions.NONE : imageLoader.apply(path));
        this.file = new Memoized<>(() -> path == null ? FileMetadata.missing() : metadataLoader.apply(path));
    }

    public static FileEvaluationContext of(Path path, int index, int totalCount) {
        return builder().path(path).index(index).totalCount(totalCount).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String parentName(Path path) {
        if (path == null) {
            return "";
        }
        Path parent = path.getParent();
        if (parent == null || parent.getFileName() == null) {
            return "";
        }
        return parent.getFileName().toString();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String ext() {
        return ext;
    }

    @Override
    public String fullName() {
        return fullName;
    }

    @Override
    public String fullPath() {
        return fullPath;
    }

    @Override
    public String dirName() {
        return dirName;
    }

    @Override
    public int index() {
        return index;
    }

    @Override
    public int totalCount() {
        return totalCount;
    }

    @Override
    public LocalDate today() {
        return today;
    }

    @Override
    public LocalDateTime now() {
        return now;
    }

    @Override
    public ImageDimensions image() {
        return image.get();
    }

    @Override
    public FileMetadata file() {
        return file.get();
    }

    @Override
    public long size() {
        return file().size();
    }

    boolean isImageLoaded() {
        return image.isLoaded();
    }

    boolean isFileLoaded() {
        return file.isLoaded();
    }

    @Override
    public String toString() {
        return "FileEvaluationContext{" + fullPath + ", index=" + index + "/" + totalCount + "}";
    }

    public static final class Builder {
        private Path path;
        private String name;
        private String ext;
        private String fullName;
        private String fullPath;
        private String dirName;
        private int index = 0;
        private int totalCount = 1;
        private Clock clock = Clock.systemDefaultZone();
        private Function<Path, ImageDimensions> imageLoader = FileProbes::readImageDimensions;
        private Function<Path, FileMetadata> metadataLoader = FileProbes::readMetadata;

        private Builder() {
        }

        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder ext(String ext) {
            this.ext = ext;
            return this;
        }

        public Builder fullName(String fullName) {
            this.fullName = fullName;
            return this;
        }

        public Builder fullPath(String fullPath) {
            this.fullPath = fullPath;
            return this;
        }

        public Builder dirName(String dirName) {
            this.dirName = dirName;
            return this;
        }

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder totalCount(int totalCount) {
            this.totalCount = totalCount;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder imageLoader(Function<Path, ImageDimensions> imageLoader) {
            this.imageLoader = Objects.requireNonNull(imageLoader, "imageLoader");
            return this;
        }

        public Builder metadataLoader(Function<Path, FileMetadata> metadataLoader) {
            this.metadataLoader = Objects.requireNonNull(metadataLoader, "metadataLoader");
            return this;
        }

        public FileEvaluationContext build() {
            return new FileEvaluationContext(this);
        }
    }
}
