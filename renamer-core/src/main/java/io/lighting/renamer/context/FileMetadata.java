package io.lighting.renamer.context;

import java.time.Instant;

/**
 * 文件属性快照。文件不存在时 exists 为 false，其余字段无意义。
 */
public record FileMetadata(boolean exists, long size, Instant creationTime, Instant lastModifiedTime,
                           Instant lastAccessTime) {
    private static final FileMetadata MISSING = new FileMetadata(false, 0L, Instant.EPOCH, Instant.EPOCH,
        Instant.EPOCH);

    public FileMetadata {
        if (creationTime == null) {
            creationTime = Instant.EPOCH;
        }
        if (lastModifiedTime == null) {
            lastModifiedTime = Instant.EPOCH;
        }
        if (lastAccessTime == null) {
            lastAccessTime = Instant.EPOCH;
        }
    }

    public static FileMetadata missing() {
        return MISSING;
    }
}
