package io.lighting.renamer.format;

import io.lighting.renamer.context.FileMetadata;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * {file} 输出完整路径；{file:createTime} 等输出时间戳。只有带格式时才读取文件属性。
 */
public final class FileFormatter {
    private FileFormatter() {
    }

    public static String format(String fullPath, Supplier<FileMetadata> metadata, String spec) {
        if (spec == null || spec.isBlank()) {
            return fullPath;
        }
        FileMetadata file = metadata.get();
        if (!file.exists()) {
            return "";
        }
        return switch (spec.trim().toLowerCase(Locale.ROOT)) {
            case "createtime" -> timestamp(file.creationTime(), "");
            case "edittime", "lastwritetime" -> timestamp(file.lastModifiedTime(), "");
            case "accesstime", "lastaccesstime" -> timestamp(file.lastAccessTime(), "");
            default -> timestamp(file.creationTime(), spec);
        };
    }

    private static String timestamp(Instant instant, String pattern) {
        return DateFormatter.formatDateTime(LocalDateTime.ofInstant(instant, ZoneId.systemDefault()), pattern);
    }
}
