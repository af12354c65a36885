package io.lighting.renamer.format;

import io.lighting.renamer.context.ImageDimensions;
import java.util.Locale;

public final class ImageFormatter {
    private ImageFormatter() {
    }

    public static String format(ImageDimensions dimensions, String spec) {
        if (dimensions == null || dimensions.isEmpty()) {
            return "";
        }
        String normalized = spec == null ? "" : spec.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "w" -> Integer.toString(dimensions.width());
            case "h" -> Integer.toString(dimensions.height());
            default -> dimensions.width() + "x" + dimensions.height();
        };
    }
}
