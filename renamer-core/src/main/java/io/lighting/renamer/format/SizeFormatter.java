package io.lighting.renamer.format;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

public final class SizeFormatter {
    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private SizeFormatter() {
    }

    public static String format(long bytes, String spec) {
        if (bytes == 0) {
            return "0 B";
        }
        String normalized = spec == null ? "" : spec.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "1b" -> bytes + " B";
            case "1kb" -> scaled(bytes, 1, 0) + " KB";
            case "1mb" -> scaled(bytes, 2, 2) + " MB";
            default -> auto(bytes, decimals(normalized));
        };
    }

    private static int decimals(String spec) {
        if (spec.length() == 3 && spec.charAt(0) == '.' && spec.charAt(2) == 'f'
            && Character.isDigit(spec.charAt(1))) {
            return spec.charAt(1) - '0';
        }
        return 2;
    }

    private static String auto(long bytes, int decimals) {
        int unit = 0;
        double value = bytes;
        while (Math.abs(value) >= 1024 && unit < UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return scaled(bytes, unit, decimals) + " " + UNITS[unit];
    }

    private static String scaled(long bytes, int unit, int decimals) {
        BigDecimal divisor = BigDecimal.valueOf(1024L).pow(unit);
        return BigDecimal.valueOf(bytes)
            .divide(divisor, decimals, RoundingMode.HALF_UP)
            .toPlainString();
    }
}
