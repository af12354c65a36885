package io.lighting.renamer.template;

import java.util.Locale;

final class StringMethods {
    // wider than any file name; larger widths leave the value untouched
    static final int MAX_PAD_WIDTH = 4096;

    private StringMethods() {
    }

    static String upper(String value) {
        return value.toUpperCase(Locale.ROOT);
    }

    static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    static String trim(String value) {
        return value.strip();
    }

    static String replace(String value, Object search, Object replacement) {
        String from = String.valueOf(search);
        if (from.isEmpty()) {
            return value;
        }
        return value.replace(from, String.valueOf(replacement));
    }

    static String slice(String value, Object start) {
        int length = value.length();
        int from = resolveIndex(start, length, 0);
        return from >= length ? "" : value.substring(from);
    }

    static String slice(String value, Object start, Object end) {
        int length = value.length();
        int from = resolveIndex(start, length, 0);
        int to = resolveIndex(end, length, length);
        return from >= to ? "" : value.substring(from, to);
    }

    static String pad(String value, Object width, Object padding, boolean left) {
        int target = toInt(width, value.length());
        if (value.length() >= target || target > MAX_PAD_WIDTH) {
            return value;
        }
        char fill = ' ';
        if (padding != null) {
            String text = String.valueOf(padding);
            if (!text.isEmpty()) {
                fill = text.charAt(0);
            }
        }
        String fillers = String.valueOf(fill).repeat(target - value.length());
        return left ? fillers + value : value + fillers;
    }

    /**
     * 负数从末尾倒数，结果截断到 [0, length]。
     */
    static int resolveIndex(Object raw, int length, int fallback) {
        int index = toInt(raw, fallback);
        if (index < 0) {
            index = length + index;
        }
        return Math.max(0, Math.min(index, length));
    }

    private static int toInt(Object raw, int fallback) {
        if (raw instanceof Integer number) {
            return number;
        }
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(String.valueOf(raw).trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
