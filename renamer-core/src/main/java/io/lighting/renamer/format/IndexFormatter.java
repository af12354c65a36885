package io.lighting.renamer.format;

/**
 * 序号格式：数字前缀决定起始值与补零宽度（"01" 从 1 开始两位补零），
 * 中文数字前缀决定中文风格与起始值（"一" 从 1 开始，"壹" 使用大写）。
 */
public final class IndexFormatter {
    private IndexFormatter() {
    }

    public static String format(int value, String spec) {
        if (spec == null || spec.isEmpty()) {
            return Integer.toString(value);
        }
        char first = spec.charAt(0);
        if (isChineseNumeral(first)) {
            return formatChinese(value, first);
        }
        if (first >= '0' && first <= '9') {
            return formatDecimal(value, spec);
        }
        return Integer.toString(value);
    }

    private static String formatChinese(int value, char first) {
        int lowerPosition = ChineseNumerals.LOWER_DIGITS.indexOf(first);
        boolean formal = lowerPosition < 0 && first != '十';
        int origin;
        if (first == '十' || first == '拾') {
            origin = 10;
        } else if (lowerPosition >= 0) {
            origin = lowerPosition;
        } else {
            origin = ChineseNumerals.UPPER_DIGITS.indexOf(first);
        }
        return ChineseNumerals.toChinese((long) value + origin, formal);
    }

    private static String formatDecimal(int value, String spec) {
        int width = 0;
        int origin = 0;
        while (width < spec.length() && Character.isDigit(spec.charAt(width))) {
            char ch = spec.charAt(width);
            if (origin == 0 && ch != '0') {
                origin = ch - '0';
            }
            width++;
        }
        long shifted = Math.max(0L, (long) value + origin);
        String digits = Long.toString(shifted);
        if (digits.length() >= width) {
            return digits;
        }
        return "0".repeat(width - digits.length()) + digits;
    }

    private static boolean isChineseNumeral(char ch) {
        return ChineseNumerals.LOWER_DIGITS.indexOf(ch) >= 0
            || ChineseNumerals.UPPER_DIGITS.indexOf(ch) >= 0
            || ch == '十' || ch == '拾';
    }
}
