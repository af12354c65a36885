package io.lighting.renamer.format;

/**
 * 整数转中文数字。小写：一百二十三；大写（财务写法）：壹佰贰拾叁。
 */
public final class ChineseNumerals {
    static final String LOWER_DIGITS = "零一二三四五六七八九";
    static final String UPPER_DIGITS = "零壹贰叁肆伍陆柒捌玖";
    private static final String[] LOWER_UNITS = {"", "十", "百", "千"};
    private static final String[] UPPER_UNITS = {"", "拾", "佰", "仟"};
    private static final String[] SECTION_UNITS = {"", "万", "亿", "万亿", "亿亿"};

    private ChineseNumerals() {
    }

    public static String toChinese(long value, boolean formal) {
        if (value == Long.MIN_VALUE) {
            throw new IllegalArgumentException("Value out of range: " + value);
        }
        String digits = formal ? UPPER_DIGITS : LOWER_DIGITS;
        if (value == 0) {
            return String.valueOf(digits.charAt(0));
        }
        long remaining = Math.abs(value);
        String[] units = formal ? UPPER_UNITS : LOWER_UNITS;

        int sectionCount = 0;
        long[] sections = new long[SECTION_UNITS.length];
        while (remaining > 0) {
            sections[sectionCount++] = remaining % 10000;
            remaining /= 10000;
        }

        StringBuilder out = new StringBuilder();
        boolean pendingZero = false;
        for (int i = sectionCount - 1; i >= 0; i--) {
            long section = sections[i];
            if (section == 0) {
                pendingZero = out.length() > 0;
                continue;
            }
            if (out.length() > 0 && (pendingZero || section < 1000)) {
                out.append(digits.charAt(0));
            }
            out.append(section(section, digits, units)).append(SECTION_UNITS[i]);
            pendingZero = false;
        }

        String result = out.toString();
        // 一十二 reads as 十二 when it leads the number
        char one = digits.charAt(1);
        if (sections[sectionCount - 1] >= 10 && sections[sectionCount - 1] < 20
            && result.length() > 1 && result.charAt(0) == one) {
            result = result.substring(1);
        }
        return value < 0 ? "负" + result : result;
    }

    private static String section(long section, String digits, String[] units) {
        StringBuilder out = new StringBuilder();
        boolean zeroGap = false;
        for (int position = 3; position >= 0; position--) {
            int digit = (int) (section / pow10(position) % 10);
            if (digit == 0) {
                zeroGap = out.length() > 0;
                continue;
            }
            if (zeroGap) {
                out.append(digits.charAt(0));
                zeroGap = false;
            }
            out.append(digits.charAt(digit)).append(units[position]);
        }
        return out.toString();
    }

    private static long pow10(int exponent) {
        long result = 1;
        for (int i = 0; i < exponent; i++) {
            result *= 10;
        }
        return result;
    }
}
