package io.lighting.renamer.format;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ChineseNumeralsTest {

    @Test
    void convertsSmallNumbers() {
        assertEquals("零", ChineseNumerals.toChinese(0, false));
        assertEquals("七", ChineseNumerals.toChinese(7, false));
        assertEquals("十", ChineseNumerals.toChinese(10, false));
        assertEquals("十九", ChineseNumerals.toChinese(19, false));
        assertEquals("二十", ChineseNumerals.toChinese(20, false));
        assertEquals("一百一十", ChineseNumerals.toChinese(110, false));
        assertEquals("一百零五", ChineseNumerals.toChinese(105, false));
    }

    @Test
    void insertsZeroBetweenGroups() {
        assertEquals("一千零一十", ChineseNumerals.toChinese(1010, false));
        assertEquals("十二万三千四百五十六", ChineseNumerals.toChinese(123456, false));
        assertEquals("十万零一十", ChineseNumerals.toChinese(100010, false));
        assertEquals("一亿零一", ChineseNumerals.toChinese(100000001, false));
        assertEquals("一亿零一万", ChineseNumerals.toChinese(100010000, false));
        assertEquals("一万零五百", ChineseNumerals.toChinese(10500, false));
    }

    @Test
    void usesFormalDigits() {
        assertEquals("拾", ChineseNumerals.toChinese(10, true));
        assertEquals("壹佰贰拾叁", ChineseNumerals.toChinese(123, true));
        assertEquals("零", ChineseNumerals.toChinese(0, true));
    }

    @Test
    void convertsValuesBeyondIntRange() {
        assertEquals("一万亿", ChineseNumerals.toChinese(1_000_000_000_000L, false));
        assertEquals("一亿亿", ChineseNumerals.toChinese(10_000_000_000_000_000L, false));
    }

    @Test
    void prefixesNegativeValues() {
        assertEquals("负三", ChineseNumerals.toChinese(-3, false));
    }
}
