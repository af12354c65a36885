package io.lighting.renamer.variable;

import java.util.List;

final class FormatOptions {
    static final List<FormatOption> INDEX = List.of(
        new FormatOption("零", "Chinese numerals starting at 零"),
        new FormatOption("1", "Decimal starting at 1"),
        new FormatOption("一", "Chinese numerals starting at 一"),
        new FormatOption("壹", "Formal Chinese numerals starting at 壹"),
        new FormatOption("00", "Two digits starting at 00"),
        new FormatOption("01", "Two digits starting at 01"),
        new FormatOption("000", "Three digits starting at 000"),
        new FormatOption("001", "Three digits starting at 001"),
        new FormatOption("0000", "Four digits starting at 0000"),
        new FormatOption("0001", "Four digits starting at 0001"),
        new FormatOption("00000", "Five digits starting at 00000"),
        new FormatOption("00001", "Five digits starting at 00001")
    );

    static final List<FormatOption> DATE = List.of(
        new FormatOption("yyyy-MM-dd", "2024-01-31"),
        new FormatOption("yyyyMMdd", "20240131"),
        new FormatOption("yyyy_MM_dd", "2024_01_31"),
        new FormatOption("yyyy.MM.dd", "2024.01.31"),
        new FormatOption("yyyy年MM月dd日", "2024年01月31日"),
        new FormatOption("MM-dd", "01-31")
    );

    static final List<FormatOption> DATE_TIME = List.of(
        new FormatOption("yyyy-MM-dd HH:mm:ss", "2024-01-31 08:30:00"),
        new FormatOption("yyyyMMddHHmmss", "20240131083000"),
        new FormatOption("yyyy-MM-dd_HH-mm-ss", "2024-01-31_08-30-00"),
        new FormatOption("HHmmss", "083000"),
        new FormatOption("HH-mm", "08-30")
    );

    static final List<FormatOption> IMAGE = List.of(
        new FormatOption("w", "Width in pixels"),
        new FormatOption("h", "Height in pixels"),
        new FormatOption("wxh", "Width x height")
    );

    static final List<FormatOption> SIZE = List.of(
        new FormatOption("1b", "Bytes"),
        new FormatOption("1kb", "Kilobytes, no decimals"),
        new FormatOption("1mb", "Megabytes, two decimals"),
        new FormatOption(".2f", "Automatic unit, two decimals"),
        new FormatOption(".1f", "Automatic unit, one decimal"),
        new FormatOption(".0f", "Automatic unit, no decimals")
    );

    static final List<FormatOption> FILE = List.of(
        new FormatOption("createTime", "Creation time"),
        new FormatOption("editTime", "Last modified time"),
        new FormatOption("accessTime", "Last access time")
    );

    private FormatOptions() {
    }
}
