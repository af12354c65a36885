package io.lighting.renamer.variable;

import java.util.Objects;

/**
 * 变量支持的一个格式后缀，例如 {@code i} 的 {@code 001}。
 */
public record FormatOption(String text, String description) {
    public FormatOption {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(description, "description");
    }
}
