package io.lighting.renamer.template;

/**
 * 模板语法错误，携带出错位置（字符偏移）。
 */
public final class TemplateSyntaxException extends IllegalArgumentException {
    private final int position;

    public TemplateSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
