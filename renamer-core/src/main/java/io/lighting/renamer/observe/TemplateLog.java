package io.lighting.renamer.observe;

import io.lighting.renamer.context.EvaluationContext;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 模板解析/渲染日志观察器。
 * <p>
 * 作为 {@link TemplateObserver} 的实现，在模板解析、编译或渲染时输出可读日志，例如：
 * <pre>
 * RENAME: [RENDER] {name}.{ext} -> song.mp3
 * </pre>
 * 通过 {@link Builder} 配置，构建后为不可变对象，线程安全。
 */
public final class TemplateLog implements TemplateObserver {
    /**
     * 总开关。为 false 时所有日志都不会输出。
     */
    private final boolean enabled;
    /**
     * 是否在解析与编译阶段输出日志（包括语法错误）。
     */
    private final boolean logOnParse;
    /**
     * 是否在每次渲染后输出日志。
     */
    private final boolean logOnRender;
    /**
     * 是否附加耗时（纳秒）。
     */
    private final boolean includeElapsed;
    private final String prefix;
    private final Consumer<String> sink;

    private TemplateLog(Builder builder) {
        this.enabled = builder.enabled;
        this.logOnParse = builder.logOnParse;
        this.logOnRender = builder.logOnRender;
        this.includeElapsed = builder.includeElapsed;
        this.prefix = builder.prefix;
        this.sink = builder.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void afterParse(String template, long elapsedNanos) {
        if (!enabled || !logOnParse) {
            return;
        }
        sink.accept(format("PARSE", template, elapsedNanos));
    }

    @Override
    public void onParseError(String template, Exception error, long elapsedNanos) {
        if (!enabled || !logOnParse) {
            return;
        }
        sink.accept(format("ERROR", template + " | " + error.getMessage(), elapsedNanos));
    }

    @Override
    public void afterCompile(String template, long elapsedNanos) {
        if (!enabled || !logOnParse) {
            return;
        }
        sink.accept(format("COMPILE", template, elapsedNanos));
    }

    @Override
    public void afterRender(String template, EvaluationContext context, String output, long elapsedNanos) {
        if (!enabled || !logOnRender) {
            return;
        }
        sink.accept(format("RENDER", template + " -> " + output, elapsedNanos));
    }

    private String format(String stage, String content, long elapsedNanos) {
        String line = prefix + " [" + stage + "] " + content;
        return includeElapsed ? line + " elapsed=" + elapsedNanos + "ns" : line;
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean logOnParse = false;
        private boolean logOnRender = true;
        private boolean includeElapsed = false;
        private String prefix = "RENAME:";
        private Consumer<String> sink = System.out::println;

        /**
         * 全局开关：关闭后不输出任何日志。
         */
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder logOnParse(boolean enabled) {
            this.logOnParse = enabled;
            return this;
        }

        public Builder logOnRender(boolean enabled) {
            this.logOnRender = enabled;
            return this;
        }

        /**
         * 是否输出耗时信息（纳秒）。
         */
        public Builder includeElapsed(boolean enabled) {
            this.includeElapsed = enabled;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = Objects.requireNonNull(prefix, "prefix");
            return this;
        }

        /**
         * 日志输出目标，默认 System.out。
         */
        public Builder sink(Consumer<String> sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public TemplateLog build() {
            return new TemplateLog(this);
        }
    }
}
