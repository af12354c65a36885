package io.lighting.renamer.starter;

import io.lighting.renamer.observe.TemplateLog;
import io.lighting.renamer.template.EvaluationMode;
import java.util.function.Consumer;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the rename template engine.
 * <p>
 * Configure these properties under the "renamer" prefix in application.yml:
 * <pre>{@code
 * renamer:
 *   mode: COMPILED
 *   cache:
 *     maximum-size: 512
 *   log:
 *     log-on-render: true
 *     include-elapsed: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "renamer")
public class RenamerProperties {

    private EvaluationMode mode = EvaluationMode.COMPILED;
    private CacheProperties cache = new CacheProperties();
    private LogProperties log = new LogProperties();

    public EvaluationMode getMode() {
        return mode;
    }

    public void setMode(EvaluationMode mode) {
        this.mode = mode;
    }

    public CacheProperties getCache() {
        return cache;
    }

    public void setCache(CacheProperties cache) {
        this.cache = cache;
    }

    public LogProperties getLog() {
        return log;
    }

    public void setLog(LogProperties log) {
        this.log = log;
    }

    public static class CacheProperties {
        private long maximumSize = 256;

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }
    }

    public static class LogProperties {
        private boolean enabled = true;
        private boolean logOnParse = false;
        private boolean logOnRender = true;
        private boolean includeElapsed = false;
        private String prefix = "RENAME:";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isLogOnParse() {
            return logOnParse;
        }

        public void setLogOnParse(boolean logOnParse) {
            this.logOnParse = logOnParse;
        }

        public boolean isLogOnRender() {
            return logOnRender;
        }

        public void setLogOnRender(boolean logOnRender) {
            this.logOnRender = logOnRender;
        }

        public boolean isIncludeElapsed() {
            return includeElapsed;
        }

        public void setIncludeElapsed(boolean includeElapsed) {
            this.includeElapsed = includeElapsed;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public TemplateLog build(Consumer<String> logger) {
            return TemplateLog.builder()
                .enabled(enabled)
                .logOnParse(logOnParse)
                .logOnRender(logOnRender)
                .includeElapsed(includeElapsed)
                .prefix(prefix)
                .sink(logger)
                .build();
        }
    }
}
