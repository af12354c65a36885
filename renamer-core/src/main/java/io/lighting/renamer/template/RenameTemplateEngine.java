package io.lighting.renamer.template;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.lighting.renamer.context.EvaluationContext;
import io.lighting.renamer.context.FileEvaluationContext;
import io.lighting.renamer.observe.TemplateObserver;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 模板引擎入口。
 * <p>
 * 按模板文本缓存解析与编译结果（Caffeine），并在解析、编译、渲染时通知 {@link TemplateObserver}。
 * 语法错误不会进入缓存。实例线程安全，可在多个线程间共享。
 */
public final class RenameTemplateEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(RenameTemplateEngine.class);

    private final EvaluationMode mode;
    private final long cacheMaximumSize;
    private final List<TemplateObserver> observers;
    private final Clock clock;
    private final Cache<String, Prepared> cache;

    private RenameTemplateEngine(Builder builder) {
        this.mode = builder.mode;
        this.cacheMaximumSize = builder.cacheMaximumSize;
        this.observers = List.copyOf(builder.observers);
        this.clock = builder.clock;
        this.cache = Caffeine.newBuilder()
            .maximumSize(cacheMaximumSize)
            .build();
    }

    public static RenameTemplateEngine create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public RenameTemplate parse(String template) {
        Objects.requireNonNull(template, "template");
        long start = System.nanoTime();
        RenameTemplate parsed;
        try {
            parsed = RenameTemplate.parse(template);
        } catch (TemplateSyntaxException ex) {
            long elapsed = System.nanoTime() - start;
            for (TemplateObserver observer : observers) {
                observer.onParseError(template, ex, elapsed);
            }
            throw ex;
        }
        long elapsed = System.nanoTime() - start;
        for (TemplateObserver observer : observers) {
            observer.afterParse(template, elapsed);
        }
        return parsed;
    }

    public CompiledTemplate compile(String template) {
        return prepare(template).compiled();
    }

    public String render(String template, EvaluationContext context) {
        Objects.requireNonNull(context, "context");
        return render(prepare(template), context);
    }

    public List<String> renderAll(String template, List<? extends EvaluationContext> contexts) {
        Objects.requireNonNull(contexts, "contexts");
        Prepared prepared = prepare(template);
        List<String> outputs = new ArrayList<>(contexts.size());
        for (EvaluationContext context : contexts) {
            outputs.add(render(prepared, Objects.requireNonNull(context, "context")));
        }
        return outputs;
    }

    public List<String> renderFiles(String template, List<Path> files) {
        Objects.requireNonNull(files, "files");
        List<EvaluationContext> contexts = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            contexts.add(FileEvaluationContext.builder()
                .path(Objects.requireNonNull(files.get(i), "file"))
                .index(i)
                .totalCount(files.size())
                .clock(clock)
                .build());
        }
        return renderAll(template, contexts);
    }

    public EvaluationMode mode() {
        return mode;
    }

    public long cacheMaximumSize() {
        return cacheMaximumSize;
    }

    public List<TemplateObserver> observers() {
        return observers;
    }

    public Clock clock() {
        return clock;
    }

    public long cachedTemplates() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clearCache() {
        cache.invalidateAll();
    }

    private Prepared prepare(String template) {
        Objects.requireNonNull(template, "template");
        return cache.get(template, this::prepareUncached);
    }

    private Prepared prepareUncached(String template) {
        LOGGER.debug("Template cache miss: {}", template);
        RenameTemplate parsed = parse(template);
        long start = System.nanoTime();
        CompiledTemplate compiled = parsed.compile();
        long elapsed = System.nanoTime() - start;
        for (TemplateObserver observer : observers) {
            observer.afterCompile(template, elapsed);
        }
        return new Prepared(parsed, compiled);
    }

    private String render(Prepared prepared, EvaluationContext context) {
        if (observers.isEmpty()) {
            return renderWithMode(prepared, context);
        }
        long start = System.nanoTime();
        String output = renderWithMode(prepared, context);
        long elapsed = System.nanoTime() - start;
        for (TemplateObserver observer : observers) {
            observer.afterRender(prepared.template().source(), context, output, elapsed);
        }
        return output;
    }

    private String renderWithMode(Prepared prepared, EvaluationContext context) {
        return mode == EvaluationMode.COMPILED
            ? prepared.compiled().render(context)
            : prepared.template().evaluate(context);
    }

    private record Prepared(RenameTemplate template, CompiledTemplate compiled) {
    }

    public static final class Builder {
        private EvaluationMode mode = EvaluationMode.COMPILED;
        private long cacheMaximumSize = 256;
        private List<TemplateObserver> observers = List.of();
        private Clock clock = Clock.systemDefaultZone();

        private Builder() {
        }

        public Builder mode(EvaluationMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        // 0 表示不缓存，每次调用都重新解析与编译。
        public Builder cacheMaximumSize(long cacheMaximumSize) {
            if (cacheMaximumSize < 0) {
                throw new IllegalArgumentException("cacheMaximumSize must not be negative: " + cacheMaximumSize);
            }
            this.cacheMaximumSize = cacheMaximumSize;
            return this;
        }

        public Builder observers(List<TemplateObserver> observers) {
            this.observers = List.copyOf(Objects.requireNonNull(observers, "observers"));
            return this;
        }

        public Builder observer(TemplateObserver observer) {
            List<TemplateObserver> next = new ArrayList<>(observers);
            next.add(Objects.requireNonNull(observer, "observer"));
            this.observers = List.copyOf(next);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public RenameTemplateEngine build() {
            return new RenameTemplateEngine(this);
        }
    }
}
