package io.lighting.renamer.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.renamer.context.EvaluationContext;
import io.lighting.renamer.observe.TemplateLog;
import io.lighting.renamer.observe.TemplateObserver;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RenameTemplateEngineTest {

    @Test
    void cachesCompiledTemplatesByText() {
        RenameTemplateEngine engine = RenameTemplateEngine.create();

        CompiledTemplate first = engine.compile("{name}.{ext}");
        CompiledTemplate second = engine.compile("{name}.{ext}");

        assertSame(first, second);
        assertEquals(1, engine.cachedTemplates());
    }

    @Test
    void syntaxErrorsAreNotCached() {
        RecordingObserver observer = new RecordingObserver();
        RenameTemplateEngine engine = RenameTemplateEngine.builder().observer(observer).build();

        assertThrows(TemplateSyntaxException.class, () -> engine.compile("{name"));
        assertThrows(TemplateSyntaxException.class, () -> engine.compile("{name"));

        assertEquals(0, engine.cachedTemplates());
        assertEquals(List.of("error:{name", "error:{name"), observer.events);
    }

    @Test
    void notifiesObserversOnceForParseAndCompile() {
        RecordingObserver observer = new RecordingObserver();
        RenameTemplateEngine engine = RenameTemplateEngine.builder().observer(observer).build();

        engine.render("{name}", TestContexts.named("a", "txt", 0));
        engine.render("{name}", TestContexts.named("b", "txt", 0));

        assertEquals(List.of("parse:{name}", "compile:{name}", "render:a", "render:b"), observer.events);
    }

    @Test
    void interpretedModeMatchesCompiledMode() {
        RenameTemplateEngine compiled = RenameTemplateEngine.create();
        RenameTemplateEngine interpreted = RenameTemplateEngine.builder().mode(EvaluationMode.INTERPRETED).build();
        String template = "{dirname}_{name.upper()[0:3]}_{iv:001}.{ext}";
        List<EvaluationContext> contexts = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            contexts.add(TestContexts.photo(i, 5));
        }

        List<String> outputs = compiled.renderAll(template, contexts);

        assertEquals(outputs, interpreted.renderAll(template, contexts));
        assertEquals("photos_BEA_005.jpg", outputs.get(0));
        assertEquals("photos_BEA_001.jpg", outputs.get(4));
    }

    @Test
    void rendersFilesWithBatchPositions(@TempDir Path dir) throws Exception {
        Path first = Files.writeString(dir.resolve("a.txt"), "a");
        Path second = dir.resolve("missing.log");
        RenameTemplateEngine engine = RenameTemplateEngine.builder().clock(TestContexts.CLOCK).build();

        List<String> names = engine.renderFiles("{today:yyyyMMdd}_{name}_{i:01}of{iv:1}.{ext}", List.of(first, second));

        assertEquals(List.of("20240131_a_01of2.txt", "20240131_missing_02of1.log"), names);
    }

    @Test
    void writesRenderLinesThroughTemplateLog() {
        List<String> lines = new ArrayList<>();
        TemplateLog log = TemplateLog.builder().sink(lines::add).build();
        RenameTemplateEngine engine = RenameTemplateEngine.builder().observer(log).build();

        engine.render("{name}.{ext}", TestContexts.named("song", "mp3", 0));

        assertEquals(List.of("RENAME: [RENDER] {name}.{ext} -> song.mp3"), lines);
    }

    @Test
    void sharesCompiledTemplatesAcrossThreads() throws Exception {
        RenameTemplateEngine engine = RenameTemplateEngine.create();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                int index = i;
                futures.add(executor.submit(() -> engine.render("{name}_{i:0001}",
                    TestContexts.named("f", "x", index))));
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals("f_" + String.format("%04d", i + 1), futures.get(i).get());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, engine.cachedTemplates());
    }

    @Test
    void rejectsNegativeCacheSize() {
        assertThrows(IllegalArgumentException.class, () -> RenameTemplateEngine.builder().cacheMaximumSize(-1));
        assertTrue(RenameTemplateEngine.create().observers().isEmpty());
    }

    private static final class RecordingObserver implements TemplateObserver {
        private final List<String> events = new ArrayList<>();

        @Override
        public void afterParse(String template, long elapsedNanos) {
            events.add("parse:" + template);
        }

        @Override
        public void onParseError(String template, Exception error, long elapsedNanos) {
            events.add("error:" + template);
        }

        @Override
        public void afterCompile(String template, long elapsedNanos) {
            events.add("compile:" + template);
        }

        @Override
        public void afterRender(String template, EvaluationContext context, String output, long elapsedNanos) {
            events.add("render:" + output);
        }
    }
}
