package io.lighting.renamer.observe;

import io.lighting.renamer.context.EvaluationContext;

public interface TemplateObserver {
    default void afterParse(String template, long elapsedNanos) {
    }

    default void onParseError(String template, Exception error, long elapsedNanos) {
    }

    default void afterCompile(String template, long elapsedNanos) {
    }

    default void afterRender(String template, EvaluationContext context, String output, long elapsedNanos) {
    }
}
