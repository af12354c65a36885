package io.lighting.renamer.template;

import io.lighting.renamer.context.EvaluationContext;

/**
 * 编译后的模板：无状态、线程安全，可对不同上下文并发调用。
 */
@FunctionalInterface
public interface CompiledTemplate {
    String render(EvaluationContext context);
}
