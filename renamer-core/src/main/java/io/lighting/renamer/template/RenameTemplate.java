package io.lighting.renamer.template;

import io.lighting.renamer.context.EvaluationContext;
import java.util.List;
import java.util.Objects;

/**
 * 重命名模板对象。
 * <p>
 * 代表已经解析完成的模板语法树，例如 {@code {name.upper()}_{i:000}.{ext}}。
 * 可以直接遍历语法树求值（{@link #evaluate}），也可以编译为闭包（{@link #compile}）
 * 后对大量文件重复调用，两种方式输出一致。实例不可变，线程安全。
 */
public final class RenameTemplate {
    private static final TemplateEvaluator EVALUATOR = new TemplateEvaluator();

    private final String source;
    private final List<TemplateNode> nodes;

    RenameTemplate(String source, List<TemplateNode> nodes) {
        this.source = source;
        this.nodes = List.copyOf(nodes);
    }

    /**
     * @throws TemplateSyntaxException 模板语法错误（未闭合的括号、字符串等）
     */
    public static RenameTemplate parse(String template) {
        Objects.requireNonNull(template, "template");
        return new RenameTemplate(template, TemplateParser.parse(template));
    }

    public String evaluate(EvaluationContext context) {
        Objects.requireNonNull(context, "context");
        return EVALUATOR.evaluate(nodes, context);
    }

    public CompiledTemplate compile() {
        return new TemplateCompiler().compile(nodes);
    }

    public String source() {
        return source;
    }

    List<TemplateNode> nodes() {
        return nodes;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RenameTemplate template)) {
            return false;
        }
        return source.equals(template.source) && nodes.equals(template.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, nodes);
    }

    @Override
    public String toString() {
        return source;
    }
}
