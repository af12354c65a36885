package io.lighting.renamer.template;

import io.lighting.renamer.context.EvaluationContext;
import io.lighting.renamer.expr.IndexExpression;
import io.lighting.renamer.format.DateFormatter;
import io.lighting.renamer.format.FileFormatter;
import io.lighting.renamer.format.ImageFormatter;
import io.lighting.renamer.format.IndexFormatter;
import io.lighting.renamer.format.SizeFormatter;
import io.lighting.renamer.variable.TemplateVariable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 将语法树一次性编译为闭包。变量、方法名与序号表达式都在编译期解析，渲染时只执行闭包。
 * 输出与 {@link TemplateEvaluator} 完全一致。
 */
final class TemplateCompiler {
    CompiledTemplate compile(List<TemplateNode> nodes) {
        if (nodes.isEmpty()) {
            return context -> "";
        }
        if (nodes.size() == 1) {
            return compileNode(nodes.get(0));
        }
        CompiledTemplate[] parts = new CompiledTemplate[nodes.size()];
        for (int i = 0; i < parts.length; i++) {
            parts[i] = compileNode(nodes.get(i));
        }
        return context -> {
            StringBuilder out = new StringBuilder();
            for (CompiledTemplate part : parts) {
                out.append(part.render(context));
            }
            return out.toString();
        };
    }

    private CompiledTemplate compileNode(TemplateNode node) {
        if (node instanceof TextNode text) {
            String value = text.text();
            return context -> value;
        }
        if (node instanceof VariableNode variable) {
            return compileVariable(variable);
        }
        if (node instanceof FormatNode format) {
            return compileFormat(format);
        }
        if (node instanceof MethodNode method) {
            return compileMethod(method);
        }
        if (node instanceof SliceNode slice) {
            return compileSlice(slice);
        }
        if (node instanceof LiteralNode literal) {
            String value = String.valueOf(literal.value());
            return context -> value;
        }
        throw new IllegalArgumentException("Unsupported template node: " + node.getClass().getSimpleName());
    }

    private CompiledTemplate compileVariable(VariableNode node) {
        Optional<TemplateVariable> variable = TemplateVariable.lookup(node.name());
        if (variable.isEmpty()) {
            String placeholder = "{" + node.name() + "}";
            return context -> placeholder;
        }
        return switch (variable.get()) {
            case NAME -> EvaluationContext::name;
            case EXT -> EvaluationContext::ext;
            case FULLNAME -> EvaluationContext::fullName;
            case DIRNAME -> EvaluationContext::dirName;
            case I -> context -> Integer.toString(context.index());
            case IV -> context -> Integer.toString(context.reverseIndex());
            case TODAY -> context -> DateFormatter.formatDate(context.today(), "");
            case NOW -> context -> DateFormatter.formatDateTime(context.now(), "");
            case IMAGE -> context -> ImageFormatter.format(context.image(), "");
            case FILE -> EvaluationContext::fullPath;
            case SIZE -> context -> SizeFormatter.format(context.size(), "");
        };
    }

    private CompiledTemplate compileFormat(FormatNode node) {
        String spec = node.formatSpec();
        if (node.expression() != null) {
            IndexExpression expression = IndexExpression.compile(node.expression());
            return context -> IndexFormatter.format(expression.applyAsInt(context.index()), spec);
        }
        if (!(node.inner() instanceof VariableNode variableNode)) {
            return compileNode(node.inner());
        }
        Optional<TemplateVariable> variable = TemplateVariable.lookup(variableNode.name());
        if (variable.isEmpty()) {
            return compileNode(node.inner());
        }
        return switch (variable.get()) {
            case I -> context -> IndexFormatter.format(context.index(), spec);
            case IV -> context -> IndexFormatter.format(context.reverseIndex(), spec);
            case TODAY -> context -> DateFormatter.formatDate(context.today(), spec);
            case NOW -> context -> DateFormatter.formatDateTime(context.now(), spec);
            case IMAGE -> context -> ImageFormatter.format(context.image(), spec);
            case FILE -> context -> FileFormatter.format(context.fullPath(), context::file, spec);
            case SIZE -> context -> SizeFormatter.format(context.size(), spec);
            case NAME, EXT, FULLNAME, DIRNAME -> compileNode(node.inner());
        };
    }

    private CompiledTemplate compileMethod(MethodNode node) {
        Optional<StringMethod> lookup = StringMethod.lookup(node.name());
        if (lookup.isEmpty()) {
            String placeholder = StringMethod.unknown(node.name());
            return context -> placeholder;
        }
        CompiledTemplate target = compileNode(node.target());
        List<Argument> arguments = new ArrayList<>(node.arguments().size());
        for (TemplateNode argument : node.arguments()) {
            arguments.add(compileArgument(argument));
        }
        return switch (lookup.get()) {
            case UPPER -> context -> StringMethods.upper(target.render(context));
            case LOWER -> context -> StringMethods.lower(target.render(context));
            case TRIM -> context -> StringMethods.trim(target.render(context));
            case REPLACE -> compileReplace(target, arguments);
            case SUB, SLICE -> compileSubstring(target, arguments);
            case PAD_LEFT -> compilePad(target, arguments, true);
            case PAD_RIGHT -> compilePad(target, arguments, false);
        };
    }

    private static CompiledTemplate compileReplace(CompiledTemplate target, List<Argument> arguments) {
        if (arguments.size() < 2) {
            return target;
        }
        Argument search = arguments.get(0);
        Argument replacement = arguments.get(1);
        return context -> StringMethods.replace(target.render(context), search.resolve(context),
            replacement.resolve(context));
    }

    private static CompiledTemplate compileSubstring(CompiledTemplate target, List<Argument> arguments) {
        if (arguments.isEmpty()) {
            return target;
        }
        Argument start = arguments.get(0);
        if (arguments.size() == 1) {
            return context -> StringMethods.slice(target.render(context), start.resolve(context));
        }
        Argument end = arguments.get(1);
        return context -> StringMethods.slice(target.render(context), start.resolve(context), end.resolve(context));
    }

    private static CompiledTemplate compilePad(CompiledTemplate target, List<Argument> arguments, boolean left) {
        if (arguments.isEmpty()) {
            return target;
        }
        Argument width = arguments.get(0);
        Argument padding = arguments.size() > 1 ? arguments.get(1) : context -> null;
        return context -> StringMethods.pad(target.render(context), width.resolve(context),
            padding.resolve(context), left);
    }

    private CompiledTemplate compileSlice(SliceNode node) {
        CompiledTemplate target = compileNode(node.target());
        List<Argument> arguments = new ArrayList<>(2);
        if (node.start() == null && node.end() != null) {
            arguments.add(context -> 0);
            arguments.add(compileArgument(node.end()));
        } else if (node.start() != null) {
            arguments.add(compileArgument(node.start()));
            if (node.end() != null) {
                arguments.add(compileArgument(node.end()));
            }
        }
        return compileSubstring(target, arguments);
    }

    private Argument compileArgument(TemplateNode node) {
        if (node instanceof LiteralNode literal) {
            Object value = literal.value();
            return context -> value;
        }
        CompiledTemplate compiled = compileNode(node);
        return compiled::render;
    }

    @FunctionalInterface
    private interface Argument {
        Object resolve(EvaluationContext context);
    }
}
