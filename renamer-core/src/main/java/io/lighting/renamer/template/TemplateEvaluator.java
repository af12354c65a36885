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

final class TemplateEvaluator {
    String evaluate(List<TemplateNode> nodes, EvaluationContext context) {
        StringBuilder out = new StringBuilder();
        for (TemplateNode node : nodes) {
            out.append(evaluateNode(node, context));
        }
        return out.toString();
    }

    private String evaluateNode(TemplateNode node, EvaluationContext context) {
        if (node instanceof TextNode text) {
            return text.text();
        }
        if (node instanceof VariableNode variable) {
            return evaluateVariable(variable, context);
        }
        if (node instanceof FormatNode format) {
            return evaluateFormat(format, context);
        }
        if (node instanceof MethodNode method) {
            return evaluateMethod(method, context);
        }
        if (node instanceof SliceNode slice) {
            return evaluateSlice(slice, context);
        }
        if (node instanceof LiteralNode literal) {
            return String.valueOf(literal.value());
        }
        throw new IllegalArgumentException("Unsupported template node: " + node.getClass().getSimpleName());
    }

    private String evaluateVariable(VariableNode node, EvaluationContext context) {
        Optional<TemplateVariable> variable = TemplateVariable.lookup(node.name());
        if (variable.isEmpty()) {
            return "{" + node.name() + "}";
        }
        return switch (variable.get()) {
            case NAME -> context.name();
            case EXT -> context.ext();
            case FULLNAME -> context.fullName();
            case DIRNAME -> context.dirName();
            case I -> Integer.toString(context.index());
            case IV -> Integer.toString(context.reverseIndex());
            case TODAY -> DateFormatter.formatDate(context.today(), "");
            case NOW -> DateFormatter.formatDateTime(context.now(), "");
            case IMAGE -> ImageFormatter.format(context.image(), "");
            case FILE -> context.fullPath();
            case SIZE -> SizeFormatter.format(context.size(), "");
        };
    }

    private String evaluateFormat(FormatNode node, EvaluationContext context) {
        if (node.expression() != null) {
            int value = IndexExpression.compile(node.expression()).applyAsInt(context.index());
            return IndexFormatter.format(value, node.formatSpec());
        }
        if (!(node.inner() instanceof VariableNode variableNode)) {
            return evaluateNode(node.inner(), context);
        }
        Optional<TemplateVariable> variable = TemplateVariable.lookup(variableNode.name());
        if (variable.isEmpty()) {
            return evaluateNode(node.inner(), context);
        }
        String spec = node.formatSpec();
        return switch (variable.get()) {
            case I -> IndexFormatter.format(context.index(), spec);
            case IV -> IndexFormatter.format(context.reverseIndex(), spec);
            case TODAY -> DateFormatter.formatDate(context.today(), spec);
            case NOW -> DateFormatter.formatDateTime(context.now(), spec);
            case IMAGE -> ImageFormatter.format(context.image(), spec);
            case FILE -> FileFormatter.format(context.fullPath(), context::file, spec);
            case SIZE -> SizeFormatter.format(context.size(), spec);
            case NAME, EXT, FULLNAME, DIRNAME -> evaluateNode(node.inner(), context);
        };
    }

    private String evaluateMethod(MethodNode node, EvaluationContext context) {
        Optional<StringMethod> method = StringMethod.lookup(node.name());
        if (method.isEmpty()) {
            return StringMethod.unknown(node.name());
        }
        String target = evaluateNode(node.target(), context);
        List<Object> arguments = new ArrayList<>(node.arguments().size());
        for (TemplateNode argument : node.arguments()) {
            arguments.add(argument instanceof LiteralNode literal ? literal.value() : evaluateNode(argument, context));
        }
        return method.get().apply(target, arguments);
    }

    private String evaluateSlice(SliceNode node, EvaluationContext context) {
        String target = evaluateNode(node.target(), context);
        if (node.start() == null && node.end() == null) {
            return target;
        }
        if (node.end() == null) {
            return StringMethods.slice(target, node.start().value());
        }
        Object start = node.start() == null ? 0 : node.start().value();
        return StringMethods.slice(target, start, node.end().value());
    }
}
