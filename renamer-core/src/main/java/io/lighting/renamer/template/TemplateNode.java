package io.lighting.renamer.template;

import java.util.Objects;
import java.util.List;

sealed interface TemplateNode permits TextNode, VariableNode, FormatNode, MethodNode, SliceNode, LiteralNode {
}

record TextNode(String text) implements TemplateNode {
    TextNode {
        Objects.requireNonNull(text, "text");
    }
}

record VariableNode(String name) implements TemplateNode {
    VariableNode {
        Objects.requireNonNull(name, "name");
    }
}

/**
 * expression 仅在 {2*i+1:00} 这类序号表达式中出现，否则为 null。
 */
record FormatNode(TemplateNode inner, String formatSpec, String expression) implements TemplateNode {
    FormatNode {
        Objects.requireNonNull(inner, "inner");
        Objects.requireNonNull(formatSpec, "formatSpec");
    }
}

record MethodNode(TemplateNode target, String name, List<TemplateNode> arguments) implements TemplateNode {
    MethodNode {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(name, "name");
        arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
    }
}

record SliceNode(TemplateNode target, LiteralNode start, LiteralNode end) implements TemplateNode {
    SliceNode {
        Objects.requireNonNull(target, "target");
    }
}

record LiteralNode(Object value) implements TemplateNode {
    LiteralNode {
        Objects.requireNonNull(value, "value");
        if (!(value instanceof String) && !(value instanceof Integer)) {
            throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
        }
    }
}
