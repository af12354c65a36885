package io.lighting.renamer.template;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 模板可调用的字符串方法，方法名大小写不敏感。
 */
enum StringMethod {
    UPPER("upper"),
    LOWER("lower"),
    TRIM("trim"),
    REPLACE("replace"),
    SUB("sub"),
    SLICE("slice"),
    PAD_LEFT("padleft"),
    PAD_RIGHT("padright");

    private final String key;

    StringMethod(String key) {
        this.key = key;
    }

    String key() {
        return key;
    }

    static Optional<StringMethod> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (StringMethod method : values()) {
            if (method.key.equals(normalized)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    String apply(String target, List<Object> arguments) {
        return switch (this) {
            case UPPER -> StringMethods.upper(target);
            case LOWER -> StringMethods.lower(target);
            case TRIM -> StringMethods.trim(target);
            case REPLACE -> arguments.size() < 2
                ? target
                : StringMethods.replace(target, arguments.get(0), arguments.get(1));
            case SUB, SLICE -> switch (arguments.size()) {
                case 0 -> target;
                case 1 -> StringMethods.slice(target, arguments.get(0));
                default -> StringMethods.slice(target, arguments.get(0), arguments.get(1));
            };
            case PAD_LEFT, PAD_RIGHT -> arguments.isEmpty()
                ? target
                : StringMethods.pad(target, arguments.get(0), arguments.size() > 1 ? arguments.get(1) : null,
                    this == PAD_LEFT);
        };
    }

    static String unknown(String name) {
        return "[Unknown method: " + name + "]";
    }
}
