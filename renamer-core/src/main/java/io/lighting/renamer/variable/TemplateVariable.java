package io.lighting.renamer.variable;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * 模板中可以引用的全部变量，名称大小写不敏感。
 */
public enum TemplateVariable {
    NAME("name", VariableType.STRING, "File name without extension", List.of()),
    EXT("ext", VariableType.STRING, "Extension without the dot", List.of()),
    FULLNAME("fullname", VariableType.STRING, "File name with extension", List.of()),
    DIRNAME("dirname", VariableType.STRING, "Name of the parent directory", List.of()),
    I("i", VariableType.NUMBER, "Zero-based position in the batch", FormatOptions.INDEX),
    IV("iv", VariableType.NUMBER, "Position counted from the end of the batch", FormatOptions.INDEX),
    TODAY("today", VariableType.DATE, "Current date", FormatOptions.DATE),
    NOW("now", VariableType.DATE_TIME, "Current date and time", FormatOptions.DATE_TIME),
    IMAGE("image", VariableType.IMAGE, "Image dimensions", FormatOptions.IMAGE),
    FILE("file", VariableType.FILE, "File path and timestamps", FormatOptions.FILE),
    SIZE("size", VariableType.SIZE, "File size", FormatOptions.SIZE);

    private final String key;
    private final VariableType type;
    private final String description;
    private final List<FormatOption> formatOptions;

    TemplateVariable(String key, VariableType type, String description, List<FormatOption> formatOptions) {
        this.key = key;
        this.type = type;
        this.description = description;
        this.formatOptions = formatOptions;
    }

    public String key() {
        return key;
    }

    public VariableType type() {
        return type;
    }

    public String description() {
        return description;
    }

    public List<FormatOption> formatOptions() {
        return formatOptions;
    }

    public static Optional<TemplateVariable> lookup(String name) {
        Objects.requireNonNull(name, "name");
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (TemplateVariable variable : values()) {
            if (variable.key.equals(normalized)) {
                return Optional.of(variable);
            }
        }
        return Optional.empty();
    }
}
