package io.lighting.renamer.variable;

public enum VariableType {
    STRING,
    NUMBER,
    DATE,
    DATE_TIME,
    IMAGE,
    FILE,
    SIZE
}
