package io.lighting.renamer.template;

public enum EvaluationMode {
    /**
     * 一次编译为闭包，适合同一模板批量渲染。
     */
    COMPILED,
    /**
     * 每次遍历语法树求值。
     */
    INTERPRETED
}
