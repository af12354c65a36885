package io.lighting.renamer.expr;

import java.util.Objects;
import java.util.function.IntUnaryOperator;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 关于序号 i 的算术表达式，例如 {@code 2*i+1}、{@code 2i+1}。
 * 求值失败时返回原始序号，不抛出异常。
 */
public final class IndexExpression implements IntUnaryOperator {
    private static final Logger LOGGER = LoggerFactory.getLogger(IndexExpression.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DIGITS_BEFORE_INDEX = Pattern.compile("(\\d)([iI])");
    private static final Pattern DIGITS_AFTER_INDEX = Pattern.compile("([iI])(\\d)");
    private static final Pattern INDEX_TOKEN = Pattern.compile("\\b[iI]\\b");
    private static final Pattern ARITHMETIC_ONLY = Pattern.compile("[0-9+\\-*/().\\s]+");

    private final String source;
    private final String formula;

    private IndexExpression(String source, String formula) {
        this.source = source;
        this.formula = formula;
    }

    public static IndexExpression compile(String expression) {
        Objects.requireNonNull(expression, "expression");
        String formula = WHITESPACE.matcher(expression).replaceAll("");
        formula = DIGITS_BEFORE_INDEX.matcher(formula).replaceAll("$1*$2");
        formula = DIGITS_AFTER_INDEX.matcher(formula).replaceAll("$1*$2");
        return new IndexExpression(expression, formula);
    }

    public String source() {
        return source;
    }

    String formula() {
        return formula;
    }

    @Override
    public int applyAsInt(int index) {
        if (formula.isEmpty()) {
            return index;
        }
        String substituted = INDEX_TOKEN.matcher(formula).replaceAll(Integer.toString(index));
        if (!ARITHMETIC_ONLY.matcher(substituted).matches()) {
            LOGGER.debug("Index expression '{}' has unsupported characters, using raw index", source);
            return index;
        }
        try {
            double result = new ArithmeticParser(substituted).parse();
            double rounded = Math.rint(result);
            if (Double.isNaN(rounded) || rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE) {
                LOGGER.debug("Index expression '{}' produced {}, using raw index", source, result);
                return index;
            }
            return (int) rounded;
        } catch (IllegalArgumentException ex) {
            LOGGER.debug("Cannot evaluate index expression '{}', using raw index", source, ex);
            return index;
        }
    }

    @Override
    public String toString() {
        return source;
    }
}
