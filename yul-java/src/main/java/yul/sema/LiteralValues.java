package yul.sema;

import yul.ast.expr.Literal;

import java.math.BigInteger;

/**
 * Numeric value of a literal as the machine sees it: numbers as written, booleans as 1/0,
 * strings as their bytes left-aligned in a 256 bit word.
 */
public final class LiteralValues {
    public static final BigInteger MAX_U256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private LiteralValues() {}

    /** Null if a number literal is not a valid decimal or hex number. */
    public static BigInteger valueOf(Literal literal) {
        String v = literal.value();
        return switch (literal.kind()) {
            case NUMBER -> parseNumber(v);
            case BOOLEAN -> "true".equals(v) ? BigInteger.ONE : BigInteger.ZERO;
            case STRING -> {
                BigInteger word = BigInteger.ZERO;
                for (int i = 0; i < 32; i++) {
                    int b = i < v.length() ? v.charAt(i) & 0xFF : 0;
                    word = word.shiftLeft(8).or(BigInteger.valueOf(b));
                }
                yield word;
            }
        };
    }

    private static BigInteger parseNumber(String v) {
        try {
            if (v.startsWith("0x") || v.startsWith("0X")) return new BigInteger(v.substring(2), 16);
            return new BigInteger(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
