package org.mathtutor.expression.analysis.finders;

import org.mathtutor.expression.frontend.parser.ast.NumberNode;

/**
 * Integer helpers for the divisibility based finders.
 */
final class IntegerMath {

    private IntegerMath() {}

    /**
     * Euclid's algorithm on absolute values.
     * @return The greatest common divisor, or the other value if one is zero.
     */
    static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    /**
     * @return {@code true} if the literal is a whole number small enough to treat as a {@code long}.
     */
    static boolean isIntegral(NumberNode node) {
        return node.isInteger() && Math.abs(node.value()) < 0x1p62;
    }

    /**
     * @return {@code true} if the literal is integral and a multiple of {@code divisor}; zero is a multiple of everything.
     */
    static boolean isMultipleOf(NumberNode node, long divisor) {
        return isIntegral(node) && (long) node.value() % divisor == 0;
    }
}
