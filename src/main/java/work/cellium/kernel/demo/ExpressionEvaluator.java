package work.cellium.kernel.demo;

/**
 * Recursive-descent evaluator for the four arithmetic operators, parentheses, unary signs and
 * decimal literals. Characters outside {@code 0-9 + - * / . ( )} and spaces are ignored.
 * Parentheses and unary signs may nest at most {@value #MAX_DEPTH} levels deep.
 */
final class ExpressionEvaluator {
    static final int MAX_DEPTH = 256;

    private final String source;
    private int pos;
    private int depth;

    private ExpressionEvaluator(String source) {
        this.source = source;
    }

    static double evaluate(String expression) {
        var sanitized = sanitize(expression == null ? "" : expression);
        if (sanitized.isEmpty()) {
            throw new IllegalArgumentException("empty expression");
        }
        var evaluator = new ExpressionEvaluator(sanitized);
        double value = evaluator.parseExpression();
        if (evaluator.pos < sanitized.length()) {
            throw new IllegalArgumentException("unexpected '" + sanitized.charAt(evaluator.pos) + "' at position " + evaluator.pos);
        }
        return value;
    }

    /**
     * Formats a result the way a calculator display would: integral values without a fraction.
     */
    static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    static String sanitize(String expression) {
        var out = new StringBuilder(expression.length());
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if ((c >= '0' && c <= '9') || "+-*/.()".indexOf(c) >= 0) {
                out.append(c);
            }
        }
        return out.toString();
    }

    private double parseExpression() {
        double value = parseTerm();
        while (pos < source.length()) {
            char op = source.charAt(pos);
            if (op == '+') {
                pos++;
                value += parseTerm();
            } else if (op == '-') {
                pos++;
                value -= parseTerm();
            } else {
                break;
            }
        }
        return value;
    }

    private double parseTerm() {
        double value = parseFactor();
        while (pos < source.length()) {
            char op = source.charAt(pos);
            if (op == '*') {
                pos++;
                value *= parseFactor();
            } else if (op == '/') {
                pos++;
                double divisor = parseFactor();
                if (divisor == 0) {
                    throw new ArithmeticException("division by zero");
                }
                value /= divisor;
            } else {
                break;
            }
        }
        return value;
    }

    private double parseFactor() {
        if (pos >= source.length()) {
            throw new IllegalArgumentException("unexpected end of expression");
        }
        char c = source.charAt(pos);
        if (c == '+' || c == '-' || c == '(') {
            if (++depth > MAX_DEPTH) {
                throw new IllegalArgumentException("expression nested too deeply");
            }
            try {
                return parseNested(c);
            } finally {
                depth--;
            }
        }
        int start = pos;
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            pos++;
        }
        if (start == pos) {
            throw new IllegalArgumentException("unexpected '" + c + "' at position " + pos);
        }
        try {
            return Double.parseDouble(source.substring(start, pos));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("invalid number '" + source.substring(start, pos) + "'", ex);
        }
    }

    private double parseNested(char c) {
        pos++;
        if (c == '+') {
            return parseFactor();
        }
        if (c == '-') {
            return -parseFactor();
        }
        double value = parseExpression();
        if (pos >= source.length() || source.charAt(pos) != ')') {
            throw new IllegalArgumentException("missing ')'");
        }
        pos++;
        return value;
    }
}
