package polyc.hir;

import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Map;

/**
* Infix operators that act on two expressions. Operators print with a
* surrounding space, e.g. {@code a + b}, and only the instances below exist,
* so they can be compared with {@code ==}.
*/
public class BinaryOperator implements Printable {

    private static final Map<String, BinaryOperator> by_symbol =
            new HashMap<String, BinaryOperator>(32);

    // Precedence levels follow C; a higher level binds tighter.
    public static final BinaryOperator MULTIPLY = define("*", 12);
    public static final BinaryOperator DIVIDE = define("/", 12);
    public static final BinaryOperator MODULUS = define("%", 12);
    public static final BinaryOperator ADD = define("+", 11);
    public static final BinaryOperator SUBTRACT = define("-", 11);
    public static final BinaryOperator SHIFT_LEFT = define("<<", 10);
    public static final BinaryOperator SHIFT_RIGHT = define(">>", 10);
    public static final BinaryOperator COMPARE_LT = define("<", 9);
    public static final BinaryOperator COMPARE_LE = define("<=", 9);
    public static final BinaryOperator COMPARE_GT = define(">", 9);
    public static final BinaryOperator COMPARE_GE = define(">=", 9);
    public static final BinaryOperator COMPARE_EQ = define("==", 8);
    public static final BinaryOperator COMPARE_NE = define("!=", 8);
    public static final BinaryOperator BITWISE_AND = define("&", 7);
    public static final BinaryOperator BITWISE_EXCLUSIVE_OR = define("^", 6);
    public static final BinaryOperator BITWISE_INCLUSIVE_OR = define("|", 5);
    public static final BinaryOperator LOGICAL_AND = define("&&", 4);
    public static final BinaryOperator LOGICAL_OR = define("||", 3);

    private final String symbol;

    private final int precedence;

    protected BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    private static BinaryOperator define(String symbol, int precedence) {
        BinaryOperator op = new BinaryOperator(symbol, precedence);
        by_symbol.put(symbol, op);
        return op;
    }

    /**
    * Returns the operator spelled <var>s</var>, or null if there is none.
    */
    public static BinaryOperator fromString(String s) {
        return by_symbol.get(s);
    }

    public void print(PrintWriter o) {
        o.print(" " + symbol + " ");
    }

    @Override
    public String toString() {
        return symbol;
    }

    /** Returns the C precedence level of the operator. */
    public int getPrecedence() {
        return precedence;
    }

}
