package polyc.hir;

import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Map;

/**
* Prefix operators that act on one expression. Only the operators that can
* appear in an affine statement body are provided.
*/
public class UnaryOperator implements Printable {

    private static final Map<String, UnaryOperator> by_symbol =
            new HashMap<String, UnaryOperator>(8);

    public static final UnaryOperator MINUS = define("-");
    public static final UnaryOperator PLUS = define("+");
    public static final UnaryOperator LOGICAL_NEGATION = define("!");
    public static final UnaryOperator BITWISE_COMPLEMENT = define("~");

    private final String symbol;

    private UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    private static UnaryOperator define(String symbol) {
        UnaryOperator op = new UnaryOperator(symbol);
        by_symbol.put(symbol, op);
        return op;
    }

    /** Returns the operator spelled <var>s</var>, or null if there is none. */
    public static UnaryOperator fromString(String s) {
        return by_symbol.get(s);
    }

    public void print(PrintWriter o) {
        o.print(symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }

}
