package polyc.hir;

import java.util.HashMap;
import java.util.Map;

/**
* Infix operators that store the value of their righthand side into their
* lefthand side. They bind loosest of all operators and are looked up apart
* from the other binary operators, so {@code +=} is never read as {@code +}.
*/
public class AssignmentOperator extends BinaryOperator {

    private static final Map<String, AssignmentOperator> by_symbol =
            new HashMap<String, AssignmentOperator>(16);

    public static final AssignmentOperator NORMAL = define("=");
    public static final AssignmentOperator ADD = define("+=");
    public static final AssignmentOperator SUBTRACT = define("-=");
    public static final AssignmentOperator MULTIPLY = define("*=");
    public static final AssignmentOperator DIVIDE = define("/=");
    public static final AssignmentOperator MODULUS = define("%=");
    public static final AssignmentOperator SHIFT_LEFT = define("<<=");
    public static final AssignmentOperator SHIFT_RIGHT = define(">>=");
    public static final AssignmentOperator BITWISE_AND = define("&=");
    public static final AssignmentOperator BITWISE_EXCLUSIVE_OR = define("^=");
    public static final AssignmentOperator BITWISE_INCLUSIVE_OR = define("|=");

    private AssignmentOperator(String symbol) {
        super(symbol, 1);
    }

    private static AssignmentOperator define(String symbol) {
        AssignmentOperator op = new AssignmentOperator(symbol);
        by_symbol.put(symbol, op);
        return op;
    }

    /**
    * Returns the assignment operator spelled <var>s</var>, or null if there
    * is none.
    */
    public static AssignmentOperator fromString(String s) {
        return by_symbol.get(s);
    }

}
