package polyc.codegen;

import polyc.hir.Annotatable;
import polyc.hir.Annotation;
import polyc.hir.BinaryExpression;
import polyc.hir.BinaryOperator;
import polyc.hir.CompoundStatement;
import polyc.hir.DFIterator;
import polyc.hir.Expression;
import polyc.hir.ExpressionStatement;
import polyc.hir.ForLoop;
import polyc.hir.FunctionCall;
import polyc.hir.IfStatement;
import polyc.hir.IntegerLiteral;
import polyc.hir.MinMaxExpression;
import polyc.hir.Statement;
import polyc.hir.Traversable;

import java.io.PrintWriter;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
* Prints a tree built by {@link AstBuild} as C code, two spaces per nesting
* level. Blocks get braces only when they hold more than one statement, and
* the top-level sequence is printed without braces. Sub classes change how
* loops and leaves are printed by overriding {@link #printFor} and
* {@link #printUser}.
*/
public class AstPrinter {

    private static final String INDENT = "  ";

    private static final String FLOORD =
            "#define floord(n,d) (((n)<0) ? -((-(n)+(d)-1)/(d)) : (n)/(d))";

    private static final String MAX =
            "#define max(x,y)    ((x) > (y) ? (x) : (y))";

    private static final String MIN =
            "#define min(x,y)    ((x) < (y) ? (x) : (y))";

    /**
    * Prints a tree.
    *
    * @param root the root returned by the builder.
    * @param level the nesting level of the top-level statements.
    * @param o the target writer.
    */
    public void print(Statement root, int level, PrintWriter o) {
        if (root instanceof CompoundStatement) {
            for (Traversable t : root.getChildren()) {
                printNode((Statement)t, level, o);
            }
        } else {
            printNode(root, level, o);
        }
    }

    /** Prints one node of the tree at the given level. */
    protected void printNode(Statement s, int level, PrintWriter o) {
        if (s instanceof ForLoop) {
            printFor((ForLoop)s, level, o);
        } else if (s instanceof IfStatement) {
            IfStatement ifs = (IfStatement)s;
            indent(level, o);
            o.print("if (");
            ifs.getControlExpression().print(o);
            o.println(")");
            printBody(ifs.getThenStatement(), level, o);
        } else if (s instanceof CompoundStatement) {
            indent(level, o);
            o.println("{");
            for (Traversable t : s.getChildren()) {
                printNode((Statement)t, level + 1, o);
            }
            indent(level, o);
            o.println("}");
        } else if (s instanceof ExpressionStatement) {
            printUser((ExpressionStatement)s, level, o);
        } else {
            indent(level, o);
            s.print(o);
            o.println();
        }
    }

    /**
    * Prints a loop header {@code for (int c = lb; c <= ub; c += 1)} and its
    * body. An upper bound {@code e - 1} is printed as {@code c < e}.
    */
    protected void printFor(ForLoop loop, int level, PrintWriter o) {
        indent(level, o);
        o.print("for (");
        loop.getInitialStatement().print(o);
        o.print(" ");
        printCondition(loop.getCondition(), o);
        o.print("; ");
        loop.getStep().print(o);
        o.println(")");
        printBody(loop.getBody(), level, o);
    }

    /** Prints a leaf as its call expression. */
    protected void printUser(ExpressionStatement s, int level, PrintWriter o) {
        indent(level, o);
        s.print(o);
        o.println();
    }

    private static void printCondition(Expression cond, PrintWriter o) {
        if (cond instanceof BinaryExpression) {
            BinaryExpression be = (BinaryExpression)cond;
            if (be.getOperator() == BinaryOperator.COMPARE_LE &&
                be.getRHS() instanceof BinaryExpression) {
                BinaryExpression ub = (BinaryExpression)be.getRHS();
                if (ub.getOperator() == BinaryOperator.SUBTRACT &&
                    ub.getRHS() instanceof IntegerLiteral &&
                    ((IntegerLiteral)ub.getRHS()).getValue() == 1) {
                    be.getLHS().print(o);
                    o.print(" < ");
                    ub.getLHS().print(o);
                    return;
                }
            }
        }
        cond.print(o);
    }

    /** Prints the body of a loop or guard one level deeper than its owner. */
    protected void printBody(Statement body, int level, PrintWriter o) {
        if (body instanceof CompoundStatement) {
            CompoundStatement block = (CompoundStatement)body;
            if (block.countStatements() == 1) {
                printNode((Statement)block.getChildren().get(0), level + 1, o);
                return;
            }
            indent(level, o);
            o.println("{");
            for (Traversable t : block.getChildren()) {
                printNode((Statement)t, level + 1, o);
            }
            indent(level, o);
            o.println("}");
        } else {
            printNode(body, level + 1, o);
        }
    }

    protected static void indent(int level, PrintWriter o) {
        for (int i = 0; i < level; i++) {
            o.print(INDENT);
        }
    }

    /**
    * Prints the definitions of the helper operators used in the tree or in
    * the expressions held by its annotations, once each, in the order they
    * are first used.
    */
    public static void printMacros(Statement root, PrintWriter o) {
        Set<String> macros = new LinkedHashSet<String>();
        DFIterator<Traversable> iter = new DFIterator<Traversable>(root);
        while (iter.hasNext()) {
            Traversable t = iter.next();
            collectMacros(t, macros);
            if (t instanceof Annotatable) {
                for (Annotation a : ((Annotatable)t).getAnnotations()) {
                    for (Object value : a.values()) {
                        collectFromValue(value, macros);
                    }
                }
            }
        }
        for (String macro : macros) {
            o.println(macro);
        }
    }

    private static void collectFromValue(Object value, Set<String> macros) {
        if (value instanceof Expression) {
            DFIterator<Traversable> iter =
                    new DFIterator<Traversable>((Expression)value);
            while (iter.hasNext()) {
                collectMacros(iter.next(), macros);
            }
        } else if (value instanceof Collection) {
            for (Object o : (Collection<?>)value) {
                collectFromValue(o, macros);
            }
        } else if (value instanceof Map) {
            for (Object o : ((Map<?, ?>)value).values()) {
                collectFromValue(o, macros);
            }
        }
    }

    private static void collectMacros(Traversable t, Set<String> macros) {
        if (t instanceof FunctionCall &&
            ((FunctionCall)t).getName().toString().equals("floord")) {
            macros.add(FLOORD);
        } else if (t instanceof MinMaxExpression) {
            macros.add(((MinMaxExpression)t).isMinExpression() ? MIN : MAX);
        }
    }

}
