package polyc.hir;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class ExpressionTest {

    private static Expression sum(String a, String b) {
        return new BinaryExpression(new Identifier(a), BinaryOperator.ADD,
                new Identifier(b));
    }

    @Test
    public void testParens() {
        Expression e = sum("i", "j");
        Expression product = new BinaryExpression(e, BinaryOperator.MULTIPLY,
                new IntegerLiteral(2));
        assertThat(product.toString(), is("i + j * 2"));
        e.setParens(true);
        assertThat(product.toString(), is("(i + j) * 2"));
        Expression literal = new IntegerLiteral(-1);
        literal.setParens(true);
        assertThat(literal.toString(), is("(-1)"));
    }

    @Test
    public void testConditionalPrintsInParens() {
        Expression e = new ConditionalExpression(
                new BinaryExpression(new Identifier("c0"),
                        BinaryOperator.COMPARE_GE, new IntegerLiteral(0)),
                new Identifier("a"), new Identifier("b"));
        assertThat(e.toString(), is("(c0 >= 0 ? a : b)"));
    }

    @Test
    public void testMinMaxNests() {
        List<Expression> operands = new ArrayList<Expression>();
        operands.add(new Identifier("a"));
        operands.add(new Identifier("b"));
        operands.add(new IntegerLiteral(3));
        assertThat(new MinMaxExpression(true, operands).toString(),
                is("min(a, min(b, 3))"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMinMaxNeedsTwoOperands() {
        new MinMaxExpression(false,
                Arrays.<Expression>asList(new Identifier("a")));
    }

    @Test
    public void testCloneIsDeepAndOrphan() {
        Expression e = sum("i", "N");
        FunctionCall call = new FunctionCall(new Identifier("S"), e);
        Expression copy = e.clone();
        assertNull(copy.getParent());
        assertEquals(e, copy);
        assertNotSame(e.getChildren().get(0), copy.getChildren().get(0));
        assertSame(copy, copy.getChildren().get(0).getParent());
        assertThat(call.toString(), is("S(i + N)"));
    }

    @Test(expected = NotAnOrphanException.class)
    public void testOperandMustBeOrphan() {
        Identifier i = new Identifier("i");
        new UnaryExpression(UnaryOperator.MINUS, i);
        new UnaryExpression(UnaryOperator.MINUS, i);
    }

    @Test
    public void testReplaceWith() {
        Identifier i = new Identifier("i");
        List<Expression> index = new ArrayList<Expression>();
        index.add(i);
        ArrayAccess access = new ArrayAccess(new Identifier("A"), index);
        i.replaceWith(sum("c0", "1"));
        assertThat(access.toString(), is("A[c0 + 1]"));
        assertNull(i.getParent());
    }

    @Test
    public void testOperatorLookup() {
        assertSame(BinaryOperator.SHIFT_LEFT, BinaryOperator.fromString("<<"));
        assertSame(AssignmentOperator.ADD, AssignmentOperator.fromString("+="));
        assertNull(BinaryOperator.fromString("+="));
        assertNull(AssignmentOperator.fromString("+"));
        assertTrue(BinaryOperator.MULTIPLY.getPrecedence() >
                BinaryOperator.ADD.getPrecedence());
        assertSame(UnaryOperator.LOGICAL_NEGATION, UnaryOperator.fromString("!"));
    }

    @Test
    public void testDepthFirstOrderWithPruning() {
        // f(g(a), b) visits f's name, g, then b when g is pruned.
        FunctionCall inner = new FunctionCall(new Identifier("g"),
                new Identifier("a"));
        FunctionCall outer = new FunctionCall(new Identifier("f"), inner,
                new Identifier("b"));
        DFIterator<Identifier> all =
                new DFIterator<Identifier>(outer, Identifier.class);
        assertThat(all.getList().toString(), is("[f, g, a, b]"));
        DFIterator<Expression> pruned =
                new DFIterator<Expression>(outer, Expression.class);
        pruned.pruneOn(FunctionCall.class);
        List<Expression> found = pruned.getList();
        assertThat(found.size(), is(1));
        assertSame(outer, found.get(0));
    }

    @Test
    public void testStatementsOwnTheirParts() {
        CompoundStatement block = new CompoundStatement();
        ExpressionStatement stmt = new ExpressionStatement(
                new AssignmentExpression(new Identifier("x"),
                        AssignmentOperator.NORMAL, new IntegerLiteral(0)));
        block.addStatement(stmt);
        assertSame(block, stmt.getParent());
        assertThat(block.toString(), is("{\nx = 0;\n}"
                .replace("\n", PrintTools.line_sep)));
        try {
            new CompoundStatement().addStatement(stmt);
            fail("statement adopted twice");
        } catch (NotAnOrphanException e) {
            assertThat(block.countStatements(), is(1));
        }
    }

}
