package polyc.poly;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

import java.util.ArrayList;
import org.junit.Test;
import polyc.hir.UnsupportedInput;

public class RelationTest {

    private static Relation rel(String text) {
        return RelationReader.readRelation(text);
    }

    private static void assertSameRelation(Relation a, Relation b) {
        assertTrue(a + " not in " + b, a.isSubset(b));
        assertTrue(b + " not in " + a, b.isSubset(a));
    }

    @Test
    public void testEmptyBounds() {
        assertTrue(rel("{ S[i] : 0 <= i and i < 0 }").isEmpty());
        assertFalse(rel("{ S[i] : 0 <= i < 1 }").isEmpty());
        assertTrue(rel("[N] -> { S[i] : 0 <= i < N and N <= 0 }").isEmpty());
        assertFalse(rel("[N] -> { S[i] : 0 <= i < N }").isEmpty());
    }

    @Test
    public void testEmptyWithoutIntegerPoint() {
        assertTrue(rel("{ S[i] : 2i = 1 }").isEmpty());
        assertTrue(rel("{ S[i] : 1 <= 3i <= 2 }").isEmpty());
        assertFalse(rel("{ S[i] : 1 <= 3i <= 3 }").isEmpty());
    }

    @Test
    public void testEmptyNeedsDarkShadow() {
        // Real solutions exist, integer ones do not.
        assertTrue(rel("{ [x, y] : 27 <= 11x + 13y <= 45 and " +
                "-10 <= 7x - 9y <= 4 }").isEmpty());
    }

    @Test
    public void testSubset() {
        Relation small = rel("{ S[i] : 1 <= i <= 5 }");
        Relation big = rel("{ S[i] : 0 <= i <= 10 }");
        assertTrue(small.isSubset(big));
        assertFalse(big.isSubset(small));
        assertTrue(rel("{ S[i] : 0 <= i <= 10 and i <= -1 }").isSubset(small));
    }

    @Test
    public void testSubsetWithParameters() {
        Relation inner = rel("[N] -> { S[i] : 0 <= i < N }");
        Relation outer = rel("[N] -> { S[i] : 0 <= i <= N }");
        assertTrue(inner.isSubset(outer));
        assertFalse(outer.isSubset(inner));
    }

    @Test
    public void testApplyRange() {
        Relation r = rel("{ S[i] -> [i + 1] }").applyRange(rel("{ [j] -> [2j] }"));
        assertSameRelation(rel("{ S[i] -> [2i + 2] }"), r);
    }

    @Test
    public void testReverse() {
        assertSameRelation(rel("{ A[j] -> S[j - 1] }"),
                rel("{ S[i] -> A[i + 1] }").reverse());
    }

    @Test
    public void testUnionAndIntersect() {
        Relation a = rel("{ S[i] : 0 <= i <= 4 }");
        Relation b = rel("{ S[i] : 3 <= i <= 9 }");
        assertSameRelation(rel("{ S[i] : 0 <= i <= 9 }"), a.union(b));
        assertSameRelation(rel("{ S[i] : 3 <= i <= 4 }"), a.intersect(b));
    }

    @Test
    public void testEquate() {
        Relation r = rel("{ [i, j] -> [k, l] : 0 <= i <= 3 and 0 <= k <= 3 }");
        assertTrue(r.equate(0, 0).isSubset(rel("{ [i, j] -> [i, l] }")));
        assertFalse(r.isSubset(rel("{ [i, j] -> [i, l] }")));
    }

    @Test
    public void testLexLessThan() {
        Relation lt = Relation.lexLessThan(new ArrayList<String>(), 2);
        assertFalse(lt.intersect(rel(
                "{ [a, b] -> [c, d] : a = 0 and b = 5 and c = 1 and d = 0 }"))
                .isEmpty());
        assertTrue(lt.intersect(rel(
                "{ [a, b] -> [c, d] : a = 1 and b = 0 and c = 0 and d = 5 }"))
                .isEmpty());
        assertTrue(lt.intersect(rel("{ [a, b] -> [a, b] }")).isEmpty());
    }

    @Test
    public void testToPwMultiAff() {
        PwMultiAff f = rel("{ S[i, j] -> A[i + 1, j] }").toPwMultiAff();
        assertThat(f.getNumPieces(), is(1));
        assertThat(f.getNumOut(), is(2));
        AffineExpression e = f.getPieces().get(0).getExpressions().get(0);
        assertThat(e.getConstant(), is(1L));
        assertThat(e.getCoefficient(1), is(1L));
        assertThat(e.getCoefficient(2), is(0L));
        assertThat(e.getDenominator(), is(1L));
    }

    @Test
    public void testToPwMultiAffCoalesces() {
        PwMultiAff f = rel("{ S[i] -> A[i] : i < 0; S[i] -> A[i] : i >= 0 }")
                .toPwMultiAff();
        assertThat(f.getNumPieces(), is(1));
    }

    @Test(expected = UnsupportedInput.class)
    public void testToPwMultiAffNotSingleValued() {
        rel("{ S[i] -> A[j] : 0 <= j <= i }").toPwMultiAff();
    }

}
