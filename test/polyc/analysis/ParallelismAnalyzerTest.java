package polyc.analysis;

import static org.junit.Assert.*;

import org.junit.Test;
import polyc.poly.RelationReader;
import polyc.poly.UnionRelation;

public class ParallelismAnalyzerTest {

    private static UnionRelation union(String text) {
        return RelationReader.readUnion(text);
    }

    @Test
    public void testNoDependence() {
        assertTrue(ParallelismAnalyzer.isParallel(
                union("{ S[i] -> [i] }"), UnionRelation.empty(),
                UnionRelation.empty()));
    }

    @Test
    public void testDependenceInsideIteration() {
        assertTrue(ParallelismAnalyzer.isParallel(
                union("{ S1[i] -> [i]; S2[i] -> [i] }"),
                union("{ S1[i] -> S2[i] }"), UnionRelation.empty()));
    }

    @Test
    public void testCarriedDependence() {
        assertFalse(ParallelismAnalyzer.isParallel(
                union("{ S1[i] -> [i]; S2[i] -> [i] }"),
                union("{ S1[i] -> S2[i + 1] }"), UnionRelation.empty()));
    }

    @Test
    public void testCarriedFalseDependence() {
        assertFalse(ParallelismAnalyzer.isParallel(
                union("{ S[i] -> [i] }"), UnionRelation.empty(),
                union("{ S[i] -> S[i + 1] }")));
    }

    @Test
    public void testDependenceCarriedByOuterLoop() {
        // Inner loop j of S[i, j] -> S[i + 1, j].
        UnionRelation deps = union("{ S[i, j] -> S[i + 1, j] }");
        assertFalse(ParallelismAnalyzer.isParallel(
                union("{ S[i, j] -> [i] }"), deps, UnionRelation.empty()));
        assertTrue(ParallelismAnalyzer.isParallel(
                union("{ S[i, j] -> [i, j] }"), deps, UnionRelation.empty()));
    }

    @Test
    public void testDependenceOutsideLoop() {
        assertTrue(ParallelismAnalyzer.isParallel(
                union("{ S1[i] -> [i] }"),
                union("{ S1[i] -> S2[i + 1] }"), UnionRelation.empty()));
    }

}
