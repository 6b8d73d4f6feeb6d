package polyc.analysis;

import static org.junit.Assert.*;

import org.junit.Test;
import polyc.poly.Relation;
import polyc.poly.RelationReader;
import polyc.poly.UnionRelation;
import polyc.scop.Scop;
import polyc.scop.ScopReader;

public class DependenceAnalysisTest {

    private static Scop scop(String description) throws Exception {
        return ScopReader.read(description + "region 0 0\n", "");
    }

    private static void assertSameRelation(String expected, Relation r) {
        Relation e = RelationReader.readRelation(expected);
        assertTrue(r + " not in " + e, r.isSubset(e));
        assertTrue(e + " not in " + r, e.isSubset(r));
    }

    @Test
    public void testFlowBetweenStatements() throws Exception {
        Scop s = scop(
                "statement [N] -> { S1[i] : 0 <= i < N }\n" +
                "A[i] = B[i]\n" +
                "statement [N] -> { S2[i] : 0 <= i < N }\n" +
                "C[i] = A[i]\n");
        DependenceAnalysis da = new DependenceAnalysis(s);
        UnionRelation flow = da.computeFlow();
        assertEquals(1, flow.getNumRelations());
        assertSameRelation("[N] -> { S1[i] -> S2[i] : 0 <= i < N }",
                flow.getRelations().get(0));
        assertTrue(da.computeFalse().isEmpty());
    }

    @Test
    public void testAntiDependence() throws Exception {
        Scop s = scop(
                "statement [N] -> { S1[i] : 0 <= i < N }\n" +
                "B[i] = A[i]\n" +
                "statement [N] -> { S2[i] : 0 <= i < N }\n" +
                "A[i] = 0\n");
        DependenceAnalysis da = new DependenceAnalysis(s);
        assertTrue(da.computeFlow().isEmpty());
        UnionRelation anti = da.computeFalse();
        assertSameRelation("[N] -> { S1[i] -> S2[i] : 0 <= i < N }",
                anti.getRelations().get(0));
    }

    @Test
    public void testLoopCarriedFlow() throws Exception {
        Scop s = scop(
                "statement [N] -> { S[i] : 1 <= i < N }\n" +
                "A[i] = A[i - 1]\n");
        UnionRelation flow = new DependenceAnalysis(s).computeFlow();
        assertSameRelation("[N] -> { S[i] -> S[i + 1] : 1 <= i and i + 1 < N }",
                flow.getRelations().get(0));
    }

    @Test
    public void testOutputDependence() throws Exception {
        Scop s = scop(
                "array float x exposed\n" +
                "statement [N] -> { S[i] : 0 <= i < N }\n" +
                "x = A[i]\n");
        UnionRelation out = new DependenceAnalysis(s).computeFalse();
        assertSameRelation("[N] -> { S[i] -> S[j] : 0 <= i < j < N }",
                out.getRelations().get(0));
    }

    @Test
    public void testEnsureDependencesKeepsGivenOnes() throws Exception {
        Scop s = scop(
                "statement { S[i] : 0 <= i < 10 }\n" +
                "A[i] = A[i - 1]\n" +
                "flow { }\n" +
                "false { }\n");
        assertSame(s, DependenceAnalysis.ensureDependences(s));
        Scop t = scop(
                "statement { S[i] : 1 <= i < 10 }\n" +
                "A[i] = A[i - 1]\n");
        Scop u = DependenceAnalysis.ensureDependences(t);
        assertTrue(u.hasDependences());
        assertFalse(u.getDepFlow().isEmpty());
    }

}
