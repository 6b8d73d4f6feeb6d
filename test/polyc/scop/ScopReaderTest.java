package polyc.scop;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

import java.util.List;
import org.junit.Test;
import polyc.poly.Relation;

public class ScopReaderTest {

    static final String SOURCE =
            "void f(int N, float *A, float *B)\n" +
            "{\n" +
            "#pragma scop\n" +
            "  for (int i = 0; i < N; i++)\n" +
            "    C[i] = A[i] + B[i];\n" +
            "#pragma endscop\n" +
            "}\n";

    static final String VECTOR_ADD =
            "# vector addition\n" +
            "context   [N] -> { : N >= 1 }\n" +
            "array     float A[N] external\n" +
            "array     float B[N] external\n" +
            "array     float C[N] hidden\n" +
            "statement [N] -> { S1[i] : 0 <= i < N }\n" +
            "          C[i] = A[i] + B[i];\n";

    @Test
    public void testStatementsAndAccesses() throws Exception {
        Scop scop = ScopReader.read(VECTOR_ADD, SOURCE);
        assertThat(scop.getStatements().size(), is(1));
        ScopStatement stmt = scop.getStatements().get(0);
        assertThat(stmt.getName(), is("S1"));
        List<AccessExpression> accesses = stmt.getAccesses();
        assertThat(accesses.size(), is(3));
        assertThat(accesses.get(0).getName(), is("C"));
        assertTrue(accesses.get(0).isWrite());
        assertFalse(accesses.get(0).isRead());
        assertThat(accesses.get(1).getName(), is("A"));
        assertTrue(accesses.get(1).isRead());
        assertFalse(accesses.get(1).isWrite());
        assertThat(accesses.get(2).getName(), is("B"));
    }

    @Test
    public void testAccessRelation() throws Exception {
        Scop scop = ScopReader.read(
                "statement [N] -> { S[i] : 1 <= i < N }\n" +
                "A[i] = A[i - 1] + 1;\n" +
                "region 0 0\n", "");
        Relation read = scop.getStatements().get(0).getAccesses().get(1)
                .getRelation();
        Relation expected = polyc.poly.RelationReader.readRelation(
                "{ S[i] -> A[i - 1] }");
        assertTrue(read.isSubset(expected));
        assertTrue(expected.isSubset(read));
    }

    @Test
    public void testCompoundAssignmentReadsAndWrites() throws Exception {
        Scop scop = ScopReader.read(
                "array float s exposed\n" +
                "statement { S[i] : 0 <= i < 10 }\n" +
                "s += A[i]\n" +
                "region 0 0\n", "");
        List<AccessExpression> accesses =
                scop.getStatements().get(0).getAccesses();
        assertThat(accesses.size(), is(2));
        assertThat(accesses.get(0).getName(), is("s"));
        assertTrue(accesses.get(0).isRead());
        assertTrue(accesses.get(0).isWrite());
    }

    @Test
    public void testIteratorUse() throws Exception {
        Scop scop = ScopReader.read(
                "statement { S[i] : 0 <= i < 10 }\n" +
                "A[i] = i\n" +
                "region 0 0\n", "");
        List<AccessExpression> accesses =
                scop.getStatements().get(0).getAccesses();
        assertThat(accesses.size(), is(2));
        assertTrue(accesses.get(0).isNamed());
        assertFalse(accesses.get(1).isNamed());
    }

    @Test
    public void testArrays() throws Exception {
        Scop scop = ScopReader.read(VECTOR_ADD, SOURCE);
        List<ScopArray> arrays = scop.getArrays();
        assertThat(arrays.size(), is(3));
        assertFalse(arrays.get(0).isDeclared());
        assertTrue(arrays.get(2).isDeclared());
        assertFalse(arrays.get(2).isExposed());
        assertTrue(scop.hasHiddenArrays());
        assertThat(arrays.get(2).getDeclaration().toString(), is("float C[N];"));
        assertThat(arrays.get(2).getType(), is("float"));
        assertThat(arrays.get(2).getExtents().toString(), is("[N]"));
    }

    @Test
    public void testDefaultScheduleAndDependences() throws Exception {
        Scop scop = ScopReader.read(VECTOR_ADD, SOURCE);
        Relation s = scop.getSchedule().getRelationByName("S1");
        assertNotNull(s);
        assertThat(s.getSpace().getNumOut(), is(2));
        assertFalse(scop.hasDependences());
    }

    @Test
    public void testRegionFromPragmas() throws Exception {
        Scop scop = ScopReader.read(VECTOR_ADD, SOURCE);
        assertThat(scop.getStart(), is(SOURCE.indexOf("#pragma scop")));
        int endscop = SOURCE.indexOf("#pragma endscop");
        assertThat(scop.getEnd(), is(endscop + "#pragma endscop\n".length()));
    }

    @Test
    public void testExplicitRegion() throws Exception {
        Scop scop = ScopReader.read(VECTOR_ADD + "region 3 7\n", SOURCE);
        assertThat(scop.getStart(), is(3));
        assertThat(scop.getEnd(), is(7));
    }

    @Test(expected = ScopFormatException.class)
    public void testRegionOutsideSource() throws Exception {
        ScopReader.read(VECTOR_ADD + "region 3 700\n", SOURCE);
    }

    @Test(expected = ScopFormatException.class)
    public void testMissingPragma() throws Exception {
        ScopReader.read(VECTOR_ADD, "int main() { return 0; }\n");
    }

    @Test(expected = ScopFormatException.class)
    public void testNonAffineAccess() throws Exception {
        ScopReader.read(
                "statement { S[i] : 0 <= i < 10 }\n" +
                "A[i * i] = 0\n", SOURCE);
    }

    @Test(expected = ScopFormatException.class)
    public void testAssignmentToPlainName() throws Exception {
        ScopReader.read(
                "statement { S[i] : 0 <= i < 10 }\n" +
                "s += A[i]\n", SOURCE);
    }

    @Test(expected = ScopFormatException.class)
    public void testStatementWithoutBody() throws Exception {
        ScopReader.read("statement { S[i] : 0 <= i < 10 }\n", SOURCE);
    }

    @Test(expected = ScopFormatException.class)
    public void testDuplicateArray() throws Exception {
        ScopReader.read("array float A[10] exposed\n" +
                "array float A[10] exposed\n" + VECTOR_ADD, SOURCE);
    }

    @Test(expected = ScopFormatException.class)
    public void testFlowWithoutFalse() throws Exception {
        ScopReader.read(VECTOR_ADD + "flow { }\n", SOURCE);
    }

    @Test(expected = ScopFormatException.class)
    public void testUnscheduledStatement() throws Exception {
        ScopReader.read(VECTOR_ADD +
                "schedule [N] -> { S2[i] -> [i] }\n", SOURCE);
    }

    @Test
    public void testUnknownEntryNamesLine() {
        try {
            ScopReader.read("# header\nlooop 3\n", SOURCE);
            fail("unknown entry accepted");
        } catch (ScopFormatException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("line 2:"));
        }
    }

}
