package polyc.codegen;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import org.junit.Test;
import polyc.hir.ForLoop;
import polyc.hir.Identifier;
import polyc.hir.Statement;
import polyc.poly.Relation;
import polyc.poly.RelationReader;
import polyc.poly.Space;
import polyc.scop.Scop;
import polyc.scop.ScopArray;
import polyc.scop.ScopReader;
import polyc.scop.ScopStatement;

public class CpuCodeGenTest {

    private static Scop scop(String description) throws Exception {
        return ScopReader.read(description + "region 0 0\n", "");
    }

    private static String print(Statement tree) {
        StringWriter sw = new StringWriter();
        PrintWriter o = new PrintWriter(sw);
        new CpuPrinter().print(tree, 0, o);
        o.flush();
        return sw.toString().replace("\r\n", "\n");
    }

    @Test
    public void testVectorAdd() throws Exception {
        Scop s = scop(
                "context [N] -> { : N >= 1 }\n" +
                "statement [N] -> { S1[i] : 0 <= i < N }\n" +
                "C[i] = A[i] + B[i];\n");
        Statement tree = CpuCodeGen.generate(s, false);
        assertTrue(tree instanceof ForLoop);
        assertNull(tree.getAnnotation(LoopAnnotation.class, "parallel"));
        assertThat(print(tree), is(
                "for (int i = 0; i < N; i += 1)\n" +
                "  C[i] = A[i] + B[i];\n"));
    }

    @Test
    public void testParallelLoop() throws Exception {
        Scop s = scop(
                "statement [N] -> { S1[i] : 0 <= i < N }\n" +
                "C[i] = A[i] + B[i];\n");
        assertThat(print(CpuCodeGen.generate(s, true)), is(
                "#pragma omp parallel for\n" +
                "for (int i = 0; i < N; i += 1)\n" +
                "  C[i] = A[i] + B[i];\n"));
    }

    @Test
    public void testCarriedLoopStaysSequential() throws Exception {
        Scop s = scop(
                "statement [N] -> { S[i] : 1 <= i < N }\n" +
                "A[i] = A[i - 1] + B[i];\n");
        Statement tree = CpuCodeGen.generate(s, true);
        LoopAnnotation note = tree.getAnnotation(LoopAnnotation.class, "parallel");
        assertNotNull(note);
        assertFalse(note.isParallel());
        assertThat(print(tree), is(
                "for (int i = 1; i < N; i += 1)\n" +
                "  A[i] = A[i - 1] + B[i];\n"));
    }

    @Test
    public void testOnlyOutermostParallelLoopIsMarked() throws Exception {
        Scop s = scop(
                "statement [N, M] -> { S[i, j] : 0 <= i < N and 0 <= j < M }\n" +
                "A[i][j] = A[i][j] + 1;\n");
        assertThat(print(CpuCodeGen.generate(s, true)), is(
                "#pragma omp parallel for\n" +
                "for (int i = 0; i < N; i += 1)\n" +
                "  for (int j = 0; j < M; j += 1)\n" +
                "    A[i][j] = A[i][j] + 1;\n"));
    }

    @Test
    public void testSequenceOfLoops() throws Exception {
        Scop s = scop(
                "statement [N] -> { S1[i] : 0 <= i < N }\n" +
                "A[i] = B[i];\n" +
                "statement [N] -> { S2[i] : 0 <= i < N }\n" +
                "C[i] = A[i];\n");
        String text = print(CpuCodeGen.generate(s, false));
        assertThat(text, is(
                "for (int i = 0; i < N; i += 1)\n" +
                "  A[i] = B[i];\n" +
                "for (int i = 0; i < N; i += 1)\n" +
                "  C[i] = A[i];\n"));
    }

    @Test
    public void testIteratorUseInBody() throws Exception {
        Scop s = scop(
                "statement [N] -> { S[i] : 0 <= i < N }\n" +
                "A[i] = i * 2;\n");
        assertThat(print(CpuCodeGen.generate(s, false)),
                containsString("  A[i] = (i) * 2;\n"));
    }

    @Test
    public void testStatementAnnotation() throws Exception {
        Scop s = scop(
                "statement [N] -> { S1[i] : 0 <= i < N }\n" +
                "C[i] = A[i + 1];\n");
        ForLoop loop = (ForLoop)CpuCodeGen.generate(s, false);
        Statement leaf = (Statement)loop.getBody();
        StatementAnnotation note =
                leaf.getAnnotation(StatementAnnotation.class, "statement");
        assertNotNull(note);
        assertThat(note.getStatement().getName(), is("S1"));
        assertThat(note.getAccesses().size(), is(2));
        assertThat(note.getAccesses().get(1).get(0).toString(), is("i + 1"));
    }

    @Test
    public void testStridedSchedule() throws Exception {
        Scop s = scop(
                "statement [N] -> { S[i] : 0 <= i < N }\n" +
                "A[i] = 0;\n" +
                "schedule [N] -> { S[i] -> [2i] }\n");
        Statement tree = CpuCodeGen.generate(s, false);
        String text = print(tree);
        assertThat(text, containsString("for (int c0 = 0; "));
        assertThat(text, containsString("if (c0 % 2 == 0)\n"));
        assertThat(text, containsString("A[floord(c0, 2)] = 0;"));
        StringWriter sw = new StringWriter();
        PrintWriter o = new PrintWriter(sw);
        AstPrinter.printMacros(tree, o);
        o.flush();
        assertThat(sw.toString(), containsString("#define floord(n,d)"));
    }

    @Test
    public void testRepeatedGenerationIsIdentical() throws Exception {
        String description =
                "statement [N, M] -> { S1[i, j] : 1 <= i < N and 0 <= j < M }\n" +
                "A[i][j] = A[i - 1][j] + B[i][j];\n" +
                "statement [N] -> { S2[i] : 0 <= i < N }\n" +
                "C[i] = C[i] * 2;\n";
        String first = print(CpuCodeGen.generate(scop(description), true));
        String second = print(CpuCodeGen.generate(scop(description), true));
        assertEquals(first, second);
        assertThat(first, containsString("#pragma omp parallel for"));
    }

    @Test
    public void testSiblingLoopsInSequentialLoop() throws Exception {
        Scop s = scop(
                "statement [N, M] -> { S1[i, j] : 1 <= i < N and 0 <= j < M }\n" +
                "A[i][j] = A[i - 1][j] + B[i][j];\n" +
                "statement [N, M] -> { S2[i, j] : 1 <= i < N and 0 <= j < M }\n" +
                "C[i][j] = A[i][j];\n" +
                "schedule [N, M] -> { S1[i, j] -> [i, 0, j] }\n" +
                "schedule [N, M] -> { S2[i, j] -> [i, 1, j] }\n");
        Statement tree = CpuCodeGen.generate(s, true);
        assertFalse(tree.getAnnotation(LoopAnnotation.class, "parallel")
                .isParallel());
        assertThat(print(tree), is(
                "for (int i = 1; i < N; i += 1)\n" +
                "{\n" +
                "  #pragma omp parallel for\n" +
                "  for (int j = 0; j < M; j += 1)\n" +
                "    A[i][j] = A[i - 1][j] + B[i][j];\n" +
                "  #pragma omp parallel for\n" +
                "  for (int j = 0; j < M; j += 1)\n" +
                "    C[i][j] = A[i][j];\n" +
                "}\n"));
    }

    @Test
    public void testInnerLoopMarkedUnderCarriedLoop() throws Exception {
        Scop s = scop(
                "statement [N, M] -> { S[i, j] : 1 <= i < N and 0 <= j < M }\n" +
                "A[i][j] = A[i - 1][j];\n");
        Statement tree = CpuCodeGen.generate(s, true);
        ForLoop outer = (ForLoop)tree;
        assertFalse(outer.getAnnotation(LoopAnnotation.class, "parallel")
                .isParallel());
        assertThat(print(tree), is(
                "for (int i = 1; i < N; i += 1)\n" +
                "  #pragma omp parallel for\n" +
                "  for (int j = 0; j < M; j += 1)\n" +
                "    A[i][j] = A[i - 1][j];\n"));
    }

    private static final String PRODUCER_CONSUMER =
            "statement [N] -> { S1[i] : 0 <= i < N }\n" +
            "C[i] = A[i] + B[i];\n" +
            "statement [N] -> { S2[i] : 0 <= i < N }\n" +
            "D[i] = C[i];\n" +
            "schedule [N] -> { S1[i] -> [i] }\n" +
            "schedule [N] -> { S2[i] -> [i] }\n" +
            "false { }\n";

    @Test
    public void testDependenceInsideFusedIteration() throws Exception {
        Scop s = scop(PRODUCER_CONSUMER + "flow { S1[i] -> S2[i] }\n");
        String text = print(CpuCodeGen.generate(s, true));
        assertThat(text, containsString(
                "#pragma omp parallel for\n" +
                "for (int i = 0; i < N; i += 1)\n"));
        assertTrue(text, text.indexOf("  C[i] = A[i] + B[i];\n") <
                text.indexOf("  D[i] = C[i];\n"));
    }

    @Test
    public void testDependenceAcrossFusedIterations() throws Exception {
        Scop s = scop(PRODUCER_CONSUMER + "flow { S1[i] -> S2[i + 1] }\n");
        Statement tree = CpuCodeGen.generate(s, true);
        assertFalse(tree.getAnnotation(LoopAnnotation.class, "parallel")
                .isParallel());
        assertFalse(print(tree).contains("#pragma"));
    }

    @Test
    public void testRunKeepsTree() throws Exception {
        Scop s = scop(
                "statement [N] -> { S1[i] : 0 <= i < N }\n" +
                "C[i] = A[i] + B[i];\n");
        CpuCodeGen codegen = new CpuCodeGen(s, true);
        assertNull(codegen.getTree());
        CodeGenPass.run(codegen);
        assertThat(print(codegen.getTree()), containsString(
                "#pragma omp parallel for\n"));
    }

    @Test(expected = CodeGenException.class)
    public void testUnknownStatement() {
        Relation domain = RelationReader.readRelation("{ T[i] : 0 <= i < 4 }");
        ScopStatement stmt = new ScopStatement("S", domain, new Identifier("x"));
        Scop s = new Scop(
                Relation.universe(Space.paramSpace(new ArrayList<String>())),
                RelationReader.readUnion("{ T[i] -> [i] }"), null, null,
                Collections.singletonList(stmt), new ArrayList<ScopArray>(),
                0, 0);
        CpuCodeGen.generate(s, false);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoScop() {
        CpuCodeGen.generate(null, false);
    }

}
