package polyc.exec;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import polyc.hir.Tools;
import polyc.hir.UnsupportedInput;
import polyc.scop.Scop;
import polyc.scop.ScopReader;

public class DriverTest {

    private static final String SOURCE =
            "void f(int N, float *A, float *B)\n" +
            "{\n" +
            "#pragma scop\n" +
            "  for (int i = 0; i < N; i++)\n" +
            "    C[i] = A[i] + B[i];\n" +
            "#pragma endscop\n" +
            "}\n";

    private static final String SCOP =
            "context   [N] -> { : N >= 1 }\n" +
            "array     float A[N] external\n" +
            "array     float B[N] external\n" +
            "array     float C[N] hidden\n" +
            "statement [N] -> { S1[i] : 0 <= i < N }\n" +
            "          C[i] = A[i] + B[i];\n";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Before
    public void setUp() {
        Driver.setOptionValue("openmp", null);
        Driver.setOptionValue("output", null);
        Driver.setOptionValue("scop", null);
        Tools.setExitThrowsException(true);
    }

    @After
    public void tearDown() {
        Driver.setOptionValue("openmp", null);
        Tools.setExitThrowsException(false);
    }

    private File write(String name, String text) throws Exception {
        File f = new File(folder.getRoot(), name);
        Writer w = new OutputStreamWriter(new FileOutputStream(f),
                StandardCharsets.UTF_8);
        w.write(text);
        w.close();
        return f;
    }

    private static String read(File f) throws Exception {
        return Driver.readFile(f.getPath()).replace("\r\n", "\n");
    }

    @Test
    public void testOutputName() {
        assertThat(Driver.getOutputName("foo.c"), is("foo.polyc.c"));
        assertThat(Driver.getOutputName("dir" + File.separator + "foo.c"),
                is("foo.polyc.c"));
        assertThat(Driver.getOutputName("a.b.c"), is("a.b.polyc.c"));
        assertThat(Driver.getOutputName("foo"), is("foo.polyc"));
        assertThat(Driver.getOutputName(".foo"), is(".polyc.foo"));
    }

    @Test
    public void testScopName() {
        assertThat(Driver.getScopName("foo.c"), is("foo.scop"));
        assertThat(Driver.getScopName("dir" + File.separator + "foo.c"),
                is("dir" + File.separator + "foo.scop"));
    }

    @Test
    public void testHiddenArraysGetOwnBlock() throws Exception {
        File input = write("vadd.c", SOURCE);
        File output = new File(folder.getRoot(), "vadd.polyc.c");
        Scop scop = ScopReader.read(SCOP, SOURCE);
        Driver.generate(scop, input.getPath(), output.getPath());
        assertThat(read(output), is(
                "void f(int N, float *A, float *B)\n" +
                "{\n" +
                "/* polyc generated CPU code */\n" +
                "\n" +
                "{\n" +
                "  float C[N];\n" +
                "  for (int i = 0; i < N; i += 1)\n" +
                "    C[i] = A[i] + B[i];\n" +
                "}\n" +
                "}\n"));
    }

    @Test
    public void testExposedArraysDeclaredBeforeCode() throws Exception {
        File input = write("vadd.c", SOURCE);
        File output = new File(folder.getRoot(), "out.c");
        Scop scop = ScopReader.read(SCOP.replace("hidden", "exposed"), SOURCE);
        Driver.generate(scop, input.getPath(), output.getPath());
        assertThat(read(output), is(
                "void f(int N, float *A, float *B)\n" +
                "{\n" +
                "/* polyc generated CPU code */\n" +
                "\n" +
                "float C[N];\n" +
                "for (int i = 0; i < N; i += 1)\n" +
                "  C[i] = A[i] + B[i];\n" +
                "}\n"));
    }

    @Test
    public void testNoOutputOnFailure() throws Exception {
        File input = write("bad.c", SOURCE);
        File output = new File(folder.getRoot(), "bad.polyc.c");
        Scop scop = ScopReader.read(
                "statement { S1[i] : 0 <= i }\n" +
                "C[i] = A[i];\n", SOURCE);
        try {
            Driver.generate(scop, input.getPath(), output.getPath());
            fail("unbounded loop accepted");
        } catch (UnsupportedInput e) {
            assertThat(e.getMessage(), containsString("unbounded"));
        }
        assertFalse(output.exists());
    }

    @Test
    public void testFailedGenerationKeepsOldOutput() throws Exception {
        File input = write("bad.c", SOURCE);
        File output = write("bad.polyc.c", "old\n");
        Scop scop = ScopReader.read(
                "statement { S1[i] : 0 <= i }\n" +
                "C[i] = A[i];\n", SOURCE);
        try {
            Driver.generate(scop, input.getPath(), output.getPath());
            fail("unbounded loop accepted");
        } catch (UnsupportedInput e) {
            // expected
        }
        assertThat(read(output), is("old\n"));
    }

    @Test
    public void testFailedWriteLeavesNoPartialFile() throws Exception {
        File input = write("vadd.c", SOURCE);
        File output = folder.newFolder("taken.c");
        write("taken.c" + File.separator + "keep", "x");
        Scop scop = ScopReader.read(SCOP, SOURCE);
        try {
            Driver.generate(scop, input.getPath(), output.getPath());
            fail("output replaced a non-empty directory");
        } catch (IOException e) {
            // expected
        }
        assertTrue(output.isDirectory());
        String[] left = folder.getRoot().list();
        Arrays.sort(left);
        assertThat(Arrays.asList(left).toString(), is("[taken.c, vadd.c]"));
    }

    @Test
    public void testOutputInMissingDirectory() throws Exception {
        File input = write("vadd.c", SOURCE);
        File output = new File(new File(folder.getRoot(), "missing"), "out.c");
        Scop scop = ScopReader.read(SCOP, SOURCE);
        try {
            Driver.generate(scop, input.getPath(), output.getPath());
            fail("output written into a missing directory");
        } catch (IOException e) {
            // expected
        }
        assertFalse(output.exists());
    }

    @Test
    public void testWriteFileReplacesOutput() throws Exception {
        File output = write("out.c", "old\n");
        Driver.writeFile(output.getPath(), "new\n");
        assertThat(read(output), is("new\n"));
        assertThat(folder.getRoot().list().length, is(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoScop() throws Exception {
        File input = write("none.c", SOURCE);
        Driver.generate(null, input.getPath(),
                new File(folder.getRoot(), "none.polyc.c").getPath());
    }

    @Test
    public void testRunWithOpenMP() throws Exception {
        File input = write("vadd.c", SOURCE);
        write("vadd.scop", SCOP);
        File output = new File(folder.getRoot(), "result.c");
        new Driver().run(new String[] {
                "-openmp", "-output=" + output.getPath(), input.getPath()});
        String text = read(output);
        assertThat(text, containsString(
                "  #pragma omp parallel for\n" +
                "  for (int i = 0; i < N; i += 1)\n"));
        assertFalse(text.contains("#pragma scop"));
    }

    @Test
    public void testRunWithMissingScop() throws Exception {
        File input = write("lonely.c", SOURCE);
        try {
            new Driver().run(new String[] {input.getPath()});
            fail("missing description accepted");
        } catch (Tools.ExitException e) {
            assertThat(e.getStatus(), is(1));
        }
    }

    @Test
    public void testOptionsDump() {
        CommandLineOptionSet set = new CommandLineOptionSet();
        set.add(CommandLineOptionSet.UTILITY, "verbosity", "0", "N", "level");
        set.add(CommandLineOptionSet.CODEGEN, "openmp", "emit directives");
        String dump = set.dumpOptions();
        assertThat(dump, containsString("verbosity=0\n"));
        assertThat(dump, containsString("#openmp\n"));
        assertThat(set.getUsage(CommandLineOptionSet.CODEGEN),
                containsString("-openmp"));
        assertNull(set.getValue("missing"));
    }

}
