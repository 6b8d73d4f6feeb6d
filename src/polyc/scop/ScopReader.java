package polyc.scop;

import polyc.hir.Expression;
import polyc.hir.PrintTools;
import polyc.hir.UnsupportedInput;
import polyc.poly.BasicRelation;
import polyc.poly.Relation;
import polyc.poly.RelationReader;
import polyc.poly.Space;
import polyc.poly.UnionRelation;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
* Reads a scop from its textual description. The description holds one
* entry per line; empty lines and lines starting with {@code #} are
* skipped.
* <pre>
*   context   [N] -&gt; { : N &gt;= 1 }
*   array     float A[N] exposed
*   statement [N] -&gt; { S1[i] : 0 &lt;= i &lt; N }
*             A[i] = 0;
*   schedule  [N] -&gt; { S1[i] -&gt; [0, i] }
*   flow      { }
*   false     { }
*   region    120 245
* </pre>
* An array is {@code exposed} when it is visible outside the region,
* {@code hidden} when it is a temporary of the region, and {@code external}
* when the generated code must not declare it. The line after a statement
* entry is the body of the statement. Several schedule entries are joined;
* without any, the statements run one after the other in the order they are
* listed. Without flow and false entries the dependences are left unknown.
* Without a region entry the region spans the {@code #pragma scop} and
* {@code #pragma endscop} lines of the source.
*/
public class ScopReader {

    private static final Pattern ARRAY = Pattern.compile(
            "(.+?)\\s+([A-Za-z_]\\w*)\\s*((\\[[^\\]]*\\]\\s*)*)" +
            "\\s+(exposed|hidden|external)");

    private static final Pattern EXTENT = Pattern.compile("\\[([^\\]]*)\\]");

    private static final Pattern REGION =
            Pattern.compile("(\\d+)\\s+(\\d+)");

    private static final Pattern PRAGMA_SCOP =
            Pattern.compile("^[ \\t]*#[ \\t]*pragma[ \\t]+scop[ \\t]*$",
                    Pattern.MULTILINE);

    private static final Pattern PRAGMA_ENDSCOP =
            Pattern.compile("^[ \\t]*#[ \\t]*pragma[ \\t]+endscop[ \\t]*$",
                    Pattern.MULTILINE);

    private Relation context = null;
    private UnionRelation schedule = null;
    private UnionRelation dep_flow = null;
    private UnionRelation dep_false = null;
    private final List<ScopStatement> statements =
            new ArrayList<ScopStatement>();
    private final Map<String, ScopArray> arrays =
            new LinkedHashMap<String, ScopArray>();
    private int start = -1;
    private int end = -1;

    private ScopReader() {
    }

    /**
    * Reads a scop.
    *
    * @param description the scop description.
    * @param source the source text the region refers to.
    * @return the scop.
    * @throws ScopFormatException if the description is malformed or the
    *   region cannot be located.
    */
    public static Scop read(String description, String source)
            throws ScopFormatException {
        ScopReader reader = new ScopReader();
        reader.parse(description);
        return reader.finish(source);
    }

    private void parse(String description) throws ScopFormatException {
        BufferedReader in = new BufferedReader(new StringReader(description));
        String pending = null;
        Relation pending_domain = null;
        int pending_line = 0;
        int line_num = 0;
        try {
            String line;
            while ((line = in.readLine()) != null) {
                line_num++;
                String text = line.trim();
                if (text.length() == 0 || text.startsWith("#")) {
                    continue;
                }
                if (pending != null) {
                    addStatement(pending_line, pending, pending_domain, text);
                    pending = null;
                    continue;
                }
                int split = firstSpace(text);
                String key = text.substring(0, split);
                String value = text.substring(split).trim();
                try {
                    if (key.equals("context")) {
                        context = readContext(value);
                    } else if (key.equals("array")) {
                        addArray(line_num, value);
                    } else if (key.equals("statement")) {
                        pending_domain = RelationReader.readRelation(value);
                        pending = pending_domain.getSpace().getOutName();
                        pending_line = line_num;
                        if (pending == null ||
                            !pending_domain.getSpace().isSet()) {
                            throw new ScopFormatException(line_num,
                                    "statement domain must be a named set");
                        }
                    } else if (key.equals("schedule")) {
                        UnionRelation s = RelationReader.readUnion(value);
                        schedule = (schedule == null) ? s : schedule.union(s);
                    } else if (key.equals("flow")) {
                        dep_flow = RelationReader.readUnion(value);
                    } else if (key.equals("false")) {
                        dep_false = RelationReader.readUnion(value);
                    } else if (key.equals("region")) {
                        Matcher m = REGION.matcher(value);
                        if (!m.matches()) {
                            throw new ScopFormatException(line_num,
                                    "region expects two offsets");
                        }
                        start = Integer.parseInt(m.group(1));
                        end = Integer.parseInt(m.group(2));
                    } else {
                        throw new ScopFormatException(line_num,
                                "unknown entry '" + key + "'");
                    }
                } catch(UnsupportedInput e) {
                    throw new ScopFormatException(line_num,
                            e.getMessage(), e);
                } catch(NumberFormatException e) {
                    throw new ScopFormatException(line_num,
                            "invalid offset in " + value, e);
                }
            }
        } catch(ScopFormatException e) {
            throw e;
        } catch(IOException e) {
            throw new ScopFormatException(line_num, e.getMessage(), e);
        }
        if (pending != null) {
            throw new ScopFormatException(pending_line,
                    "statement " + pending + " has no body");
        }
    }

    private static int firstSpace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return text.length();
    }

    private static Relation readContext(String value) {
        Relation r = RelationReader.readRelation(value);
        if (!r.getSpace().isSet() || r.getSpace().getNumOut() != 0) {
            throw new UnsupportedInput("context must be a parameter set");
        }
        return r;
    }

    private void addArray(int line_num, String value)
            throws ScopFormatException {
        Matcher m = ARRAY.matcher(value);
        if (!m.matches()) {
            throw new ScopFormatException(line_num,
                    "array expects '<type> <name>[<size>]... " +
                    "exposed|hidden|external'");
        }
        String name = m.group(2);
        if (arrays.containsKey(name)) {
            throw new ScopFormatException(line_num,
                    "array " + name + " listed twice");
        }
        List<Expression> extents = new ArrayList<Expression>();
        Matcher e = EXTENT.matcher(m.group(3));
        BodyParser.ScopStatementHeader none =
                new BodyParser.ScopStatementHeader(name, new ArrayList<String>());
        while (e.find()) {
            extents.add(new BodyParser(e.group(1), none,
                    new LinkedHashMap<String, ScopArray>()).parse());
        }
        String kind = m.group(5);
        arrays.put(name, new ScopArray(name, m.group(1).trim(), extents,
                !kind.equals("external"), !kind.equals("hidden")));
    }

    private void addStatement(int line_num, String name, Relation domain,
            String body) throws ScopFormatException {
        for (ScopStatement s : statements) {
            if (s.getName().equals(name)) {
                throw new ScopFormatException(line_num,
                        "statement " + name + " listed twice");
            }
        }
        List<String> iterators = domain.getSpace().getOutDimNames();
        if (iterators.contains(null)) {
            throw new ScopFormatException(line_num,
                    "statement " + name + " has unnamed iterators");
        }
        if (body.endsWith(";")) {
            body = body.substring(0, body.length() - 1).trim();
        }
        try {
            Expression e = new BodyParser(body,
                    new BodyParser.ScopStatementHeader(name, iterators),
                    arrays).parse();
            statements.add(new ScopStatement(name, domain, e));
        } catch(UnsupportedInput e) {
            throw new ScopFormatException(line_num + 1, e.getMessage(), e);
        }
        PrintTools.printlnStatus(3, "[ScopReader]", "statement", name, body);
    }

    private Scop finish(String source) throws ScopFormatException {
        if (statements.isEmpty()) {
            throw new ScopFormatException("scop has no statements");
        }
        if (context == null) {
            context = Relation.universe(
                    Space.paramSpace(new ArrayList<String>()));
        }
        if (schedule == null) {
            schedule = sequentialSchedule();
        }
        for (ScopStatement s : statements) {
            Relation r = schedule.getRelationByName(s.getName());
            if (r == null || r.getSpace().isSet()) {
                throw new ScopFormatException(
                        "statement " + s.getName() + " is not scheduled");
            }
        }
        if ((dep_flow == null) != (dep_false == null)) {
            throw new ScopFormatException(
                    "flow and false dependences must be given together");
        }
        if (start < 0) {
            locateRegion(source);
        }
        if (end > source.length() || start > end) {
            throw new ScopFormatException("region [" + start + ", " + end +
                    ") lies outside the source");
        }
        return new Scop(context, schedule, dep_flow, dep_false,
                statements, new ArrayList<ScopArray>(arrays.values()),
                start, end);
    }

    // Statement k runs all its instances after those of statement k-1.
    private UnionRelation sequentialSchedule() {
        UnionRelation ret = UnionRelation.empty();
        for (int k = 0; k < statements.size(); k++) {
            ScopStatement s = statements.get(k);
            Space set = s.getDomain().getSpace();
            int n = set.getNumOut();
            List<String> time = new ArrayList<String>(n + 1);
            for (int i = 0; i <= n; i++) {
                time.add(null);
            }
            Space map = Space.mapSpace(set.getParams(), s.getName(),
                    set.getOutDimNames(), null, time);
            BasicRelation b = BasicRelation.universe(map);
            long[] row = new long[map.getNumColumns()];
            row[0] = -k;
            row[map.outColumn(0)] = 1;
            b = b.addEquality(row);
            for (int i = 0; i < n; i++) {
                row = new long[map.getNumColumns()];
                row[map.inColumn(i)] = -1;
                row[map.outColumn(i + 1)] = 1;
                b = b.addEquality(row);
            }
            ret = ret.add(Relation.fromBasic(b));
        }
        return ret;
    }

    private void locateRegion(String source) throws ScopFormatException {
        Matcher begin = PRAGMA_SCOP.matcher(source);
        if (!begin.find()) {
            throw new ScopFormatException("no #pragma scop in the source");
        }
        Matcher finish = PRAGMA_ENDSCOP.matcher(source);
        if (!finish.find(begin.end())) {
            throw new ScopFormatException("no #pragma endscop in the source");
        }
        start = begin.start();
        end = finish.end();
        if (end < source.length() && source.charAt(end) == '\r') {
            end++;
        }
        if (end < source.length() && source.charAt(end) == '\n') {
            end++;
        }
    }

}
