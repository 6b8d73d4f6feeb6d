package polyc.poly;

import polyc.hir.UnsupportedInput;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
* Reads relations written in the isl notation, e.g.
* <pre>
*   [N] -&gt; { S[i] -&gt; A[i + 1] : 0 &lt;= i &lt; N; T[i, j] : i = 2j or i &gt; N }
* </pre>
* Constraints may chain comparisons and join them with {@code and} and
* {@code or}; integer multiples may omit the {@code *}. Names that are
* neither tuple dimensions nor declared parameters become parameters.
* Tuple entries that are not fresh names define unnamed dimensions equal to
* the given expression. Quantifiers and integer division are not supported.
*/
public final class RelationReader {

    private final String text;
    private int pos;
    private final List<String> params;

    // One parsed piece: tuples and constraints as linear forms.
    private static final class PieceText {
        String in_name;
        List<String> in_dims;
        String out_name;
        List<String> out_dims;
        boolean is_set;
        List<Map<String, Long>> eqs = new ArrayList<Map<String, Long>>();
        List<Map<String, Long>> ineqs = new ArrayList<Map<String, Long>>();
    }

    // Key of the constant term in a linear form.
    private static final String ONE = "";

    private RelationReader(String text) {
        this.text = text;
        this.pos = 0;
        this.params = new ArrayList<String>();
    }

    /**
    * Reads a union of relations.
    *
    * @throws UnsupportedInput if the text is malformed.
    */
    public static UnionRelation readUnion(String text) {
        return new RelationReader(text).parseUnion();
    }

    /**
    * Reads a relation whose pieces all share one space.
    *
    * @throws UnsupportedInput if the text is malformed or spans several
    *   spaces.
    */
    public static Relation readRelation(String text) {
        UnionRelation u = readUnion(text);
        if (u.getNumRelations() != 1) {
            throw new UnsupportedInput("expected a single space in: " + text);
        }
        return u.getRelations().get(0);
    }

    private UnionRelation parseUnion() {
        skipSpace();
        if (peek('[')) {
            expect("[");
            if (!peek(']')) {
                do {
                    String p = identifier();
                    if (!params.contains(p)) {
                        params.add(p);
                    }
                } while (accept(","));
            }
            expect("]");
            expect("->");
        }
        expect("{");
        List<PieceText> pieces = new ArrayList<PieceText>();
        if (!peek('}')) {
            do {
                pieces.addAll(parsePiece());
            } while (accept(";"));
        }
        expect("}");
        skipSpace();
        if (pos < text.length()) {
            throw error("unexpected text");
        }
        UnionRelation ret = UnionRelation.empty();
        for (PieceText p : pieces) {
            ret = ret.add(Relation.fromBasic(build(p)));
        }
        return ret;
    }

    // Returns one piece per disjunct.
    private List<PieceText> parsePiece() {
        Map<String, String> bound = new HashMap<String, String>();
        PieceText t = new PieceText();
        List<Map<String, Long>> defs = new ArrayList<Map<String, Long>>();
        String name = optionalIdentifier();
        if (name == null && peek(':')) {
            // A parameter domain such as { : N >= 1 }.
            t.out_dims = new ArrayList<String>(0);
            t.is_set = true;
        } else {
            parseTuples(t, name, bound, defs);
        }
        t.eqs.addAll(defs);
        List<PieceText> ret = new ArrayList<PieceText>();
        if (!accept(":")) {
            ret.add(t);
            return ret;
        }
        List<List<Map<String, Long>[]>> disjuncts = parseDisjunction(bound);
        for (List<Map<String, Long>[]> conj : disjuncts) {
            PieceText p = new PieceText();
            p.in_name = t.in_name;
            p.in_dims = t.in_dims;
            p.out_name = t.out_name;
            p.out_dims = t.out_dims;
            p.is_set = t.is_set;
            p.eqs.addAll(t.eqs);
            for (Map<String, Long>[] c : conj) {
                if (c[1] != null) {
                    p.eqs.add(c[0]);
                } else {
                    p.ineqs.add(c[0]);
                }
            }
            ret.add(p);
        }
        return ret;
    }

    private void parseTuples(PieceText t, String name,
            Map<String, String> bound, List<Map<String, Long>> defs) {
        List<String> first = parseTuple("$i", bound, defs);
        if (accept("->")) {
            t.in_name = name;
            t.in_dims = first;
            t.out_name = optionalIdentifier();
            t.out_dims = parseTuple("$o", bound, defs);
            t.is_set = false;
        } else {
            t.out_name = name;
            t.out_dims = renameKeys(first, bound, defs);
            t.is_set = true;
        }
    }

    // The dimensions of a set are read as inputs first; move them to outputs.
    private List<String> renameKeys(List<String> dims,
            Map<String, String> bound, List<Map<String, Long>> defs) {
        for (Map.Entry<String, String> e : bound.entrySet()) {
            e.setValue(e.getValue().replace("$i", "$o"));
        }
        for (int i = 0; i < defs.size(); i++) {
            Map<String, Long> renamed = new LinkedHashMap<String, Long>();
            for (Map.Entry<String, Long> e : defs.get(i).entrySet()) {
                renamed.put(e.getKey().replace("$i", "$o"), e.getValue());
            }
            defs.set(i, renamed);
        }
        return dims;
    }

    private List<String> parseTuple(String prefix,
            Map<String, String> bound, List<Map<String, Long>> defs) {
        List<String> dims = new ArrayList<String>();
        expect("[");
        if (!peek(']')) {
            do {
                String key = prefix + dims.size();
                int save = pos;
                String id = optionalIdentifier();
                if (id != null && (peek(',') || peek(']')) &&
                    !bound.containsKey(id) && !params.contains(id)) {
                    bound.put(id, key);
                    dims.add(id);
                } else {
                    pos = save;
                    Map<String, Long> f = parseAffine(bound);
                    add(f, key, -1);
                    defs.add(f);
                    dims.add(null);
                }
            } while (accept(","));
        }
        expect("]");
        return dims;
    }

    // Each constraint is {form, marker}; a non-null marker means equality.
    @SuppressWarnings("unchecked")
    private List<List<Map<String, Long>[]>> parseDisjunction(
            Map<String, String> bound) {
        List<List<Map<String, Long>[]>> ret =
                new ArrayList<List<Map<String, Long>[]>>();
        do {
            List<Map<String, Long>[]> conj = new ArrayList<Map<String, Long>[]>();
            do {
                parseChain(bound, conj);
            } while (accept("and") || accept("&&"));
            ret.add(conj);
        } while (accept("or") || accept("||"));
        return ret;
    }

    @SuppressWarnings("unchecked")
    private void parseChain(Map<String, String> bound,
            List<Map<String, Long>[]> conj) {
        Map<String, Long> left = parseAffine(bound);
        String op = comparison();
        if (op == null) {
            throw error("comparison expected");
        }
        while (op != null) {
            Map<String, Long> right = parseAffine(bound);
            Map<String, Long> f;
            boolean eq = false;
            if (op.equals("<=")) {
                f = difference(right, left, 0);
            } else if (op.equals("<")) {
                f = difference(right, left, -1);
            } else if (op.equals(">=")) {
                f = difference(left, right, 0);
            } else if (op.equals(">")) {
                f = difference(left, right, -1);
            } else {
                f = difference(left, right, 0);
                eq = true;
            }
            conj.add(new Map[] {f, eq ? f : null});
            left = right;
            op = comparison();
        }
    }

    private String comparison() {
        String[] ops = {"<=", ">=", "==", "<", ">", "="};
        for (String op : ops) {
            if (accept(op)) {
                return op;
            }
        }
        return null;
    }

    private static Map<String, Long> difference(
            Map<String, Long> a, Map<String, Long> b, long c) {
        Map<String, Long> ret = new LinkedHashMap<String, Long>(a);
        for (Map.Entry<String, Long> e : b.entrySet()) {
            add(ret, e.getKey(), -e.getValue());
        }
        add(ret, ONE, c);
        return ret;
    }

    private static void add(Map<String, Long> f, String key, long c) {
        Long old = f.get(key);
        f.put(key, Rows.add(old == null ? 0 : old, c));
    }

    private Map<String, Long> parseAffine(Map<String, String> bound) {
        Map<String, Long> ret = new LinkedHashMap<String, Long>();
        long sign = 1;
        if (accept("-")) {
            sign = -1;
        } else {
            accept("+");
        }
        while (true) {
            Map<String, Long> term = parseTerm(bound);
            for (Map.Entry<String, Long> e : term.entrySet()) {
                add(ret, e.getKey(), Rows.mul(sign, e.getValue()));
            }
            if (accept("+")) {
                sign = 1;
            } else if (peekMinusOperator()) {
                expect("-");
                sign = -1;
            } else {
                return ret;
            }
        }
    }

    // A '-' followed by '>' is the arrow, not a subtraction.
    private boolean peekMinusOperator() {
        skipSpace();
        return pos < text.length() && text.charAt(pos) == '-' &&
                !(pos + 1 < text.length() && text.charAt(pos + 1) == '>');
    }

    private Map<String, Long> parseTerm(Map<String, String> bound) {
        Map<String, Long> ret = parseFactor(bound);
        while (true) {
            skipSpace();
            Map<String, Long> next;
            if (accept("*")) {
                next = parseFactor(bound);
            } else if (isConstant(ret) && pos < text.length() &&
                       (Character.isLetter(text.charAt(pos)) ||
                        text.charAt(pos) == '_' || text.charAt(pos) == '(') &&
                       !atKeyword()) {
                next = parseFactor(bound);
            } else {
                return ret;
            }
            if (isConstant(ret)) {
                ret = scale(next, constantOf(ret));
            } else if (isConstant(next)) {
                ret = scale(ret, constantOf(next));
            } else {
                throw error("non-affine product");
            }
        }
    }

    private boolean atKeyword() {
        return text.startsWith("and", pos) || text.startsWith("or", pos);
    }

    private Map<String, Long> parseFactor(Map<String, String> bound) {
        skipSpace();
        Map<String, Long> ret = new LinkedHashMap<String, Long>();
        if (accept("(")) {
            ret = parseAffine(bound);
            expect(")");
            return ret;
        }
        if (accept("-")) {
            return scale(parseFactor(bound), -1);
        }
        if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            int start = pos;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
            try {
                ret.put(ONE, Long.parseLong(text.substring(start, pos)));
            } catch(NumberFormatException e) {
                throw error("integer too large");
            }
            return ret;
        }
        String id = identifier();
        String key = bound.get(id);
        if (key == null) {
            if (!params.contains(id)) {
                params.add(id);
            }
            key = id;
        }
        ret.put(key, 1L);
        return ret;
    }

    private static boolean isConstant(Map<String, Long> f) {
        for (Map.Entry<String, Long> e : f.entrySet()) {
            if (!e.getKey().equals(ONE) && e.getValue() != 0) {
                return false;
            }
        }
        return true;
    }

    private static long constantOf(Map<String, Long> f) {
        Long c = f.get(ONE);
        return (c == null) ? 0 : c;
    }

    private static Map<String, Long> scale(Map<String, Long> f, long c) {
        Map<String, Long> ret = new LinkedHashMap<String, Long>();
        for (Map.Entry<String, Long> e : f.entrySet()) {
            ret.put(e.getKey(), Rows.mul(e.getValue(), c));
        }
        return ret;
    }

    private BasicRelation build(PieceText p) {
        Space space;
        if (p.is_set) {
            space = Space.setSpace(params, p.out_name, p.out_dims);
        } else {
            space = Space.mapSpace(params, p.in_name, p.in_dims,
                    p.out_name, p.out_dims);
        }
        List<long[]> eqs = new ArrayList<long[]>();
        List<long[]> ineqs = new ArrayList<long[]>();
        for (Map<String, Long> f : p.eqs) {
            eqs.add(toRow(f, space));
        }
        for (Map<String, Long> f : p.ineqs) {
            ineqs.add(toRow(f, space));
        }
        return new BasicRelation(space, 0, eqs, ineqs).simplify();
    }

    private long[] toRow(Map<String, Long> f, Space space) {
        long[] row = new long[space.getNumColumns()];
        for (Map.Entry<String, Long> e : f.entrySet()) {
            String key = e.getKey();
            int col;
            if (key.equals(ONE)) {
                col = 0;
            } else if (key.startsWith("$i")) {
                col = space.inColumn(Integer.parseInt(key.substring(2)));
            } else if (key.startsWith("$o")) {
                col = space.outColumn(Integer.parseInt(key.substring(2)));
            } else {
                col = space.paramColumn(params.indexOf(key));
            }
            row[col] = Rows.add(row[col], e.getValue());
        }
        return row;
    }

    private void skipSpace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private boolean peek(char c) {
        skipSpace();
        return pos < text.length() && text.charAt(pos) == c;
    }

    private boolean accept(String s) {
        skipSpace();
        if (!text.startsWith(s, pos)) {
            return false;
        }
        if (Character.isLetter(s.charAt(0))) {
            int end = pos + s.length();
            if (end < text.length() && isIdentifierPart(text.charAt(end))) {
                return false;
            }
        }
        pos += s.length();
        return true;
    }

    private void expect(String s) {
        if (!accept(s)) {
            throw error("'" + s + "' expected");
        }
    }

    private String optionalIdentifier() {
        skipSpace();
        if (pos >= text.length()) {
            return null;
        }
        char c = text.charAt(pos);
        if (!Character.isLetter(c) && c != '_') {
            return null;
        }
        int start = pos;
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
        return text.substring(start, pos);
    }

    private String identifier() {
        String id = optionalIdentifier();
        if (id == null) {
            throw error("name expected");
        }
        return id;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
    }

    private UnsupportedInput error(String message) {
        return new UnsupportedInput(message + " at column " + (pos + 1) +
                " of \"" + text + "\"");
    }

}
