package polyc.codegen;

import polyc.hir.AssignmentExpression;
import polyc.hir.AssignmentOperator;
import polyc.hir.BinaryExpression;
import polyc.hir.BinaryOperator;
import polyc.hir.CompoundStatement;
import polyc.hir.DeclarationStatement;
import polyc.hir.Expression;
import polyc.hir.ExpressionStatement;
import polyc.hir.ForLoop;
import polyc.hir.FunctionCall;
import polyc.hir.Identifier;
import polyc.hir.IfStatement;
import polyc.hir.IntegerLiteral;
import polyc.hir.MinMaxExpression;
import polyc.hir.NullStatement;
import polyc.hir.PrintTools;
import polyc.hir.Statement;
import polyc.hir.UnaryExpression;
import polyc.hir.UnaryOperator;
import polyc.hir.UnsupportedInput;
import polyc.poly.AffineExpression;
import polyc.poly.BasicRelation;
import polyc.poly.Constraint;
import polyc.poly.PwMultiAff;
import polyc.poly.Relation;
import polyc.poly.Space;
import polyc.poly.UnionRelation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
* Builds a loop tree that visits the statement instances of a schedule in
* lexicographic order of their time stamps. Each schedule entry maps the
* instances of one statement to time stamps; entries of different length are
* padded with zeros.
* <p>
* The tree is built one time dimension at a time, from the outermost. A
* dimension fixed to the same value in all statements generates no code; one
* fixed to different constants splits the statements into a sequence; any
* other dimension becomes a loop whose bounds are taken from the projection
* of the statement instances onto the outer dimensions. At the innermost
* level each statement instance becomes a leaf {@code S(i0, i1, ..)},
* guarded by the constraints that the enclosing loops do not enforce.
* <p>
* A listener sees every loop before its body is built and after the whole
* loop is complete, and every leaf once.
*/
public class AstBuild {

    // The instances of one statement sharing one conjunction of constraints.
    private static final class Piece {

        final String name;

        // Statement instance to time stamp, columns [1 | P | S | T].
        final BasicRelation map;

        // Time stamps, columns [1 | P | T | E].
        final BasicRelation time;

        Piece(String name, BasicRelation map, BasicRelation time) {
            this.name = name;
            this.map = map;
            this.time = time;
        }

    }

    private final Relation context;

    private AstBuildListener listener;

    private final Set<String> reserved;

    // Parameters of the build, the column order of [1 | P | T].
    private List<String> params;

    private int n_time;

    // Iterator name of each loop dimension on the current path.
    private String[] dim_names;

    // Value of each dimension that generates no loop, over [1 | P | T].
    private AffineExpression[] dim_values;

    // Facts holding at the node under construction, over [1 | P | T].
    private List<long[]> ctx_eqs;

    private List<long[]> ctx_ineqs;

    // Schedule of the node a callback is invoked for.
    private UnionRelation current;

    /**
    * Creates a builder.
    *
    * @param context the parameter domain the tree may assume.
    */
    public AstBuild(Relation context) {
        this.context = context;
        this.listener = null;
        this.reserved = new HashSet<String>();
    }

    /** Sets the listener invoked during construction. */
    public void setListener(AstBuildListener listener) {
        this.listener = listener;
    }

    /** Keeps the given names from being used as loop iterators. */
    public void reserveNames(Collection<String> names) {
        reserved.addAll(names);
    }

    /**
    * Builds the tree of a schedule.
    *
    * @param schedule maps from statement instances to time stamps; only the
    *   instances in the input of the maps are visited.
    * @return the root of the tree; a sequence of top-level nodes is
    *   returned as a compound statement.
    * @throws UnsupportedInput if the schedule cannot be expressed by
    *   unit-stride loops and guards.
    */
    public Statement build(UnionRelation schedule) {
        params = new ArrayList<String>(context.getSpace().getParams());
        n_time = 0;
        for (Relation r : schedule.getRelations()) {
            if (r.getSpace().isSet()) {
                throw new IllegalArgumentException(
                        "schedule entry is not a map: " + r);
            }
            params = Space.mergeParams(params, r.getSpace().getParams());
            n_time = Math.max(n_time, r.getSpace().getNumOut());
        }
        List<Piece> pieces = new ArrayList<Piece>();
        for (Relation r : schedule.getRelations()) {
            Relation aligned = r.alignParams(params).padOutputs(n_time)
                    .intersectParams(context).alignParams(params);
            for (BasicRelation raw : aligned.getBasicRelations()) {
                BasicRelation b = raw.simplify();
                if (b.isEmpty()) {
                    continue;
                }
                pieces.add(new Piece(r.getSpace().getInName(), b, b.range()));
            }
        }
        dim_names = new String[n_time];
        dim_values = new AffineExpression[n_time];
        ctx_eqs = new ArrayList<long[]>();
        ctx_ineqs = new ArrayList<long[]>();
        List<BasicRelation> ctx_pieces =
                context.alignParams(params).getBasicRelations();
        if (ctx_pieces.size() == 1) {
            for (Constraint c : ctx_pieces.get(0).simplify().getConstraints()) {
                long[] row = widen(c.getCoefficients(), timeWidth());
                (c.isEquality() ? ctx_eqs : ctx_ineqs).add(row);
            }
        }
        PrintTools.printlnStatus(2, "[AstBuild]", pieces.size(), "pieces,",
                n_time, "time dimensions");
        List<Statement> stmts = build(pieces, 0);
        current = null;
        return block(stmts);
    }

    /**
    * Returns the schedule of the node a callback is invoked for: for a loop
    * at depth <var>d</var>, the schedule of the statements inside the loop
    * restricted to the time dimensions up to <var>d</var>; for a leaf, the
    * full schedule of the statement instances of the leaf.
    */
    public UnionRelation getSchedule() {
        return current;
    }

    /**
    * Returns the C expression of an affine expression of the time stamp,
    * in terms of the iterators of the enclosing loops.
    *
    * @param aff the expression over {@code [1 | params | time]}.
    * @param space a space whose parameters and input dimensions give the
    *   columns of <var>aff</var>.
    * @throws IllegalStateException if the expression depends on a time
    *   dimension that has neither an iterator nor a value yet.
    */
    public Expression expressionFromAff(AffineExpression aff, Space space) {
        List<String> extra = extraParams(space);
        long[] row = toBuildRow(aff.getCoefficients(), space, extra);
        AffineExpression a = substituteDims(
                new AffineExpression(row, aff.getDenominator()));
        return toExpression(a.getCoefficients(), a.getDenominator(),
                false, extra);
    }

    /**
    * Returns the C condition of a set of time stamps, the disjunction of the
    * conjunctions of its basic sets. Constraints implied by the enclosing
    * loops are left out.
    */
    public Expression conditionFromSet(Relation set) {
        Space space = set.getSpace();
        List<String> extra = extraParams(space);
        Expression ret = null;
        for (BasicRelation b : set.getBasicRelations()) {
            List<Expression> conds = new ArrayList<Expression>();
            for (Constraint c : b.simplify().getConstraints()) {
                addCondition(conds, c, b, space, extra);
            }
            Expression e = conjunction(conds);
            if (set.getBasicRelations().size() > 1 &&
                    e instanceof BinaryExpression) {
                e.setParens(true);
            }
            ret = (ret == null) ? e :
                    new BinaryExpression(ret, BinaryOperator.LOGICAL_OR, e);
        }
        return (ret == null) ? new IntegerLiteral(0) : ret;
    }

    private List<Statement> build(List<Piece> pieces, int depth) {
        List<Statement> ret = new ArrayList<Statement>();
        if (depth == n_time) {
            for (Piece p : pieces) {
                ret.add(leaf(p));
            }
            return ret;
        }
        AffineExpression[] fixed = new AffineExpression[pieces.size()];
        boolean all_fixed = true, all_same = true, all_constant = true;
        for (int i = 0; i < fixed.length; i++) {
            fixed[i] = fixedValue(pieces.get(i), depth);
            if (fixed[i] == null) {
                all_fixed = false;
                break;
            }
            all_same &= fixed[i].equals(fixed[0]);
            all_constant &= fixed[i].isConstant();
        }
        if (all_fixed && all_same) {
            return buildFixed(pieces, depth, fixed[0]);
        }
        if (all_fixed && all_constant) {
            TreeMap<Long, List<Piece>> groups = new TreeMap<Long, List<Piece>>();
            for (int i = 0; i < fixed.length; i++) {
                Long key = fixed[i].getConstant();
                if (!groups.containsKey(key)) {
                    groups.put(key, new ArrayList<Piece>());
                }
                groups.get(key).add(pieces.get(i));
            }
            for (Long key : groups.keySet()) {
                ret.addAll(buildFixed(groups.get(key), depth,
                        AffineExpression.constant(timeWidth(), key)));
            }
            return ret;
        }
        ret.add(buildLoop(pieces, depth));
        return ret;
    }

    // Builds the inner dimensions with dimension depth equal to value.
    private List<Statement> buildFixed(List<Piece> pieces, int depth,
            AffineExpression value) {
        int eq_mark = ctx_eqs.size();
        long[] row = value.getCoefficients();
        for (int k = 0; k < row.length; k++) {
            row[k] = -row[k];
        }
        row[timeColumn(depth)] += 1;
        ctx_eqs.add(row);
        dim_values[depth] = value;
        List<Statement> ret = build(pieces, depth + 1);
        dim_values[depth] = null;
        truncate(ctx_eqs, eq_mark);
        return ret;
    }

    /**
    * Returns the value of dimension depth if the piece fixes it through an
    * equality with a unit coefficient over outer dimensions and parameters.
    */
    private AffineExpression fixedValue(Piece p, int depth) {
        int col = timeColumn(depth);
        int width = timeWidth();
        for (Constraint c : p.time.getConstraints()) {
            if (!c.isEquality()) {
                continue;
            }
            long[] r = c.getCoefficients();
            if (r[col] != 1 && r[col] != -1) {
                continue;
            }
            boolean inner = false;
            for (int k = col + 1; k < r.length && !inner; k++) {
                inner = (r[k] != 0);
            }
            if (inner) {
                continue;
            }
            long[] value = new long[width];
            for (int k = 0; k < col; k++) {
                value[k] = -r[col] * r[k];
            }
            return substituteDims(new AffineExpression(value, 1));
        }
        return null;
    }

    private Statement buildLoop(List<Piece> pieces, int depth) {
        int col = timeColumn(depth);
        String name = iteratorName(pieces, depth);
        List<List<long[]>> lowers = new ArrayList<List<long[]>>();
        List<List<long[]>> uppers = new ArrayList<List<long[]>>();
        for (Piece p : pieces) {
            BasicRelation b = p.time;
            for (long[] r : ctx_eqs) {
                b = b.addEquality(widen(r, b.getNumColumns()));
            }
            for (long[] r : ctx_ineqs) {
                b = b.addInequality(widen(r, b.getNumColumns()));
            }
            BasicRelation proj = b.projectOutRational(depth + 1);
            List<long[]> outer = new ArrayList<long[]>();
            List<long[]> lo = new ArrayList<long[]>();
            List<long[]> up = new ArrayList<long[]>();
            for (Constraint c : proj.getConstraints()) {
                long[] r = widen(c.getCoefficients(), timeWidth());
                if (r[col] == 0) {
                    outer.add(r);
                    if (c.isEquality()) {
                        outer.add(negate(r));
                    }
                } else if (c.isEquality()) {
                    lo.add(r[col] > 0 ? r : negate(r));
                    up.add(r[col] > 0 ? negate(r) : r);
                } else {
                    (r[col] > 0 ? lo : up).add(r);
                }
            }
            if (lo.isEmpty() || up.isEmpty()) {
                throw new UnsupportedInput("time dimension " + depth +
                        " of " + p.name + " is unbounded in " + p.time);
            }
            lowers.add(prune(lo, outer));
            uppers.add(prune(up, outer));
        }
        boolean same_lower = allSame(lowers);
        boolean same_upper = allSame(uppers);
        Expression lb = bound(lowers, same_lower, col, false);
        Expression ub = bound(uppers, same_upper, col, true);

        int eq_mark = ctx_eqs.size(), ineq_mark = ctx_ineqs.size();
        if (same_lower) {
            ctx_ineqs.addAll(lowers.get(0));
        }
        if (same_upper) {
            ctx_ineqs.addAll(uppers.get(0));
        }
        DeclarationStatement init =
                new DeclarationStatement("int", new Identifier(name), lb);
        Expression cond = new BinaryExpression(new Identifier(name),
                BinaryOperator.COMPARE_LE, ub);
        Expression step = new AssignmentExpression(new Identifier(name),
                AssignmentOperator.ADD, new IntegerLiteral(1));
        ForLoop loop = new ForLoop(init, cond, step, new NullStatement());
        dim_names[depth] = name;
        UnionRelation prefix = prefixSchedule(pieces, depth);
        current = prefix;
        if (listener != null) {
            listener.beforeFor(loop, this);
        }
        loop.setBody(block(build(pieces, depth + 1)));
        current = prefix;
        if (listener != null) {
            listener.afterFor(loop, this);
        }
        dim_names[depth] = null;
        truncate(ctx_eqs, eq_mark);
        truncate(ctx_ineqs, ineq_mark);
        return loop;
    }

    /**
    * Drops the bounds implied by the other bounds of the same kind, the
    * constraints on the outer dimensions and the facts of the enclosing
    * nodes.
    */
    private List<long[]> prune(List<long[]> bounds, List<long[]> outer) {
        List<long[]> kept = new ArrayList<long[]>(bounds);
        for (int i = kept.size() - 1; i >= 0 && kept.size() > 1; i--) {
            BasicRelation facts = contextSet();
            for (long[] r : outer) {
                facts = facts.addInequality(r);
            }
            for (int j = 0; j < kept.size(); j++) {
                if (j != i) {
                    facts = facts.addInequality(kept.get(j));
                }
            }
            if (facts.implies(kept.get(i), false)) {
                kept.remove(i);
            }
        }
        return kept;
    }

    private static boolean allSame(List<List<long[]>> bounds) {
        String first = rowsKey(bounds.get(0));
        for (List<long[]> b : bounds) {
            if (!rowsKey(b).equals(first)) {
                return false;
            }
        }
        return true;
    }

    private static String rowsKey(List<long[]> rows) {
        List<String> keys = new ArrayList<String>(rows.size());
        for (long[] r : rows) {
            keys.add(Arrays.toString(r));
        }
        java.util.Collections.sort(keys);
        return keys.toString();
    }

    /**
    * Returns the loop bound: the maximum of the lower bounds of a statement,
    * and over several statements the minimum of those maxima; the other way
    * round for upper bounds.
    */
    private Expression bound(List<List<long[]>> per_piece, boolean same,
            int col, boolean upper) {
        List<Expression> outer = new ArrayList<Expression>();
        List<String> seen = new ArrayList<String>();
        for (List<long[]> rows : per_piece) {
            List<Expression> inner = new ArrayList<Expression>();
            List<String> inner_seen = new ArrayList<String>();
            for (long[] r : rows) {
                Expression e = boundExpression(r, col, upper);
                if (!inner_seen.contains(e.toString())) {
                    inner_seen.add(e.toString());
                    inner.add(e);
                }
            }
            Expression e = (inner.size() == 1) ? inner.get(0) :
                    new MinMaxExpression(upper, inner);
            if (!seen.contains(e.toString())) {
                seen.add(e.toString());
                outer.add(e);
            }
            if (same) {
                break;
            }
        }
        return (outer.size() == 1) ? outer.get(0) :
                new MinMaxExpression(!upper, outer);
    }

    /**
    * Returns the bound on the variable in column col given by a row:
    * {@code a t + f >= 0} gives {@code t >= ceil(-f / a)} and
    * {@code -a t + f >= 0} gives {@code t <= floor(f / a)}.
    */
    private Expression boundExpression(long[] row, int col, boolean upper) {
        long a = Math.abs(row[col]);
        long[] f = row.clone();
        f[col] = 0;
        if (!upper) {
            f = negate(f);
        }
        AffineExpression value = substituteDims(new AffineExpression(f, 1));
        long[] num = value.getCoefficients();
        long den = value.getDenominator();
        // (num / den) / a
        AffineExpression scaled = new AffineExpression(num, den * a);
        return toExpression(scaled.getCoefficients(),
                scaled.getDenominator(), !upper, new ArrayList<String>(0));
    }

    private String iteratorName(List<Piece> pieces, int depth) {
        String name = null;
        for (Piece p : pieces) {
            String n = originalIterator(p, depth);
            if (n == null || (name != null && !name.equals(n))) {
                name = null;
                break;
            }
            name = n;
        }
        if (name != null && isTaken(name, depth)) {
            name = null;
        }
        if (name == null) {
            name = "c" + depth;
            while (isTaken(name, depth)) {
                name = name + "_";
            }
        }
        return name;
    }

    private boolean isTaken(String name, int depth) {
        if (params.contains(name) || reserved.contains(name)) {
            return true;
        }
        for (int d = 0; d < depth; d++) {
            if (name.equals(dim_names[d])) {
                return true;
            }
        }
        return false;
    }

    /**
    * Returns the name of the statement iterator equal to time dimension
    * depth, or null if there is none.
    */
    private static String originalIterator(Piece p, int depth) {
        Space space = p.map.getSpace();
        int col = space.outColumn(depth);
        for (Constraint c : p.map.getConstraints()) {
            long[] r = c.getCoefficients();
            if (!c.isEquality() || (r[col] != 1 && r[col] != -1) ||
                r[0] != 0) {
                continue;
            }
            int in = -1, nonzero = 0;
            for (int k = 1; k < r.length; k++) {
                if (r[k] == 0) {
                    continue;
                }
                nonzero++;
                for (int i = 0; i < space.getNumIn(); i++) {
                    if (k == space.inColumn(i) && r[k] == -r[col]) {
                        in = i;
                    }
                }
            }
            if (nonzero == 2 && in >= 0) {
                return space.getInDimName(in);
            }
        }
        return null;
    }

    private Statement leaf(Piece p) {
        Relation map = Relation.fromBasic(p.map);
        current = UnionRelation.of(map);
        PwMultiAff args = map.reverse().toPwMultiAff();
        List<Expression> exprs = new ArrayList<Expression>();
        for (int k = 0; k < args.getNumOut(); k++) {
            exprs.add(AccessTransformer.expressionFromPwMultiAff(args, k, this));
        }
        FunctionCall call = new FunctionCall(new Identifier(p.name), exprs);
        ExpressionStatement leaf = new ExpressionStatement(call);
        List<Expression> guards = new ArrayList<Expression>();
        for (Constraint c : p.time.getConstraints()) {
            addCondition(guards, c, p.time, p.time.getSpace(),
                    new ArrayList<String>(0));
        }
        if (listener != null) {
            listener.atEachDomain(leaf, this);
        }
        if (guards.isEmpty()) {
            return leaf;
        }
        return new IfStatement(conjunction(guards), leaf);
    }

    /**
    * Adds the condition of a constraint of a set of time stamps unless the
    * enclosing nodes imply it. A constraint with an existential variable
    * must be a divisibility, an equality whose variable occurs nowhere else.
    */
    private void addCondition(List<Expression> conds, Constraint c,
            BasicRelation set, Space space, List<String> extra) {
        long[] r = c.getCoefficients();
        int base = space.getNumColumns();
        int exists = -1, n_exists = 0;
        for (int k = base; k < r.length; k++) {
            if (r[k] != 0) {
                exists = k;
                n_exists++;
            }
        }
        long[] row = toBuildRow(r, space, extra);
        if (n_exists == 0) {
            if (extra.isEmpty() && contextSet().implies(row, c.isEquality())) {
                return;
            }
            AffineExpression a = substituteDims(new AffineExpression(row, 1));
            long[] s = a.getCoefficients();
            if (isConstant(s)) {
                if (c.isEquality() ? s[0] != 0 : s[0] < 0) {
                    conds.add(new IntegerLiteral(0));
                }
                return;
            }
            conds.add(comparison(s, c.isEquality(), extra));
            return;
        }
        if (!c.isEquality() || n_exists > 1 || occursElsewhere(set, c, exists)) {
            throw new UnsupportedInput("cannot express " + c + " of " + set);
        }
        long m = Math.abs(r[exists]);
        AffineExpression a = substituteDims(new AffineExpression(row, 1));
        long[] s = a.getCoefficients();
        boolean divisible = true;
        for (long v : s) {
            divisible &= (v % m == 0);
        }
        if (divisible) {
            return;
        }
        if (firstTermNegative(s)) {
            s = negate(s);
        }
        Expression rest = toExpression(s, 1, false, extra);
        if (rest instanceof BinaryExpression || rest instanceof UnaryExpression) {
            rest.setParens(true);
        }
        conds.add(new BinaryExpression(
                new BinaryExpression(rest, BinaryOperator.MODULUS,
                        new IntegerLiteral(m)),
                BinaryOperator.COMPARE_EQ, new IntegerLiteral(0)));
    }

    private static boolean occursElsewhere(BasicRelation set, Constraint c,
            int col) {
        for (Constraint other : set.getConstraints()) {
            if (other != c && other.getCoefficients()[col] != 0 &&
                !Arrays.equals(other.getCoefficients(), c.getCoefficients())) {
                return true;
            }
        }
        return false;
    }

    private boolean firstTermNegative(long[] row) {
        for (int col : termOrder(row.length)) {
            if (row[col] != 0) {
                return row[col] < 0;
            }
        }
        return row[0] < 0;
    }

    /**
    * Prints {@code row >= 0} or {@code row = 0} with the positive terms on
    * the left and the negative ones on the right, e.g. {@code N >= c0 + 1}.
    */
    private Expression comparison(long[] row, boolean equality,
            List<String> extra) {
        long[] pos = new long[row.length];
        long[] neg = new long[row.length];
        for (int k = 0; k < row.length; k++) {
            if (row[k] > 0) {
                pos[k] = row[k];
            } else {
                neg[k] = -row[k];
            }
        }
        return new BinaryExpression(toExpression(pos, 1, false, extra),
                equality ? BinaryOperator.COMPARE_EQ : BinaryOperator.COMPARE_GE,
                toExpression(neg, 1, false, extra));
    }

    private static Expression conjunction(List<Expression> conds) {
        if (conds.isEmpty()) {
            return new IntegerLiteral(1);
        }
        Expression ret = conds.get(0);
        for (int i = 1; i < conds.size(); i++) {
            ret = new BinaryExpression(ret, BinaryOperator.LOGICAL_AND,
                    conds.get(i));
        }
        return ret;
    }

    /**
    * Prints {@code row / den}, rounded down, or up if <var>ceil</var> is
    * set. Terms are printed iterators first, then parameters, then the
    * constant.
    */
    private Expression toExpression(long[] row, long den, boolean ceil,
            List<String> extra) {
        long[] c = row.clone();
        if (ceil && den > 1) {
            c[0] += den - 1;
        }
        Expression e = null;
        for (int col : termOrder(c.length)) {
            long v = c[col];
            if (v == 0) {
                continue;
            }
            Expression id = new Identifier(columnName(col, extra));
            if (e == null) {
                if (v == 1) {
                    e = id;
                } else if (v == -1) {
                    e = new UnaryExpression(UnaryOperator.MINUS, id);
                } else {
                    e = new BinaryExpression(new IntegerLiteral(v),
                            BinaryOperator.MULTIPLY, id);
                }
            } else {
                long a = Math.abs(v);
                Expression term = (a == 1) ? id : new BinaryExpression(
                        new IntegerLiteral(a), BinaryOperator.MULTIPLY, id);
                e = new BinaryExpression(e, (v > 0) ?
                        BinaryOperator.ADD : BinaryOperator.SUBTRACT, term);
            }
        }
        if (c[0] != 0) {
            if (e == null) {
                e = new IntegerLiteral(c[0]);
            } else {
                e = new BinaryExpression(e, (c[0] > 0) ? BinaryOperator.ADD :
                        BinaryOperator.SUBTRACT,
                        new IntegerLiteral(Math.abs(c[0])));
            }
        }
        if (e == null) {
            e = new IntegerLiteral(0);
        }
        if (den > 1) {
            e = new FunctionCall(new Identifier("floord"), e,
                    new IntegerLiteral(den));
        }
        return e;
    }

    // Time columns, then the build parameters, then the other parameters.
    private int[] termOrder(int width) {
        int[] ret = new int[width - 1];
        int n = 0;
        for (int d = 0; d < n_time; d++) {
            ret[n++] = timeColumn(d);
        }
        for (int i = 0; i < params.size(); i++) {
            ret[n++] = 1 + i;
        }
        for (int k = timeWidth(); k < width; k++) {
            ret[n++] = k;
        }
        return ret;
    }

    private String columnName(int col, List<String> extra) {
        if (col <= params.size()) {
            return params.get(col - 1);
        }
        if (col >= timeWidth()) {
            return extra.get(col - timeWidth());
        }
        int d = col - 1 - params.size();
        if (dim_names[d] == null) {
            throw new IllegalStateException(
                    "time dimension " + d + " has no iterator");
        }
        return dim_names[d];
    }

    // Parameters of the space that are not parameters of the build.
    private List<String> extraParams(Space space) {
        List<String> extra = new ArrayList<String>();
        for (String p : space.getParams()) {
            if (!params.contains(p)) {
                extra.add(p);
            }
        }
        return extra;
    }

    /**
    * Moves the columns {@code [1 | params | dims]} of a row of the given
    * space to the layout {@code [1 | P | T | extra]} of the build.
    */
    private long[] toBuildRow(long[] row, Space space, List<String> extra) {
        long[] ret = new long[timeWidth() + extra.size()];
        ret[0] = row[0];
        List<String> names = space.getParams();
        for (int i = 0; i < names.size(); i++) {
            int pos = params.indexOf(names.get(i));
            int col = (pos >= 0) ? 1 + pos :
                    timeWidth() + extra.indexOf(names.get(i));
            ret[col] += row[1 + i];
        }
        int n_dims = space.isSet() ? space.getNumOut() : space.getNumIn();
        if (n_dims > n_time) {
            throw new IllegalArgumentException(
                    n_dims + " dimensions in a build of " + n_time);
        }
        for (int d = 0; d < n_dims; d++) {
            ret[timeColumn(d)] += row[1 + names.size() + d];
        }
        return ret;
    }

    // Replaces the dimensions without loop by their values.
    private AffineExpression substituteDims(AffineExpression a) {
        for (int d = n_time - 1; d >= 0; d--) {
            if (dim_values[d] != null && a.involves(timeColumn(d))) {
                a = a.substitute(timeColumn(d), new AffineExpression(
                        widen(dim_values[d].getCoefficients(),
                                a.getNumColumns()), 1));
            }
        }
        return a;
    }

    private UnionRelation prefixSchedule(List<Piece> pieces, int depth) {
        UnionRelation ret = UnionRelation.empty();
        for (Piece p : pieces) {
            ret = ret.add(Relation.fromBasic(p.map).truncateOutputs(depth + 1));
        }
        return ret;
    }

    private BasicRelation contextSet() {
        BasicRelation b =
                BasicRelation.universe(Space.setSpace(params, null, n_time));
        for (long[] r : ctx_eqs) {
            b = b.addEquality(r);
        }
        for (long[] r : ctx_ineqs) {
            b = b.addInequality(r);
        }
        return b;
    }

    private static Statement block(List<Statement> stmts) {
        if (stmts.size() == 1) {
            return stmts.get(0);
        }
        CompoundStatement ret = new CompoundStatement();
        for (Statement s : stmts) {
            ret.addStatement(s);
        }
        return ret;
    }

    private int timeColumn(int d) {
        return 1 + params.size() + d;
    }

    private int timeWidth() {
        return 1 + params.size() + n_time;
    }

    private static long[] widen(long[] row, int width) {
        return Arrays.copyOf(row, width);
    }

    private static long[] negate(long[] row) {
        long[] ret = new long[row.length];
        for (int k = 0; k < row.length; k++) {
            ret[k] = -row[k];
        }
        return ret;
    }

    private static boolean isConstant(long[] row) {
        for (int k = 1; k < row.length; k++) {
            if (row[k] != 0) {
                return false;
            }
        }
        return true;
    }

    private static void truncate(List<long[]> rows, int size) {
        while (rows.size() > size) {
            rows.remove(rows.size() - 1);
        }
    }

}
