package polyc.poly;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
* A conjunction of integer affine constraints over a {@link Space}, with
* optional existentially quantified variables. The constraint columns are
* laid out as {@code [1 | params | in | out | exists]}.
* <p>
* Basic relations are immutable: every operation returns a fresh value.
*/
public final class BasicRelation {

    private final Space space;
    private final int n_exists;
    private final List<long[]> eqs;
    private final List<long[]> ineqs;

    /**
    * Creates a basic relation; the rows become owned by the new object and
    * must not be changed afterwards.
    */
    BasicRelation(Space space, int n_exists,
            List<long[]> eqs, List<long[]> ineqs) {
        this.space = space;
        this.n_exists = n_exists;
        this.eqs = eqs;
        this.ineqs = ineqs;
        int width = space.getNumColumns() + n_exists;
        for (long[] r : eqs) {
            checkWidth(r, width);
        }
        for (long[] r : ineqs) {
            checkWidth(r, width);
        }
    }

    private static void checkWidth(long[] row, int width) {
        if (row.length != width) {
            throw new IllegalArgumentException("constraint has " +
                    row.length + " columns, expected " + width);
        }
    }

    /** Returns the relation without constraints over the given space. */
    public static BasicRelation universe(Space space) {
        return new BasicRelation(space, 0,
                new ArrayList<long[]>(0), new ArrayList<long[]>(0));
    }

    /** Returns an empty relation over the given space. */
    public static BasicRelation empty(Space space) {
        List<long[]> ineqs = new ArrayList<long[]>(1);
        long[] row = new long[space.getNumColumns()];
        row[0] = -1;
        ineqs.add(row);
        return new BasicRelation(space, 0, new ArrayList<long[]>(0), ineqs);
    }

    public Space getSpace() {
        return space;
    }

    public int getNumExists() {
        return n_exists;
    }

    /** Returns the number of constraint columns, existentials included. */
    public int getNumColumns() {
        return space.getNumColumns() + n_exists;
    }

    /** Returns the column of the <var>i</var>th existential variable. */
    public int existsColumn(int i) {
        return space.getNumColumns() + i;
    }

    /** Returns the constraints, equalities first. */
    public List<Constraint> getConstraints() {
        List<Constraint> ret = new ArrayList<Constraint>(
                eqs.size() + ineqs.size());
        for (long[] r : eqs) {
            ret.add(new Constraint(r, true));
        }
        for (long[] r : ineqs) {
            ret.add(new Constraint(r, false));
        }
        return ret;
    }

    List<long[]> equalities() {
        return Collections.unmodifiableList(eqs);
    }

    List<long[]> inequalities() {
        return Collections.unmodifiableList(ineqs);
    }

    /** Returns this relation with one more constraint. */
    public BasicRelation addConstraint(Constraint c) {
        checkWidth(c.getCoefficients(), getNumColumns());
        List<long[]> new_eqs = Rows.copy(eqs);
        List<long[]> new_ineqs = Rows.copy(ineqs);
        if (c.isEquality()) {
            new_eqs.add(c.getCoefficients());
        } else {
            new_ineqs.add(c.getCoefficients());
        }
        return new BasicRelation(space, n_exists, new_eqs, new_ineqs);
    }

    /** Returns this relation with the equality {@code row . x = 0} added. */
    public BasicRelation addEquality(long[] row) {
        return addConstraint(new Constraint(row, true));
    }

    /** Returns this relation with the inequality {@code row . x >= 0} added. */
    public BasicRelation addInequality(long[] row) {
        return addConstraint(new Constraint(row, false));
    }

    /**
    * Moves every column to a new layout.
    *
    * @param target the new space.
    * @param target_exists the number of existentials of the result.
    * @param map the new column of each old column.
    */
    BasicRelation remap(Space target, int target_exists, int[] map) {
        int width = target.getNumColumns() + target_exists;
        List<long[]> new_eqs = new ArrayList<long[]>(eqs.size());
        List<long[]> new_ineqs = new ArrayList<long[]>(ineqs.size());
        for (long[] r : eqs) {
            new_eqs.add(Rows.remap(r, map, width));
        }
        for (long[] r : ineqs) {
            new_ineqs.add(Rows.remap(r, map, width));
        }
        return new BasicRelation(target, target_exists, new_eqs, new_ineqs);
    }

    /**
    * Returns this relation over the given parameter list, which must contain
    * every parameter of this relation.
    */
    public BasicRelation alignParams(List<String> params) {
        if (params.equals(space.getParams())) {
            return this;
        }
        List<String> mine = space.getParams();
        int[] map = new int[getNumColumns()];
        map[0] = 0;
        for (int i = 0; i < mine.size(); i++) {
            int pos = params.indexOf(mine.get(i));
            if (pos < 0) {
                throw new IllegalArgumentException(
                        "parameter " + mine.get(i) + " is not in " + params);
            }
            map[1 + i] = 1 + pos;
        }
        int shift = params.size() - mine.size();
        for (int k = 1 + mine.size(); k < map.length; k++) {
            map[k] = k + shift;
        }
        return remap(space.withParams(params), n_exists, map);
    }

    /**
    * Returns the intersection with a relation of the same tuples.
    */
    public BasicRelation intersect(BasicRelation other) {
        if (!space.tuplesMatch(other.space)) {
            throw new IllegalArgumentException(
                    "spaces do not match: " + space + " and " + other.space);
        }
        List<String> params = space.mergeParams(other.space);
        BasicRelation a = alignParams(params);
        BasicRelation b = other.alignParams(params);
        int base = a.space.getNumColumns();
        int n = a.n_exists + b.n_exists;
        int[] map_a = identityMap(a.getNumColumns());
        int[] map_b = new int[b.getNumColumns()];
        for (int k = 0; k < map_b.length; k++) {
            map_b[k] = (k < base) ? k : k + a.n_exists;
        }
        return join(a.remap(a.space, n, map_a), b.remap(a.space, n, map_b));
    }

    /**
    * Returns the intersection of the input tuple with a set.
    */
    public BasicRelation intersectDomain(BasicRelation set) {
        if (space.isSet() || !space.domainMatches(set.space)) {
            throw new IllegalArgumentException(
                    "domain mismatch: " + space + " and " + set.space);
        }
        return intersectTuple(set, true);
    }

    /**
    * Returns the intersection of the output tuple with a set.
    */
    public BasicRelation intersectRange(BasicRelation set) {
        if (set.space.getNumOut() != space.getNumOut()) {
            throw new IllegalArgumentException(
                    "range mismatch: " + space + " and " + set.space);
        }
        return intersectTuple(set, false);
    }

    /**
    * Returns the intersection with a parameter domain.
    */
    public BasicRelation intersectParams(BasicRelation params_set) {
        if (params_set.space.getNumOut() != 0 ||
            params_set.space.getNumIn() != 0) {
            throw new IllegalArgumentException(
                    "not a parameter domain: " + params_set.space);
        }
        return intersectTuple(params_set, false);
    }

    private BasicRelation intersectTuple(BasicRelation set, boolean domain) {
        List<String> params = space.mergeParams(set.space);
        BasicRelation a = alignParams(params);
        BasicRelation b = set.alignParams(params);
        int np = params.size();
        int n = a.n_exists + b.n_exists;
        int[] map_a = identityMap(a.getNumColumns());
        int[] map_b = new int[b.getNumColumns()];
        for (int k = 0; k <= np; k++) {
            map_b[k] = k;
        }
        int first = domain ? a.space.inColumn(0) : a.space.outColumn(0);
        for (int i = 0; i < b.space.getNumOut(); i++) {
            map_b[b.space.outColumn(i)] = first + i;
        }
        for (int i = 0; i < b.n_exists; i++) {
            map_b[b.existsColumn(i)] = a.space.getNumColumns() + a.n_exists + i;
        }
        return join(a.remap(a.space, n, map_a), b.remap(a.space, n, map_b));
    }

    private static BasicRelation join(BasicRelation a, BasicRelation b) {
        List<long[]> new_eqs = Rows.copy(a.eqs);
        new_eqs.addAll(Rows.copy(b.eqs));
        List<long[]> new_ineqs = Rows.copy(a.ineqs);
        new_ineqs.addAll(Rows.copy(b.ineqs));
        return new BasicRelation(a.space, a.n_exists, new_eqs, new_ineqs);
    }

    private static int[] identityMap(int n) {
        int[] map = new int[n];
        for (int k = 0; k < n; k++) {
            map[k] = k;
        }
        return map;
    }

    /** Returns the relation with input and output swapped. */
    public BasicRelation reverse() {
        Space target = space.reverse();
        int[] map = identityMap(getNumColumns());
        for (int i = 0; i < space.getNumIn(); i++) {
            map[space.inColumn(i)] = target.outColumn(i);
        }
        for (int i = 0; i < space.getNumOut(); i++) {
            map[space.outColumn(i)] = target.inColumn(i);
        }
        return remap(target, n_exists, map);
    }

    /**
    * Composes this relation X -&gt; Y with <var>next</var> Y -&gt; Z into
    * X -&gt; Z; for a set Y the result is the image set Z. The Y variables
    * become existentials.
    */
    public BasicRelation applyRange(BasicRelation next) {
        if (next.space.isSet() || !space.rangeMatchesDomainOf(next.space)) {
            throw new IllegalArgumentException(
                    "cannot compose " + space + " with " + next.space);
        }
        List<String> params = space.mergeParams(next.space);
        BasicRelation a = alignParams(params);
        BasicRelation b = next.alignParams(params);
        Space target;
        if (space.isSet()) {
            target = b.space.range();
        } else {
            target = Space.mapSpace(params,
                    space.getInName(), space.getInDimNames(),
                    next.space.getOutName(), next.space.getOutDimNames());
        }
        int ny = a.space.getNumOut();
        int n = a.n_exists + b.n_exists + ny;
        int base = target.getNumColumns();
        int y_base = base + a.n_exists + b.n_exists;
        int np = params.size();
        int[] map_a = new int[a.getNumColumns()];
        for (int k = 0; k <= np; k++) {
            map_a[k] = k;
        }
        for (int i = 0; i < a.space.getNumIn(); i++) {
            map_a[a.space.inColumn(i)] = target.inColumn(i);
        }
        for (int i = 0; i < ny; i++) {
            map_a[a.space.outColumn(i)] = y_base + i;
        }
        for (int i = 0; i < a.n_exists; i++) {
            map_a[a.existsColumn(i)] = base + i;
        }
        int[] map_b = new int[b.getNumColumns()];
        for (int k = 0; k <= np; k++) {
            map_b[k] = k;
        }
        for (int i = 0; i < ny; i++) {
            map_b[b.space.inColumn(i)] = y_base + i;
        }
        for (int i = 0; i < b.space.getNumOut(); i++) {
            map_b[b.space.outColumn(i)] = target.outColumn(i);
        }
        for (int i = 0; i < b.n_exists; i++) {
            map_b[b.existsColumn(i)] = base + a.n_exists + i;
        }
        return join(a.remap(target, n, map_a), b.remap(target, n, map_b))
                .simplify();
    }

    /**
    * Returns this relation with input <var>in_pos</var> equal to output
    * <var>out_pos</var>.
    */
    public BasicRelation equate(int in_pos, int out_pos) {
        long[] row = new long[getNumColumns()];
        row[space.inColumn(in_pos)] = 1;
        row[space.outColumn(out_pos)] = -1;
        return addEquality(row);
    }

    /** Returns the set of inputs; the outputs become existentials. */
    public BasicRelation domain() {
        Space target = space.domain();
        int n_out = space.getNumOut();
        int[] map = new int[getNumColumns()];
        int np = space.getNumParams();
        for (int k = 0; k <= np; k++) {
            map[k] = k;
        }
        if (space.isSet()) {
            for (int i = 0; i < n_out; i++) {
                map[space.outColumn(i)] = target.getNumColumns() + i;
            }
        } else {
            for (int i = 0; i < space.getNumIn(); i++) {
                map[space.inColumn(i)] = target.outColumn(i);
            }
            for (int i = 0; i < n_out; i++) {
                map[space.outColumn(i)] = target.getNumColumns() + i;
            }
        }
        for (int i = 0; i < n_exists; i++) {
            map[existsColumn(i)] = target.getNumColumns() + n_out + i;
        }
        return remap(target, n_out + n_exists, map).simplify();
    }

    /** Returns the set of outputs; the inputs become existentials. */
    public BasicRelation range() {
        if (space.isSet()) {
            return this;
        }
        Space target = space.range();
        int n_in = space.getNumIn();
        int[] map = new int[getNumColumns()];
        int np = space.getNumParams();
        for (int k = 0; k <= np; k++) {
            map[k] = k;
        }
        for (int i = 0; i < n_in; i++) {
            map[space.inColumn(i)] = target.getNumColumns() + i;
        }
        for (int i = 0; i < space.getNumOut(); i++) {
            map[space.outColumn(i)] = target.outColumn(i);
        }
        for (int i = 0; i < n_exists; i++) {
            map[existsColumn(i)] = target.getNumColumns() + n_in + i;
        }
        return remap(target, n_in + n_exists, map).simplify();
    }

    /**
    * Keeps the first <var>n</var> output dimensions; the others become
    * existentials.
    */
    public BasicRelation truncateOutputs(int n) {
        int n_out = space.getNumOut();
        if (n >= n_out) {
            return this;
        }
        Space target = space.withNumOut(n);
        int dropped = n_out - n;
        int[] map = identityMap(getNumColumns());
        for (int i = n; i < n_out; i++) {
            map[space.outColumn(i)] = target.getNumColumns() + (i - n);
        }
        for (int i = 0; i < n_exists; i++) {
            map[existsColumn(i)] = target.getNumColumns() + dropped + i;
        }
        return remap(target, dropped + n_exists, map).simplify();
    }

    /**
    * Appends output dimensions fixed to zero until there are <var>n</var>.
    */
    public BasicRelation padOutputs(int n) {
        int n_out = space.getNumOut();
        if (n <= n_out) {
            return this;
        }
        Space target = space.withNumOut(n);
        int[] map = identityMap(getNumColumns());
        for (int i = 0; i < n_exists; i++) {
            map[existsColumn(i)] = target.getNumColumns() + i;
        }
        BasicRelation ret = remap(target, n_exists, map);
        List<long[]> new_eqs = Rows.copy(ret.eqs);
        for (int i = n_out; i < n; i++) {
            long[] row = new long[ret.getNumColumns()];
            row[target.outColumn(i)] = 1;
            new_eqs.add(row);
        }
        return new BasicRelation(target, n_exists, new_eqs, Rows.copy(ret.ineqs));
    }

    /**
    * Projects out the set dimensions from <var>first</var> on and all
    * existentials by Fourier-Motzkin elimination over the rationals. Every
    * integer point of this set maps to an integer point of the result; the
    * converse need not hold, so the result may be larger than the exact
    * integer projection.
    *
    * @param first the number of leading set dimensions to keep.
    * @return a set with <var>first</var> dimensions and no existentials.
    */
    public BasicRelation projectOutRational(int first) {
        if (!space.isSet() || first > space.getNumOut()) {
            throw new IllegalArgumentException(
                    "cannot keep " + first + " dimensions of " + space);
        }
        Space target = space.withNumOut(first);
        int keep = target.getNumColumns();
        List<long[]> e = Rows.copy(eqs);
        List<long[]> in = Rows.copy(ineqs);
        for (int col = getNumColumns() - 1; col >= keep; col--) {
            int pivot = -1;
            for (int r = 0; r < e.size(); r++) {
                long c = e.get(r)[col];
                if (c != 0 && (pivot == -1 ||
                               Math.abs(c) < Math.abs(e.get(pivot)[col]))) {
                    pivot = r;
                }
            }
            if (pivot != -1) {
                long[] eq = e.remove(pivot);
                for (int r = 0; r < e.size(); r++) {
                    e.set(r, Rows.eliminate(e.get(r), eq, col));
                }
                for (int r = 0; r < in.size(); r++) {
                    in.set(r, Rows.eliminate(in.get(r), eq, col));
                }
            } else {
                List<long[]> next = new ArrayList<long[]>();
                for (long[] r : in) {
                    if (r[col] == 0) {
                        next.add(r);
                    }
                }
                for (long[] lo : in) {
                    if (lo[col] <= 0) {
                        continue;
                    }
                    for (long[] up : in) {
                        if (up[col] < 0) {
                            next.add(Rows.combine(-up[col], lo, lo[col], up));
                        }
                    }
                }
                in = next;
            }
            List<long[]> e2 = new ArrayList<long[]>(e.size());
            List<long[]> in2 = new ArrayList<long[]>(in.size());
            if (!normalize(e, in, e2, in2)) {
                return empty(target);
            }
            e = e2;
            in = in2;
        }
        List<long[]> new_eqs = new ArrayList<long[]>(e.size());
        List<long[]> new_ineqs = new ArrayList<long[]>(in.size());
        for (long[] r : e) {
            new_eqs.add(Arrays.copyOf(r, keep));
        }
        for (long[] r : in) {
            new_ineqs.add(Arrays.copyOf(r, keep));
        }
        return new BasicRelation(target, 0, new_eqs, new_ineqs);
    }

    /** Checks if the relation holds no integer point. */
    public boolean isEmpty() {
        return !OmegaTest.isFeasible(eqs, ineqs);
    }

    /**
    * Checks if every point of this relation satisfies the constraint
    * {@code row . x = 0} (<var>equality</var>) or {@code row . x >= 0}.
    */
    public boolean implies(long[] row, boolean equality) {
        checkWidth(row, getNumColumns());
        long[] negated = Rows.negate(row);
        negated[0] -= 1;
        if (!addInequality(negated).isEmpty()) {
            return false;
        }
        if (equality) {
            long[] above = row.clone();
            above[0] -= 1;
            return addInequality(above).isEmpty();
        }
        return true;
    }

    /**
    * Returns an equivalent relation in a simpler form: rows are normalized,
    * duplicates dropped, existentials defined by an equality with a unit
    * coefficient substituted away, and existentials of an equality with a
    * larger coefficient confined to that single equality, which then states
    * a divisibility. Trivially false relations become {@link #empty}.
    */
    public BasicRelation simplify() {
        List<long[]> e = new ArrayList<long[]>(eqs.size());
        List<long[]> in = new ArrayList<long[]>(ineqs.size());
        if (!normalize(eqs, ineqs, e, in)) {
            return empty(space);
        }
        int base = space.getNumColumns();
        int width = getNumColumns();
        boolean[] removed = new boolean[n_exists];
        // Unit substitutions first, then scaled ones.
        for (int pass = 0; pass < 2; pass++) {
            for (int x = 0; x < n_exists; x++) {
                int col = base + x;
                if (removed[x]) {
                    continue;
                }
                int pivot = -1;
                for (int r = 0; r < e.size(); r++) {
                    long c = e.get(r)[col];
                    if (c != 0 && (pass == 1 || c == 1 || c == -1)) {
                        if (pivot == -1 ||
                            Math.abs(c) < Math.abs(e.get(pivot)[col])) {
                            pivot = r;
                        }
                    }
                }
                if (pivot == -1) {
                    continue;
                }
                long[] eq = e.get(pivot);
                for (int r = 0; r < e.size(); r++) {
                    if (r != pivot) {
                        e.set(r, Rows.eliminate(e.get(r), eq, col));
                    }
                }
                for (int r = 0; r < in.size(); r++) {
                    in.set(r, Rows.eliminate(in.get(r), eq, col));
                }
                if (Math.abs(eq[col]) == 1) {
                    e.remove(pivot);
                    removed[x] = true;
                }
                List<long[]> e2 = new ArrayList<long[]>(e.size());
                List<long[]> in2 = new ArrayList<long[]>(in.size());
                if (!normalize(e, in, e2, in2)) {
                    return empty(space);
                }
                e = e2;
                in = in2;
            }
        }
        // Existentials bounded on one side only, or with unit coefficients
        // on one side, are projected out exactly.
        for (int x = 0; x < n_exists; x++) {
            int col = base + x;
            if (removed[x] || appears(e, col)) {
                continue;
            }
            boolean unit_lower = true, unit_upper = true;
            int lowers = 0, uppers = 0;
            for (long[] r : in) {
                if (r[col] > 0) {
                    lowers++;
                    unit_lower &= (r[col] == 1);
                } else if (r[col] < 0) {
                    uppers++;
                    unit_upper &= (r[col] == -1);
                }
            }
            if (lowers == 0 || uppers == 0 || unit_lower || unit_upper) {
                List<long[]> next = new ArrayList<long[]>();
                for (long[] r : in) {
                    if (r[col] == 0) {
                        next.add(r);
                    }
                }
                if (lowers > 0 && uppers > 0) {
                    for (long[] lo : in) {
                        if (lo[col] <= 0) {
                            continue;
                        }
                        for (long[] up : in) {
                            if (up[col] < 0) {
                                next.add(Rows.combine(-up[col], lo, lo[col], up));
                            }
                        }
                    }
                }
                List<long[]> e2 = new ArrayList<long[]>(e.size());
                List<long[]> in2 = new ArrayList<long[]>(next.size());
                if (!normalize(e, next, e2, in2)) {
                    return empty(space);
                }
                e = e2;
                in = in2;
            }
            if (!appears(in, col)) {
                removed[x] = true;
            }
        }
        // Compact the existential columns.
        int kept = 0;
        int[] map = new int[width];
        for (int k = 0; k < base; k++) {
            map[k] = k;
        }
        for (int x = 0; x < n_exists; x++) {
            if (!removed[x] && (appears(e, base + x) || appears(in, base + x))) {
                map[base + x] = base + kept;
                kept++;
            } else {
                map[base + x] = 0;
            }
        }
        int new_width = base + kept;
        List<long[]> new_eqs = new ArrayList<long[]>(e.size());
        List<long[]> new_ineqs = new ArrayList<long[]>(in.size());
        for (long[] r : e) {
            new_eqs.add(compact(r, map, base, new_width));
        }
        for (long[] r : in) {
            new_ineqs.add(compact(r, map, base, new_width));
        }
        return new BasicRelation(space, kept, new_eqs, new_ineqs);
    }

    private static long[] compact(long[] row, int[] map, int base, int width) {
        long[] ret = new long[width];
        for (int k = 0; k < row.length; k++) {
            if (k < base) {
                ret[k] = row[k];
            } else if (row[k] != 0) {
                ret[map[k]] = row[k];
            }
        }
        return ret;
    }

    private static boolean appears(List<long[]> rows, int col) {
        for (long[] r : rows) {
            if (r[col] != 0) {
                return true;
            }
        }
        return false;
    }

    /**
    * Normalizes rows into the output lists, dropping duplicates and trivial
    * rows, and turning opposite inequalities that meet into equalities.
    *
    * @return false if a row is trivially violated.
    */
    private static boolean normalize(List<long[]> eqs, List<long[]> ineqs,
            List<long[]> out_eqs, List<long[]> out_ineqs) {
        for (long[] r : eqs) {
            long[] n = Rows.normalizeEquality(r);
            if (n == null) {
                return false;
            }
            if (Rows.isConstant(n)) {
                continue;
            }
            if (!Rows.contains(out_eqs, n)) {
                out_eqs.add(n);
            }
        }
        for (long[] r : ineqs) {
            long[] n = Rows.normalizeInequality(r);
            if (Rows.isConstant(n)) {
                if (n[0] < 0) {
                    return false;
                }
                continue;
            }
            boolean merged = false;
            for (int i = 0; i < out_ineqs.size() && !merged; i++) {
                long[] s = out_ineqs.get(i);
                if (Rows.sameCoefficients(n, s)) {
                    if (n[0] < s[0]) {
                        out_ineqs.set(i, n);
                    }
                    merged = true;
                }
            }
            if (!merged) {
                out_ineqs.add(n);
            }
        }
        for (int i = 0; i < out_ineqs.size(); i++) {
            for (int j = i + 1; j < out_ineqs.size(); j++) {
                long[] a = out_ineqs.get(i);
                long[] b = out_ineqs.get(j);
                if (Rows.oppositeCoefficients(a, b)) {
                    long sum = Rows.add(a[0], b[0]);
                    if (sum < 0) {
                        return false;
                    }
                    if (sum == 0) {
                        long[] n = Rows.normalizeEquality(a);
                        if (!Rows.contains(out_eqs, n)) {
                            out_eqs.add(n);
                        }
                        out_ineqs.remove(j);
                        out_ineqs.remove(i);
                        i--;
                        break;
                    }
                }
            }
        }
        // Inequalities implied by an equality with the same coefficients.
        List<long[]> rest = new ArrayList<long[]>(out_ineqs.size());
        for (long[] r : out_ineqs) {
            boolean implied = false;
            for (long[] eq : out_eqs) {
                if (Rows.sameCoefficients(r, eq) && r[0] >= eq[0]) {
                    implied = true;
                } else if (Rows.oppositeCoefficients(r, eq) && r[0] >= -eq[0]) {
                    implied = true;
                }
            }
            if (!implied) {
                rest.add(r);
            }
        }
        out_ineqs.clear();
        out_ineqs.addAll(rest);
        return true;
    }

    /**
    * Returns the names used for the columns when printing.
    */
    String[] columnNames() {
        String[] names = new String[getNumColumns()];
        names[0] = "";
        List<String> params = space.getParams();
        for (int i = 0; i < params.size(); i++) {
            names[space.paramColumn(i)] = params.get(i);
        }
        for (int i = 0; i < space.getNumIn(); i++) {
            String d = space.getInDimName(i);
            names[space.inColumn(i)] = (d == null) ? "i" + i : d;
        }
        for (int i = 0; i < space.getNumOut(); i++) {
            String d = space.getOutDimName(i);
            names[space.outColumn(i)] =
                    (d == null) ? (space.isSet() ? "i" : "o") + i : d;
        }
        for (int i = 0; i < n_exists; i++) {
            names[existsColumn(i)] = "e" + i;
        }
        return names;
    }

    /** Prints the constraints as an isl-like conjunction. */
    String constraintsString() {
        String[] names = columnNames();
        StringBuilder sb = new StringBuilder(80);
        for (long[] r : eqs) {
            if (sb.length() > 0) {
                sb.append(" and ");
            }
            sb.append(formatRow(r, names, " = "));
        }
        for (long[] r : ineqs) {
            if (sb.length() > 0) {
                sb.append(" and ");
            }
            sb.append(formatRow(r, names, " >= "));
        }
        if (n_exists > 0 && sb.length() > 0) {
            StringBuilder ex = new StringBuilder("exists (");
            for (int i = 0; i < n_exists; i++) {
                ex.append(i > 0 ? ", " : "").append("e").append(i);
            }
            ex.append(" : ").append(sb).append(")");
            return ex.toString();
        }
        return sb.toString();
    }

    static String formatRow(long[] row, String[] names, String op) {
        StringBuilder lhs = new StringBuilder();
        StringBuilder rhs = new StringBuilder();
        for (int k = 1; k < row.length; k++) {
            if (row[k] > 0) {
                appendTerm(lhs, row[k], names[k]);
            } else if (row[k] < 0) {
                appendTerm(rhs, -row[k], names[k]);
            }
        }
        if (row[0] > 0) {
            appendTerm(lhs, row[0], null);
        } else if (row[0] < 0) {
            appendTerm(rhs, -row[0], null);
        }
        if (lhs.length() == 0) {
            lhs.append("0");
        }
        if (rhs.length() == 0) {
            rhs.append("0");
        }
        return lhs + op + rhs;
    }

    private static void appendTerm(StringBuilder sb, long c, String name) {
        if (sb.length() > 0) {
            sb.append(" + ");
        }
        if (name == null) {
            sb.append(c);
        } else if (c == 1) {
            sb.append(name);
        } else {
            sb.append(c).append(name);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BasicRelation)) {
            return false;
        }
        BasicRelation other = (BasicRelation)o;
        return (space.equals(other.space) && n_exists == other.n_exists &&
                sameRows(eqs, other.eqs) && sameRows(ineqs, other.ineqs));
    }

    private static boolean sameRows(List<long[]> a, List<long[]> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!Arrays.equals(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return space.hashCode() * 31 + eqs.size() * 7 + ineqs.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(80);
        if (space.getNumParams() > 0) {
            sb.append(space.getParams()).append(" -> ");
        }
        sb.append("{ ");
        sb.append(tupleString());
        String c = constraintsString();
        if (c.length() > 0) {
            sb.append(" : ").append(c);
        }
        sb.append(" }");
        return sb.toString();
    }

    String tupleString() {
        String[] names = columnNames();
        StringBuilder sb = new StringBuilder(32);
        if (!space.isSet()) {
            appendTuple(sb, space.getInName(), names,
                    space.inColumn(0), space.getNumIn());
            sb.append(" -> ");
        }
        appendTuple(sb, space.getOutName(), names,
                space.outColumn(0), space.getNumOut());
        return sb.toString();
    }

    private static void appendTuple(StringBuilder sb, String name,
            String[] names, int first, int n) {
        if (name != null) {
            sb.append(name);
        }
        sb.append("[");
        for (int i = 0; i < n; i++) {
            sb.append(i > 0 ? ", " : "").append(names[first + i]);
        }
        sb.append("]");
    }

}
