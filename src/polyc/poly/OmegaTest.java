package polyc.poly;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
* Exact integer feasibility of a conjunction of affine equalities and
* inequalities, after Pugh's Omega test. Equalities are removed first by
* unimodular changes of variables; inequalities are then eliminated one
* variable at a time, exactly when a unit coefficient allows it and otherwise
* through the real shadow, the dark shadow and the splinters.
* <p>
* All variables are integer and unbounded; rows follow the layout of
* {@link Rows}.
*/
public final class OmegaTest {

    private OmegaTest() {
    }

    /**
    * Checks if the system has an integer solution.
    *
    * @param eqs the equality rows.
    * @param ineqs the inequality rows.
    * @return true if some integer point satisfies every row.
    */
    public static boolean isFeasible(List<long[]> eqs, List<long[]> ineqs) {
        return feasible(Rows.copy(eqs), Rows.copy(ineqs));
    }

    private static boolean feasible(List<long[]> eqs, List<long[]> ineqs) {
        if (!eliminateEqualities(eqs, ineqs)) {
            return false;
        }
        while (true) {
            List<long[]> normalized = new ArrayList<long[]>(ineqs.size());
            for (long[] row : ineqs) {
                long[] r = Rows.normalizeInequality(row);
                if (Rows.isConstant(r)) {
                    if (r[0] < 0) {
                        return false;
                    }
                    continue;
                }
                normalized.add(r);
            }
            ineqs = normalized;
            // Tightest of parallel rows; opposite rows may pin an equality.
            List<long[]> pinned = new ArrayList<long[]>();
            ineqs = pruneParallel(ineqs, pinned);
            if (ineqs == null) {
                return false;
            }
            if (!pinned.isEmpty()) {
                return feasible(pinned, ineqs);
            }
            if (ineqs.isEmpty()) {
                return true;
            }
            int width = ineqs.get(0).length;
            int best = -1;
            boolean best_exact = false;
            long best_cost = Long.MAX_VALUE;
            boolean dropped = false;
            for (int k = 1; k < width && !dropped; k++) {
                int lowers = 0, uppers = 0;
                boolean unit_lower = true, unit_upper = true;
                for (long[] r : ineqs) {
                    if (r[k] > 0) {
                        lowers++;
                        unit_lower &= (r[k] == 1);
                    } else if (r[k] < 0) {
                        uppers++;
                        unit_upper &= (r[k] == -1);
                    }
                }
                if (lowers + uppers == 0) {
                    continue;
                }
                if (lowers == 0 || uppers == 0) {
                    // Unbounded on one side: every row on x_k holds for
                    // some large enough value.
                    List<long[]> kept = new ArrayList<long[]>(ineqs.size());
                    for (long[] r : ineqs) {
                        if (r[k] == 0) {
                            kept.add(r);
                        }
                    }
                    ineqs = kept;
                    dropped = true;
                    continue;
                }
                boolean exact = unit_lower || unit_upper;
                long cost = (long)lowers * uppers;
                if (best == -1 || (exact && !best_exact) ||
                    (exact == best_exact && cost < best_cost)) {
                    best = k;
                    best_exact = exact;
                    best_cost = cost;
                }
            }
            if (dropped) {
                continue;
            }
            if (best_exact) {
                ineqs = shadow(ineqs, best, false);
                continue;
            }
            return inexactElimination(ineqs, best);
        }
    }

    private static boolean inexactElimination(List<long[]> ineqs, int k) {
        if (!feasible(new ArrayList<long[]>(), shadow(ineqs, k, false))) {
            return false;
        }
        if (feasible(new ArrayList<long[]>(), shadow(ineqs, k, true))) {
            return true;
        }
        long max_upper = 0;
        for (long[] r : ineqs) {
            if (r[k] < 0) {
                max_upper = Math.max(max_upper, -r[k]);
            }
        }
        for (long[] lower : ineqs) {
            long a = lower[k];
            if (a <= 0) {
                continue;
            }
            long limit = Math.floorDiv(
                    Rows.add(Rows.mul(max_upper, a), -a - max_upper),
                    max_upper);
            for (long i = 0; i <= limit; i++) {
                long[] splinter = lower.clone();
                splinter[0] = Rows.add(splinter[0], -i);
                List<long[]> eqs = new ArrayList<long[]>(1);
                eqs.add(splinter);
                if (feasible(eqs, Rows.copy(ineqs))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
    * Eliminates x_k by combining every lower bound with every upper bound;
    * the dark shadow additionally tightens each combination.
    */
    private static List<long[]> shadow(List<long[]> ineqs, int k, boolean dark) {
        List<long[]> ret = new ArrayList<long[]>();
        for (long[] r : ineqs) {
            if (r[k] == 0) {
                ret.add(r.clone());
            }
        }
        for (long[] lower : ineqs) {
            if (lower[k] <= 0) {
                continue;
            }
            for (long[] upper : ineqs) {
                if (upper[k] >= 0) {
                    continue;
                }
                long a = lower[k];
                long b = -upper[k];
                long[] row = Rows.combine(b, lower, a, upper);
                if (dark) {
                    row[0] = Rows.add(row[0], -Rows.mul(a - 1, b - 1));
                }
                ret.add(row);
            }
        }
        return ret;
    }

    /**
    * Removes all equalities, rewriting the inequalities in place.
    *
    * @return false if the equalities have no integer solution.
    */
    private static boolean eliminateEqualities(
            List<long[]> eqs, List<long[]> ineqs) {
        while (!eqs.isEmpty()) {
            long[] eq = Rows.normalizeEquality(eqs.remove(eqs.size() - 1));
            if (eq == null) {
                return false;
            }
            if (Rows.isConstant(eq)) {
                continue;
            }
            int unit = -1;
            int smallest = -1;
            for (int i = 1; i < eq.length; i++) {
                if (eq[i] == 1 || eq[i] == -1) {
                    unit = i;
                    break;
                }
                if (eq[i] != 0 &&
                    (smallest == -1 || Math.abs(eq[i]) < Math.abs(eq[smallest]))) {
                    smallest = i;
                }
            }
            if (unit != -1) {
                substitute(eqs, eq, unit);
                substitute(ineqs, eq, unit);
                continue;
            }
            // Substituting x_k = x_k' - q x_i reduces the coefficient of x_i
            // modulo that of x_k without changing the integer solutions.
            int k = smallest;
            List<long[]> all = new ArrayList<long[]>(eqs.size() + ineqs.size() + 1);
            all.addAll(eqs);
            all.addAll(ineqs);
            all.add(eq);
            for (int i = 1; i < eq.length; i++) {
                if (i == k || eq[i] == 0) {
                    continue;
                }
                long q = Math.floorDiv(eq[i], eq[k]);
                for (long[] r : all) {
                    r[i] = Rows.add(r[i], -Rows.mul(q, r[k]));
                }
            }
            eqs.add(eq);
        }
        return true;
    }

    private static void substitute(List<long[]> rows, long[] eq, int col) {
        for (int i = 0; i < rows.size(); i++) {
            long[] r = rows.get(i);
            if (r[col] != 0) {
                // eq[col] is 1 or -1.
                rows.set(i, Rows.combine(1, r, -r[col] * eq[col], eq));
            }
        }
    }

    /**
    * Keeps the tightest of each group of parallel inequalities and collects
    * opposite pairs that meet in a single value as equalities.
    *
    * @return the pruned rows or null if an opposite pair is contradictory.
    */
    private static List<long[]> pruneParallel(
            List<long[]> ineqs, List<long[]> pinned) {
        List<long[]> ret = new ArrayList<long[]>(ineqs.size());
        for (long[] r : ineqs) {
            boolean merged = false;
            for (int i = 0; i < ret.size(); i++) {
                long[] s = ret.get(i);
                if (Rows.sameCoefficients(r, s)) {
                    if (r[0] < s[0]) {
                        ret.set(i, r);
                    }
                    merged = true;
                    break;
                }
            }
            if (!merged) {
                ret.add(r);
            }
        }
        for (int i = 0; i < ret.size(); i++) {
            for (int j = i + 1; j < ret.size(); j++) {
                long[] a = ret.get(i);
                long[] b = ret.get(j);
                if (Rows.oppositeCoefficients(a, b)) {
                    long sum = Rows.add(a[0], b[0]);
                    if (sum < 0) {
                        return null;
                    }
                    if (sum == 0 && !Rows.contains(pinned, a)) {
                        pinned.add(a.clone());
                    }
                }
            }
        }
        if (!pinned.isEmpty()) {
            List<long[]> rest = new ArrayList<long[]>(ret.size());
            for (long[] r : ret) {
                boolean is_pinned = false;
                for (long[] p : pinned) {
                    if (Arrays.equals(r, p) ||
                        Arrays.equals(r, Rows.negate(p))) {
                        is_pinned = true;
                    }
                }
                if (!is_pinned) {
                    rest.add(r);
                }
            }
            return rest;
        }
        return ret;
    }

}
