package polyc.poly;

import polyc.hir.Tools;
import polyc.hir.UnsupportedInput;

import java.util.ArrayList;
import java.util.List;

/**
* Overflow-checked arithmetic on constraint rows. A row holds the constant in
* column 0 followed by the variable coefficients; an equality row means
* {@code row . (1, x) = 0} and an inequality row {@code row . (1, x) >= 0}.
*/
final class Rows {

    private Rows() {
    }

    static long add(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch(ArithmeticException e) {
            throw new UnsupportedInput("coefficient overflow", e);
        }
    }

    static long mul(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch(ArithmeticException e) {
            throw new UnsupportedInput("coefficient overflow", e);
        }
    }

    /** Returns {@code a * x + b * y} element-wise. */
    static long[] combine(long a, long[] x, long b, long[] y) {
        long[] ret = new long[x.length];
        for (int i = 0; i < x.length; i++) {
            ret[i] = add(mul(a, x[i]), mul(b, y[i]));
        }
        return ret;
    }

    /** Returns the gcd of the variable coefficients, column 1 onwards. */
    static long coefficientGcd(long[] row) {
        long g = 0;
        for (int i = 1; i < row.length; i++) {
            g = Tools.gcd(g, row[i]);
        }
        return g;
    }

    /** Checks if every variable coefficient is zero. */
    static boolean isConstant(long[] row) {
        for (int i = 1; i < row.length; i++) {
            if (row[i] != 0) {
                return false;
            }
        }
        return true;
    }

    /**
    * Divides an equality by the gcd of its coefficients.
    *
    * @return the normalized row, or null if the equality has no integer
    *   solution.
    */
    static long[] normalizeEquality(long[] row) {
        long g = coefficientGcd(row);
        if (g == 0) {
            return (row[0] == 0) ? row.clone() : null;
        }
        if (row[0] % g != 0) {
            return null;
        }
        long[] ret = new long[row.length];
        // The first nonzero coefficient is made positive.
        long sign = 1;
        for (int i = 1; i < row.length; i++) {
            if (row[i] != 0) {
                sign = (row[i] < 0) ? -1 : 1;
                break;
            }
        }
        for (int i = 0; i < row.length; i++) {
            ret[i] = sign * row[i] / g;
        }
        return ret;
    }

    /**
    * Divides an inequality by the gcd of its coefficients, rounding the
    * constant down, which keeps every integer solution.
    */
    static long[] normalizeInequality(long[] row) {
        long g = coefficientGcd(row);
        if (g <= 1) {
            return row.clone();
        }
        long[] ret = new long[row.length];
        ret[0] = Math.floorDiv(row[0], g);
        for (int i = 1; i < row.length; i++) {
            ret[i] = row[i] / g;
        }
        return ret;
    }

    /** Checks if two rows have the same variable coefficients. */
    static boolean sameCoefficients(long[] a, long[] b) {
        for (int i = 1; i < a.length; i++) {
            if (a[i] != b[i]) {
                return false;
            }
        }
        return true;
    }

    /** Checks if the variable coefficients of two rows are opposite. */
    static boolean oppositeCoefficients(long[] a, long[] b) {
        for (int i = 1; i < a.length; i++) {
            if (a[i] != -b[i]) {
                return false;
            }
        }
        return true;
    }

    /** Returns the negation of a row. */
    static long[] negate(long[] row) {
        long[] ret = new long[row.length];
        for (int i = 0; i < row.length; i++) {
            ret[i] = -row[i];
        }
        return ret;
    }

    /**
    * Maps a row to a new column layout; column {@code k} of the old row is
    * added to column {@code map[k]} of the new one.
    */
    static long[] remap(long[] row, int[] map, int new_length) {
        long[] ret = new long[new_length];
        for (int k = 0; k < row.length; k++) {
            if (row[k] != 0) {
                ret[map[k]] = add(ret[map[k]], row[k]);
            }
        }
        return ret;
    }

    /**
    * Eliminates column <var>col</var> from <var>row</var> using the equality
    * <var>eq</var>, scaling <var>row</var> by a positive factor so that the
    * direction of an inequality is kept.
    */
    static long[] eliminate(long[] row, long[] eq, int col) {
        if (row[col] == 0) {
            return row;
        }
        long p = eq[col];
        long f = row[col];
        long g = Tools.gcd(p, f);
        long a = Math.abs(p) / g;
        long b = -Long.signum(p) * f / g;
        return combine(a, row, b, eq);
    }

    /** Deep copy of a list of rows. */
    static List<long[]> copy(List<long[]> rows) {
        List<long[]> ret = new ArrayList<long[]>(rows.size());
        for (long[] r : rows) {
            ret.add(r.clone());
        }
        return ret;
    }

    /** Checks if the list holds a row equal to <var>row</var>. */
    static boolean contains(List<long[]> rows, long[] row) {
        for (long[] r : rows) {
            if (java.util.Arrays.equals(r, row)) {
                return true;
            }
        }
        return false;
    }

}
