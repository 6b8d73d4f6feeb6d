package polyc.poly;

import polyc.hir.Tools;

import java.util.Arrays;

/**
* A quasi-affine value {@code (c . (1, params, vars)) / d} with integer
* coefficients and a positive denominator, the value being rounded down when
* the division is not exact. The columns follow the input layout of the
* relation the expression was taken from: the constant, the parameters, then
* the input (or set) dimensions.
*/
public final class AffineExpression {

    private final long[] coefficients;
    private final long denominator;

    /**
    * Creates an affine expression; the coefficients are copied and the
    * fraction is reduced.
    *
    * @throws IllegalArgumentException if the denominator is not positive.
    */
    public AffineExpression(long[] coefficients, long denominator) {
        if (denominator <= 0) {
            throw new IllegalArgumentException("denominator " + denominator);
        }
        long g = denominator;
        for (long c : coefficients) {
            g = Tools.gcd(g, c);
        }
        this.coefficients = new long[coefficients.length];
        for (int i = 0; i < coefficients.length; i++) {
            this.coefficients[i] = coefficients[i] / g;
        }
        this.denominator = denominator / g;
    }

    /** Creates the constant expression of the given width. */
    public static AffineExpression constant(int width, long value) {
        long[] c = new long[width];
        c[0] = value;
        return new AffineExpression(c, 1);
    }

    /** Creates the expression equal to the variable in column <var>col</var>. */
    public static AffineExpression variable(int width, int col) {
        long[] c = new long[width];
        c[col] = 1;
        return new AffineExpression(c, 1);
    }

    public int getNumColumns() {
        return coefficients.length;
    }

    public long getCoefficient(int col) {
        return coefficients[col];
    }

    public long getConstant() {
        return coefficients[0];
    }

    public long getDenominator() {
        return denominator;
    }

    /** Returns a copy of the numerator coefficients. */
    public long[] getCoefficients() {
        return coefficients.clone();
    }

    /** Checks if the expression has no variable or parameter term. */
    public boolean isConstant() {
        return Rows.isConstant(coefficients);
    }

    /** Checks if the expression involves the given column. */
    public boolean involves(int col) {
        return coefficients[col] != 0;
    }

    /**
    * Replaces the variable in column <var>col</var> by <var>value</var>,
    * which must have the same width.
    */
    public AffineExpression substitute(int col, AffineExpression value) {
        long c = coefficients[col];
        if (c == 0) {
            return this;
        }
        long[] ret = new long[coefficients.length];
        for (int k = 0; k < ret.length; k++) {
            long own = (k == col) ? 0 : coefficients[k];
            ret[k] = Rows.add(Rows.mul(own, value.denominator),
                    Rows.mul(c, value.coefficients[k]));
        }
        return new AffineExpression(ret, Rows.mul(denominator, value.denominator));
    }

    /**
    * Returns the expression over a wider column layout; column <var>k</var>
    * moves to <var>map[k]</var>.
    */
    public AffineExpression remap(int[] map, int width) {
        return new AffineExpression(
                Rows.remap(coefficients, map, width), denominator);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof AffineExpression)) {
            return false;
        }
        AffineExpression other = (AffineExpression)o;
        return (denominator == other.denominator &&
                Arrays.equals(coefficients, other.coefficients));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coefficients) * 31 + (int)denominator;
    }

    @Override
    public String toString() {
        String s = Arrays.toString(coefficients);
        return (denominator == 1) ? s : s + "/" + denominator;
    }

}
