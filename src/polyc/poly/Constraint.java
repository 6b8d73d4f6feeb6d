package polyc.poly;

import java.util.Arrays;

/**
* An integer affine constraint over the columns
* {@code [1 | params | in | out | exists]} of a relation: either
* {@code c . x = 0} or {@code c . x >= 0}. Constraints are immutable.
*/
public final class Constraint {

    private final long[] coefficients;
    private final boolean equality;

    /**
    * Creates a constraint.
    *
    * @param coefficients the coefficients, constant first; copied.
    * @param equality true for an equality, false for an inequality.
    */
    public Constraint(long[] coefficients, boolean equality) {
        this.coefficients = coefficients.clone();
        this.equality = equality;
    }

    public boolean isEquality() {
        return equality;
    }

    /** Returns the number of columns including the constant. */
    public int getNumColumns() {
        return coefficients.length;
    }

    /** Returns the coefficient of the given column. */
    public long getCoefficient(int column) {
        return coefficients[column];
    }

    /** Returns the constant term. */
    public long getConstant() {
        return coefficients[0];
    }

    /** Returns a copy of the coefficients. */
    public long[] getCoefficients() {
        return coefficients.clone();
    }

    /** Checks if the constraint involves the given column. */
    public boolean involves(int column) {
        return coefficients[column] != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Constraint)) {
            return false;
        }
        Constraint other = (Constraint)o;
        return (equality == other.equality &&
                Arrays.equals(coefficients, other.coefficients));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coefficients) * 2 + (equality ? 1 : 0);
    }

    @Override
    public String toString() {
        return Arrays.toString(coefficients) + (equality ? " = 0" : " >= 0");
    }

}
