package polyc.hir;

import java.io.PrintWriter;

/** Represents an integer literal in the program. */
public class IntegerLiteral extends Literal {

    private long value;

    public IntegerLiteral(long value) {
        this.value = value;
    }

    @Override
    public IntegerLiteral clone() {
        return (IntegerLiteral)super.clone();
    }

    protected void printBare(PrintWriter o) {
        o.print(value);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && value == ((IntegerLiteral)o).value);
    }

    @Override
    public int hashCode() {
        return Long.valueOf(value).hashCode();
    }

    public long getValue() {
        return value;
    }

}
