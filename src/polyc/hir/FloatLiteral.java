package polyc.hir;

import java.io.PrintWriter;

/**
* Represents a floating point literal. The source spelling is kept so that
* statement bodies are replayed exactly as written.
*/
public class FloatLiteral extends Literal {

    private String text;

    /** Constructs a literal from its source spelling, e.g. {@code 0.5f}. */
    public FloatLiteral(String text) {
        this.text = text;
    }

    @Override
    public FloatLiteral clone() {
        return (FloatLiteral)super.clone();
    }

    protected void printBare(PrintWriter o) {
        o.print(text);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && text.equals(((FloatLiteral)o).text));
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    /** Returns the numeric value, ignoring a type suffix. */
    public double getValue() {
        return Double.parseDouble(text.replaceAll("[fFlL]$", ""));
    }

}
