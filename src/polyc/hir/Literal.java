package polyc.hir;

/** Represents an immediate value; literals are always leaves. */
public abstract class Literal extends Expression {

    protected Literal() {
        super();
    }

    @Override
    public Literal clone() {
        return (Literal)super.clone();
    }

}
