package polyc.hir;

import java.io.PrintWriter;

/**
* Represents a name in C text: a parameter, a generated loop iterator, a
* scalar or the callee of a call-like expression. Identifiers are not linked
* to symbol tables; two identifiers are equal iff their names are.
*/
public class Identifier extends Expression {

    private String name;

    /**
    * @throws IllegalArgumentException if <b>name</b> is null or empty.
    */
    public Identifier(String name) {
        if (name == null || name.length() == 0) {
            throw new IllegalArgumentException("empty identifier");
        }
        this.name = name;
    }

    @Override
    public Identifier clone() {
        return (Identifier)super.clone();
    }

    protected void printBare(PrintWriter o) {
        o.print(name);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && name.equals(((Identifier)o).name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    public String getName() {
        return name;
    }

}
