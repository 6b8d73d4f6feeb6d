package polyc.hir;

import java.io.PrintWriter;

/**
* A sequence of statements. In the generated tree a compound statement holds
* the members of a sequence of loops or leaves sharing one enclosing time
* step; it is structural and never annotated.
*/
public class CompoundStatement extends Statement {

    public CompoundStatement() {
        super();
    }

    public void print(PrintWriter o) {
        o.println("{");
        for (Traversable t : children) {
            t.print(o);
            o.println("");
        }
        o.print("}");
    }

    /**
    * Adds a statement to the end of this compound statement.
    *
    * @throws NotAnOrphanException if <b>stmt</b> has a parent.
    */
    public void addStatement(Statement stmt) {
        adopt(stmt);
    }

    public int countStatements() {
        return children.size();
    }

}
