package polyc.codegen;

import polyc.hir.Annotation;
import polyc.hir.Expression;
import polyc.scop.ScopStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Attached to a leaf of the generated tree. It refers to the scop statement
* executed by the leaf and holds, for each access of the statement body in
* traversal order, the index expressions of the accessed element in terms of
* the generated loop iterators.
*/
public class StatementAnnotation extends Annotation {

    private static final long serialVersionUID = 1L;

    /**
    * Creates the annotation.
    *
    * @param stmt the executed statement.
    * @param accesses one list of index expressions per access.
    * @throws IllegalArgumentException if the number of lists is not the
    *   number of accesses of the statement body.
    */
    public StatementAnnotation(ScopStatement stmt,
            List<List<Expression>> accesses) {
        super();
        if (accesses.size() != stmt.countAccesses()) {
            throw new IllegalArgumentException(stmt.getName() + " has " +
                    stmt.countAccesses() + " accesses, got " +
                    accesses.size());
        }
        List<List<Expression>> copy =
                new ArrayList<List<Expression>>(accesses.size());
        for (List<Expression> index : accesses) {
            copy.add(Collections.unmodifiableList(
                    new ArrayList<Expression>(index)));
        }
        put("statement", stmt);
        put("accesses", Collections.unmodifiableList(copy));
    }

    public ScopStatement getStatement() {
        return get("statement");
    }

    /** Returns the index expressions, one list per access. */
    public List<List<Expression>> getAccesses() {
        return get("accesses");
    }

    @Override
    public String toString() {
        return "";
    }

}
