package polyc.codegen;

import polyc.hir.ArrayAccess;
import polyc.hir.Expression;
import polyc.hir.ExpressionStatement;
import polyc.hir.ForLoop;
import polyc.hir.Identifier;
import polyc.hir.OmpAnnotation;
import polyc.scop.AccessExpression;
import polyc.scop.ScopStatement;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Prints the tree of {@link CpuCodeGen} as sequential C with OpenMP
* directives. A leaf prints the body of its statement with every access
* rewritten in terms of the loop iterators; a loop marked parallel is
* preceded by {@code #pragma omp parallel for}.
*/
public class CpuPrinter extends AstPrinter {

    @Override
    protected void printFor(ForLoop loop, int level, PrintWriter o) {
        LoopAnnotation note = loop.getAnnotation(LoopAnnotation.class, "parallel");
        if (note != null && note.isParallel()) {
            indent(level, o);
            o.println(OmpAnnotation.parallelFor());
        }
        super.printFor(loop, level, o);
    }

    @Override
    protected void printUser(ExpressionStatement leaf, int level,
            PrintWriter o) {
        StatementAnnotation note =
                leaf.getAnnotation(StatementAnnotation.class, "statement");
        if (note == null) {
            throw new IllegalStateException("leaf " + leaf +
                    " carries no statement annotation");
        }
        indent(level, o);
        transformBody(note).print(o);
        o.println(";");
    }

    /**
    * Returns a copy of the statement body whose accesses are replaced by
    * their index expressions: {@code A[e0][e1]} for an array element and
    * {@code (e0)} for an unnamed access.
    *
    * @throws IllegalStateException if the number of index lists differs
    *   from the number of accesses of the body.
    */
    public static Expression transformBody(StatementAnnotation note) {
        ScopStatement stmt = note.getStatement();
        Expression body = stmt.getBody().clone();
        List<AccessExpression> accesses = ScopStatement.getAccesses(body);
        List<List<Expression>> indices = note.getAccesses();
        if (accesses.size() != indices.size()) {
            throw new IllegalStateException(stmt.getName() + " has " +
                    accesses.size() + " accesses but " + indices.size() +
                    " index lists");
        }
        for (int k = 0; k < accesses.size(); k++) {
            AccessExpression access = accesses.get(k);
            List<Expression> index = indices.get(k);
            Expression replacement;
            if (access.isNamed()) {
                List<Expression> copies = new ArrayList<Expression>(index.size());
                for (Expression e : index) {
                    copies.add(e.clone());
                }
                replacement = new ArrayAccess(
                        new Identifier(access.getName()), copies);
            } else {
                if (index.size() != 1) {
                    throw new IllegalStateException("unnamed access " +
                            access + " of " + stmt.getName() + " has " +
                            index.size() + " index expressions");
                }
                replacement = index.get(0).clone();
                replacement.setParens(true);
            }
            if (access == body) {
                body = replacement;
            } else {
                access.replaceWith(replacement);
            }
        }
        return body;
    }

}
