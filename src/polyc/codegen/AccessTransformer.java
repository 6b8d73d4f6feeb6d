package polyc.codegen;

import polyc.hir.ConditionalExpression;
import polyc.hir.Expression;
import polyc.hir.IntegerLiteral;
import polyc.poly.PwMultiAff;
import polyc.poly.Relation;

import java.util.ArrayList;
import java.util.List;

/**
* Turns the access relations of a statement into index expressions over the
* iterators of the generated loops. An access relation maps statement
* instances to elements; composed with the inverse of the schedule of a leaf
* it maps time stamps to elements, from which one C expression per element
* dimension is printed.
*/
public final class AccessTransformer {

    private AccessTransformer() {
    }

    /**
    * Returns the index expressions of an access at a leaf.
    *
    * @param access the access relation, statement instance to element.
    * @param reverse_schedule the leaf schedule reversed, time stamp to
    *   statement instance.
    * @param build the builder positioned at the leaf.
    * @return one expression per dimension of the accessed element.
    */
    public static List<Expression> transform(Relation access,
            Relation reverse_schedule, AstBuild build) {
        PwMultiAff index = reverse_schedule.applyRange(access).toPwMultiAff();
        List<Expression> ret = new ArrayList<Expression>(index.getNumOut());
        for (int k = 0; k < index.getNumOut(); k++) {
            ret.add(expressionFromPwMultiAff(index, k, build));
        }
        return ret;
    }

    /**
    * Returns output <var>k</var> of a piecewise function of the time stamp.
    * A function with several pieces selects the piece with a conditional
    * expression; the last piece is taken when no earlier one applies.
    */
    static Expression expressionFromPwMultiAff(PwMultiAff f, int k,
            AstBuild build) {
        List<PwMultiAff.Piece> pieces = f.getPieces();
        if (pieces.isEmpty()) {
            return new IntegerLiteral(0);
        }
        int last = pieces.size() - 1;
        Expression ret = build.expressionFromAff(
                pieces.get(last).getExpressions().get(k), f.getSpace());
        for (int i = last - 1; i >= 0; i--) {
            PwMultiAff.Piece p = pieces.get(i);
            ret = new ConditionalExpression(
                    build.conditionFromSet(p.getDomain()),
                    build.expressionFromAff(p.getExpressions().get(k),
                            f.getSpace()),
                    ret);
        }
        return ret;
    }

}
