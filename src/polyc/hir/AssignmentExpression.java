package polyc.hir;

/**
* An assignment expression has a lefthand side, an assignment operator and a
* righthand side. The lefthand side is visited before the righthand side, so
* in {@code C[i] = A[i] + B[i]} the write to {@code C} is the first access.
*/
public class AssignmentExpression extends BinaryExpression {

    public AssignmentExpression(
            Expression lhs, AssignmentOperator op, Expression rhs) {
        super(lhs, op, rhs);
    }

    @Override
    public AssignmentExpression clone() {
        return (AssignmentExpression)super.clone();
    }

    @Override
    public AssignmentOperator getOperator() {
        return (AssignmentOperator)op;
    }

}
