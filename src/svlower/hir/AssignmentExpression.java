package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a blocking or non-blocking assignment.
*/
public class AssignmentExpression extends BinaryExpression {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = AssignmentExpression.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates an assignment expression.
    *
    * @param lhs The left-hand side of the assignment.
    * @param op The assignment operator.
    * @param rhs The right-hand side of the assignment.
    * @throws NotAnOrphanException if <b>lhs</b> or <b>rhs</b> has a parent.
    */
    public AssignmentExpression(
            Expression lhs, AssignmentOperator op, Expression rhs) {
        super(lhs, op, rhs);
        object_print_method = class_print_method;
    }

    @Override
    public AssignmentExpression clone() {
        return (AssignmentExpression)super.clone();
    }

    /**
    * Prints an assignment expression to a stream.
    *
    * @param e The expression to print.
    * @param o The writer on which to print the expression.
    */
    public static void defaultPrint(AssignmentExpression e, PrintWriter o) {
        e.getLHS().print(o);
        o.print(" ");
        e.op.print(o);
        o.print(" ");
        e.getRHS().print(o);
    }

    @Override
    public AssignmentOperator getOperator() {
        return (AssignmentOperator)op;
    }

}
