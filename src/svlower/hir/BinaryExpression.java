package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents an infix expression with a left and a right operand.
*/
public class BinaryExpression extends Expression {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = BinaryExpression.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /** The operator */
    protected BinaryOperator op;

    /**
    * Creates a binary expression.
    *
    * @param lhs The left operand.
    * @param op The operator.
    * @param rhs The right operand.
    * @throws NotAnOrphanException if <b>lhs</b> or <b>rhs</b> has a parent.
    */
    public BinaryExpression(
            Expression lhs, BinaryOperator op, Expression rhs) {
        super(2);
        object_print_method = class_print_method;
        addChild(lhs);
        this.op = op;
        addChild(rhs);
    }

    @Override
    public BinaryExpression clone() {
        BinaryExpression o = (BinaryExpression)super.clone();
        o.op = op;
        return o;
    }

    /**
    * Prints a binary expression to a stream.
    *
    * @param e The expression to print.
    * @param o The writer on which to print the expression.
    */
    public static void defaultPrint(BinaryExpression e, PrintWriter o) {
        o.print("(");
        e.getLHS().print(o);
        o.print(" ");
        e.op.print(o);
        o.print(" ");
        e.getRHS().print(o);
        o.print(")");
    }

    public Expression getLHS() {
        return (Expression)children.get(0);
    }

    public BinaryOperator getOperator() {
        return op;
    }

    public Expression getRHS() {
        return (Expression)children.get(1);
    }

    public void setLHS(Expression expr) {
        setChild(0, expr);
    }

    public void setRHS(Expression expr) {
        setChild(1, expr);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((BinaryExpression)o).op);
    }

}
