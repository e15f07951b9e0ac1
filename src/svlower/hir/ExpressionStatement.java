package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a statement made of a single expression, usually an
* assignment or a call.
*/
public class ExpressionStatement extends Statement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = ExpressionStatement.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates an expression statement.
    *
    * @param expr the expression.
    * @throws NotAnOrphanException if <b>expr</b> has a parent.
    */
    public ExpressionStatement(Expression expr) {
        super(1);
        object_print_method = class_print_method;
        addChild(expr);
    }

    @Override
    public ExpressionStatement clone() {
        return (ExpressionStatement)super.clone();
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    public static void defaultPrint(ExpressionStatement s, PrintWriter o) {
        s.getExpression().print(o);
        o.print(";");
    }

}
