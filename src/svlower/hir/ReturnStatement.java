package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a return statement, optionally carrying the value returned
* by a function.
*/
public class ReturnStatement extends Statement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = ReturnStatement.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /** Creates a return statement without a value. */
    public ReturnStatement() {
        super(1);
        object_print_method = class_print_method;
    }

    /**
    * Creates a return statement with a value.
    *
    * @param expr the returned value.
    * @throws NotAnOrphanException if <b>expr</b> has a parent.
    */
    public ReturnStatement(Expression expr) {
        this();
        addChild(expr);
    }

    @Override
    public ReturnStatement clone() {
        return (ReturnStatement)super.clone();
    }

    /** Returns the returned value, or null if there is none. */
    public Expression getExpression() {
        if (children.isEmpty()) {
            return null;
        }
        return (Expression)children.get(0);
    }

    /**
    * Detaches and returns the returned value.
    *
    * @return the value, or null if there is none.
    */
    public Expression takeExpression() {
        Expression expr = getExpression();
        if (expr != null) {
            children.remove(0);
            expr.setParent(null);
        }
        return expr;
    }

    public static void defaultPrint(ReturnStatement s, PrintWriter o) {
        o.print("return");
        if (s.getExpression() != null) {
            o.print(" ");
            s.getExpression().print(o);
        }
        o.print(";");
    }

}
