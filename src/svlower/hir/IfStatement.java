package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents an if statement with an optional else branch.
*/
public class IfStatement extends Statement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = IfStatement.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates an if statement without an else branch.
    *
    * @param condition the condition.
    * @param then_stmt the statement run if the condition holds.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public IfStatement(Expression condition, Statement then_stmt) {
        super(3);
        object_print_method = class_print_method;
        addChild(condition);
        addChild(IRTools.toCompound(then_stmt));
    }

    /**
    * Creates an if statement with an else branch.
    *
    * @param condition the condition.
    * @param then_stmt the statement run if the condition holds.
    * @param else_stmt the statement run otherwise.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public IfStatement(Expression condition, Statement then_stmt,
                       Statement else_stmt) {
        this(condition, then_stmt);
        if (else_stmt != null) {
            addChild(IRTools.toCompound(else_stmt));
        }
    }

    @Override
    public IfStatement clone() {
        return (IfStatement)super.clone();
    }

    public Expression getCondition() {
        return (Expression)children.get(0);
    }

    public CompoundStatement getThenStatement() {
        return (CompoundStatement)children.get(1);
    }

    /** Returns the else branch, or null if there is none. */
    public CompoundStatement getElseStatement() {
        if (children.size() > 2) {
            return (CompoundStatement)children.get(2);
        }
        return null;
    }

    public static void defaultPrint(IfStatement s, PrintWriter o) {
        o.print("if (");
        s.getCondition().print(o);
        o.print(") ");
        s.getThenStatement().print(o);
        if (s.getElseStatement() != null) {
            o.print(" else ");
            s.getElseStatement().print(o);
        }
    }

}
