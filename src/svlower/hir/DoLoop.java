package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents <b>do body while (condition)</b>: the body runs once before
* the condition is first tested.
*/
public class DoLoop extends Statement implements Loop {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = DoLoop.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates a do loop.
    *
    * @param body the loop body.
    * @param condition the condition tested after each iteration.
    * @throws NotAnOrphanException if <b>body</b> or <b>condition</b> has a
    *   parent.
    */
    public DoLoop(Statement body, Expression condition) {
        super(2);
        object_print_method = class_print_method;
        addChild(IRTools.toCompound(body));
        addChild(condition);
    }

    @Override
    public DoLoop clone() {
        return (DoLoop)super.clone();
    }

    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(0);
    }

    public Expression getCondition() {
        return (Expression)children.get(1);
    }

    public static void defaultPrint(DoLoop l, PrintWriter o) {
        o.print("do ");
        l.getBody().print(o);
        o.print(" while (");
        l.getCondition().print(o);
        o.print(");");
    }

}
