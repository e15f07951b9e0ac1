package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents <b>repeat (count) body</b>. The count is evaluated once; a
* count that is not positive runs the body zero times.
*/
public class RepeatLoop extends Statement implements Loop {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = RepeatLoop.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates a repeat loop.
    *
    * @param count the iteration count.
    * @param body the loop body.
    * @throws NotAnOrphanException if <b>count</b> or <b>body</b> has a
    *   parent.
    */
    public RepeatLoop(Expression count, Statement body) {
        super(2);
        object_print_method = class_print_method;
        addChild(count);
        addChild(IRTools.toCompound(body));
    }

    @Override
    public RepeatLoop clone() {
        return (RepeatLoop)super.clone();
    }

    public Expression getCount() {
        return (Expression)children.get(0);
    }

    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(1);
    }

    public static void defaultPrint(RepeatLoop l, PrintWriter o) {
        o.print("repeat (");
        l.getCount().print(o);
        o.print(") ");
        l.getBody().print(o);
    }

}
