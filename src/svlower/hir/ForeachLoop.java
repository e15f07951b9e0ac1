package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents an element-wise iteration such as <b>foreach (a[i]) body</b>.
* The header is opaque to the passes that handle control transfers.
*/
public class ForeachLoop extends Statement implements Loop {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = ForeachLoop.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates a foreach loop.
    *
    * @param header the iterated array and loop variables.
    * @param body the loop body.
    * @throws NotAnOrphanException if <b>header</b> or <b>body</b> has a
    *   parent.
    */
    public ForeachLoop(Expression header, Statement body) {
        super(2);
        object_print_method = class_print_method;
        addChild(header);
        addChild(IRTools.toCompound(body));
    }

    @Override
    public ForeachLoop clone() {
        return (ForeachLoop)super.clone();
    }

    public Expression getHeader() {
        return (Expression)children.get(0);
    }

    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(1);
    }

    public static void defaultPrint(ForeachLoop l, PrintWriter o) {
        o.print("foreach (");
        l.getHeader().print(o);
        o.print(") ");
        l.getBody().print(o);
    }

}
