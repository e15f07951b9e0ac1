package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a break statement; leaves the innermost loop.
*/
public class BreakStatement extends Statement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = BreakStatement.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    public BreakStatement() {
        super(-1);
        object_print_method = class_print_method;
    }

    @Override
    public BreakStatement clone() {
        return (BreakStatement)super.clone();
    }

    public static void defaultPrint(BreakStatement s, PrintWriter o) {
        o.print("break;");
    }

}
