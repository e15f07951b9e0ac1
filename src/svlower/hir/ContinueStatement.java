package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a continue statement; ends the current iteration of the
* innermost loop.
*/
public class ContinueStatement extends Statement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = ContinueStatement.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    public ContinueStatement() {
        super(-1);
        object_print_method = class_print_method;
    }

    @Override
    public ContinueStatement clone() {
        return (ContinueStatement)super.clone();
    }

    public static void defaultPrint(ContinueStatement s, PrintWriter o) {
        o.print("continue;");
    }

}
