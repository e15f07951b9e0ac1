package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents <b>disable name</b>, which leaves the enclosing block with
* that name.
*/
public class DisableStatement extends Statement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = DisableStatement.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    private String target;

    /**
    * Creates a disable statement.
    *
    * @param target the name of the disabled block.
    */
    public DisableStatement(String target) {
        super(-1);
        object_print_method = class_print_method;
        this.target = target;
    }

    @Override
    public DisableStatement clone() {
        return (DisableStatement)super.clone();
    }

    /** Returns the name of the disabled block. */
    public String getTarget() {
        return target;
    }

    public static void defaultPrint(DisableStatement s, PrintWriter o) {
        o.print("disable " + s.target + ";");
    }

}
