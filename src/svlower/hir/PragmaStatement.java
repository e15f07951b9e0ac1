package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a tool directive embedded among the statements. The unroll
* directives apply to the loop that follows them.
*/
public class PragmaStatement extends Statement {

    /** The supported directive kinds. */
    public enum PragmaType {
        /** Fully unroll the next loop. */
        UNROLL_FULL,
        /** Never unroll the next loop. */
        UNROLL_DISABLE,
        /** Exclude the enclosing block from coverage. */
        COVERAGE_BLOCK_OFF,
        /** Keep the enclosing scope visible to external code. */
        PUBLIC
    }

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = PragmaStatement.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    private PragmaType type;

    /**
    * Creates a pragma of the specified kind.
    *
    * @param type the directive kind.
    */
    public PragmaStatement(PragmaType type) {
        super(-1);
        object_print_method = class_print_method;
        this.type = type;
    }

    @Override
    public PragmaStatement clone() {
        return (PragmaStatement)super.clone();
    }

    public PragmaType getType() {
        return type;
    }

    public static void defaultPrint(PragmaStatement s, PrintWriter o) {
        o.print("// pragma " + s.type.name().toLowerCase());
    }

}
