package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents an integer constant.
*/
public class IntegerLiteral extends Expression {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = IntegerLiteral.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    private long value;

    /**
    * Constructs an integer literal with the specified numeric value.
    *
    * @param value the value of the literal.
    */
    public IntegerLiteral(long value) {
        super(-1);
        object_print_method = class_print_method;
        this.value = value;
    }

    @Override
    public IntegerLiteral clone() {
        return (IntegerLiteral)super.clone();
    }

    public static void defaultPrint(IntegerLiteral l, PrintWriter o) {
        o.print(l.value);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && value == ((IntegerLiteral)o).value);
    }

    /** Returns the numeric value of the literal. */
    public long getValue() {
        return value;
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }

}
