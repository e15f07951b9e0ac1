package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a plain name that is not bound to a variable: block names,
* label names and the targets of disable statements and function calls.
*/
public class NameID extends Expression {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = NameID.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    private String name;

    /**
    * Constructs a new name with the specified string.
    *
    * @param name the name.
    */
    public NameID(String name) {
        super(-1);
        object_print_method = class_print_method;
        this.name = name;
    }

    @Override
    public NameID clone() {
        return (NameID)super.clone();
    }

    /** Returns the string name. */
    public String getName() {
        return name;
    }

    public static void defaultPrint(NameID i, PrintWriter o) {
        o.print(i.name);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && name.equals(((NameID)o).name));
    }

    @Override
    public String toString() {
        return name;
    }

}
