package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Marks the exit point of the {@link JumpBlock} that owns it as its last
* statement.
*/
public class JumpLabel extends Statement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = JumpLabel.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    private String name;

    /**
    * Creates a label with the specified name.
    *
    * @param name the label name.
    */
    public JumpLabel(String name) {
        super(-1);
        object_print_method = class_print_method;
        this.name = name;
    }

    @Override
    public JumpLabel clone() {
        return (JumpLabel)super.clone();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
    * Returns the jump block this label ends.
    *
    * @return the owning jump block, or null if the label is not attached
    *   to one.
    */
    public JumpBlock getBlock() {
        return (parent instanceof JumpBlock) ? (JumpBlock)parent : null;
    }

    public static void defaultPrint(JumpLabel l, PrintWriter o) {
        o.print(l.name);
        o.print(": ;");
    }

}
