package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Wraps a sequence of statements that a {@link JumpGo} may leave early. The
* last statement of a jump block is its {@link JumpLabel}; jumping to the
* label continues execution right after the jump block.
*/
public class JumpBlock extends CompoundStatement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = JumpBlock.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /** Creates an empty jump block. */
    public JumpBlock() {
        object_print_method = class_print_method;
    }

    @Override
    public JumpBlock clone() {
        return (JumpBlock)super.clone();
    }

    /**
    * Returns the label that ends this jump block.
    *
    * @return the label, or null if the block does not end with one yet.
    */
    public JumpLabel getLabel() {
        if (children.isEmpty()) {
            return null;
        }
        Traversable last = children.get(children.size() - 1);
        return (last instanceof JumpLabel) ? (JumpLabel)last : null;
    }

    public static void defaultPrint(JumpBlock b, PrintWriter o) {
        o.println("begin // jump block");
        printBody(b, o);
        o.print("end");
    }

}
