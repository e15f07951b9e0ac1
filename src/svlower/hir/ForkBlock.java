package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a <b>fork</b>/<b>join</b> block whose statements execute
* concurrently. Control may not be transferred out of a fork block by a
* jump.
*/
public class ForkBlock extends Block {

    /** The kind of join that ends the fork block. */
    public enum JoinType {
        /** Waits for all forked statements. */
        JOIN("join"),
        /** Waits for any forked statement. */
        JOIN_ANY("join_any"),
        /** Does not wait. */
        JOIN_NONE("join_none");

        private final String keyword;

        JoinType(String keyword) {
            this.keyword = keyword;
        }

        @Override
        public String toString() {
            return keyword;
        }
    }

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = ForkBlock.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    private JoinType join_type;

    /**
    * Creates a fork block.
    *
    * @param name the block name; null or empty for an unnamed fork.
    * @param join_type the join kind.
    */
    public ForkBlock(String name, JoinType join_type) {
        super(name);
        object_print_method = class_print_method;
        this.join_type = join_type;
    }

    /** Creates an unnamed fork block ending with <b>join</b>. */
    public ForkBlock() {
        this("", JoinType.JOIN);
    }

    @Override
    public ForkBlock clone() {
        return (ForkBlock)super.clone();
    }

    public JoinType getJoinType() {
        return join_type;
    }

    @Override
    public boolean isParallel() {
        return true;
    }

    public static void defaultPrint(ForkBlock b, PrintWriter o) {
        o.print("fork");
        if (b.isNamed()) {
            o.print(" : " + b.name);
        }
        o.println("");
        printBody(b, o);
        o.print(b.join_type);
    }

}
