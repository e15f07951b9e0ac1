package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a sequential <b>begin</b>/<b>end</b> block with an optional
* name. Named blocks are the targets of disable statements.
*/
public class Block extends CompoundStatement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = Block.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /** The block name, empty for an unnamed block */
    protected String name;

    /** Creates an unnamed block. */
    public Block() {
        this("");
    }

    /**
    * Creates a block with the specified name.
    *
    * @param name the block name; null or empty for an unnamed block.
    */
    public Block(String name) {
        object_print_method = class_print_method;
        this.name = (name == null) ? "" : name;
    }

    @Override
    public Block clone() {
        return (Block)super.clone();
    }

    /** Returns the block name, empty if the block is unnamed. */
    public String getName() {
        return name;
    }

    /** Checks if the block has a name. */
    public boolean isNamed() {
        return name.length() > 0;
    }

    /**
    * Renames the block.
    *
    * @param name the new name.
    */
    public void setName(String name) {
        this.name = (name == null) ? "" : name;
    }

    /** Checks if the statements of the block execute in parallel. */
    public boolean isParallel() {
        return false;
    }

    public static void defaultPrint(Block b, PrintWriter o) {
        o.print("begin");
        if (b.isNamed()) {
            o.print(" : " + b.name);
        }
        o.println("");
        printBody(b, o);
        o.print("end");
    }

}
