package svlower.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents the whole design of one compilation: the root of the IR tree.
*/
public final class Program implements Traversable {

    private List<Traversable> children;

    /** Creates an empty program. */
    public Program() {
        children = new ArrayList<Traversable>(4);
    }

    /**
    * Adds a module to the program.
    *
    * @param module the module to add.
    * @throws NotAnOrphanException if <b>module</b> has a parent.
    */
    public void addModule(Module module) {
        if (module.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.add(module);
        module.setParent(this);
    }

    /** Returns the modules of the program. */
    @SuppressWarnings("unchecked")
    public List<Module> getModules() {
        return (List)children;
    }

    public List<Traversable> getChildren() {
        return children;
    }

    /** A program is the root; its parent is always null. */
    public Traversable getParent() {
        return null;
    }

    /**
    * Removes the specified module.
    *
    * @throws NotAChildException if <b>child</b> is not found.
    */
    public void removeChild(Traversable child) {
        int index = Tools.identityIndexOf(children, child);
        if (index == -1) {
            throw new NotAChildException();
        }
        children.remove(index);
        child.setParent(null);
    }

    public void setChild(int index, Traversable t) {
        if (!(t instanceof Module)) {
            throw new IllegalArgumentException();
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.get(index).setParent(null);
        children.set(index, t);
        t.setParent(this);
    }

    /**
    * A program cannot have a parent.
    * @throws UnsupportedOperationException always
    */
    public void setParent(Traversable t) {
        throw new UnsupportedOperationException();
    }

    public void print(PrintWriter o) {
        PrintTools.printlnList(children, o);
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
