package svlower.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a module: a named scope holding module-level variables,
* processes and procedures.
*/
public final class Module implements Traversable {

    private Traversable parent;

    private List<Traversable> children;

    private String name;

    private String file_name;

    private boolean parameterized;

    private boolean dead;

    /**
    * Creates an empty module.
    *
    * @param name the module name.
    * @param file_name the source file the module was read from.
    */
    public Module(String name, String file_name) {
        parent = null;
        children = new ArrayList<Traversable>(4);
        this.name = name;
        this.file_name = file_name;
        parameterized = false;
        dead = false;
    }

    /**
    * Adds a module item: a variable declaration, a process or a procedure.
    *
    * @param item the item to add.
    * @throws IllegalArgumentException if <b>item</b> is not a module item.
    * @throws NotAnOrphanException if <b>item</b> has a parent.
    */
    public void addItem(Traversable item) {
        if (!(item instanceof VariableDeclaration ||
              item instanceof Process || item instanceof Procedure)) {
            throw new IllegalArgumentException("invalid module item " + item);
        }
        if (item.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.add(item);
        item.setParent(this);
    }

    public String getName() {
        return name;
    }

    public String getFileName() {
        return file_name;
    }

    /** Checks if the module has parameters. */
    public boolean isParameterized() {
        return parameterized;
    }

    public void setParameterized(boolean parameterized) {
        this.parameterized = parameterized;
    }

    /** Checks if the module is not instantiated and skipped by passes. */
    public boolean isDead() {
        return dead;
    }

    public void setDead(boolean dead) {
        this.dead = dead;
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    /**
    * Removes the specified module item.
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
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.get(index).setParent(null);
        children.set(index, t);
        t.setParent(this);
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    public void print(PrintWriter o) {
        o.println("module " + name + ";");
        PrintTools.printlnList(children, o);
        o.print("endmodule");
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
