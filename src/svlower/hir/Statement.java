package svlower.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class for all statements.
* Statement is the base class of numerous specific statement classes.
*/
public abstract class Statement implements Cloneable, Traversable {

    /** The print method for the statement */
    protected Method object_print_method;

    /** The parent traversable object */
    protected Traversable parent;

    /** The list of children of the statement */
    protected List<Traversable> children;

    /** The position of the statement */
    protected int line_number = -1;

    /** Empty child list for statements with no child */
    protected static final List empty_list =
            Collections.unmodifiableList(new ArrayList<Object>(0));

    /** Constructor for derived classes. */
    protected Statement() {
        parent = null;
        children = new ArrayList<Traversable>(1);
    }

    /**
    * Constructor for derived classes that preallocates
    * space for multiple children.
    *
    * @param size The expected number of children for this statement, or a
    *   negative number for statements that never have children.
    */
    @SuppressWarnings("unchecked")
    protected Statement(int size) {
        parent = null;
        if (size < 0) {
            children = empty_list;
        } else {
            children = new ArrayList<Traversable>(size);
        }
    }

    /**
    * Returns a deep copy of the statement. References from the copy to
    * labels and variables outside the copied subtree are left unchanged;
    * {@link CompoundStatement#clone()} relinks the ones inside it.
    */
    @Override
    public Statement clone() {
        Statement o = null;
        try {
            o = (Statement)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError();
        }
        o.object_print_method = object_print_method;
        o.parent = null;
        if (children != empty_list) {
            o.children = new ArrayList<Traversable>(children.size());
            int children_size = children.size();
            for (int i = 0; i < children_size; i++) {
                Traversable child = children.get(i);
                Traversable o_child = null;
                if (child instanceof Statement) {
                    o_child = ((Statement)child).clone();
                } else if (child instanceof Expression) {
                    o_child = ((Expression)child).clone();
                } else if (child != null) {
                    throw new InternalError(
                            "Statement contains an unknown child type" + this);
                }
                if (o_child != null) {
                    o_child.setParent(o);
                }
                o.children.add(o_child);
            }
        }
        return o;
    }

    /**
    * Compares the statement with the specified object for equality.
    *
    * @param o the object to be compared.
    * @return true if {@code (o == this)}, false otherwise.
    */
    @Override
    public boolean equals(Object o) {
        return (o == this);
    }

    /**
    * Returns the identity hash code of the statement.
    */
    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    /**
    * Detaches this statement from it's parent, if it has one.
    */
    public void detach() {
        if (parent != null) {
            parent.removeChild(this);
            setParent(null);
        }
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    /**
    * Prints the statement on the specified print writer.
    *
    * @param o the target print writer.
    */
    public void print(PrintWriter o) {
        if (object_print_method == null) {
            return;
        }
        try {
            object_print_method.invoke(null, new Object[] {this, o});
        } catch(IllegalAccessException e) {
            throw new InternalError(e.getMessage());
        } catch(InvocationTargetException e) {
            throw new InternalError(e.getMessage());
        }
    }

    /**
    * Removes a specific child of this statement;
    * some statements do not support this method.
    *
    * @param child The child to remove.
    */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(
            "This statement does not support removal of arbitrary children.");
    }

    public void setChild(int index, Traversable t) {
        if (t == null || index < 0 || index >= children.size()) {
            throw new IllegalArgumentException();
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        // Detach the old child
        if (children.get(index) != null) {
            children.get(index).setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    /**
    * Inserts the specified traversable object at the end of the child list.
    *
    * @param t the traversable object to be inserted.
    * @throws IllegalArgumentException if <b>t</b> is null.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(Traversable t) {
        if (t == null) {
            throw new IllegalArgumentException("invalid child inserted.");
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(this.getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

    /**
    * Inserts the specified traversable object at the specified position.
    *
    * @param t the traversable object to be inserted.
    * @throws IllegalArgumentException if <b>t</b> is null or index is
    * out-of-bound.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(int index, Traversable t) {
        if (t == null || index < 0 || index > children.size()) {
            throw new IllegalArgumentException("invalid child inserted.");
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(this.getClass().getName());
        }
        children.add(index, t);
        t.setParent(this);
    }

    /**
    * Swaps two statements on the IR tree.  If neither this statement nor
    * <var>stmt</var> has a parent, then this function has no effect.
    * Otherwise, each statement ends up with the other's parent. Swapping an
    * attached statement with an orphan replaces it in place.
    *
    * @param stmt The statement with which to swap this statement.
    * @throws IllegalArgumentException if <var>stmt</var> is null.
    * @throws IllegalStateException if a parent does not list the statement
    *   as its child.
    */
    public void swapWith(Statement stmt) {
        if (stmt == null) {
            throw new IllegalArgumentException();
        }
        if (this == stmt) {
            return;
        }
        // The order below matters: both get detached before either is set.
        Traversable this_parent = this.parent;
        Traversable stmt_parent = stmt.parent;
        int this_index = -1, stmt_index = -1;
        if (this_parent != null) {
            this_index = Tools.identityIndexOf(this_parent.getChildren(), this);
            if (this_index == -1) {
                throw new IllegalStateException();
            }
        }
        if (stmt_parent != null) {
            stmt_index = Tools.identityIndexOf(stmt_parent.getChildren(), stmt);
            if (stmt_index == -1) {
                throw new IllegalStateException();
            }
        }
        stmt.parent = null;
        this.parent = null;
        if (this_parent != null) {
            this_parent.getChildren().set(this_index, stmt);
            stmt.setParent(this_parent);
        }
        if (stmt_parent != null) {
            stmt_parent.getChildren().set(stmt_index, this);
            this.setParent(stmt_parent);
        }
    }

    /**
    * Sets the line number of this statement.
    * This function is to be used only by front ends and tests.
    *
    * @param line The line number
    */
    public void setLineNumber(int line) {
        line_number = line;
    }

    /** Returns a string representation of the statement */
    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

    /**
    * Returns the line number of this statement if the
    * statement was present in the original source file.
    * Statements added by compiler passes return -1 unless
    * the pass copied the line of the statement it replaced.
    *
    * @return the line number of this statement.
    */
    public int where() {
        return line_number;
    }

}
