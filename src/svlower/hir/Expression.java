package svlower.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class for all expressions. Expressions are compared lexically against
* other expressions when used in collections.
*/
public abstract class Expression implements Cloneable, Traversable {

    /** The print method for the expression */
    protected Method object_print_method;

    /** The parent object of the expression */
    protected Traversable parent;

    /** All children must be Expressions. */
    protected List<Traversable> children;

    /** Empty child list for expressions having no children */
    protected static final List empty_list =
            Collections.unmodifiableList(new ArrayList<Object>(0));

    /** Constructor for derived classes. */
    protected Expression() {
        parent = null;
        children = new ArrayList<Traversable>(1);
    }

    /**
    * Constructor for derived classes.
    *
    * @param size The initial size for the child list, or a negative number
    *   for leaf expressions.
    */
    @SuppressWarnings("unchecked")
    protected Expression(int size) {
        parent = null;
        if (size < 0) {
            children = empty_list;
        } else {
            children = new ArrayList<Traversable>(size);
        }
    }

    /**
    * Creates and returns a deep copy of this expression.
    *
    * @return a deep copy of this expression.
    */
    @Override
    public Expression clone() {
        Expression o = null;
        try {
            o = (Expression)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError();
        }
        o.object_print_method = object_print_method;
        o.parent = null;
        if (children != empty_list) {
            o.children = new ArrayList<Traversable>(children.size());
            for (int i = 0; i < children.size(); i++) {
                Expression new_child = ((Expression)children.get(i)).clone();
                new_child.setParent(o);
                o.children.add(new_child);
            }
        }
        return o;
    }

    /**
    * Checks if the given object has the same type with this expression and
    * its children are equal to this expression's. Sub classes having
    * additional fields call this method first.
    *
    * @param o the object to be compared with.
    */
    @Override
    public boolean equals(Object o) {
        if (o == null || this.getClass() != o.getClass()) {
            return false;
        }
        return children.equals(((Expression)o).children);
    }

    /**
    * Returns the hash code of the string representation since expressions
    * are compared lexically.
    */
    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    /* Traversable interface */
    public List<Traversable> getChildren() {
        return children;
    }

    /* Traversable interface */
    public Traversable getParent() {
        return parent;
    }

    /**
    * Prints the expression on the specified print writer.
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
    * This operation is not allowed.
    * @throws UnsupportedOperationException always
    */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(
                "Expressions do not support removal of arbitrary children.");
    }

    /**
    * @throws NotAnOrphanException if <b>t</b> has a parent object.
    * @throws IllegalArgumentException if <b>index</b> is out-of-range or
    * <b>t</b> is not an expression.
    */
    public void setChild(int index, Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        if (!(t instanceof Expression) || index >= children.size()) {
            throw new IllegalArgumentException();
        }
        // Detach the old child
        if (children.get(index) != null) {
            children.get(index).setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    /* Traversable interface */
    public void setParent(Traversable t) {
        parent = t;
    }

    /**
    * Swaps two expression on the IR tree.  If neither this expression nor
    * <var>expr</var> has a parent, then this function has no effect. Otherwise,
    * each expression ends up with the other's parent and exchange positions in
    * the parents' lists of children.
    *
    * @param expr The expression with which to swap this expression.
    * @throws IllegalArgumentException if <var>expr</var> is null.
    * @throws IllegalStateException if a parent does not list the expression
    *   as its child.
    */
    public void swapWith(Expression expr) {
        if (expr == null) {
            throw new IllegalArgumentException();
        }
        if (this == expr) {
            return;
        }
        Traversable this_parent = this.parent;
        Traversable expr_parent = expr.parent;
        int this_index = -1, expr_index = -1;
        if (this_parent != null) {
            this_index = Tools.identityIndexOf(this_parent.getChildren(), this);
            if (this_index == -1) {
                throw new IllegalStateException();
            }
        }
        if (expr_parent != null) {
            expr_index = Tools.identityIndexOf(expr_parent.getChildren(), expr);
            if (expr_index == -1) {
                throw new IllegalStateException();
            }
        }
        // detach both so setChild won't complain
        expr.parent = null;
        this.parent = null;
        if (this_parent != null) {
            this_parent.getChildren().set(this_index, expr);
            expr.setParent(this_parent);
        }
        if (expr_parent != null) {
            expr_parent.getChildren().set(expr_index, this);
            this.setParent(expr_parent);
        }
    }

    /** Returns a string representation of the expression */
    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        print(new PrintWriter(sw));
        return sw.toString();
    }

    /**
    * Common operation used in constructors - adds the specified traversable
    * object at the end of the child list.
    *
    * @param t the new child object to be added.
    * @throws IllegalArgumentException if <b>t</b> is null.
    * @throws NotAnOrphanException if <b>t</b> has a parent object.
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

}
