package svlower.hir;

import java.io.PrintWriter;
import java.util.HashMap;

/**
* Infix operators that act on two expressions.
*/
public class BinaryOperator implements Printable {

    private static HashMap<String, BinaryOperator> op_map =
            new HashMap<String, BinaryOperator>(16);

    private static String[] names = {
            "+", "-", "*", "==", "!=", ">", ">=", "<", "<=", "&&", "||"};

    /**
    * +
    */
    public static final BinaryOperator ADD = new BinaryOperator(0);

    /**
    * -
    */
    public static final BinaryOperator SUBTRACT = new BinaryOperator(1);

    /**
    * *
    */
    public static final BinaryOperator MULTIPLY = new BinaryOperator(2);

    /**
    * ==
    */
    public static final BinaryOperator COMPARE_EQ = new BinaryOperator(3);

    /**
    * &#33;=
    */
    public static final BinaryOperator COMPARE_NE = new BinaryOperator(4);

    /**
    * &gt;
    */
    public static final BinaryOperator COMPARE_GT = new BinaryOperator(5);

    /**
    * &gt;=
    */
    public static final BinaryOperator COMPARE_GE = new BinaryOperator(6);

    /**
    * &lt;
    */
    public static final BinaryOperator COMPARE_LT = new BinaryOperator(7);

    /**
    * &lt;=
    */
    public static final BinaryOperator COMPARE_LE = new BinaryOperator(8);

    /**
    * &amp;&amp;
    */
    public static final BinaryOperator LOGICAL_AND = new BinaryOperator(9);

    /**
    * ||
    */
    public static final BinaryOperator LOGICAL_OR = new BinaryOperator(10);

    protected int value;

    protected BinaryOperator() {
    }

    /**
    * Used internally -- you may not create arbitrary binary operators
    * and may only use the ones provided as static members.
    *
    * @param value The numeric code of the operator.
    */
    private BinaryOperator(int value) {
        this.value = value;
        op_map.put(names[value], this);
    }

    /**
    * Returns a binary operator that matches the specified string <tt>s</tt>.
    * @param s the string to be matched.
    * @return the matching operator or null if not found.
    */
    public static BinaryOperator fromString(String s) {
        return op_map.get(s);
    }

    public void print(PrintWriter o) {
        o.print(names[value]);
    }

    @Override
    public String toString() {
        return names[value];
    }

    /**
    * Checks if this operator belongs to binary comparison operator.
    */
    public boolean isCompare() {
        return (value >= 3 && value <= 8);
    }

    /**
    * Checks if this operator belongs to boolean logic operator.
    */
    public boolean isLogical() {
        return (value >= 9 && value <= 10);
    }

}
