package svlower.hir;

/**
* Integral data type of a variable: a name, a bit width and a signedness.
*/
public final class DataType {

    /** Signed 32-bit <b>int</b> */
    public static final DataType INT = new DataType("int", 32, true);

    /** Unsigned single-bit <b>logic</b> */
    public static final DataType LOGIC = new DataType("logic", 1, false);

    private final String name;

    private final int width;

    private final boolean signed;

    /**
    * Creates a data type.
    *
    * @param name the printed name of the type.
    * @param width the number of bits.
    * @param signed true for a signed type.
    */
    public DataType(String name, int width, boolean signed) {
        if (width <= 0) {
            throw new IllegalArgumentException("invalid width " + width);
        }
        this.name = name;
        this.width = width;
        this.signed = signed;
    }

    public String getName() {
        return name;
    }

    public int getWidth() {
        return width;
    }

    public boolean isSigned() {
        return signed;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DataType)) {
            return false;
        }
        DataType other = (DataType)o;
        return (name.equals(other.name) && width == other.width &&
                signed == other.signed);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + width) + (signed ? 1 : 0);
    }

    @Override
    public String toString() {
        return name;
    }

}
