package svlower.hir;

/**
* Loop unrolling request attached to a {@link WhileLoop} by a preceding
* unroll pragma.
*/
public enum UnrollDirective {

    /** No request; later passes decide. */
    DEFAULT,

    /** The loop must be fully unrolled. */
    FULL,

    /** The loop must not be unrolled. */
    DISABLE

}
