package svlower.hir;

/**
* Implemented by the statements that repeatedly execute a body: the targets
* of break and continue statements.
*/
public interface Loop extends Traversable {

    /**
    * Returns the statement that is executed in each iteration.
    *
    * @return the loop body.
    */
    CompoundStatement getBody();

}
