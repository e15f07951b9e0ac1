package svlower.hir;

/**
* Thrown when an action requires an IR object to be the child of
* another object, but that is not the case.
*/
public class NotAChildException extends RuntimeException {

    private static final long serialVersionUID = 3479L;

    public NotAChildException() {
        super();
    }

    public NotAChildException(String message) {
        super(message);
    }

}
