package gpusync.hir;

/**
* Thrown when an operation expects an object to be a child of another object
* and it is not.
*/
public class NotAChildException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NotAChildException() {
        super();
    }

    public NotAChildException(String message) {
        super(message);
    }
}
