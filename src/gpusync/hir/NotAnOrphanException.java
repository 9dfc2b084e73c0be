package gpusync.hir;

/**
* Thrown when a node that already has a parent is attached to another parent.
* Detach the node first, or attach a clone.
*/
public class NotAnOrphanException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NotAnOrphanException() {
        super();
    }

    public NotAnOrphanException(String message) {
        super(message);
    }
}
