package polyc.hir;

/**
* Thrown when a child is added to an IR node while it still belongs to
* another one. Detach or clone the child first.
*/
public class NotAnOrphanException extends RuntimeException {

    private static final long serialVersionUID = 1;

    public NotAnOrphanException() {
        super();
    }

    public NotAnOrphanException(String message) {
        super(message);
    }

}
