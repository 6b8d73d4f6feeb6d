package polyc.codegen;

/**
* Thrown when the generated tree cannot be matched with the scop it was
* built from, e.g. a leaf names a statement the scop does not have. The
* whole code generation pass fails.
*/
public class CodeGenException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CodeGenException(String message) {
        super(message);
    }

    public CodeGenException(String message, Throwable cause) {
        super(message, cause);
    }

}
