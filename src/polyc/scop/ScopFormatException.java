package polyc.scop;

import java.io.IOException;

/**
* Thrown when a scop description cannot be read. The message names the line
* and the offending text.
*/
public class ScopFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public ScopFormatException(String message) {
        super(message);
    }

    public ScopFormatException(int line, String message) {
        super("line " + line + ": " + message);
    }

    public ScopFormatException(int line, String message, Throwable cause) {
        super("line " + line + ": " + message, cause);
    }

}
