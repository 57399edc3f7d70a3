package sdline.it.validation.fit;

/**
 * Thrown when no singular value truncation yields a usable least-squares solution.
 */
public class SingularFitException extends RuntimeException {

    public SingularFitException(String message) {
        super(message);
    }

    public SingularFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
