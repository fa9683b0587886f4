package bazaar.core.service.catalog;

/**
 * Raised when a user tries to remove a review they did not write.
 */
public class ReviewNotPermittedException extends RuntimeException {

    public ReviewNotPermittedException(String message) {
        super(message);
    }
}
