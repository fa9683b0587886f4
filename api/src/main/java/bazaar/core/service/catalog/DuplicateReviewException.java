package bazaar.core.service.catalog;

/**
 * Raised when a user tries to review the same record twice.
 */
public class DuplicateReviewException extends RuntimeException {

    public DuplicateReviewException(String message) {
        super(message);
    }
}
