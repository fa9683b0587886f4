package bazaar.core.service.catalog;

/**
 * Raised when a review id does not exist on the record.
 */
public class ReviewNotFoundException extends RuntimeException {

    public ReviewNotFoundException(String message) {
        super(message);
    }
}
