package bazaar.core.service.catalog;

/**
 * Raised when the catalog store fails or does not answer in time.
 */
public class CatalogUnavailableException extends RuntimeException {

    private final String operation;

    public CatalogUnavailableException(String operation, Throwable cause) {
        super("Catalog store unavailable during " + operation
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
