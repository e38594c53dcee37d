package gr.imsi.athenarc.tsview.exception;

/**
 * Transport failure or timeout while talking to the cache store.
 */
public class StoreUnavailableException extends TsApiException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
