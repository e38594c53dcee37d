package gr.imsi.athenarc.tsview.exception;

/**
 * Raised when the raw data of a dataset cannot be removed from durable storage.
 */
public class DurableDeleteFailedException extends TsApiException {

    public DurableDeleteFailedException(String message) {
        super(message);
    }

    public DurableDeleteFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
