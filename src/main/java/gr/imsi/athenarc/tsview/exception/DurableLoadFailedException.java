package gr.imsi.athenarc.tsview.exception;

/**
 * Raised when the raw data of a dataset cannot be read from durable storage.
 */
public class DurableLoadFailedException extends TsApiException {

    public DurableLoadFailedException(String message) {
        super(message);
    }

    public DurableLoadFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
