package gr.imsi.athenarc.tsview.exception;

/**
 * Raised when the shape or content of a dataset does not allow the requested operation.
 */
public class TsApiDataException extends TsApiException {

    public TsApiDataException(String message) {
        super(message);
    }

    public TsApiDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
