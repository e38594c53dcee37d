package gr.imsi.athenarc.tsview.exception;

/**
 * Base class for every failure raised by the time series view layer.
 */
public class TsApiException extends RuntimeException {

    public TsApiException(String message) {
        super(message);
    }

    public TsApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
