package gr.imsi.athenarc.tsview.exception;

/**
 * Raised when a dataset or operation set id does not resolve to a stored record.
 */
public class UnknownEntityException extends TsApiException {

    public UnknownEntityException(String kind, String id) {
        super("Unknown " + kind + ": " + id);
    }
}
