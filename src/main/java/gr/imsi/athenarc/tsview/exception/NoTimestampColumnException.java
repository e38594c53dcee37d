package gr.imsi.athenarc.tsview.exception;

/**
 * Raised at ingestion time when a table carries no temporal column.
 */
public class NoTimestampColumnException extends TsApiDataException {

    public NoTimestampColumnException(String message) {
        super(message);
    }
}
