package gr.imsi.athenarc.tsview.exception;

/**
 * Raised when a table cannot be bucketed, e.g. it is empty or the bucket width collapses to zero.
 */
public class AggregationException extends TsApiDataException {

    public AggregationException(String message) {
        super(message);
    }
}
