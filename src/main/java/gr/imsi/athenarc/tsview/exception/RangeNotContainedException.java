package gr.imsi.athenarc.tsview.exception;

/**
 * Signals that a requested row range is not fully inside a previously cached one.
 * Only used inside the cache; callers see an eviction instead.
 */
public class RangeNotContainedException extends TsApiException {

    public RangeNotContainedException(String message) {
        super(message);
    }
}
