package gr.imsi.athenarc.tsview.exception;

/**
 * Raised when no dominant spacing can be established for a timestamp sequence.
 * The outcome is a deterministic function of the input, so callers should not retry.
 */
public class FrequencyIndeterminateException extends TsApiDataException {

    private final int distinctDeltas;

    public FrequencyIndeterminateException(String message, int distinctDeltas) {
        super(message);
        this.distinctDeltas = distinctDeltas;
    }

    public int getDistinctDeltas() {
        return distinctDeltas;
    }
}
