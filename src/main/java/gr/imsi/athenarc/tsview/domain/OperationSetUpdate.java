package gr.imsi.athenarc.tsview.domain;

/**
 * The record of an operation set before and after an in-place update.
 */
public class OperationSetUpdate {

    private final OperationSet previous;
    private final OperationSet current;

    public OperationSetUpdate(OperationSet previous, OperationSet current) {
        this.previous = previous;
        this.current = current;
    }

    public OperationSet getPrevious() {
        return previous;
    }

    public OperationSet getCurrent() {
        return current;
    }
}
