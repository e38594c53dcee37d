package gr.imsi.athenarc.tsview.cache;

/** What {@link ViewCache#reconcile} did with the entry of an updated operation set. */
public enum ReconcileOutcome {
    /** Nothing was cached for the operation set. */
    ABSENT,
    /** The cached slice covered the new range and was narrowed in place. */
    NARROWED,
    /** The entry could not serve the new range and was deleted. */
    EVICTED
}
