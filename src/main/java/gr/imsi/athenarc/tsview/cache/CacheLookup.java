package gr.imsi.athenarc.tsview.cache;

import java.util.Optional;

/**
 * Result of a cache read. Distinguishes a key that is simply not cached from a store that could
 * not be asked, even though callers usually treat both as a miss.
 */
public final class CacheLookup {

    public enum Status {
        HIT,
        MISS,
        ERROR
    }

    private static final CacheLookup MISS = new CacheLookup(Status.MISS, null, null);

    private final Status status;
    private final CacheEntry entry;
    private final Throwable error;

    private CacheLookup(Status status, CacheEntry entry, Throwable error) {
        this.status = status;
        this.entry = entry;
        this.error = error;
    }

    public static CacheLookup hit(CacheEntry entry) {
        return new CacheLookup(Status.HIT, entry, null);
    }

    public static CacheLookup miss() {
        return MISS;
    }

    public static CacheLookup error(Throwable error) {
        return new CacheLookup(Status.ERROR, null, error);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isHit() {
        return status == Status.HIT;
    }

    public CacheEntry getEntry() {
        if (entry == null) {
            throw new IllegalStateException("No entry on a " + status);
        }
        return entry;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "CacheLookup{" + status + '}';
    }
}
