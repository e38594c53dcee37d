package gr.imsi.athenarc.tsview.cache.store;

import gr.imsi.athenarc.tsview.exception.StoreUnavailableException;

import java.time.Duration;

/**
 * A shared key-value store with per-key expiration, the only shared mutable resource of the cache.
 * Every call may block on I/O and may fail with {@link StoreUnavailableException}.
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * @return the stored bytes, or {@code null} if the key is absent or expired
     */
    byte[] get(String key) throws StoreUnavailableException;

    /**
     * Stores {@code value} under {@code key}, replacing any previous value.
     *
     * @param ttl time to live, after which the entry is no longer returned
     */
    void set(String key, byte[] value, Duration ttl) throws StoreUnavailableException;

    /**
     * @return true if an entry was removed
     */
    boolean delete(String key) throws StoreUnavailableException;

    @Override
    void close();
}
