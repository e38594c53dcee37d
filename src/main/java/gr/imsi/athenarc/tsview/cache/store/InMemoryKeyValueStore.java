package gr.imsi.athenarc.tsview.cache.store;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;

/**
 * Process-local {@link KeyValueStore} on top of a Guava {@link Cache}. Guava only supports a single
 * expiry policy per cache, so each value carries its own deadline, checked on read against the
 * cache's {@link Ticker}; the cache-wide expiry only bounds how long dead entries linger.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

    private final Cache<String, ExpiringValue> cache;
    private final Ticker ticker;

    public InMemoryKeyValueStore(long maxEntries, Duration maxTtl) {
        this(maxEntries, maxTtl, Ticker.systemTicker());
    }

    public InMemoryKeyValueStore(long maxEntries, Duration maxTtl, Ticker ticker) {
        Preconditions.checkArgument(maxEntries > 0, "maxEntries must be positive");
        this.ticker = ticker;
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(maxTtl)
                .ticker(ticker)
                .build();
        LOG.info("Created in-memory store for {} entries, max ttl {}", maxEntries, maxTtl);
    }

    @Override
    public byte[] get(String key) {
        ExpiringValue value = cache.getIfPresent(key);
        if (value == null) {
            return null;
        }
        if (ticker.read() >= value.expiresAtNanos) {
            cache.invalidate(key);
            return null;
        }
        return Arrays.copyOf(value.bytes, value.bytes.length);
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        Preconditions.checkArgument(!ttl.isNegative() && !ttl.isZero(), "ttl must be positive");
        cache.put(key, new ExpiringValue(Arrays.copyOf(value, value.length), ticker.read() + ttl.toNanos()));
    }

    @Override
    public boolean delete(String key) {
        boolean present = cache.getIfPresent(key) != null;
        cache.invalidate(key);
        return present;
    }

    public long size() {
        cache.cleanUp();
        return cache.size();
    }

    @Override
    public void close() {
        cache.invalidateAll();
    }

    private static final class ExpiringValue {
        private final byte[] bytes;
        private final long expiresAtNanos;

        private ExpiringValue(byte[] bytes, long expiresAtNanos) {
            this.bytes = bytes;
            this.expiresAtNanos = expiresAtNanos;
        }
    }
}
