package gr.imsi.athenarc.tsview.cache;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsview.cache.store.KeyValueStore;
import gr.imsi.athenarc.tsview.datasource.DatasetLoader;
import gr.imsi.athenarc.tsview.domain.OperationSet;
import gr.imsi.athenarc.tsview.domain.RowRange;
import gr.imsi.athenarc.tsview.domain.Table;
import gr.imsi.athenarc.tsview.exception.RangeNotContainedException;
import gr.imsi.athenarc.tsview.exception.StoreUnavailableException;

import java.io.IOException;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Cache of serialized tables in a shared {@link KeyValueStore}. Two kinds of entries live side by side:
 * <ul>
 *     <li>keyed by dataset id, the full raw table of the dataset;</li>
 *     <li>keyed by operation set id, the raw slice for the operation set's current row range,
 *     stored together with that range.</li>
 * </ul>
 * The cache is an optimisation only: store failures are logged and degrade to a miss or a no-op,
 * they never reach the caller.
 */
public class ViewCache {

    private static final Logger LOG = LoggerFactory.getLogger(ViewCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final KeyValueStore store;
    private final TableCodec codec;
    private final Duration ttl;

    public ViewCache(KeyValueStore store) {
        this(store, DEFAULT_TTL);
    }

    public ViewCache(KeyValueStore store, Duration ttl) {
        this.store = Preconditions.checkNotNull(store, "store");
        this.ttl = Preconditions.checkNotNull(ttl, "ttl");
        this.codec = new TableCodec();
    }

    /**
     * Reads an entry. Never throws: store failures and undecodable blobs come back as {@link CacheLookup.Status#ERROR}.
     */
    public CacheLookup get(String key) {
        byte[] blob;
        try {
            blob = store.get(key);
        } catch (StoreUnavailableException e) {
            LOG.warn("Cache read of {} failed, treating as a miss: {}", key, e.getMessage());
            return CacheLookup.error(e);
        }
        if (blob == null) {
            return CacheLookup.miss();
        }
        try {
            return CacheLookup.hit(codec.decode(blob));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Discarding undecodable cache entry {}", key, e);
            delete(key);
            return CacheLookup.error(e);
        }
    }

    public boolean put(String key, Table table) {
        return put(key, CacheEntry.of(table), ttl);
    }

    public boolean put(String key, Table table, Duration entryTtl) {
        return put(key, CacheEntry.of(table), entryTtl);
    }

    public boolean put(String key, RowRange range, Table table, Duration entryTtl) {
        return put(key, CacheEntry.of(range, table), entryTtl);
    }

    /**
     * Best-effort write.
     *
     * @return true if the store accepted the entry
     */
    public boolean put(String key, CacheEntry entry, Duration entryTtl) {
        try {
            store.set(key, codec.encode(entry), entryTtl);
            return true;
        } catch (StoreUnavailableException e) {
            LOG.warn("Cache write of {} failed, continuing without it: {}", key, e.getMessage());
            return false;
        }
    }

    /**
     * Best-effort delete.
     *
     * @return true if an entry was removed
     */
    public boolean delete(String key) {
        try {
            return store.delete(key);
        } catch (StoreUnavailableException e) {
            LOG.warn("Cache delete of {} failed: {}", key, e.getMessage());
            return false;
        }
    }

    /**
     * Returns the raw slice of an operation set, from its own entry when that entry was computed
     * for the current range, otherwise from the cached or freshly loaded dataset.
     *
     * @param opset the operation set to resolve
     * @param loader reads the dataset from durable storage on a miss
     * @return rows {@code [offset, offset + limit)} of the dataset
     */
    public Table resolve(OperationSet opset, DatasetLoader loader) {
        CacheLookup cached = get(opset.getId());
        if (cached.isHit()) {
            CacheEntry entry = cached.getEntry();
            if (opset.getRange().equals(entry.getRange())) {
                LOG.debug("View {} served from cache", opset.getId());
                return entry.getTable();
            }
            // an update was persisted but never reconciled
            LOG.info("Cached view {} covers {} but {} is requested, evicting",
                    opset.getId(), entry.getRange(), opset.getRange());
            delete(opset.getId());
        }

        Table raw = loadDataset(opset.getDatasetId(), loader);
        Table slice = raw.slice(opset.getOffset(), opset.getLimit());
        put(opset.getId(), CacheEntry.of(opset.getRange(), slice), ttl);
        return slice;
    }

    private Table loadDataset(String datasetId, DatasetLoader loader) {
        CacheLookup cached = get(datasetId);
        if (cached.isHit()) {
            return cached.getEntry().getTable();
        }
        Stopwatch stopwatch = Stopwatch.createStarted();
        Table raw = loader.load(datasetId);
        LOG.info("Loaded dataset {} ({} rows) in {} ms", datasetId, raw.getRowCount(),
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
        put(datasetId, CacheEntry.of(raw), ttl);
        return raw;
    }

    /**
     * Brings the entry of an operation set in line with an in-place update of its range. If the new
     * range lies within the cached one, the cached slice is narrowed and written back under the same
     * id; otherwise, or whenever the outcome is uncertain, the entry is evicted so the next
     * {@link #resolve} reloads it.
     *
     * @param updated the operation set after the update
     * @param previous the operation set before the update
     * @return what happened to the entry
     */
    public ReconcileOutcome reconcile(OperationSet updated, OperationSet previous) {
        Preconditions.checkArgument(updated.getId().equals(previous.getId()),
                "Cannot reconcile %s with %s", updated.getId(), previous.getId());
        String key = updated.getId();

        CacheLookup cached = get(key);
        switch (cached.getStatus()) {
            case MISS:
                return ReconcileOutcome.ABSENT;
            case ERROR:
                delete(key);
                return ReconcileOutcome.EVICTED;
            default:
                break;
        }

        CacheEntry entry = cached.getEntry();
        if (!previous.getRange().equals(entry.getRange())) {
            LOG.info("Cached view {} covers {}, not the previous range {}, evicting",
                    key, entry.getRange(), previous.getRange());
            delete(key);
            return ReconcileOutcome.EVICTED;
        }

        RowRange relative;
        try {
            relative = subRange(previous.getOffset(), previous.getLimit(), updated.getOffset(), updated.getLimit());
        } catch (RangeNotContainedException e) {
            LOG.debug("Evicting view {}: {}", key, e.getMessage());
            delete(key);
            return ReconcileOutcome.EVICTED;
        }

        Table narrowed = entry.getTable().slice(relative.getOffset(), relative.getLimit());
        if (!put(key, CacheEntry.of(updated.getRange(), narrowed), ttl)) {
            // the wider slice must not keep answering for the new range
            delete(key);
            return ReconcileOutcome.EVICTED;
        }
        LOG.debug("Narrowed view {} from {} to {}", key, previous.getRange(), updated.getRange());
        return ReconcileOutcome.NARROWED;
    }

    /**
     * Locates a new range inside a prior one.
     *
     * @return the new range relative to the start of the prior one
     * @throws RangeNotContainedException if the new range is not fully inside the prior one, or
     *                                    either range has a negative offset or a non-positive limit
     */
    public static RowRange subRange(int priorOffset, int priorLimit, int newOffset, int newLimit) {
        if (priorOffset < 0 || newOffset < 0 || priorLimit <= 0 || newLimit <= 0) {
            throw new RangeNotContainedException("Invalid ranges (" + priorOffset + ", " + priorLimit
                    + ") and (" + newOffset + ", " + newLimit + ")");
        }
        RowRange prior = RowRange.of(priorOffset, priorLimit);
        RowRange requested = RowRange.of(newOffset, newLimit);
        if (!prior.contains(requested)) {
            throw new RangeNotContainedException(requested + " is not inside " + prior);
        }
        return RowRange.of(newOffset - priorOffset, newLimit);
    }

    /**
     * Drops the cached raw table of a dataset and every view computed from it.
     */
    public void evictDataset(String datasetId, Collection<String> operationSetIds) {
        delete(datasetId);
        for (String id : operationSetIds) {
            delete(id);
        }
        LOG.info("Evicted dataset {} and {} dependent views", datasetId, operationSetIds.size());
    }

    public Duration getTtl() {
        return ttl;
    }
}
