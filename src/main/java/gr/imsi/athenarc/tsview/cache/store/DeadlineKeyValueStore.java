package gr.imsi.athenarc.tsview.cache.store;

import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsview.exception.StoreUnavailableException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every call to a delegate store by a deadline. A call that runs past it is interrupted and
 * reported as {@link StoreUnavailableException}, the same as a transport error. Calls run on the
 * given executor, which stays owned by the caller; a bounded pool caps the threads left behind by a
 * delegate that ignores interruption.
 */
public class DeadlineKeyValueStore implements KeyValueStore {

    private static final Logger LOG = LoggerFactory.getLogger(DeadlineKeyValueStore.class);

    private final KeyValueStore delegate;
    private final Duration timeout;
    private final TimeLimiter timeLimiter;

    public DeadlineKeyValueStore(KeyValueStore delegate, ExecutorService executor, Duration timeout) {
        this.delegate = delegate;
        this.timeout = timeout;
        this.timeLimiter = SimpleTimeLimiter.create(executor);
    }

    @Override
    public byte[] get(String key) {
        return call("get", key, () -> delegate.get(key));
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        call("set", key, () -> {
            delegate.set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean delete(String key) {
        Boolean deleted = call("delete", key, () -> delegate.delete(key));
        return deleted != null && deleted;
    }

    private <T> T call(String operation, String key, Callable<T> callable) {
        try {
            return timeLimiter.callWithTimeout(callable, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Store {} of {} timed out after {}", operation, key, timeout);
            throw new StoreUnavailableException("Store " + operation + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted during store " + operation, e);
        } catch (ExecutionException | UncheckedExecutionException e) {
            if (e.getCause() instanceof StoreUnavailableException) {
                throw (StoreUnavailableException) e.getCause();
            }
            throw new StoreUnavailableException("Store " + operation + " failed", e.getCause());
        }
    }

    @Override
    public void close() {
        delegate.close();
    }
}
