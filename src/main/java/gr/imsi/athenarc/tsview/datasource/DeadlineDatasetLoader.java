package gr.imsi.athenarc.tsview.datasource;

import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsview.domain.Table;
import gr.imsi.athenarc.tsview.exception.DurableLoadFailedException;
import gr.imsi.athenarc.tsview.exception.TsApiException;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a delegate loader on a separate executor so a slow durable read cannot hold the request
 * past a deadline.
 */
public class DeadlineDatasetLoader implements DatasetLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DeadlineDatasetLoader.class);

    private final DatasetLoader delegate;
    private final TimeLimiter timeLimiter;
    private final Duration timeout;

    public DeadlineDatasetLoader(DatasetLoader delegate, ExecutorService executor, Duration timeout) {
        this.delegate = delegate;
        this.timeLimiter = SimpleTimeLimiter.create(executor);
        this.timeout = timeout;
    }

    @Override
    public Table load(String datasetId) {
        try {
            return timeLimiter.callWithTimeout(() -> delegate.load(datasetId), timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Loading dataset {} timed out after {}", datasetId, timeout);
            throw new DurableLoadFailedException("Loading dataset " + datasetId + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DurableLoadFailedException("Interrupted while loading dataset " + datasetId, e);
        } catch (ExecutionException | UncheckedExecutionException e) {
            // keep the delegate's own taxonomy (unknown dataset, load failure)
            if (e.getCause() instanceof TsApiException) {
                throw (TsApiException) e.getCause();
            }
            throw new DurableLoadFailedException("Failed to load dataset " + datasetId, e.getCause());
        }
    }
}
