package gr.imsi.athenarc.tsview.cache.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import gr.imsi.athenarc.tsview.exception.StoreUnavailableException;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class DeadlineKeyValueStoreTest {

    @Mock
    private KeyValueStore delegate;

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    private DeadlineKeyValueStore store;

    private DeadlineKeyValueStore store() {
        store = new DeadlineKeyValueStore(delegate, executor, Duration.ofMillis(200));
        return store;
    }

    @AfterEach
    public void tearDown() {
        if (store != null) {
            store.close();
        }
        executor.shutdownNow();
    }

    @Test
    public void testCallsWithinDeadlinePassThrough() {
        when(delegate.get("key")).thenReturn(new byte[]{7});
        when(delegate.delete("key")).thenReturn(true);

        assertArrayEquals(new byte[]{7}, store().get("key"));
        store.set("key", new byte[]{8}, Duration.ofSeconds(1));
        assertTrue(store.delete("key"));
        verify(delegate).set("key", new byte[]{8}, Duration.ofSeconds(1));
    }

    @Test
    public void testSlowCallIsReportedUnavailable() {
        when(delegate.get("key")).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return new byte[0];
        });
        assertThrows(StoreUnavailableException.class, () -> store().get("key"));
    }

    @Test
    public void testDelegateUnavailabilityIsKept() {
        StoreUnavailableException down = new StoreUnavailableException("down");
        when(delegate.get("key")).thenThrow(down);
        assertSame(down, assertThrows(StoreUnavailableException.class, () -> store().get("key")));
    }

    @Test
    public void testOtherFailuresBecomeUnavailability() {
        IllegalStateException boom = new IllegalStateException("boom");
        doAnswer(invocation -> {
            throw boom;
        }).when(delegate).set("key", null, null);
        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> store().set("key", null, null));
        assertEquals(boom, e.getCause());
    }

    @Test
    public void testCallsRunOnTheGivenExecutor() {
        ExecutorService named = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "store-call"));
        try {
            when(delegate.get("key")).thenAnswer(invocation -> Thread.currentThread().getName().getBytes());
            DeadlineKeyValueStore bounded = new DeadlineKeyValueStore(delegate, named, Duration.ofSeconds(5));

            assertArrayEquals("store-call".getBytes(), bounded.get("key"));
            bounded.close();
            assertFalse(named.isShutdown());
        } finally {
            named.shutdownNow();
        }
    }
}
