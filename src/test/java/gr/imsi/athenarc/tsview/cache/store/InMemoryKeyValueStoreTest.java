package gr.imsi.athenarc.tsview.cache.store;

import com.google.common.base.Ticker;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemoryKeyValueStoreTest {

    private static final class ManualTicker extends Ticker {
        private long nanos;

        @Override
        public long read() {
            return nanos;
        }

        void advance(Duration duration) {
            nanos += duration.toNanos();
        }
    }

    private final ManualTicker ticker = new ManualTicker();
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(10, Duration.ofHours(1), ticker);

    @Test
    public void testValuesExpireAfterTheirOwnTtl() {
        store.set("short", new byte[]{1}, Duration.ofSeconds(10));
        store.set("long", new byte[]{2}, Duration.ofMinutes(10));

        ticker.advance(Duration.ofSeconds(9));
        assertArrayEquals(new byte[]{1}, store.get("short"));

        ticker.advance(Duration.ofSeconds(1));
        assertNull(store.get("short"));
        assertArrayEquals(new byte[]{2}, store.get("long"));
    }

    @Test
    public void testOverwriteRefreshesTtl() {
        store.set("key", new byte[]{1}, Duration.ofSeconds(10));
        ticker.advance(Duration.ofSeconds(8));
        store.set("key", new byte[]{3}, Duration.ofSeconds(10));
        ticker.advance(Duration.ofSeconds(8));
        assertArrayEquals(new byte[]{3}, store.get("key"));
    }

    @Test
    public void testDeleteReportsWhetherSomethingWasRemoved() {
        store.set("key", new byte[]{1}, Duration.ofSeconds(10));
        assertTrue(store.delete("key"));
        assertFalse(store.delete("key"));
        assertNull(store.get("key"));
    }

    @Test
    public void testStoredBytesAreCopied() {
        byte[] value = {1, 2, 3};
        store.set("key", value, Duration.ofSeconds(10));
        value[0] = 9;
        store.get("key")[1] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, store.get("key"));
    }

    @Test
    public void testSizeIsBounded() {
        for (int i = 0; i < 50; i++) {
            store.set("key-" + i, new byte[]{(byte) i}, Duration.ofSeconds(10));
        }
        assertTrue(store.size() <= 10);
    }

    @Test
    public void testTtlMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> store.set("key", new byte[0], Duration.ZERO));
    }

    @Test
    public void testCloseDropsEverything() {
        store.set("key", new byte[]{1}, Duration.ofSeconds(10));
        store.close();
        assertEquals(0, store.size());
    }
}
