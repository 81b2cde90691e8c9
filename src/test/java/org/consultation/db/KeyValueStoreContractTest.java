package org.consultation.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link KeyValueStore} implementation must share.
 */
public abstract class KeyValueStoreContractTest {

    protected KeyValueStore store;

    protected abstract KeyValueStore createStore() throws Exception;

    @BeforeEach
    public void openStore() throws Exception {
        store = createStore();
    }

    @AfterEach
    public void closeStore() {
        store.close();
    }

    @Test
    public void testCommittedWritesAreVisible() {
        store.inTransaction(tx -> {
            tx.put("A", "1");
            tx.put("B", "2");
            return null;
        });

        assertEquals("1", store.read(tx -> tx.get("A")));
        assertEquals("2", store.read(tx -> tx.get("B")));
        assertNull(store.read(tx -> tx.get("C")));
    }

    @Test
    public void testTransactionSeesItsOwnWrites() {
        String seen = store.inTransaction(tx -> {
            tx.put("A", "1");
            return tx.get("A");
        });
        assertEquals("1", seen);
    }

    @Test
    public void testFailedTransactionAppliesNothing() {
        store.inTransaction(tx -> {
            tx.put("A", "before");
            return null;
        });

        assertThrows(IllegalStateException.class, () -> store.inTransaction(tx -> {
            tx.put("A", "after");
            tx.put("B", "new");
            tx.delete("A");
            throw new IllegalStateException("abort");
        }));

        assertEquals("before", store.read(tx -> tx.get("A")));
        assertNull(store.read(tx -> tx.get("B")));
    }

    @Test
    public void testDelete() {
        store.inTransaction(tx -> {
            tx.put("A", "1");
            return null;
        });
        store.inTransaction(tx -> {
            tx.delete("A");
            assertNull(tx.get("A"));
            return null;
        });
        assertNull(store.read(tx -> tx.get("A")));
    }

    @Test
    public void testScanReturnsPrefixInKeyOrder() {
        store.inTransaction(tx -> {
            tx.put("VOTE:2:b", "x");
            tx.put("VOTE:1:b", "y");
            tx.put("VOTE:1:a", "z");
            tx.put("VOTES", "not a match");
            tx.put("OTHER:1:a", "w");
            return null;
        });

        SortedMap<String, String> scanned = store.read(tx -> tx.scan("VOTE:1:"));
        assertEquals(2, scanned.size());
        assertEquals("VOTE:1:a", scanned.firstKey());
        assertEquals("VOTE:1:b", scanned.lastKey());
    }

    @Test
    public void testScanMergesPendingWrites() {
        store.inTransaction(tx -> {
            tx.put("P:a", "1");
            tx.put("P:b", "2");
            return null;
        });

        SortedMap<String, String> scanned = store.inTransaction(tx -> {
            tx.delete("P:a");
            tx.put("P:c", "3");
            return tx.scan("P:");
        });

        assertEquals(2, scanned.size());
        assertFalse(scanned.containsKey("P:a"));
        assertEquals("3", scanned.get("P:c"));
    }

    @Test
    public void testReadViewRejectsWrites() {
        assertThrows(IllegalStateException.class, () -> store.read(tx -> {
            tx.put("A", "1");
            return null;
        }));
        assertNull(store.read(tx -> tx.get("A")));
    }
}
