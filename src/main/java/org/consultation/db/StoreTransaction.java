package org.consultation.db;

import java.util.SortedMap;

/**
 * View of the keyed store inside one unit of work. Writes become visible to
 * other units only when the surrounding transaction commits.
 */
public interface StoreTransaction {

    /**
     * @return the value stored under {@code key}, or {@code null} if absent
     */
    String get(String key);

    void put(String key, String value);

    void delete(String key);

    /**
     * All entries whose key starts with {@code prefix}, in key order.
     */
    SortedMap<String, String> scan(String prefix);
}
