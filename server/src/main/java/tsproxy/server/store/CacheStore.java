package tsproxy.server.store;

import java.util.List;

/**
 * Key/value backing store for cached queries and series. Implementations must issue {@link #multiGet(List)} and
 * {@link #multiSet(List)} as a single round trip.
 */
public interface CacheStore {

    /**
     * @return the value stored under key, or null when absent or expired
     * @throws CacheStoreException
     *             when the store cannot be reached
     */
    String get(String key);

    /**
     * @param expiry
     *            time to live in seconds, 0 for none
     * @return true when the store acknowledged the write
     */
    boolean set(String key, String value, long expiry);

    /**
     * Pipelined read.
     *
     * @return one value per key, in key order, null for keys that are absent
     * @throws CacheStoreException
     *             when the store cannot be reached
     */
    List<String> multiGet(List<String> keys);

    /**
     * Pipelined write. Individual entries may fail while others succeed.
     *
     * @return one success flag per entry, in entry order
     */
    List<Boolean> multiSet(List<StoreEntry> entries);

}
