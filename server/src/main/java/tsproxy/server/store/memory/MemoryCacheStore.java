package tsproxy.server.store.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Timer;
import java.util.TimerTask;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tsproxy.server.store.CacheStore;
import tsproxy.server.store.StoreEntry;

/**
 * In-process {@link CacheStore} with per-key expiry. Expired keys are dropped when they are next read or by
 * {@link #purgeExpired()}.
 */
public class MemoryCacheStore implements CacheStore {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryCacheStore.class);

    private static class Value {

        private final String data;
        private final Instant expiresAt;

        private Value(String data, Instant expiresAt) {
            this.data = data;
            this.expiresAt = expiresAt;
        }
    }

    private final Map<String, Value> values = new ConcurrentHashMap<>();
    private final Clock clock;
    private Timer maintenanceTimer = null;
    private final AtomicLong getCount = new AtomicLong(0);
    private final AtomicLong setCount = new AtomicLong(0);
    private final AtomicLong pipelineGetCount = new AtomicLong(0);
    private final AtomicLong pipelineSetCount = new AtomicLong(0);
    private final AtomicLong pipelineExecuteCount = new AtomicLong(0);

    public MemoryCacheStore() {
        this(Clock.systemUTC());
    }

    public MemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String get(String key) {
        getCount.incrementAndGet();
        return read(key);
    }

    @Override
    public boolean set(String key, String value, long expiry) {
        setCount.incrementAndGet();
        return write(new StoreEntry(key, value, expiry));
    }

    @Override
    public List<String> multiGet(List<String> keys) {
        pipelineExecuteCount.incrementAndGet();
        List<String> result = new ArrayList<>(keys.size());
        for (String key : keys) {
            pipelineGetCount.incrementAndGet();
            result.add(read(key));
        }
        return result;
    }

    @Override
    public List<Boolean> multiSet(List<StoreEntry> entries) {
        pipelineExecuteCount.incrementAndGet();
        List<Boolean> result = new ArrayList<>(entries.size());
        for (StoreEntry entry : entries) {
            pipelineSetCount.incrementAndGet();
            result.add(write(entry));
        }
        return result;
    }

    protected String read(String key) {
        Value v = values.get(key);
        if (v == null) {
            return null;
        }
        if (v.expiresAt != null && !clock.instant().isBefore(v.expiresAt)) {
            values.remove(key, v);
            return null;
        }
        return v.data;
    }

    protected boolean write(StoreEntry entry) {
        Instant expiresAt = entry.getExpiry() > 0 ? clock.instant().plusSeconds(entry.getExpiry()) : null;
        values.put(entry.getKey(), new Value(entry.getValue(), expiresAt));
        return true;
    }

    public void start(long purgeInterval) {
        maintenanceTimer = new Timer("MemoryCacheStoreTimer", true);
        maintenanceTimer.schedule(new TimerTask() {

            @Override
            public void run() {
                try {
                    purgeExpired();
                } catch (Exception e) {
                    LOG.error(e.getMessage(), e);
                }
            }
        }, purgeInterval, purgeInterval);
    }

    public void shutdown() {
        if (maintenanceTimer != null) {
            maintenanceTimer.cancel();
        }
    }

    public void purgeExpired() {
        Instant now = clock.instant();
        int before = values.size();
        values.entrySet().removeIf(e -> e.getValue().expiresAt != null && !now.isBefore(e.getValue().expiresAt));
        LOG.debug("Purged {} expired keys", before - values.size());
    }

    /**
     * @return remaining time to live in seconds, -1 when the key has no expiry, -2 when the key is absent
     */
    public long ttl(String key) {
        Value v = values.get(key);
        if (v == null) {
            return -2;
        }
        if (v.expiresAt == null) {
            return -1;
        }
        return Math.max(0, v.expiresAt.getEpochSecond() - clock.instant().getEpochSecond());
    }

    public int size() {
        return values.size();
    }

    public long getGetCount() {
        return getCount.get();
    }

    public long getSetCount() {
        return setCount.get();
    }

    public long getPipelineGetCount() {
        return pipelineGetCount.get();
    }

    public long getPipelineSetCount() {
        return pipelineSetCount.get();
    }

    public long getPipelineExecuteCount() {
        return pipelineExecuteCount.get();
    }

}
