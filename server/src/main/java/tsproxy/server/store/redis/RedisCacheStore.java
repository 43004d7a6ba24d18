package tsproxy.server.store.redis;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.Response;
import redis.clients.jedis.exceptions.JedisException;
import tsproxy.server.store.CacheStore;
import tsproxy.server.store.CacheStoreException;
import tsproxy.server.store.StoreEntry;

public class RedisCacheStore implements CacheStore {

    private static final Logger LOG = LoggerFactory.getLogger(RedisCacheStore.class);
    private static final String OK = "OK";

    private final JedisPool pool;

    public RedisCacheStore(JedisPool pool) {
        this.pool = pool;
    }

    @Override
    public String get(String key) {
        try (Jedis jedis = pool.getResource()) {
            return jedis.get(key);
        } catch (JedisException e) {
            throw new CacheStoreException("Unable to read " + key, e);
        }
    }

    @Override
    public boolean set(String key, String value, long expiry) {
        try (Jedis jedis = pool.getResource()) {
            String reply = expiry > 0 ? jedis.setex(key, (int) expiry, value) : jedis.set(key, value);
            return OK.equals(reply);
        } catch (JedisException e) {
            LOG.error("Unable to write " + key, e);
            return false;
        }
    }

    @Override
    public List<String> multiGet(List<String> keys) {
        List<String> values = new ArrayList<>(keys.size());
        if (keys.isEmpty()) {
            return values;
        }
        try (Jedis jedis = pool.getResource()) {
            Pipeline pipeline = jedis.pipelined();
            List<Response<String>> responses = new ArrayList<>(keys.size());
            for (String key : keys) {
                responses.add(pipeline.get(key));
            }
            pipeline.sync();
            for (int i = 0; i < responses.size(); i++) {
                try {
                    values.add(responses.get(i).get());
                } catch (JedisException e) {
                    LOG.warn("Pipelined read of {} failed: {}", keys.get(i), e.getMessage());
                    values.add(null);
                }
            }
            return values;
        } catch (JedisException e) {
            throw new CacheStoreException("Unable to read " + keys.size() + " keys", e);
        }
    }

    @Override
    public List<Boolean> multiSet(List<StoreEntry> entries) {
        List<Boolean> results = new ArrayList<>(entries.size());
        if (entries.isEmpty()) {
            return results;
        }
        try (Jedis jedis = pool.getResource()) {
            Pipeline pipeline = jedis.pipelined();
            List<Response<String>> responses = new ArrayList<>(entries.size());
            for (StoreEntry entry : entries) {
                if (entry.getExpiry() > 0) {
                    responses.add(pipeline.setex(entry.getKey(), (int) entry.getExpiry(), entry.getValue()));
                } else {
                    responses.add(pipeline.set(entry.getKey(), entry.getValue()));
                }
            }
            pipeline.sync();
            for (int i = 0; i < responses.size(); i++) {
                try {
                    results.add(OK.equals(responses.get(i).get()));
                } catch (JedisException e) {
                    LOG.warn("Pipelined write of {} failed: {}", entries.get(i).getKey(), e.getMessage());
                    results.add(false);
                }
            }
        } catch (JedisException e) {
            LOG.error("Unable to write " + entries.size() + " keys", e);
            while (results.size() < entries.size()) {
                results.add(false);
            }
        }
        return results;
    }

}
