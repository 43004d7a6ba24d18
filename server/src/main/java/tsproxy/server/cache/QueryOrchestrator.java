package tsproxy.server.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import io.netty.handler.codec.http.HttpResponseStatus;
import tsproxy.api.response.TsProxyException;
import tsproxy.api.response.timeseries.QueryResponse;
import tsproxy.api.response.timeseries.QueryResult;
import tsproxy.common.configuration.CacheProperties;
import tsproxy.server.store.CacheStore;
import tsproxy.server.store.CacheStoreException;
import tsproxy.server.store.StoreEntry;

/**
 * Answers client queries from the cache, fetching from the upstream service what is missing or stale.
 * <p>
 * Each metric of a request is classified on its own:
 * <ul>
 * <li>{@link CacheState#COLD}: fetch the whole range, cache every series returned</li>
 * <li>{@link CacheState#HOT}: serve the cached series, no upstream call</li>
 * <li>{@link CacheState#WARM}: fetch from the last fetch until the end of the requested range and merge into the
 * cached series</li>
 * </ul>
 * Cache writes are best effort; an upstream failure fails the whole request.
 */
public class QueryOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(QueryOrchestrator.class);
    private static final String QUERIES = "queries";

    private final CacheStore store;
    private final BackendProxy proxy;
    private final CacheProperties config;
    private final Clock clock;

    public QueryOrchestrator(CacheStore store, BackendProxy proxy, CacheProperties config, Clock clock) {
        this.store = store;
        this.proxy = proxy;
        this.config = config;
        this.clock = clock;
    }

    public QueryResponse handle(JsonNode request) throws TsProxyException {
        Clock requestClock = Clock.fixed(clock.instant(), ZoneOffset.UTC);
        QueryResponse response = new QueryResponse();
        try {
            JsonNode metrics = request.path(QueryDescriptor.METRICS);
            if (!metrics.isArray() || metrics.size() == 0) {
                throw new IllegalArgumentException("No query specified.");
            }
            for (QueryDescriptor descriptor : QueryDescriptor.fromRequest(request, config, requestClock)) {
                response.addQuery(handle(descriptor, requestClock.instant()));
            }
        } catch (IllegalArgumentException e) {
            throw new TsProxyException(HttpResponseStatus.BAD_REQUEST.code(), "Invalid query", e.getMessage(), e);
        } catch (BackendQueryFailure e) {
            throw new TsProxyException(e.getStatusCode(), "Upstream query failed", e.getMessage(), e);
        }
        return response;
    }

    QueryResult handle(QueryDescriptor descriptor, Instant now) throws BackendQueryFailure {
        Optional<DescriptorRecord> record;
        try {
            record = descriptor.load(store);
        } catch (CacheStoreException e) {
            LOG.warn("Unable to read query {} from the cache, fetching from upstream: {}", descriptor.getCacheKey(),
                    e.getMessage());
            record = Optional.empty();
        }
        CacheState state = classify(descriptor, record);
        LOG.debug("Query {} is {}", descriptor.getCacheKey(), state);
        try {
            switch (state) {
                case HOT:
                    return hot(descriptor, record.get());
                case WARM:
                    return warm(descriptor, record.get(), now);
                default:
                    return cold(descriptor);
            }
        } catch (CacheStoreException e) {
            LOG.warn("Unable to read series of query {} from the cache, fetching from upstream: {}",
                    descriptor.getCacheKey(), e.getMessage());
            return cold(descriptor);
        }
    }

    CacheState classify(QueryDescriptor descriptor, Optional<DescriptorRecord> record) {
        if (!record.isPresent() || null == record.get().getLastAddData()) {
            return CacheState.COLD;
        }
        return descriptor.isStale(record.get().getLastAddData()) ? CacheState.WARM : CacheState.HOT;
    }

    private QueryResult cold(QueryDescriptor descriptor) throws BackendQueryFailure {
        TimeRange range = descriptor.getTimeRange();
        Map<String, SeriesCacheEntry> fetched = new LinkedHashMap<>();
        Duration chunkSize = config.getChunkSize();
        if (!chunkSize.isZero() && range.getDuration().compareTo(chunkSize) > 0) {
            // newest chunk first, so a shared boundary keeps the newer value
            for (JsonNode result : proxy.queryChunked(descriptor, range.chunk(chunkSize))) {
                for (SeriesCacheEntry entry : SeriesCacheEntry.fromResult(descriptor, firstQuery(result),
                        config.getSeriesExpiry())) {
                    SeriesCacheEntry existing = fetched.putIfAbsent(entry.getKey(), entry);
                    if (null != existing) {
                        existing.mergeFrom(entry, false);
                    }
                }
            }
        } else {
            JsonNode result = proxy.query(descriptor, range, true);
            for (SeriesCacheEntry entry : SeriesCacheEntry.fromResult(descriptor, firstQuery(result),
                    config.getSeriesExpiry())) {
                SeriesCacheEntry existing = fetched.putIfAbsent(entry.getKey(), entry);
                if (null != existing) {
                    existing.mergeFrom(entry, true);
                }
            }
        }
        QueryResult result = new QueryResult();
        List<StoreEntry> writes = new ArrayList<>(fetched.size());
        for (SeriesCacheEntry entry : fetched.values()) {
            descriptor.addSeries(entry);
            entry.buildResponse(descriptor, result, false);
            writes.add(entry.toStoreEntry());
        }
        writeSeries(writes);
        descriptor.persist(store, range.getStart(), null);
        return result;
    }

    private QueryResult hot(QueryDescriptor descriptor, DescriptorRecord record) {
        QueryResult result = new QueryResult();
        for (SeriesCacheEntry entry : SeriesCacheEntry.fromCache(store, descriptor, record.getSeriesKeys(),
                config.getSeriesExpiry())) {
            entry.buildResponse(descriptor, result, true);
        }
        return result;
    }

    private QueryResult warm(QueryDescriptor descriptor, DescriptorRecord record, Instant now)
            throws BackendQueryFailure {
        descriptor.restore(record);
        Map<String, SeriesCacheEntry> cached = new LinkedHashMap<>();
        for (SeriesCacheEntry entry : SeriesCacheEntry.fromCache(store, descriptor, record.getSeriesKeys(),
                config.getSeriesExpiry())) {
            cached.put(entry.getKey(), entry);
            descriptor.addSeries(entry);
        }
        TimeRange delta = delta(descriptor.getTimeRange(), Instant.ofEpochMilli(record.getLastAddData()));
        JsonNode fetched = proxy.query(descriptor, delta, true);
        long windowStart = descriptor.getTimeRange().getStart().toEpochMilli();

        QueryResult result = new QueryResult();
        List<StoreEntry> writes = new ArrayList<>();
        for (SeriesCacheEntry entry : SeriesCacheEntry.fromResult(descriptor, firstQuery(fetched),
                config.getSeriesExpiry())) {
            SeriesCacheEntry existing = cached.remove(entry.getKey());
            if (null != existing) {
                existing.mergeFrom(entry, true);
                existing.dropBefore(windowStart);
                writes.add(existing.toStoreEntry());
                existing.buildResponse(descriptor, result, true);
            } else {
                descriptor.addSeries(entry);
                writes.add(entry.toStoreEntry());
                entry.buildResponse(descriptor, result, false);
            }
        }
        // cached series with nothing new in the delta are served as they are
        for (SeriesCacheEntry entry : cached.values()) {
            entry.buildResponse(descriptor, result, true);
        }
        writeSeries(writes);
        descriptor.persist(store, descriptor.getTimeRange().getStart(), now);
        return result;
    }

    /**
     * The part of range not covered by the fetch that ended at lastAdd. Clamped to range so that a query whose end
     * lies in the past never fetches beyond it.
     */
    static TimeRange delta(TimeRange range, Instant lastAdd) {
        Instant start = lastAdd;
        if (start.isBefore(range.getStart())) {
            start = range.getStart();
        }
        if (start.isAfter(range.getEnd())) {
            start = range.getEnd();
        }
        return new TimeRange(start, range.getEnd());
    }

    private void writeSeries(List<StoreEntry> writes) {
        if (writes.isEmpty()) {
            return;
        }
        List<Boolean> results = store.multiSet(writes);
        int successful = 0;
        for (Boolean ok : results) {
            if (Boolean.TRUE.equals(ok)) {
                successful++;
            }
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug(String.format("Series write pipeline: %d of %d successful", successful, writes.size()));
        }
    }

    private static JsonNode firstQuery(JsonNode result) {
        return result.path(QUERIES).path(0);
    }
}
