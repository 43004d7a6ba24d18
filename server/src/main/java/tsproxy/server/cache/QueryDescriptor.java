package tsproxy.server.cache;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Iterables;

import tsproxy.common.configuration.CacheProperties;
import tsproxy.server.store.CacheStore;
import tsproxy.util.JsonUtil;

/**
 * One metric query of a client request and the cache bookkeeping for it.
 * <p>
 * The cache key is derived from the metric query and the request's time range fields when the descriptor is built
 * and never changes afterwards. The series it owns and the fetch timestamps are kept apart from the key basis and
 * written with it as a {@link DescriptorRecord}.
 */
public class QueryDescriptor {

    private static final Logger LOG = LoggerFactory.getLogger(QueryDescriptor.class);

    public static final String METRICS = "metrics";
    public static final String AGGREGATORS = "aggregators";
    public static final String ALIGN_SAMPLING = "align_sampling";
    public static final String ALIGN_START_TIME = "align_start_time";

    private static final String[] TIME_FIELDS = { TimeRange.START_RELATIVE, TimeRange.END_RELATIVE,
            TimeRange.START_ABSOLUTE, TimeRange.END_ABSOLUTE, TimeRange.TIME_ZONE };

    private final ObjectNode metric;
    private final ObjectNode basis;
    private final String cacheKey;
    private final TimeRange timeRange;
    private final CacheProperties config;
    private final Clock clock;
    private final Set<String> relatedSeriesKeys = new LinkedHashSet<>();
    private Long lastAddData = null;
    private Long earliestData = null;

    public QueryDescriptor(JsonNode metric, JsonNode request, TimeRange timeRange, CacheProperties config,
            Clock clock) {
        if (null == metric || !metric.isObject()) {
            throw new IllegalArgumentException("Metric query must be a JSON object: " + metric);
        }
        this.metric = normalize((ObjectNode) metric.deepCopy());
        this.basis = this.metric.deepCopy();
        for (String field : TIME_FIELDS) {
            if (request.has(field)) {
                this.basis.set(field, request.get(field).deepCopy());
            }
        }
        this.cacheKey = CacheKeys.key(CacheKeys.QUERY_PREFIX, basis);
        this.timeRange = timeRange;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Splits a client request into one descriptor per element of its metrics array. The time range is resolved
     * against the clock immediately, the descriptors are built on iteration. No store I/O.
     *
     * @throws IllegalArgumentException
     *             if the request has no usable time range
     */
    public static Iterable<QueryDescriptor> fromRequest(JsonNode request, CacheProperties config, Clock clock) {
        TimeRange range = TimeRange.resolve(request, clock.instant());
        return Iterables.transform(request.path(METRICS),
                metric -> new QueryDescriptor(metric, request, range, config, clock));
    }

    /**
     * Aggregators written for the old dialect carry align_sampling, which the upstream service now calls
     * align_start_time.
     */
    private static ObjectNode normalize(ObjectNode metric) {
        for (JsonNode aggregator : metric.path(AGGREGATORS)) {
            if (aggregator.isObject() && aggregator.path(ALIGN_SAMPLING).asBoolean(false)) {
                ObjectNode agg = (ObjectNode) aggregator;
                agg.remove(ALIGN_SAMPLING);
                agg.put(ALIGN_START_TIME, true);
            }
        }
        return metric;
    }

    /**
     * @return a copy of the fields the cache key is computed over
     */
    public JsonNode keyBasis() {
        return basis.deepCopy();
    }

    /**
     * @return a copy of the metric query as it is sent upstream
     */
    public ObjectNode getMetric() {
        return metric.deepCopy();
    }

    public void addSeries(SeriesCacheEntry series) {
        addSeries(series.getKey());
    }

    public void addSeries(String seriesKey) {
        relatedSeriesKeys.add(seriesKey);
    }

    /**
     * Records a fetch and writes the descriptor record.
     *
     * @param earliestDataTime
     *            start of the fetched data, only kept if no earlier fetch was recorded
     * @param lastDataTime
     *            end of the fetched data, now when null
     * @return true if the store acknowledged the write
     */
    public boolean persist(CacheStore store, Instant earliestDataTime, Instant lastDataTime) {
        lastAddData = (null == lastDataTime) ? clock.millis() : lastDataTime.toEpochMilli();
        if (null == earliestData && null != earliestDataTime) {
            earliestData = earliestDataTime.toEpochMilli();
        }
        String value;
        try {
            value = JsonUtil.getObjectMapper().writeValueAsString(toRecord());
        } catch (JsonProcessingException e) {
            LOG.error("Unable to serialize query " + cacheKey, e);
            return false;
        }
        boolean written = store.set(cacheKey, value, config.getQueryExpiry());
        if (!written) {
            LOG.error("Unable to write query {} to the cache", cacheKey);
        }
        return written;
    }

    /**
     * @return the stored record for this query, empty when absent or unreadable
     * @throws tsproxy.server.store.CacheStoreException
     *             when the store cannot be read
     */
    public Optional<DescriptorRecord> load(CacheStore store) {
        String value = store.get(cacheKey);
        if (null == value) {
            return Optional.empty();
        }
        try {
            return Optional.of(JsonUtil.getObjectMapper().readValue(value, DescriptorRecord.class));
        } catch (IOException e) {
            LOG.warn("Ignoring unreadable cached query {}: {}", cacheKey, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Carries the fetch timestamps of a stored record over to this descriptor.
     */
    public void restore(DescriptorRecord record) {
        this.earliestData = record.getEarliestData();
        this.lastAddData = record.getLastAddData();
    }

    public boolean isStale(long lastModified) {
        return clock.millis() - lastModified > config.getStalenessThreshold() * 1000;
    }

    public DescriptorRecord toRecord() {
        DescriptorRecord record = new DescriptorRecord();
        record.setQuery(basis.deepCopy());
        record.getSeriesKeys().addAll(relatedSeriesKeys);
        record.setLastAddData(lastAddData);
        record.setEarliestData(earliestData);
        return record;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public Set<String> getRelatedSeriesKeys() {
        return Collections.unmodifiableSet(relatedSeriesKeys);
    }

    public Long getLastAddData() {
        return lastAddData;
    }

    public Long getEarliestData() {
        return earliestData;
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("cacheKey", cacheKey);
        tsb.append("basis", basis);
        tsb.append("timeRange", timeRange);
        tsb.append("relatedSeriesKeys", relatedSeriesKeys);
        tsb.append("lastAddData", lastAddData);
        tsb.append("earliestData", earliestData);
        return tsb.toString();
    }
}
