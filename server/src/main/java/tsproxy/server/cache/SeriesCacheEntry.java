package tsproxy.server.cache;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.Iterables;

import tsproxy.api.response.timeseries.QueryResult;
import tsproxy.server.store.CacheStore;
import tsproxy.server.store.StoreEntry;
import tsproxy.util.JsonUtil;

/**
 * Cached datapoints of one concrete series, as returned by the upstream service for one metric query. Datapoints are
 * kept sorted by timestamp with at most one value per timestamp.
 * <p>
 * The store key covers the owning query's cache key as well as the series identity: the same series aggregated by
 * two different queries holds different values.
 */
public class SeriesCacheEntry {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesCacheEntry.class);

    public static final String NAME = "name";
    public static final String GROUP_BY = "group_by";
    public static final String TAGS = "tags";
    public static final String VALUES = "values";
    public static final String RESULTS = "results";
    public static final String QUERY = "query";

    private final String queryKey;
    private final String name;
    private final JsonNode groupBy;
    private final JsonNode tags;
    private final NavigableMap<Long, JsonNode> datapoints = new TreeMap<>();
    private final long expiry;
    private final String key;

    /**
     * @param series
     *            a single element of an upstream query's results, {name, group_by, tags, values}
     * @param queryKey
     *            cache key of the query the series was fetched for
     * @param expiry
     *            seconds the entry lives in the backing store
     */
    public SeriesCacheEntry(JsonNode series, String queryKey, long expiry) {
        this.queryKey = queryKey;
        this.name = series.path(NAME).asText();
        this.groupBy = series.has(GROUP_BY) ? series.get(GROUP_BY).deepCopy() : JsonNodeFactory.instance.arrayNode();
        this.tags = series.has(TAGS) ? series.get(TAGS).deepCopy() : JsonNodeFactory.instance.objectNode();
        this.expiry = expiry;
        for (JsonNode point : series.path(VALUES)) {
            if (point.isArray() && point.size() >= 2 && point.get(0).canConvertToLong()) {
                // a repeated timestamp keeps the last value
                datapoints.put(point.get(0).asLong(), point.get(1).deepCopy());
            }
        }
        ObjectNode basis = JsonNodeFactory.instance.objectNode();
        basis.put(NAME, name);
        basis.set(TAGS, tags);
        basis.set(GROUP_BY, groupBy);
        basis.put(QUERY, queryKey);
        this.key = CacheKeys.key(CacheKeys.SERIES_PREFIX, basis);
    }

    /**
     * One entry per series in the results of a single upstream query object, owned by descriptor. No store I/O.
     */
    public static Iterable<SeriesCacheEntry> fromResult(QueryDescriptor descriptor, JsonNode query, long expiry) {
        String queryKey = descriptor.getCacheKey();
        return Iterables.transform(query.path(RESULTS), series -> new SeriesCacheEntry(series, queryKey, expiry));
    }

    /**
     * Loads entries from the store. Nothing is read until iteration starts, then all keys are fetched with one
     * pipelined read. Keys missing from the store and values that cannot be parsed are skipped.
     *
     * @throws tsproxy.server.store.CacheStoreException
     *             on iteration, when the store cannot be read
     */
    public static Iterable<SeriesCacheEntry> fromCache(CacheStore store, QueryDescriptor descriptor,
            Collection<String> keys, long expiry) {
        String queryKey = descriptor.getCacheKey();
        List<String> keyList = new ArrayList<>(keys);
        return new Iterable<SeriesCacheEntry>() {

            @Override
            public Iterator<SeriesCacheEntry> iterator() {
                if (keyList.isEmpty()) {
                    return Collections.emptyIterator();
                }
                List<String> values = store.multiGet(keyList);
                List<SeriesCacheEntry> entries = new ArrayList<>(values.size());
                for (int i = 0; i < values.size(); i++) {
                    String value = values.get(i);
                    if (null == value) {
                        LOG.trace("Series {} not found in cache", keyList.get(i));
                        continue;
                    }
                    try {
                        entries.add(new SeriesCacheEntry(JsonUtil.getObjectMapper().readTree(value), queryKey, expiry));
                    } catch (IOException e) {
                        LOG.warn("Ignoring unreadable cached series {}: {}", keyList.get(i), e.getMessage());
                    }
                }
                return entries.iterator();
            }
        };
    }

    /**
     * Adds the datapoints of other to this entry. When both hold a timestamp, the value of other is kept if isNewer,
     * otherwise this entry's value is kept.
     */
    public void mergeFrom(SeriesCacheEntry other, boolean isNewer) {
        for (Map.Entry<Long, JsonNode> point : other.datapoints.entrySet()) {
            if (isNewer) {
                datapoints.put(point.getKey(), point.getValue());
            } else {
                datapoints.putIfAbsent(point.getKey(), point.getValue());
            }
        }
    }

    /**
     * Drops the datapoints older than timestamp.
     *
     * @return the number of datapoints dropped
     */
    public int dropBefore(long timestamp) {
        NavigableMap<Long, JsonNode> older = datapoints.headMap(timestamp, false);
        int dropped = older.size();
        older.clear();
        return dropped;
    }

    /**
     * Appends this series to the result being built for the descriptor's query and adds the number of emitted
     * datapoints to its sample size.
     *
     * @param trim
     *            restrict the emitted datapoints to the time range the query asked for
     */
    public QueryResult buildResponse(QueryDescriptor descriptor, QueryResult result, boolean trim) {
        NavigableMap<Long, JsonNode> emitted = datapoints;
        if (trim) {
            TimeRange range = descriptor.getTimeRange();
            emitted = datapoints.subMap(range.getStart().toEpochMilli(), true, range.getEnd().toEpochMilli(), true);
        }
        result.addResult(toJson(emitted), emitted.size());
        return result;
    }

    public StoreEntry toStoreEntry() {
        return new StoreEntry(key, toJson(datapoints).toString(), expiry);
    }

    private ObjectNode toJson(NavigableMap<Long, JsonNode> points) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(NAME, name);
        node.set(GROUP_BY, groupBy.deepCopy());
        node.set(TAGS, tags.deepCopy());
        ArrayNode values = node.putArray(VALUES);
        points.forEach((ts, v) -> values.addArray().add(ts).add(v));
        return node;
    }

    public String getKey() {
        return key;
    }

    public String getQueryKey() {
        return queryKey;
    }

    public String getName() {
        return name;
    }

    public JsonNode getTags() {
        return tags.deepCopy();
    }

    public JsonNode getGroupBy() {
        return groupBy.deepCopy();
    }

    public long getExpiry() {
        return expiry;
    }

    public List<DataPoint> getDataPoints() {
        return FluentIterable.from(datapoints.entrySet()).transform(e -> new DataPoint(e.getKey(), e.getValue()))
                .toList();
    }

    public int size() {
        return datapoints.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SeriesCacheEntry)) {
            return false;
        }
        SeriesCacheEntry other = (SeriesCacheEntry) obj;
        EqualsBuilder eb = new EqualsBuilder();
        eb.append(key, other.key);
        eb.append(datapoints, other.datapoints);
        return eb.isEquals();
    }

    @Override
    public int hashCode() {
        HashCodeBuilder hcb = new HashCodeBuilder();
        hcb.append(key);
        hcb.append(datapoints);
        return hcb.toHashCode();
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("key", key);
        tsb.append("name", name);
        tsb.append("tags", tags);
        tsb.append("datapoints", datapoints.size());
        return tsb.toString();
    }
}
