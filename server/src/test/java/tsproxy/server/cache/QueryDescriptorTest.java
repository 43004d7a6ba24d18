package tsproxy.server.cache;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Lists;

import tsproxy.common.configuration.CacheProperties;
import tsproxy.server.store.memory.MemoryCacheStore;
import tsproxy.server.test.TestData;
import tsproxy.util.JsonUtil;

public class QueryDescriptorTest {

    private static final Instant T1 = Instant.ofEpochMilli(1234567890000L);
    private static final Instant T2 = Instant.ofEpochMilli(1234567990000L);

    private final Clock clock = Clock.fixed(TestData.NOW, ZoneOffset.UTC);
    private CacheProperties config;
    private MemoryCacheStore store;

    @Before
    public void setup() {
        config = new CacheProperties().setStalenessThreshold(10).setQueryExpiry(600);
        store = new MemoryCacheStore(clock);
    }

    private static JsonNode json(String s) throws Exception {
        return JsonUtil.getObjectMapper().readTree(s);
    }

    private QueryDescriptor descriptor(String metric) throws Exception {
        return QueryDescriptor.fromRequest(json("{\"metrics\":[" + metric + "],"
                + "\"start_relative\":{\"value\":\"1\",\"unit\":\"hours\"}}"), config, clock).iterator().next();
    }

    private DescriptorRecord stored(QueryDescriptor descriptor) throws Exception {
        return JsonUtil.getObjectMapper().readValue(store.get(descriptor.getCacheKey()), DescriptorRecord.class);
    }

    @Test
    public void testFromRequest() throws Exception {
        JsonNode request = json("{\"metrics\":[{\"hello\":\"some query\"},{\"goodbye\":\"another_query\"}],"
                + "\"start_relative\":{\"value\":\"1\",\"unit\":\"hours\"}}");
        Iterable<QueryDescriptor> descriptors = QueryDescriptor.fromRequest(request, config, clock);
        Iterator<QueryDescriptor> iter = descriptors.iterator();
        Assert.assertEquals(request.get("metrics").get(0), iter.next().getMetric());
        Assert.assertEquals(request.get("metrics").get(1), iter.next().getMetric());
        Assert.assertFalse(iter.hasNext());
        Assert.assertEquals(0, store.getGetCount());
        Assert.assertEquals(0, store.getSetCount());
        Assert.assertEquals(0, store.getPipelineExecuteCount());
    }

    @Test
    public void testFromRequestResolvesTimeRange() throws Exception {
        QueryDescriptor descriptor = descriptor("{\"name\":\"m\"}");
        Assert.assertEquals(new TimeRange(TestData.NOW.minusSeconds(3600), TestData.NOW),
                descriptor.getTimeRange());
    }

    @Test
    public void testFromRequestReplacesAlignSampling() throws Exception {
        QueryDescriptor descriptor = descriptor("{\"hello\":\"some query\",\"aggregators\":[{\"name\":\"sum\","
                + "\"align_sampling\":true,\"sampling\":{\"value\":\"1\",\"unit\":\"minutes\"}}]}");
        JsonNode expected = json("{\"hello\":\"some query\",\"aggregators\":[{\"name\":\"sum\","
                + "\"align_start_time\":true,\"sampling\":{\"value\":\"1\",\"unit\":\"minutes\"}}]}");
        Assert.assertEquals(expected, descriptor.getMetric());
    }

    @Test
    public void testAlignSamplingFalseIsUntouched() throws Exception {
        String metric = "{\"name\":\"m\",\"aggregators\":[{\"name\":\"avg\",\"align_sampling\":false},"
                + "{\"name\":\"max\"}]}";
        Assert.assertEquals(json(metric), descriptor(metric).getMetric());
    }

    @Test
    public void testCacheKeyIgnoresFieldOrder() throws Exception {
        QueryDescriptor first = descriptor("{\"name\":\"m\",\"aggregators\":[{\"name\":\"sum\","
                + "\"align_sampling\":true,\"sampling\":{\"value\":\"1\",\"unit\":\"minutes\"}}]}");
        QueryDescriptor second = descriptor("{\"aggregators\":[{\"sampling\":{\"unit\":\"minutes\",\"value\":\"1\"},"
                + "\"align_sampling\":true,\"name\":\"sum\"}],\"name\":\"m\"}");
        Assert.assertEquals(first.getCacheKey(), second.getCacheKey());
        Assert.assertTrue(first.getCacheKey().startsWith("tsproxy:query:"));
    }

    @Test
    public void testCacheKeyIncludesTimeFields() throws Exception {
        QueryDescriptor hour = descriptor("{\"name\":\"m\"}");
        QueryDescriptor day = QueryDescriptor.fromRequest(
                json("{\"metrics\":[{\"name\":\"m\"}],\"start_relative\":{\"value\":\"1\",\"unit\":\"days\"}}"),
                config, clock).iterator().next();
        Assert.assertNotEquals(hour.getCacheKey(), day.getCacheKey());
        Assert.assertEquals(json("{\"value\":\"1\",\"unit\":\"hours\"}"), hour.keyBasis().get("start_relative"));
    }

    @Test
    public void testCacheKeyStableAfterMutation() throws Exception {
        QueryDescriptor descriptor = descriptor("{\"name\":\"m\"}");
        String key = descriptor.getCacheKey();
        JsonNode basis = descriptor.keyBasis();
        descriptor.addSeries("tsproxy:series:abc");
        descriptor.persist(store, T1, T2);
        ((ObjectNode) descriptor.keyBasis()).put("name", "changed");
        Assert.assertEquals(key, descriptor.getCacheKey());
        Assert.assertEquals(basis, descriptor.keyBasis());
        Assert.assertEquals(key, descriptor("{\"name\":\"m\"}").getCacheKey());
    }

    @Test
    public void testAddSeriesIsIdempotent() throws Exception {
        QueryDescriptor descriptor = descriptor("{\"name\":\"m\"}");
        SeriesCacheEntry series = new SeriesCacheEntry(TestData.series("m", "a", 1000, 1), descriptor.getCacheKey(),
                60);
        descriptor.addSeries("hello");
        descriptor.addSeries("goodbye");
        descriptor.addSeries("hello");
        descriptor.addSeries(series);
        descriptor.addSeries(series.getKey());
        Assert.assertEquals(Arrays.asList("hello", "goodbye", series.getKey()),
                Lists.newArrayList(descriptor.getRelatedSeriesKeys()));
    }

    @Test
    public void testPersistWritesRecord() throws Exception {
        QueryDescriptor descriptor = descriptor("{\"name\":\"m\"}");
        descriptor.addSeries("rick-and-morty");
        Assert.assertTrue(descriptor.persist(store, T1, T2));
        Assert.assertEquals(1, store.getSetCount());
        Assert.assertEquals(600, store.ttl(descriptor.getCacheKey()));

        DescriptorRecord record = stored(descriptor);
        Assert.assertEquals(descriptor.keyBasis(), record.getQuery());
        Assert.assertEquals(Arrays.asList("rick-and-morty"), record.getSeriesKeys());
        Assert.assertEquals(Long.valueOf(T1.toEpochMilli()), record.getEarliestData());
        Assert.assertEquals(Long.valueOf(T2.toEpochMilli()), record.getLastAddData());

        JsonNode raw = json(store.get(descriptor.getCacheKey()));
        Assert.assertTrue(raw.has("series_keys"));
        Assert.assertTrue(raw.has("last_add_data"));
        Assert.assertTrue(raw.has("earliest_data"));
    }

    @Test
    public void testPersistEarliestDataIsWriteOnce() throws Exception {
        QueryDescriptor descriptor = descriptor("{\"name\":\"m\"}");
        descriptor.persist(store, T1, null);
        descriptor.persist(store, T2, null);
        Assert.assertEquals(Long.valueOf(T1.toEpochMilli()), stored(descriptor).getEarliestData());
    }

    @Test
    public void testPersistLastAddData() throws Exception {
        QueryDescriptor descriptor = descriptor("{\"name\":\"m\"}");
        descriptor.persist(store, T1, null);
        Assert.assertEquals(Long.valueOf(TestData.NOW.toEpochMilli()), stored(descriptor).getLastAddData());
        descriptor.persist(store, T1, T2);
        Assert.assertEquals(Long.valueOf(T2.toEpochMilli()), stored(descriptor).getLastAddData());
    }

    @Test
    public void testPersistWithoutExpiry() throws Exception {
        config.setQueryExpiry(0);
        QueryDescriptor descriptor = descriptor("{\"name\":\"m\"}");
        descriptor.persist(store, T1, T2);
        Assert.assertEquals(-1, store.ttl(descriptor.getCacheKey()));
    }

    @Test
    public void testPersistReportsFailedWrite() throws Exception {
        MemoryCacheStore failing = new MemoryCacheStore(clock) {

            @Override
            protected boolean write(tsproxy.server.store.StoreEntry entry) {
                return false;
            }
        };
        Assert.assertFalse(descriptor("{\"name\":\"m\"}").persist(failing, T1, T2));
    }

    @Test
    public void testLoadAndRestore() throws Exception {
        QueryDescriptor first = descriptor("{\"name\":\"m\"}");
        first.addSeries("a");
        first.persist(store, T1, T2);

        QueryDescriptor second = descriptor("{\"name\":\"m\"}");
        Optional<DescriptorRecord> record = second.load(store);
        Assert.assertTrue(record.isPresent());
        Assert.assertEquals(Arrays.asList("a"), record.get().getSeriesKeys());
        second.restore(record.get());
        second.persist(store, TestData.NOW, TestData.NOW);
        Assert.assertEquals(Long.valueOf(T1.toEpochMilli()), stored(second).getEarliestData());
        Assert.assertEquals(Long.valueOf(TestData.NOW.toEpochMilli()), stored(second).getLastAddData());
    }

    @Test
    public void testLoadMissingOrUnreadable() throws Exception {
        QueryDescriptor descriptor = descriptor("{\"name\":\"m\"}");
        Assert.assertFalse(descriptor.load(store).isPresent());
        store.set(descriptor.getCacheKey(), "not json", 0);
        Assert.assertFalse(descriptor.load(store).isPresent());
        Assert.assertEquals(2, store.getGetCount());
    }

    @Test
    public void testIsStale() throws Exception {
        QueryDescriptor descriptor = descriptor("{\"name\":\"m\"}");
        long now = TestData.NOW.toEpochMilli();
        Assert.assertFalse(descriptor.isStale(now));
        Assert.assertFalse(descriptor.isStale(now - 10000));
        Assert.assertTrue(descriptor.isStale(now - 10001));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMetricMustBeAnObject() throws Exception {
        List<QueryDescriptor> descriptors = Lists.newArrayList(QueryDescriptor.fromRequest(
                json("{\"metrics\":[\"m\"],\"start_absolute\":1}"), config, clock));
        Assert.fail("Expected failure, got " + descriptors);
    }
}
