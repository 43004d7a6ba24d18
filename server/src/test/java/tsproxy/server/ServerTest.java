package tsproxy.server;

import java.nio.charset.StandardCharsets;

import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;

import tsproxy.client.http.HttpClient;
import tsproxy.common.configuration.CacheProperties;
import tsproxy.common.configuration.HttpProperties;
import tsproxy.common.configuration.ServerProperties;
import tsproxy.server.cache.BackendProxy;
import tsproxy.server.cache.QueryOrchestrator;
import tsproxy.server.store.memory.MemoryCacheStore;
import tsproxy.server.test.ScriptedUpstreamClient;
import tsproxy.server.test.TestClock;
import tsproxy.server.test.TestData;
import tsproxy.util.JsonUtil;

public class ServerTest {

    private static final String QUERY = "{\"metrics\":[{\"name\":\"sys.cpu.user\"}],"
            + "\"start_relative\":{\"value\":\"1\",\"unit\":\"hours\"}}";

    private ScriptedUpstreamClient upstream;
    private MemoryCacheStore store;
    private Server server;
    private CloseableHttpClient client;
    private String baseUri;

    @Before
    public void setup() {
        TestClock clock = new TestClock(TestData.NOW);
        upstream = new ScriptedUpstreamClient();
        store = new MemoryCacheStore(clock);
        QueryOrchestrator orchestrator = new QueryOrchestrator(store, new BackendProxy(upstream, "localhost", 8080),
                new CacheProperties(), clock);
        HttpProperties httpProperties = new HttpProperties();
        httpProperties.setIp("127.0.0.1");
        httpProperties.setPort(0);
        httpProperties.setQueryThreads(2);
        ServerProperties serverProperties = new ServerProperties();
        serverProperties.setShutdownQuietPeriod(0);
        server = new Server(null, orchestrator, serverProperties, httpProperties);
        server.start();
        baseUri = "http://127.0.0.1:" + server.getHttpPort();
        client = HttpClient.get(2000, 5000);
    }

    @After
    public void tearDown() throws Exception {
        client.close();
        server.shutdown();
    }

    private JsonNode post(String path, String body, int expectedStatus) throws Exception {
        HttpPost post = new HttpPost(baseUri + path);
        post.setEntity(new StringEntity(body, ContentType.APPLICATION_JSON));
        try (CloseableHttpResponse response = client.execute(post)) {
            Assert.assertEquals(expectedStatus, response.getStatusLine().getStatusCode());
            return JsonUtil.getObjectMapper().readTree(EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8));
        }
    }

    @Test
    public void testBanner() throws Exception {
        try (CloseableHttpResponse response = client.execute(new HttpGet(baseUri + "/"))) {
            Assert.assertEquals(200, response.getStatusLine().getStatusCode());
            Assert.assertTrue(EntityUtils.toString(response.getEntity()).startsWith("tsproxy"));
        }
    }

    @Test
    public void testColdThenHot() throws Exception {
        long t0 = TestData.NOW.toEpochMilli();
        upstream.respond(TestData.result(TestData.series("sys.cpu.user", "a", t0 - 1000, 1, t0, 2)));
        JsonNode cold = post("/api/v1/datapoints/query", QUERY, 200);
        JsonNode hot = post("/api/v1/datapoints/query", QUERY, 200);
        Assert.assertEquals(1, upstream.getRequests().size());
        Assert.assertEquals(cold, hot);
        Assert.assertEquals(2, hot.path("queries").get(0).path("sample_size").asInt());
        Assert.assertEquals(2, store.getGetCount());
    }

    @Test
    public void testUnknownPath() throws Exception {
        JsonNode error = post("/api/v1/unknown", QUERY, 404);
        Assert.assertEquals(404, error.path("responseCode").asInt());
    }
}
