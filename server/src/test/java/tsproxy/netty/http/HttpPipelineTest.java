package tsproxy.netty.http;

import java.nio.charset.StandardCharsets;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import tsproxy.client.upstream.KairosHttpClient;
import tsproxy.common.configuration.CacheProperties;
import tsproxy.netty.Constants;
import tsproxy.server.cache.BackendProxy;
import tsproxy.server.cache.QueryOrchestrator;
import tsproxy.server.store.memory.MemoryCacheStore;
import tsproxy.server.test.ScriptedUpstreamClient;
import tsproxy.server.test.TestClock;
import tsproxy.server.test.TestData;
import tsproxy.util.JsonUtil;

public class HttpPipelineTest {

    private static final String QUERY = "{\"metrics\":[{\"name\":\"sys.cpu.user\"}],"
            + "\"start_relative\":{\"value\":\"1\",\"unit\":\"hours\"}}";

    private ScriptedUpstreamClient upstream;
    private EmbeddedChannel channel;

    @Before
    public void setup() {
        TestClock clock = new TestClock(TestData.NOW);
        upstream = new ScriptedUpstreamClient();
        QueryOrchestrator orchestrator = new QueryOrchestrator(new MemoryCacheStore(clock),
                new BackendProxy(upstream, "localhost", 8080), new CacheProperties(), clock);
        channel = new EmbeddedChannel(new HttpRequestDecoder(), new HttpVersionRequestHandler(),
                new HttpQueryRequestHandler(orchestrator), new TsProxyExceptionHandler());
    }

    @After
    public void tearDown() {
        channel.finishAndReleaseAll();
    }

    private FullHttpResponse exchange(FullHttpRequest request) {
        channel.writeInbound(request);
        FullHttpResponse response = channel.readOutbound();
        Assert.assertNotNull(response);
        return response;
    }

    private static JsonNode body(FullHttpResponse response) throws Exception {
        try {
            return JsonUtil.getObjectMapper().readTree(response.content().toString(StandardCharsets.UTF_8));
        } finally {
            response.release();
        }
    }

    @Test
    public void testVersion() throws Exception {
        FullHttpResponse response = exchange(
                new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/"));
        Assert.assertEquals(HttpResponseStatus.OK, response.status());
        Assert.assertEquals(Constants.TEXT_TYPE, response.headers().get(HttpHeaderNames.CONTENT_TYPE));
        Assert.assertTrue(response.content().toString(StandardCharsets.UTF_8)
                .startsWith(HttpVersionRequestHandler.BANNER));
        response.release();
    }

    @Test
    public void testQuery() throws Exception {
        long t0 = TestData.NOW.toEpochMilli();
        upstream.respond(TestData.result(TestData.series("sys.cpu.user", "a", t0 - 1000, 1, t0, 2)));
        FullHttpResponse response = exchange(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST,
                "/api/v1/datapoints/query", Unpooled.copiedBuffer(QUERY, StandardCharsets.UTF_8)));
        Assert.assertEquals(HttpResponseStatus.OK, response.status());
        Assert.assertEquals(Constants.JSON_TYPE, response.headers().get(HttpHeaderNames.CONTENT_TYPE));
        JsonNode body = body(response);
        Assert.assertEquals(1, body.path("queries").size());
        Assert.assertEquals(2, body.path("queries").get(0).path("sample_size").asInt());
        Assert.assertEquals("sys.cpu.user",
                body.path("queries").get(0).path("results").get(0).path("name").asText());
    }

    @Test
    public void testUpstreamError() throws Exception {
        upstream.respond(KairosHttpClient.error("bad metric", 400));
        FullHttpResponse response = exchange(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST,
                "/api/v1/datapoints/query", Unpooled.copiedBuffer(QUERY, StandardCharsets.UTF_8)));
        Assert.assertEquals(HttpResponseStatus.BAD_REQUEST, response.status());
        JsonNode body = body(response);
        Assert.assertEquals(400, body.path("responseCode").asInt());
        Assert.assertEquals("bad metric", body.path("detailMessage").asText());
    }

    @Test
    public void testNotFound() throws Exception {
        FullHttpResponse response = exchange(
                new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/api/unknown"));
        Assert.assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        Assert.assertEquals(404, body(response).path("responseCode").asInt());
    }

    @Test
    public void testMethodNotAllowed() throws Exception {
        FullHttpResponse response = exchange(
                new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.DELETE, "/api/v1/datapoints/query"));
        Assert.assertEquals(HttpResponseStatus.METHOD_NOT_ALLOWED, response.status());
        Assert.assertEquals("GET,POST", response.headers().get(HttpHeaderNames.ALLOW));
        response.release();
    }

    @Test
    public void testMalformedJson() throws Exception {
        FullHttpResponse response = exchange(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST,
                "/api/v1/datapoints/query", Unpooled.copiedBuffer("{\"metrics\":", StandardCharsets.UTF_8)));
        Assert.assertEquals(HttpResponseStatus.BAD_REQUEST, response.status());
        Assert.assertEquals(400, body(response).path("responseCode").asInt());
    }
}
