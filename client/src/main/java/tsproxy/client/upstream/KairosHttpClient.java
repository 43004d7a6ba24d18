package tsproxy.client.upstream;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import tsproxy.util.JsonUtil;

/**
 * {@link UpstreamClient} for the KairosDB REST query endpoint.
 */
public class KairosHttpClient implements UpstreamClient, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(KairosHttpClient.class);
    public static final String QUERY_PATH = "/api/v1/datapoints/query";
    private static final String NO_MESSAGE = "No message given";

    private final CloseableHttpClient client;

    public KairosHttpClient(CloseableHttpClient client) {
        this.client = client;
    }

    @Override
    public JsonNode query(String host, int port, JsonNode body) {
        String uri = "http://" + host + ":" + port + QUERY_PATH;
        HttpPost post = new HttpPost(uri);
        try {
            post.setEntity(new StringEntity(JsonUtil.getObjectMapper().writeValueAsString(body),
                    ContentType.APPLICATION_JSON));
            LOG.trace("Relaying query to {}: {}", uri, body);
            try (CloseableHttpResponse response = client.execute(post)) {
                int status = response.getStatusLine().getStatusCode();
                String content = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(),
                        StandardCharsets.UTF_8);
                if (status / 100 != 2) {
                    String message = errorMessage(content);
                    LOG.error("Upstream {} responded {}: {}", uri, status, message);
                    return error(message, status);
                }
                return JsonUtil.getObjectMapper().readTree(content);
            }
        } catch (IOException e) {
            LOG.error("Could not connect to upstream " + uri, e);
            return error("Could not connect to upstream: " + e.getMessage(), 500);
        }
    }

    private String errorMessage(String content) {
        if (StringUtils.isBlank(content)) {
            return NO_MESSAGE;
        }
        try {
            JsonNode errors = JsonUtil.getObjectMapper().readTree(content).path("errors");
            if (errors.isArray() && errors.size() > 0) {
                List<String> messages = new ArrayList<>();
                errors.forEach(e -> messages.add(e.asText()));
                return StringUtils.join(messages, ", ");
            }
        } catch (IOException e) {
            LOG.trace("Upstream error body is not JSON: {}", content);
        }
        return content;
    }

    public static ObjectNode error(String message, int statusCode) {
        ObjectNode error = JsonUtil.getObjectMapper().createObjectNode();
        error.put(ERROR, message);
        error.put(STATUS_CODE, statusCode);
        return error;
    }

    @Override
    public void close() throws IOException {
        client.close();
    }
}
