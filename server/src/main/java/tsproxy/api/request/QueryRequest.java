package tsproxy.api.request;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

import com.fasterxml.jackson.databind.JsonNode;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;
import tsproxy.api.annotation.Http;
import tsproxy.util.JsonUtil;

/**
 * A multi-metric query as submitted by a client. The body is kept as a tree since every metric object is relayed
 * upstream as-is.
 */
@Http(path = "/api/v1/datapoints/query")
public class QueryRequest implements HttpGetRequest, HttpPostRequest {

    public static final String QUERY_PARAM = "query";
    public static final String METRICS = "metrics";

    private JsonNode body = null;
    private FullHttpRequest httpRequest = null;

    public QueryRequest() {
    }

    public QueryRequest(JsonNode body) {
        this.body = body;
    }

    public JsonNode getBody() {
        return body;
    }

    @Override
    public void validate() {
        if (null == body || !body.isObject()) {
            throw new IllegalArgumentException("Query body must be a JSON object.");
        }
        JsonNode metrics = body.path(METRICS);
        if (!metrics.isArray() || metrics.size() == 0) {
            throw new IllegalArgumentException("No query specified.");
        }
    }

    @Override
    public HttpPostRequest parseBody(String content) throws Exception {
        if (StringUtils.isBlank(content)) {
            throw new IllegalArgumentException("Query body is empty.");
        }
        return new QueryRequest(JsonUtil.getObjectMapper().readTree(content));
    }

    @Override
    public HttpGetRequest parseQueryParameters(QueryStringDecoder decoder) throws Exception {
        List<String> query = decoder.parameters().get(QUERY_PARAM);
        if (null == query || query.isEmpty()) {
            throw new IllegalArgumentException("Missing query parameter: " + QUERY_PARAM);
        }
        return new QueryRequest(JsonUtil.getObjectMapper().readTree(query.get(0)));
    }

    @Override
    public void setHttpRequest(FullHttpRequest httpRequest) {
        this.httpRequest = httpRequest;
    }

    @Override
    public FullHttpRequest getHttpRequest() {
        return httpRequest;
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("body", body);
        return tsb.toString();
    }
}
