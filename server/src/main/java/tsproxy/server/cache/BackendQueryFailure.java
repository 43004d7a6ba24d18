package tsproxy.server.cache;

import com.fasterxml.jackson.databind.JsonNode;

import tsproxy.client.upstream.UpstreamClient;

/**
 * The upstream service answered a query with an error or could not be reached.
 */
public class BackendQueryFailure extends Exception {

    private static final long serialVersionUID = 1L;
    private final int statusCode;

    public BackendQueryFailure(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public static BackendQueryFailure from(JsonNode result) {
        if (null == result) {
            return new BackendQueryFailure("No response from upstream", 500);
        }
        return new BackendQueryFailure(result.path(UpstreamClient.ERROR).asText(),
                result.path(UpstreamClient.STATUS_CODE).asInt(500));
    }

    public int getStatusCode() {
        return statusCode;
    }
}
