package tsproxy.client.upstream;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Issues a query against the upstream time-series service.
 */
public interface UpstreamClient {

    String ERROR = "error";
    String STATUS_CODE = "status_code";

    /**
     * @param host
     *            upstream host
     * @param port
     *            upstream port
     * @param body
     *            query body, serialized as the request entity
     * @return the upstream result, or an object with {@value #ERROR} and {@value #STATUS_CODE} fields when the
     *         upstream service answered with an error or could not be reached
     */
    JsonNode query(String host, int port, JsonNode body);

    static boolean isError(JsonNode result) {
        return result == null || result.has(ERROR);
    }
}
