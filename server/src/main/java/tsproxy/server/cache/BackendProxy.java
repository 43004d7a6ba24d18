package tsproxy.server.cache;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import tsproxy.client.upstream.UpstreamClient;

/**
 * Relays a descriptor's metric query to the upstream service for a given time range.
 */
public class BackendProxy {

    private static final Logger LOG = LoggerFactory.getLogger(BackendProxy.class);

    public static final String CACHE_TIME = "cache_time";

    private final UpstreamClient client;
    private final String host;
    private final int port;

    public BackendProxy(UpstreamClient client, String host, int port) {
        this.client = client;
        this.host = host;
        this.port = port;
    }

    /**
     * @param propagateErrors
     *            raise {@link BackendQueryFailure} for an error result instead of returning it
     */
    public JsonNode query(QueryDescriptor descriptor, TimeRange range, boolean propagateErrors)
            throws BackendQueryFailure {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.putArray(QueryDescriptor.METRICS).add(descriptor.getMetric());
        body.put(CACHE_TIME, 0);
        body.put(TimeRange.START_ABSOLUTE, range.getStart().toEpochMilli());
        body.put(TimeRange.END_ABSOLUTE, range.getEnd().toEpochMilli());
        LOG.trace("Querying {}:{} with {}", host, port, body);
        JsonNode result = client.query(host, port, body);
        if (propagateErrors && UpstreamClient.isError(result)) {
            LOG.error("Upstream query for {} failed: {}", descriptor.getCacheKey(), result);
            throw BackendQueryFailure.from(result);
        }
        return result;
    }

    /**
     * Queries each range in turn. Every range is queried even after one fails, and the results are only returned
     * when all of them succeeded.
     *
     * @return one result per range, in range order
     */
    public List<JsonNode> queryChunked(QueryDescriptor descriptor, List<TimeRange> ranges)
            throws BackendQueryFailure {
        List<JsonNode> results = new ArrayList<>(ranges.size());
        for (TimeRange range : ranges) {
            results.add(query(descriptor, range, false));
        }
        for (JsonNode result : results) {
            if (UpstreamClient.isError(result)) {
                LOG.error("Chunked upstream query for {} failed: {}", descriptor.getCacheKey(), result);
                throw BackendQueryFailure.from(result);
            }
        }
        return results;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }
}
