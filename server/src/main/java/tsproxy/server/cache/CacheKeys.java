package tsproxy.server.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import tsproxy.util.JsonUtil;

final class CacheKeys {

    static final String QUERY_PREFIX = "tsproxy:query:";
    static final String SERIES_PREFIX = "tsproxy:series:";

    private CacheKeys() {
    }

    static String key(String prefix, JsonNode basis) {
        try {
            return prefix + JsonUtil.fingerprint(basis);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to fingerprint " + basis, e);
        }
    }
}
