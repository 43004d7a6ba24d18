package tsproxy.util;

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.hash.Hashing;

public class JsonUtil {

    private static ObjectMapper mapper = new ObjectMapper();
    private static ObjectWriter canonicalWriter;

    static {
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_ARRAY_AS_NULL_OBJECT, true);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        // mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        mapper.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
        canonicalWriter = mapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public static ObjectMapper getObjectMapper() {
        return mapper;
    }

    /**
     * Renders a tree with the keys of every nested object sorted, so that two trees holding the same fields in a
     * different order produce the same text.
     */
    public static String toCanonicalString(JsonNode node) throws JsonProcessingException {
        Object plain = mapper.treeToValue(node, Object.class);
        return canonicalWriter.writeValueAsString(plain);
    }

    /**
     * Hex encoded SHA-256 digest of the canonical form of the tree.
     */
    public static String fingerprint(JsonNode node) throws JsonProcessingException {
        return Hashing.sha256().hashString(toCanonicalString(node), StandardCharsets.UTF_8).toString();
    }

}
