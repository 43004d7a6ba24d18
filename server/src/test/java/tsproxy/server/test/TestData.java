package tsproxy.server.test;

import java.time.Instant;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builders for client requests and upstream results.
 */
public class TestData {

    public static final Instant NOW = Instant.ofEpochMilli(1500000000000L);

    private TestData() {
    }

    /**
     * @param points
     *            timestamp and value pairs
     */
    public static ObjectNode series(String name, String host, long... points) {
        ObjectNode series = JsonNodeFactory.instance.objectNode();
        series.put("name", name);
        ArrayNode groupBy = series.putArray("group_by");
        groupBy.addObject().put("name", "type").put("type", "number");
        series.putObject("tags").putArray("host").add(host);
        ArrayNode values = series.putArray("values");
        for (int i = 0; i + 1 < points.length; i += 2) {
            long value = points[i + 1];
            // int sized values are kept as ints so they match what a parser reads back
            if (value == (int) value) {
                values.addArray().add(points[i]).add((int) value);
            } else {
                values.addArray().add(points[i]).add(value);
            }
        }
        return series;
    }

    public static ObjectNode result(ObjectNode... series) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        ObjectNode query = result.putArray("queries").addObject();
        query.put("sample_size", 0);
        ArrayNode results = query.putArray("results");
        for (ObjectNode s : series) {
            results.add(s);
        }
        return result;
    }

    public static ObjectNode metric(String name) {
        ObjectNode metric = JsonNodeFactory.instance.objectNode();
        metric.put("name", name);
        ObjectNode agg = metric.putArray("aggregators").addObject();
        agg.put("name", "sum");
        agg.putObject("sampling").put("value", "1").put("unit", "minutes");
        return metric;
    }

    public static ObjectNode request(long hours, ObjectNode... metrics) {
        ObjectNode request = JsonNodeFactory.instance.objectNode();
        ArrayNode array = request.putArray("metrics");
        for (ObjectNode m : metrics) {
            array.add(m);
        }
        request.putObject("start_relative").put("value", String.valueOf(hours)).put("unit", "hours");
        return request;
    }
}
