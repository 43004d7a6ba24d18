package tsproxy.server.cache;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.builder.ToStringBuilder;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Stored form of a {@link QueryDescriptor}: the query it was keyed on plus the metadata accumulated by previous
 * requests.
 */
public class DescriptorRecord {

    @JsonProperty("query")
    private JsonNode query;

    @JsonProperty("series_keys")
    private List<String> seriesKeys = new ArrayList<>();

    @JsonProperty("last_add_data")
    private Long lastAddData;

    @JsonProperty("earliest_data")
    private Long earliestData;

    public JsonNode getQuery() {
        return query;
    }

    public void setQuery(JsonNode query) {
        this.query = query;
    }

    public List<String> getSeriesKeys() {
        return seriesKeys;
    }

    public void setSeriesKeys(List<String> seriesKeys) {
        this.seriesKeys = seriesKeys;
    }

    /**
     * Epoch milliseconds of the most recent fetch.
     */
    public Long getLastAddData() {
        return lastAddData;
    }

    public void setLastAddData(Long lastAddData) {
        this.lastAddData = lastAddData;
    }

    /**
     * Epoch milliseconds of the start of the first fetch.
     */
    public Long getEarliestData() {
        return earliestData;
    }

    public void setEarliestData(Long earliestData) {
        this.earliestData = earliestData;
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("query", query);
        tsb.append("seriesKeys", seriesKeys);
        tsb.append("lastAddData", lastAddData);
        tsb.append("earliestData", earliestData);
        return tsb.toString();
    }
}
