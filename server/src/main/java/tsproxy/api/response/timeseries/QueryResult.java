package tsproxy.api.response.timeseries;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.builder.ToStringBuilder;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response fragment for one submitted metric query.
 */
public class QueryResult {

    private List<JsonNode> results = new ArrayList<>();
    private long sampleSize = 0;

    public List<JsonNode> getResults() {
        return results;
    }

    public void setResults(List<JsonNode> results) {
        this.results = results;
    }

    @JsonProperty("sample_size")
    public long getSampleSize() {
        return sampleSize;
    }

    @JsonProperty("sample_size")
    public void setSampleSize(long sampleSize) {
        this.sampleSize = sampleSize;
    }

    public void addResult(JsonNode result, int samples) {
        this.results.add(result);
        this.sampleSize += samples;
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("results", results.size());
        tsb.append("sampleSize", sampleSize);
        return tsb.toString();
    }
}
