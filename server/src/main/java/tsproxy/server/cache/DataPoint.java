package tsproxy.server.cache;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One sample of a series. The value is kept as the node the upstream service returned so that integer, floating
 * point and string samples are written back unchanged.
 */
public class DataPoint {

    private final long timestamp;
    private final JsonNode value;

    public DataPoint(long timestamp, JsonNode value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public JsonNode getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DataPoint)) {
            return false;
        }
        DataPoint other = (DataPoint) obj;
        EqualsBuilder eb = new EqualsBuilder();
        eb.append(timestamp, other.timestamp);
        eb.append(value, other.value);
        return eb.isEquals();
    }

    @Override
    public int hashCode() {
        HashCodeBuilder hcb = new HashCodeBuilder();
        hcb.append(timestamp);
        hcb.append(value);
        return hcb.toHashCode();
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("timestamp", timestamp);
        tsb.append("value", value);
        return tsb.toString();
    }
}
