package tsproxy.server.store;

import org.apache.commons.lang3.builder.ToStringBuilder;

public class StoreEntry {

    private final String key;
    private final String value;
    private final long expiry;

    public StoreEntry(String key, String value, long expiry) {
        this.key = key;
        this.value = value;
        this.expiry = expiry;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    /**
     * Time to live in seconds, 0 for none.
     */
    public long getExpiry() {
        return expiry;
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("key", key);
        tsb.append("expiry", expiry);
        return tsb.toString();
    }
}
