package tsproxy.common.configuration;

import java.time.Duration;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tsproxy.cache")
public class CacheProperties {

    @Min(0)
    private long stalenessThreshold = 10;
    @Min(1)
    @Max(Integer.MAX_VALUE)
    private long seriesExpiry = 10800;
    @Min(0)
    @Max(Integer.MAX_VALUE)
    private long queryExpiry = 10800;
    @NotNull
    private Duration chunkSize = Duration.ZERO;

    /**
     * Seconds after the last fetch during which a cached query is served without contacting the upstream service.
     */
    public long getStalenessThreshold() {
        return stalenessThreshold;
    }

    public CacheProperties setStalenessThreshold(long stalenessThreshold) {
        this.stalenessThreshold = stalenessThreshold;
        return this;
    }

    /**
     * Seconds a cached series lives in the backing store.
     */
    public long getSeriesExpiry() {
        return seriesExpiry;
    }

    public CacheProperties setSeriesExpiry(long seriesExpiry) {
        this.seriesExpiry = seriesExpiry;
        return this;
    }

    /**
     * Seconds a cached query record lives in the backing store, 0 to keep it until evicted.
     */
    public long getQueryExpiry() {
        return queryExpiry;
    }

    public CacheProperties setQueryExpiry(long queryExpiry) {
        this.queryExpiry = queryExpiry;
        return this;
    }

    /**
     * Length of the sub-ranges a cold fetch is split into, zero to fetch the whole range at once.
     */
    public Duration getChunkSize() {
        return chunkSize;
    }

    public CacheProperties setChunkSize(Duration chunkSize) {
        this.chunkSize = chunkSize;
        return this;
    }
}
