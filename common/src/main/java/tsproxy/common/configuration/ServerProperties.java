package tsproxy.common.configuration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tsproxy.server")
public class ServerProperties {

    private Integer shutdownQuietPeriod = 5;

    /**
     * Time to wait (in seconds) for connections to finish and to make sure no new connections happen before shutting
     * down Netty event loop groups.
     */
    public int getShutdownQuietPeriod() {
        return this.shutdownQuietPeriod;
    }

    public void setShutdownQuietPeriod(Integer quietPeriod) {
        this.shutdownQuietPeriod = quietPeriod;
    }
}
