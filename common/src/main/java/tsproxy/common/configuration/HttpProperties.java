package tsproxy.common.configuration;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tsproxy.http")
public class HttpProperties {

    @NotBlank
    private String ip = "0.0.0.0";
    @NotNull
    private Integer port = 8008;
    @Min(1)
    private int queryThreads = 16;
    @Min(1024)
    private int maxContentLength = 1048576;
    @Valid
    @NestedConfigurationProperty
    private CorsProperties cors = new CorsProperties();

    public String getIp() {
        return ip;
    }

    public void setIp(String ip) {
        this.ip = ip;
    }

    public Integer getPort() {
        return port;
    }

    public void setPort(Integer port) {
        this.port = port;
    }

    /**
     * Size of the executor group that runs query handling off the Netty event loop. Query handling blocks on the
     * backing store and on the upstream service.
     */
    public int getQueryThreads() {
        return queryThreads;
    }

    public void setQueryThreads(int queryThreads) {
        this.queryThreads = queryThreads;
    }

    public int getMaxContentLength() {
        return maxContentLength;
    }

    public void setMaxContentLength(int maxContentLength) {
        this.maxContentLength = maxContentLength;
    }

    public CorsProperties getCors() {
        return cors;
    }

    public void setCors(CorsProperties cors) {
        this.cors = cors;
    }
}
