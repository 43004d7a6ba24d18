package tsproxy.common.configuration;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;

public class RedisProperties {

    @NotBlank
    private String host = "localhost";
    @Min(1)
    private int port = 6379;
    private int timeout = 2000;
    private String password = null;
    @Min(0)
    private int database = 0;
    private int maxTotal = 32;
    private int maxIdle = 8;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getDatabase() {
        return database;
    }

    public void setDatabase(int database) {
        this.database = database;
    }

    public int getMaxTotal() {
        return maxTotal;
    }

    public void setMaxTotal(int maxTotal) {
        this.maxTotal = maxTotal;
    }

    public int getMaxIdle() {
        return maxIdle;
    }

    public void setMaxIdle(int maxIdle) {
        this.maxIdle = maxIdle;
    }
}
