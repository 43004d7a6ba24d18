package tsproxy.common.configuration;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tsproxy.store")
public class StoreProperties {

    public enum Type {
        REDIS, MEMORY
    }

    @NotNull
    private Type type = Type.REDIS;
    @Valid
    @NestedConfigurationProperty
    private RedisProperties redis = new RedisProperties();

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }

    public RedisProperties getRedis() {
        return redis;
    }

    public void setRedis(RedisProperties redis) {
        this.redis = redis;
    }
}
