package tsproxy.common.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({CacheProperties.class, HttpProperties.class, ServerProperties.class, StoreProperties.class,
        UpstreamProperties.class})
public class TsProxyCommonConfiguration {

}
