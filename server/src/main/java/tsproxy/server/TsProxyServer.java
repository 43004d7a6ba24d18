package tsproxy.server;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication(scanBasePackages = {"tsproxy.server", "tsproxy.common"})
public class TsProxyServer {

    public static void main(String[] args) {
        new SpringApplicationBuilder(TsProxyServer.class).main(TsProxyServer.class).web(WebApplicationType.NONE)
                .run(args);
    }
}
