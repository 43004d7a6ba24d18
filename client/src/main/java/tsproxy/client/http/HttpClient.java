package tsproxy.client.http;

import org.apache.http.client.config.CookieSpecs;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.HttpClients;

public class HttpClient {

    public static CloseableHttpClient get(int connectTimeout, int socketTimeout) {
        return get(connectTimeout, socketTimeout, 64);
    }

    public static CloseableHttpClient get(int connectTimeout, int socketTimeout, int maxConnections) {
        // cookies are never shared between proxied queries
        RequestConfig defaultRequestConfig = RequestConfig.custom().setCookieSpec(CookieSpecs.IGNORE_COOKIES)
                .setConnectTimeout(connectTimeout).setConnectionRequestTimeout(connectTimeout)
                .setSocketTimeout(socketTimeout).build();
        HttpClientBuilder builder = HttpClients.custom().setDefaultRequestConfig(defaultRequestConfig)
                .setMaxConnTotal(maxConnections).setMaxConnPerRoute(maxConnections).disableCookieManagement();
        return builder.build();
    }

}
