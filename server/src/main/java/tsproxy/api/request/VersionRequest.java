package tsproxy.api.request;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;
import tsproxy.api.annotation.Http;

@Http(path = "/")
public class VersionRequest implements HttpGetRequest {

    public static final String VERSION;
    static {
        String ver = VersionRequest.class.getPackage().getImplementationVersion();
        VERSION = (null == ver) ? "Unknown" : ver;
    }

    private FullHttpRequest httpRequest = null;

    public String getVersion() {
        return VERSION;
    }

    @Override
    public String toString() {
        return "Version: " + VERSION;
    }

    @Override
    public HttpGetRequest parseQueryParameters(QueryStringDecoder decoder) {
        return new VersionRequest();
    }

    @Override
    public void setHttpRequest(FullHttpRequest httpRequest) {
        this.httpRequest = httpRequest;
    }

    @Override
    public FullHttpRequest getHttpRequest() {
        return httpRequest;
    }

}
