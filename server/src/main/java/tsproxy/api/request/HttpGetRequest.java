package tsproxy.api.request;

import io.netty.handler.codec.http.QueryStringDecoder;

public interface HttpGetRequest extends HttpRequest {

    public HttpGetRequest parseQueryParameters(QueryStringDecoder decoder) throws Exception;

}
