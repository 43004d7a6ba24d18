package tsproxy.api.request;

import io.netty.handler.codec.http.FullHttpRequest;

public interface HttpRequest extends Request {

    /**
     * Keeps the originating request for its headers. Its content is released once decoding completes.
     */
    public void setHttpRequest(FullHttpRequest httpRequest);

    public FullHttpRequest getHttpRequest();
}
