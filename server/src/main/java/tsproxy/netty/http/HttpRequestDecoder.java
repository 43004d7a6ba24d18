package tsproxy.netty.http;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import tsproxy.api.annotation.AnnotationResolver;
import tsproxy.api.request.HttpGetRequest;
import tsproxy.api.request.HttpPostRequest;
import tsproxy.api.request.HttpRequest;
import tsproxy.api.response.TsProxyException;

/**
 * Turns an aggregated HTTP request into the {@link HttpRequest} registered for its path and method.
 */
public class HttpRequestDecoder extends MessageToMessageDecoder<FullHttpRequest> implements TsProxyHttpHandler {

    private static final Logger LOG = LoggerFactory.getLogger(HttpRequestDecoder.class);
    private static final String LOG_RECEIVED_REQUEST = "Received HTTP request {}";
    private static final String LOG_PARSED_REQUEST = "Parsed request {}";

    @Override
    protected void decode(ChannelHandlerContext ctx, FullHttpRequest msg, List<Object> out) throws Exception {

        LOG.trace(LOG_RECEIVED_REQUEST, msg);

        final QueryStringDecoder decoder = new QueryStringDecoder(msg.uri());
        HttpRequest request;
        try {
            if (msg.method().equals(HttpMethod.GET)) {
                HttpGetRequest get = AnnotationResolver.getClassForHttpGet(decoder.path());
                if (null == get) {
                    throw notFound(decoder.path());
                }
                request = get.parseQueryParameters(decoder);
            } else if (msg.method().equals(HttpMethod.POST)) {
                HttpPostRequest post = AnnotationResolver.getClassForHttpPost(decoder.path());
                if (null == post) {
                    throw notFound(decoder.path());
                }
                String content = "";
                ByteBuf body = msg.content();
                if (null != body) {
                    content = body.toString(StandardCharsets.UTF_8);
                }
                request = post.parseBody(content);
            } else {
                TsProxyException e = new TsProxyException(HttpResponseStatus.METHOD_NOT_ALLOWED.code(),
                        "unhandled method type", "");
                e.addResponseHeader(HttpHeaderNames.ALLOW.toString(),
                        HttpMethod.GET.name() + "," + HttpMethod.POST.name());
                LOG.warn("Unhandled HTTP request type {}", msg.method());
                throw e;
            }
            request.setHttpRequest(msg);
            LOG.trace(LOG_PARSED_REQUEST, request);
            request.validate();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TsProxyException(HttpResponseStatus.BAD_REQUEST.code(), "Unable to parse request",
                    e.getMessage(), e);
        }
        out.add(request);
    }

    private static TsProxyException notFound(String path) {
        return new TsProxyException(HttpResponseStatus.NOT_FOUND.code(), "Not found", "No handler for " + path);
    }

}
