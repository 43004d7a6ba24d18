package tsproxy.netty.http;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import tsproxy.api.request.QueryRequest;
import tsproxy.api.response.TsProxyException;
import tsproxy.netty.Constants;
import tsproxy.server.cache.QueryOrchestrator;
import tsproxy.util.JsonUtil;

public class HttpQueryRequestHandler extends SimpleChannelInboundHandler<QueryRequest>
        implements TsProxyHttpHandler {

    private final QueryOrchestrator orchestrator;

    public HttpQueryRequestHandler(QueryOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, QueryRequest msg) throws Exception {
        byte[] buf;
        try {
            buf = JsonUtil.getObjectMapper().writeValueAsBytes(orchestrator.handle(msg.getBody()));
        } catch (TsProxyException e) {
            this.sendHttpError(ctx, e);
            return;
        }
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK,
                Unpooled.copiedBuffer(buf));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, Constants.JSON_TYPE);
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        sendResponse(ctx, response);
    }

}
