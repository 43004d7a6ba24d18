package tsproxy.netty.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.HttpResponseStatus;
import tsproxy.api.response.TsProxyException;

@Sharable
public class TsProxyExceptionHandler extends SimpleChannelInboundHandler<TsProxyException>
        implements TsProxyHttpHandler {

    private static final Logger LOG = LoggerFactory.getLogger(TsProxyExceptionHandler.class);

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TsProxyException msg) throws Exception {
        this.sendHttpError(ctx, msg);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        if (cause instanceof TsProxyException) {
            this.sendHttpError(ctx, (TsProxyException) cause);
        } else if (null != cause.getCause() && cause.getCause() instanceof TsProxyException) {
            this.sendHttpError(ctx, (TsProxyException) cause.getCause());
        } else {
            LOG.error("Exception in pipeline", cause);
            TsProxyException e = new TsProxyException(HttpResponseStatus.INTERNAL_SERVER_ERROR.code(),
                    cause.getMessage(), "");
            this.sendHttpError(ctx, e);
        }
    }

}
