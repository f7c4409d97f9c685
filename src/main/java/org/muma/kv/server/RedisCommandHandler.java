package org.muma.kv.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.muma.kv.command.CommandDispatcher;
import org.muma.kv.protocol.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Per-connection handler. Commands run directly on the channel's event loop; the store does its own locking.
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public static int connectedClients() {
        return connectedClients.get();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.incrementAndGet();
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.decrementAndGet();
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        if (msg instanceof RedisArray array) {
            handleCommand(ctx, array);
        } else {
            log.warn("Received non-array message: {}", msg);
            ctx.writeAndFlush(new ErrorMessage("ERR protocol error: expected array"));
        }
    }

    private void handleCommand(ChannelHandlerContext ctx, RedisArray array) {
        RedisMessage[] elements = array.elements();
        if (elements == null || elements.length == 0) return;

        if (!(elements[0] instanceof BulkString cmdNameBulk) || cmdNameBulk.isNull()) {
            ctx.writeAndFlush(new ErrorMessage("ERR protocol error: command name must be string"));
            return;
        }

        String commandName = cmdNameBulk.asString();

        if (log.isDebugEnabled()) {
            String argsLog = Arrays.stream(elements).skip(1).map(this::convertToString).collect(Collectors.joining(", "));
            log.debug("Execute Command: {} args=[{}]", commandName, argsLog);
        }

        if ("QUIT".equals(commandName.toUpperCase(Locale.ROOT))) {
            ctx.writeAndFlush(SimpleString.OK).addListener(ChannelFutureListener.CLOSE);
            return;
        }

        ctx.writeAndFlush(dispatcher.dispatch(commandName, array));
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            log.warn("Protocol error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
            ctx.writeAndFlush(new ErrorMessage("ERR " + rootMessage(cause)))
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            log.error("Unexpected error on channel {}", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }

    private static String rootMessage(Throwable cause) {
        Throwable t = cause;
        while (t.getCause() != null && t.getMessage() == null) {
            t = t.getCause();
        }
        return t.getMessage() == null ? "Protocol error: invalid request" : t.getMessage();
    }

    private String convertToString(RedisMessage msg) {
        if (msg instanceof BulkString b) return b.asString();
        if (msg instanceof SimpleString s) return s.content();
        if (msg instanceof RedisInteger i) return String.valueOf(i.value());
        return "<?>";
    }
}
