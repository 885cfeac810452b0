package com.broadcaster.websocket;

import io.javalin.websocket.WsContext;

/**
 * Subscriber backed by a Javalin WebSocket session.
 */
public final class JavalinSubscriber implements Subscriber {
    private final WsContext ctx;

    public JavalinSubscriber(WsContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public String id() {
        return ctx.sessionId();
    }

    @Override
    public void send(String text) {
        ctx.send(text);
    }

    @Override
    public String toString() {
        return "JavalinSubscriber[" + ctx.sessionId() + "]";
    }
}
