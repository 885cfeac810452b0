package com.broadcaster.websocket;

import java.io.IOException;

/**
 * A live connection that receives broadcast messages.
 */
public interface Subscriber {

    /**
     * Stable identity used for set membership.
     */
    String id();

    void send(String text) throws IOException;
}
