package com.broadcaster.broker;

/**
 * Connection state of the order-book stream.
 */
public enum StreamState {
    DISCONNECTED,
    CONNECTING,
    SUBSCRIBED
}
