package com.askdb.query;

import com.askdb.api.StreamEvent;

/**
 * Receiver of a streamed answer, typically one HTTP client.
 */
public interface StreamEventSink {

    /**
     * Deliver an event. A delivery failure must mark the sink closed rather than throw.
     *
     * @param event event
     */
    void send(StreamEvent event);

    /**
     * Whether the receiver is still listening.
     *
     * @return false once the client has gone
     */
    boolean isOpen();
}
