package com.printshop_voice_backend.websocket;

import com.printshop_voice_backend.dto.PipelineEvent;

/**
 * Outbound side of one client's voice channel.
 */
public interface ClientConnection {

    String getId();

    /**
     * Best-effort send. Returns false when the frame could not be delivered;
     * never throws for a closed or failing transport.
     */
    boolean send(PipelineEvent event);

    /**
     * Close the transport with the given status. Only the first call has an effect.
     */
    void close(int code, String reason);

    boolean isOpen();
}
