package com.agentrelay.core.transport;

import com.agentrelay.core.model.WorkerReply;

/**
 * Callback the transport invokes, on its own threads, when a published envelope resolves.
 */
public interface ReplyHandler {

    void onReply(WorkerReply reply);

    /**
     * The envelope was accepted but could not be handed to its recipient.
     */
    void onDeliveryFailure(Envelope envelope, Throwable cause);
}
