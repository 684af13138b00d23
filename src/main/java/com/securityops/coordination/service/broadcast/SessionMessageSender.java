package com.securityops.coordination.service.broadcast;

import com.securityops.coordination.dto.OutboundEvent;
import com.securityops.coordination.service.registry.SessionHandle;

/**
 * Transport used by the broadcast router to push an event to one live session.
 */
public interface SessionMessageSender {

    /**
     * @return false when the session cannot take events yet (or the send failed);
     *         the router then keeps the event queued
     */
    boolean send(SessionHandle session, OutboundEvent event);
}
