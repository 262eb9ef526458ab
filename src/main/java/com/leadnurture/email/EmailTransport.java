package com.leadnurture.email;

import com.leadnurture.dto.OutboundEmail;
import com.leadnurture.exception.EmailDeliveryException;

/**
 * Outbound email collaborator. Returns the provider-assigned message id.
 */
public interface EmailTransport {

    String send(OutboundEmail email) throws EmailDeliveryException;

    /** False when no credentials are configured and simulation is off. */
    boolean isEnabled();
}
