package com.shlawgathon.faceguard.backend.delivery;

import com.shlawgathon.faceguard.backend.model.ChannelType;

/**
 * Sends one notification over one channel type. Implementations report
 * failure through the result instead of throwing where they can.
 */
public interface NotificationSender {

    ChannelType channelType();

    DeliveryResult send(OutboundNotification notification);
}
