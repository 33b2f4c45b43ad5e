package com.shlawgathon.faceguard.backend.delivery;

import com.shlawgathon.faceguard.backend.model.ChannelType;
import com.shlawgathon.faceguard.backend.pubsub.RealtimeEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Delivers an alert to connected dashboards through the realtime relay.
 */
@Component
public class DashboardSender implements NotificationSender {

    private final RealtimeEventPublisher publisher;

    public DashboardSender(RealtimeEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public ChannelType channelType() {
        return ChannelType.DASHBOARD;
    }

    @Override
    public DeliveryResult send(OutboundNotification notification) {
        publisher.publishAlert(notification.alert());
        return DeliveryResult.delivered("dashboard:" + notification.alert().getId());
    }
}
