package io.github.drompincen.jobengine.runtime.port;

/** Delivers a rendered notification to the owner over a channel. */
public interface NotificationTransport {

    DeliveryResult send(String ownerId, String channel, NotificationMessage message);
}
