package io.agentgw.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentgw.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of engine events to gateway subscribers.
 */
public final class GatewayEventBus {
    private static final Logger log = LoggerFactory.getLogger(GatewayEventBus.class);

    private final List<Consumer<GatewayEvent>> subscribers = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public GatewayEventBus() {
        this(Clock.systemUTC());
    }

    public GatewayEventBus(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return handle that removes the subscription
     */
    public Runnable subscribe(Consumer<GatewayEvent> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public GatewayEvent publish(String type, Object payload) {
        JsonNode node = payload instanceof JsonNode json ? json : Jsons.mapper().valueToTree(payload);
        GatewayEvent event = new GatewayEvent(type, node, clock.instant());
        for (Consumer<GatewayEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.warn("[EVENTS] Subscriber failed on {}: {}", type, e.toString());
            }
        }
        return event;
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
