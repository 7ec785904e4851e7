package io.agentgw.engine;

/**
 * Service-provider hook for plugging an agent engine into the daemon.
 * Registered under {@code META-INF/services/io.agentgw.engine.GatewayEngineFactory}.
 */
public interface GatewayEngineFactory {

    GatewayHandlers createHandlers(GatewayEventBus eventBus);

    /**
     * @return webhook handler, or null to accept and drop webhooks
     */
    default WebhookHandler createWebhookHandler(GatewayEventBus eventBus) {
        return null;
    }
}
