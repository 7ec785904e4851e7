package io.agentgw.engine;

import java.util.Map;

@FunctionalInterface
public interface WebhookHandler {

    /**
     * @return fields merged into the {@code 202} response, conventionally including {@code matchedJobs}
     */
    Map<String, Object> handleWebhook(WebhookPayload payload) throws Exception;
}
