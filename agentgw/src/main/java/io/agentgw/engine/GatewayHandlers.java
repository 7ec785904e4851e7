package io.agentgw.engine;

import java.util.List;
import java.util.function.Consumer;

/**
 * The agent engine as seen by the gateway. Implementations may block; the gateway never calls
 * them on an I/O thread.
 */
public interface GatewayHandlers {

    /**
     * Runs one message through the engine.
     *
     * @param onChunk receives partial output in emission order, invoked on the thread running this call
     */
    MessageOutcome processMessage(MessageRequest request, Consumer<String> onChunk) throws Exception;

    List<SessionSummary> listSessions();

    EngineStatus getStatus();
}
