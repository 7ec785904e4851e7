package io.agentgw.transport.http;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface RpcMethod {

    /**
     * @param params request {@code params}, an empty object when omitted
     * @return value serialized as the response {@code result}
     */
    Object invoke(JsonNode params, GatewayCallContext context) throws Exception;
}
