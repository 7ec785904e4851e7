package io.agentgw.transport.http;

/**
 * Caller identity resolved by the bearer check for {@code /rpc} and registered routes.
 *
 * @param clientId issued client id, or {@code "static"} for the configured gateway token
 */
public record GatewayCallContext(String clientId, String label, boolean staticToken) {

    public static final String STATIC_CLIENT_ID = "static";

    public static GatewayCallContext forStaticToken() {
        return new GatewayCallContext(STATIC_CLIENT_ID, "gateway-auth-token", true);
    }
}
