package io.agentgw.auth;

/**
 * A freshly minted bearer token and the client it identifies. The plaintext token exists only here.
 */
public record IssuedToken(String token, AuthClient client) {

    @Override
    public String toString() {
        return "IssuedToken[client=" + client + ", token=<redacted>]";
    }
}
