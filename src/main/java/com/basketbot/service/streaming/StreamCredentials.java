package com.basketbot.service.streaming;

import lombok.Getter;

/**
 * Identity used to open the feed: the API key as client id plus the session access token.
 * KiteTicker takes the two parts separately and sends them as its own query parameters,
 * so no combined {@code clientId:accessToken} string is built here.
 */
@Getter
public class StreamCredentials {

    private final String clientId;
    private final String accessToken;

    public StreamCredentials(String clientId, String accessToken) {
        this.clientId = clientId;
        this.accessToken = accessToken;
    }

    @Override
    public String toString() {
        int visible = accessToken == null ? 0 : Math.min(4, accessToken.length());
        String masked = accessToken == null ? "null" : "****" + accessToken.substring(accessToken.length() - visible);
        return "StreamCredentials(" + clientId + ":" + masked + ")";
    }
}
