package com.basketbot.config;

import com.basketbot.exception.ConfigurationException;
import com.basketbot.service.streaming.StreamCredentials;
import com.basketbot.util.AccessTokenLoader;
import com.zerodhatech.kiteconnect.KiteConnect;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Kite Connect Configuration
 * Loads the API key and the access token once at startup
 */
@Configuration
@ConfigurationProperties(prefix = "kite")
@Getter
@Setter
public class KiteConfig {

    private String apiKey;

    /** JSON file holding {"access_token": ...} */
    private String tokenFile = "auth_tokens.json";

    /** Overrides the token file when set, e.g. from KITE_ACCESS_TOKEN */
    private String accessToken;

    @Bean
    public KiteConnect kiteConnect() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("kite.api-key is required");
        }
        KiteConnect kiteConnect = new KiteConnect(apiKey);
        kiteConnect.setAccessToken(resolveAccessToken());
        return kiteConnect;
    }

    @Bean
    public StreamCredentials streamCredentials(KiteConnect kiteConnect) {
        return new StreamCredentials(apiKey, kiteConnect.getAccessToken());
    }

    String resolveAccessToken() {
        if (accessToken != null && !accessToken.isBlank()) {
            return accessToken.trim();
        }
        return AccessTokenLoader.load(Path.of(tokenFile));
    }
}
