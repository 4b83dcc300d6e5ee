package com.basketbot.config;

import com.basketbot.service.streaming.DataType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Realtime feed settings.
 */
@ConfigurationProperties(prefix = "streaming")
@Getter
@Setter
public class StreamingConfig {

    private boolean enabled = true;

    /** Symbols subscribed at startup, e.g. NSE:NIFTY 50 */
    private List<String> symbols = new ArrayList<>();

    private DataType dataType = DataType.SYMBOL_UPDATE;

    private int queueCapacity = 10_000;

    private Duration reconnectInitialDelay = Duration.ofSeconds(1);
    private Duration reconnectMaxDelay = Duration.ofSeconds(60);

    /** Upper bound on how long disconnect waits for the transport to close */
    private Duration closeGracePeriod = Duration.ofSeconds(3);
}
