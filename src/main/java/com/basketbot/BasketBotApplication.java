package com.basketbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point. Loads credentials and strategy parameters once, then hands control to
 * {@link com.basketbot.service.StrategyRunner}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BasketBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(BasketBotApplication.class, args);
    }
}
