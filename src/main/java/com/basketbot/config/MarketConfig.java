package com.basketbot.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Exchange session settings: time zone, regular session window and trading holidays.
 */
@ConfigurationProperties(prefix = "market")
@Getter
@Setter
public class MarketConfig {

    private String zone = "Asia/Kolkata";
    private String openTime = "09:15"; // HH:mm
    private String closeTime = "15:30"; // HH:mm

    /** Exchange holidays, yyyy-MM-dd */
    private List<String> holidays = new ArrayList<>();
}
