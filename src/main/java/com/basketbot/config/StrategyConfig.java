package com.basketbot.config;

import com.basketbot.model.OptionType;
import com.basketbot.model.Side;
import com.basketbot.model.StrategyVariant;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.List;

/**
 * Strategy parameters, read once from the strategy file at startup.
 * <p>
 * Bound through the constructor so every component sees the same immutable value.
 * Times use HH:mm in the market's zone.
 */
@ConfigurationProperties(prefix = "strategy")
@Validated
@Getter
public class StrategyConfig {

    private static final String TIME_PATTERN = "^([01]\\d|2[0-3]):[0-5]\\d$";

    @NotBlank
    private final String underlying;

    /** Symbol used to quote the underlying spot, e.g. "NSE:NIFTY 50" */
    @NotBlank
    private final String underlyingQuoteSymbol;

    @NotBlank
    private final String optionExchange;

    @NotNull
    private final StrategyVariant variant;

    @Min(1)
    private final int lotSize;

    @Min(1)
    private final int strikeBase;

    @Valid
    private final List<LegConfig> legs;

    @Valid
    private final StrangleConfig strangle;

    @DecimalMin("0.0")
    private final double targetPercent;

    @DecimalMin("0.0")
    private final double stopLossPercent;

    @NotEmpty
    private final List<DayOfWeek> entryDays;

    @Pattern(regexp = TIME_PATTERN)
    private final String entryTime;

    @Pattern(regexp = TIME_PATTERN)
    private final String exitTime;

    @NotBlank
    private final String productType;

    @NotBlank
    private final String orderType;

    @NotNull
    private final Duration pollInterval;

    @NotNull
    private final Duration orderPacing;

    /** Stop the application once the day's cycle is DONE or FAILED */
    private final boolean shutdownOnCompletion;

    @Valid
    private final RsiFilterConfig rsiFilter;

    @Builder
    public StrategyConfig(@DefaultValue("NIFTY") String underlying,
                          @DefaultValue("NSE:NIFTY 50") String underlyingQuoteSymbol,
                          @DefaultValue("NFO") String optionExchange,
                          @DefaultValue("OFFSET_BASKET") StrategyVariant variant,
                          @DefaultValue("50") int lotSize,
                          @DefaultValue("50") int strikeBase,
                          List<LegConfig> legs,
                          StrangleConfig strangle,
                          @DefaultValue("1.0") double targetPercent,
                          @DefaultValue("1.0") double stopLossPercent,
                          @DefaultValue("MONDAY") List<DayOfWeek> entryDays,
                          @DefaultValue("09:45") String entryTime,
                          @DefaultValue("15:15") String exitTime,
                          @DefaultValue("MIS") String productType,
                          @DefaultValue("MARKET") String orderType,
                          @DefaultValue("10s") Duration pollInterval,
                          @DefaultValue("500ms") Duration orderPacing,
                          @DefaultValue("true") boolean shutdownOnCompletion,
                          RsiFilterConfig rsiFilter) {
        this.underlying = underlying;
        this.underlyingQuoteSymbol = underlyingQuoteSymbol;
        this.optionExchange = optionExchange;
        this.variant = variant;
        this.lotSize = lotSize;
        this.strikeBase = strikeBase;
        this.legs = legs != null ? List.copyOf(legs) : List.of();
        this.strangle = strangle;
        this.targetPercent = targetPercent;
        this.stopLossPercent = stopLossPercent;
        this.entryDays = entryDays != null ? List.copyOf(entryDays) : List.of();
        this.entryTime = entryTime;
        this.exitTime = exitTime;
        this.productType = productType;
        this.orderType = orderType;
        this.pollInterval = pollInterval;
        this.orderPacing = orderPacing;
        this.shutdownOnCompletion = shutdownOnCompletion;
        this.rsiFilter = rsiFilter != null ? rsiFilter : RsiFilterConfig.disabled();
    }

    public LocalTime entryLocalTime() {
        return LocalTime.parse(entryTime);
    }

    public LocalTime exitLocalTime() {
        return LocalTime.parse(exitTime);
    }

    @AssertTrue(message = "entryTime must be before exitTime")
    public boolean isEntryBeforeExit() {
        if (entryTime == null || exitTime == null
                || !entryTime.matches(TIME_PATTERN) || !exitTime.matches(TIME_PATTERN)) {
            return true; // reported by @Pattern
        }
        return entryLocalTime().isBefore(exitLocalTime());
    }

    @AssertTrue(message = "variant needs its leg definition: legs for OFFSET_BASKET, strangle for STRANGLE")
    public boolean isLegDefinitionPresent() {
        if (variant == StrategyVariant.STRANGLE) {
            return strangle != null;
        }
        return !legs.isEmpty();
    }

    /**
     * One configured leg of an offset basket.
     */
    @Getter
    public static class LegConfig {

        @NotBlank
        private final String label;

        @NotNull
        private final OptionType optionType;

        @NotNull
        private final Side side;

        /** Points above ATM */
        @Min(0)
        private final int offset;

        @Min(1)
        private final int quantityMultiplier;

        @Builder
        public LegConfig(String label, @DefaultValue("CE") OptionType optionType, Side side,
                         int offset, @DefaultValue("1") int quantityMultiplier) {
            this.label = label;
            this.optionType = optionType;
            this.side = side;
            this.offset = offset;
            this.quantityMultiplier = quantityMultiplier;
        }
    }

    /**
     * Strangle: call at ATM + offset and put at ATM - offset, same side and size.
     */
    @Getter
    public static class StrangleConfig {

        @Min(0)
        private final int offset;

        @NotNull
        private final Side side;

        @Min(1)
        private final int quantityMultiplier;

        @Builder
        public StrangleConfig(@DefaultValue("100") int offset, @DefaultValue("SELL") Side side,
                              @DefaultValue("1") int quantityMultiplier) {
            this.offset = offset;
            this.side = side;
            this.quantityMultiplier = quantityMultiplier;
        }
    }

    /**
     * Optional RSI gate on index candles, evaluated once per closed candle.
     */
    @Getter
    public static class RsiFilterConfig {

        private final boolean enabled;

        @Min(2)
        private final int period;

        /** Candle resolution: 1, 5, 15, 60 or D */
        @Pattern(regexp = "^(1|3|5|10|15|30|60|D)$")
        private final String resolution;

        @Min(1)
        private final int historyDays;

        @DecimalMin("0.0")
        private final double entryLevel;

        @NotNull
        private final Direction direction;

        @Builder
        public RsiFilterConfig(@DefaultValue("false") boolean enabled,
                               @DefaultValue("14") int period,
                               @DefaultValue("5") String resolution,
                               @DefaultValue("5") int historyDays,
                               @DefaultValue("60") double entryLevel,
                               @DefaultValue("ABOVE") Direction direction) {
            this.enabled = enabled;
            this.period = period;
            this.resolution = resolution;
            this.historyDays = historyDays;
            this.entryLevel = entryLevel;
            this.direction = direction;
        }

        static RsiFilterConfig disabled() {
            return new RsiFilterConfig(false, 14, "5", 5, 60.0, Direction.ABOVE);
        }

        public enum Direction {
            /** Enter when RSI is at or above the entry level */
            ABOVE,
            /** Enter when RSI is at or below the entry level */
            BELOW
        }
    }
}
