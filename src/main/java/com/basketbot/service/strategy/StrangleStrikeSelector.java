package com.basketbot.service.strategy;

import com.basketbot.config.StrategyConfig;
import com.basketbot.config.StrategyConfig.StrangleConfig;
import com.basketbot.model.Leg;
import com.basketbot.model.OptionType;
import com.basketbot.util.StrikeUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Call at ATM + offset and put at ATM - offset, both on the configured side.
 */
@Slf4j
public class StrangleStrikeSelector implements StrikeSelector {

    private final StrangleConfig strangle;
    private final int strikeBase;
    private final int lotSize;

    public StrangleStrikeSelector(StrategyConfig config) {
        this.strangle = config.getStrangle();
        this.strikeBase = config.getStrikeBase();
        this.lotSize = config.getLotSize();
    }

    @Override
    public List<Leg> select(double spot) {
        double atm = StrikeUtils.atmStrike(spot, strikeBase);
        int quantity = strangle.getQuantityMultiplier() * lotSize;
        String side = strangle.getSide().name();

        Leg call = Leg.builder()
                .label(side + "_CE")
                .optionType(OptionType.CE)
                .strike(atm + strangle.getOffset())
                .side(strangle.getSide())
                .quantity(quantity)
                .build();
        Leg put = Leg.builder()
                .label(side + "_PE")
                .optionType(OptionType.PE)
                .strike(atm - strangle.getOffset())
                .side(strangle.getSide())
                .quantity(quantity)
                .build();

        log.info("Spot {} -> ATM {} -> strangle CE {} / PE {}", spot, atm, call.getStrike(), put.getStrike());
        return List.of(call, put);
    }
}
