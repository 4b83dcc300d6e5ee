package com.basketbot.service.strategy;

import com.basketbot.config.StrategyConfig;
import com.basketbot.config.StrategyConfig.LegConfig;
import com.basketbot.model.Leg;
import com.basketbot.util.StrikeUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Places each configured leg at ATM plus its offset. With offsets 200/400/600 and
 * multipliers 1/3/2 this is the buy-sell-buy call ratio basket.
 */
@Slf4j
public class OffsetStrikeSelector implements StrikeSelector {

    private final List<LegConfig> legs;
    private final int strikeBase;
    private final int lotSize;

    public OffsetStrikeSelector(StrategyConfig config) {
        this.legs = config.getLegs();
        this.strikeBase = config.getStrikeBase();
        this.lotSize = config.getLotSize();
    }

    @Override
    public List<Leg> select(double spot) {
        double atm = StrikeUtils.atmStrike(spot, strikeBase);
        List<Leg> selected = new ArrayList<>(legs.size());
        for (LegConfig leg : legs) {
            selected.add(Leg.builder()
                    .label(leg.getLabel())
                    .optionType(leg.getOptionType())
                    .strike(atm + leg.getOffset())
                    .side(leg.getSide())
                    .quantity(leg.getQuantityMultiplier() * lotSize)
                    .build());
        }
        log.info("Spot {} -> ATM {} -> strikes {}", spot, atm,
                selected.stream().map(l -> l.getLabel() + "@" + (long) l.getStrike()).toList());
        return selected;
    }
}
