package com.basketbot.service.strategy;

import com.basketbot.config.StrategyConfig;
import com.basketbot.config.StrategyConfig.StrangleConfig;
import com.basketbot.model.Leg;
import com.basketbot.model.OptionType;
import com.basketbot.model.Side;
import com.basketbot.model.StrategyVariant;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StrangleStrikeSelectorTest {

    @Test
    void shortStrangleAroundAtm() {
        StrategyConfig config = StrategyConfig.builder()
                .variant(StrategyVariant.STRANGLE)
                .lotSize(50)
                .strikeBase(50)
                .strangle(StrangleConfig.builder().offset(100).side(Side.SELL).quantityMultiplier(2).build())
                .build();

        List<Leg> legs = new StrangleStrikeSelector(config).select(22040.0);

        assertEquals(2, legs.size());
        Leg call = legs.get(0);
        Leg put = legs.get(1);

        assertEquals(OptionType.CE, call.getOptionType());
        assertEquals(22150.0, call.getStrike());
        assertEquals(OptionType.PE, put.getOptionType());
        assertEquals(21950.0, put.getStrike());

        assertEquals("SELL_CE", call.getLabel());
        assertEquals("SELL_PE", put.getLabel());
        assertTrue(call.isShort());
        assertTrue(put.isShort());
        assertEquals(100, call.getQuantity());
        assertEquals(100, put.getQuantity());
    }
}
