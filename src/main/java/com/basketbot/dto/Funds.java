package com.basketbot.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Funds {
    /** Margin currently blocked by open positions */
    private double utilizedMargin;
    private double availableCash;
}
