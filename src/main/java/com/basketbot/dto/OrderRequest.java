package com.basketbot.dto;

import com.basketbot.model.Side;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderRequest {
    private String tradingSymbol;
    private String exchange;
    private Side side;
    private int quantity;
    private String product; // MIS, NRML
    private String orderType; // MARKET, LIMIT
    private String tag;
}
