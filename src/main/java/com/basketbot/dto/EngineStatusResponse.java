package com.basketbot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EngineStatusResponse {
    private String state;
    private LocalDate tradingDay;
    private boolean monitoring;
    private Double deployedCapital;
    private Instant entryTimestamp;
    private String lastExitDecision;
    private List<String> legs;
    private boolean manualExitRequested;
    private Instant lastUpdated;
}
