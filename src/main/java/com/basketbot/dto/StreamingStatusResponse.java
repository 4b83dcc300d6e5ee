package com.basketbot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StreamingStatusResponse {
    private String status;
    private List<String> subscriptions;
    private int queuedMessages;
    private long droppedMessages;
    private int reconnectAttempts;
    private Map<String, Long> dispatchedByType;
}
