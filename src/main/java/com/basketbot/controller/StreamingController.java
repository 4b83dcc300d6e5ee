package com.basketbot.controller;

import com.basketbot.dto.ApiResponse;
import com.basketbot.dto.StreamingStatusResponse;
import com.basketbot.service.streaming.StreamingClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/streaming")
@RequiredArgsConstructor
@Tag(name = "Streaming", description = "Realtime market and order feed")
public class StreamingController {

    private final StreamingClient streamingClient;

    @GetMapping("/status")
    @Operation(summary = "Get feed status",
               description = "Connection status, subscriptions, queue depth and dispatched message counts")
    public ResponseEntity<ApiResponse<StreamingStatusResponse>> getStatus() {
        StreamingStatusResponse status = StreamingStatusResponse.builder()
                .status(streamingClient.getStatus().name())
                .subscriptions(streamingClient.describeSubscriptions())
                .queuedMessages(streamingClient.getQueuedMessages())
                .droppedMessages(streamingClient.getDroppedMessages())
                .reconnectAttempts(streamingClient.getReconnectAttempts())
                .dispatchedByType(streamingClient.getDispatchedCounts())
                .build();
        return ResponseEntity.ok(ApiResponse.success(status));
    }
}
