package com.example.stock.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Raised once, when breakage flagging is first switched on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BreakageFlaggedEvent {

    private UUID eventId;
    private Instant eventTimestamp;
}
