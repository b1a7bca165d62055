package com.example.stock.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Raised for every add that happens while breakage flagging is on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BreakageRecordedEvent {

    private UUID eventId;
    private String name;
    private Integer quantity;
    private Integer breakageTotal;
    private Instant eventTimestamp;
}
