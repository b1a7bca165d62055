package com.example.stock.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BottleRemovedEvent {

    private UUID eventId;
    private Long itemId;
    private String name;
    private Integer quantityRemoved;
    private Integer remainingTotal;
    private Instant eventTimestamp;
}
