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
public class BottleEditedEvent {

    private UUID eventId;
    private Long itemId;
    private String previousName;
    private String name;
    private Integer previousQuantity;
    private Integer quantity;
    private Instant eventTimestamp;
}
