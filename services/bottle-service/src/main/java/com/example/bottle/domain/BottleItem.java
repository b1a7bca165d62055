package com.example.bottle.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A stocked beer. Created and removed only by the inventory, which assigns the id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BottleItem {

    private Long id;
    private String style;
    private String name;
    private double strengthPercent;
    private ContainerSize size;
    private int quantity;
    private Barcode barcode;
    private Instant lastUpdated;

    public void touch(Instant now) {
        lastUpdated = now;
    }

    public BottleItem snapshot() {
        return toBuilder()
                .size(size != null ? size.copy() : null)
                .build();
    }
}
