package com.example.bottle.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class BottleItemTest {

    @Test
    void snapshotDoesNotShareContainerSize() {
        BottleItem item = BottleItem.builder()
                .id(1L)
                .name("Example IPA")
                .size(ContainerSize.millilitres(355))
                .quantity(24)
                .barcode(Barcode.of(123456L))
                .lastUpdated(Instant.parse("2024-03-01T10:15:30Z"))
                .build();

        BottleItem snapshot = item.snapshot();
        snapshot.getSize().setSize(500);
        snapshot.setQuantity(1);

        assertThat(item.getSize().getSize()).isEqualTo(355);
        assertThat(item.getQuantity()).isEqualTo(24);
        assertThat(snapshot.getBarcode()).isEqualTo(item.getBarcode());
    }

    @Test
    void breakageCounterAccumulates() {
        BreakageCounter counter = new BreakageCounter();

        counter.increment(24);
        counter.increment(12);

        assertThat(counter.getTotalBreakage()).isEqualTo(36);
    }
}
