package com.example.bottle.listener;

import com.example.bottle.config.BottleProperties;
import com.example.stock.events.BottleAddedEvent;
import com.example.stock.events.BottleEditedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class InventoryActivityListenerTest {

    @Test
    @DisplayName("Should keep only the most recent entries up to the configured capacity")
    void shouldDropOldestBeyondCapacity() {
        BottleProperties properties = new BottleProperties();
        properties.setActivityLogCapacity(2);
        InventoryActivityListener listener = new InventoryActivityListener(properties);

        for (int i = 1; i <= 3; i++) {
            listener.handleBottleAdded(BottleAddedEvent.builder()
                    .eventId(UUID.randomUUID())
                    .itemId((long) i)
                    .name("Beer " + i)
                    .quantity(i)
                    .eventTimestamp(Instant.parse("2024-03-01T10:15:30Z"))
                    .build());
        }

        assertThat(listener.recentActivity())
                .extracting(ActivityEntry::getSummary)
                .containsExactly("2 bottles of Beer 2 added", "3 bottles of Beer 3 added");
    }

    @Test
    @DisplayName("Should describe renames and in-place edits differently")
    void shouldSummariseEdits() {
        InventoryActivityListener listener = new InventoryActivityListener(new BottleProperties());

        listener.handleBottleEdited(BottleEditedEvent.builder()
                .eventId(UUID.randomUUID())
                .previousName("Sample Stout")
                .name("Oatmeal Stout")
                .build());
        listener.handleBottleEdited(BottleEditedEvent.builder()
                .eventId(UUID.randomUUID())
                .previousName("Oatmeal Stout")
                .name("Oatmeal Stout")
                .build());

        assertThat(listener.recentActivity())
                .extracting(ActivityEntry::getSummary)
                .containsExactly("Sample Stout renamed to Oatmeal Stout", "Oatmeal Stout updated");
    }
}
