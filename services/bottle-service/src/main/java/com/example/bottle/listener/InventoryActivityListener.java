package com.example.bottle.listener;

import com.example.bottle.config.BottleProperties;
import com.example.stock.events.BottleAddedEvent;
import com.example.stock.events.BottleEditedEvent;
import com.example.stock.events.BottleRemovedEvent;
import com.example.stock.events.BreakageFlaggedEvent;
import com.example.stock.events.BreakageRecordedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

/**
 * Keeps a bounded trail of the most recent inventory events, oldest first.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InventoryActivityListener {

    private final BottleProperties properties;
    private final Deque<ActivityEntry> recent = new ArrayDeque<>();

    @EventListener
    public void handleBottleAdded(BottleAddedEvent event) {
        log.info("Received BottleAdded event: eventId={}, itemId={}, name={}, quantity={}",
                event.getEventId(), event.getItemId(), event.getName(), event.getQuantity());
        record(event.getEventId(), "BottleAddedEvent",
                event.getQuantity() + " bottles of " + event.getName() + " added",
                event.getEventTimestamp());
    }

    @EventListener
    public void handleBottleRemoved(BottleRemovedEvent event) {
        log.info("Received BottleRemoved event: eventId={}, itemId={}, name={}, quantity={}",
                event.getEventId(), event.getItemId(), event.getName(), event.getQuantityRemoved());
        record(event.getEventId(), "BottleRemovedEvent",
                event.getQuantityRemoved() + " bottles of " + event.getName() + " removed",
                event.getEventTimestamp());
    }

    @EventListener
    public void handleBottleEdited(BottleEditedEvent event) {
        log.info("Received BottleEdited event: eventId={}, itemId={}, previousName={}, name={}",
                event.getEventId(), event.getItemId(), event.getPreviousName(), event.getName());
        String summary = event.getPreviousName().equals(event.getName())
                ? event.getName() + " updated"
                : event.getPreviousName() + " renamed to " + event.getName();
        record(event.getEventId(), "BottleEditedEvent", summary, event.getEventTimestamp());
    }

    @EventListener
    public void handleBreakageRecorded(BreakageRecordedEvent event) {
        log.info("Received BreakageRecorded event: eventId={}, name={}, quantity={}, breakageTotal={}",
                event.getEventId(), event.getName(), event.getQuantity(), event.getBreakageTotal());
        record(event.getEventId(), "BreakageRecordedEvent",
                event.getQuantity() + " bottles of " + event.getName() + " recorded as breakage",
                event.getEventTimestamp());
    }

    @EventListener
    public void handleBreakageFlagged(BreakageFlaggedEvent event) {
        log.info("Received BreakageFlagged event: eventId={}", event.getEventId());
        record(event.getEventId(), "BreakageFlaggedEvent", "breakage flagging enabled", event.getEventTimestamp());
    }

    public List<ActivityEntry> recentActivity() {
        return List.copyOf(recent);
    }

    private void record(UUID eventId, String eventType, String summary, Instant occurredAt) {
        recent.addLast(new ActivityEntry(eventId, eventType, summary, occurredAt));
        while (recent.size() > properties.getActivityLogCapacity()) {
            recent.removeFirst();
        }
    }
}
