package com.example.bottle.service;

import com.example.bottle.domain.BottleItem;
import com.example.stock.events.BottleAddedEvent;
import com.example.stock.events.BottleEditedEvent;
import com.example.stock.events.BottleRemovedEvent;
import com.example.stock.events.BreakageFlaggedEvent;
import com.example.stock.events.BreakageRecordedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public void publishBottleAdded(BottleItem item, boolean breakageFlagged) {
        BottleAddedEvent event = BottleAddedEvent.builder()
                .eventId(UUID.randomUUID())
                .itemId(item.getId())
                .name(item.getName())
                .style(item.getStyle())
                .quantity(item.getQuantity())
                .sizeInMl(item.getSize() != null ? item.getSize().getSizeInMl() : null)
                .barcode(item.getBarcode() != null ? item.getBarcode().getValue() : null)
                .breakageFlagged(breakageFlagged)
                .eventTimestamp(Instant.now(clock))
                .build();

        applicationEventPublisher.publishEvent(event);
        log.debug("BottleAddedEvent published: eventId={}, itemId={}", event.getEventId(), item.getId());
    }

    public void publishBottleRemoved(BottleItem item, int remainingTotal) {
        BottleRemovedEvent event = BottleRemovedEvent.builder()
                .eventId(UUID.randomUUID())
                .itemId(item.getId())
                .name(item.getName())
                .quantityRemoved(item.getQuantity())
                .remainingTotal(remainingTotal)
                .eventTimestamp(Instant.now(clock))
                .build();

        applicationEventPublisher.publishEvent(event);
        log.debug("BottleRemovedEvent published: eventId={}, itemId={}", event.getEventId(), item.getId());
    }

    public void publishBottleEdited(BottleItem item, String previousName, int previousQuantity) {
        BottleEditedEvent event = BottleEditedEvent.builder()
                .eventId(UUID.randomUUID())
                .itemId(item.getId())
                .previousName(previousName)
                .name(item.getName())
                .previousQuantity(previousQuantity)
                .quantity(item.getQuantity())
                .eventTimestamp(Instant.now(clock))
                .build();

        applicationEventPublisher.publishEvent(event);
        log.debug("BottleEditedEvent published: eventId={}, itemId={}", event.getEventId(), item.getId());
    }

    public void publishBreakageRecorded(String name, int quantity, int breakageTotal) {
        BreakageRecordedEvent event = BreakageRecordedEvent.builder()
                .eventId(UUID.randomUUID())
                .name(name)
                .quantity(quantity)
                .breakageTotal(breakageTotal)
                .eventTimestamp(Instant.now(clock))
                .build();

        applicationEventPublisher.publishEvent(event);
        log.debug("BreakageRecordedEvent published: eventId={}, name={}", event.getEventId(), name);
    }

    public void publishBreakageFlagged() {
        BreakageFlaggedEvent event = BreakageFlaggedEvent.builder()
                .eventId(UUID.randomUUID())
                .eventTimestamp(Instant.now(clock))
                .build();

        applicationEventPublisher.publishEvent(event);
        log.debug("BreakageFlaggedEvent published: eventId={}", event.getEventId());
    }
}
