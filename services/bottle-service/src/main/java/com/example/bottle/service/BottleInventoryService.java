package com.example.bottle.service;

import com.example.bottle.config.BottleProperties;
import com.example.bottle.domain.Barcode;
import com.example.bottle.domain.BottleItem;
import com.example.bottle.domain.BottlePatch;
import com.example.bottle.domain.BreakageCounter;
import com.example.bottle.domain.Confirmation;
import com.example.bottle.domain.ContainerSize;
import com.example.bottle.domain.FlaggedBreakage;
import com.example.bottle.domain.InventoryOperation;
import com.example.bottle.domain.NewBottle;
import com.example.bottle.error.InventoryError;
import com.example.bottle.error.InventoryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory bottle stock. Keeps the item list, the per-name and {@value #TOTAL_KEY} counts
 * and the breakage bookkeeping in step with each other.
 *
 * <p>Every rejected call throws {@link InventoryException} before touching any state.
 * Not thread-safe; the inventory has a single caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BottleInventoryService {

    public static final String TOTAL_KEY = "Total";

    private final Clock clock;
    private final InventoryEventPublisher eventPublisher;
    private final BottleProperties properties;

    private final List<BottleItem> items = new ArrayList<>();
    private final Map<String, Integer> countsByName = new TreeMap<>();
    private final List<FlaggedBreakage> flaggedBreakage = new ArrayList<>();
    private final BreakageCounter breakageCounter = new BreakageCounter();
    private boolean breakageFlagged;
    private long nextId = 1;

    @EventListener(ApplicationReadyEvent.class)
    public void applyStartupSettings() {
        if (properties.isBreakageFlaggedOnStartup()) {
            log.info("Breakage flagging enabled on startup");
            flagBreakage();
        }
    }

    public Confirmation add(NewBottle candidate) {
        String name = candidate.getName();
        int quantity = candidate.getQuantity();
        log.info("Processing add for name={}, quantity={}", name, quantity);

        if (quantity <= 0) {
            throw rejection(InventoryError.INVALID_QUANTITY, "Invalid quantity. Please enter a positive value.");
        }
        if (!StringUtils.hasText(name)) {
            throw rejection(InventoryError.INVALID_NAME, "Beer name must not be blank.");
        }
        if (TOTAL_KEY.equals(name)) {
            throw rejection(InventoryError.RESERVED_NAME, "'" + TOTAL_KEY + "' is reserved for the overall count.");
        }
        if (findLiveByName(name).isPresent()) {
            throw rejection(InventoryError.DUPLICATE_NAME, "Beer with name '" + name + "' already exists.");
        }

        BottleItem item = BottleItem.builder()
                .id(nextId++)
                .style(candidate.getStyle())
                .name(name)
                .strengthPercent(candidate.getStrengthPercent())
                .size(candidate.getSize() != null ? candidate.getSize().copy() : null)
                .quantity(quantity)
                .barcode(Barcode.of(candidate.getBarcode()))
                .lastUpdated(Instant.now(clock))
                .build();

        items.add(item);
        adjustCount(name, quantity);
        adjustCount(TOTAL_KEY, quantity);

        log.info("{} bottles of {} added to stock: itemId={}", quantity, name, item.getId());
        eventPublisher.publishBottleAdded(item, breakageFlagged);

        if (breakageFlagged) {
            flaggedBreakage.add(new FlaggedBreakage(name, quantity));
            breakageCounter.increment(quantity);
            log.info("Breakage has been flagged while adding beer: name={}, quantity={}, breakageTotal={}",
                    name, quantity, breakageCounter.getTotalBreakage());
            eventPublisher.publishBreakageRecorded(name, quantity, breakageCounter.getTotalBreakage());
        }

        return Confirmation.builder()
                .operation(InventoryOperation.ADD)
                .itemId(item.getId())
                .name(name)
                .quantity(quantity)
                .breakageFlagged(breakageFlagged)
                .message(quantity + " bottles of " + name + " added to stock.")
                .build();
    }

    public Confirmation removeById(long id) {
        log.info("Processing removal for itemId={}", id);

        BottleItem item = items.stream()
                .filter(candidate -> candidate.getId() == id)
                .findFirst()
                .orElseThrow(() -> rejection(InventoryError.NOT_FOUND, "Beer with id " + id + " not found."));

        adjustCount(item.getName(), -item.getQuantity());
        adjustCount(TOTAL_KEY, -item.getQuantity());
        items.remove(item);

        log.info("{} bottles of {} removed from stock: itemId={}", item.getQuantity(), item.getName(), id);
        eventPublisher.publishBottleRemoved(item, countsByName.get(TOTAL_KEY));

        return Confirmation.builder()
                .operation(InventoryOperation.REMOVE)
                .itemId(item.getId())
                .name(item.getName())
                .quantity(item.getQuantity())
                .breakageFlagged(breakageFlagged)
                .message(item.getQuantity() + " bottles of " + item.getName() + " removed from stock.")
                .build();
    }

    public Confirmation edit(String name, BottlePatch patch) {
        Objects.requireNonNull(patch, "patch");
        log.info("Processing edit for name={}", name);

        BottleItem item = findLiveByName(name)
                .orElseThrow(() -> rejection(InventoryError.NOT_FOUND, "Beer with name '" + name + "' not found."));

        String previousName = item.getName();
        int previousQuantity = item.getQuantity();
        String newName = StringUtils.hasText(patch.getName()) ? patch.getName() : previousName;
        int newQuantity = patch.getQuantity() != null ? patch.getQuantity() : previousQuantity;

        if (!newName.equals(previousName)) {
            if (TOTAL_KEY.equals(newName)) {
                throw rejection(InventoryError.RESERVED_NAME, "'" + TOTAL_KEY + "' is reserved for the overall count.");
            }
            if (findLiveByName(newName).isPresent()) {
                throw rejection(InventoryError.CONFLICT, "Beer with name '" + newName + "' already exists.");
            }
        }
        if (newQuantity < 0) {
            throw rejection(InventoryError.INVALID_QUANTITY, "Invalid quantity. Please enter a non-negative value.");
        }

        adjustCount(previousName, -previousQuantity);
        adjustCount(newName, newQuantity);
        adjustCount(TOTAL_KEY, newQuantity - previousQuantity);

        item.setName(newName);
        item.setQuantity(newQuantity);
        if (StringUtils.hasText(patch.getStyle())) {
            item.setStyle(patch.getStyle());
        }
        if (patch.getStrengthPercent() != null) {
            item.setStrengthPercent(patch.getStrengthPercent());
        }
        if (patch.getSize() != null || patch.getMetric() != null) {
            ContainerSize resized = item.getSize() != null ? item.getSize().copy() : ContainerSize.millilitres(0);
            if (patch.getSize() != null) {
                resized.setSize(patch.getSize());
            }
            if (patch.getMetric() != null) {
                resized.setMetric(patch.getMetric());
            }
            item.setSize(resized);
        }
        if (patch.getBarcode() != null) {
            item.setBarcode(Barcode.of(patch.getBarcode()));
        }
        item.touch(Instant.now(clock));

        log.info("Beer details updated: itemId={}, previousName={}, name={}, previousQuantity={}, quantity={}",
                item.getId(), previousName, newName, previousQuantity, newQuantity);
        eventPublisher.publishBottleEdited(item, previousName, previousQuantity);

        return Confirmation.builder()
                .operation(InventoryOperation.EDIT)
                .itemId(item.getId())
                .name(newName)
                .quantity(newQuantity)
                .breakageFlagged(breakageFlagged)
                .message("Beer details updated.")
                .build();
    }

    public void flagBreakage() {
        if (breakageFlagged) {
            log.debug("Breakage already flagged");
            return;
        }
        breakageFlagged = true;
        log.info("Breakage flagging enabled");
        eventPublisher.publishBreakageFlagged();
    }

    public boolean isBreakageFlagged() {
        return breakageFlagged;
    }

    public int breakageTotal() {
        return breakageCounter.getTotalBreakage();
    }

    public int totalCount() {
        Integer total = countsByName.get(TOTAL_KEY);
        if (total == null) {
            throw rejection(InventoryError.NOT_FOUND, "No beer has been added to stock yet.");
        }
        return total;
    }

    /**
     * True once a beer of this name has ever been stocked, including after all of it was
     * removed again: removal lowers the count but keeps the name in the count map.
     */
    public boolean exists(String name) {
        return countsByName.containsKey(name);
    }

    public Optional<BottleItem> findById(long id) {
        return items.stream()
                .filter(item -> item.getId() == id)
                .findFirst()
                .map(BottleItem::snapshot);
    }

    public List<BottleItem> listItems() {
        return items.stream()
                .map(BottleItem::snapshot)
                .toList();
    }

    public List<FlaggedBreakage> listFlaggedBreakage() {
        return List.copyOf(flaggedBreakage);
    }

    public Map<String, Integer> countsByType() {
        return Collections.unmodifiableMap(new TreeMap<>(countsByName));
    }

    private Optional<BottleItem> findLiveByName(String name) {
        return items.stream()
                .filter(item -> item.getName().equals(name))
                .findFirst();
    }

    private void adjustCount(String key, int delta) {
        countsByName.merge(key, delta, Integer::sum);
    }

    private InventoryException rejection(InventoryError error, String message) {
        log.warn("Inventory operation rejected: error={}, reason={}", error, message);
        return new InventoryException(error, message);
    }
}
