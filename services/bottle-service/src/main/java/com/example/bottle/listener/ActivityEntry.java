package com.example.bottle.listener;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ActivityEntry {

    UUID eventId;
    String eventType;
    String summary;
    Instant occurredAt;
}
