package com.demo.groupchat.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Message timestamps: ISO-8601 UTC with millisecond precision, strictly increasing
 * within this process so that string order matches post order.
 */
@Component
public class MessageClock {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final AtomicLong lastMillis = new AtomicLong();

    public MessageClock() {
        this(Clock.systemUTC());
    }

    MessageClock(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        long now = clock.millis();
        long millis = lastMillis.updateAndGet(previous -> Math.max(previous + 1, now));
        return FORMAT.format(Instant.ofEpochMilli(millis));
    }
}
