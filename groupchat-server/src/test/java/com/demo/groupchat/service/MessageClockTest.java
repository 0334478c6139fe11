package com.demo.groupchat.service;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageClockTest {

    @Test
    void formatsIsoUtcWithMillis() {
        MessageClock clock = new MessageClock(Clock.fixed(Instant.parse("2024-03-05T10:15:30.123Z"), ZoneOffset.UTC));

        assertEquals("2024-03-05T10:15:30.123Z", clock.next());
    }

    @Test
    void advancesPastAStalledWallClock() {
        MessageClock clock = new MessageClock(Clock.fixed(Instant.parse("2024-03-05T10:15:30.123Z"), ZoneOffset.UTC));

        String first = clock.next();
        String second = clock.next();

        assertEquals("2024-03-05T10:15:30.124Z", second);
        assertTrue(first.compareTo(second) < 0);
    }
}
