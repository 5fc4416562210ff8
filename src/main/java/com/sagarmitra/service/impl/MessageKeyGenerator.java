package com.sagarmitra.service.impl;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues message ordering keys and record identifiers.
 *
 * <p>A message key is a UTC timestamp with microsecond precision followed by a random
 * hex suffix, e.g. {@code 2024-05-01T06:30:12.123456Z-9f3a}. Timestamps handed out by one
 * generator strictly increase, so keys sort lexicographically in issue order even when
 * the clock does not advance between two calls.</p>
 */
@Component
public class MessageKeyGenerator {

    private static final DateTimeFormatter KEY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final AtomicLong lastMicros = new AtomicLong();

    public MessageKeyGenerator() {
        this(Clock.systemUTC());
    }

    MessageKeyGenerator(Clock clock) {
        this.clock = clock;
    }

    public String nextMessageKey() {
        long now = ChronoUnit.MICROS.between(Instant.EPOCH, clock.instant());
        long micros = lastMicros.updateAndGet(last -> Math.max(last + 1, now));
        Instant instant = Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
        return KEY_FORMAT.format(instant) + "-" + randomHex(2);
    }

    public String newConversationId() {
        return "conv_" + shortUuid();
    }

    public String newMessageId() {
        return "msg_" + shortUuid();
    }

    private static String shortUuid() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    private static String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        ThreadLocalRandom.current().nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }
}
