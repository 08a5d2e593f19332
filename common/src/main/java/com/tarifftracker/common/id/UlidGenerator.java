package com.tarifftracker.common.id;

import java.security.SecureRandom;
import java.time.Clock;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * ULID ids for pending fragments and dispatch cycles: 48-bit millisecond timestamp followed by
 * 80 random bits, rendered as 26 Crockford Base32 characters so ids sort by creation time.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    private static final char[] ENCODING = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int TIME_CHARS = 10;
    private static final int RANDOM_CHARS = 16;

    public static String generate() {
        return generate(Clock.systemUTC());
    }

    public static String generate(Clock clock) {
        var chars = new char[TIME_CHARS + RANDOM_CHARS];
        long timestamp = clock.millis();
        for (int i = TIME_CHARS - 1; i >= 0; i--) {
            chars[i] = ENCODING[(int) (timestamp & 0x1F)];
            timestamp >>>= 5;
        }

        var randomness = new byte[10];
        RANDOM.nextBytes(randomness);
        // 80 bits split into two 40-bit halves, 8 chars each
        long high = toLong(randomness, 0);
        long low = toLong(randomness, 5);
        for (int i = 7; i >= 0; i--) {
            chars[TIME_CHARS + i] = ENCODING[(int) (high & 0x1F)];
            chars[TIME_CHARS + 8 + i] = ENCODING[(int) (low & 0x1F)];
            high >>>= 5;
            low >>>= 5;
        }
        return new String(chars);
    }

    private static long toLong(byte[] bytes, int offset) {
        long value = 0;
        for (int i = offset; i < offset + 5; i++) {
            value = (value << 8) | (bytes[i] & 0xFF);
        }
        return value;
    }
}
