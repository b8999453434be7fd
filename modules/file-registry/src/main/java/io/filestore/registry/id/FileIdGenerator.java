package io.filestore.registry.id;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Generates public file ids of the form {@code <epochMillis>-<9 base36 chars>}. The timestamp
 * part never goes backwards, even if the wall clock does.
 */
@Component
public class FileIdGenerator {
    static final int RANDOM_LENGTH = 9;
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final Clock clock;
    private final Supplier<Random> random;
    private final AtomicLong lastMillis = new AtomicLong(Long.MIN_VALUE);

    public FileIdGenerator() {
        this(Clock.systemUTC(), ThreadLocalRandom::current);
    }

    FileIdGenerator(Clock clock, Supplier<Random> random) {
        this.clock = clock;
        this.random = random;
    }

    public String nextId() {
        long now = clock.millis();
        long millis = lastMillis.accumulateAndGet(now, Math::max);

        Random rnd = random.get();
        StringBuilder id = new StringBuilder().append(millis).append('-');
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            id.append(ALPHABET.charAt(rnd.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }
}
