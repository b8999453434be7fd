package io.filestore.registry.id;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class FileIdGeneratorTest {

    @Test
    void nextId_shouldMatchTimestampDashBase36Format() {
        String id = new FileIdGenerator().nextId();

        assertThat(id).matches("\\d+-[0-9a-z]{9}");
    }

    @Test
    void nextId_shouldNotRepeatWithinProcess() {
        FileIdGenerator generator = new FileIdGenerator();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < 10_000; i++) {
            ids.add(generator.nextId());
        }

        assertThat(ids).hasSize(10_000);
    }

    @Test
    void nextId_whenClockGoesBackwards_shouldKeepTimestampNonDecreasing() {
        AtomicLong now = new AtomicLong(2_000);
        Clock clock = new Clock() {
            @Override
            public ZoneOffset getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(java.time.ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return Instant.ofEpochMilli(now.get());
            }
        };
        Random random = new Random(7);
        FileIdGenerator generator = new FileIdGenerator(clock, () -> random);

        String first = generator.nextId();
        now.set(1_000);
        String second = generator.nextId();

        assertThat(first).startsWith("2000-");
        assertThat(second).startsWith("2000-");
        assertThat(second).isNotEqualTo(first);
    }
}
