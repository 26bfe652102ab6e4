package com.processflow.core.lifecycle;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates default business keys of the form {@code <prefix><epochMillis>_<6 hex chars>}.
 */
public class BusinessKeyGenerator {

    public static final String DEFAULT_PREFIX = "PROC_";

    private final String prefix;
    private final Clock clock;

    public BusinessKeyGenerator(String prefix, Clock clock) {
        this.prefix = prefix == null ? DEFAULT_PREFIX : prefix;
        this.clock = clock;
    }

    public String generate() {
        int suffix = ThreadLocalRandom.current().nextInt(0x1000000);
        return String.format("%s%d_%06x", prefix, clock.millis(), suffix);
    }
}
