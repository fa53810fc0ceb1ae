package com.riskradar.orchestration;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Batch request ids: {@code req_<yyyyMMdd_HHmmss>_<eventCount>_<sequence>}, UTC, sequence per instance.
 */
@Component
public class RequestIdGenerator {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public RequestIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next(int eventCount) {
        return "req_" + FORMAT.format(clock.instant()) + "_" + eventCount + "_" + sequence.incrementAndGet();
    }
}
