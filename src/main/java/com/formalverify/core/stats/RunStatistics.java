package com.formalverify.core.stats;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class RunStatistics {   // in-memory only, reset on restart

    private final AtomicLong started  = new AtomicLong();
    private final AtomicLong valid    = new AtomicLong();
    private final AtomicLong invalid  = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public void recordStarted()  { started.incrementAndGet(); }
    public void recordValid()    { valid.incrementAndGet(); }
    public void recordInvalid()  { invalid.incrementAndGet(); }
    public void recordRejected() { rejected.incrementAndGet(); }

    public Map<String, Long> snapshot() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("total",    started.get());
        counts.put("valid",    valid.get());
        counts.put("invalid",  invalid.get());
        counts.put("rejected", rejected.get());
        return counts;
    }
}
