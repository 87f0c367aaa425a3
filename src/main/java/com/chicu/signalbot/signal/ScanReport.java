package com.chicu.signalbot.signal;

import java.time.Instant;
import java.util.List;

/**
 * Итог одного прохода сканера: сколько пар проверено и что упало.
 */
public record ScanReport(
        Instant startedAt,
        Instant finishedAt,
        int pairsScanned,
        int pairsFailed,
        int candidates,
        int emitted,
        List<String> failures
) {

    public ScanReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public String summary() {
        return pairsScanned + " pairs scanned, " + pairsFailed + " failed, "
                + candidates + " candidates, " + emitted + " signals";
    }
}
