package com.chicu.signalbot.signal;

import java.util.List;

public record ScanResult(List<Signal> signals, ScanReport report) {

    public ScanResult {
        signals = signals == null ? List.of() : List.copyOf(signals);
    }
}
