package com.tradegate.access.mode;

import java.util.Locale;
import java.util.Optional;

public enum TradingMode {
    PAPER, LIVE;

    /** URL segment for this mode, e.g. {@code /live/...}. */
    public String segment() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TradingMode> fromSegment(String segment) {
        for (TradingMode mode : values()) {
            if (mode.segment().equals(segment)) return Optional.of(mode);
        }
        return Optional.empty();
    }
}
