package com.mediavault.service.retag;

import com.mediavault.model.RetagMode;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Which assets to retag, to which date, and how the date is spread over them.
 */
public class RetagRequest {
    private final List<Long> assetIds;
    private final LocalDateTime newDate;
    private final RetagMode mode;
    private final Duration interval;

    public RetagRequest(List<Long> assetIds, LocalDateTime newDate, RetagMode mode, Duration interval) {
        this.assetIds = new ArrayList<>(Objects.requireNonNull(assetIds, "assetIds"));
        this.newDate = Objects.requireNonNull(newDate, "newDate");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.interval = interval;
        if (mode == RetagMode.SEQUENCE && (interval == null || interval.isNegative())) {
            throw new IllegalArgumentException("Sequence mode needs a non-negative interval");
        }
    }

    public RetagRequest(List<Long> assetIds, LocalDateTime newDate, RetagMode mode) {
        this(assetIds, newDate, mode, mode == RetagMode.SEQUENCE ? Duration.ofMinutes(5) : null);
    }

    public List<Long> getAssetIds() { return assetIds; }
    public LocalDateTime getNewDate() { return newDate; }
    public RetagMode getMode() { return mode; }
    public Duration getInterval() { return interval; }
}
