package com.firesql.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.firesql.domain.TimeWindow;

/**
 * Dashboard time range in epoch milliseconds. 0 or absent means no bound.
 */
public class TimeRangeDto {
    @JsonProperty("from")
    private long from;

    @JsonProperty("to")
    private long to;

    public TimeRangeDto() {
    }

    public TimeRangeDto(long from, long to) {
        this.from = from;
        this.to = to;
    }

    public long getFrom() {
        return from;
    }

    public void setFrom(long from) {
        this.from = from;
    }

    public long getTo() {
        return to;
    }

    public void setTo(long to) {
        this.to = to;
    }

    public TimeWindow toWindow() {
        return TimeWindow.ofEpochMillis(from, to);
    }
}
