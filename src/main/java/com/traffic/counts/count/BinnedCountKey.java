package com.traffic.counts.count;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Objects;

/**
 * Bin start and channel of one binned histogram row.
 */
public final class BinnedCountKey implements Comparable<BinnedCountKey> {

    private static final Comparator<BinnedCountKey> ORDER = Comparator
            .comparing((BinnedCountKey k) -> k.dateTime)
            .thenComparingInt(k -> k.channel);

    public final LocalDateTime dateTime;
    public final int channel;

    public BinnedCountKey(LocalDateTime dateTime, int channel) {
        this.dateTime = Objects.requireNonNull(dateTime, "dateTime");
        this.channel = channel;
    }

    @Override
    public int compareTo(BinnedCountKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BinnedCountKey)) {
            return false;
        }
        BinnedCountKey other = (BinnedCountKey) o;
        return channel == other.channel && dateTime.equals(other.dateTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dateTime, channel);
    }

    @Override
    public String toString() {
        return dateTime + "#" + channel;
    }
}
