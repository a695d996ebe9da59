package io.accounting.core;

import io.accounting.error.ValidationException;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One unit of accountable resource usage.
 *
 * <p>A record without a stop time is open. The runtime is derived from the start and stop times
 * and cannot be set directly. Timestamps are kept at microsecond precision, the precision of the
 * store.
 */
public final class Record {
    private final String recordId;
    private final Instant startTime;
    private final Instant stopTime;
    private final Meta meta;
    private final List<Component> components;
    private final Instant updatedAt;

    private Record(Builder b) {
        this.recordId = Names.requireValid("record_id", b.recordId);
        if (b.startTime == null) {
            throw new ValidationException("record " + recordId + " has no start_time");
        }
        this.startTime = truncate(b.startTime);
        this.stopTime = truncate(b.stopTime);
        if (stopTime != null && stopTime.isBefore(startTime)) {
            throw new ValidationException("record " + recordId + " stops at " + stopTime + " before it starts at " + startTime);
        }
        this.meta = b.meta == null ? Meta.empty() : b.meta;
        this.components = List.copyOf(b.components);
        this.updatedAt = truncate(b.updatedAt);
    }

    public static Builder builder(String recordId, Instant startTime) {
        return new Builder().recordId(recordId).startTime(startTime);
    }

    public String recordId() { return recordId; }
    public Instant startTime() { return startTime; }
    public Optional<Instant> stopTime() { return Optional.ofNullable(stopTime); }
    public Meta meta() { return meta; }
    public List<Component> components() { return components; }
    public Optional<Instant> updatedAt() { return Optional.ofNullable(updatedAt); }

    public boolean isOpen() { return stopTime == null; }

    /** Whole seconds between start and stop, empty while the record is open. */
    public Optional<Long> runtime() {
        if (stopTime == null) return Optional.empty();
        return Optional.of(runtimeSeconds(startTime, stopTime));
    }

    public boolean hasComponent(String name) {
        for (Component c : components) {
            if (c.name().equals(name)) return true;
        }
        return false;
    }

    public Record withStopTime(Instant stop) { return toBuilder().stopTime(stop).build(); }

    public Record withUpdatedAt(Instant at) { return toBuilder().updatedAt(at).build(); }

    public Builder toBuilder() {
        Builder b = new Builder()
                .recordId(recordId)
                .startTime(startTime)
                .stopTime(stopTime)
                .meta(meta)
                .updatedAt(updatedAt);
        b.components.addAll(components);
        return b;
    }

    public static long runtimeSeconds(Instant start, Instant stop) {
        return Duration.between(start, stop).getSeconds();
    }

    static Instant truncate(Instant t) {
        return t == null ? null : t.truncatedTo(ChronoUnit.MICROS);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record)) return false;
        Record r = (Record) o;
        return recordId.equals(r.recordId)
                && startTime.equals(r.startTime)
                && Objects.equals(stopTime, r.stopTime)
                && meta.equals(r.meta)
                && components.equals(r.components)
                && Objects.equals(updatedAt, r.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordId, startTime, stopTime, meta, components, updatedAt);
    }

    @Override
    public String toString() {
        return "Record{" + recordId + ", start=" + startTime + ", stop=" + stopTime + ", meta=" + meta + ", components=" + components + "}";
    }

    public static final class Builder {
        private String recordId;
        private Instant startTime;
        private Instant stopTime;
        private Meta meta;
        private final List<Component> components = new ArrayList<>();
        private Instant updatedAt;

        public Builder recordId(String recordId) { this.recordId = recordId; return this; }
        public Builder startTime(Instant startTime) { this.startTime = startTime; return this; }
        public Builder stopTime(Instant stopTime) { this.stopTime = stopTime; return this; }
        public Builder meta(Meta meta) { this.meta = meta; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }

        public Builder component(Component c) {
            components.add(Objects.requireNonNull(c));
            return this;
        }

        public Builder components(List<Component> cs) {
            components.clear();
            cs.forEach(this::component);
            return this;
        }

        public Record build() { return new Record(this); }
    }
}
