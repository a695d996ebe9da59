package io.accounting.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Multi-valued record attributes (site, user, group, ...). Keys keep insertion order and
 * every key keeps the order of its values.
 */
public final class Meta {
    private static final Meta EMPTY = new Meta(new LinkedHashMap<>());

    private final Map<String, List<String>> entries;

    private Meta(LinkedHashMap<String, List<String>> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static Meta empty() { return EMPTY; }

    public static Builder builder() { return new Builder(); }

    public static Meta of(Map<String, ? extends List<String>> values) {
        Builder b = builder();
        values.forEach(b::put);
        return b.build();
    }

    public List<String> get(String key) {
        return entries.getOrDefault(key, List.of());
    }

    public boolean containsKey(String key) { return entries.containsKey(key); }

    public boolean contains(String key, String value) { return get(key).contains(value); }

    public Set<String> keys() { return entries.keySet(); }

    public Map<String, List<String>> asMap() { return entries; }

    public boolean isEmpty() { return entries.isEmpty(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Meta)) return false;
        Meta other = (Meta) o;
        return List.copyOf(entries.entrySet()).equals(List.copyOf(other.entries.entrySet()));
    }

    @Override
    public int hashCode() { return Objects.hash(entries); }

    @Override
    public String toString() { return entries.toString(); }

    public static final class Builder {
        private final LinkedHashMap<String, List<String>> entries = new LinkedHashMap<>();

        public Builder put(String key, List<String> values) {
            Names.requireValid("meta key", key);
            for (String v : values) Names.requireValid("meta value for " + key, v);
            entries.put(key, List.copyOf(values));
            return this;
        }

        public Builder put(String key, String... values) {
            return put(key, List.of(values));
        }

        public Meta build() {
            return entries.isEmpty() ? EMPTY : new Meta(new LinkedHashMap<>(entries));
        }
    }
}
