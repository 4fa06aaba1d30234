package de.conciso.circulargraph.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping Identifier → DocumentRecord. Build it once per session
 * via {@link #builder()} and pass it into every extraction call.
 */
public final class KnownIndex {

    private static final KnownIndex EMPTY = new KnownIndex(Map.of());

    private final Map<Identifier, DocumentRecord> records;

    private KnownIndex(Map<Identifier, DocumentRecord> records) {
        this.records = records;
    }

    public static KnownIndex empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<DocumentRecord> resolve(Identifier identifier) {
        return Optional.ofNullable(records.get(identifier));
    }

    public boolean contains(Identifier identifier) {
        return records.containsKey(identifier);
    }

    public Collection<DocumentRecord> records() {
        return records.values();
    }

    public int size() {
        return records.size();
    }

    public static final class Builder {

        private final Map<Identifier, DocumentRecord> records = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Last write wins. Returns the record that was replaced, if any.
         */
        public Optional<DocumentRecord> put(DocumentRecord record) {
            return Optional.ofNullable(records.put(record.identifier(), record));
        }

        public KnownIndex build() {
            return new KnownIndex(Collections.unmodifiableMap(new LinkedHashMap<>(records)));
        }
    }
}
