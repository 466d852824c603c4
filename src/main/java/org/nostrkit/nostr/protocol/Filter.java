package org.nostrkit.nostr.protocol;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable Nostr subscription filter as defined in NIP-01.
 *
 * <p>A filter matches an event if every criterion it specifies matches (AND).
 * Absent criteria impose no constraint. Tag criteria match when, for every
 * constrained tag name, at least one of the event's values for that name is
 * in the filter's value set.
 *
 * <p>{@code limit} and {@code search} are relay-side hints and never affect
 * client-side matching.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Filter {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Set<String> ids;
    private final Set<String> authors;
    private final Set<Integer> kinds;
    private final Long since;
    private final Long until;
    private final Integer limit;
    private final String search;
    private final Map<String, Set<String>> tags;

    private Filter(Builder builder) {
        this.ids = freeze(builder.ids);
        this.authors = freeze(builder.authors);
        this.kinds = freeze(builder.kinds);
        this.since = builder.since;
        this.until = builder.until;
        this.limit = builder.limit;
        this.search = builder.search;

        Map<String, Set<String>> tagCopy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : builder.tags.entrySet()) {
            tagCopy.put(entry.getKey(), freeze(entry.getValue()));
        }
        this.tags = Collections.unmodifiableMap(tagCopy);

        validate();
    }

    private static <T> Set<T> freeze(Set<T> values) {
        return values == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    private void validate() {
        requireNonEmptyStrings("ids", ids);
        requireNonEmptyStrings("authors", authors);
        if (kinds != null && kinds.contains(null)) {
            throw new IllegalArgumentException("kinds cannot contain null");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative: " + limit);
        }
        if (since != null && until != null && since > until) {
            throw new IllegalArgumentException("since (" + since + ") is after until (" + until + ")");
        }
        for (Map.Entry<String, Set<String>> entry : tags.entrySet()) {
            String name = entry.getKey();
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("Tag name cannot be blank");
            }
            if (name.startsWith("#")) {
                throw new IllegalArgumentException("Tag name must not include the '#' prefix: " + name);
            }
            if (entry.getValue().contains(null)) {
                throw new IllegalArgumentException("Tag values cannot be null for #" + name);
            }
        }
    }

    private static void requireNonEmptyStrings(String field, Set<String> values) {
        if (values == null) {
            return;
        }
        for (String value : values) {
            if (value == null || value.isEmpty()) {
                throw new IllegalArgumentException(field + " cannot contain empty values");
            }
        }
    }

    // Getters

    @JsonProperty("ids")
    public Set<String> getIds() { return ids; }

    @JsonProperty("authors")
    public Set<String> getAuthors() { return authors; }

    @JsonProperty("kinds")
    public Set<Integer> getKinds() { return kinds; }

    @JsonProperty("since")
    public Long getSince() { return since; }

    @JsonProperty("until")
    public Long getUntil() { return until; }

    @JsonProperty("limit")
    public Integer getLimit() { return limit; }

    @JsonProperty("search")
    public String getSearch() { return search; }

    /** Tag criteria keyed by tag name (without the '#' prefix). */
    @JsonIgnore
    public Map<String, Set<String>> getTags() { return tags; }

    @JsonAnyGetter
    public Map<String, Set<String>> getTagFilters() {
        Map<String, Set<String>> prefixed = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : tags.entrySet()) {
            prefixed.put("#" + entry.getKey(), entry.getValue());
        }
        return prefixed;
    }

    /**
     * Checks if an event matches this filter.
     *
     * @param event The event to check
     * @return true if every specified criterion matches
     */
    public boolean matches(Event event) {
        if (ids != null && !ids.contains(event.getId())) {
            return false;
        }
        if (authors != null && !authors.contains(event.getPubkey())) {
            return false;
        }
        if (kinds != null && !kinds.contains(event.getKind())) {
            return false;
        }
        if (since != null && event.getCreatedAt() < since) {
            return false;
        }
        if (until != null && event.getCreatedAt() > until) {
            return false;
        }
        for (Map.Entry<String, Set<String>> entry : tags.entrySet()) {
            Set<String> wanted = entry.getValue();
            boolean hasMatch = false;
            for (String value : event.getTagValues(entry.getKey())) {
                if (wanted.contains(value)) {
                    hasMatch = true;
                    break;
                }
            }
            if (!hasMatch) {
                return false;
            }
        }
        return true;
    }

    /**
     * Deterministic fingerprint of the selection criteria, used as the grouping key.
     * since, until, limit and search are excluded, so filters that differ only in
     * those collapse to the same fingerprint. An empty filter fingerprints to "".
     */
    public String fingerprint() {
        List<String> parts = new ArrayList<>();
        if (ids != null) {
            parts.add("i:" + joinEscaped(ids));
        }
        if (authors != null) {
            parts.add("a:" + joinEscaped(authors));
        }
        if (kinds != null) {
            StringBuilder kindPart = new StringBuilder("k:");
            boolean first = true;
            for (Integer kind : new TreeSet<>(kinds)) {
                if (!first) {
                    kindPart.append(',');
                }
                kindPart.append(kind);
                first = false;
            }
            parts.add(kindPart.toString());
        }
        for (Map.Entry<String, Set<String>> entry : new TreeMap<>(tags).entrySet()) {
            parts.add("#" + escape(entry.getKey()) + ":" + joinEscaped(entry.getValue()));
        }
        return String.join("|", parts);
    }

    private static String joinEscaped(Set<String> values) {
        List<String> escaped = new ArrayList<>();
        for (String value : new TreeSet<>(values)) {
            escaped.add(escape(value));
        }
        return String.join(",", escaped);
    }

    // Backslash-escapes the fingerprint delimiters so distinct values never collide
    private static String escape(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' || c == ',' || c == '|' || c == ':' || c == ';') {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }

    /**
     * Copy of this filter without since, until and limit.
     * Cache queries use this so temporal constraints don't hide cached results.
     */
    public Filter withoutTemporalConstraints() {
        return toBuilder().clearSince().clearUntil().clearLimit().build();
    }

    /**
     * Copy of this filter with the given temporal constraints; null clears a bound.
     */
    public Filter withTemporalConstraints(Long since, Long until, Integer limit) {
        Builder builder = toBuilder().clearSince().clearUntil().clearLimit();
        builder.since = since;
        builder.until = until;
        builder.limit = limit;
        return builder.build();
    }

    /**
     * Serialize to NIP-01 JSON. Tags are written with a '#' prefix.
     */
    public String toJson() {
        try {
            return JSON.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize filter", e);
        }
    }

    /**
     * Parse a NIP-01 JSON filter.
     *
     * @throws IllegalArgumentException if the JSON is malformed or violates filter constraints
     */
    public static Filter fromJson(String json) {
        try {
            return JSON.readValue(json, Filter.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid filter JSON: " + e.getOriginalMessage(), e);
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Filter fromMap(Map<String, Object> map) {
        Builder builder = builder();
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            switch (key) {
                case "ids":
                    builder.ids(stringList(key, value));
                    break;
                case "authors":
                    builder.authors(stringList(key, value));
                    break;
                case "kinds":
                    List<Integer> kinds = new ArrayList<>();
                    for (Object kind : list(key, value)) {
                        kinds.add(number(key, kind).intValue());
                    }
                    builder.kinds(kinds);
                    break;
                case "since":
                    builder.since(number(key, value).longValue());
                    break;
                case "until":
                    builder.until(number(key, value).longValue());
                    break;
                case "limit":
                    builder.limit(number(key, value).intValue());
                    break;
                case "search":
                    builder.search(value.toString());
                    break;
                default:
                    if (key.startsWith("#") && key.length() > 1) {
                        builder.tag(key.substring(1), stringList(key, value));
                    }
            }
        }
        return builder.build();
    }

    private static List<?> list(String key, Object value) {
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Filter field '" + key + "' must be an array");
        }
        return (List<?>) value;
    }

    private static List<String> stringList(String key, Object value) {
        List<String> strings = new ArrayList<>();
        for (Object element : list(key, value)) {
            if (!(element instanceof String)) {
                throw new IllegalArgumentException("Filter field '" + key + "' must contain strings");
            }
            strings.add((String) element);
        }
        return strings;
    }

    private static Number number(String key, Object value) {
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Filter field '" + key + "' must be a number");
        }
        return (Number) value;
    }

    /**
     * Create a builder for constructing filters.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-populated with this filter's criteria.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.ids = ids != null ? new LinkedHashSet<>(ids) : null;
        builder.authors = authors != null ? new LinkedHashSet<>(authors) : null;
        builder.kinds = kinds != null ? new LinkedHashSet<>(kinds) : null;
        builder.since = since;
        builder.until = until;
        builder.limit = limit;
        builder.search = search;
        for (Map.Entry<String, Set<String>> entry : tags.entrySet()) {
            builder.tags.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
        }
        return builder;
    }

    /**
     * Builder for Filter construction.
     */
    public static class Builder {
        private Set<String> ids;
        private Set<String> authors;
        private Set<Integer> kinds;
        private Long since;
        private Long until;
        private Integer limit;
        private String search;
        private final Map<String, Set<String>> tags = new LinkedHashMap<>();

        private Builder() {}

        public Builder ids(String... ids) {
            return ids(Arrays.asList(ids));
        }

        public Builder ids(Collection<String> ids) {
            this.ids = new LinkedHashSet<>(ids);
            return this;
        }

        public Builder authors(String... authors) {
            return authors(Arrays.asList(authors));
        }

        public Builder authors(Collection<String> authors) {
            this.authors = new LinkedHashSet<>(authors);
            return this;
        }

        public Builder kinds(int... kinds) {
            this.kinds = new LinkedHashSet<>();
            for (int kind : kinds) {
                this.kinds.add(kind);
            }
            return this;
        }

        public Builder kinds(Collection<Integer> kinds) {
            this.kinds = new LinkedHashSet<>(kinds);
            return this;
        }

        /**
         * Constrain a tag by name (without the '#' prefix).
         */
        public Builder tag(String name, String... values) {
            return tag(name, Arrays.asList(values));
        }

        public Builder tag(String name, Collection<String> values) {
            tags.put(name, new LinkedHashSet<>(values));
            return this;
        }

        public Builder eTags(String... eTags) {
            return tag("e", eTags);
        }

        public Builder pTags(String... pTags) {
            return tag("p", pTags);
        }

        public Builder tTags(String... tTags) {
            return tag("t", tTags);
        }

        public Builder dTags(String... dTags) {
            return tag("d", dTags);
        }

        public Builder since(long since) {
            this.since = since;
            return this;
        }

        public Builder until(long until) {
            this.until = until;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder search(String search) {
            this.search = search;
            return this;
        }

        Builder clearSince() {
            this.since = null;
            return this;
        }

        Builder clearUntil() {
            this.until = null;
            return this;
        }

        Builder clearLimit() {
            this.limit = null;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the criteria are malformed
         */
        public Filter build() {
            return new Filter(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Filter filter = (Filter) o;
        return Objects.equals(ids, filter.ids)
                && Objects.equals(authors, filter.authors)
                && Objects.equals(kinds, filter.kinds)
                && Objects.equals(since, filter.since)
                && Objects.equals(until, filter.until)
                && Objects.equals(limit, filter.limit)
                && Objects.equals(search, filter.search)
                && Objects.equals(tags, filter.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ids, authors, kinds, since, until, limit, search, tags);
    }

    @Override
    public String toString() {
        return "Filter{" +
                "ids=" + (ids != null ? ids.size() : 0) +
                ", authors=" + (authors != null ? authors.size() : 0) +
                ", kinds=" + kinds +
                ", tags=" + tags.keySet() +
                ", since=" + since +
                ", until=" + until +
                ", limit=" + limit +
                (search != null ? ", search='" + search + '\'' : "") +
                '}';
    }
}
