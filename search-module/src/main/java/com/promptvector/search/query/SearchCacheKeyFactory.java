package com.promptvector.search.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.promptvector.common.model.SearchFilters;
import com.promptvector.common.model.SearchQuery;
import com.promptvector.search.exception.InternalVectorSearchException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds search cache keys: SHA-256 over a canonical JSON form of the query
 * (sorted keys, sorted filter sets) with the effective limit and threshold.
 * <p>
 * The first ten vector components are kept readable in the canonical form; a hash of
 * the full vector is added so queries that differ only past the prefix never collide.
 */
@Component
public class SearchCacheKeyFactory {

    static final int VECTOR_PREFIX = 10;

    private final ObjectMapper objectMapper = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();

    public String keyFor(SearchQuery query, int limit, double threshold) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("vectorPrefix", vectorPrefix(query.vector()));
        canonical.put("vectorHash", vectorHash(query.vector()));
        canonical.put("text", query.text());
        canonical.put("filters", canonicalFilters(query.filters()));
        canonical.put("limit", limit);
        canonical.put("threshold", threshold);
        try {
            String json = objectMapper.writeValueAsString(canonical);
            return Hashing.sha256().hashString(json, StandardCharsets.UTF_8).toString();
        } catch (JsonProcessingException e) {
            throw new InternalVectorSearchException("Failed to build search cache key", e);
        }
    }

    private static List<Float> vectorPrefix(float[] vector) {
        if (vector == null) {
            return null;
        }
        List<Float> prefix = new ArrayList<>(VECTOR_PREFIX);
        for (int i = 0; i < Math.min(VECTOR_PREFIX, vector.length); i++) {
            prefix.add(vector[i]);
        }
        return prefix;
    }

    private static String vectorHash(float[] vector) {
        if (vector == null) {
            return null;
        }
        Hasher hasher = Hashing.sha256().newHasher();
        hasher.putInt(vector.length);
        for (float value : vector) {
            hasher.putFloat(value);
        }
        return hasher.hash().toString();
    }

    private static Map<String, Object> canonicalFilters(SearchFilters filters) {
        if (filters == null) {
            return null;
        }
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("domains", sorted(filters.domains()));
        canonical.put("types", filters.types() == null ? null
            : sorted(filters.types().stream().map(Enum::name).toList()));
        canonical.put("tags", sorted(filters.tags()));
        canonical.put("effectivenessMin", filters.effectivenessMin());
        canonical.put("createdAfter", instant(filters.createdAfter()));
        canonical.put("createdBefore", instant(filters.createdBefore()));
        return canonical;
    }

    private static List<String> sorted(Collection<String> values) {
        return values == null ? null : values.stream().sorted().toList();
    }

    private static String instant(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
