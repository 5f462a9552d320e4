package com.metricscache.domain.keyspace;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Cache key encodings. Each scheme is its own namespace: data written under one
 * scheme is never read back through another, and the scheme is always chosen by
 * the caller rather than inferred from a key.
 *
 * Formats:
 * - VERBOSE:   {@code tenant:{tenant}:metric:{metric}:year:{year}:month:{month}:dimensions:[d1,d2]}
 * - SHORTENED: {@code {metric}_{tenant}_{year}_{month}} plus {@code _[d1,d2]} when dimensions are present
 * - HASHED:    {@code {metric}_{tenant}_{year}_{month}_{hash8}}, hash8 being the first 8 hex
 *              characters of the MD5 of the dimensions joined with ','
 *
 * Null components render as {@value #NULL_SENTINEL}.
 */
public enum KeyScheme {

    VERBOSE(":[],") {
        @Override
        String encode(DimensionalTuple tuple) {
            return "tenant:" + component(tuple.getTenantId())
                    + ":metric:" + component(tuple.getMetricId())
                    + ":year:" + component(tuple.getYear())
                    + ":month:" + component(tuple.getMonth())
                    + ":dimensions:" + dimensionList(tuple.getDimensions());
        }

        @Override
        DimensionalTuple decode(String key) {
            String[] parts = key.split(":", -1);
            if (parts.length != 10
                    || !"tenant".equals(parts[0])
                    || !"metric".equals(parts[2])
                    || !"year".equals(parts[4])
                    || !"month".equals(parts[6])
                    || !"dimensions".equals(parts[8])) {
                throw new IllegalArgumentException("Not a VERBOSE key: " + key);
            }
            return DimensionalTuple.builder()
                    .tenantId(token(parts[1]))
                    .metricId(token(parts[3]))
                    .year(yearToken(parts[5], key))
                    .month(token(parts[7]))
                    .dimensions(parseDimensionList(parts[9], key))
                    .build();
        }
    },

    SHORTENED("_[],") {
        @Override
        String encode(DimensionalTuple tuple) {
            String key = positional(tuple);
            return tuple.getDimensions().isEmpty() ? key : key + "_" + dimensionList(tuple.getDimensions());
        }

        @Override
        DimensionalTuple decode(String key) {
            String[] parts = key.split("_", -1);
            if (parts.length != 4 && parts.length != 5) {
                throw new IllegalArgumentException("Not a SHORTENED key: " + key);
            }
            return DimensionalTuple.builder()
                    .metricId(token(parts[0]))
                    .tenantId(token(parts[1]))
                    .year(yearToken(parts[2], key))
                    .month(token(parts[3]))
                    .dimensions(parts.length == 5 ? parseDimensionList(parts[4], key) : List.of())
                    .build();
        }
    },

    HASHED("_[],") {
        @Override
        String encode(DimensionalTuple tuple) {
            tuple.getDimensions().forEach(this::component);
            return positional(tuple) + "_" + dimensionHash(tuple.getDimensions());
        }

        @Override
        DimensionalTuple decode(String key) {
            throw new UnsupportedOperationException("HASHED keys do not carry dimension labels: " + key);
        }
    };

    public static final String NULL_SENTINEL = "null";

    static final int HASH_LENGTH = 8;

    private final String reserved;

    KeyScheme(String reserved) {
        this.reserved = reserved;
    }

    abstract String encode(DimensionalTuple tuple);

    abstract DimensionalTuple decode(String key);

    /**
     * Fixed-width hash of a dimension set, shared by population and lookup.
     */
    public static String dimensionHash(List<String> dimensions) {
        byte[] joined = String.join(",", dimensions).getBytes(StandardCharsets.UTF_8);
        return DigestUtils.md5DigestAsHex(joined).substring(0, HASH_LENGTH);
    }

    String positional(DimensionalTuple tuple) {
        return component(tuple.getMetricId())
                + "_" + component(tuple.getTenantId())
                + "_" + component(tuple.getYear())
                + "_" + component(tuple.getMonth());
    }

    String component(Object value) {
        if (value == null) {
            return NULL_SENTINEL;
        }
        String text = value.toString();
        for (int i = 0; i < text.length(); i++) {
            if (reserved.indexOf(text.charAt(i)) >= 0) {
                throw new IllegalArgumentException(
                        "Key component '" + text + "' contains a character reserved by " + name() + ": " + reserved);
            }
        }
        return text;
    }

    String dimensionList(List<String> dimensions) {
        StringBuilder list = new StringBuilder("[");
        for (int i = 0; i < dimensions.size(); i++) {
            if (i > 0) {
                list.append(',');
            }
            String label = dimensions.get(i);
            if (label.isEmpty()) {
                throw new IllegalArgumentException("Dimension labels must not be empty");
            }
            list.append(component(label));
        }
        return list.append(']').toString();
    }

    static String token(String text) {
        return NULL_SENTINEL.equals(text) ? null : text;
    }

    static Integer yearToken(String text, String key) {
        String year = token(text);
        if (year == null) {
            return null;
        }
        try {
            return Integer.valueOf(year);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid year '" + text + "' in key: " + key, e);
        }
    }

    static List<String> parseDimensionList(String text, String key) {
        if (text.length() < 2 || text.charAt(0) != '[' || text.charAt(text.length() - 1) != ']') {
            throw new IllegalArgumentException("Invalid dimension list '" + text + "' in key: " + key);
        }
        String body = text.substring(1, text.length() - 1);
        return body.isEmpty() ? List.of() : Arrays.asList(body.split(",", -1));
    }
}
