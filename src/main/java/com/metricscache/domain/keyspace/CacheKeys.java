package com.metricscache.domain.keyspace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds, parses and expands cache keys.
 *
 * Empty-axis policy: a null or empty axis expands as a single-element axis holding
 * the null sentinel (for dimension sets: one empty set). An empty axis therefore
 * still yields keys, which read back as "no data", rather than an empty product.
 * Expansion performs no deduplication; callers bound the axis cardinalities.
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String buildKey(DimensionalTuple tuple, KeyScheme scheme) {
        return scheme.encode(tuple);
    }

    /**
     * Inverse of {@link #buildKey} for VERBOSE and SHORTENED keys.
     *
     * @throws UnsupportedOperationException for HASHED keys
     * @throws IllegalArgumentException if the key does not match the scheme's format
     */
    public static DimensionalTuple parseKey(String key, KeyScheme scheme) {
        return scheme.decode(key);
    }

    /**
     * Cartesian product in axis order metric, tenant, year, month, dimension set.
     */
    public static List<DimensionalTuple> expandTuples(List<String> metricIds,
                                                      List<String> tenantIds,
                                                      List<Integer> years,
                                                      List<String> months,
                                                      List<List<String>> dimensionSets) {
        List<String> metricAxis = axis(metricIds);
        List<String> tenantAxis = axis(tenantIds);
        List<Integer> yearAxis = axis(years);
        List<String> monthAxis = axis(months);
        List<List<String>> dimensionAxis = dimensionSets == null || dimensionSets.isEmpty()
                ? List.of(List.of())
                : dimensionSets;

        List<DimensionalTuple> tuples = new ArrayList<>(metricAxis.size() * tenantAxis.size()
                * yearAxis.size() * monthAxis.size() * dimensionAxis.size());
        for (String metricId : metricAxis) {
            for (String tenantId : tenantAxis) {
                for (Integer year : yearAxis) {
                    for (String month : monthAxis) {
                        for (List<String> dimensions : dimensionAxis) {
                            tuples.add(new DimensionalTuple(metricId, tenantId, year, month, dimensions));
                        }
                    }
                }
            }
        }
        return tuples;
    }

    public static List<String> expandKeys(List<String> metricIds,
                                          List<String> tenantIds,
                                          List<Integer> years,
                                          List<String> months,
                                          List<List<String>> dimensionSets,
                                          KeyScheme scheme) {
        List<DimensionalTuple> tuples = expandTuples(metricIds, tenantIds, years, months, dimensionSets);
        List<String> keys = new ArrayList<>(tuples.size());
        for (DimensionalTuple tuple : tuples) {
            keys.add(buildKey(tuple, scheme));
        }
        return keys;
    }

    /**
     * SCAN match pattern for every key of a metric/tenant under a scheme.
     * Null arguments match anything.
     */
    public static String scanPattern(KeyScheme scheme, String metricId, String tenantId) {
        String metric = metricId == null ? "*" : scheme.component(metricId);
        String tenant = tenantId == null ? "*" : scheme.component(tenantId);
        if (scheme == KeyScheme.VERBOSE) {
            return "tenant:" + tenant + ":metric:" + metric + ":*";
        }
        return metric + "_" + tenant + "_*";
    }

    private static <T> List<T> axis(List<T> values) {
        return values == null || values.isEmpty() ? Collections.singletonList(null) : values;
    }
}
