package com.metricscache.domain.population;

import java.util.List;
import java.util.SplittableRandom;

/**
 * Keys for synthetic-volume population, which is not tied to a real key space:
 * {@code tenant:{1..tenants}:month:{month}:year:{year}:metrics:[{metric}]:dimensions:[{dimension}]:id:{index}}.
 *
 * The random parts are derived from the seed and the target index, so the same
 * index always yields the same key and a resumed run rewrites nothing twice.
 * The {@code id} suffix keeps every key unique.
 */
public class SyntheticKeyFactory {

    private static final List<String> MONTHS = List.of(
            "january", "february", "march", "april", "may", "june",
            "july", "august", "september", "october", "november", "december");

    private final List<String> metrics;
    private final List<String> dimensions;
    private final int tenants;
    private final int year;
    private final long seed;

    public SyntheticKeyFactory(List<String> metrics, List<String> dimensions, int tenants, int year, long seed) {
        if (metrics.isEmpty() || dimensions.isEmpty() || tenants < 1) {
            throw new IllegalArgumentException("Synthetic keys need at least one metric, dimension and tenant");
        }
        this.metrics = List.copyOf(metrics);
        this.dimensions = List.copyOf(dimensions);
        this.tenants = tenants;
        this.year = year;
        this.seed = seed;
    }

    public static SyntheticKeyFactory defaults(long seed) {
        return new SyntheticKeyFactory(
                List.of("metric1", "metric2", "metric3"),
                List.of("organization", "campaign", "platform", "channel"),
                100, 2024, seed);
    }

    public String keyFor(long index) {
        SplittableRandom random = new SplittableRandom(seed + index);
        return "tenant:" + (random.nextInt(tenants) + 1)
                + ":month:" + MONTHS.get(random.nextInt(MONTHS.size()))
                + ":year:" + year
                + ":metrics:[" + metrics.get(random.nextInt(metrics.size())) + "]"
                + ":dimensions:[" + dimensions.get(random.nextInt(dimensions.size())) + "]"
                + ":id:" + index;
    }
}
