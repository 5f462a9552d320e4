package com.metricscache.domain.population;

import com.metricscache.domain.keyspace.DimensionalTuple;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Random campaign-day rows drawn from a {@link SeedCorpus}.
 *
 * Tenant, year and month come from the target's tuple when it has one.
 * Metrics are {@code metricValue1..N}, stored as two-decimal strings.
 * Output is deterministic for a given seed and target index.
 */
public class SyntheticRecordFactory implements RecordFactory {

    private static final int[] YEARS = {2023, 2024};

    private final SeedCorpus corpus;
    private final int recordsPerKey;
    private final int metricValueCount;
    private final long seed;

    public SyntheticRecordFactory(SeedCorpus corpus, int recordsPerKey, int metricValueCount, long seed) {
        if (recordsPerKey < 1) {
            throw new IllegalArgumentException("recordsPerKey must be positive");
        }
        this.corpus = corpus;
        this.recordsPerKey = recordsPerKey;
        this.metricValueCount = metricValueCount;
        this.seed = seed;
    }

    @Override
    public List<Map<String, Object>> create(PopulationTarget target) {
        SplittableRandom random = new SplittableRandom(seed ^ target.getIndex());
        DimensionalTuple tuple = target.getTuple();

        List<Map<String, Object>> records = new ArrayList<>(recordsPerKey);
        for (int i = 0; i < recordsPerKey; i++) {
            String tenantId = tuple != null && tuple.getTenantId() != null
                    ? tuple.getTenantId()
                    : "tenant_" + (random.nextInt(100) + 1);
            int year = tuple != null && tuple.getYear() != null ? tuple.getYear() : YEARS[random.nextInt(YEARS.length)];
            String month = tuple != null && tuple.getMonth() != null
                    ? tuple.getMonth()
                    : String.format(Locale.ROOT, "%02d", random.nextInt(12) + 1);

            Map<String, Object> record = new LinkedHashMap<>();
            record.put("tenantId", tenantId);
            record.put("organization", pick(corpus.getOrganizations(), random));
            record.put("channel", pick(corpus.getChannels(), random));
            record.put("platform", pick(corpus.getPlatforms(), random));
            record.put("campaignGroup", pick(corpus.getCampaignGroups(), random));
            record.put("campaign", pick(corpus.getCampaigns(), random));
            record.put("year", year);
            record.put("quarter", quarterOf(month));
            record.put("month", month + " " + year);
            record.put("week", "Week " + (random.nextInt(52) + 1));
            record.put("day", "Day " + (random.nextInt(31) + 1));
            for (int m = 1; m <= metricValueCount; m++) {
                double value = 10 + random.nextDouble() * 790;
                record.put("metricValue" + m, String.format(Locale.ROOT, "%.2f", value));
            }
            records.add(record);
        }
        return records;
    }

    /**
     * Quarter label for a month number ("01".."12"); null when the month is not numeric.
     */
    static String quarterOf(String month) {
        int monthNumber;
        try {
            monthNumber = Integer.parseInt(month);
        } catch (NumberFormatException e) {
            return null;
        }
        if (monthNumber < 1 || monthNumber > 12) {
            return null;
        }
        return "Q" + ((monthNumber - 1) / 3 + 1);
    }

    private static String pick(List<String> pool, SplittableRandom random) {
        if (pool == null || pool.isEmpty()) {
            return null;
        }
        return pool.get(random.nextInt(pool.size()));
    }
}
