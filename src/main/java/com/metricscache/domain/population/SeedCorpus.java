package com.metricscache.domain.population;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Dimension-label pools the synthetic record factory draws from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeedCorpus {

    private List<String> organizations;
    private List<String> campaigns;
    private List<String> campaignGroups;
    private List<String> platforms;
    private List<String> channels;

    public static SeedCorpus defaults() {
        return SeedCorpus.builder()
                .organizations(numbered("Campbell & Company ", 50))
                .campaigns(List.of(
                        "xcat:service_area_business_electrician",
                        "xcat:service_area_business_plumber",
                        "xcat:service_area_business_hvac",
                        "Brand Search",
                        "Spring Promotion"))
                .campaignGroups(List.of("brand", "non-brand", "remarketing", "other"))
                .platforms(List.of("Paid Google Local Services", "Google Ads", "Bing Ads", "Facebook Ads"))
                .channels(List.of("Paid Search", "Paid Social", "Paid Google Local Services", "Display"))
                .build();
    }

    private static List<String> numbered(String prefix, int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> prefix + i)
                .collect(Collectors.toList());
    }
}
