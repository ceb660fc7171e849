package br.com.analytics.pipeline.order_analytics_batch.pipeline;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Set;

public class RegionClassifier {

    public static final String OTHER = "Other";

    public static final List<RegionRule> DEFAULT_RULES = List.of(
            new RegionRule(Set.of("SP", "RJ", "MG", "ES"), "Southeast"),
            new RegionRule(Set.of("PR", "SC", "RS"), "South"),
            new RegionRule(Set.of("BA", "SE", "AL", "PE", "PB", "RN", "CE", "PI", "MA"), "Northeast"),
            new RegionRule(Set.of("MT", "MS", "GO", "DF"), "Midwest"),
            new RegionRule(Set.of("AM", "RR", "AP", "PA", "TO", "RO", "AC"), "North")
    );

    private final List<RegionRule> rules;
    private final String fallbackLabel;

    public RegionClassifier() {
        this(DEFAULT_RULES, OTHER);
    }

    public RegionClassifier(List<RegionRule> rules, String fallbackLabel) {
        this.rules = List.copyOf(rules);
        this.fallbackLabel = fallbackLabel;
    }

    public String classify(@Nullable String stateCode) {
        if (stateCode == null) {
            return fallbackLabel;
        }
        for (RegionRule rule : rules) {
            if (rule.stateCodes().contains(stateCode)) {
                return rule.label();
            }
        }
        return fallbackLabel;
    }

    public record RegionRule(Set<String> stateCodes, String label) {

        public RegionRule {
            stateCodes = Set.copyOf(stateCodes);
        }
    }
}
