package com.koni.mobility.application.reconcile;

import com.koni.mobility.domain.model.TypeUnit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link CategoryMapping} backed by an ordered rule list; the first matching rule wins.
 * Labels are compared trimmed and case-insensitively.
 *
 * <pre>
 * PriorityCategoryMapping.builder()
 *         .labels(new TypeUnit("PM10", "µg/m³"), "P1")
 *         .keepingLabel("Vacant Spaces", "Parkobjekt", "ParkingArea")
 *         .build();
 * </pre>
 */
public final class PriorityCategoryMapping implements CategoryMapping {

    private final List<Rule> rules;

    private PriorityCategoryMapping(List<Rule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<TypeUnit> resolve(String categoryLabel) {
        if (categoryLabel == null || categoryLabel.isBlank()) {
            return Optional.empty();
        }
        String label = categoryLabel.trim();
        for (Rule rule : rules) {
            if (rule.matches.test(label)) {
                return Optional.of(rule.target.apply(label));
            }
        }
        return Optional.empty();
    }

    public int size() {
        return rules.size();
    }

    private static final class Rule {
        private final Predicate<String> matches;
        private final Function<String, TypeUnit> target;

        private Rule(Predicate<String> matches, Function<String, TypeUnit> target) {
            this.matches = matches;
            this.target = target;
        }
    }

    public static final class Builder {

        private final List<Rule> rules = new ArrayList<>();

        private Builder() {
        }

        /**
         * Maps any of the labels to a fixed (type, unit).
         */
        public Builder labels(TypeUnit target, String... labels) {
            Set<String> normalized = normalize(labels);
            rules.add(new Rule(label -> normalized.contains(label.toLowerCase(Locale.ROOT)), label -> target));
            return this;
        }

        /**
         * Maps any of the labels to a type equal to the label itself, with a fixed unit.
         */
        public Builder keepingLabel(String unit, String... labels) {
            Set<String> normalized = normalize(labels);
            rules.add(new Rule(label -> normalized.contains(label.toLowerCase(Locale.ROOT)),
                    label -> new TypeUnit(label, unit)));
            return this;
        }

        public Builder pattern(Pattern pattern, TypeUnit target) {
            rules.add(new Rule(label -> pattern.matcher(label).matches(), label -> target));
            return this;
        }

        public PriorityCategoryMapping build() {
            return new PriorityCategoryMapping(rules);
        }

        private static Set<String> normalize(String... labels) {
            return Stream.of(labels)
                    .map(label -> label.trim().toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
        }
    }
}
