package com.dealflow.dedup.rules;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A case-insensitive regex rewrite applied to a field value.
 *
 * @param name       unique rule name, used in logs
 * @param pattern    compiled pattern
 * @param replacement replacement text, may reference groups
 * @param scope      field kinds the rule applies to; empty means every kind
 * @param priority   lower runs first
 * @param repeatable re-run with the other repeatable rules until the value stops changing
 * @param trimAfter  trim the result of each application
 */
public record NormalizationRule(
        String name,
        Pattern pattern,
        String replacement,
        Set<FieldKind> scope,
        int priority,
        boolean repeatable,
        boolean trimAfter
) {
    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        scope = scope != null ? Set.copyOf(scope) : Set.of();
    }

    public boolean appliesTo(FieldKind kind) {
        return scope.isEmpty() || scope.contains(kind);
    }

    /**
     * Rewrites the value. Null stays null.
     */
    public String apply(String value) {
        if (value == null) {
            return null;
        }
        String rewritten = pattern.matcher(value).replaceAll(replacement);
        return trimAfter ? rewritten.trim() : rewritten;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String regex;
        private String replacement;
        private final Set<FieldKind> scope = EnumSet.noneOf(FieldKind.class);
        private int priority = 100;
        private boolean repeatable;
        private boolean trimAfter;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String regex) {
            this.regex = regex;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        /**
         * Restricts the rule to the given kinds. Without this call it applies everywhere.
         */
        public Builder applicableKinds(FieldKind first, FieldKind... rest) {
            scope.add(first);
            scope.addAll(Set.of(rest));
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder repeatable(boolean repeatable) {
            this.repeatable = repeatable;
            return this;
        }

        public Builder trimAfter(boolean trimAfter) {
            this.trimAfter = trimAfter;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(regex, "pattern is required");
            return new NormalizationRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement,
                    scope, priority, repeatable, trimAfter);
        }
    }
}
