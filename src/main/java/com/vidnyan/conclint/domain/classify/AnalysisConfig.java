package com.vidnyan.conclint.domain.classify;

import com.vidnyan.conclint.domain.classify.CoroutineNames.BlockingCategory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable name registries and switches consumed by classification and rules.
 * Host entries extend the built-in registries, they never replace them.
 * Blocking calls keep registration order, built-in entries first.
 */
public final class AnalysisConfig {

    public static final String DEFAULT_DOC_BASE_URL =
            "https://github.com/santimattius/structured-coroutines/blob/main/docs/BEST_PRACTICES_COROUTINES.md";

    private static final AnalysisConfig DEFAULTS = builder().build();

    private final Set<String> frameworkScopes;
    private final Set<String> frameworkScopeFactories;
    private final Set<String> cooperationPoints;
    private final Map<String, BlockingCategory> blockingCalls;
    private final Set<String> allowedScopes;
    private final Set<String> disabledRules;
    private final String docBaseUrl;

    private AnalysisConfig(Builder builder) {
        this.frameworkScopes = Set.copyOf(builder.frameworkScopes);
        this.frameworkScopeFactories = Set.copyOf(builder.frameworkScopeFactories);
        this.cooperationPoints = Set.copyOf(builder.cooperationPoints);
        this.blockingCalls = Collections.unmodifiableMap(new LinkedHashMap<>(builder.blockingCalls));
        this.allowedScopes = Set.copyOf(builder.allowedScopes);
        this.disabledRules = Set.copyOf(builder.disabledRules);
        this.docBaseUrl = builder.docBaseUrl;
    }

    public static AnalysisConfig defaults() {
        return DEFAULTS;
    }

    public Set<String> frameworkScopes() {
        return frameworkScopes;
    }

    public Set<String> frameworkScopeFactories() {
        return frameworkScopeFactories;
    }

    public Set<String> cooperationPoints() {
        return cooperationPoints;
    }

    public Map<String, BlockingCategory> blockingCalls() {
        return blockingCalls;
    }

    public Set<String> allowedScopes() {
        return allowedScopes;
    }

    public String docBaseUrl() {
        return docBaseUrl;
    }

    /**
     * A rule is disabled when either its id code or its name is listed.
     */
    public boolean isRuleEnabled(String ruleId, String ruleName) {
        return !disabledRules.contains(ruleId) && (ruleName == null || !disabledRules.contains(ruleName));
    }

    public String documentationUrl(String anchor) {
        if (anchor == null || anchor.isBlank()) {
            return docBaseUrl;
        }
        return docBaseUrl + "#" + anchor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Set<String> frameworkScopes = new HashSet<>(CoroutineNames.DEFAULT_FRAMEWORK_SCOPES);
        private final Set<String> frameworkScopeFactories =
                new HashSet<>(CoroutineNames.DEFAULT_FRAMEWORK_SCOPE_FACTORIES);
        private final Set<String> cooperationPoints = new HashSet<>(CoroutineNames.DEFAULT_COOPERATION_POINTS);
        private final Map<String, BlockingCategory> blockingCalls = new LinkedHashMap<>(CoroutineNames.DEFAULT_BLOCKING_CALLS);
        private final Set<String> allowedScopes = new HashSet<>();
        private final Set<String> disabledRules = new HashSet<>();
        private String docBaseUrl = DEFAULT_DOC_BASE_URL;

        public Builder frameworkScopes(Collection<String> names) { addAll(frameworkScopes, names); return this; }
        public Builder frameworkScopeFactories(Collection<String> names) { addAll(frameworkScopeFactories, names); return this; }
        public Builder cooperationPoints(Collection<String> names) { addAll(cooperationPoints, names); return this; }
        public Builder allowedScopes(Collection<String> names) { addAll(allowedScopes, names); return this; }
        public Builder disabledRules(Collection<String> ids) { addAll(disabledRules, ids); return this; }

        public Builder blockingCalls(Collection<String> names) {
            if (names != null) {
                names.stream()
                        .filter(n -> n != null && !n.isBlank())
                        .forEach(n -> blockingCalls.putIfAbsent(n.trim(), BlockingCategory.CUSTOM));
            }
            return this;
        }

        public Builder docBaseUrl(String url) {
            if (url != null && !url.isBlank()) {
                this.docBaseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
            }
            return this;
        }

        /**
         * @throws IllegalArgumentException if a host entry collides with another registry,
         *         which would make scope classification ambiguous
         */
        public AnalysisConfig build() {
            Set<String> reserved = Set.of(CoroutineNames.GLOBAL_SCOPE, CoroutineNames.SCOPE_CONSTRUCTOR);
            for (String name : frameworkScopes) {
                if (reserved.contains(name) || frameworkScopeFactories.contains(name)) {
                    throw new IllegalArgumentException("Framework scope name '" + name + "' is ambiguous");
                }
            }
            for (String name : frameworkScopeFactories) {
                if (reserved.contains(name)) {
                    throw new IllegalArgumentException("Framework scope factory '" + name + "' is ambiguous");
                }
            }
            return new AnalysisConfig(this);
        }

        private static void addAll(Set<String> target, Collection<String> names) {
            if (names == null) {
                return;
            }
            names.stream()
                    .filter(n -> n != null && !n.isBlank())
                    .map(String::trim)
                    .forEach(target::add);
        }
    }
}
