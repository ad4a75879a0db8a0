package com.raditha.cppnorm.config;

import java.time.Duration;

/**
 * Configuration for token simplification.
 *
 * @param language        source language of the token stream
 * @param standard        language standard; must belong to {@code language}
 * @param aliasTimeBudget wall clock budget for typedef and using inlining; zero means unlimited
 * @param debugWarnings   report DEBUG diagnostics for constructs the heuristics skipped
 */
public record SimplifierConfig(
        Language language,
        Standard standard,
        Duration aliasTimeBudget,
        boolean debugWarnings) {

    /**
     * Validate configuration.
     */
    public SimplifierConfig {
        if (language == null) {
            throw new IllegalArgumentException("language cannot be null");
        }
        if (standard == null) {
            standard = Standard.latest(language);
        }
        if (standard.language() != language) {
            throw new IllegalArgumentException(
                    "standard " + standard.toCliString() + " does not match language " + language.toCliString());
        }
        if (aliasTimeBudget == null) {
            aliasTimeBudget = Duration.ZERO;
        }
        if (aliasTimeBudget.isNegative()) {
            throw new IllegalArgumentException("aliasTimeBudget must be >= 0");
        }
    }

    /**
     * C++ preset: latest standard, no time budget, debug warnings off.
     */
    public static SimplifierConfig cpp() {
        return new SimplifierConfig(Language.CPP, Standard.CPP20, Duration.ZERO, false);
    }

    /**
     * C preset: latest standard, no time budget, debug warnings off.
     */
    public static SimplifierConfig c() {
        return new SimplifierConfig(Language.C, Standard.C17, Duration.ZERO, false);
    }

    public boolean isCpp() {
        return language == Language.CPP;
    }

    public boolean hasTimeBudget() {
        return !aliasTimeBudget.isZero();
    }

    public SimplifierConfig withDebugWarnings(boolean enabled) {
        return new SimplifierConfig(language, standard, aliasTimeBudget, enabled);
    }

    public SimplifierConfig withStandard(Standard newStandard) {
        return new SimplifierConfig(newStandard.language(), newStandard, aliasTimeBudget, debugWarnings);
    }
}
