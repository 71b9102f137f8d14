package com.purchasingpower.forksync.model;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * A named line predicate recognising gating-related code (premium checks, license objects,
 * feature toggles). The scanner evaluates rules in list order.
 *
 * @param name      identifier reported in findings
 * @param predicate true when a single line of upstream content matches
 */
public record DriftRule(String name, Predicate<String> predicate) {

    public DriftRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(predicate, "predicate");
    }

    public static DriftRule regex(String name, String regex) {
        Pattern pattern = Pattern.compile(regex);
        return new DriftRule(name, line -> pattern.matcher(line).find());
    }

    public boolean matches(String line) {
        return predicate.test(line);
    }
}
