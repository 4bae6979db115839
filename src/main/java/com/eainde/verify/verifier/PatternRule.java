package com.eainde.verify.verifier;

import java.util.regex.Pattern;

/**
 * One static rule of a {@link PatternRuleVerifier}.
 *
 * @param appliesTo matched against the claim statement; {@code null} applies to every claim
 * @param requires  must be found in the artifact content for the rule to hold
 */
record PatternRule(String id, Pattern appliesTo, Pattern requires, String guidance) {

    boolean appliesTo(String statement) {
        return appliesTo == null || appliesTo.matcher(statement).find();
    }

    boolean isSatisfiedBy(String content) {
        return requires.matcher(content).find();
    }
}
