package com.psyos.pipeline.domain;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fully resolved detector configuration: every signal has keywords and a directive.
 */
@Value
public class SignalConfig {

    Map<SignalKey, Rule> rules;

    public SignalConfig(Map<SignalKey, Rule> rules) {
        EnumMap<SignalKey, Rule> copy = new EnumMap<>(SignalKey.class);
        copy.putAll(rules);
        for (SignalKey key : SignalKey.values()) {
            if (!copy.containsKey(key)) {
                throw new IllegalArgumentException("Missing signal rule for " + key.jsonName());
            }
        }
        this.rules = Collections.unmodifiableMap(copy);
    }

    public Rule rule(SignalKey key) {
        return rules.get(key);
    }

    public List<String> keywords(SignalKey key) {
        return rules.get(key).getKeywords();
    }

    public String directive(SignalKey key) {
        return rules.get(key).getDirective();
    }

    @Value
    public static class Rule {
        List<String> keywords;
        String directive;

        public Rule(List<String> keywords, String directive) {
            this.keywords = List.copyOf(keywords);
            this.directive = directive;
        }
    }
}
