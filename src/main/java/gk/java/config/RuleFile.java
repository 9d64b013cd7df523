package gk.java.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Top-level shape of a rules file: {@code {"rules": [ ... ]}}.
 */
public record RuleFile(@JsonProperty("rules") List<RuleDefinition> rules) {

    public RuleFile {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }
}
