package gk.java.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import gk.core.model.RateLimitRule;
import gk.java.engine.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads rule definitions from JSON and registers them with a {@link RateLimiter}.
 */
public final class RuleFileLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleFileLoader.class);

    private final ObjectMapper objectMapper;

    public RuleFileLoader() {
        this(new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT));
    }

    public RuleFileLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a rules file.
     *
     * @throws IOException if the file cannot be read or is not valid JSON
     * @throws gk.java.engine.InvalidRuleException if a definition cannot become a rule
     */
    public List<RateLimitRule> read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public List<RateLimitRule> read(InputStream in) throws IOException {
        RuleFile file = objectMapper.readValue(in, RuleFile.class);
        return file.rules().stream().map(RuleDefinition::toModel).toList();
    }

    /**
     * Parses a rules file and adds every rule to the limiter. Stops at the first invalid rule.
     *
     * @return number of rules added
     */
    public int loadInto(Path path, RateLimiter limiter) throws IOException {
        List<RateLimitRule> rules = read(path);
        for (RateLimitRule rule : rules) {
            limiter.addRule(rule);
        }
        log.info("Loaded {} rate limit rules from {}", rules.size(), path);
        return rules.size();
    }

    public String write(List<RateLimitRule> rules) throws JsonProcessingException {
        return objectMapper.writeValueAsString(new RuleFile(rules.stream().map(RuleDefinition::fromModel).toList()));
    }
}
