package gk.java.engine;

import gk.core.clock.ManualClock;
import gk.core.model.RateLimitRule;
import gk.core.model.RateLimitScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuleRegistry ordering and RuleMatcher selection.
 */
class RuleRegistryTest {

    private ManualClock clock;
    private RuleRegistry registry;
    private RuleMatcher matcher;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(0L);
        registry = new RuleRegistry(clock, new RuleValidator(5.0), RateLimiterFactory.standard());
        matcher = new RuleMatcher(registry);
    }

    private static RateLimitRule.Builder rule(String id) {
        return RateLimitRule.builder(id).maxRequests(10).windowSeconds(60);
    }

    private List<String> applicableIds(String identifier, RateLimitScope scope, String endpoint) {
        return matcher.findApplicable(identifier, scope, endpoint, clock.nowNanos()).stream()
            .map(RegisteredRule::id)
            .toList();
    }

    @Test
    void testOrder_priorityDescendingThenInsertion() {
        registry.add(rule("a").priority(0).build());
        registry.add(rule("b").priority(5).build());
        registry.add(rule("c").priority(0).build());
        registry.add(rule("d").priority(5).build());

        assertEquals(List.of("b", "d", "a", "c"), registry.rules().stream().map(RateLimitRule::id).toList());
    }

    @Test
    void testUpdate_keepsInsertionPositionButFollowsNewPriority() {
        registry.add(rule("a").build());
        registry.add(rule("b").build());
        registry.add(rule("c").build());

        registry.update(rule("a").maxRequests(20).build());
        assertEquals(List.of("a", "b", "c"), registry.rules().stream().map(RateLimitRule::id).toList());

        registry.update(rule("c").priority(1).build());
        assertEquals(List.of("c", "a", "b"), registry.rules().stream().map(RateLimitRule::id).toList());
    }

    @Test
    void testSnapshot_isImmutableAndUnaffectedByLaterChanges() {
        registry.add(rule("a").build());
        List<RegisteredRule> before = registry.snapshot();

        registry.add(rule("b").build());

        assertEquals(1, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.remove(0));
    }

    @Test
    void testRemoveAndSetEnabled_unknownIds() {
        assertTrue(registry.remove("missing").isEmpty());
        assertFalse(registry.setEnabled("missing", true));
        assertThrows(UnknownRuleException.class, () -> registry.update(rule("missing").build()));
    }

    @Test
    void testSetEnabled_keepsRegistrationTime() {
        registry.add(rule("temp").ttlSeconds(10L).build());
        clock.advanceSeconds(5);
        registry.setEnabled("temp", false);
        registry.setEnabled("temp", true);

        clock.advanceSeconds(5);
        assertTrue(applicableIds("x", RateLimitScope.GLOBAL, "/").isEmpty(), "ttl counts from first registration");
    }

    @Test
    void testUpdate_restartsTtl() {
        registry.add(rule("temp").ttlSeconds(10L).build());
        clock.advanceSeconds(5);
        registry.update(rule("temp").ttlSeconds(10L).build());

        clock.advanceSeconds(5);
        assertEquals(List.of("temp"), applicableIds("x", RateLimitScope.GLOBAL, "/"));
    }

    @Test
    void testMatcher_filtersByScopeIdentifierEndpointAndEnabled() {
        registry.add(rule("global").build());
        registry.add(rule("any-user").scope(RateLimitScope.USER).build());
        registry.add(rule("alice").scope(RateLimitScope.USER).scopeValue("alice").build());
        registry.add(rule("admin").scope(RateLimitScope.USER).endpointPattern("/admin/*").build());
        registry.add(rule("off").scope(RateLimitScope.USER).enabled(false).build());

        assertEquals(List.of("any-user", "alice"), applicableIds("alice", RateLimitScope.USER, "/items"));
        assertEquals(List.of("any-user"), applicableIds("bob", RateLimitScope.USER, "/items"));
        assertEquals(List.of("any-user", "admin"), applicableIds("bob", RateLimitScope.USER, "/admin/users"));
        assertEquals(List.of("global"), applicableIds("bob", RateLimitScope.GLOBAL, "/items"));
        assertTrue(applicableIds("bob", RateLimitScope.IP, "/items").isEmpty());
    }

    @Test
    void testAdd_invalidPatternRejectedAtRegistration() {
        assertThrows(InvalidRuleException.class, () -> registry.add(rule("bad").endpointPattern("").build()));
        assertTrue(registry.rules().isEmpty());
    }
}
