package gk.java.grpc;

import gk.core.clock.ManualClock;
import gk.core.model.RateLimitHeaders;
import gk.java.engine.RateLimiter;
import gk.java.engine.RateLimiterConfig;
import gk.proto.AddRuleRequest;
import gk.proto.CheckRateLimitRequest;
import gk.proto.CheckRateLimitResponse;
import gk.proto.GatekeeperServiceGrpc;
import gk.proto.GetStatisticsRequest;
import gk.proto.GetStatisticsResponse;
import gk.proto.GetStatusRequest;
import gk.proto.GetStatusResponse;
import gk.proto.GetUsageStatisticsRequest;
import gk.proto.GetUsageStatisticsResponse;
import gk.proto.HealthCheckRequest;
import gk.proto.HealthCheckResponse;
import gk.proto.ListRulesRequest;
import gk.proto.RemoveRuleRequest;
import gk.proto.ResetRequest;
import gk.proto.Rule;
import gk.proto.RuleResponse;
import gk.proto.SetRuleEnabledRequest;
import gk.proto.UpdateRuleRequest;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for GatekeeperServiceImpl using InProcessServer.
 *
 * <p>Tests cover:
 * <ul>
 *   <li>Allow/reject behavior and response headers</li>
 *   <li>Rule administration round trips</li>
 *   <li>Status codes for invalid input and unknown rules</li>
 *   <li>Health check endpoint</li>
 * </ul>
 */
class GatekeeperServiceImplTest {

    private Server server;
    private ManagedChannel channel;
    private ManualClock clock;
    private RateLimiter limiter;
    private GatekeeperServiceGrpc.GatekeeperServiceBlockingStub blockingStub;

    @BeforeEach
    void setUp() throws Exception {
        clock = new ManualClock(0L, 1_700_000_000_000L);
        limiter = new RateLimiter(clock, RateLimiterConfig.defaults());

        String serverName = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(serverName)
            .directExecutor()
            .addService(new GatekeeperServiceImpl(limiter))
            .build()
            .start();

        channel = InProcessChannelBuilder.forName(serverName)
            .directExecutor()
            .build();

        blockingStub = GatekeeperServiceGrpc.newBlockingStub(channel);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (channel != null) {
            channel.shutdown();
            channel.awaitTermination(5, TimeUnit.SECONDS);
        }
        if (server != null) {
            server.shutdown();
            server.awaitTermination(5, TimeUnit.SECONDS);
        }
        limiter.close();
    }

    private static Rule ipRule(String id, int maxRequests) {
        return Rule.newBuilder()
            .setId(id)
            .setAlgorithm("token_bucket")
            .setScope("ip")
            .setMaxRequests(maxRequests)
            .setWindowSeconds(10)
            .build();
    }

    private CheckRateLimitResponse check(String identifier) {
        return blockingStub.checkRateLimit(CheckRateLimitRequest.newBuilder()
            .setIdentifier(identifier)
            .setScope("ip")
            .setEndpoint("/api/items")
            .build());
    }

    private static void assertStatus(Status.Code expected, Runnable call) {
        StatusRuntimeException e = assertThrows(StatusRuntimeException.class, call::run);
        assertEquals(expected, e.getStatus().getCode(), e.getStatus().getDescription());
    }

    @Test
    void testCheck_allowThenReject() {
        blockingStub.addRule(AddRuleRequest.newBuilder().setRule(ipRule("tb", 3)).build());

        for (int i = 0; i < 3; i++) {
            CheckRateLimitResponse response = check("10.0.0.1");
            assertTrue(response.getAllowed(), "request " + i);
            assertEquals(2 - i, response.getRemainingRequests());
            assertFalse(response.hasRetryAfterSeconds());
        }

        CheckRateLimitResponse rejected = check("10.0.0.1");
        assertFalse(rejected.getAllowed());
        assertTrue(rejected.hasRetryAfterSeconds());
        assertEquals(4L, rejected.getRetryAfterSeconds(), "one token at 0.3/s");
        assertEquals("4", rejected.getHeadersMap().get(RateLimitHeaders.RETRY_AFTER));
        assertTrue(rejected.getViolationDetected());
        assertEquals(1, rejected.getRateLimitedCount());
    }

    @Test
    void testCheck_noRulesUsesDefaults() {
        CheckRateLimitResponse response = check("10.0.0.1");
        assertTrue(response.getAllowed());
        assertEquals(100L, response.getRemainingRequests());
        assertEquals(1_700_000_060L, response.getResetEpochSeconds());
    }

    @Test
    void testCheck_invalidArguments() {
        assertStatus(Status.Code.INVALID_ARGUMENT,
            () -> blockingStub.checkRateLimit(CheckRateLimitRequest.newBuilder().setScope("ip").build()));
        assertStatus(Status.Code.INVALID_ARGUMENT,
            () -> blockingStub.checkRateLimit(CheckRateLimitRequest.newBuilder().setIdentifier("x").setScope("galaxy").build()));
        assertStatus(Status.Code.INVALID_ARGUMENT,
            () -> blockingStub.checkRateLimit(CheckRateLimitRequest.newBuilder()
                .setIdentifier("x").setScope("ip").setRequestSize(-1).build()));
    }

    @Test
    void testAddRule_appliesDefaultsAndRejectsDuplicates() {
        RuleResponse added = blockingStub.addRule(AddRuleRequest.newBuilder().setRule(ipRule("tb", 5)).build());

        Rule stored = added.getRule();
        assertEquals("tb", stored.getName());
        assertEquals("block", stored.getAction());
        assertEquals("*", stored.getScopeValue());
        assertEquals(1.0, stored.getBurstMultiplier());
        assertEquals(1.0, stored.getWeight());
        assertTrue(stored.getEnabled());
        assertFalse(stored.hasTtlSeconds());

        assertStatus(Status.Code.INVALID_ARGUMENT,
            () -> blockingStub.addRule(AddRuleRequest.newBuilder().setRule(ipRule("tb", 5)).build()));
        assertStatus(Status.Code.INVALID_ARGUMENT,
            () -> blockingStub.addRule(AddRuleRequest.newBuilder().setRule(ipRule("bad", 0)).build()));
        assertStatus(Status.Code.INVALID_ARGUMENT,
            () -> blockingStub.addRule(AddRuleRequest.newBuilder().setRule(ipRule("", 5)).build()));
    }

    @Test
    void testUpdateRule_unknownIsNotFound() {
        assertStatus(Status.Code.NOT_FOUND,
            () -> blockingStub.updateRule(UpdateRuleRequest.newBuilder().setRule(ipRule("missing", 5)).build()));
    }

    @Test
    void testRuleAdministration_roundTrip() {
        blockingStub.addRule(AddRuleRequest.newBuilder().setRule(ipRule("tb", 5)).build());
        RuleResponse updated = blockingStub.updateRule(UpdateRuleRequest.newBuilder()
            .setRule(ipRule("tb", 8).toBuilder().setPriority(3).addEndpointPatterns("/api/*")).build());
        assertEquals(8, updated.getRule().getMaxRequests());
        assertEquals(3, updated.getRule().getPriority());

        assertTrue(blockingStub.setRuleEnabled(SetRuleEnabledRequest.newBuilder()
            .setRuleId("tb").setEnabled(false).build()).getFound());
        assertFalse(blockingStub.listRules(ListRulesRequest.getDefaultInstance()).getRules(0).getEnabled());
        assertFalse(blockingStub.setRuleEnabled(SetRuleEnabledRequest.newBuilder()
            .setRuleId("missing").setEnabled(true).build()).getFound());

        assertTrue(blockingStub.removeRule(RemoveRuleRequest.newBuilder().setRuleId("tb").build()).getRemoved());
        assertFalse(blockingStub.removeRule(RemoveRuleRequest.newBuilder().setRuleId("tb").build()).getRemoved());
        assertEquals(0, blockingStub.listRules(ListRulesRequest.getDefaultInstance()).getRulesCount());

        assertStatus(Status.Code.INVALID_ARGUMENT,
            () -> blockingStub.removeRule(RemoveRuleRequest.getDefaultInstance()));
    }

    @Test
    void testStatusAndReset() {
        blockingStub.addRule(AddRuleRequest.newBuilder().setRule(ipRule("tb", 3)).build());
        check("10.0.0.1");

        GetStatusRequest statusRequest = GetStatusRequest.newBuilder()
            .setIdentifier("10.0.0.1").setScope("ip").setEndpoint("/api/items").build();
        GetStatusResponse status = blockingStub.getStatus(statusRequest);
        assertEquals(1, status.getStatusesCount());
        assertTrue(status.getStatuses(0).getTracked());
        assertEquals("token_bucket", status.getStatuses(0).getAlgorithm());
        assertEquals("2.0", status.getStatuses(0).getStateMap().get("remaining_tokens"));

        ResetRequest reset = ResetRequest.newBuilder()
            .setIdentifier("10.0.0.1").setScope("ip").setEndpoint("/api/items").build();
        assertTrue(blockingStub.reset(reset).getCleared());
        assertFalse(blockingStub.reset(reset).getCleared());
        assertFalse(blockingStub.getStatus(statusRequest).getStatuses(0).getTracked());
    }

    @Test
    void testStatistics() {
        blockingStub.addRule(AddRuleRequest.newBuilder().setRule(ipRule("tb", 1)).build());
        check("10.0.0.1");
        check("10.0.0.1");

        GetStatisticsResponse stats = blockingStub.getStatistics(GetStatisticsRequest.getDefaultInstance());
        assertEquals(2L, stats.getTotalChecks());
        assertEquals(1L, stats.getBlockedRequests());
        assertEquals(50.0, stats.getBlockRatePercent());
        assertEquals(1L, stats.getRuleViolationsMap().get("tb"));
        assertEquals(1, stats.getAlgorithmBreakdownMap().get("token_bucket"));
        assertEquals(1, stats.getScopeBreakdownMap().get("ip"));

        GetUsageStatisticsResponse usage = blockingStub.getUsageStatistics(GetUsageStatisticsRequest.newBuilder()
            .setIdentifier("10.0.0.1").setScope("ip").build());
        assertEquals(24, usage.getPeriodHours());
        assertEquals(2L, usage.getTotalRequests());
        assertEquals(1L, usage.getTotalBlocked());
        assertEquals(1, usage.getHourlyBreakdownCount());
        assertTrue(usage.hasPeakUsageHourEpochSeconds());
        assertEquals("consistent", usage.getUsagePattern());
    }

    @Test
    void testHealthCheck() {
        HealthCheckResponse response = blockingStub.healthCheck(HealthCheckRequest.getDefaultInstance());
        assertEquals(HealthCheckResponse.Status.SERVING, response.getStatus());
    }
}
