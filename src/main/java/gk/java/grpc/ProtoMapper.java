package gk.java.grpc;

import gk.core.model.RateLimitAction;
import gk.core.model.RateLimitAlgorithm;
import gk.core.model.RateLimitResult;
import gk.core.model.RateLimitRule;
import gk.core.model.RateLimitScope;
import gk.core.model.RateLimitStatistics;
import gk.core.model.UsageStatistics;
import gk.proto.CheckRateLimitResponse;
import gk.proto.GetStatisticsResponse;
import gk.proto.GetUsageStatisticsResponse;
import gk.proto.HourlyUsage;
import gk.proto.Rule;

import java.util.Map;

/**
 * Conversions between protobuf messages and the engine model.
 */
final class ProtoMapper {

    private ProtoMapper() {
    }

    static RateLimitRule toRule(Rule proto) {
        if (proto.getId().isEmpty()) {
            throw new IllegalArgumentException("rule id must not be empty");
        }
        RateLimitRule.Builder builder = RateLimitRule.builder(proto.getId())
            .maxRequests(proto.getMaxRequests())
            .windowSeconds(proto.getWindowSeconds())
            .blockDurationSeconds(proto.getBlockDurationSeconds())
            .endpointPatterns(proto.getEndpointPatternsList())
            .priority(proto.getPriority())
            .metadata(proto.getMetadataMap());
        if (!proto.getName().isEmpty()) builder.name(proto.getName());
        if (!proto.getAlgorithm().isEmpty()) builder.algorithm(RateLimitAlgorithm.fromWireName(proto.getAlgorithm()));
        if (!proto.getScope().isEmpty()) builder.scope(RateLimitScope.fromWireName(proto.getScope()));
        if (!proto.getScopeValue().isEmpty()) builder.scopeValue(proto.getScopeValue());
        if (!proto.getAction().isEmpty()) builder.action(RateLimitAction.fromWireName(proto.getAction()));
        if (proto.hasBurstMultiplier()) builder.burstMultiplier(proto.getBurstMultiplier());
        if (proto.hasWeight()) builder.weight(proto.getWeight());
        if (proto.hasTtlSeconds()) builder.ttlSeconds(proto.getTtlSeconds());
        if (proto.hasEnabled()) builder.enabled(proto.getEnabled());
        return builder.build();
    }

    static Rule toProto(RateLimitRule rule) {
        Rule.Builder builder = Rule.newBuilder()
            .setId(rule.id())
            .setName(rule.name())
            .setAlgorithm(rule.algorithm().wireName())
            .setScope(rule.scope().wireName())
            .setScopeValue(rule.scopeValue())
            .setMaxRequests(rule.maxRequests())
            .setWindowSeconds(rule.windowSeconds())
            .setBurstMultiplier(rule.burstMultiplier())
            .setBlockDurationSeconds(rule.blockDurationSeconds())
            .setAction(rule.action().wireName())
            .addAllEndpointPatterns(rule.endpointPatterns())
            .setPriority(rule.priority())
            .setWeight(rule.weight())
            .setEnabled(rule.enabled())
            .putAllMetadata(rule.metadata());
        if (rule.ttlSeconds() != null) {
            builder.setTtlSeconds(rule.ttlSeconds());
        }
        return builder.build();
    }

    static CheckRateLimitResponse toProto(RateLimitResult result) {
        CheckRateLimitResponse.Builder builder = CheckRateLimitResponse.newBuilder()
            .setAllowed(result.allowed())
            .setRemainingRequests(result.remainingRequests())
            .setResetEpochSeconds(result.resetEpochSeconds())
            .putAllHeaders(result.headers())
            .setViolationDetected(result.violationDetected())
            .setRateLimitedCount(result.rateLimitedCount());
        result.retryAfterSeconds().ifPresent(builder::setRetryAfterSeconds);
        result.throttleDelaySeconds().ifPresent(builder::setThrottleDelaySeconds);
        return builder.build();
    }

    static gk.proto.RuleStatus toProto(gk.core.model.RuleStatus status) {
        gk.proto.RuleStatus.Builder builder = gk.proto.RuleStatus.newBuilder()
            .setRuleId(status.ruleId())
            .setRuleName(status.ruleName())
            .setAlgorithm(status.algorithm().wireName())
            .setMaxRequests(status.maxRequests())
            .setWindowSeconds(status.windowSeconds())
            .setEnabled(status.enabled())
            .setTracked(status.tracked());
        for (Map.Entry<String, Object> e : status.state().entrySet()) {
            builder.putState(e.getKey(), String.valueOf(e.getValue()));
        }
        return builder.build();
    }

    static GetStatisticsResponse toProto(RateLimitStatistics stats) {
        GetStatisticsResponse.Builder builder = GetStatisticsResponse.newBuilder()
            .setTotalChecks(stats.totalChecks())
            .setAllowedRequests(stats.allowedRequests())
            .setBlockedRequests(stats.blockedRequests())
            .setAllowanceRatePercent(stats.allowanceRatePercent())
            .setBlockRatePercent(stats.blockRatePercent())
            .putAllRuleViolations(stats.ruleViolations())
            .setEvaluationErrors(stats.evaluationErrors())
            .setDroppedEvents(stats.droppedEvents())
            .setTrackedStates(stats.trackedStates())
            .setActiveRules(stats.activeRules())
            .setTotalRules(stats.totalRules());
        stats.algorithmBreakdown().forEach((algorithm, count) -> builder.putAlgorithmBreakdown(algorithm.wireName(), count));
        stats.scopeBreakdown().forEach((scope, count) -> builder.putScopeBreakdown(scope.wireName(), count));
        return builder.build();
    }

    static GetUsageStatisticsResponse toProto(UsageStatistics usage) {
        GetUsageStatisticsResponse.Builder builder = GetUsageStatisticsResponse.newBuilder()
            .setIdentifier(usage.identifier())
            .setScope(usage.scope().wireName())
            .setPeriodHours(usage.periodHours())
            .setTotalRequests(usage.totalRequests())
            .setTotalBlocked(usage.totalBlocked())
            .setBlockRatePercent(usage.blockRatePercent())
            .setUsagePattern(usage.pattern())
            .setAverageRequestsPerHour(usage.averageRequestsPerHour())
            .setPeakHourlyRequests(usage.peakHourlyRequests())
            .setPeakToAverageRatio(usage.peakToAverageRatio());
        for (UsageStatistics.HourlyUsage hour : usage.hourlyBreakdown()) {
            builder.addHourlyBreakdown(HourlyUsage.newBuilder()
                .setHourEpochSeconds(hour.hour().getEpochSecond())
                .setRequests(hour.requests())
                .setBlocked(hour.blocked()));
        }
        usage.peakUsageHour().ifPresent(hour -> builder.setPeakUsageHourEpochSeconds(hour.getEpochSecond()));
        return builder.build();
    }
}
