package gk.java.grpc;

import gk.core.model.RateLimitResult;
import gk.core.model.RateLimitScope;
import gk.java.engine.RateLimiter;
import gk.java.engine.UnknownRuleException;
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
import gk.proto.ListRulesResponse;
import gk.proto.RemoveRuleRequest;
import gk.proto.RemoveRuleResponse;
import gk.proto.ResetRequest;
import gk.proto.ResetResponse;
import gk.proto.RuleResponse;
import gk.proto.SetRuleEnabledRequest;
import gk.proto.SetRuleEnabledResponse;
import gk.proto.UpdateRuleRequest;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * gRPC service implementation for admission checks and rule administration.
 *
 * <p>This is a thin wrapper over {@link RateLimiter} with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>NOT_FOUND when an update names an unknown rule</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 *   <li>Protobuf conversion through {@link ProtoMapper}</li>
 * </ul>
 *
 * <p>Thread-safety: RateLimiter handles concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class GatekeeperServiceImpl extends GatekeeperServiceGrpc.GatekeeperServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(GatekeeperServiceImpl.class);
    private static final int DEFAULT_HOURS_BACK = 24;

    private final RateLimiter limiter;

    /**
     * Creates a new gRPC service wrapping the given limiter.
     *
     * @param limiter Rate limiter (must be thread-safe)
     * @throws IllegalArgumentException if limiter is null
     */
    public GatekeeperServiceImpl(RateLimiter limiter) {
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
        this.limiter = limiter;
    }

    @Override
    public void checkRateLimit(CheckRateLimitRequest request, StreamObserver<CheckRateLimitResponse> responseObserver) {
        respond(responseObserver, () -> {
            // protobuf strings are never null, only empty
            requireNonEmpty(request.getIdentifier(), "identifier");
            if (request.getRequestSize() < 0) {
                throw new IllegalArgumentException("request_size must be >= 0, got: " + request.getRequestSize());
            }
            OptionalDouble latency = request.hasObservedLatencyMs()
                ? OptionalDouble.of(request.getObservedLatencyMs())
                : OptionalDouble.empty();
            RateLimitResult result = limiter.checkRateLimit(request.getIdentifier(), scope(request.getScope()),
                request.getEndpoint(), latency, request.getRequestSize());
            return ProtoMapper.toProto(result);
        });
    }

    @Override
    public void addRule(AddRuleRequest request, StreamObserver<RuleResponse> responseObserver) {
        respond(responseObserver, () -> {
            limiter.addRule(ProtoMapper.toRule(request.getRule()));
            return ruleResponse(request.getRule().getId());
        });
    }

    @Override
    public void updateRule(UpdateRuleRequest request, StreamObserver<RuleResponse> responseObserver) {
        respond(responseObserver, () -> {
            limiter.updateRule(ProtoMapper.toRule(request.getRule()));
            return ruleResponse(request.getRule().getId());
        });
    }

    @Override
    public void removeRule(RemoveRuleRequest request, StreamObserver<RemoveRuleResponse> responseObserver) {
        respond(responseObserver, () -> {
            requireNonEmpty(request.getRuleId(), "rule_id");
            return RemoveRuleResponse.newBuilder().setRemoved(limiter.removeRule(request.getRuleId())).build();
        });
    }

    @Override
    public void setRuleEnabled(SetRuleEnabledRequest request, StreamObserver<SetRuleEnabledResponse> responseObserver) {
        respond(responseObserver, () -> {
            requireNonEmpty(request.getRuleId(), "rule_id");
            boolean found = limiter.setRuleEnabled(request.getRuleId(), request.getEnabled());
            return SetRuleEnabledResponse.newBuilder().setFound(found).build();
        });
    }

    @Override
    public void listRules(ListRulesRequest request, StreamObserver<ListRulesResponse> responseObserver) {
        respond(responseObserver, () -> {
            ListRulesResponse.Builder builder = ListRulesResponse.newBuilder();
            limiter.listRules().forEach(rule -> builder.addRules(ProtoMapper.toProto(rule)));
            return builder.build();
        });
    }

    @Override
    public void getStatus(GetStatusRequest request, StreamObserver<GetStatusResponse> responseObserver) {
        respond(responseObserver, () -> {
            requireNonEmpty(request.getIdentifier(), "identifier");
            GetStatusResponse.Builder builder = GetStatusResponse.newBuilder();
            limiter.getStatus(request.getIdentifier(), scope(request.getScope()), request.getEndpoint())
                .forEach(status -> builder.addStatuses(ProtoMapper.toProto(status)));
            return builder.build();
        });
    }

    @Override
    public void reset(ResetRequest request, StreamObserver<ResetResponse> responseObserver) {
        respond(responseObserver, () -> {
            requireNonEmpty(request.getIdentifier(), "identifier");
            boolean cleared = limiter.reset(request.getIdentifier(), scope(request.getScope()), request.getEndpoint());
            return ResetResponse.newBuilder().setCleared(cleared).build();
        });
    }

    @Override
    public void getStatistics(GetStatisticsRequest request, StreamObserver<GetStatisticsResponse> responseObserver) {
        respond(responseObserver, () -> ProtoMapper.toProto(limiter.getStatistics()));
    }

    @Override
    public void getUsageStatistics(GetUsageStatisticsRequest request,
                                   StreamObserver<GetUsageStatisticsResponse> responseObserver) {
        respond(responseObserver, () -> {
            requireNonEmpty(request.getIdentifier(), "identifier");
            int hoursBack = request.getHoursBack() == 0 ? DEFAULT_HOURS_BACK : request.getHoursBack();
            return ProtoMapper.toProto(
                limiter.getUsageStatistics(request.getIdentifier(), scope(request.getScope()), hoursBack));
        });
    }

    @Override
    public void healthCheck(HealthCheckRequest request, StreamObserver<HealthCheckResponse> responseObserver) {
        // Simple health check: if we can respond, we're serving
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    private RuleResponse ruleResponse(String ruleId) {
        return limiter.getRule(ruleId)
            .map(rule -> RuleResponse.newBuilder().setRule(ProtoMapper.toProto(rule)).build())
            .orElseThrow(() -> new UnknownRuleException(ruleId));
    }

    private static RateLimitScope scope(String value) {
        return RateLimitScope.fromWireName(value);
    }

    private static void requireNonEmpty(String value, String field) {
        if (value.isEmpty()) {
            throw new IllegalArgumentException(field + " must not be empty");
        }
    }

    private static <T> void respond(StreamObserver<T> responseObserver, Supplier<T> call) {
        T response;
        try {
            response = call.get();
        } catch (UnknownRuleException e) {
            responseObserver.onError(
                Status.NOT_FOUND
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        } catch (IllegalArgumentException e) {
            // Rule validation and request argument failures
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        } catch (Exception e) {
            log.error("Unexpected error serving request", e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("Internal error: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }
}
