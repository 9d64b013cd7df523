package gk.benchmarks;

import gk.core.clock.SystemClock;
import gk.core.model.RateLimitAlgorithm;
import gk.core.model.RateLimitRule;
import gk.core.model.RateLimitScope;
import gk.java.engine.RateLimiter;
import gk.java.engine.RateLimiterConfig;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for RateLimiter admission checks.
 *
 * Measures throughput (ops/sec) across 4 scenarios:
 * - singleKey: All requests from the same IP (contention on one state)
 * - multiKey: Rotating through 1000 IPs (low contention)
 * - parallel: 8 threads on a single IP
 * - layered: Three matching rules per request
 *
 * Run from the test classpath:
 *   java -cp target/test-classes:target/classes:... org.openjdk.jmh.Main Admission
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class AdmissionBenchmark {

    private RateLimiter single;
    private RateLimiter layered;

    @Setup
    public void setup() {
        single = new RateLimiter(SystemClock.instance(), RateLimiterConfig.defaults());
        single.addRule(RateLimitRule.builder("ip")
            .scope(RateLimitScope.IP)
            .maxRequests(1_000_000)
            .windowSeconds(1)
            .build());

        layered = new RateLimiter(SystemClock.instance(), RateLimiterConfig.defaults());
        layered.addRule(RateLimitRule.builder("burst").scope(RateLimitScope.IP)
            .maxRequests(1_000_000).windowSeconds(1).priority(10).build());
        layered.addRule(RateLimitRule.builder("minute").scope(RateLimitScope.IP)
            .algorithm(RateLimitAlgorithm.FIXED_WINDOW).maxRequests(100_000_000).windowSeconds(60).build());
        layered.addRule(RateLimitRule.builder("api").scope(RateLimitScope.IP)
            .algorithm(RateLimitAlgorithm.LEAKY_BUCKET).maxRequests(1_000_000).windowSeconds(1)
            .endpointPattern("/api/*").build());
    }

    @TearDown
    public void tearDown() {
        single.close();
        layered.close();
    }

    @Benchmark
    public boolean singleKey() {
        return single.checkRateLimit("10.0.0.1", RateLimitScope.IP, "/api/items").allowed();
    }

    @Benchmark
    public boolean multiKey() {
        String ip = "10.0.0." + ThreadLocalRandom.current().nextInt(1000);
        return single.checkRateLimit(ip, RateLimitScope.IP, "/api/items").allowed();
    }

    @Benchmark
    @Threads(8)
    public boolean parallel() {
        return single.checkRateLimit("10.0.0.1", RateLimitScope.IP, "/api/items").allowed();
    }

    @Benchmark
    public boolean layeredRules() {
        return layered.checkRateLimit("10.0.0.1", RateLimitScope.IP, "/api/items").allowed();
    }
}
