package sm.benchmarks.java;

import org.openjdk.jmh.annotations.*;
import sm.core.clock.SystemClock;
import sm.core.model.AdmissionDecision;
import sm.core.ratelimit.QuotaRateLimiter;
import sm.core.ratelimit.RateLimiterConfig;

import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for QuotaRateLimiter admission.
 *
 * The limits are low, so after warmup almost every call answers WAIT: this measures the
 * decision path under a saturated window, the common case behind a tight API plan.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class RateLimiterBenchmark {

    private QuotaRateLimiter limiter;

    @Setup
    public void setup() {
        limiter = new QuotaRateLimiter(SystemClock.instance(), RateLimiterConfig.of(300, 7_500));
    }

    @Benchmark
    public AdmissionDecision acquire() {
        return limiter.acquire();
    }

    @Benchmark
    @Threads(8)
    public AdmissionDecision parallelAcquire() {
        return limiter.acquire();
    }
}
