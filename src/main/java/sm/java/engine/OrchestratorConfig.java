package sm.java.engine;

import java.time.Duration;

/**
 * Configuration for the fetch orchestrator.
 *
 * @param transportMaxAttempts Upstream attempts per fetch on transport failures (>= 1)
 * @param transportRetryDelay Delay before the second attempt; doubles per attempt
 * @param admissionTimeout Ceiling on the total time a fetch may spend waiting for admission
 * @param maxAdmissionAttempts Ceiling on admission requests per upstream attempt
 * @param fetchTimeout How long a synchronous caller waits for the shared result
 */
public record OrchestratorConfig(
    int transportMaxAttempts,
    Duration transportRetryDelay,
    Duration admissionTimeout,
    int maxAdmissionAttempts,
    Duration fetchTimeout
) {
    public OrchestratorConfig {
        if (transportMaxAttempts <= 0) throw new IllegalArgumentException("transportMaxAttempts must be > 0");
        if (transportRetryDelay == null || transportRetryDelay.isNegative()) {
            throw new IllegalArgumentException("transportRetryDelay must be >= 0");
        }
        if (admissionTimeout == null || admissionTimeout.isNegative()) {
            throw new IllegalArgumentException("admissionTimeout must be >= 0");
        }
        if (maxAdmissionAttempts <= 0) throw new IllegalArgumentException("maxAdmissionAttempts must be > 0");
        if (fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            throw new IllegalArgumentException("fetchTimeout must be > 0");
        }
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig(
            3,
            Duration.ofMillis(500),
            Duration.ofSeconds(90),
            32,
            Duration.ofMinutes(3)
        );
    }

    public OrchestratorConfig withTransportRetries(int attempts, Duration delay) {
        return new OrchestratorConfig(attempts, delay, admissionTimeout, maxAdmissionAttempts, fetchTimeout);
    }

    public OrchestratorConfig withAdmission(Duration timeout, int maxAttempts) {
        return new OrchestratorConfig(transportMaxAttempts, transportRetryDelay, timeout, maxAttempts, fetchTimeout);
    }

    public OrchestratorConfig withFetchTimeout(Duration timeout) {
        return new OrchestratorConfig(transportMaxAttempts, transportRetryDelay, admissionTimeout, maxAdmissionAttempts, timeout);
    }
}
