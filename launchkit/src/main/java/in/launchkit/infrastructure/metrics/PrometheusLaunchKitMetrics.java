package in.launchkit.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of LaunchKitMetrics.
 *
 * Key Metrics:
 * - launchkit_launches_total{outcome}
 * - launchkit_publishes_total{channel, outcome}
 * - launchkit_operation_latency_seconds{operation}
 * - launchkit_claims_rejected_total{operation}
 * - launchkit_external_calls_total{dependency, status}
 * - launchkit_sweep_due{channel} / launchkit_sweep_failures_total{channel}
 */
public class PrometheusLaunchKitMetrics implements LaunchKitMetrics {

    private final CollectorRegistry registry;

    private final Counter launchCounter;
    private final Counter publishCounter;
    private final Histogram operationLatency;
    private final Counter claimRejectedCounter;
    private final Counter externalCallCounter;
    private final Gauge sweepDue;
    private final Counter sweepFailures;

    public PrometheusLaunchKitMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusLaunchKitMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.launchCounter = Counter.build()
            .name("launchkit_launches_total")
            .help("Launch attempts by outcome")
            .labelNames("outcome")
            .register(registry);

        this.publishCounter = Counter.build()
            .name("launchkit_publishes_total")
            .help("Publish attempts by channel and outcome")
            .labelNames("channel", "outcome")
            .register(registry);

        this.operationLatency = Histogram.build()
            .name("launchkit_operation_latency_seconds")
            .help("Orchestration latency in seconds")
            .labelNames("operation")
            .buckets(0.05, 0.1, 0.5, 1.0, 2.0, 5.0, 10.0, 30.0, 60.0)
            .register(registry);

        this.claimRejectedCounter = Counter.build()
            .name("launchkit_claims_rejected_total")
            .help("Claims that lost to an in-flight or finished operation")
            .labelNames("operation")
            .register(registry);

        this.externalCallCounter = Counter.build()
            .name("launchkit_external_calls_total")
            .help("Calls to remote dependencies by response status")
            .labelNames("dependency", "status")
            .register(registry);

        this.sweepDue = Gauge.build()
            .name("launchkit_sweep_due")
            .help("LaunchPacks found due in the last sweep")
            .labelNames("channel")
            .register(registry);

        this.sweepFailures = Counter.build()
            .name("launchkit_sweep_failures_total")
            .help("Scheduled publishes that failed during a sweep")
            .labelNames("channel")
            .register(registry);
    }

    @Override
    public void recordLaunch(String outcome, Duration latency) {
        launchCounter.labels(outcome).inc();
        operationLatency.labels("launch").observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordPublish(String channel, String outcome, Duration latency) {
        publishCounter.labels(channel, outcome).inc();
        operationLatency.labels("publish_" + channel).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordClaimRejected(String operation) {
        claimRejectedCounter.labels(operation).inc();
    }

    @Override
    public void recordExternalCall(String dependency, String status) {
        externalCallCounter.labels(dependency, status).inc();
    }

    @Override
    public void recordSweep(String channel, int due, int failed) {
        sweepDue.labels(channel).set(due);
        if (failed > 0) {
            sweepFailures.labels(channel).inc(failed);
        }
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
