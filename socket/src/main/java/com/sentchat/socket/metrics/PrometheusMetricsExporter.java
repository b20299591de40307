package com.sentchat.socket.metrics;

import com.sentchat.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Scrape endpoint backing for {@code /metrics}.
 * <p>
 * Attaches a Prometheus registry to Reactor Netty's global composite so server metrics
 * and the socket node's own meters end up in one scrape.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.registry = Metrics.REGISTRY;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        } else {
            log.warn("Reactor Netty registry is not a composite; /metrics will be empty");
        }

        registry.config().commonTags(MetricsTags.NODE_ID, nodeId);
        log.info("Metrics exporter initialized for node {}", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
