package in.livebid.infrastructure.metrics;

import io.prometheus.client.Collector.MetricFamilySamples;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Serves the auction metric families at /metrics in Prometheus text format.
 *
 * Only families whose name starts with the configured prefix are exported, so collectors other
 * libraries register in the same registry stay private. A scrape may narrow the output further
 * with repeated {@code name[]=<sample name>} parameters.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private static final String NAME_PARAM = "name[]";

    private final CollectorRegistry registry;
    private final String familyPrefix;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this(registry, PrometheusAuctionMetrics.FAMILY_PREFIX);
    }

    public PrometheusMetricsHandler(CollectorRegistry registry, String familyPrefix) {
        this.registry = registry;
        this.familyPrefix = familyPrefix;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Set<String> requested = requestedNames(exchange);
        List<MetricFamilySamples> families = select(requested);

        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, Collections.enumeration(families));
        } catch (IOException e) {
            log.error("Failed to export {} metric families: {}", families.size(), e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(writer.toString());
        log.debug("Served {} metric families (filter={})", families.size(), requested.isEmpty() ? "none" : requested);
    }

    private List<MetricFamilySamples> select(Set<String> requested) {
        List<MetricFamilySamples> selected = new ArrayList<>();
        Enumeration<MetricFamilySamples> all = registry.metricFamilySamples();
        while (all.hasMoreElements()) {
            MetricFamilySamples family = all.nextElement();
            if (!family.name.startsWith(familyPrefix)) {
                continue;
            }
            if (requested.isEmpty() || family.samples.stream().anyMatch(s -> requested.contains(s.name))) {
                selected.add(family);
            }
        }
        return selected;
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get(NAME_PARAM);
        return values == null ? Collections.emptySet() : new HashSet<>(values);
    }
}
