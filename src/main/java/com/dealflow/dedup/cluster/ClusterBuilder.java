package com.dealflow.dedup.cluster;

import com.dealflow.dedup.api.DetectionConfig;
import com.dealflow.dedup.api.DetectionOptions;
import com.dealflow.dedup.api.DuplicateDetectionService;
import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.DetectionOperation;
import com.dealflow.dedup.core.model.DetectionResult;
import com.dealflow.dedup.core.model.DuplicateCluster;
import com.dealflow.dedup.core.model.EntityKind;
import com.dealflow.dedup.core.model.MatchCandidate;
import com.dealflow.dedup.logging.LogContext;
import com.dealflow.dedup.metrics.MetricsService;
import com.dealflow.dedup.tracing.Span;
import com.dealflow.dedup.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

/**
 * Groups transitively related duplicates into clusters.
 *
 * <p>Every record is checked against the other input records at the high confidence
 * threshold. Each reported match becomes an undirected edge, and every connected
 * component with at least two members becomes an {@link DuplicateCluster#active active}
 * cluster. Components are found with an explicit stack, so deep chains cannot
 * overflow the call stack.</p>
 *
 * <p>The pairwise step is quadratic in the number of records.</p>
 */
public class ClusterBuilder {
    private static final Logger log = LoggerFactory.getLogger(ClusterBuilder.class);

    private final DuplicateDetectionService detectionService;
    private final DetectionConfig config;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public ClusterBuilder(DuplicateDetectionService detectionService, MetricsService metricsService,
                          TracingService tracingService) {
        this.detectionService = detectionService;
        this.config = detectionService.getConfig();
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    public List<DuplicateCluster> cluster(List<ComparableRecord> records) {
        return cluster(records, EntityKind.DEAL);
    }

    public List<DuplicateCluster> cluster(List<ComparableRecord> records, EntityKind kind) {
        try (LogContext ctx = LogContext.forCluster(LogContext.currentOrNewCorrelationId(), kind);
             Span span = tracingService.startSpan(DetectionOperation.CLUSTER, kind)) {
            span.setAttribute("records", records.size());
            log.info("Clustering {} {} records", records.size(), kind.getTag());

            DetectionOptions options = pairwiseOptions(records, kind);
            Map<String, DetectionResult> results = new LinkedHashMap<>();
            for (ComparableRecord record : records) {
                if (record.hasId()) {
                    results.put(record.getId(), detectionService.detect(record, options));
                }
            }

            List<DuplicateCluster> clusters = extractClusters(results, kind);
            span.setAttribute("clusters", clusters.size());
            span.succeed();
            return clusters;
        }
    }

    /**
     * Options used for the pairwise step: the input records as the pool and the
     * high confidence threshold.
     */
    public DetectionOptions pairwiseOptions(List<ComparableRecord> records, EntityKind kind) {
        return DetectionOptions.builder()
                .candidates(records)
                .threshold(config.getHighConfidenceThreshold())
                .entityKind(kind)
                .build();
    }

    /**
     * Builds clusters from pairwise results computed elsewhere.
     *
     * @param results detection results keyed by record id, in a stable order
     */
    public List<DuplicateCluster> extractClusters(Map<String, DetectionResult> results, EntityKind kind) {
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        Map<String, Double> edgeConfidence = new HashMap<>();

        for (Entry<String, DetectionResult> entry : results.entrySet()) {
            if (!entry.getValue().isDuplicate()) {
                continue;
            }
            String id = entry.getKey();
            for (MatchCandidate match : entry.getValue().matches()) {
                String other = match.matchedEntityId();
                if (id.equals(other)) {
                    continue;
                }
                adjacency.computeIfAbsent(id, k -> new LinkedHashSet<>()).add(other);
                adjacency.computeIfAbsent(other, k -> new LinkedHashSet<>()).add(id);
                edgeConfidence.merge(edgeKey(id, other), match.confidence(), Math::max);
            }
        }

        List<DuplicateCluster> clusters = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String start : adjacency.keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            List<String> component = collectComponent(start, adjacency, visited);
            if (component.size() > 1) {
                clusters.add(DuplicateCluster.active(kind, component, scoreOf(component, edgeConfidence)));
            }
        }

        metricsService.incrementClustersFound(clusters.size());
        log.info("Duplicate clustering completed: records={} clusters={}", results.size(), clusters.size());
        return clusters;
    }

    private static List<String> collectComponent(String start, Map<String, Set<String>> adjacency,
                                                 Set<String> visited) {
        List<String> component = new ArrayList<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);
        visited.add(start);

        while (!stack.isEmpty()) {
            String node = stack.pop();
            component.add(node);
            for (String neighbour : adjacency.getOrDefault(node, Set.of())) {
                if (visited.add(neighbour)) {
                    stack.push(neighbour);
                }
            }
        }
        return component;
    }

    private double scoreOf(List<String> members, Map<String, Double> edgeConfidence) {
        if (config.getClusterScoring() == ClusterScoring.PLACEHOLDER) {
            return config.getClusterPlaceholderConfidence();
        }
        double sum = 0.0;
        int edges = 0;
        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                Double confidence = edgeConfidence.get(edgeKey(members.get(i), members.get(j)));
                if (confidence != null) {
                    sum += confidence;
                    edges++;
                }
            }
        }
        return edges == 0 ? config.getClusterPlaceholderConfidence() : sum / edges;
    }

    private static String edgeKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + DuplicateCluster.KEY_SEPARATOR + b : b + DuplicateCluster.KEY_SEPARATOR + a;
    }
}
