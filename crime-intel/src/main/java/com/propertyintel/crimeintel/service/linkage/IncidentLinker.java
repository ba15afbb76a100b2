package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.IncidentRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import com.propertyintel.crimeintel.model.LinkageResult;
import com.propertyintel.crimeintel.model.LinkedIncident;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Finds evidence relating a set of seed incidents to each other and to
 * incidents known only to the graph store or search index.
 *
 * Every (seed, strategy) pair runs as its own task. Graph and search tasks
 * are bounded by the collaborator timeout and are not started once the
 * deadline has passed; whatever finished in time makes up the result.
 */
@Service
@Slf4j
public class IncidentLinker {

    static final String NO_INCIDENTS = "No incidents found for the provided IDs";
    static final String NO_LINKS = "No linkages found above the confidence threshold";

    private final IncidentResolver resolver;
    private final List<EvidenceStrategy> strategies;
    private final CrimeIntelProperties.Linkage linkage;
    private final Executor executor;

    public IncidentLinker(IncidentResolver resolver,
                          List<EvidenceStrategy> strategies,
                          CrimeIntelProperties properties,
                          @Qualifier("analysisExecutor") Executor executor) {
        this.resolver = resolver;
        this.strategies = List.copyOf(strategies);
        this.linkage = properties.getLinkage();
        this.executor = executor;
    }

    public LinkageResult link(Collection<String> incidentIds) {
        return link(incidentIds, Instant.now().plus(linkage.getLinkDeadline()));
    }

    public LinkageResult link(Collection<String> incidentIds, Instant deadline) {
        List<String> seeds = incidentIds == null ? List.of() : incidentIds.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .distinct()
                .toList();
        if (seeds.isEmpty()) {
            return LinkageResult.empty(NO_INCIDENTS);
        }

        Map<String, IncidentRecord> resolved = new LinkedHashMap<>(resolver.resolve(seeds, deadline));
        List<IncidentRecord> batch = List.copyOf(resolved.values());

        List<CompletableFuture<List<LinkageEdge>>> tasks = new ArrayList<>();
        int skipped = 0;
        for (IncidentRecord incident : batch) {
            for (EvidenceStrategy strategy : strategies) {
                if (!strategy.isAvailable()) continue;
                if (strategy.usesCollaborator() && CollaboratorCalls.expired(deadline)) {
                    skipped++;
                    continue;
                }
                tasks.add(submit(strategy, incident, batch, deadline));
            }
        }
        if (skipped > 0) {
            log.warn("Linkage deadline passed, skipped {} graph/search task(s)", skipped);
        }

        List<LinkageEdge> edges = new ArrayList<>();
        for (CompletableFuture<List<LinkageEdge>> task : tasks) {
            edges.addAll(task.join());
        }

        List<LinkageEdge> linkages = deduplicate(edges);
        log.info("Linked {} seed incident(s): {} candidate edge(s), {} after deduplication",
                seeds.size(), edges.size(), linkages.size());

        Set<String> nodeIds = new LinkedHashSet<>(seeds);
        for (LinkageEdge edge : linkages) {
            nodeIds.add(edge.getSourceIncidentId());
            nodeIds.add(edge.getTargetIncidentId());
        }
        List<String> unresolved = nodeIds.stream().filter(id -> !resolved.containsKey(id)).toList();
        if (!unresolved.isEmpty()) {
            resolved.putAll(resolver.resolve(unresolved, deadline));
        }

        List<LinkedIncident> linkedIncidents = nodeIds.stream()
                .map(id -> LinkedIncident.of(resolved.get(id)))
                .toList();

        return LinkageResult.builder()
                .linkedIncidents(linkedIncidents)
                .linkages(linkages)
                .confidenceScores(confidenceScores(nodeIds, linkages))
                .explanations(explanations(linkages))
                .build();
    }

    private CompletableFuture<List<LinkageEdge>> submit(EvidenceStrategy strategy, IncidentRecord incident,
                                                         List<IncidentRecord> batch, Instant deadline) {
        String label = strategy.getType().getValue() + " evidence for " + incident.getIncidentId();
        if (strategy.usesCollaborator()) {
            return CollaboratorCalls.submit(label, () -> strategy.findLinks(incident, batch), executor,
                    linkage.getCollaboratorTimeout(), deadline, List.of());
        }
        try {
            return CompletableFuture.supplyAsync(() -> strategy.findLinks(incident, batch), executor)
                    .exceptionally(ex -> {
                        log.warn("{} failed: {}", label, ex.getMessage());
                        return List.of();
                    });
        } catch (RejectedExecutionException e) {
            log.debug("Executor saturated, running {} inline", label);
            try {
                return CompletableFuture.completedFuture(strategy.findLinks(incident, batch));
            } catch (RuntimeException ex) {
                log.warn("{} failed: {}", label, ex.getMessage());
                return CompletableFuture.completedFuture(List.of());
            }
        }
    }

    /** One edge per (source, target, type), the most confident one, in first-seen order. */
    static List<LinkageEdge> deduplicate(List<LinkageEdge> edges) {
        Map<LinkageEdge.Key, LinkageEdge> best = new LinkedHashMap<>();
        for (LinkageEdge edge : edges) {
            if (edge.getSourceIncidentId() == null || edge.getTargetIncidentId() == null
                    || edge.getSourceIncidentId().equals(edge.getTargetIncidentId())) {
                continue;
            }
            best.merge(edge.key(), edge, (kept, candidate) ->
                    candidate.getConfidence() > kept.getConfidence() ? candidate : kept);
        }
        return List.copyOf(best.values());
    }

    private static Map<String, Double> confidenceScores(Set<String> nodeIds, List<LinkageEdge> linkages) {
        Map<String, Double> scores = new LinkedHashMap<>();
        nodeIds.forEach(id -> scores.put(id, 0.0));
        for (LinkageEdge edge : linkages) {
            scores.merge(edge.getSourceIncidentId(), edge.getConfidence(), Math::max);
            scores.merge(edge.getTargetIncidentId(), edge.getConfidence(), Math::max);
        }
        return scores;
    }

    private static List<String> explanations(List<LinkageEdge> linkages) {
        if (linkages.isEmpty()) return List.of(NO_LINKS);
        return linkages.stream()
                .map(edge -> String.format(Locale.ROOT, "%s: %s -> %s (confidence: %.2f) - %s",
                        edge.getLinkageType().getValue(),
                        edge.getSourceIncidentId(),
                        edge.getTargetIncidentId(),
                        edge.getConfidence(),
                        edge.getExplanation()))
                .toList();
    }
}
