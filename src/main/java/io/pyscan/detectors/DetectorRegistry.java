package io.pyscan.detectors;

import io.pyscan.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Registry of all available detectors.
 * Runs detectors in registration order and concatenates their findings.
 */
public class DetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final List<Detector> detectors;
    private final Set<String> disabledIds;

    private DetectorRegistry(List<Detector> detectors, Set<String> disabledIds) {
        this.detectors = List.copyOf(detectors);
        this.disabledIds = Set.copyOf(disabledIds);
    }

    /**
     * Creates a registry with all default detectors.
     * Undefined names come first, runtime patterns second.
     */
    public static DetectorRegistry createDefault() {
        return new DetectorRegistry(List.of(
                new UndefinedNameDetector(),
                new RuntimePatternDetector()
        ), Set.of());
    }

    /**
     * Creates a registry with specific detectors.
     */
    public static DetectorRegistry of(Detector... detectors) {
        return new DetectorRegistry(Arrays.asList(detectors), Set.of());
    }

    /**
     * Returns a copy that skips the given detector ids in {@link #runAll(AnalysisContext)}.
     */
    public DetectorRegistry withDisabled(Collection<String> ids) {
        Set<String> disabled = new HashSet<>(disabledIds);
        if (ids != null) {
            disabled.addAll(ids);
        }
        for (String id : disabled) {
            if (getById(id).isEmpty()) {
                log.warn("Unknown detector id '{}' in disabled list", id);
            }
        }
        return new DetectorRegistry(detectors, disabled);
    }

    /**
     * Runs all enabled detectors and returns aggregated findings.
     *
     * @param context The parsed source to analyze
     * @return All findings, grouped by detector in registration order
     */
    public List<Finding> runAll(AnalysisContext context) {
        List<Finding> allFindings = new ArrayList<>();
        for (Detector detector : detectors) {
            if (detector.enabledByDefault() && !disabledIds.contains(detector.id())) {
                allFindings.addAll(runSafely(detector, context));
            }
        }
        return allFindings;
    }

    /**
     * Runs specific detectors by ID, ignoring the disabled list.
     *
     * @param context     The parsed source to analyze
     * @param detectorIds IDs of detectors to run
     * @return All findings from specified detectors
     */
    public List<Finding> run(AnalysisContext context, Set<String> detectorIds) {
        List<Finding> allFindings = new ArrayList<>();
        for (Detector detector : detectors) {
            if (detectorIds.contains(detector.id())) {
                allFindings.addAll(runSafely(detector, context));
            }
        }
        return allFindings;
    }

    private List<Finding> runSafely(Detector detector, AnalysisContext context) {
        try {
            List<Finding> findings = detector.detect(context);
            log.debug("Detector '{}' produced {} finding(s)", detector.id(), findings.size());
            return findings;
        } catch (RuntimeException e) {
            log.warn("Detector '{}' failed and was skipped: {}", detector.id(), e.toString(), e);
            return List.of();
        } catch (StackOverflowError e) {
            log.warn("Detector '{}' ran out of stack on a deeply nested tree and was skipped", detector.id());
            return List.of();
        }
    }

    /**
     * Returns all registered detectors.
     */
    public List<Detector> allDetectors() {
        return detectors;
    }

    public Set<String> disabledIds() {
        return disabledIds;
    }

    /**
     * Returns a detector by ID, if present.
     */
    public Optional<Detector> getById(String id) {
        return detectors.stream()
                .filter(d -> d.id().equals(id))
                .findFirst();
    }
}
