package com.testfleet.core.registry;

import com.testfleet.core.config.TestfleetProperties;
import com.testfleet.core.model.PhaseSpec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, validated list of phases for a pipeline run.
 */
public record PhasePlan(List<PhaseSpec> phases) {

    static final String FILTER_PLACEHOLDER = "${filter}";

    public PhasePlan {
        phases = List.copyOf(phases);
        var problems = new ArrayList<String>();
        var seen = new HashSet<String>();
        for (var phase : phases) {
            if (phase.name() == null || phase.name().isBlank()) {
                problems.add("phase without a name");
                continue;
            }
            if (!seen.add(phase.name())) {
                problems.add("duplicate phase name '" + phase.name() + "'");
            }
            if (phase.commands().isEmpty()) {
                problems.add("phase " + phase.name() + ": no commands");
            }
            if (phase.filterExpression().isEmpty()
                    && phase.commands().stream().anyMatch(c -> c.contains(FILTER_PLACEHOLDER))) {
                problems.add("phase " + phase.name() + ": uses " + FILTER_PLACEHOLDER + " but declares no filter");
            }
            if (phase.timeout().isNegative() || phase.timeout().isZero()) {
                problems.add("phase " + phase.name() + ": timeout must be positive");
            }
        }
        if (!problems.isEmpty()) {
            throw new RegistryValidationException(problems);
        }
    }

    public static PhasePlan fromProperties(List<TestfleetProperties.Phase> declared) {
        var specs = new ArrayList<PhaseSpec>();
        for (var p : declared) {
            String filter = p.getFilter();
            specs.add(new PhaseSpec(
                    p.getName(),
                    p.getCommands(),
                    filter == null || filter.isBlank() ? Optional.empty() : Optional.of(filter),
                    p.isProducesCoverage(),
                    Path.of(p.getCoverageArtifact()),
                    p.isBlocking(),
                    p.getTimeout()
            ));
        }
        return new PhasePlan(specs);
    }

    public List<String> names() {
        return phases.stream().map(PhaseSpec::name).toList();
    }
}
