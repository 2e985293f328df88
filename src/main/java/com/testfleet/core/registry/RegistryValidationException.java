package com.testfleet.core.registry;

import java.util.List;

/**
 * Raised at startup when the declared services or phases are inconsistent.
 * Carries every problem found, not just the first.
 */
public class RegistryValidationException extends RuntimeException {

    private final List<String> problems;

    public RegistryValidationException(List<String> problems) {
        super("Invalid pipeline configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
