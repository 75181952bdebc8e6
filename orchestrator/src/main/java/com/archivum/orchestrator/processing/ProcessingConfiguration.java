package com.archivum.orchestrator.processing;

import java.util.Map;
import java.util.Optional;

/**
 * Processing switches resolved for one package at submission time.
 *
 * Immutable: stored on the Transfer as JSON and never changed while the package
 * is processed. Decision links read it through {@link #find}; a missing option
 * is the caller's error to report, never defaulted here.
 *
 * @param version the {@link ProcessingOption#VERSION} the options were validated against
 * @param options option key to canonical value
 */
public record ProcessingConfiguration(int version, Map<String, String> options) {

    public ProcessingConfiguration {
        options = Map.copyOf(options);
    }

    public Optional<String> find(String optionKey) {
        return Optional.ofNullable(options.get(optionKey));
    }

    public boolean isEnabled(ProcessingOption option) {
        return "true".equals(options.get(option.key()));
    }
}
