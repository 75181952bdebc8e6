package com.archivum.orchestrator.processing;

import com.archivum.orchestrator.config.ArchivumProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a submitted processing configuration and merges it over the
 * deployment defaults ({@code archivum.processing.defaults.*}).
 *
 * Every option must end up with a value; an option that is neither submitted
 * nor defaulted rejects the submission. Defaults are validated once, at startup.
 */
@Component
public class ProcessingConfigurationResolver {

    private static final Logger log = LoggerFactory.getLogger(ProcessingConfigurationResolver.class);

    private final Map<ProcessingOption, String> defaults;

    public ProcessingConfigurationResolver(ArchivumProperties properties) {
        this.defaults = canonicalize(properties.processing().defaults(), "default");
        log.info("Processing configuration v{} defaults: {}", ProcessingOption.VERSION, defaults);
    }

    /**
     * @param submitted option key to raw value (Boolean, Number or String); may be null
     * @throws InvalidConfigurationException on an unknown option, a bad value,
     *                                       or an option with no value at all
     */
    public ProcessingConfiguration resolve(Map<String, ?> submitted) {
        Map<ProcessingOption, String> merged = new EnumMap<>(ProcessingOption.class);
        merged.putAll(defaults);
        if (submitted != null) {
            merged.putAll(canonicalize(submitted, "submitted"));
        }

        List<String> missing = new ArrayList<>();
        for (ProcessingOption option : ProcessingOption.values()) {
            if (!merged.containsKey(option)) missing.add(option.key());
        }
        if (!missing.isEmpty()) {
            throw new InvalidConfigurationException("No value for processing options " + missing);
        }

        Map<String, String> options = new HashMap<>();
        merged.forEach((option, value) -> options.put(option.key(), value));
        return new ProcessingConfiguration(ProcessingOption.VERSION, options);
    }

    private static Map<ProcessingOption, String> canonicalize(Map<String, ?> raw, String source) {
        Map<ProcessingOption, String> result = new EnumMap<>(ProcessingOption.class);
        if (raw == null) return result;
        raw.forEach((key, value) -> {
            ProcessingOption option = ProcessingOption.fromKey(key).orElseThrow(() ->
                    new InvalidConfigurationException("Unknown " + source + " processing option '" + key + "'"));
            try {
                result.put(option, option.canonicalize(value));
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException(e.getMessage());
            }
        });
        return result;
    }
}
