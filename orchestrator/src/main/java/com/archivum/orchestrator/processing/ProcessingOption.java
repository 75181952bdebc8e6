package com.archivum.orchestrator.processing;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * The fixed set of processing switches a submission can set.
 *
 * Values are kept as canonical strings: "true"/"false" for booleans, the decimal
 * form for the compression level, and the wire name for enums. Decision links
 * and command templates only ever see canonical values.
 */
public enum ProcessingOption {
    ASSIGN_UUIDS_TO_DIRECTORIES("assign_uuids_to_directories"),
    EXAMINE_CONTENTS("examine_contents"),
    GENERATE_TRANSFER_STRUCTURE_REPORT("generate_transfer_structure_report"),
    DOCUMENT_EMPTY_DIRECTORIES("document_empty_directories"),
    EXTRACT_PACKAGES("extract_packages"),
    DELETE_PACKAGES_AFTER_EXTRACTION("delete_packages_after_extraction"),
    IDENTIFY_TRANSFER("identify_transfer"),
    // One switch, two identification jobs: submission documentation and metadata.
    IDENTIFY_SUBMISSION_AND_METADATA("identify_submission_and_metadata"),
    IDENTIFY_BEFORE_NORMALIZATION("identify_before_normalization"),
    NORMALIZE("normalize"),
    TRANSCRIBE_FILES("transcribe_files"),
    PERFORM_POLICY_CHECKS_ON_ORIGINALS("perform_policy_checks_on_originals"),
    PERFORM_POLICY_CHECKS_ON_PRESERVATION_DERIVATIVES("perform_policy_checks_on_preservation_derivatives"),
    PERFORM_POLICY_CHECKS_ON_ACCESS_DERIVATIVES("perform_policy_checks_on_access_derivatives"),
    AIP_COMPRESSION_LEVEL("aip_compression_level", Kind.INTEGER),
    AIP_COMPRESSION_ALGORITHM("aip_compression_algorithm", Kind.ENUM),
    THUMBNAIL_MODE("thumbnail_mode", Kind.ENUM);

    /** Bumped whenever an option is added, removed or changes meaning. */
    public static final int VERSION = 1;

    static final int MIN_COMPRESSION_LEVEL = 1;
    static final int MAX_COMPRESSION_LEVEL = 9;

    enum Kind { BOOLEAN, INTEGER, ENUM }

    private final String key;
    private final Kind   kind;

    ProcessingOption(String key) {
        this(key, Kind.BOOLEAN);
    }

    ProcessingOption(String key, Kind kind) {
        this.key  = key;
        this.kind = kind;
    }

    public String key() { return key; }

    public static Optional<ProcessingOption> fromKey(String key) {
        return Arrays.stream(values()).filter(o -> o.key.equals(key)).findFirst();
    }

    /** Every canonical value this option can take. */
    public List<String> domain() {
        return switch (kind) {
            case BOOLEAN -> List.of("true", "false");
            case INTEGER -> IntStream.rangeClosed(MIN_COMPRESSION_LEVEL, MAX_COMPRESSION_LEVEL)
                    .mapToObj(Integer::toString).toList();
            case ENUM -> this == AIP_COMPRESSION_ALGORITHM
                    ? Arrays.stream(CompressionAlgorithm.values()).map(CompressionAlgorithm::wireName).toList()
                    : Arrays.stream(ThumbnailMode.values()).map(ThumbnailMode::wireName).toList();
        };
    }

    /**
     * Normalise a submitted value.
     *
     * Enum values are accepted by wire name ("tar-gzip") or constant name
     * ("TAR_GZIP"), case-insensitively; "tar+gzip" is treated as "tar-gzip".
     *
     * @throws IllegalArgumentException when the value is outside the option's domain
     */
    public String canonicalize(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Option '" + key + "' has no value");
        }
        String value = raw.toString().strip().toLowerCase(Locale.ROOT);
        String canonical = switch (kind) {
            case BOOLEAN -> value.equals("true") || value.equals("false") ? value : null;
            case INTEGER -> canonicalLevel(value);
            case ENUM -> {
                String normalized = value.replace('+', '-').replace('_', '-');
                if (normalized.startsWith("s7-")) normalized = "7z-" + normalized.substring(3);
                yield domain().contains(normalized) ? normalized : null;
            }
        };
        if (canonical == null) {
            throw new IllegalArgumentException("Invalid value '" + raw + "' for option '" + key
                    + "'; expected one of " + domain());
        }
        return canonical;
    }

    private static String canonicalLevel(String value) {
        try {
            int level = Integer.parseInt(value);
            return level >= MIN_COMPRESSION_LEVEL && level <= MAX_COMPRESSION_LEVEL
                    ? Integer.toString(level) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
