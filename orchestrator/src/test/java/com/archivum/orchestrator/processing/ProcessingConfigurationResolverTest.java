package com.archivum.orchestrator.processing;

import com.archivum.orchestrator.config.TestProperties;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessingConfigurationResolverTest {

    /** A default for every option: booleans true, level 1, first enum value. */
    private static Map<String, String> completeDefaults() {
        return Arrays.stream(ProcessingOption.values())
                .collect(Collectors.toMap(ProcessingOption::key, o -> o.domain().get(0), (a, b) -> a, HashMap::new));
    }

    @Test
    void resolve_submittedValuesOverrideDefaults() {
        ProcessingConfigurationResolver resolver =
                new ProcessingConfigurationResolver(TestProperties.withDefaults(completeDefaults()));

        ProcessingConfiguration config = resolver.resolve(Map.of(
                "normalize", false,
                "aip_compression_level", 9,
                "aip_compression_algorithm", "TAR_GZIP"));

        assertThat(config.version()).isEqualTo(ProcessingOption.VERSION);
        assertThat(config.find("normalize")).contains("false");
        assertThat(config.find("aip_compression_level")).contains("9");
        assertThat(config.find("aip_compression_algorithm")).contains("tar-gzip");
        assertThat(config.isEnabled(ProcessingOption.EXTRACT_PACKAGES)).isTrue();
        assertThat(config.options()).hasSize(ProcessingOption.values().length);
    }

    @Test
    void resolve_nullSubmission_usesDefaults() {
        ProcessingConfigurationResolver resolver =
                new ProcessingConfigurationResolver(TestProperties.withDefaults(completeDefaults()));

        assertThat(resolver.resolve(null).options()).isEqualTo(completeDefaults());
    }

    @Test
    void resolve_unknownOption_isRejected() {
        ProcessingConfigurationResolver resolver =
                new ProcessingConfigurationResolver(TestProperties.withDefaults(completeDefaults()));

        assertThatThrownBy(() -> resolver.resolve(Map.of("make_coffee", true)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("make_coffee");
    }

    @Test
    void resolve_valueOutsideDomain_isRejected() {
        ProcessingConfigurationResolver resolver =
                new ProcessingConfigurationResolver(TestProperties.withDefaults(completeDefaults()));

        assertThatThrownBy(() -> resolver.resolve(Map.of("aip_compression_level", 12)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("aip_compression_level");
        assertThatThrownBy(() -> resolver.resolve(Map.of("normalize", "yes")))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> resolver.resolve(Map.of("thumbnail_mode", "sometimes")))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void resolve_optionWithoutValueOrDefault_isRejected() {
        Map<String, String> defaults = completeDefaults();
        defaults.remove("thumbnail_mode");
        ProcessingConfigurationResolver resolver =
                new ProcessingConfigurationResolver(TestProperties.withDefaults(defaults));

        assertThatThrownBy(() -> resolver.resolve(Map.of()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("thumbnail_mode");
        assertThat(resolver.resolve(Map.of("thumbnail_mode", "do-not-generate")).find("thumbnail_mode"))
                .contains("do-not-generate");
    }

    @Test
    void constructor_invalidDefault_failsFast() {
        Map<String, String> defaults = completeDefaults();
        defaults.put("normalize", "maybe");

        assertThatThrownBy(() -> new ProcessingConfigurationResolver(TestProperties.withDefaults(defaults)))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void canonicalize_acceptsLegacySpellings() {
        assertThat(ProcessingOption.AIP_COMPRESSION_ALGORITHM.canonicalize("tar+bzip2")).isEqualTo("tar-bzip2");
        assertThat(ProcessingOption.AIP_COMPRESSION_ALGORITHM.canonicalize("S7_LZMA")).isEqualTo("7z-lzma");
        assertThat(ProcessingOption.NORMALIZE.canonicalize(Boolean.TRUE)).isEqualTo("true");
        assertThat(ProcessingOption.AIP_COMPRESSION_LEVEL.canonicalize(" 3 ")).isEqualTo("3");
    }
}
