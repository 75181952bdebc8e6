package com.archivum.orchestrator.workflow;

import com.archivum.orchestrator.processing.ProcessingOption;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Loading is where every graph error must surface; traversal never meets one.
 */
class WorkflowGraphLoaderTest {

    private static final Pattern CONFIG_ARGUMENT = Pattern.compile("%config:(\\w+)%");

    private final WorkflowGraphLoader loader = new WorkflowGraphLoader(new ObjectMapper());

    private WorkflowGraph parse(String json) throws IOException {
        return loader.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void load_shippedWorkflow_isValid() {
        WorkflowGraph graph = loader.load(new ClassPathResource("workflow/workflow.json"));

        assertThat(graph.entryLink().id()).isEqualTo("start-transfer");
        assertThat(graph.links()).extracting(Link::id).contains("store-aip");
        assertThat(graph.resolve("decide-normalize").isDecision()).isTrue();
    }

    @Test
    void load_shippedWorkflow_readsEveryProcessingOption() {
        WorkflowGraph graph = loader.load(new ClassPathResource("workflow/workflow.json"));

        Set<String> read = new HashSet<>();
        for (Link link : graph.links()) {
            if (link.action() instanceof DecisionAction decision) {
                read.add(decision.option());
            } else if (link.action() instanceof RunAction run) {
                for (String argument : run.arguments()) {
                    Matcher m = CONFIG_ARGUMENT.matcher(argument);
                    while (m.find()) {
                        read.add(m.group(1));
                    }
                }
            }
        }

        assertThat(read).containsAll(Arrays.stream(ProcessingOption.values()).map(ProcessingOption::key).toList());
    }

    @Test
    void load_shippedWorkflow_identifiesSubmissionDocumentationAndMetadataSeparately() {
        WorkflowGraph graph = loader.load(new ClassPathResource("workflow/workflow.json"));

        RunAction submission = (RunAction) graph.resolve("identify-submission-documentation").action();
        RunAction metadata   = (RunAction) graph.resolve("identify-metadata").action();

        assertThat(submission.tool()).isEqualTo("identify_format");
        assertThat(submission.perFile()).isTrue();
        assertThat(submission.filterSubdir()).isEqualTo("objects/submissionDocumentation");
        assertThat(metadata.tool()).isEqualTo("identify_format");
        assertThat(metadata.filterSubdir()).isEqualTo("objects/metadata");
        assertThat(((DecisionAction) graph.resolve("decide-identify-submission-and-metadata").action()).option())
                .isEqualTo("identify_submission_and_metadata");
    }

    @Test
    void load_chainTarget_resolvesToFirstLinkOfChain() {
        WorkflowGraph graph = loader.load(new ClassPathResource("workflow/test-workflow.json"));

        DecisionAction decision = (DecisionAction) graph.resolve("decide-normalize").action();
        assertThat(decision.choose("false")).contains(RouteTarget.link("name-aip"));
        assertThat(graph.resolve("normalize").routing().route(7)).contains(RouteTarget.link("name-aip"));
        assertThat(graph.resolve("name-aip").chainId()).isEqualTo("finish");
    }

    @Test
    void load_runAction_readsAllFields() {
        WorkflowGraph graph = loader.load(new ClassPathResource("workflow/test-workflow.json"));

        RunAction scan = (RunAction) graph.resolve("scan").action();
        assertThat(scan.tool()).isEqualTo("scan");
        assertThat(scan.perFile()).isTrue();
        assertThat(scan.unanimous()).isTrue();
        assertThat(scan.arguments()).containsExactly("%inputFile%", "%taskOutputDirectory%");

        RunAction normalize = (RunAction) graph.resolve("normalize").action();
        assertThat(normalize.unanimous()).isFalse();
    }

    @Test
    void resolve_unknownId_throwsUnknownLink() {
        WorkflowGraph graph = loader.load(new ClassPathResource("workflow/test-workflow.json"));

        assertThatThrownBy(() -> graph.resolve("nope"))
                .isInstanceOfSatisfying(UnknownLinkException.class,
                        e -> assertThat(e.getLinkId()).isEqualTo("nope"));
    }

    @Test
    void parse_routeToMissingLink_failsAtLoad() {
        assertThatThrownBy(() -> parse("""
                {"entry_chain": "c", "chains": {"c": {"links": ["a"]}},
                 "links": {"a": {"action": {"type": "pass"}, "default": {"link": "ghost"}}}}
                """))
                .isInstanceOf(UnknownLinkException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void parse_chainListsMissingLink_failsAtLoad() {
        assertThatThrownBy(() -> parse("""
                {"entry_chain": "c", "chains": {"c": {"links": ["a", "b"]}},
                 "links": {"a": {"action": {"type": "pass"}, "default": {"outcome": "complete"}}}}
                """))
                .isInstanceOf(UnknownLinkException.class);
    }

    @Test
    void parse_runLinkWithoutDefault_isRejected() {
        assertThatThrownBy(() -> parse("""
                {"entry_chain": "c", "chains": {"c": {"links": ["a"]}},
                 "links": {"a": {"action": {"type": "run", "tool": "t"},
                                 "exit_codes": {"0": {"outcome": "complete"}}}}}
                """))
                .isInstanceOf(WorkflowGraphException.class)
                .hasMessageContaining("no default");
    }

    @Test
    void parse_decisionNotCoveringDomain_isRejected() {
        assertThatThrownBy(() -> parse("""
                {"entry_chain": "c", "chains": {"c": {"links": ["d"]}},
                 "links": {"d": {"action": {"type": "decision", "option": "normalize",
                                            "choices": {"true": {"outcome": "complete"}}}}}}
                """))
                .isInstanceOf(WorkflowGraphException.class)
                .hasMessageContaining("false");
    }

    @Test
    void parse_decisionWithDefault_mayCoverPartOfDomain() throws IOException {
        WorkflowGraph graph = parse("""
                {"entry_chain": "c", "chains": {"c": {"links": ["d"]}},
                 "links": {"d": {"action": {"type": "decision", "option": "aip_compression_algorithm",
                                            "choices": {"TAR_GZIP": {"outcome": "reject"}}},
                                 "default": {"outcome": "complete"}}}}
                """);

        DecisionAction decision = (DecisionAction) graph.resolve("d").action();
        assertThat(decision.choose("tar-gzip")).contains(RouteTarget.terminal(Outcome.REJECT));
        assertThat(decision.choose("7z-lzma")).contains(RouteTarget.terminal(Outcome.COMPLETE));
    }

    @Test
    void parse_decisionOnUnknownOption_isRejected() {
        assertThatThrownBy(() -> parse("""
                {"entry_chain": "c", "chains": {"c": {"links": ["d"]}},
                 "links": {"d": {"action": {"type": "decision", "option": "make_coffee", "choices": {}},
                                 "default": {"outcome": "complete"}}}}
                """))
                .isInstanceOf(WorkflowGraphException.class)
                .hasMessageContaining("make_coffee");
    }

    @Test
    void parse_linkInTwoChains_isRejected() {
        assertThatThrownBy(() -> parse("""
                {"entry_chain": "c1", "chains": {"c1": {"links": ["a"]}, "c2": {"links": ["a"]}},
                 "links": {"a": {"action": {"type": "pass"}, "default": {"outcome": "complete"}}}}
                """))
                .isInstanceOf(WorkflowGraphException.class)
                .hasMessageContaining("belongs to chains");
    }

    @Test
    void parse_missingEntryChain_isRejected() {
        assertThatThrownBy(() -> parse("""
                {"entry_chain": "nope", "chains": {"c": {"links": ["a"]}},
                 "links": {"a": {"action": {"type": "pass"}, "default": {"outcome": "complete"}}}}
                """))
                .isInstanceOf(WorkflowGraphException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void parse_unknownActionType_isRejected() {
        assertThatThrownBy(() -> parse("""
                {"entry_chain": "c", "chains": {"c": {"links": ["a"]}},
                 "links": {"a": {"action": {"type": "teleport"}, "default": {"outcome": "complete"}}}}
                """))
                .isInstanceOf(WorkflowGraphException.class)
                .hasMessageContaining("teleport");
    }
}
