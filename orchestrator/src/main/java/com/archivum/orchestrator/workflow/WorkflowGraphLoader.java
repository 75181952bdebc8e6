package com.archivum.orchestrator.workflow;

import com.archivum.orchestrator.processing.ProcessingOption;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses and validates the workflow graph JSON.
 *
 * Validation is eager and total: a graph that loads can be traversed without
 * ever meeting an unknown link, a chain with no links, a run/set/pass link
 * without a default route, or a decision that cannot resolve a valid option
 * value. Anything else is reported as a {@link WorkflowGraphException}
 * ({@link UnknownLinkException} for dangling references).
 *
 * <pre>
 * { "version": 1, "entry_chain": "...",
 *   "chains": { "id": { "description": "...", "links": ["..."] } },
 *   "links":  { "id": { "description", "group", "action": {...},
 *                       "exit_codes": { "0": target, "1-9": target }, "default": target } } }
 * target: {"link": id} | {"chain": id} | {"outcome": "complete|fail|reject"}
 * </pre>
 */
public class WorkflowGraphLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowGraphLoader.class);

    private final ObjectMapper json;

    public WorkflowGraphLoader(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public WorkflowGraph load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            WorkflowGraph graph = parse(in);
            log.info("Loaded workflow graph v{} from {}: {} chains, {} links",
                    graph.version(), resource.getDescription(), graph.chains().size(), graph.links().size());
            return graph;
        } catch (IOException e) {
            throw new WorkflowGraphException("Cannot read workflow graph from " + resource.getDescription(), e);
        }
    }

    public WorkflowGraph parse(InputStream in) throws IOException {
        return build(json.readTree(in));
    }

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    WorkflowGraph build(JsonNode root) {
        JsonNode linksNode  = required(root, "links", "workflow");
        JsonNode chainsNode = required(root, "chains", "workflow");
        String entryChainId = requiredText(root, "entry_chain", "workflow");
        int version = root.path("version").asInt(1);

        // Chains first: chain targets resolve to their first link.
        Map<String, Chain> chains = new LinkedHashMap<>();
        Map<String, String> chainOfLink = new HashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = chainsNode.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            List<String> linkIds = new ArrayList<>();
            required(e.getValue(), "links", "chain '" + e.getKey() + "'")
                    .forEach(n -> linkIds.add(n.asText()));
            Chain chain = new Chain(e.getKey(), e.getValue().path("description").asText(e.getKey()), linkIds);
            for (String linkId : chain.linkIds()) {
                if (!linksNode.has(linkId)) {
                    throw new UnknownLinkException(linkId, "chain:" + chain.id());
                }
                String previous = chainOfLink.putIfAbsent(linkId, chain.id());
                if (previous != null) {
                    throw new WorkflowGraphException("Link '" + linkId + "' belongs to chains '"
                            + previous + "' and '" + chain.id() + "'");
                }
            }
            chains.put(chain.id(), chain);
        }
        if (!chains.containsKey(entryChainId)) {
            throw new WorkflowGraphException("Entry chain '" + entryChainId + "' is not defined");
        }

        Map<String, Link> links = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = linksNode.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            links.put(e.getKey(), parseLink(e.getKey(), e.getValue(), chainOfLink.get(e.getKey()),
                    linksNode, chains));
        }

        warnUnreachable(chains.get(entryChainId).firstLinkId(), links);
        return new WorkflowGraph(version, entryChainId, chains, links);
    }

    private Link parseLink(String id, JsonNode node, String chainId,
                           JsonNode allLinks, Map<String, Chain> chains) {
        String where = "link '" + id + "'";
        JsonNode actionNode = required(node, "action", where);
        ActionType type = ActionType.fromJson(requiredText(actionNode, "type", where + " action"));

        RoutingTable.Builder routing = RoutingTable.builder();
        JsonNode exitCodes = node.path("exit_codes");
        for (Iterator<Map.Entry<String, JsonNode>> it = exitCodes.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            routing.entry(e.getKey(), parseTarget(e.getValue(), id, allLinks, chains));
        }
        RouteTarget fallback = node.hasNonNull("default")
                ? parseTarget(node.get("default"), id, allLinks, chains) : null;
        routing.fallback(fallback);

        LinkAction action = switch (type) {
            case RUN -> parseRun(actionNode, where);
            case SET_VARIABLE -> new SetVariableAction(
                    requiredText(actionNode, "variable", where),
                    actionNode.path("value").asText(""));
            case PASS -> new PassAction();
            case DECISION -> parseDecision(actionNode, fallback, id, where, allLinks, chains);
        };

        if (type != ActionType.DECISION && fallback == null) {
            throw new WorkflowGraphException(where + " has no default exit code route");
        }
        if (type == ActionType.DECISION && exitCodes.size() > 0) {
            throw new WorkflowGraphException(where + " is a decision and cannot route on exit codes");
        }

        return new Link(id, chainId,
                node.path("description").asText(id),
                node.path("group").asText(""),
                action,
                routing.build());
    }

    private RunAction parseRun(JsonNode action, String where) {
        List<String> arguments = new ArrayList<>();
        action.path("arguments").forEach(n -> arguments.add(n.asText()));
        String filter = action.hasNonNull("filter_subdir") ? action.get("filter_subdir").asText() : null;
        boolean perFile = action.path("per_file").asBoolean(false);
        if (filter != null && !perFile) {
            throw new WorkflowGraphException(where + " sets filter_subdir without per_file");
        }
        return new RunAction(
                requiredText(action, "tool", where),
                arguments,
                perFile,
                filter,
                action.path("unanimous").asBoolean(true),
                action.path("timeout_seconds").asInt(0));
    }

    private DecisionAction parseDecision(JsonNode action, RouteTarget fallback, String id, String where,
                                         JsonNode allLinks, Map<String, Chain> chains) {
        String optionKey = requiredText(action, "option", where);
        ProcessingOption option = ProcessingOption.fromKey(optionKey).orElseThrow(() ->
                new WorkflowGraphException(where + " decides on unknown processing option '" + optionKey + "'"));

        Map<String, RouteTarget> choices = new HashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = required(action, "choices", where).fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            String value;
            try {
                value = option.canonicalize(e.getKey());
            } catch (IllegalArgumentException ex) {
                throw new WorkflowGraphException(where + ": " + ex.getMessage(), ex);
            }
            choices.put(value, parseTarget(e.getValue(), id, allLinks, chains));
        }

        if (fallback == null) {
            Set<String> uncovered = new HashSet<>(option.domain());
            uncovered.removeAll(choices.keySet());
            if (!uncovered.isEmpty()) {
                throw new WorkflowGraphException(where + " has no default and no choice for "
                        + optionKey + " values " + uncovered);
            }
        }
        return new DecisionAction(optionKey, choices, fallback);
    }

    private RouteTarget parseTarget(JsonNode node, String from, JsonNode allLinks, Map<String, Chain> chains) {
        if (node.hasNonNull("outcome")) {
            return RouteTarget.terminal(Outcome.fromTerminalName(node.get("outcome").asText()));
        }
        if (node.hasNonNull("link")) {
            String linkId = node.get("link").asText();
            if (!allLinks.has(linkId)) {
                throw new UnknownLinkException(linkId, from);
            }
            return RouteTarget.link(linkId);
        }
        if (node.hasNonNull("chain")) {
            Chain chain = chains.get(node.get("chain").asText());
            if (chain == null) {
                throw new UnknownLinkException(node.get("chain").asText(), from);
            }
            return RouteTarget.link(chain.firstLinkId());
        }
        throw new WorkflowGraphException("Link '" + from + "' has a route with no link, chain or outcome");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void warnUnreachable(String entryLinkId, Map<String, Link> links) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(List.of(entryLinkId));
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!seen.add(id)) continue;
            Link link = links.get(id);
            List<RouteTarget> targets = new ArrayList<>(link.routing().targets());
            if (link.action() instanceof DecisionAction decision) {
                targets.addAll(decision.choices().values());
            }
            targets.stream().filter(t -> !t.isTerminal()).forEach(t -> queue.add(t.linkId()));
        }
        links.keySet().stream()
                .filter(id -> !seen.contains(id))
                .forEach(id -> log.warn("Workflow link '{}' is unreachable from the entry chain", id));
    }

    private static JsonNode required(JsonNode node, String field, String where) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new WorkflowGraphException(where + " is missing '" + field + "'");
        }
        return value;
    }

    private static String requiredText(JsonNode node, String field, String where) {
        String text = required(node, field, where).asText();
        if (text.isBlank()) {
            throw new WorkflowGraphException(where + " has a blank '" + field + "'");
        }
        return text;
    }
}
