package com.archivum.orchestrator.workflow;

import java.util.Map;
import java.util.Optional;

/**
 * Chooses the next Link from one processing configuration option.
 *
 * Choice keys are canonical option values (see
 * {@link com.archivum.orchestrator.processing.ProcessingOption#canonicalize}).
 * The loader guarantees that either every value of the option has a choice
 * or {@code fallback} is set.
 */
public record DecisionAction(
        String                   option,
        Map<String, RouteTarget> choices,
        RouteTarget              fallback) implements LinkAction {

    public DecisionAction {
        choices = Map.copyOf(choices);
    }

    public Optional<RouteTarget> choose(String value) {
        RouteTarget target = choices.get(value);
        return target != null ? Optional.of(target) : Optional.ofNullable(fallback);
    }

    @Override
    public ActionType type() { return ActionType.DECISION; }
}
