package com.archivum.orchestrator.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Exit-code routing for one Link.
 *
 * Lookup order: exact code, then the range containing the code, then the
 * default entry. Ranges are inclusive and never overlap (checked on build).
 */
public final class RoutingTable {

    public record CodeRange(int from, int to, RouteTarget target) {
        boolean contains(int code) {
            return code >= from && code <= to;
        }
    }

    private final Map<Integer, RouteTarget> exact;
    private final List<CodeRange> ranges;
    private final RouteTarget fallback;

    private RoutingTable(Map<Integer, RouteTarget> exact, List<CodeRange> ranges, RouteTarget fallback) {
        this.exact    = Collections.unmodifiableMap(new LinkedHashMap<>(exact));
        this.ranges   = List.copyOf(ranges);
        this.fallback = fallback;
    }

    /**
     * Route an exit code.
     *
     * @return the target, or empty when the code is unmapped and there is no default
     */
    public Optional<RouteTarget> route(int exitCode) {
        RouteTarget hit = exact.get(exitCode);
        if (hit != null) return Optional.of(hit);
        for (CodeRange range : ranges) {
            if (range.contains(exitCode)) return Optional.of(range.target());
        }
        return Optional.ofNullable(fallback);
    }

    public boolean hasDefault()                  { return fallback != null; }
    public Map<Integer, RouteTarget> exactCodes(){ return exact; }
    public List<CodeRange> ranges()              { return ranges; }

    /** Every target in the table, default included. */
    public List<RouteTarget> targets() {
        List<RouteTarget> all = new ArrayList<>(exact.values());
        ranges.forEach(r -> all.add(r.target()));
        if (fallback != null) all.add(fallback);
        return all;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Integer, RouteTarget> exact = new LinkedHashMap<>();
        private final List<CodeRange> ranges = new ArrayList<>();
        private RouteTarget fallback;

        public Builder code(int code, RouteTarget target) {
            if (exact.putIfAbsent(code, target) != null) {
                throw new WorkflowGraphException("Exit code " + code + " mapped twice");
            }
            return this;
        }

        public Builder range(int from, int to, RouteTarget target) {
            if (from > to) {
                throw new WorkflowGraphException("Invalid exit code range " + from + "-" + to);
            }
            for (CodeRange other : ranges) {
                if (from <= other.to() && other.from() <= to) {
                    throw new WorkflowGraphException("Exit code range " + from + "-" + to
                            + " overlaps " + other.from() + "-" + other.to());
                }
            }
            ranges.add(new CodeRange(from, to, target));
            return this;
        }

        /**
         * Parses a JSON key: either a single code ("2") or an inclusive range ("1-9").
         * Negative single codes are allowed ("-1").
         */
        public Builder entry(String key, RouteTarget target) {
            String k = key.strip();
            int dash = k.indexOf('-', 1);
            try {
                if (dash < 0) {
                    return code(Integer.parseInt(k), target);
                }
                return range(Integer.parseInt(k.substring(0, dash)),
                             Integer.parseInt(k.substring(dash + 1)), target);
            } catch (NumberFormatException e) {
                throw new WorkflowGraphException("Malformed exit code key '" + key + "'", e);
            }
        }

        public Builder fallback(RouteTarget target) {
            this.fallback = target;
            return this;
        }

        public RoutingTable build() {
            return new RoutingTable(exact, ranges, fallback);
        }
    }
}
