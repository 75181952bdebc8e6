package com.archivum.orchestrator.engine;

import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces the exit codes of a Job's tasks to the one code used for routing.
 */
public final class ExitCodes {

    private ExitCodes() {}

    /**
     * With {@code unanimous}, the first nonzero code in file id order; otherwise 0.
     * An empty map (nothing to run) is 0.
     *
     * The result depends only on the (fileId, code) pairs, never on the order
     * tasks finished in.
     */
    public static int effective(Map<String, Integer> codesByFileId, boolean unanimous) {
        if (!unanimous) {
            return 0;
        }
        for (int code : new TreeMap<>(codesByFileId).values()) {
            if (code != 0) {
                return code;
            }
        }
        return 0;
    }
}
