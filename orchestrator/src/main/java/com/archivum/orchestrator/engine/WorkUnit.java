package com.archivum.orchestrator.engine;

import com.archivum.orchestrator.model.Task;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * What one Task runs against: a single file of the workspace, or the package.
 *
 * File ids are derived from the transfer id and the relative path, so the same
 * file gets the same id on every enumeration. Resume relies on that.
 */
public record WorkUnit(String fileId, String relativePath) {

    public static WorkUnit wholePackage() {
        return new WorkUnit(Task.PACKAGE_FILE_ID, "");
    }

    public static WorkUnit forFile(UUID transferId, String relativePath) {
        String key = transferId + "/" + relativePath;
        return new WorkUnit(UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString(), relativePath);
    }

    public boolean isPackage() {
        return fileId.isEmpty();
    }
}
