package com.archivum.orchestrator.processing;

public enum ThumbnailMode {
    GENERATE("generate"),
    GENERATE_NON_DEFAULT("generate-non-default"),
    DO_NOT_GENERATE("do-not-generate");

    private final String wireName;

    ThumbnailMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
