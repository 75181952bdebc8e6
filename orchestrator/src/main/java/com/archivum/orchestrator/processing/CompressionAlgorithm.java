package com.archivum.orchestrator.processing;

/** AIP compression algorithm, as accepted on submission and exposed to templates. */
public enum CompressionAlgorithm {
    UNCOMPRESSED("uncompressed"),
    TAR("tar"),
    TAR_BZIP2("tar-bzip2"),
    TAR_GZIP("tar-gzip"),
    S7_COPY("7z-copy"),
    S7_BZIP2("7z-bzip2"),
    S7_LZMA("7z-lzma");

    private final String wireName;

    CompressionAlgorithm(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
