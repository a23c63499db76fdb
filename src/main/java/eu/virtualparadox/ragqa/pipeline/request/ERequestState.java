package eu.virtualparadox.ragqa.pipeline.request;

public enum ERequestState {
    RECEIVED,
    // ingestion
    CHUNKED,
    EMBEDDED,
    INDEXED,
    // query
    EMBEDDED_QUERY,
    RETRIEVED,
    SYNTHESIZED,
    ANSWERED,
    FAILED;

    public boolean isTerminal() {
        return this == INDEXED || this == ANSWERED || this == FAILED;
    }
}
