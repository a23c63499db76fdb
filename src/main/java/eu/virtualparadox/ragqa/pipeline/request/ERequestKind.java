package eu.virtualparadox.ragqa.pipeline.request;

public enum ERequestKind {
    INGEST,
    QUERY
}
