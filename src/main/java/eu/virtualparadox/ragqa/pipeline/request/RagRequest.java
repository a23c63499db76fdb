package eu.virtualparadox.ragqa.pipeline.request;

import eu.virtualparadox.ragqa.error.EErrorKind;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RagRequest {
    private final long id;
    private final ERequestKind kind;
    private final String subject;
    private final Instant createdAt;
    private final List<ERequestState> history;
    private volatile ERequestState state;
    private volatile EErrorKind errorKind;
    private volatile String error;

    public RagRequest(long id, ERequestKind kind, String subject) {
        this.id = id;
        this.kind = kind;
        this.subject = subject;
        this.createdAt = Instant.now();
        this.history = new CopyOnWriteArrayList<>();
        this.state = ERequestState.RECEIVED;
        this.history.add(ERequestState.RECEIVED);
    }

    public long getId() { return id; }
    public ERequestKind getKind() { return kind; }
    /** Source id for ingestions, the question for queries. */
    public String getSubject() { return subject; }
    public Instant getCreatedAt() { return createdAt; }
    public ERequestState getState() { return state; }
    public EErrorKind getErrorKind() { return errorKind; }
    public String getError() { return error; }

    /**
     * @return every state entered so far, oldest first
     */
    public List<ERequestState> getHistory() { return List.copyOf(history); }

    void moveTo(ERequestState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Request " + id + " already " + state + ", cannot move to " + next);
        }
        this.state = next;
        this.history.add(next);
    }

    void fail(EErrorKind kind, String message) {
        this.errorKind = kind;
        this.error = message;
        moveTo(ERequestState.FAILED);
    }
}
