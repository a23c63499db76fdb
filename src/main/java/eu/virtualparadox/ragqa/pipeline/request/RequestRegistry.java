package eu.virtualparadox.ragqa.pipeline.request;

import eu.virtualparadox.ragqa.error.EErrorKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the most recent requests and their state progression, oldest evicted first.
 */
@Service
public class RequestRegistry {

    private final AtomicLong counter;
    private final Map<Long, RagRequest> requests;
    private final Queue<Long> order;
    private final int capacity;

    public RequestRegistry(@Value("${ragqa.requests.capacity:1000}") final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.counter = new AtomicLong(0);
        this.requests = new ConcurrentHashMap<>();
        this.order = new ConcurrentLinkedQueue<>();
        this.capacity = capacity;
    }

    public RagRequest create(final ERequestKind kind, final String subject) {
        final long id = counter.incrementAndGet();
        final RagRequest request = new RagRequest(id, kind, subject);
        requests.put(id, request);
        order.add(id);
        while (order.size() > capacity) {
            final Long eldest = order.poll();
            if (eldest != null) {
                requests.remove(eldest);
            }
        }
        return request;
    }

    public Optional<RagRequest> get(final long id) {
        return Optional.ofNullable(requests.get(id));
    }

    public void advance(final RagRequest request, final ERequestState state) {
        request.moveTo(state);
    }

    public void fail(final RagRequest request, final EErrorKind kind, final String message) {
        if (!request.getState().isTerminal()) {
            request.fail(kind, message);
        }
    }
}
