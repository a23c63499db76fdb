package eu.virtualparadox.ragqa.pipeline.request;

import eu.virtualparadox.ragqa.error.EErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestRegistryTest {

    @Test
    @DisplayName("New requests start RECEIVED with increasing ids")
    void create() {
        RequestRegistry registry = new RequestRegistry(10);
        RagRequest first = registry.create(ERequestKind.INGEST, "doc1");
        RagRequest second = registry.create(ERequestKind.QUERY, "why?");

        assertThat(second.getId()).isGreaterThan(first.getId());
        assertThat(first.getState()).isEqualTo(ERequestState.RECEIVED);
        assertThat(second.getKind()).isEqualTo(ERequestKind.QUERY);
        assertThat(second.getSubject()).isEqualTo("why?");
        assertThat(registry.get(first.getId())).containsSame(first);
    }

    @Test
    @DisplayName("Terminal states accept no further transitions")
    void terminal() {
        RequestRegistry registry = new RequestRegistry(10);
        RagRequest request = registry.create(ERequestKind.INGEST, "doc1");
        registry.advance(request, ERequestState.CHUNKED);
        registry.advance(request, ERequestState.EMBEDDED);
        registry.advance(request, ERequestState.INDEXED);

        assertThatThrownBy(() -> registry.advance(request, ERequestState.CHUNKED))
                .isInstanceOf(IllegalStateException.class);

        // failing a finished request keeps its outcome
        registry.fail(request, EErrorKind.INDEX, "late");
        assertThat(request.getState()).isEqualTo(ERequestState.INDEXED);
        assertThat(request.getError()).isNull();
    }

    @Test
    @DisplayName("Failure records kind and message")
    void fail() {
        RequestRegistry registry = new RequestRegistry(10);
        RagRequest request = registry.create(ERequestKind.QUERY, "q");
        registry.advance(request, ERequestState.EMBEDDED_QUERY);
        registry.fail(request, EErrorKind.PROVIDER, "timeout");

        assertThat(request.getState()).isEqualTo(ERequestState.FAILED);
        assertThat(request.getErrorKind()).isEqualTo(EErrorKind.PROVIDER);
        assertThat(request.getError()).isEqualTo("timeout");
        assertThat(request.getHistory()).containsExactly(
                ERequestState.RECEIVED, ERequestState.EMBEDDED_QUERY, ERequestState.FAILED);
    }

    @Test
    @DisplayName("Oldest requests are evicted beyond capacity")
    void eviction() {
        RequestRegistry registry = new RequestRegistry(2);
        RagRequest first = registry.create(ERequestKind.QUERY, "1");
        RagRequest second = registry.create(ERequestKind.QUERY, "2");
        RagRequest third = registry.create(ERequestKind.QUERY, "3");

        assertThat(registry.get(first.getId())).isEmpty();
        assertThat(registry.get(second.getId())).isPresent();
        assertThat(registry.get(third.getId())).isPresent();
    }
}
