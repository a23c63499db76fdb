package eu.virtualparadox.ragqa.ingest.chunker;

import eu.virtualparadox.ragqa.ingest.model.Passage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Labels passages of page-structured documents with the pages they cover.
 * <p>
 * Page starts are character offsets into the same text the passages were cut from;
 * entry {@code i} is where page {@code i + 1} begins. Labels read {@code p. 3} or {@code p. 3-4}.
 * </p>
 */
@Component
public class PageSpanResolver {

    /**
     * Returns copies of {@code passages} carrying a page label. Without page starts the
     * passages are returned unchanged.
     *
     * @param passages   passages in source order
     * @param pageStarts ascending page start offsets, may be empty
     * @return labelled passages, same order
     */
    public List<Passage> label(final List<Passage> passages, final List<Integer> pageStarts) {
        if (pageStarts == null || pageStarts.isEmpty()) {
            return passages;
        }

        final List<Passage> labelled = new ArrayList<>(passages.size());
        for (final Passage p : passages) {
            final int fromPage = pageOf(pageStarts, p.startChar());
            final int toPage = pageOf(pageStarts, Math.max(p.endChar() - 1, p.startChar()));
            labelled.add(p.withSection(format(fromPage, toPage)));
        }
        return labelled;
    }

    /**
     * 1-based page containing {@code offset}. Binary search over the page start offsets.
     */
    static int pageOf(final List<Integer> pageStarts, final int offset) {
        int lo = 0;
        int hi = pageStarts.size() - 1;
        int page = 0;
        while (lo <= hi) {
            final int mid = (lo + hi) >>> 1;
            if (pageStarts.get(mid) <= offset) {
                page = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return page + 1;
    }

    private static String format(final int fromPage, final int toPage) {
        return fromPage == toPage ? "p. " + fromPage : "p. " + fromPage + "-" + toPage;
    }
}
