package dev.nuclr.plugin.core.render.parallel.pool;

import dev.nuclr.plugin.core.render.parallel.backend.DocumentLock;
import dev.nuclr.plugin.core.render.parallel.backend.LoadedPage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch-scoped holding area for pages loaded by pool workers.
 *
 * <p>Workers hand every page they load to the collector instead of closing
 * it. Once the batch has completed, the coordinator closes them all, newest
 * first, with the document lock held. The collector owns each page from
 * {@link #add} on; {@link #closeAll} is the only path that closes them and
 * may run once.
 */
@Slf4j
public final class PageHandleCollector {

    private final List<LoadedPage> pages = new ArrayList<>();
    private boolean drained;

    public synchronized void add(LoadedPage page) {
        if (page == null) return;
        if (drained) throw new IllegalStateException("Collector already drained");
        pages.add(page);
    }

    /** Acquire the document lock, then close every collected page. */
    public void closeAllUnderLock(DocumentLock lock) {
        try (DocumentLock.Guard guard = lock.acquire()) {
            closeAll(lock, guard);
        }
    }

    /**
     * Close every collected page in reverse insertion order.
     *
     * @param lock  the document lock the pages were loaded under
     * @param guard proof that the calling thread holds {@code lock}
     */
    public synchronized void closeAll(DocumentLock lock, DocumentLock.Guard guard) {
        if (guard == null || !guard.guards(lock)) {
            throw new IllegalStateException("Document lock not held by " + Thread.currentThread().getName());
        }
        if (drained) throw new IllegalStateException("Collector already drained");
        drained = true;

        log.debug("Closing {} deferred pages", pages.size());
        for (int i = pages.size() - 1; i >= 0; i--) {
            LoadedPage page = pages.get(i);
            try {
                page.close();
            } catch (RuntimeException e) {
                log.warn("Error closing page {}", page.pageIndex(), e);
            }
        }
        pages.clear();
    }

    public synchronized int pendingCount() {
        return pages.size();
    }

    public synchronized boolean isDrained() {
        return drained;
    }
}
