package dev.nuclr.plugin.core.render.parallel;

import dev.nuclr.plugin.core.render.parallel.pool.BitmapAllocator;
import dev.nuclr.plugin.core.render.parallel.pool.OutputFormat;
import dev.nuclr.plugin.core.render.parallel.pool.PageBitmap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParallelRendererTest {

    @TempDir
    Path dir;

    private final List<PageBitmap> allocated = Collections.synchronizedList(new ArrayList<>());
    private ParallelRenderer renderer;

    @BeforeEach
    void setUp() {
        BitmapAllocator recording = (w, h, f) -> {
            PageBitmap bitmap = PageBitmap.allocate(w, h, f);
            allocated.add(bitmap);
            return bitmap;
        };
        renderer = new ParallelRenderer(new ParallelRenderSettings(dir.resolve("render.properties")), 16, recording);
    }

    @AfterEach
    void tearDown() {
        renderer.close();
    }

    /**
     * Records every callback by page index. Inconsistencies are collected and
     * checked on the test thread by {@link #assertConsistent()}.
     */
    private static final class Results implements PageCallback {
        final Map<Integer, Boolean> outcomes = new ConcurrentHashMap<>();
        final AtomicInteger calls = new AtomicInteger();
        final Set<String> threads = ConcurrentHashMap.newKeySet();
        final List<String> violations = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onPage(int pageIndex, PageBitmap bitmap, Object userData, boolean success) {
            calls.incrementAndGet();
            threads.add(Thread.currentThread().getName());
            if (success != (bitmap != null)) {
                violations.add("page " + pageIndex + ": success=" + success + " bitmap=" + bitmap);
            }
            if (outcomes.put(pageIndex, success) != null) {
                violations.add("page " + pageIndex + " reported twice");
            }
        }

        void assertConsistent() {
            assertEquals(List.of(), violations);
        }
    }

    private static RenderOptions workers(int n) {
        return RenderOptions.builder().workerCount(n).build();
    }

    @Test
    void singlePageRendersInlineOnTheCallingThread() {
        FakeDocument doc = new FakeDocument(1, 5_000);
        Results results = new Results();

        assertEquals(1, renderer.recommendedWorkerCount(doc));
        assertTrue(renderer.renderPages(doc, 0, 1, 100, 100, RenderOptions.defaults(), results, null));

        assertEquals(1, results.calls.get());
        results.assertConsistent();
        assertEquals(Boolean.TRUE, results.outcomes.get(0));
        assertEquals(Set.of(Thread.currentThread().getName()), results.threads);
        assertEquals(0, renderer.workerCount());
        assertEquals(1, doc.closes());
    }

    @Test
    void lightDocumentUsesSixteenWorkersAndCompletesEveryPage() {
        FakeDocument doc = new FakeDocument(500, 500 * 5_000L);
        Results results = new Results();

        assertEquals(16, renderer.recommendedWorkerCount(doc));
        assertTrue(renderer.renderPagesPooled(doc, 0, 500, 30, 40, RenderOptions.defaults(), results, null));

        assertEquals(500, results.calls.get());
        results.assertConsistent();
        assertEquals(500, results.outcomes.size());
        assertTrue(results.outcomes.values().stream().allMatch(ok -> ok));
        assertEquals(16, renderer.workerCount());
        assertEquals(0, renderer.outstandingPages());
        assertEquals(500, doc.closes());
    }

    @Test
    void failedPageIsReportedAndTheRestSucceed() {
        FakeDocument doc = new FakeDocument(10).failLoad(3);
        Results results = new Results();

        assertTrue(renderer.renderPages(doc, 0, 10, 20, 20, workers(4), results, null));

        assertEquals(10, results.calls.get());
        results.assertConsistent();
        assertEquals(Boolean.FALSE, results.outcomes.get(3));
        for (int i = 0; i < 10; i++) {
            if (i != 3) assertEquals(Boolean.TRUE, results.outcomes.get(i), "page " + i);
        }
        assertEquals(9, doc.closes());
    }

    @Test
    void queueDepthBoundsOutstandingPages() throws Exception {
        FakeDocument doc = new FakeDocument(20).renderDelay(5);
        AtomicInteger maxSeen = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        AtomicBoolean sampling = new AtomicBoolean(true);

        Thread sampler = new Thread(() -> {
            while (sampling.get()) {
                maxSeen.accumulateAndGet(renderer.outstandingPages(), Math::max);
                Thread.onSpinWait();
            }
        });
        sampler.start();
        try {
            RenderOptions options = RenderOptions.builder().workerCount(4).maxQueueDepth(5).build();
            assertTrue(renderer.renderPages(doc, 0, 20, 20, 20, options, (p, b, u, ok) -> {
                calls.incrementAndGet();
                maxSeen.accumulateAndGet(renderer.outstandingPages(), Math::max);
            }, null));
        } finally {
            sampling.set(false);
            sampler.join();
        }

        assertEquals(20, calls.get());
        assertTrue(maxSeen.get() <= 5, "outstanding reached " + maxSeen.get());
        assertTrue(maxSeen.get() >= 1);
    }

    @Test
    void invalidRequestsSubmitNothing() {
        FakeDocument doc = new FakeDocument(10);
        Results results = new Results();
        RenderOptions dpi = RenderOptions.builder().dpi(72).workerCount(2).build();

        assertFalse(renderer.renderPages(null, 0, 1, 10, 10, null, results, null));
        assertFalse(renderer.renderPages(doc, 0, 1, 10, 10, null, null, null));
        assertFalse(renderer.renderPages(doc, 0, 0, 10, 10, null, results, null));
        assertFalse(renderer.renderPages(doc, -1, 1, 10, 10, null, results, null));
        assertFalse(renderer.renderPages(doc, 10, 1, 10, 10, null, results, null));
        assertFalse(renderer.renderPages(doc, 0, 1, 0, 10, null, results, null));
        assertFalse(renderer.renderPages(doc, 0, 2, 0, 0, dpi, results, null));
        assertFalse(renderer.renderPagesPooled(doc, 0, 2, 0, 0, RenderOptions.defaults(), results, null));

        assertEquals(0, results.calls.get());
        assertEquals(0, doc.loads());
    }

    @Test
    void rangeIsClampedToTheDocument() {
        FakeDocument doc = new FakeDocument(10);
        Results results = new Results();

        assertTrue(renderer.renderPages(doc, 8, 50, 10, 10, workers(3), results, null));

        assertEquals(Set.of(8, 9), results.outcomes.keySet());
        results.assertConsistent();
    }

    @Test
    void poolPagesAreClosedNewestFirstAfterTheBatch() {
        FakeDocument doc = new FakeDocument(40);
        AtomicInteger closedDuringCallbacks = new AtomicInteger();

        assertTrue(renderer.renderPagesPooled(doc, 0, 40, 10, 10, workers(4),
                (p, b, u, ok) -> closedDuringCallbacks.accumulateAndGet(doc.closes(), Math::max), null));

        assertEquals(0, closedDuringCallbacks.get());
        List<Integer> expected = new ArrayList<>(doc.loadOrder());
        Collections.reverse(expected);
        assertEquals(expected, doc.closeOrder());
        assertEquals(1, doc.maxConcurrent());
        assertEquals(0, doc.unlockedAccess());
    }

    @Test
    void serialPagesAreClosedRightAfterTheirCallback() {
        FakeDocument doc = new FakeDocument(5);
        List<Integer> closedAtCallback = Collections.synchronizedList(new ArrayList<>());

        assertTrue(renderer.renderPages(doc, 0, 5, 10, 10, workers(1),
                (p, b, u, ok) -> closedAtCallback.add(doc.closes()), null));

        assertEquals(List.of(0, 1, 2, 3, 4), closedAtCallback);
        assertEquals(5, doc.closes());
    }

    @Test
    void ownedBitmapsOutliveTheCallback() {
        FakeDocument doc = new FakeDocument(12);
        List<PageBitmap> kept = Collections.synchronizedList(new ArrayList<>());

        assertTrue(renderer.renderPages(doc, 0, 12, 16, 16, workers(3), (p, b, u, ok) -> kept.add(b), null));

        assertEquals(12, kept.size());
        assertEquals(12, kept.stream().distinct().count());
        assertTrue(kept.stream().noneMatch(PageBitmap::isDestroyed));
        assertTrue(allocated.isEmpty());
    }

    @Test
    void pooledBitmapsAreReusedAcrossPages() {
        FakeDocument doc = new FakeDocument(20);

        assertTrue(renderer.renderPagesPooled(doc, 0, 20, 64, 64, workers(1), (p, b, u, ok) -> {}, null));
        assertEquals(1, allocated.size());
        assertTrue(allocated.get(0).isDestroyed());

        allocated.clear();
        assertTrue(renderer.renderPagesPooled(doc, 0, 20, 64, 64, workers(2), (p, b, u, ok) -> {}, null));
        assertTrue(allocated.size() <= 2, "allocated " + allocated.size());
    }

    @Test
    void dpiSizesEachPooledPage() {
        FakeDocument doc = new FakeDocument(6);
        Map<Integer, int[]> sizes = new ConcurrentHashMap<>();
        RenderOptions options = RenderOptions.builder()
                .workerCount(3).dpi(72).rotation(1).outputFormat(OutputFormat.GRAY).build();

        assertTrue(renderer.renderPagesPooled(doc, 0, 6, 0, 0, options,
                (p, b, u, ok) -> sizes.put(p, new int[] {b.width(), b.height(), b.stride()}), null));

        assertEquals(6, sizes.size());
        for (int[] size : sizes.values()) {
            assertEquals(792, size[0]);
            assertEquals(612, size[1]);
            assertEquals(792, size[2]);
        }
    }

    @Test
    void userDataReachesEveryCallback() {
        FakeDocument doc = new FakeDocument(8);
        Object context = new Object();
        AtomicInteger matches = new AtomicInteger();

        assertTrue(renderer.renderPagesPooled(doc, 0, 8, 10, 10, workers(2), (p, b, u, ok) -> {
            if (u == context) matches.incrementAndGet();
        }, context));

        assertEquals(8, matches.get());
    }

    @Test
    void closeIsIdempotentAndTheNextBatchStartsAFreshPool() {
        FakeDocument doc = new FakeDocument(8);
        Results first = new Results();
        assertTrue(renderer.renderPagesPooled(doc, 0, 8, 10, 10, workers(2), first, null));
        assertEquals(2, renderer.workerCount());

        renderer.close();
        renderer.close();
        assertEquals(0, renderer.workerCount());

        Results second = new Results();
        assertTrue(renderer.renderPagesPooled(doc, 0, 8, 10, 10, workers(3), second, null));
        assertEquals(8, second.calls.get());
        first.assertConsistent();
        second.assertConsistent();
        assertEquals(3, renderer.workerCount());
    }

    @Test
    void workerCachesAreClearedAfterEachBatchUnlessKept() throws Exception {
        FakeDocument doc = new FakeDocument(8);
        RenderOptions keep = RenderOptions.builder().workerCount(2).keepWorkerCaches(true).build();

        assertTrue(renderer.renderPagesPooled(doc, 0, 8, 10, 10, keep, (p, b, u, ok) -> {}, null));
        Thread.sleep(50);
        assertTrue(allocated.stream().noneMatch(PageBitmap::isDestroyed));

        assertTrue(renderer.renderPagesPooled(doc, 0, 8, 10, 10, workers(2), (p, b, u, ok) -> {}, null));
        long deadline = System.currentTimeMillis() + 5_000;
        while (!allocated.stream().allMatch(PageBitmap::isDestroyed)) {
            assertTrue(System.currentTimeMillis() < deadline, "worker caches not cleared");
            Thread.sleep(5);
        }
        assertEquals(2, renderer.workerCount());
    }

    @Test
    void concurrentBatchesOnOneDocumentStaySerialisedOnTheLock() throws Exception {
        FakeDocument doc = new FakeDocument(60);
        Results a = new Results();
        Results b = new Results();

        Thread other = new Thread(() -> renderer.renderPagesPooled(doc, 0, 30, 10, 10, workers(3), a, null));
        other.start();
        assertTrue(renderer.renderPagesPooled(doc, 30, 30, 10, 10, workers(3), b, null));
        other.join();

        assertEquals(30, a.calls.get());
        assertEquals(30, b.calls.get());
        a.assertConsistent();
        b.assertConsistent();
        assertEquals(60, doc.closes());
        assertEquals(1, doc.maxConcurrent());
    }

    @Test
    void errorLoadingAPageFailsOnlyThatPage() {
        FakeDocument doc = new FakeDocument(10).loadError(3).renderError(7);
        Results results = new Results();

        assertTrue(renderer.renderPages(doc, 0, 10, 20, 20, workers(4), results, null));

        assertEquals(10, results.calls.get());
        results.assertConsistent();
        assertEquals(Boolean.FALSE, results.outcomes.get(3));
        assertEquals(Boolean.FALSE, results.outcomes.get(7));
        assertEquals(8, results.outcomes.values().stream().filter(ok -> ok).count());
        assertEquals(4, renderer.workerCount());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void errorThrownByACallbackLeavesTheWorkersRunning() {
        FakeDocument doc = new FakeDocument(10);
        AtomicInteger failing = new AtomicInteger();

        assertTrue(renderer.renderPagesPooled(doc, 0, 2, 10, 10, workers(2), (p, b, u, ok) -> {
            failing.incrementAndGet();
            throw new AssertionError("callback bug on page " + p);
        }, null));
        assertEquals(2, failing.get());
        assertEquals(2, renderer.workerCount());

        Results results = new Results();
        assertTrue(renderer.renderPagesPooled(doc, 0, 10, 10, 10, workers(2), results, null));
        assertEquals(10, results.calls.get());
        results.assertConsistent();
        assertTrue(results.outcomes.values().stream().allMatch(ok -> ok));
    }
}
