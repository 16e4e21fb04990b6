package org.smileyface.campuscrawler.crawler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.campuscrawler.model.FrontierState;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class FrontierTest {

    private static final String ROOT = "https://www.bracu.ac.bd/";
    private static final String A = "https://www.bracu.ac.bd/a";
    private static final String B = "https://www.bracu.ac.bd/b";
    private static final String C = "https://www.bracu.ac.bd/c";

    private Frontier frontier;

    @BeforeEach
    void setUp() {
        UrlNormalizer normalizer = new UrlNormalizer(List.of("www.bracu.ac.bd"), List.of(".pdf"));
        frontier = new Frontier(normalizer);
    }

    @Test
    void emptyFrontierDequeueReturnsNull() {
        assertThat(frontier.isEmpty()).isTrue();
        assertThat(frontier.deQueue()).isNull();
    }

    @Test
    void fifoOrderWithDeduplication() {
        assertThat(frontier.enqueue(A)).isTrue();
        assertThat(frontier.enqueue(B)).isTrue();
        assertThat(frontier.enqueue(A)).isFalse();
        assertThat(frontier.enqueue(B + "/")).as("same page, other spelling").isFalse();
        assertThat(frontier.enqueue(C)).isTrue();

        assertThat(frontier.queueSize()).isEqualTo(3);
        assertThat(frontier.deQueue()).isEqualTo(A);
        assertThat(frontier.deQueue()).isEqualTo(B);
        assertThat(frontier.deQueue()).isEqualTo(C);
        assertThat(frontier.deQueue()).isNull();
    }

    @Test
    void enqueueStoresNormalizedForm() {
        frontier.enqueue("https://WWW.bracu.ac.bd:443/a/#top");
        assertThat(frontier.isQueued(A)).isTrue();
        assertThat(frontier.deQueue()).isEqualTo(A);
    }

    @Test
    void invalidUrlsAreNeverQueued() {
        assertThat(frontier.enqueue(null)).isFalse();
        assertThat(frontier.enqueue("  ")).isFalse();
        assertThat(frontier.enqueue("/relative")).isFalse();
        assertThat(frontier.enqueue("https://example.com/a")).isFalse();
        assertThat(frontier.enqueue("https://www.bracu.ac.bd/doc.pdf")).isFalse();
        assertThat(frontier.isEmpty()).isTrue();
    }

    @Test
    void visitedUrlIsNeverQueuedAgain() {
        frontier.enqueue(A);
        assertThat(frontier.deQueue()).isEqualTo(A);
        frontier.markVisited(A);

        assertThat(frontier.enqueue(A)).isFalse();
        assertThat(frontier.enqueueAll(List.of(A, A + "/", B))).isEqualTo(1);
        assertThat(frontier.isVisited(A)).isTrue();
        assertThat(frontier.deQueue()).isEqualTo(B);
        assertThat(frontier.deQueue()).isNull();
    }

    @Test
    void markVisitedRemovesQueuedEntry() {
        frontier.enqueueAll(List.of(A, B));
        frontier.markVisited(B);

        assertThat(frontier.isQueued(B)).isFalse();
        assertThat(frontier.isVisited(B)).isTrue();
        assertThat(frontier.snapshot().queue()).containsExactly(A);
    }

    @Test
    void requeueFirstPutsUrlAtHead() {
        frontier.enqueueAll(List.of(A, B, C));
        String head = frontier.deQueue();
        assertThat(frontier.requeueFirst(head)).isTrue();
        assertThat(frontier.snapshot().queue()).containsExactly(A, B, C);

        frontier.markVisited(A);
        assertThat(frontier.requeueFirst(A)).as("visited URLs stay out").isFalse();
        assertThat(frontier.requeueFirst(C)).as("already queued").isFalse();
    }

    @Test
    void seedResolvesPathsAgainstRoot() {
        int added = frontier.seed(List.of("/", "/a", "/a/", "b", "/report.pdf"), ROOT);

        assertThat(added).isEqualTo(3);
        assertThat(frontier.snapshot().queue())
                .containsExactly("https://www.bracu.ac.bd", A, B);
        assertThat(frontier.seed(List.of("/", "/a"), ROOT)).as("seeding is idempotent").isZero();
    }

    /**
     * A checkpoint with visited={A} and queue=[B, C] must continue with B, never fetch A again and
     * append seeds after the restored queue.
     */
    @Test
    void restoredQueueKeepsItsOrderAheadOfSeeds() {
        frontier.restore(new FrontierState(Set.of(A), List.of(B, C)));
        frontier.seed(List.of("/a", "/d", "/b"), ROOT);

        assertThat(frontier.visitedCount()).isEqualTo(1);
        assertThat(frontier.deQueue()).isEqualTo(B);
        assertThat(frontier.deQueue()).isEqualTo(C);
        assertThat(frontier.deQueue()).isEqualTo("https://www.bracu.ac.bd/d");
        assertThat(frontier.deQueue()).isNull();
    }

    @Test
    void restoreDropsQueuedEntriesThatAreVisitedOrInvalid() {
        frontier.enqueue(C);
        frontier.restore(new FrontierState(Set.of(A), List.of(A, "https://example.com/x", B, B)));

        FrontierState snapshot = frontier.snapshot();
        assertThat(snapshot.visited()).containsExactly(A);
        assertThat(snapshot.queue()).containsExactly(B);
        assertThat(frontier.isQueued(C)).as("restore replaces current contents").isFalse();
    }

    @Test
    void restoredVisitedEntriesAreNormalized() {
        String external = "https://example.com/kept-as-is";
        frontier.restore(new FrontierState(Set.of("https://WWW.bracu.ac.bd/a/", external), List.of(A, B)));

        assertThat(frontier.isVisited(A)).isTrue();
        assertThat(frontier.isVisited(external)).isTrue();
        assertThat(frontier.deQueue()).isEqualTo(B);
        assertThat(frontier.enqueue("https://www.bracu.ac.bd/a/")).isFalse();
    }

    @Test
    void restoreNullLeavesFrontierEmpty() {
        frontier.enqueue(A);
        frontier.restore(null);
        assertThat(frontier.isEmpty()).isTrue();
        assertThat(frontier.visitedCount()).isZero();
    }

    @Test
    void concurrentEnqueueNeverDuplicates() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            urls.add("https://www.bracu.ac.bd/page-" + i);
        }
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    accepted.addAndGet(frontier.enqueueAll(urls));
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }
        assertThat(accepted.get()).isEqualTo(200);
        assertThat(frontier.queueSize()).isEqualTo(200);
    }
}
