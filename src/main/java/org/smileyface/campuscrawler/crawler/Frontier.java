package org.smileyface.campuscrawler.crawler;

import org.smileyface.campuscrawler.model.FrontierState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The queue of pending URLs plus the set of URLs already visited.
 * <p>
 * Invariants: a URL is never both visited and queued, the queue holds no duplicates and every queued
 * URL has been accepted by the {@link UrlNormalizer}. The queue is FIFO. All methods are synchronized,
 * which keeps the membership check and the insertion in {@link #enqueue(String)} atomic should several
 * workers ever share one frontier.
 */
public class Frontier {

    private final UrlNormalizer normalizer;
    // insertion-ordered: iteration order is the dequeue order
    private final LinkedHashSet<String> queue = new LinkedHashSet<>();
    private final Set<String> visited = new LinkedHashSet<>();

    public Frontier(UrlNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    /**
     * Validates and appends a URL to the end of the queue. Rejected, visited and already queued
     * URLs are ignored.
     *
     * @param url absolute URL
     * @return true if the queue changed
     */
    public synchronized boolean enqueue(String url) {
        if (url == null || url.isBlank()) return false;
        String normalized = normalizer.normalize(url);
        if (normalized == null || visited.contains(normalized)) {
            return false;
        }
        return queue.add(normalized);
    }

    /**
     * Enqueues every URL in order.
     *
     * @return number of URLs actually added
     */
    public synchronized int enqueueAll(Collection<String> urls) {
        if (urls == null) return 0;
        int added = 0;
        for (String url : urls) {
            if (enqueue(url)) added++;
        }
        return added;
    }

    /**
     * Resolves seed paths against the site root and enqueues them after whatever is queued already.
     * Seeding twice, or seeding URLs restored from a checkpoint, changes nothing.
     *
     * @param seedPaths paths such as "/" or "/admissions"
     * @param rootUrl   absolute site root
     * @return number of seeds actually added
     */
    public synchronized int seed(Collection<String> seedPaths, String rootUrl) {
        if (seedPaths == null) return 0;
        int added = 0;
        for (String path : seedPaths) {
            String url = normalizer.normalizeAndValidate(path, rootUrl);
            if (url != null && enqueue(url)) added++;
        }
        return added;
    }

    /**
     * Removes and returns the head of the queue.
     *
     * @return next URL or null if the queue is empty
     */
    public synchronized String deQueue() {
        Iterator<String> it = queue.iterator();
        if (!it.hasNext()) return null;
        String head = it.next();
        it.remove();
        return head;
    }

    /**
     * Puts a URL that was dequeued but not finished back at the head of the queue. Visited and
     * already queued URLs are ignored.
     *
     * @return true if the queue changed
     */
    public synchronized boolean requeueFirst(String url) {
        if (url == null || visited.contains(url) || queue.contains(url)) return false;
        if (normalizer.normalize(url) == null) return false;
        LinkedHashSet<String> rest = new LinkedHashSet<>(queue);
        queue.clear();
        queue.add(url);
        queue.addAll(rest);
        return true;
    }

    /**
     * Records a URL as visited, whether or not its fetch succeeded. Visited is permanent for the
     * lifetime of this frontier.
     */
    public synchronized void markVisited(String url) {
        if (url == null || url.isBlank()) return;
        queue.remove(url);
        visited.add(url);
    }

    public synchronized boolean isVisited(String url) {
        return visited.contains(url);
    }

    public synchronized boolean isQueued(String url) {
        return queue.contains(url);
    }

    public synchronized boolean isEmpty() {
        return queue.isEmpty();
    }

    public synchronized int queueSize() {
        return queue.size();
    }

    public synchronized int visitedCount() {
        return visited.size();
    }

    /**
     * Replaces the current contents with a checkpoint. Visited URLs are normalized, and one the
     * normalizer rejects is kept verbatim. Queued URLs go through {@link #enqueue(String)}, so invalid
     * or already visited entries are dropped.
     */
    public synchronized void restore(FrontierState state) {
        queue.clear();
        visited.clear();
        if (state == null) return;
        for (String url : state.visited()) {
            if (url == null || url.isBlank()) continue;
            String normalized = normalizer.normalize(url);
            visited.add(normalized != null ? normalized : url);
        }
        enqueueAll(state.queue());
    }

    public synchronized FrontierState snapshot() {
        return new FrontierState(new LinkedHashSet<>(visited), new ArrayList<>(queue));
    }
}
