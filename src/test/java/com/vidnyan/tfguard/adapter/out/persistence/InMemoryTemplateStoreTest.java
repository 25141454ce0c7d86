package com.vidnyan.tfguard.adapter.out.persistence;

import com.vidnyan.tfguard.domain.session.TemplateVersion;
import com.vidnyan.tfguard.domain.session.VersionAuthor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTemplateStoreTest {

    private final InMemoryTemplateStore store = new InMemoryTemplateStore();

    @Test
    void createVersion_ShouldNumberFromOne() {
        store.createVersion("t", "a", "first", VersionAuthor.USER);
        TemplateVersion second = store.createVersion("t", "b", "second", VersionAuthor.AGENT);

        assertEquals(2, second.version());
        assertEquals(second, store.getLatestVersion("t").orElseThrow());
        assertEquals("a", store.findVersion("t", 1).orElseThrow().content());
        assertTrue(store.findVersion("t", 3).isEmpty());
        assertTrue(store.getLatestVersion("other").isEmpty());
    }

    @Test
    void createVersion_ShouldNotLeaveGapsUnderConcurrency() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TemplateVersion>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 100; i++) {
                String content = "content-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.createVersion("t", content, "concurrent", VersionAuthor.AGENT);
                }));
            }
            start.countDown();
            for (Future<TemplateVersion> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<Integer> numbers = store.listVersions("t").stream().map(TemplateVersion::version).toList();
        assertEquals(IntStream.rangeClosed(1, 100).boxed().toList(), numbers);
    }

    @Test
    void createBaselineIfAbsent_ShouldOnlyCreateFirstVersion() {
        TemplateVersion baseline = store.createBaselineIfAbsent("t", "original", "baseline", VersionAuthor.USER);
        TemplateVersion again = store.createBaselineIfAbsent("t", "changed", "baseline", VersionAuthor.USER);

        assertEquals(1, baseline.version());
        assertEquals(baseline, again);
        assertEquals(1, store.listVersions("t").size());
    }

    @Test
    void setContent_ShouldNotTouchHistory() {
        store.setContent("t", "x");

        assertEquals("x", store.getContent("t").orElseThrow());
        assertTrue(store.listVersions("t").isEmpty());
        assertTrue(store.getContent("missing").isEmpty());
    }
}
