package com.invertedindex.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 临时段目录的分配与清理测试。
 */
class SegmentStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("两个存储使用不同目录，关闭后目录及文件全部删除")
    void testDistinctDirectoriesAndCleanup() throws IOException {
        SegmentStore first = SegmentStore.create(tempDir);
        SegmentStore second = SegmentStore.create(tempDir);
        assertNotEquals(first.directory(), second.directory());

        Path segment = first.allocate();
        Files.writeString(segment, "payload");
        Files.writeString(first.directory().resolve("stray.partial"), "leftover");

        first.close();
        second.close();

        assertFalse(Files.exists(first.directory()));
        assertFalse(Files.exists(second.directory()));
        assertTrue(first.isClosed());
        first.close();
    }

    @Test
    @DisplayName("分配的路径唯一且按分配顺序记录")
    void testAllocationOrder() throws IOException {
        try (SegmentStore store = SegmentStore.create(tempDir)) {
            Path a = store.allocate();
            Path b = store.allocate();

            assertEquals(List.of(a, b), store.allocatedSegments());
            assertEquals(store.directory(), a.getParent());
            assertTrue(a.getFileName().toString().startsWith("seg-"));
            assertTrue(a.getFileName().toString().endsWith(".seg"));
        }
    }

    @Test
    @DisplayName("多线程并发分配不产生重复路径")
    void testConcurrentAllocation() throws Exception {
        int threads = 8;
        int perThread = 200;
        Set<Path> paths = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try (SegmentStore store = SegmentStore.create(tempDir)) {
            CountDownLatch start = new CountDownLatch(1);
            for (int thread = 0; thread < threads; thread++) {
                executor.submit(() -> {
                    start.await();
                    for (int index = 0; index < perThread; index++) {
                        paths.add(store.allocate());
                    }
                    return null;
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

            assertEquals(threads * perThread, paths.size());
            assertEquals(threads * perThread, new HashSet<>(store.allocatedSegments()).size());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("释放删除单个段，关闭后不能再分配")
    void testReleaseAndClosedStore() throws IOException {
        SegmentStore store = SegmentStore.create(tempDir);
        Path segment = store.allocate();
        Files.writeString(segment, "data");

        store.release(segment);
        assertFalse(Files.exists(segment));
        store.release(segment);

        store.close();
        assertThrows(IllegalStateException.class, store::allocate);
    }
}
