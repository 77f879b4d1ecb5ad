package com.invertedindex.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 收集线程使用的批次缓冲：累积部分索引，位置数达到阈值时写出一个段。
 *
 * 只由单个收集线程访问。
 */
final class SegmentBatcher {
    private static final Logger logger = LoggerFactory.getLogger(SegmentBatcher.class);

    private final SegmentStore segmentStore;
    private final long flushThreshold;
    private final List<Path> segments = new ArrayList<>();
    private PartialIndex current;
    private long wordCount;

    SegmentBatcher(SegmentStore segmentStore, long flushThreshold) {
        if (flushThreshold < 1) {
            throw new IllegalArgumentException("刷写阈值必须为正数: " + flushThreshold);
        }
        this.segmentStore = segmentStore;
        this.flushThreshold = flushThreshold;
    }

    void add(PartialIndex partialIndex) throws IOException {
        wordCount += partialIndex.positionCount();
        if (current == null) {
            current = partialIndex;
        } else {
            current.merge(partialIndex);
        }
        if (current.positionCount() >= flushThreshold) {
            flush();
        }
    }

    /**
     * 把当前批次写成段，批次为空时什么也不做。
     */
    void flush() throws IOException {
        if (current == null || current.isEmpty()) {
            return;
        }
        Path segmentPath = segmentStore.allocate();
        SegmentWriter.write(current, segmentPath);
        segments.add(segmentPath);
        logger.debug("批次已刷写: segment={}, docs={}, positions={}", segmentPath.getFileName(),
            current.documents().size(), current.positionCount());
        current = null;
    }

    List<Path> segments() {
        return List.copyOf(segments);
    }

    long wordCount() {
        return wordCount;
    }
}
