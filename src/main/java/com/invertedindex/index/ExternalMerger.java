package com.invertedindex.index;

import com.invertedindex.config.Constants;
import com.invertedindex.document.DocumentTable;
import com.invertedindex.storage.IndexFileWriter;
import com.invertedindex.storage.IndexParseException;
import com.invertedindex.storage.MergeWriteException;
import com.invertedindex.storage.PostingList;
import com.invertedindex.storage.SegmentCursor;
import com.invertedindex.storage.SegmentWriteException;
import com.invertedindex.storage.TermOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * 段文件的外部多路归并。
 *
 * 每个段一个游标，按当前词项放入小顶堆；每轮弹出所有与最小词项相同的游标，
 * 合并它们的倒排列表后写出一条，再只推进被消费的游标。内存中只保留一个词项的倒排与各段文档表。
 *
 * 段数超过归并因子时先分组归并为中间段（段格式），直到剩余段数不超过归并因子，最后一轮写出最终索引。
 */
public final class ExternalMerger {
    private static final Logger logger = LoggerFactory.getLogger(ExternalMerger.class);
    private static final Comparator<SegmentCursor> CURSOR_ORDER =
        Comparator.comparing(SegmentCursor::currentTerm, TermOrder.COMPARATOR).thenComparingInt(SegmentCursor::ordinal);

    private final SegmentStore segmentStore;
    private final int mergeFactor;

    public ExternalMerger(SegmentStore segmentStore, int mergeFactor) {
        if (segmentStore == null) {
            throw new IllegalArgumentException("segmentStore 不能为空");
        }
        if (mergeFactor < 2) {
            throw new IllegalArgumentException("归并因子至少为2: " + mergeFactor);
        }
        this.segmentStore = segmentStore;
        this.mergeFactor = mergeFactor;
    }

    /**
     * 把全部段归并为最终索引文件。输入段在读完后即被释放。
     *
     * @param segments 段路径，顺序无关
     * @param outputPath 最终索引路径
     * @return 归并统计
     * @throws IndexParseException 段损坏或同一词项下 docId 重复
     * @throws SegmentWriteException 中间段写入失败
     * @throws MergeWriteException 最终索引写入失败
     */
    public MergeStats merge(List<Path> segments, Path outputPath) throws IOException {
        if (segments == null || outputPath == null) {
            throw new IllegalArgumentException("段列表与输出路径不能为空");
        }
        List<Path> pending = new ArrayList<>(segments);
        int passes = 0;
        while (pending.size() > mergeFactor) {
            passes++;
            List<Path> next = new ArrayList<>();
            for (int start = 0; start < pending.size(); start += mergeFactor) {
                List<Path> group = pending.subList(start, Math.min(start + mergeFactor, pending.size()));
                if (group.size() == 1) {
                    next.add(group.get(0));
                    continue;
                }
                Path intermediate = segmentStore.allocate();
                mergeGroup(group, intermediate, Constants.SEGMENT_MAGIC);
                next.add(intermediate);
            }
            logger.info("中间归并第{}轮: {} 个段 -> {} 个段", passes, pending.size(), next.size());
            pending = next;
        }

        passes++;
        GroupResult result = mergeGroup(pending, outputPath, Constants.INDEX_MAGIC);
        logger.info("最终归并完成: segments={}, terms={}, documents={}, passes={}",
            pending.size(), result.termCount(), result.documentCount(), passes);
        return new MergeStats(result.termCount(), result.documentCount(), segments.size(), passes);
    }

    private GroupResult mergeGroup(List<Path> group, Path outputPath, int magic) throws IOException {
        List<SegmentCursor> cursors = new ArrayList<>(group.size());
        try {
            DocumentTable documents = new DocumentTable();
            for (int ordinal = 0; ordinal < group.size(); ordinal++) {
                SegmentCursor cursor = SegmentCursor.open(group.get(ordinal), ordinal, Constants.SEGMENT_MAGIC);
                cursors.add(cursor);
                try {
                    documents.putAll(cursor.documents());
                } catch (IllegalArgumentException exception) {
                    throw new IndexParseException("多个段包含同一文档: " + cursor.path().getFileName(), exception);
                }
            }

            PriorityQueue<SegmentCursor> queue = new PriorityQueue<>(Math.max(1, cursors.size()), CURSOR_ORDER);
            for (SegmentCursor cursor : cursors) {
                if (cursor.hasCurrent()) {
                    queue.add(cursor);
                } else {
                    releaseExhausted(cursor);
                }
            }

            try (IndexFileWriter writer = openWriter(outputPath, magic, documents)) {
                List<SegmentCursor> consumed = new ArrayList<>();
                List<PostingList> parts = new ArrayList<>();
                while (!queue.isEmpty()) {
                    String term = queue.peek().currentTerm();
                    consumed.clear();
                    parts.clear();
                    while (!queue.isEmpty() && queue.peek().currentTerm().equals(term)) {
                        SegmentCursor cursor = queue.poll();
                        consumed.add(cursor);
                        parts.add(cursor.currentPostings());
                    }
                    PostingList merged;
                    try {
                        merged = PostingList.union(parts);
                    } catch (IndexParseException exception) {
                        throw new IndexParseException("归并词项失败: term=" + term, exception);
                    }
                    writeTerm(writer, term, merged, outputPath, magic);

                    for (SegmentCursor cursor : consumed) {
                        cursor.advance();
                        if (cursor.hasCurrent()) {
                            queue.add(cursor);
                        } else {
                            releaseExhausted(cursor);
                        }
                    }
                }
                finish(writer, outputPath, magic);
                return new GroupResult(writer.getTermCount(), documents.size());
            }
        } finally {
            for (SegmentCursor cursor : cursors) {
                closeQuietly(cursor);
            }
        }
    }

    private IndexFileWriter openWriter(Path outputPath, int magic, DocumentTable documents) throws IOException {
        try {
            return new IndexFileWriter(outputPath, magic, documents);
        } catch (IOException exception) {
            throw writeFailure(outputPath, magic, exception);
        }
    }

    private void writeTerm(IndexFileWriter writer, String term, PostingList postingList, Path outputPath, int magic)
        throws IOException {
        try {
            writer.writeTerm(term, postingList);
        } catch (IOException exception) {
            throw writeFailure(outputPath, magic, exception);
        }
    }

    private void finish(IndexFileWriter writer, Path outputPath, int magic) throws IOException {
        try {
            writer.finish();
        } catch (IOException exception) {
            throw writeFailure(outputPath, magic, exception);
        }
    }

    private static IOException writeFailure(Path outputPath, int magic, IOException cause) {
        if (magic == Constants.INDEX_MAGIC) {
            return new MergeWriteException(outputPath, cause);
        }
        return new SegmentWriteException(outputPath, cause);
    }

    private void releaseExhausted(SegmentCursor cursor) {
        closeQuietly(cursor);
        segmentStore.release(cursor.path());
        logger.debug("段已读完并释放: {}", cursor.path().getFileName());
    }

    private static void closeQuietly(SegmentCursor cursor) {
        try {
            cursor.close();
        } catch (IOException exception) {
            logger.warn("关闭段游标失败: {}", cursor.path(), exception);
        }
    }

    /**
     * 归并统计。
     *
     * @param termCount 最终索引词项数
     * @param documentCount 最终索引文档数
     * @param segmentCount 输入段数
     * @param passes 归并轮数，含最终一轮
     */
    public record MergeStats(int termCount, int documentCount, int segmentCount, int passes) {
    }

    private record GroupResult(int termCount, int documentCount) {
    }
}
