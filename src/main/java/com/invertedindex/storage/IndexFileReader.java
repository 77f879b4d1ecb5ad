package com.invertedindex.storage;

import com.invertedindex.config.Constants;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.TreeMap;

/**
 * 最终索引文件的全量读取器。
 */
public final class IndexFileReader {
    private IndexFileReader() {
    }

    /**
     * 读取整个索引文件到内存。
     *
     * @param indexPath 索引文件路径
     * @return 内存索引
     * @throws IndexParseException 文件损坏、截断、魔数或 CRC 不符时抛出
     * @throws IOException 文件不存在或读取失败时抛出
     */
    public static InvertedIndex read(Path indexPath) throws IOException {
        if (indexPath == null) {
            throw new IllegalArgumentException("索引路径不能为空");
        }
        if (!Files.isRegularFile(indexPath)) {
            throw new IOException("索引文件不存在: " + indexPath);
        }
        TreeMap<String, PostingList> postingsByTerm = new TreeMap<>(TermOrder.COMPARATOR);
        try (SegmentCursor cursor = SegmentCursor.open(indexPath, 0, Constants.INDEX_MAGIC)) {
            while (cursor.hasCurrent()) {
                postingsByTerm.put(cursor.currentTerm(), cursor.currentPostings());
                cursor.advance();
            }
            return new InvertedIndex(cursor.documents(), postingsByTerm);
        }
    }
}
