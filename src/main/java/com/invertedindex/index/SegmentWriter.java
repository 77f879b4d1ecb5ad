package com.invertedindex.index;

import com.invertedindex.config.Constants;
import com.invertedindex.storage.IndexFileWriter;
import com.invertedindex.storage.SegmentWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 将一个部分索引按词项排序后写成段文件。
 */
public final class SegmentWriter {
    private static final Logger logger = LoggerFactory.getLogger(SegmentWriter.class);

    private SegmentWriter() {
    }

    /**
     * 写入段文件。写入先落到暂存文件，成功后才出现在目标路径。
     *
     * @param partialIndex 待写入的部分索引
     * @param segmentPath 目标段路径
     * @return 写入的词项数
     * @throws SegmentWriteException 任何 I/O 失败
     */
    public static int write(PartialIndex partialIndex, Path segmentPath) throws SegmentWriteException {
        if (partialIndex == null) {
            throw new IllegalArgumentException("部分索引不能为空");
        }
        try (IndexFileWriter writer = new IndexFileWriter(segmentPath, Constants.SEGMENT_MAGIC, partialIndex.documents())) {
            for (String term : partialIndex.sortedTerms()) {
                writer.writeTerm(term, partialIndex.postingList(term));
            }
            writer.finish();
            logger.debug("段写入完成: {}, docs={}, terms={}", segmentPath.getFileName(),
                partialIndex.documents().size(), writer.getTermCount());
            return writer.getTermCount();
        } catch (IOException exception) {
            throw new SegmentWriteException(segmentPath, exception);
        }
    }
}
