package com.invertedindex.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 段文件无法创建或写入。缺失的段会让文档从最终索引中静默消失，因此该异常总是中止构建。
 */
public class SegmentWriteException extends IOException {
    private final Path segmentPath;

    public SegmentWriteException(Path segmentPath, Throwable cause) {
        super("写入段文件失败: " + segmentPath, cause);
        this.segmentPath = segmentPath;
    }

    public Path getSegmentPath() {
        return segmentPath;
    }
}
