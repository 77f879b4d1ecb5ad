package com.invertedindex.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 归并结果（最终索引或中间段）无法写入或提交。
 */
public class MergeWriteException extends IOException {
    private final Path outputPath;

    public MergeWriteException(Path outputPath, Throwable cause) {
        super("写入归并结果失败: " + outputPath, cause);
        this.outputPath = outputPath;
    }

    public Path getOutputPath() {
        return outputPath;
    }
}
