package com.invertedindex.document;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 输入文档缺失或不可读。构建阶段遇到该异常会中止整个构建。
 */
public class DocumentReadException extends IOException {
    private final Path path;

    public DocumentReadException(Path path, Throwable cause) {
        super("读取文档失败: " + path + (cause == null || cause.getMessage() == null ? "" : " (" + cause.getMessage() + ")"), cause);
        this.path = path;
    }

    public DocumentReadException(Path path, String reason) {
        super("读取文档失败: " + path + " (" + reason + ")");
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
