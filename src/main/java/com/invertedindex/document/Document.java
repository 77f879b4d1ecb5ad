package com.invertedindex.document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 待索引文档：摄入时创建一次，之后不可变，分词完成后即可丢弃。
 */
public record Document(
        int docId,
        Path sourcePath,
        String text
) {
    public Document {
        if (docId <= 0) {
            throw new IllegalArgumentException("docId 必须为正数: " + docId);
        }
        if (sourcePath == null) {
            throw new IllegalArgumentException("sourcePath 不能为空");
        }
        if (text == null) {
            throw new IllegalArgumentException("text 不能为空");
        }
    }

    /**
     * 以 UTF-8 读取文件内容并创建文档。
     *
     * @param docId 文档 ID
     * @param path 源文件
     * @return 文档
     * @throws DocumentReadException 文件不存在、不可读或不是合法 UTF-8 时抛出
     */
    public static Document load(int docId, Path path) throws DocumentReadException {
        return new Document(docId, path, readText(path));
    }

    /**
     * 读取源文件全文，查询高亮阶段同样通过该方法重新读取原文。
     */
    public static String readText(Path path) throws DocumentReadException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException exception) {
            throw new DocumentReadException(path, exception);
        }
    }
}
