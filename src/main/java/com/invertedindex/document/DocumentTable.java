package com.invertedindex.document;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 文档表：docId 到源文件路径的映射，随索引文件一同持久化，供查询阶段重新打开原文。
 *
 * 非线程安全，每个部分索引持有自己的实例。
 */
public final class DocumentTable {
    private final TreeMap<Integer, Path> pathsByDocId = new TreeMap<>();

    /**
     * 登记文档路径，docId 重复时抛出异常。
     */
    public void put(int docId, Path sourcePath) {
        if (docId <= 0) {
            throw new IllegalArgumentException("docId 必须为正数: " + docId);
        }
        if (sourcePath == null) {
            throw new IllegalArgumentException("sourcePath 不能为空");
        }
        Path previous = pathsByDocId.putIfAbsent(docId, sourcePath);
        if (previous != null) {
            throw new IllegalArgumentException("docId 重复: " + docId + ", existing=" + previous + ", new=" + sourcePath);
        }
    }

    /**
     * 合并另一张文档表，两表 docId 必须互不相交。
     */
    public void putAll(DocumentTable other) {
        for (Map.Entry<Integer, Path> entry : other.pathsByDocId.entrySet()) {
            put(entry.getKey(), entry.getValue());
        }
    }

    public Optional<Path> findPath(int docId) {
        return Optional.ofNullable(pathsByDocId.get(docId));
    }

    public boolean contains(int docId) {
        return pathsByDocId.containsKey(docId);
    }

    public int size() {
        return pathsByDocId.size();
    }

    public boolean isEmpty() {
        return pathsByDocId.isEmpty();
    }

    /**
     * 按 docId 升序返回只读视图。
     */
    public NavigableMap<Integer, Path> entries() {
        return Collections.unmodifiableNavigableMap(pathsByDocId);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DocumentTable that)) {
            return false;
        }
        return pathsByDocId.equals(that.pathsByDocId);
    }

    @Override
    public int hashCode() {
        return pathsByDocId.hashCode();
    }

    @Override
    public String toString() {
        return "DocumentTable" + pathsByDocId;
    }
}
