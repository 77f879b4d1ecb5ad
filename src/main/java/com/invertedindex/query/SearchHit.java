package com.invertedindex.query;

import com.invertedindex.highlight.HighlightSpan;

import java.nio.file.Path;
import java.util.List;

/**
 * 单个命中文档。
 *
 * @param docId 文档ID
 * @param sourcePath 源文件路径
 * @param text 查询时重新读取的原文
 * @param highlights 高亮片段，按起始位置升序
 */
public record SearchHit(
        int docId,
        Path sourcePath,
        String text,
        List<HighlightSpan> highlights
) {
    public SearchHit {
        highlights = List.copyOf(highlights);
    }
}
