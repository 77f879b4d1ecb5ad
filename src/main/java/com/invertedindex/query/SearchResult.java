package com.invertedindex.query;

import java.util.List;

/**
 * 一次查询的结果，命中按 docId 升序。
 *
 * @param query 原始查询串
 * @param term 归一化后的词项，查询无法归一化为单个词项时为 null
 * @param hits 命中文档
 * @param elapsedMs 耗时（毫秒）
 */
public record SearchResult(
        String query,
        String term,
        List<SearchHit> hits,
        long elapsedMs
) {
    public SearchResult {
        hits = List.copyOf(hits);
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }

    public int totalMatches() {
        return hits.size();
    }
}
