package com.invertedindex.storage;

import com.invertedindex.document.DocumentTable;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 载入内存的最终索引：按 {@link TermOrder} 排列的词项到倒排列表映射，以及文档表。
 *
 * 构建完成后只读，可被多个查询线程共享。
 */
public final class InvertedIndex {
    private final DocumentTable documents;
    private final NavigableMap<String, PostingList> postingsByTerm;

    public InvertedIndex(DocumentTable documents, NavigableMap<String, PostingList> postingsByTerm) {
        if (documents == null || postingsByTerm == null) {
            throw new IllegalArgumentException("文档表与词项映射不能为空");
        }
        this.documents = documents;
        TreeMap<String, PostingList> sorted = new TreeMap<>(TermOrder.COMPARATOR);
        sorted.putAll(postingsByTerm);
        this.postingsByTerm = Collections.unmodifiableNavigableMap(sorted);
    }

    /**
     * 查找词项的倒排列表，词项不存在时返回空列表。
     *
     * @param term 已归一化的词项
     * @return 倒排列表，永不为 null
     */
    public PostingList lookup(String term) {
        if (term == null) {
            return PostingList.empty();
        }
        PostingList postingList = postingsByTerm.get(term);
        return postingList == null ? PostingList.empty() : postingList;
    }

    public NavigableMap<String, PostingList> terms() {
        return postingsByTerm;
    }

    public DocumentTable documents() {
        return documents;
    }

    public int termCount() {
        return postingsByTerm.size();
    }

    public int documentCount() {
        return documents.size();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof InvertedIndex)) {
            return false;
        }
        InvertedIndex that = (InvertedIndex) other;
        return documents.equals(that.documents) && postingsByTerm.equals(that.postingsByTerm);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documents, postingsByTerm);
    }

    @Override
    public String toString() {
        return "InvertedIndex{terms=" + postingsByTerm.size() + ", documents=" + documents.size() + "}";
    }
}
