package com.invertedindex.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 倒排列表：某词项的全部出现记录，按 docId 严格递增，每个文档至多一条。
 *
 * @param postings 按 docId 升序排列的出现记录
 */
public record PostingList(List<Posting> postings) {
    private static final PostingList EMPTY = new PostingList(List.of());

    /**
     * 构造时校验 docId 单调性并复制为不可变列表。
     */
    public PostingList {
        if (postings == null) {
            throw new IllegalArgumentException("postings不能为null");
        }
        for (int index = 1; index < postings.size(); index++) {
            if (postings.get(index).docId() <= postings.get(index - 1).docId()) {
                throw new IllegalArgumentException("docId必须严格递增，位置=" + index + ", current=" + postings.get(index).docId());
            }
        }
        postings = List.copyOf(postings);
    }

    public static PostingList empty() {
        return EMPTY;
    }

    /**
     * 合并多个来自不同段的倒排列表，重新按 docId 排序；同一 docId 出现两次视为数据损坏。
     *
     * @param parts 待合并列表
     * @return 合并结果
     * @throws IndexParseException docId 重复时抛出
     */
    public static PostingList union(List<PostingList> parts) throws IndexParseException {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        List<Posting> combined = new ArrayList<>();
        for (PostingList part : parts) {
            combined.addAll(part.postings());
        }
        combined.sort(Comparator.comparingInt(Posting::docId));
        for (int index = 1; index < combined.size(); index++) {
            if (combined.get(index).docId() == combined.get(index - 1).docId()) {
                throw new IndexParseException("同一 docId 出现在多个段中: " + combined.get(index).docId());
            }
        }
        return new PostingList(combined);
    }

    /**
     * 返回倒排项数量。
     */
    public int size() {
        return postings.size();
    }

    public boolean isEmpty() {
        return postings.isEmpty();
    }

    public Posting get(int index) {
        return postings.get(index);
    }

    /**
     * 返回全部 docId（升序）。
     */
    public int[] docIds() {
        int[] docIds = new int[postings.size()];
        for (int index = 0; index < docIds.length; index++) {
            docIds[index] = postings.get(index).docId();
        }
        return docIds;
    }

    /**
     * 所有文档中的出现总次数。
     */
    public long totalFrequency() {
        long total = 0;
        for (Posting posting : postings) {
            total += posting.frequency();
        }
        return total;
    }
}
