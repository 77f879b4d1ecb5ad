package com.invertedindex.index;

import com.invertedindex.document.DocumentTable;
import com.invertedindex.storage.Posting;
import com.invertedindex.storage.PostingList;
import com.invertedindex.storage.TermOrder;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存中的部分索引：一批文档的 term -> docId -> 位置列表。
 *
 * 内部使用哈希表，不保证顺序；只有 {@link #sortedTerms()} 和 {@link #postingList(String)} 在读出时排序。
 * 非线程安全，每个实例在任一时刻只属于一个线程。
 */
public final class PartialIndex {
    private final Map<String, Map<Integer, PositionBuffer>> positionsByTerm = new HashMap<>();
    private final DocumentTable documents = new DocumentTable();
    private long positionCount;

    /**
     * 登记一个文档，之后才能为它追加位置。
     */
    public void addDocument(int docId, Path sourcePath) {
        documents.put(docId, sourcePath);
    }

    /**
     * 记录词项在文档中的一次出现，同一 (term, docId) 的位置必须严格递增。
     *
     * @param term 归一化后的词项
     * @param docId 已登记的文档ID
     * @param position 文档内起始偏移
     */
    public void addOccurrence(String term, int docId, int position) {
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("term 不能为空");
        }
        if (!documents.contains(docId)) {
            throw new IllegalArgumentException("文档未登记: docId=" + docId);
        }
        if (position < 0) {
            throw new IllegalArgumentException("位置不能为负数: " + position);
        }
        positionsByTerm
            .computeIfAbsent(term, key -> new HashMap<>())
            .computeIfAbsent(docId, key -> new PositionBuffer())
            .add(position, term, docId);
        positionCount++;
    }

    /**
     * 吸收另一个部分索引。两者的文档必须互不相交，合并后不应再修改 other。
     *
     * @param other 另一批文档的部分索引
     * @throws IllegalArgumentException 文档重叠时抛出，此时当前实例保持不变
     */
    public void merge(PartialIndex other) {
        if (other == null || other == this) {
            throw new IllegalArgumentException("无法合并自身或空的部分索引");
        }
        for (Integer docId : other.documents.entries().keySet()) {
            if (documents.contains(docId)) {
                throw new IllegalArgumentException("部分索引的文档重叠: docId=" + docId);
            }
        }
        documents.putAll(other.documents);
        for (Map.Entry<String, Map<Integer, PositionBuffer>> entry : other.positionsByTerm.entrySet()) {
            positionsByTerm.computeIfAbsent(entry.getKey(), key -> new HashMap<>()).putAll(entry.getValue());
        }
        positionCount += other.positionCount;
    }

    /**
     * 按 {@link TermOrder} 返回全部词项。
     */
    public List<String> sortedTerms() {
        List<String> terms = new ArrayList<>(positionsByTerm.keySet());
        terms.sort(TermOrder.COMPARATOR);
        return terms;
    }

    /**
     * 返回词项的倒排列表（按 docId 升序），词项不存在时返回空列表。
     */
    public PostingList postingList(String term) {
        Map<Integer, PositionBuffer> positionsByDoc = positionsByTerm.get(term);
        if (positionsByDoc == null) {
            return PostingList.empty();
        }
        List<Integer> docIds = new ArrayList<>(positionsByDoc.keySet());
        Collections.sort(docIds);
        List<Posting> postings = new ArrayList<>(docIds.size());
        for (Integer docId : docIds) {
            postings.add(new Posting(docId, positionsByDoc.get(docId).toArray()));
        }
        return new PostingList(postings);
    }

    public DocumentTable documents() {
        return documents;
    }

    public int termCount() {
        return positionsByTerm.size();
    }

    /**
     * 已记录的位置总数，即这批文档的词数。
     */
    public long positionCount() {
        return positionCount;
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }

    private static final class PositionBuffer {
        private int[] values = new int[4];
        private int size;

        void add(int position, String term, int docId) {
            if (size > 0 && position <= values[size - 1]) {
                throw new IllegalArgumentException("位置必须严格递增: term=" + term + ", docId=" + docId
                    + ", last=" + values[size - 1] + ", current=" + position);
            }
            if (size == values.length) {
                values = Arrays.copyOf(values, size * 2);
            }
            values[size++] = position;
        }

        int[] toArray() {
            return Arrays.copyOf(values, size);
        }
    }
}
