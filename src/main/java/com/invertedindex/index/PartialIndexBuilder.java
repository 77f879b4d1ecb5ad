package com.invertedindex.index;

import com.invertedindex.document.Document;
import com.invertedindex.text.Token;
import com.invertedindex.text.Tokenizer;

/**
 * 把单个文档分词为部分索引。无 I/O、无共享状态，可在任意工作线程中并发调用。
 */
public final class PartialIndexBuilder {
    private final Tokenizer tokenizer;

    public PartialIndexBuilder(Tokenizer tokenizer) {
        if (tokenizer == null) {
            throw new IllegalArgumentException("tokenizer 不能为空");
        }
        this.tokenizer = tokenizer;
    }

    /**
     * 为文档构建部分索引，每个词元的起始偏移作为位置。
     *
     * @param document 已读取的文档
     * @return 只包含该文档的部分索引
     */
    public PartialIndex build(Document document) {
        if (document == null) {
            throw new IllegalArgumentException("document 不能为空");
        }
        PartialIndex partialIndex = new PartialIndex();
        partialIndex.addDocument(document.docId(), document.sourcePath());
        for (Token token : tokenizer.tokens(document.text())) {
            partialIndex.addOccurrence(token.term(), document.docId(), token.startOffset());
        }
        return partialIndex;
    }
}
