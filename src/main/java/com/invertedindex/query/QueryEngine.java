package com.invertedindex.query;

import com.invertedindex.document.Document;
import com.invertedindex.highlight.AnsiHighlighter;
import com.invertedindex.highlight.HighlightSpan;
import com.invertedindex.storage.IndexFileReader;
import com.invertedindex.storage.IndexParseException;
import com.invertedindex.storage.InvertedIndex;
import com.invertedindex.storage.Posting;
import com.invertedindex.storage.PostingList;
import com.invertedindex.text.AlphanumericTokenizer;
import com.invertedindex.text.Token;
import com.invertedindex.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 单词项查询引擎：按分词器规则归一化查询，查找倒排列表，重新读取命中文档并计算高亮片段。
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final InvertedIndex index;
    private final Tokenizer tokenizer;

    public QueryEngine(InvertedIndex index) {
        this(index, new AlphanumericTokenizer());
    }

    public QueryEngine(InvertedIndex index, Tokenizer tokenizer) {
        if (index == null || tokenizer == null) {
            throw new IllegalArgumentException("索引与分词器不能为空");
        }
        this.index = index;
        this.tokenizer = tokenizer;
    }

    /**
     * 从索引文件加载并创建查询引擎。
     *
     * @param indexPath 最终索引文件
     * @return 查询引擎
     * @throws IOException 索引无法读取或已损坏
     */
    public static QueryEngine open(Path indexPath) throws IOException {
        InvertedIndex index = IndexFileReader.read(indexPath);
        logger.info("索引已加载: {}, terms={}, documents={}", indexPath, index.termCount(), index.documentCount());
        return new QueryEngine(index);
    }

    /**
     * 查询单个词项。词项不存在时返回空结果；查询串归一化后不是恰好一个词项时同样返回空结果。
     *
     * @param query 查询串，大小写不敏感
     * @return 查询结果，命中按 docId 升序
     * @throws com.invertedindex.document.DocumentReadException 命中文档无法重新读取
     * @throws IndexParseException 倒排引用了文档表中不存在的文档
     */
    public SearchResult search(String query) throws IOException {
        long startNanos = System.nanoTime();
        List<Token> tokens = tokenizer.tokenize(query);
        if (tokens.size() != 1) {
            logger.debug("查询无法归一化为单个词项: query={}, tokens={}", query, tokens.size());
            return new SearchResult(query, null, List.of(), elapsedMillis(startNanos));
        }

        String term = tokens.get(0).term();
        PostingList postingList = index.lookup(term);
        List<SearchHit> hits = new ArrayList<>(postingList.size());
        for (Posting posting : postingList.postings()) {
            Path sourcePath = index.documents().findPath(posting.docId())
                .orElseThrow(() -> new IndexParseException("倒排引用了文档表中不存在的 docId: " + posting.docId()));
            String text = Document.readText(sourcePath);
            List<HighlightSpan> spans = AnsiHighlighter.locate(text, posting.positions(), sourcePath);
            hits.add(new SearchHit(posting.docId(), sourcePath, text, spans));
        }

        long elapsedMs = elapsedMillis(startNanos);
        logger.debug("查询完成: term={}, hits={}, 耗时={}ms", term, hits.size(), elapsedMs);
        return new SearchResult(query, term, hits, elapsedMs);
    }

    public InvertedIndex getIndex() {
        return index;
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
