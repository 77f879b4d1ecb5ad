package com.invertedindex.query;

import com.invertedindex.config.EngineConfig;
import com.invertedindex.document.DocumentReadException;
import com.invertedindex.document.DocumentTable;
import com.invertedindex.highlight.HighlightSpan;
import com.invertedindex.index.IndexBuilder;
import com.invertedindex.storage.IndexParseException;
import com.invertedindex.storage.InvertedIndex;
import com.invertedindex.storage.Posting;
import com.invertedindex.storage.PostingList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class QueryEngineTest {

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private QueryEngine queryEngine;

    @BeforeEach
    void setUp() throws IOException {
        sourceDir = Files.createDirectories(tempDir.resolve("source"));
        Files.writeString(sourceDir.resolve("1.txt"), "Go is fun");
        Files.writeString(sourceDir.resolve("2.txt"), "I love Go programming");

        EngineConfig config = EngineConfig.defaults();
        config.setIndexOutputPath(tempDir.resolve("index.dat"));
        new IndexBuilder(config).build(List.of(sourceDir));
        queryEngine = QueryEngine.open(tempDir.resolve("index.dat"));
    }

    @Test
    @DisplayName("命中两个文档，高亮位置分别为0和7")
    void testTermInBothDocuments() throws IOException {
        SearchResult result = queryEngine.search("go");

        assertEquals("go", result.term());
        assertEquals(2, result.totalMatches());
        SearchHit first = result.hits().get(0);
        SearchHit second = result.hits().get(1);
        assertEquals(1, first.docId());
        assertEquals(sourceDir.resolve("1.txt"), first.sourcePath());
        assertEquals("Go is fun", first.text());
        assertEquals(List.of(new HighlightSpan(0, 2)), first.highlights());
        assertEquals(2, second.docId());
        assertEquals(List.of(new HighlightSpan(7, 2)), second.highlights());
    }

    @Test
    @DisplayName("只出现在一个文档中的词项")
    void testTermInSingleDocument() throws IOException {
        SearchResult result = queryEngine.search("fun");

        assertEquals(1, result.totalMatches());
        assertEquals(1, result.hits().get(0).docId());
        assertEquals(List.of(new HighlightSpan(6, 3)), result.hits().get(0).highlights());
    }

    @Test
    @DisplayName("不存在的词项返回空结果而不是错误")
    void testAbsentTerm() throws IOException {
        SearchResult result = queryEngine.search("rust");

        assertTrue(result.isEmpty());
        assertEquals("rust", result.term());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Programming", "programming", "PROGRAMMING", "  programming!  "})
    @DisplayName("查询大小写不敏感")
    void testCaseInsensitive(String query) throws IOException {
        SearchResult result = queryEngine.search(query);

        assertEquals(1, result.totalMatches());
        assertEquals(2, result.hits().get(0).docId());
        assertEquals(List.of(new HighlightSpan(10, 11)), result.hits().get(0).highlights());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "!!!", "go fun"})
    @DisplayName("查询不是恰好一个词项时返回空结果")
    void testNotASingleTerm(String query) throws IOException {
        SearchResult result = queryEngine.search(query);

        assertTrue(result.isEmpty());
        assertNull(result.term());
    }

    @Test
    @DisplayName("单字符词项可以被检索")
    void testSingleCharacterTerm() throws IOException {
        SearchResult result = queryEngine.search("I");

        assertEquals(1, result.totalMatches());
        assertEquals(List.of(new HighlightSpan(0, 1)), result.hits().get(0).highlights());
    }

    @Test
    @DisplayName("文档在建索引后被修改：越界位置被丢弃")
    void testStalePositionsDropped() throws IOException {
        Files.writeString(sourceDir.resolve("2.txt"), "I");

        SearchResult result = queryEngine.search("go");

        assertEquals(2, result.totalMatches());
        assertTrue(result.hits().get(1).highlights().isEmpty());
    }

    @Test
    @DisplayName("命中文档被删除时查询失败")
    void testDeletedDocument() throws IOException {
        Files.delete(sourceDir.resolve("1.txt"));

        DocumentReadException exception = assertThrows(DocumentReadException.class, () -> queryEngine.search("fun"));
        assertEquals(sourceDir.resolve("1.txt"), exception.getPath());
    }

    @Test
    @DisplayName("倒排引用未知文档时报告索引损坏")
    void testUnknownDocumentInPostings() {
        TreeMap<String, PostingList> terms = new TreeMap<>();
        terms.put("ghost", new PostingList(List.of(new Posting(9, new int[] {0}))));
        QueryEngine engine = new QueryEngine(new InvertedIndex(new DocumentTable(), terms));

        assertThrows(IndexParseException.class, () -> engine.search("ghost"));
    }

    @Test
    @DisplayName("索引文件不存在时打开失败")
    void testOpenMissingIndex() {
        assertThrows(IOException.class, () -> QueryEngine.open(tempDir.resolve("absent.dat")));
    }
}
