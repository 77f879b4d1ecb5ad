package com.invertedindex.storage;

import com.invertedindex.config.Constants;
import com.invertedindex.document.DocumentTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 索引文件格式集成测试，覆盖 round-trip、文件头布局、暂存提交与 CRC 防护。
 */
class StorageRoundTripTest {

    @TempDir
    Path tempDir;

    /**
     * 随机构造的索引写入后读回应完全一致。
     */
    @Test
    void indexRoundTrip() throws IOException {
        DocumentTable documents = new DocumentTable();
        for (int docId = 1; docId <= 40; docId++) {
            documents.put(docId, tempDir.resolve("doc-" + docId + ".txt"));
        }
        TreeMap<String, PostingList> expected = buildRandomPostings(documents.size(), new Random(7));

        Path indexPath = tempDir.resolve("index.dat");
        writeIndex(indexPath, Constants.INDEX_MAGIC, documents, expected);

        InvertedIndex index = IndexFileReader.read(indexPath);
        assertEquals(documents, index.documents());
        assertEquals(expected, index.terms());
        assertEquals(new InvertedIndex(documents, expected), index);
        assertTrue(index.lookup("missing").isEmpty());
    }

    /**
     * 空索引也是合法文件：零词项、零文档。
     */
    @Test
    void emptyIndexRoundTrip() throws IOException {
        Path indexPath = tempDir.resolve("empty.dat");
        writeIndex(indexPath, Constants.INDEX_MAGIC, new DocumentTable(), new TreeMap<>());

        InvertedIndex index = IndexFileReader.read(indexPath);
        assertEquals(0, index.termCount());
        assertEquals(0, index.documentCount());
        assertEquals(Constants.HEADER_BYTES + Integer.BYTES, Files.size(indexPath));
    }

    /**
     * 文件头为大端 magic、版本、回填的 termCount 与 docCount。
     */
    @Test
    void headerLayout() throws IOException {
        DocumentTable documents = new DocumentTable();
        documents.put(1, Path.of("a.txt"));
        TreeMap<String, PostingList> postings = new TreeMap<>();
        postings.put("alpha", new PostingList(List.of(new Posting(1, new int[] {0}))));
        postings.put("beta", new PostingList(List.of(new Posting(1, new int[] {6, 12}))));

        Path indexPath = tempDir.resolve("header.dat");
        writeIndex(indexPath, Constants.INDEX_MAGIC, documents, postings);

        try (DataInputStream input = new DataInputStream(Files.newInputStream(indexPath))) {
            assertEquals(Constants.INDEX_MAGIC, input.readInt());
            assertEquals(Constants.FORMAT_VERSION, input.readShort());
            assertEquals(2, input.readInt());
            assertEquals(1, input.readInt());
            assertEquals(1, VarIntCodec.readVarInt(input));
            byte[] path = new byte[VarIntCodec.readVarInt(input)];
            input.readFully(path);
            assertEquals("a.txt", new String(path, StandardCharsets.UTF_8));
        }
    }

    /**
     * CRC32 校验可拦截任意位置的单字节损坏。
     */
    @Test
    void crcCorruptionShouldThrow() throws IOException {
        Path indexPath = writeSmallIndex("crc.dat");
        long length = Files.size(indexPath);
        for (long offset : new long[] {0L, 7L, length / 2, length - 1}) {
            Path copy = tempDir.resolve("crc-" + offset + ".dat");
            Files.copy(indexPath, copy);
            corruptOneByte(copy, offset);
            assertThrows(IndexParseException.class, () -> IndexFileReader.read(copy));
        }
    }

    /**
     * 结构仍可解析的损坏（文档路径中的一个字节）只能由 CRC 发现，游标在读完最后一个词项时报告。
     */
    @Test
    void crcMismatchIsReportedWhenCursorIsExhausted() throws IOException {
        Path indexPath = writeSmallIndex("late-crc.dat");
        // 文件头之后依次是 docId、路径长度与 "one.txt"
        corruptOneByte(indexPath, Constants.HEADER_BYTES + 3);

        try (SegmentCursor cursor = SegmentCursor.open(indexPath, 0, Constants.INDEX_MAGIC)) {
            assertEquals("fun", cursor.currentTerm());
            cursor.advance();
            cursor.advance();
            assertEquals("is", cursor.currentTerm());
            IndexParseException exception = assertThrows(IndexParseException.class, cursor::advance);
            assertTrue(exception.getMessage().contains("CRC32"));
        }
        assertThrows(IndexParseException.class, () -> IndexFileReader.read(indexPath));
    }

    /**
     * 截断的文件同样视为损坏。
     */
    @Test
    void truncatedFileShouldThrow() throws IOException {
        Path indexPath = writeSmallIndex("truncated.dat");
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(indexPath.toFile(), "rw")) {
            randomAccessFile.setLength(randomAccessFile.length() - 6);
        }
        assertThrows(IndexParseException.class, () -> IndexFileReader.read(indexPath));

        Path tiny = tempDir.resolve("tiny.dat");
        Files.write(tiny, new byte[] {1, 2});
        assertThrows(IndexParseException.class, () -> IndexFileReader.read(tiny));
    }

    /**
     * 段文件不能当作最终索引读取。
     */
    @Test
    void segmentMagicIsRejectedByIndexReader() throws IOException {
        DocumentTable documents = new DocumentTable();
        documents.put(1, Path.of("a.txt"));
        TreeMap<String, PostingList> postings = new TreeMap<>();
        postings.put("go", new PostingList(List.of(new Posting(1, new int[] {0}))));
        Path segmentPath = tempDir.resolve("seg-00000000.seg");
        writeIndex(segmentPath, Constants.SEGMENT_MAGIC, documents, postings);

        assertThrows(IndexParseException.class, () -> IndexFileReader.read(segmentPath));
        try (SegmentCursor cursor = SegmentCursor.open(segmentPath, 0, Constants.SEGMENT_MAGIC)) {
            assertEquals("go", cursor.currentTerm());
        }
    }

    /**
     * 倒排引用了文档表中不存在的 docId 时读取失败。
     */
    @Test
    void postingForUnknownDocumentShouldThrow() throws IOException {
        DocumentTable documents = new DocumentTable();
        documents.put(1, Path.of("a.txt"));
        TreeMap<String, PostingList> postings = new TreeMap<>();
        postings.put("ghost", new PostingList(List.of(new Posting(2, new int[] {0}))));
        Path indexPath = tempDir.resolve("ghost.dat");
        writeIndex(indexPath, Constants.INDEX_MAGIC, documents, postings);

        assertThrows(IndexParseException.class, () -> IndexFileReader.read(indexPath));
    }

    /**
     * 游标按字典序逐条返回词项，耗尽后保持耗尽。
     */
    @Test
    void cursorStreamsTermsInOrder() throws IOException {
        Path indexPath = writeSmallIndex("cursor.dat");
        List<String> terms = new ArrayList<>();
        try (SegmentCursor cursor = SegmentCursor.open(indexPath, 3, Constants.INDEX_MAGIC)) {
            assertEquals(3, cursor.ordinal());
            assertEquals(3, cursor.termCount());
            while (cursor.hasCurrent()) {
                terms.add(cursor.currentTerm());
                cursor.advance();
            }
            cursor.advance();
            assertFalse(cursor.hasCurrent());
            assertThrows(IllegalStateException.class, cursor::currentTerm);
        }
        assertEquals(List.of("fun", "go", "is"), terms);
    }

    /**
     * 未完成即关闭的写入器不会留下目标文件或暂存文件；完成后覆盖旧文件。
     */
    @Test
    void writerCommitsAtomically() throws IOException {
        Path indexPath = tempDir.resolve("atomic.dat");
        Path stagingPath = tempDir.resolve("atomic.dat" + Constants.STAGING_SUFFIX);

        DocumentTable documents = new DocumentTable();
        documents.put(1, Path.of("a.txt"));
        try (IndexFileWriter writer = new IndexFileWriter(indexPath, Constants.INDEX_MAGIC, documents)) {
            writer.writeTerm("abandoned", new PostingList(List.of(new Posting(1, new int[] {0}))));
            assertTrue(Files.exists(stagingPath));
            assertFalse(Files.exists(indexPath));
        }
        assertFalse(Files.exists(stagingPath));
        assertFalse(Files.exists(indexPath));

        Files.writeString(indexPath, "stale content");
        writeIndex(indexPath, Constants.INDEX_MAGIC, documents, new TreeMap<>());
        assertEquals(0, IndexFileReader.read(indexPath).termCount());
        assertFalse(Files.exists(stagingPath));
    }

    /**
     * 写入器拒绝非递增词项、空倒排以及关闭后的写入。
     */
    @Test
    void writerRejectsMisuse() throws IOException {
        DocumentTable documents = new DocumentTable();
        documents.put(1, Path.of("a.txt"));
        PostingList postingList = new PostingList(List.of(new Posting(1, new int[] {0})));
        Path indexPath = tempDir.resolve("misuse.dat");

        IndexFileWriter writer = new IndexFileWriter(indexPath, Constants.INDEX_MAGIC, documents);
        writer.writeTerm("beta", postingList);
        assertThrows(IllegalArgumentException.class, () -> writer.writeTerm("alpha", postingList));
        assertThrows(IllegalArgumentException.class, () -> writer.writeTerm("beta", postingList));
        assertThrows(IllegalArgumentException.class, () -> writer.writeTerm("gamma", PostingList.empty()));
        writer.finish();
        assertThrows(IllegalStateException.class, () -> writer.writeTerm("zeta", postingList));
        writer.close();

        assertThrows(IllegalArgumentException.class,
            () -> new IndexFileWriter(indexPath, 0x12345678, documents));
    }

    private Path writeSmallIndex(String fileName) throws IOException {
        DocumentTable documents = new DocumentTable();
        documents.put(1, Path.of("one.txt"));
        documents.put(2, Path.of("two.txt"));
        TreeMap<String, PostingList> postings = new TreeMap<>();
        postings.put("go", new PostingList(List.of(new Posting(1, new int[] {0}), new Posting(2, new int[] {7}))));
        postings.put("is", new PostingList(List.of(new Posting(1, new int[] {3}))));
        postings.put("fun", new PostingList(List.of(new Posting(1, new int[] {6}))));
        Path indexPath = tempDir.resolve(fileName);
        writeIndex(indexPath, Constants.INDEX_MAGIC, documents, postings);
        return indexPath;
    }

    private void writeIndex(Path path, int magic, DocumentTable documents, Map<String, PostingList> postings)
        throws IOException {
        try (IndexFileWriter writer = new IndexFileWriter(path, magic, documents)) {
            for (Map.Entry<String, PostingList> entry : new TreeMap<>(postings).entrySet()) {
                writer.writeTerm(entry.getKey(), entry.getValue());
            }
            writer.finish();
            assertEquals(postings.size(), writer.getTermCount());
        }
    }

    /**
     * 构造随机词项与倒排列表，docId 与位置严格递增。
     */
    private TreeMap<String, PostingList> buildRandomPostings(int documentCount, Random random) {
        TreeMap<String, PostingList> postings = new TreeMap<>();
        for (int termIndex = 0; termIndex < 120; termIndex++) {
            String term = "term" + Integer.toString(random.nextInt(1_000_000), 36);
            List<Posting> list = new ArrayList<>();
            for (int docId = 1; docId <= documentCount; docId++) {
                if (random.nextInt(4) != 0) {
                    continue;
                }
                int[] positions = new int[random.nextInt(5) + 1];
                int position = random.nextInt(10);
                for (int index = 0; index < positions.length; index++) {
                    positions[index] = position;
                    position += random.nextInt(300) + 1;
                }
                list.add(new Posting(docId, positions));
            }
            if (list.isEmpty()) {
                list.add(new Posting(1, new int[] {0}));
            }
            postings.put(term, new PostingList(list));
        }
        return postings;
    }

    /**
     * 定位到指定偏移并翻转一个字节，模拟磁盘损坏。
     */
    private void corruptOneByte(Path file, long offset) throws IOException {
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file.toFile(), "rw")) {
            randomAccessFile.seek(offset);
            int origin = randomAccessFile.readUnsignedByte();
            randomAccessFile.seek(offset);
            randomAccessFile.writeByte(origin ^ 0xFF);
        }
    }
}
