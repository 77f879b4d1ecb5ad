package com.invertedindex.storage;

import com.invertedindex.config.Constants;
import com.invertedindex.document.DocumentTable;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;
import java.util.zip.CheckedInputStream;

/**
 * 索引文件的顺序游标：打开时载入文档表，之后每次只在内存中保留当前词项的倒排列表。
 *
 * 文件只顺序读取一遍，CRC32 随读取累加，读完最后一个词项时与页脚比对；
 * 因此损坏可能在耗尽时才被发现，调用方必须读到耗尽才能信任已读出的内容。
 * 归并阶段为每个段持有一个游标，最终索引的全量加载也复用它逐条读取。
 */
public final class SegmentCursor implements AutoCloseable {
    private static final int MAX_TERM_BYTES = 1 << 20;

    private final Path path;
    private final int ordinal;
    private final DataInputStream input;
    private final CRC32 checksum;
    private final long fileLength;
    private final int termCount;
    private final DocumentTable documents;
    private int consumedTerms;
    private String currentTerm;
    private PostingList currentPostings;
    private boolean exhausted;
    private boolean closed;

    private SegmentCursor(Path path, int ordinal, DataInputStream input, CRC32 checksum, long fileLength,
                          int termCount, DocumentTable documents) {
        this.path = path;
        this.ordinal = ordinal;
        this.input = input;
        this.checksum = checksum;
        this.fileLength = fileLength;
        this.termCount = termCount;
        this.documents = documents;
    }

    /**
     * 打开文件并定位到第一个词项。
     *
     * @param path 文件路径
     * @param ordinal 游标序号，词项相同时按序号决定先后
     * @param expectedMagic 期望的文件魔数
     * @return 已定位的游标，文件无词项时 {@link #hasCurrent()} 为 false
     * @throws IndexParseException 文件损坏、截断或魔数不符时抛出
     * @throws IOException 读取失败时抛出
     */
    public static SegmentCursor open(Path path, int ordinal, int expectedMagic) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("文件路径不能为空");
        }
        String fileName = String.valueOf(path.getFileName());
        long fileLength = Files.size(path);
        if (fileLength < Constants.HEADER_BYTES + Integer.BYTES) {
            throw new IndexParseException("文件头不完整: " + fileName + ", length=" + fileLength);
        }

        // 校验和只统计实际消费的字节，缓冲层必须在 CheckedInputStream 之下
        CRC32 checksum = new CRC32();
        DataInputStream input = new DataInputStream(
            new CheckedInputStream(new BufferedInputStream(Files.newInputStream(path)), checksum));
        try {
            int magic = input.readInt();
            if (magic != expectedMagic) {
                throw new IndexParseException("文件 magic 不匹配: " + fileName + ", expected=" + Integer.toHexString(expectedMagic)
                    + ", actual=" + Integer.toHexString(magic));
            }
            short version = input.readShort();
            if (version != Constants.FORMAT_VERSION) {
                throw new IndexParseException("文件版本不支持: " + version + ", file=" + fileName);
            }
            int termCount = input.readInt();
            int docCount = input.readInt();
            if (termCount < 0 || docCount < 0 || termCount > fileLength || docCount > fileLength) {
                throw new IndexParseException("文件头计数非法: termCount=" + termCount + ", docCount=" + docCount + ", file=" + fileName);
            }
            DocumentTable documents = readDocumentTable(input, docCount, fileName);

            SegmentCursor cursor = new SegmentCursor(path, ordinal, input, checksum, fileLength, termCount, documents);
            cursor.advance();
            return cursor;
        } catch (EOFException exception) {
            input.close();
            throw new IndexParseException("文件被截断: " + fileName, exception);
        } catch (IOException | RuntimeException exception) {
            input.close();
            throw exception;
        }
    }

    /**
     * 前进到下一个词项；读完最后一个词项后校验 CRC 页脚且其后没有多余字节。
     *
     * @throws IOException 读取或解析失败时抛出
     */
    public void advance() throws IOException {
        ensureOpen();
        if (exhausted) {
            return;
        }
        if (consumedTerms >= termCount) {
            verifyTrailer();
            exhausted = true;
            currentTerm = null;
            currentPostings = null;
            return;
        }
        try {
            String term = readTerm();
            if (currentTerm != null && TermOrder.compare(term, currentTerm) <= 0) {
                throw new IndexParseException("词序损坏，term 未严格递增: " + term + ", file=" + path.getFileName());
            }
            currentPostings = readPostingList(term);
            currentTerm = term;
            consumedTerms++;
        } catch (EOFException exception) {
            throw new IndexParseException("文件被截断: " + path.getFileName() + ", 已读取词项=" + consumedTerms, exception);
        }
    }

    public boolean hasCurrent() {
        return currentTerm != null;
    }

    public String currentTerm() {
        if (currentTerm == null) {
            throw new IllegalStateException("游标已耗尽: " + path);
        }
        return currentTerm;
    }

    public PostingList currentPostings() {
        if (currentPostings == null) {
            throw new IllegalStateException("游标已耗尽: " + path);
        }
        return currentPostings;
    }

    public DocumentTable documents() {
        return documents;
    }

    public int termCount() {
        return termCount;
    }

    public int ordinal() {
        return ordinal;
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        input.close();
    }

    private static DocumentTable readDocumentTable(DataInputStream input, int docCount, String fileName) throws IOException {
        DocumentTable documents = new DocumentTable();
        int previousDocId = 0;
        for (int index = 0; index < docCount; index++) {
            int docId = VarIntCodec.readVarInt(input);
            if (docId <= previousDocId) {
                throw new IndexParseException("文档表 docId 未严格递增: " + docId + ", file=" + fileName);
            }
            String rawPath = new String(readBytes(input, MAX_TERM_BYTES, fileName), StandardCharsets.UTF_8);
            try {
                documents.put(docId, Path.of(rawPath));
            } catch (RuntimeException exception) {
                throw new IndexParseException("文档表路径非法: docId=" + docId + ", file=" + fileName, exception);
            }
            previousDocId = docId;
        }
        return documents;
    }

    private static byte[] readBytes(DataInputStream input, int maxLength, String fileName) throws IOException {
        int length = VarIntCodec.readVarInt(input);
        if (length > maxLength) {
            throw new IndexParseException("长度字段非法: " + length + ", file=" + fileName);
        }
        byte[] bytes = new byte[length];
        input.readFully(bytes);
        return bytes;
    }

    private String readTerm() throws IOException {
        byte[] termBytes = readBytes(input, MAX_TERM_BYTES, String.valueOf(path.getFileName()));
        if (termBytes.length == 0) {
            throw new IndexParseException("词项为空: file=" + path.getFileName());
        }
        return new String(termBytes, StandardCharsets.UTF_8);
    }

    private PostingList readPostingList(String term) throws IOException {
        int postingCount = VarIntCodec.readVarInt(input);
        if (postingCount == 0 || postingCount > documents.size()) {
            throw new IndexParseException("倒排列表长度非法: term=" + term + ", postingCount=" + postingCount
                + ", docCount=" + documents.size());
        }
        List<Posting> postings = new ArrayList<>(postingCount);
        int docId = 0;
        for (int index = 0; index < postingCount; index++) {
            int delta = VarIntCodec.readVarInt(input);
            if (delta == 0) {
                throw new IndexParseException("docId 未严格递增: term=" + term + ", index=" + index);
            }
            docId += delta;
            if (!documents.contains(docId)) {
                throw new IndexParseException("倒排引用了文档表中不存在的 docId: term=" + term + ", docId=" + docId);
            }
            int positionCount = VarIntCodec.readVarInt(input);
            if (positionCount == 0 || positionCount > fileLength) {
                throw new IndexParseException("位置数量非法: term=" + term + ", docId=" + docId
                    + ", positionCount=" + positionCount);
            }
            int[] positions = DeltaCodec.decodeDeltaVarInt(positionCount, input);
            postings.add(new Posting(docId, positions));
        }
        return new PostingList(postings);
    }

    private void verifyTrailer() throws IOException {
        long actualCrc32 = checksum.getValue();
        long expectedCrc32;
        try {
            expectedCrc32 = Integer.toUnsignedLong(input.readInt());
        } catch (EOFException exception) {
            throw new IndexParseException("文件缺少 CRC32 页脚: " + path.getFileName(), exception);
        }
        if (input.read() != -1) {
            throw new IndexParseException("文件包含未解析字节，可能已损坏: " + path.getFileName());
        }
        if (actualCrc32 != expectedCrc32) {
            throw new IndexParseException("CRC32 校验失败: " + path.getFileName() + ", expected=" + expectedCrc32
                + ", actual=" + actualCrc32);
        }
    }

    /**
     * 校验游标是否已经关闭。
     */
    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("SegmentCursor 已关闭");
        }
    }
}
