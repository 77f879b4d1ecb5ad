package com.invertedindex.storage;

import com.invertedindex.config.Constants;
import com.invertedindex.document.DocumentTable;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 索引文件写入器，最终索引与临时段共用同一布局，仅魔数不同。
 *
 * <pre>
 * int    magic
 * short  version
 * int    termCount            完成时回填
 * int    docCount
 * docCount  × { VarInt docId, VarInt pathLength, path bytes }
 * termCount × { VarInt termLength, term bytes, VarInt postingCount,
 *               postingCount × { VarInt docIdDelta, VarInt positionCount, positionCount × VarInt positionDelta } }
 * int    CRC32
 * </pre>
 *
 * 内容先写入同目录暂存文件，{@link #finish()} 成功后才原子替换到目标路径；
 * 未完成即关闭时删除暂存文件，读取方永远看不到写了一半的文件。
 */
public final class IndexFileWriter implements AutoCloseable {
    private final Path targetPath;
    private final Path stagingPath;
    private final DataOutputStream output;
    private int termCount;
    private String lastTerm;
    private boolean finished;
    private boolean closed;

    /**
     * 创建写入器并写入文件头与文档表。
     *
     * @param targetPath 目标文件
     * @param magic {@link Constants#INDEX_MAGIC} 或 {@link Constants#SEGMENT_MAGIC}
     * @param documents 文件覆盖的文档表
     * @throws IOException 初始化失败时抛出
     */
    public IndexFileWriter(Path targetPath, int magic, DocumentTable documents) throws IOException {
        if (targetPath == null || targetPath.getFileName() == null) {
            throw new IllegalArgumentException("目标文件不能为空");
        }
        if (magic != Constants.INDEX_MAGIC && magic != Constants.SEGMENT_MAGIC) {
            throw new IllegalArgumentException("未知文件魔数: " + Integer.toHexString(magic));
        }
        if (documents == null) {
            throw new IllegalArgumentException("文档表不能为空");
        }
        this.targetPath = targetPath;
        this.stagingPath = StorageFileUtil.stagingPathFor(targetPath, Constants.STAGING_SUFFIX);
        this.output = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(stagingPath)));
        try {
            writeHeader(magic, documents);
        } catch (IOException | RuntimeException exception) {
            close();
            throw exception;
        }
    }

    /**
     * 写入一个词项及其倒排列表，要求 term 按 {@link TermOrder} 严格递增。
     *
     * @param term 词项
     * @param postingList 非空倒排列表
     * @throws IOException 写入失败时抛出
     */
    public void writeTerm(String term, PostingList postingList) throws IOException {
        ensureOpen();
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("term 不能为空");
        }
        if (postingList == null || postingList.isEmpty()) {
            throw new IllegalArgumentException("倒排列表不能为空, term=" + term);
        }
        if (lastTerm != null && TermOrder.compare(term, lastTerm) <= 0) {
            throw new IllegalArgumentException("term 必须严格递增，last=" + lastTerm + ", current=" + term);
        }

        writeBytes(term.getBytes(StandardCharsets.UTF_8));
        VarIntCodec.writeVarInt(postingList.size(), output);
        int previousDocId = 0;
        for (Posting posting : postingList.postings()) {
            VarIntCodec.writeVarInt(posting.docId() - previousDocId, output);
            VarIntCodec.writeVarInt(posting.frequency(), output);
            DeltaCodec.encodeDeltaVarInt(posting.positions(), output);
            previousDocId = posting.docId();
        }

        termCount++;
        lastTerm = term;
    }

    /**
     * 回填 termCount、追加 CRC32 页脚并原子提交到目标路径。
     *
     * termCount 位于文件头且在写完全部词项后才确定，CRC 需要在回填之后统一计算，暂存文件因此被完整读取一遍。
     *
     * @throws IOException 提交失败时抛出，暂存文件会被删除
     */
    public void finish() throws IOException {
        ensureOpen();
        try {
            output.close();
            try (RandomAccessFile randomAccessFile = new RandomAccessFile(stagingPath.toFile(), "rw")) {
                randomAccessFile.seek(Constants.TERM_COUNT_OFFSET);
                randomAccessFile.writeInt(termCount);
                StorageFileUtil.appendCrc32Footer(randomAccessFile);
            }
            StorageFileUtil.commit(stagingPath, targetPath);
            finished = true;
        } catch (IOException exception) {
            Files.deleteIfExists(stagingPath);
            throw new IOException("提交索引文件失败: file=" + targetPath + ", termCount=" + termCount, exception);
        } finally {
            closed = true;
        }
    }

    /**
     * 未调用 {@link #finish()} 时放弃写入并删除暂存文件。
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            output.close();
        } finally {
            Files.deleteIfExists(stagingPath);
        }
    }

    public int getTermCount() {
        return termCount;
    }

    public Path getTargetPath() {
        return targetPath;
    }

    private void writeHeader(int magic, DocumentTable documents) throws IOException {
        output.writeInt(magic);
        output.writeShort(Constants.FORMAT_VERSION);
        output.writeInt(0);
        output.writeInt(documents.size());
        for (Map.Entry<Integer, Path> entry : documents.entries().entrySet()) {
            VarIntCodec.writeVarInt(entry.getKey(), output);
            writeBytes(entry.getValue().toString().getBytes(StandardCharsets.UTF_8));
        }
    }

    private void writeBytes(byte[] bytes) throws IOException {
        VarIntCodec.writeVarInt(bytes.length, output);
        output.write(bytes);
    }

    /**
     * 校验写入器状态，防止关闭后继续写入。
     */
    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("IndexFileWriter 已关闭");
        }
    }
}
