package com.invertedindex.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.invertedindex.config.Constants;
import com.invertedindex.storage.StorageFileUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * 索引元数据，构建成功后以 JSON 写在索引文件旁（{@code <index>.meta.json}），供 status 命令读取。
 */
public record IndexMeta(
    String indexFile,
    int formatVersion,
    int documentCount,
    int termCount,
    long wordCount,
    int segmentCount,
    int mergePasses,
    boolean singleThreaded,
    int workerCount,
    long elapsedMillis,
    Instant createTime
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * 计算索引文件对应的元数据路径。
     */
    public static Path metaPathFor(Path indexPath) {
        if (indexPath == null || indexPath.getFileName() == null) {
            throw new IllegalArgumentException("索引路径不能为空");
        }
        return indexPath.resolveSibling(indexPath.getFileName().toString() + Constants.META_SUFFIX);
    }

    /**
     * 将元数据写入指定 JSON 文件。先写同目录暂存文件再原子替换，失败时原有文件保持不变。
     *
     * @param file 元数据文件
     * @throws IOException 写入或提交失败时抛出
     */
    public void writeTo(Path file) throws IOException {
        if (file == null || file.getFileName() == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        Path stagingPath = StorageFileUtil.stagingPathFor(file, Constants.STAGING_SUFFIX);
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(stagingPath.toFile(), this);
            StorageFileUtil.commit(stagingPath, file);
        } catch (IOException exception) {
            IOException failure = new IOException("写入索引元数据失败: " + file.toAbsolutePath(), exception);
            try {
                Files.deleteIfExists(stagingPath);
            } catch (IOException cleanupException) {
                failure.addSuppressed(cleanupException);
            }
            throw failure;
        }
    }

    /**
     * 从指定 JSON 文件读取元数据。
     *
     * @param file 元数据文件
     * @return 反序列化后的元数据
     * @throws IOException 读取或解析失败时抛出
     */
    public static IndexMeta readFrom(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file.toFile(), IndexMeta.class);
        } catch (IOException exception) {
            throw new IOException("读取索引元数据失败: " + file.toAbsolutePath(), exception);
        }
    }
}
