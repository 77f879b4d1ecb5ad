package com.invertedindex.storage;

import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.CRC32;

/**
 * 存储文件工具方法，封装 CRC32 页脚读写与暂存文件提交逻辑。
 */
public final class StorageFileUtil {
    private StorageFileUtil() {
    }

    /**
     * 计算指定前缀字节区间的 CRC32。
     *
     * @param randomAccessFile 源文件
     * @param length 参与校验的字节长度
     * @return CRC32 无符号值
     * @throws IOException 读取失败时抛出
     */
    static long computeCrc32(RandomAccessFile randomAccessFile, long length) throws IOException {
        long originalPointer = randomAccessFile.getFilePointer();
        CRC32 crc32 = new CRC32();
        byte[] buffer = new byte[8 * 1024];
        long remainingBytes = length;
        randomAccessFile.seek(0L);
        while (remainingBytes > 0) {
            int chunkSize = (int) Math.min(buffer.length, remainingBytes);
            int readBytes = randomAccessFile.read(buffer, 0, chunkSize);
            if (readBytes < 0) {
                throw new EOFException("计算 CRC32 时遇到 EOF");
            }
            crc32.update(buffer, 0, readBytes);
            remainingBytes -= readBytes;
        }
        randomAccessFile.seek(originalPointer);
        return crc32.getValue();
    }

    /**
     * 在文件尾部追加 CRC32 页脚。
     *
     * @param randomAccessFile 目标文件
     * @throws IOException 写入失败时抛出
     */
    static void appendCrc32Footer(RandomAccessFile randomAccessFile) throws IOException {
        long dataLength = randomAccessFile.length();
        long crc32Value = computeCrc32(randomAccessFile, dataLength);
        randomAccessFile.seek(dataLength);
        randomAccessFile.writeInt((int) crc32Value);
    }

    /**
     * 将暂存文件原子地替换到目标路径，文件系统不支持原子移动时退化为普通替换。
     */
    public static void commit(Path stagingPath, Path targetPath) throws IOException {
        try {
            Files.move(stagingPath, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException exception) {
            Files.move(stagingPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * 为目标文件生成同目录下的暂存路径。
     */
    public static Path stagingPathFor(Path targetPath, String stagingSuffix) {
        return targetPath.resolveSibling(targetPath.getFileName().toString() + stagingSuffix);
    }
}
