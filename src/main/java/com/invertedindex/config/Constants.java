package com.invertedindex.config;

/**
 * 全局常量定义
 *
 * 包含存储格式魔数、段刷写与归并参数、线程参数和高亮参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 存储格式魔数 ====================
    /** 最终索引文件魔数 "IIXF" */
    public static final int INDEX_MAGIC = 0x49495846;
    /** 临时段文件魔数 "IISG" */
    public static final int SEGMENT_MAGIC = 0x49495347;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;
    /** 文件头长度：magic + version + termCount + docCount */
    public static final int HEADER_BYTES = Integer.BYTES + Short.BYTES + Integer.BYTES + Integer.BYTES;
    /** termCount 字段在文件头中的偏移，关闭写入器时回填 */
    public static final long TERM_COUNT_OFFSET = Integer.BYTES + Short.BYTES;

    // ==================== 索引参数 ====================
    /** 默认最终索引输出路径 */
    public static final String DEFAULT_INDEX_FILE = "index.dat";
    /** 元数据旁路文件后缀 */
    public static final String META_SUFFIX = ".meta.json";
    /** 内存批次累计位置数上限，达到后刷写为一个段 */
    public static final long DEFAULT_SEGMENT_FLUSH_THRESHOLD = 1_000_000L;
    /** 单轮归并的最大段数，超过后先做中间归并 */
    public static final int DEFAULT_MERGE_FACTOR = 8;
    /** 段文件后缀 */
    public static final String SEGMENT_SUFFIX = ".seg";
    /** 写入中的暂存文件后缀，完成后原子重命名 */
    public static final String STAGING_SUFFIX = ".partial";

    // ==================== 线程参数 ====================
    /** 默认索引工作线程数 */
    public static final int DEFAULT_INDEX_THREADS = Runtime.getRuntime().availableProcessors();
    /** 工作线程数安全上限 */
    public static final int MAX_INDEX_THREADS = 64;
    /** 取消后等待工作线程退出的秒数 */
    public static final long WORKER_SHUTDOWN_TIMEOUT_SECONDS = 30;

    // ==================== 高亮参数 ====================
    /** 终端高亮起始序列（红色） */
    public static final String ANSI_HIGHLIGHT = "\u001B[31m";
    /** 终端高亮结束序列 */
    public static final String ANSI_RESET = "\u001B[0m";
}
