package com.invertedindex.storage;

import java.io.IOException;

/**
 * 索引或段文件损坏、截断、版本不兼容或内容违反排序约束。
 */
public class IndexParseException extends IOException {

    public IndexParseException(String message) {
        super(message);
    }

    public IndexParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
