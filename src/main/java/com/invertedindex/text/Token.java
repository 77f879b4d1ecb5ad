package com.invertedindex.text;

/**
 * 词项及其在原文中的序号与字符偏移（UTF-16 下标，左闭右开）。
 */
public record Token(
    String term,
    int position,
    int startOffset,
    int endOffset
) {
    public int length() {
        return endOffset - startOffset;
    }
}
