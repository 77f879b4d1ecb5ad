package com.invertedindex.text;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * 字母数字分词器：连续的 Unicode 字母或数字构成一个词项，其余字符均为分隔符。
 *
 * 词项统一按 {@link Locale#ROOT} 转为小写，偏移为原文中的 char 下标，与高亮阶段使用同一单位。
 */
public class AlphanumericTokenizer implements Tokenizer {

    /**
     * 返回可重复遍历的惰性词项序列，空文本或 null 返回空序列。
     */
    @Override
    public Iterable<Token> tokens(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return () -> new TokenIterator(text);
    }

    @Override
    public String normalize(String rawTerm) {
        if (rawTerm == null) {
            return "";
        }
        return rawTerm.toLowerCase(Locale.ROOT);
    }

    /**
     * 从指定偏移开始计算连续字母数字片段的长度（char 数），偏移处不是词项字符时返回 0。
     */
    public static int termExtent(CharSequence text, int startOffset) {
        if (text == null || startOffset < 0 || startOffset >= text.length()) {
            return 0;
        }
        int cursor = startOffset;
        while (cursor < text.length()) {
            int codePoint = Character.codePointAt(text, cursor);
            if (!isTermChar(codePoint)) {
                break;
            }
            cursor += Character.charCount(codePoint);
        }
        return cursor - startOffset;
    }

    static boolean isTermChar(int codePoint) {
        return Character.isLetterOrDigit(codePoint);
    }

    /**
     * 单次扫描迭代器，按码点前进以正确处理代理对。
     */
    private final class TokenIterator implements Iterator<Token> {
        private final String text;
        private int cursor;
        private int nextPosition;
        private Token pending;

        private TokenIterator(String text) {
            this.text = text;
        }

        @Override
        public boolean hasNext() {
            if (pending == null) {
                pending = advance();
            }
            return pending != null;
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Token current = pending;
            pending = null;
            return current;
        }

        private Token advance() {
            while (cursor < text.length()) {
                int codePoint = text.codePointAt(cursor);
                if (isTermChar(codePoint)) {
                    break;
                }
                cursor += Character.charCount(codePoint);
            }
            if (cursor >= text.length()) {
                return null;
            }
            int startOffset = cursor;
            int endOffset = startOffset + termExtent(text, startOffset);
            cursor = endOffset;
            String term = normalize(text.substring(startOffset, endOffset));
            return new Token(term, nextPosition++, startOffset, endOffset);
        }
    }
}
