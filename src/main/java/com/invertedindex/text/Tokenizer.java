package com.invertedindex.text;

import java.util.ArrayList;
import java.util.List;

public interface Tokenizer {

    /**
     * 返回惰性词项序列，每次调用 iterator() 都从文本开头重新扫描。
     */
    Iterable<Token> tokens(String text);

    /**
     * 将输入文本切分为词项列表。
     */
    default List<Token> tokenize(String text) {
        List<Token> collected = new ArrayList<>();
        for (Token token : tokens(text)) {
            collected.add(token);
        }
        return List.copyOf(collected);
    }

    /**
     * 按与索引阶段一致的规则归一化单个词项。
     */
    String normalize(String rawTerm);
}
