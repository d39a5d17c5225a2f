package com.gdin.inspection.perspective.doc.tokenizer;

import com.gdin.inspection.perspective.pojo.Token;

import java.util.List;

public interface ITokenizer {

    List<Token> parse(String text);

    /**
     * 仅取词形，供检索 / 相似度计算使用
     */
    default List<String> terms(String text) {
        return parse(text).stream().map(Token::getWord).toList();
    }
}
