package com.gdin.inspection.perspective.doc.tokenizer;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.perspective.pojo.Token;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 英文分词，基于 Lucene EnglishAnalyzer：小写化、去停用词、去所有格、Porter 词干化。
 * 单字符词不要。
 */
@Component
public class EnglishTokenizer implements ITokenizer {

    private static final String FIELD = "text";

    // Analyzer 内部按线程复用组件，可以多线程共享
    private final Analyzer analyzer = new EnglishAnalyzer();

    @Override
    public List<Token> parse(String text) {
        List<Token> tokens = new ArrayList<>();
        if (StrUtil.isBlank(text)) return tokens;

        try (TokenStream stream = analyzer.tokenStream(FIELD, text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            PositionIncrementAttribute increment = stream.addAttribute(PositionIncrementAttribute.class);
            stream.reset();
            // 停用词留下的空位也计入词序
            int position = -1;
            while (stream.incrementToken()) {
                position += increment.getPositionIncrement();
                String word = term.toString();
                if (word.length() < 2) continue;
                tokens.add(Token.builder().word(word).position(position).build());
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to tokenize text", e);
        }
        return tokens;
    }
}
