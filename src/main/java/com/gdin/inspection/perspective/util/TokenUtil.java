package com.gdin.inspection.perspective.util;

import cn.hutool.core.util.StrUtil;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import org.springframework.stereotype.Component;

/**
 * 基于 jtokkit 的 token 计数 / 截断，用于控制 prompt 中单篇文档的长度。
 */
@Component
public class TokenUtil {

    private final Encoding encoding;

    public TokenUtil() {
        EncodingRegistry registry = Encodings.newLazyEncodingRegistry();
        encoding = registry.getEncodingForModel("gpt-4")
                .orElseThrow(() -> new IllegalStateException("gpt-4 encoding not available"));
    }

    public int getTokenCount(String text) {
        if (StrUtil.isEmpty(text)) return 0;
        return encoding.countTokens(text);
    }

    /**
     * 超过 maxTokens 时截断到 maxTokens 个 token；maxTokens<=0 表示不限制
     */
    public String truncate(String text, int maxTokens) {
        if (StrUtil.isEmpty(text) || maxTokens <= 0) return text;
        if (getTokenCount(text) <= maxTokens) return text;
        return encoding.decode(encoding.encode(text, maxTokens).getTokens());
    }
}
