package com.gdin.inspection.perspective.util;

import cn.hutool.core.util.StrUtil;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 文档 id 相关的小工具。
 */
public final class DocumentIds {

    private DocumentIds() {
    }

    /**
     * 升序比较：两个 id 都是纯数字时按数值比较，否则按字符串比较；数字 id 排在非数字 id 之前。
     */
    public static final Comparator<String> ASCENDING = (a, b) -> {
        boolean an = isNumeric(a);
        boolean bn = isNumeric(b);
        if (an && bn) {
            int c = new BigInteger(a).compareTo(new BigInteger(b));
            return c != 0 ? c : a.compareTo(b);
        }
        if (an) return -1;
        if (bn) return 1;
        return a.compareTo(b);
    };

    private static final Pattern DOC_PREFIX = Pattern.compile("^(?i)doc(?:ument)?(?:\\s*[:#_-]\\s*|\\s+|(?=\\d))(.+)$");

    /**
     * 模型有时会把 id 写成 "Doc 205" / "[Doc 205]" / "doc_205"，这里统一还原成 "205"。
     * 只有 doc 后面紧跟分隔符、空白或数字时才当作前缀，"document" 这类 id 原样保留。
     */
    public static String normalize(String raw) {
        if (raw == null) return null;
        String t = StrUtil.strip(raw.trim(), "[", "]").trim();
        Matcher m = DOC_PREFIX.matcher(t);
        if (m.matches()) t = m.group(1).trim();
        return t;
    }

    private static boolean isNumeric(String s) {
        return StrUtil.isNotEmpty(s) && StrUtil.isNumeric(s);
    }
}
