package com.gdin.inspection.perspective.models;

/**
 * 立场极性：支持 / 反对。
 */
public enum Polarity {
    PRO,
    CON;

    /**
     * 宽松解析模型输出的立场标签，无法识别时返回 null（由调用方决定丢弃）。
     */
    public static Polarity parseLoose(String label) {
        if (label == null) return null;
        String t = label.trim().toUpperCase();
        if (t.startsWith("PRO") || t.equals("FAVOR") || t.equals("SUPPORT")) return PRO;
        if (t.startsWith("CON") || t.equals("AGAINST") || t.equals("OPPOSE")) return CON;
        return null;
    }
}
