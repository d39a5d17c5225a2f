package com.gdin.inspection.perspective.service;

/**
 * 文本生成能力（黑盒）。实现必须保证调用有超时，不会无限阻塞。
 */
@FunctionalInterface
public interface TextGenerator {

    String generate(String prompt);
}
