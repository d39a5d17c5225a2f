package com.gdin.inspection.perspective.util;

import cn.hutool.core.util.StrUtil;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.gdin.inspection.perspective.exception.GenerationException;
import com.gdin.inspection.perspective.exception.GenerationTimeoutException;
import dev.langchain4j.service.TokenStream;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * 大模型响应的收集与清洗。
 */
@Slf4j
public class ResponseUtil {

    private static final Pattern THINK = Pattern.compile("<think>.*?</think>", Pattern.DOTALL);
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?]|[.!?][\"”])\\s+");
    private static final Pattern DECORATION = Pattern.compile("^[*\"“”\\s]+|[*\"“”\\s]+$");
    private static final Pattern LEADING_LABEL = Pattern.compile(
            "^(?i)(perspective|claim|answer|summary)\\s*(\\d+)?\\s*[:：-]\\s*");

    private ResponseUtil() {
    }

    public static String removeThink(String response) {
        if (response == null) return null;
        // 去掉<think></think>标签以及其中的所有内容
        return THINK.matcher(response).replaceAll("");
    }

    public static String getResponseWithoutThink(TokenStream tokenStream, String id, long timeoutMillis) throws InterruptedException {
        return removeThink(getResponse(tokenStream, id, timeoutMillis));
    }

    /**
     * 阻塞收集流式响应，最多等待 timeoutMillis。
     * 超时抛 {@link GenerationTimeoutException}，模型报错或返回为空抛 {@link GenerationException}。
     * <p>
     * TokenStream 没有取消接口，超时后底层请求仍会跑完；此后到达的回调一律丢弃。
     */
    public static String getResponse(TokenStream tokenStream, String id, long timeoutMillis) throws InterruptedException {
        StringBuffer result = new StringBuffer();
        AtomicReference<Throwable> error = new AtomicReference<>();
        AtomicBoolean abandoned = new AtomicBoolean(false);
        CountDownLatch latch = new CountDownLatch(1);
        long startTime = System.currentTimeMillis();

        tokenStream.onPartialResponse(s -> {
                    if (abandoned.get()) return;
                    if (result.length() == 0) {
                        log.debug("[{}] first token after {} ms", id, System.currentTimeMillis() - startTime);
                    }
                    result.append(s);
                })
                .onCompleteResponse(chatResponse -> {
                    if (abandoned.get()) {
                        log.debug("[{}] late response dropped", id);
                        return;
                    }
                    log.debug("[{}] 返回内容: {}", id, result);
                    log.info("[{}] 耗时: {}ms", id, System.currentTimeMillis() - startTime);
                    latch.countDown();
                })
                .onError(throwable -> {
                    if (abandoned.get()) {
                        log.debug("[{}] late error dropped: {}", id, throwable.getMessage());
                        return;
                    }
                    log.error("[{}] generation failed: {}", id, throwable.getMessage());
                    error.set(throwable);
                    latch.countDown();
                })
                .start();

        if (!latch.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
            abandoned.set(true);
            throw new GenerationTimeoutException(id, timeoutMillis);
        }
        if (error.get() != null) {
            throw new GenerationException("generation [" + id + "] failed: " + error.get().getMessage(), error.get());
        }
        if (result.length() == 0) throw new GenerationException("调用失败, 返回为空");
        return result.toString();
    }

    public static JSONObject getJSONResponse(String response) {
        // 去掉think的内容
        String answer = removeThink(response);
        if (StrUtil.isBlank(answer)) return new JSONObject();
        // 获取文本中的json部分, 即{}中的内容
        if (answer.indexOf('{') == -1) answer = "{" + answer + "}";
        int begin = answer.indexOf('{');
        int end = answer.lastIndexOf('}');
        if (end < begin) throw new JSONException("unterminated JSON object in response");
        JSONObject json = JSONObject.parseObject(answer.substring(begin, end + 1));
        return json == null ? new JSONObject() : json;
    }

    /**
     * 把模型输出清洗成一句话：去 think、去引号 / 前缀标签，只保留第一句。
     */
    public static String firstSentence(String response) {
        String text = removeThink(response);
        if (StrUtil.isBlank(text)) return "";
        text = text.trim();
        // 只看第一段
        int nl = text.indexOf('\n');
        if (nl > 0) text = text.substring(0, nl).trim();
        text = trimDecoration(text);
        text = LEADING_LABEL.matcher(text).replaceFirst("");
        text = trimDecoration(text);
        String[] sentences = SENTENCE_END.split(text, 2);
        return sentences.length == 0 ? "" : trimDecoration(sentences[0]);
    }

    // 去掉首尾的 markdown 加粗和引号
    private static String trimDecoration(String text) {
        return DECORATION.matcher(text).replaceAll("");
    }
}
