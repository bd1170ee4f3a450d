package com.aura.domain.screening.service;

import org.springframework.stereotype.Service;

/**
 * 模型输出清洗领域服务：去除 Markdown 代码围栏并截取首尾 JSON 括号之间的内容。
 * <p>
 * 只做规范化，不做括号配平；结果是否可解析由调用方判断。
 * 对同一输入多次清洗的结果与清洗一次相同。
 * </p>
 */
@Service
public class TextSanitizerDomainService {

    private static final String FENCE = "```";

    public String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.trim();
        text = stripFence(text);

        if (!text.startsWith("{") && !text.startsWith("[")) {
            int start = firstIndex(text.indexOf('{'), text.indexOf('['));
            if (start >= 0) {
                text = text.substring(start);
            }
        }

        int end = Math.max(text.lastIndexOf('}'), text.lastIndexOf(']'));
        if (end >= 0) {
            text = text.substring(0, end + 1);
        }
        return text;
    }

    private String stripFence(String text) {
        String current = text;
        String stripped = stripFenceOnce(current);
        while (!stripped.equals(current)) {
            current = stripped;
            stripped = stripFenceOnce(current);
        }
        return stripped;
    }

    private String stripFenceOnce(String text) {
        String result = text;
        if (result.startsWith(FENCE)) {
            int cursor = FENCE.length();
            while (cursor < result.length() && isTagChar(result.charAt(cursor))) {
                cursor++;
            }
            result = result.substring(cursor);
        }
        if (result.endsWith(FENCE)) {
            result = result.substring(0, result.length() - FENCE.length());
        }
        return result.trim();
    }

    private boolean isTagChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '+';
    }

    private int firstIndex(int a, int b) {
        if (a < 0) {
            return b;
        }
        if (b < 0) {
            return a;
        }
        return Math.min(a, b);
    }
}
