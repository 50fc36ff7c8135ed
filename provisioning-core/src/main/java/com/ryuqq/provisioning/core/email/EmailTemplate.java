package com.ryuqq.provisioning.core.email;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 이메일 템플릿.
 *
 * <p>제목과 본문의 {@code {{key}}} 자리표시자를 data 값으로 치환합니다.
 * data에 없는 키는 빈 문자열이 됩니다.</p>
 *
 * @param id 템플릿 id
 * @param subject 제목 템플릿
 * @param text 텍스트 본문 템플릿
 * @param html HTML 본문 템플릿
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record EmailTemplate(String id, String subject, String text, String html) {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-zA-Z0-9_]+)\\s*}}");

    public EmailTemplate {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (subject == null || text == null || html == null) {
            throw new IllegalArgumentException("subject, text and html cannot be null");
        }
    }

    /**
     * 템플릿 렌더링.
     *
     * @param data 치환 값
     * @return 렌더링된 메시지
     */
    public RenderedEmail render(Map<String, String> data) {
        return new RenderedEmail(fill(subject, data), fill(text, data), fill(html, data));
    }

    private static String fill(String template, Map<String, String> data) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = data.getOrDefault(matcher.group(1), "");
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * 렌더링 결과.
     *
     * @param subject 제목
     * @param text 텍스트 본문
     * @param html HTML 본문
     */
    public record RenderedEmail(String subject, String text, String html) {
    }
}
