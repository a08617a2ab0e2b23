package com.newsbrief.pipeline.util;

public final class TextNormalizer {

    private TextNormalizer() {
    }

    /**
     * 공백을 정리하여 텍스트를 정규화
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    /**
     * 최대 길이로 자르기 (상한 초과 시 정확히 maxLength 문자)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    /**
     * 말줄임표를 붙여 자르기. 결과 길이는 maxLength를 넘지 않습니다.
     */
    public static String abbreviate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= 3) {
            return text.substring(0, maxLength);
        }
        return text.substring(0, maxLength - 3) + "...";
    }

    /**
     * 저장소 이름으로 쓸 수 있도록 문자 정리 (문자/숫자, 공백, -, _, . 만 유지)
     */
    public static String safeName(String text, int maxLength, boolean keepDots) {
        if (text == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        text.codePoints().forEach(cp -> {
            if (Character.isLetterOrDigit(cp) || cp == ' ' || cp == '-' || cp == '_' || (keepDots && cp == '.')) {
                sb.appendCodePoint(cp);
            }
        });
        String cleaned = sb.toString().trim();
        return cleaned.length() <= maxLength ? cleaned : cleaned.substring(0, maxLength).trim();
    }
}
