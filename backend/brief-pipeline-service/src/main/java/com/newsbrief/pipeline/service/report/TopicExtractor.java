package com.newsbrief.pipeline.service.report;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 제목에서 키워드를 뽑아 빈도를 셉니다.
 *
 * 라틴/한글 단어는 공백·구두점 기준으로, 한자/가나 연속 구간은 2글자 단위로 자릅니다.
 * 한 문서 안의 반복은 1회로 계산하고, 빈도 내림차순·사전순으로 정렬하여 항상 같은 결과를 냅니다.
 */
final class TopicExtractor {

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "with", "from", "that", "this", "are", "was", "were", "has", "have",
            "will", "into", "over", "after", "about", "its", "new", "says", "said", "more", "than"
    );

    private TopicExtractor() {
    }

    static List<Map.Entry<String, Long>> topTopics(List<String> documents, int limit) {
        Map<String, Long> counts = new HashMap<>();
        for (String document : documents) {
            for (String term : terms(document)) {
                counts.merge(term, 1L, Long::sum);
            }
        }
        List<Map.Entry<String, Long>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        return ranked.subList(0, Math.min(limit, ranked.size()));
    }

    static Set<String> terms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        if (text == null) {
            return terms;
        }
        StringBuilder word = new StringBuilder();
        StringBuilder ideographs = new StringBuilder();
        text.toLowerCase(Locale.ROOT).codePoints().forEach(cp -> {
            if (isIdeographic(cp)) {
                flushWord(word, terms);
                ideographs.appendCodePoint(cp);
            } else if (Character.isLetterOrDigit(cp)) {
                flushIdeographs(ideographs, terms);
                word.appendCodePoint(cp);
            } else {
                flushWord(word, terms);
                flushIdeographs(ideographs, terms);
            }
        });
        flushWord(word, terms);
        flushIdeographs(ideographs, terms);
        return terms;
    }

    private static boolean isIdeographic(int cp) {
        Character.UnicodeScript script = Character.UnicodeScript.of(cp);
        return script == Character.UnicodeScript.HAN
                || script == Character.UnicodeScript.HIRAGANA
                || script == Character.UnicodeScript.KATAKANA;
    }

    private static void flushWord(StringBuilder word, Set<String> terms) {
        String w = word.toString();
        word.setLength(0);
        if (w.isEmpty() || STOPWORDS.contains(w) || w.chars().allMatch(Character::isDigit)) {
            return;
        }
        boolean hangul = w.codePoints().anyMatch(cp -> Character.UnicodeScript.of(cp) == Character.UnicodeScript.HANGUL);
        if (w.length() >= (hangul ? 2 : 3)) {
            terms.add(w);
        }
    }

    private static void flushIdeographs(StringBuilder run, Set<String> terms) {
        String s = run.toString();
        run.setLength(0);
        int[] cps = s.codePoints().toArray();
        for (int i = 0; i + 1 < cps.length; i++) {
            terms.add(new String(cps, i, 2));
        }
    }
}
