package com.newsbrief.pipeline.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    @DisplayName("본문 자르기는 말줄임표 없이 정확히 상한 길이")
    void truncateIsExact() {
        assertThat(TextNormalizer.truncate("abcdefghij", 4)).isEqualTo("abcd");
        assertThat(TextNormalizer.truncate("abc", 4)).isEqualTo("abc");
    }

    @Test
    @DisplayName("요약은 상한을 넘지 않도록 말줄임표 포함")
    void abbreviateAddsEllipsis() {
        String result = TextNormalizer.abbreviate("x".repeat(250), 200);

        assertThat(result).hasSize(200).endsWith("...");
    }

    @Test
    @DisplayName("저장소 이름은 특수문자를 제거")
    void safeName() {
        assertThat(TextNormalizer.safeName("보고서: 2024/Q1 <최종>.pdf", 100, true))
                .isEqualTo("보고서 2024Q1 최종.pdf");
        assertThat(TextNormalizer.safeName("a.b", 100, false)).isEqualTo("ab");
    }

    @Test
    @DisplayName("공백 정규화")
    void normalize() {
        assertThat(TextNormalizer.normalize("  a \n\t b  ")).isEqualTo("a b");
    }
}
