package com.newsbrief.pipeline.service.attachment;

import com.newsbrief.pipeline.dto.Attachment;
import com.newsbrief.pipeline.dto.AttachmentCandidate;
import com.newsbrief.pipeline.dto.AttachmentCandidate.Signal;
import com.newsbrief.pipeline.dto.CandidateItem;
import com.newsbrief.pipeline.dto.FilteredItem;
import com.newsbrief.pipeline.entity.AttachmentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AttachmentResolver 분류 규칙 테스트
 */
class AttachmentResolverTest {

    private static final String PAGE = """
            <html><body>
              <a href="https://site/doc/report.pdf">Annual report</a>
              <a href="https://site/doc/report.pdf?utm_source=newsletter">Annual report (mirror)</a>
              <a href="/files/photo.jpg">下载图片</a>
              <a href="/getfile?id=3">附件: 政策解读</a>
              <a href="/about">About us</a>
              <a href="mailto:press@site">press</a>
            </body></html>
            """;

    private AttachmentResolver resolver;
    private DownloadPolicy policy;
    private FilteredItem item;

    @BeforeEach
    void setUp() {
        resolver = new AttachmentResolver(Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC));
        policy = new DownloadPolicy(50L * 1024 * 1024, Duration.ofSeconds(5), Set.of("pdf", "doc", "docx"));
        item = new FilteredItem(new CandidateItem("gov", "Policy update", "https://site/news/1", null, ""), "fp-1");
    }

    @Test
    @DisplayName("확장자 규칙으로 pdf 분류")
    void classifiesByExtension() {
        AttachmentCandidate candidate = resolver.classify("fp-1", "https://site/doc/report.pdf", "", policy);

        assertThat(candidate).isNotNull();
        assertThat(candidate.sourceSignal()).isEqualTo(Signal.EXTENSION);
        assertThat(candidate.inferredType()).isEqualTo("pdf");
        assertThat(candidate.filename()).isEqualTo("report.pdf");
    }

    @Test
    @DisplayName("추적 파라미터만 다른 링크는 하나로 취급하고, 허용되지 않은 확장자는 다운로드 없이 제외")
    void resolvesPage() {
        // when
        AttachmentResolution resolution = resolver.resolve(item, PAGE, policy, 10);

        // then
        assertThat(resolution.candidates())
                .extracting(AttachmentCandidate::url)
                .containsExactly("https://site/doc/report.pdf", "https://site/getfile?id=3");

        AttachmentCandidate byText = resolution.candidates().get(1);
        assertThat(byText.sourceSignal()).isEqualTo(Signal.LINK_TEXT);
        assertThat(byText.hasKnownType()).isFalse();
        assertThat(byText.filename()).isEqualTo("附件 政策解读");

        assertThat(resolution.rejected()).singleElement().satisfies(rejected -> {
            assertThat(rejected.url()).isEqualTo("https://site/files/photo.jpg");
            assertThat(rejected.status()).isEqualTo(AttachmentStatus.SKIPPED_TYPE);
            assertThat(rejected.type()).isEqualTo("jpg");
        });
    }

    @Test
    @DisplayName("항목당 최대 개수를 넘는 후보는 무시")
    void capsCandidates() {
        AttachmentResolution resolution = resolver.resolve(item, PAGE, policy, 1);

        assertThat(resolution.candidates()).hasSize(1);
        assertThat(resolution.rejected()).extracting(Attachment::type).containsExactly("jpg");
    }

    @Test
    @DisplayName("URL 키워드 규칙과 키워드 기반 유형 추정")
    void classifiesByUrlKeyword() {
        AttachmentCandidate candidate = resolver.classify("fp-1", "https://site/download?file=word", "click", policy);

        assertThat(candidate.sourceSignal()).isEqualTo(Signal.URL_KEYWORD);
        assertThat(candidate.inferredType()).isEqualTo("doc");
        assertThat(candidate.filename()).isEqualTo("click");
    }

    @Test
    @DisplayName("파일명을 얻을 수 없으면 시각 기반 이름")
    void fallbackFilename() {
        assertThat(resolver.filenameOf("https://site/download", ""))
                .isEqualTo("attachment_20240501_101530");
    }

    @Test
    @DisplayName("페이지 본문이 없으면 후보 없음")
    void emptyPage() {
        assertThat(resolver.resolve(item, "", policy, 10).candidates()).isEmpty();
    }
}
