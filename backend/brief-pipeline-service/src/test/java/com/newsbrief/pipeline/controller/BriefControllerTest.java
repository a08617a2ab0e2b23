package com.newsbrief.pipeline.controller;

import com.newsbrief.pipeline.dto.Brief;
import com.newsbrief.pipeline.entity.OutputFormat;
import com.newsbrief.pipeline.entity.ReportTemplate;
import com.newsbrief.pipeline.service.report.BriefRenderer;
import com.newsbrief.pipeline.service.report.BriefStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BriefController.class)
@ActiveProfiles("test")
class BriefControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T01:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BriefStore briefStore;

    @MockBean
    private BriefRenderer briefRenderer;

    private final Brief brief = new Brief("brief-1", "acme", ReportTemplate.DAILY_BRIEF, "en-US", "Daily Brief",
            NOW.minusSeconds(86400), NOW, 0, Map.of(), NOW);

    @Test
    @DisplayName("GET /api/v1/briefs/{briefId} - 기본 형식은 markdown")
    void defaultsToMarkdown() throws Exception {
        given(briefStore.find("brief-1")).willReturn(Optional.of(brief));
        given(briefRenderer.render(brief, OutputFormat.MARKDOWN)).willReturn("# Daily Brief");

        mockMvc.perform(get("/api/v1/briefs/brief-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", "text/markdown;charset=UTF-8"))
                .andExpect(content().string("# Daily Brief"));
    }

    @Test
    @DisplayName("format 파라미터는 대소문자를 구분하지 않는다")
    void formatParameter() throws Exception {
        given(briefStore.find("brief-1")).willReturn(Optional.of(brief));
        given(briefRenderer.render(brief, OutputFormat.TEXT)).willReturn("Daily Brief");

        mockMvc.perform(get("/api/v1/briefs/brief-1").param("format", "TEXT"))
                .andExpect(status().isOk())
                .andExpect(content().string("Daily Brief"));
    }

    @Test
    @DisplayName("없는 브리프는 404, 알 수 없는 형식은 400")
    void notFoundAndBadFormat() throws Exception {
        given(briefStore.find("missing")).willReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/briefs/missing"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/briefs/brief-1").param("format", "pdf"))
                .andExpect(status().isBadRequest());
    }
}
