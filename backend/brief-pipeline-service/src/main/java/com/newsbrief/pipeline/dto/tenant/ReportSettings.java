package com.newsbrief.pipeline.dto.tenant;

import com.newsbrief.pipeline.entity.BriefSection;
import com.newsbrief.pipeline.entity.OutputFormat;
import com.newsbrief.pipeline.entity.ReportTemplate;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ReportSettings {

    @NotNull
    private ReportTemplate template = ReportTemplate.DAILY_BRIEF;

    @NotBlank
    private String language = "zh-CN";

    private List<String> kbIds = new ArrayList<>();

    @NotEmpty
    private List<BriefSection> sections = new ArrayList<>(List.of(BriefSection.values()));

    private boolean includeAttachments = true;

    private boolean attachmentSummary = true;

    @Min(1)
    private int maxAttachmentSummaryLength = 500;

    @NotNull
    private OutputFormat outputFormat = OutputFormat.MARKDOWN;

    @Min(1)
    private int maxNewsCount = 20;

    @Min(1)
    private int dateRangeDays = 1;
}
