package com.newsbrief.pipeline.dto.tenant;

import com.newsbrief.pipeline.entity.OutputFormat;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Data
public class ProcessorSettings {

    @NotBlank
    private String kbId;

    private boolean processContent = true;

    @Min(1)
    private int maxContentLength = 5000;

    @NotNull
    private OutputFormat formatOutput = OutputFormat.MARKDOWN;

    private boolean saveToKb = true;

    private boolean downloadAttachments = true;

    @NotEmpty
    private List<String> attachmentTypes = new ArrayList<>(List.of("pdf", "doc", "docx", "ppt", "pptx"));

    /**
     * 첨부파일 최대 크기 (바이트, 기본 50MB)
     */
    @Min(1)
    private long maxAttachmentSize = 50L * 1024 * 1024;

    /**
     * 첨부파일 1건 다운로드 타임아웃 (초)
     */
    @Min(1)
    private int attachmentTimeout = 60;

    public Set<String> allowedAttachmentTypes() {
        return attachmentTypes.stream()
                .map(type -> type.toLowerCase(Locale.ROOT).trim())
                .collect(Collectors.toUnmodifiableSet());
    }
}
