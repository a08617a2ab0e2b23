package com.newsbrief.pipeline.service.report;

import com.newsbrief.pipeline.entity.BriefSection;
import com.newsbrief.pipeline.entity.ReportTemplate;

import java.util.EnumMap;
import java.util.Map;

/**
 * 브리프 문구 (템플릿 제목, 섹션 제목, 개요 문장). 지원하지 않는 언어는 en-US로 대체합니다.
 */
public enum BriefLocalization {

    ZH_CN("zh-CN",
            titles("每日新闻简报", "高管摘要", "行业报告", "新闻报告"),
            sections("摘要", "重点新闻", "趋势分析", "附件"),
            "本期共收集 %d 条新闻，来自 %d 个来源；其中 %d 条新闻包含附件，共 %d 个附件。",
            "本期无相关内容。",
            "来源", "附件总数", "热门话题", "来源分布"),
    EN_US("en-US",
            titles("Daily News Brief", "Executive Summary", "Industry Report", "News Report"),
            sections("Summary", "Key Events", "Trends", "Attachments"),
            "Collected %d news items from %d sources; %d items carry attachments (%d in total).",
            "No content for this period.",
            "Source", "Total attachments", "Hot topics", "Source distribution"),
    KO_KR("ko-KR",
            titles("일일 뉴스 브리핑", "경영진 요약", "산업 보고서", "뉴스 보고서"),
            sections("요약", "주요 뉴스", "트렌드", "첨부파일"),
            "이번 기간 %d건의 뉴스를 %d개 소스에서 수집했습니다. 첨부파일이 있는 뉴스는 %d건, 첨부파일은 총 %d개입니다.",
            "이 기간에 해당하는 내용이 없습니다.",
            "출처", "첨부파일 수", "주요 키워드", "소스 분포"),
    JA_JP("ja-JP",
            titles("デイリーニュースブリーフ", "エグゼクティブサマリー", "業界レポート", "ニュースレポート"),
            sections("概要", "主要ニュース", "トレンド", "添付ファイル"),
            "今期は %d 件のニュースを %d 件のソースから収集しました。添付ファイル付きは %d 件、添付ファイルは計 %d 件です。",
            "この期間の内容はありません。",
            "ソース", "添付ファイル数", "注目トピック", "ソース分布");

    private final String tag;
    private final Map<ReportTemplate, String> titles;
    private final Map<BriefSection, String> sectionTitles;
    private final String overviewPattern;
    private final String emptyMarker;
    private final String sourceLabel;
    private final String attachmentTotalLabel;
    private final String hotTopicsLabel;
    private final String sourceDistributionLabel;

    BriefLocalization(String tag, Map<ReportTemplate, String> titles, Map<BriefSection, String> sectionTitles,
                      String overviewPattern, String emptyMarker, String sourceLabel, String attachmentTotalLabel,
                      String hotTopicsLabel, String sourceDistributionLabel) {
        this.tag = tag;
        this.titles = titles;
        this.sectionTitles = sectionTitles;
        this.overviewPattern = overviewPattern;
        this.emptyMarker = emptyMarker;
        this.sourceLabel = sourceLabel;
        this.attachmentTotalLabel = attachmentTotalLabel;
        this.hotTopicsLabel = hotTopicsLabel;
        this.sourceDistributionLabel = sourceDistributionLabel;
    }

    public static BriefLocalization forLanguage(String language) {
        for (BriefLocalization localization : values()) {
            if (localization.tag.equalsIgnoreCase(language)) {
                return localization;
            }
        }
        return EN_US;
    }

    public String getTag() {
        return tag;
    }

    public String title(ReportTemplate template) {
        return titles.get(template);
    }

    public String sectionTitle(BriefSection section) {
        return sectionTitles.get(section);
    }

    public String overview(int news, int sources, int newsWithAttachments, int attachments) {
        return String.format(overviewPattern, news, sources, newsWithAttachments, attachments);
    }

    public String getEmptyMarker() {
        return emptyMarker;
    }

    public String getSourceLabel() {
        return sourceLabel;
    }

    public String getAttachmentTotalLabel() {
        return attachmentTotalLabel;
    }

    public String getHotTopicsLabel() {
        return hotTopicsLabel;
    }

    public String getSourceDistributionLabel() {
        return sourceDistributionLabel;
    }

    private static Map<ReportTemplate, String> titles(String daily, String executive, String industry, String custom) {
        Map<ReportTemplate, String> map = new EnumMap<>(ReportTemplate.class);
        map.put(ReportTemplate.DAILY_BRIEF, daily);
        map.put(ReportTemplate.EXECUTIVE_SUMMARY, executive);
        map.put(ReportTemplate.INDUSTRY_REPORT, industry);
        map.put(ReportTemplate.CUSTOM, custom);
        return map;
    }

    private static Map<BriefSection, String> sections(String summary, String keyEvents, String trends, String attachments) {
        Map<BriefSection, String> map = new EnumMap<>(BriefSection.class);
        map.put(BriefSection.SUMMARY, summary);
        map.put(BriefSection.KEY_EVENTS, keyEvents);
        map.put(BriefSection.TRENDS, trends);
        map.put(BriefSection.ATTACHMENTS, attachments);
        return map;
    }
}
