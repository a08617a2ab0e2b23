package com.newsbrief.pipeline.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * URL 정규화 유틸리티.
 *
 * 지문 계산용 정규화는 쿼리/프래그먼트를 모두 제거하고,
 * 첨부파일 중복 제거용 정규화는 추적 파라미터만 제거합니다.
 */
public final class UrlNormalizer {

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "fbclid", "gclid", "dclid", "msclkid", "yclid", "igshid", "mc_cid", "mc_eid",
            "spm", "from", "ref", "ref_src", "share", "source", "_ga", "cmpid", "s_cid"
    );

    private UrlNormalizer() {
    }

    /**
     * 쿼리와 프래그먼트를 제거한 정규 URL
     */
    public static String canonicalize(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        URI uri = parse(url.trim());
        if (uri == null || uri.getHost() == null) {
            return stripQuery(url.trim()).toLowerCase(Locale.ROOT);
        }
        return baseOf(uri);
    }

    /**
     * 추적 파라미터(utm_* 등)만 제거한 URL. 남은 파라미터 순서는 유지합니다.
     */
    public static String stripTracking(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        URI uri = parse(url.trim());
        if (uri == null || uri.getHost() == null) {
            return url.trim();
        }
        String base = baseOf(uri);
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return base;
        }
        List<String> kept = new ArrayList<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String name = pair.split("=", 2)[0].toLowerCase(Locale.ROOT);
            if (name.startsWith("utm_") || TRACKING_PARAMS.contains(name)) {
                continue;
            }
            kept.add(pair);
        }
        return kept.isEmpty() ? base : base + "?" + String.join("&", kept);
    }

    /**
     * URL 경로 (소문자 비교용). 파싱 실패 시 쿼리를 제외한 문자열 전체.
     */
    public static String path(String url) {
        URI uri = parse(url);
        if (uri == null || uri.getRawPath() == null) {
            return stripQuery(url);
        }
        return uri.getRawPath();
    }

    private static String baseOf(URI uri) {
        String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        boolean defaultPort = port == -1
                || ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if ("/".equals(path)) {
            path = "";
        }
        return scheme + "://" + host + (defaultPort ? "" : ":" + port) + path;
    }

    private static String stripQuery(String url) {
        int cut = url.length();
        int q = url.indexOf('?');
        int h = url.indexOf('#');
        if (q >= 0) {
            cut = Math.min(cut, q);
        }
        if (h >= 0) {
            cut = Math.min(cut, h);
        }
        return url.substring(0, cut);
    }

    private static URI parse(String url) {
        try {
            return new URI(url.replace(" ", "%20"));
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
