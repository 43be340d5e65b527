package com.answer.pipeline.client;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Pulls readable text out of an HTML page: boilerplate elements are removed, the first
 * main-content container wins, and common footer phrases are stripped.
 */
public class HtmlContentExtractor {

    private static final String BOILERPLATE = "script, style, noscript, nav, header, footer, aside, form, iframe";
    private static final List<String> CONTENT_SELECTORS = List.of(
            "main", "article", "[role=main]", ".content", "#content",
            ".post-content", ".entry-content", ".article-content"
    );
    private static final List<Pattern> NOISE = List.of(
            Pattern.compile("(?i)cookie\\s+policy[^.]*\\.?"),
            Pattern.compile("(?i)privacy\\s+policy[^.]*\\.?"),
            Pattern.compile("(?i)terms\\s+of\\s+service[^.]*\\.?"),
            Pattern.compile("(?i)subscribe\\s+to[^.]*\\.?"),
            Pattern.compile("(?i)follow\\s+us[^.]*\\.?"),
            Pattern.compile("(?i)share\\s+this[^.]*\\.?")
    );

    public Extracted extract(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return new Extracted("", "");
        }
        Document document = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        String title = document.title();
        document.select(BOILERPLATE).remove();

        Element container = null;
        for (String selector : CONTENT_SELECTORS) {
            container = document.selectFirst(selector);
            if (container != null) {
                break;
            }
        }
        if (container == null) {
            container = document.body() == null ? document : document.body();
        }
        return new Extracted(title == null ? "" : title.trim(), clean(container.text()));
    }

    static String clean(String text) {
        String cleaned = text.replaceAll("\\s+", " ");
        for (Pattern pattern : NOISE) {
            cleaned = pattern.matcher(cleaned).replaceAll("");
        }
        return cleaned.replaceAll("\\s+", " ").trim();
    }

    public record Extracted(String title, String text) {
    }
}
