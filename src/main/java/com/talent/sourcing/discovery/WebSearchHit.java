package com.talent.sourcing.discovery;

/**
 * One result of a web search.
 *
 * @param title   result title, never null
 * @param content snippet text, never null
 * @param url     result URL, or null
 * @param rank    zero-based position in the result list
 */
public record WebSearchHit(String title, String content, String url, int rank) {

    public WebSearchHit {
        title = title != null ? title : "";
        content = content != null ? content : "";
        url = url == null || url.isBlank() ? null : url.strip();
    }
}
