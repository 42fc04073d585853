package com.forumprep.util.dom;


public final class FlattenedHtmlResult {

    private final String html;
    private final DomMetrics metrics;

    public FlattenedHtmlResult(String html, DomMetrics metrics) {
        this.html = html;
        this.metrics = metrics;
    }

    public String getHtml() {
        return html;
    }

    public DomMetrics getMetrics() {
        return metrics;
    }
}
