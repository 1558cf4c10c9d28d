package com.companyintel.profiles.pipeline.model;

public record ExtractedText(
    String text,
    String title
) {
    public static final ExtractedText EMPTY = new ExtractedText("", "");

    public ExtractedText {
        text = text == null ? "" : text;
        title = title == null ? "" : title;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
