package com.companyintel.profiles.pipeline.extract;

import com.companyintel.profiles.config.PipelineProperties;
import com.companyintel.profiles.pipeline.model.ExtractedText;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns one archived homepage into whitespace-normalized prose plus a title.
 * Never throws: unreadable or unparseable input yields {@link ExtractedText#EMPTY}.
 */
@Component
public class TextExtractor {
    private static final Logger log = LoggerFactory.getLogger(TextExtractor.class);

    // \s alone misses U+00A0 from &nbsp;
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    private static final String STRIPPED_TAGS = "script, style, nav, footer, header, aside, iframe, noscript";

    private static final List<String> NOISE_CLASSES = List.of(
        "cookie",
        "banner",
        "popup",
        "modal",
        "navigation",
        "menu",
        "sidebar"
    );

    // Cut at the first occurrence, keeping the left part.
    private static final List<String> TITLE_SUFFIX_SEPARATORS = List.of(
        " | Home",
        " - Home",
        " | ",
        " - ",
        " – "
    );

    private static final List<String> TITLE_PREFIXES = List.of(
        "Home - ",
        "Home | "
    );

    private final PipelineProperties properties;

    public TextExtractor(PipelineProperties properties) {
        this.properties = properties;
    }

    public ExtractedText extract(Path htmlPath) {
        String html;
        try {
            html = read(htmlPath);
        } catch (IOException e) {
            log.warn("Unable to read {}: {}", htmlPath, e.getMessage());
            return ExtractedText.EMPTY;
        }
        return extractFromHtml(html);
    }

    public ExtractedText extractFromHtml(String html) {
        if (html == null || html.isBlank()) {
            return ExtractedText.EMPTY;
        }
        try {
            Document document = Jsoup.parse(html);
            String title = resolveTitle(document);
            String text = visibleText(document);
            return new ExtractedText(truncate(text, properties.getExtraction().getMaxTextLength()), title);
        } catch (RuntimeException e) {
            log.warn("HTML parsing failed: {}", e.getMessage());
            return ExtractedText.EMPTY;
        }
    }

    /**
     * Reads the archived file as UTF-8; malformed bytes are replaced rather than rejected.
     */
    public String read(Path htmlPath) throws IOException {
        byte[] bytes = Files.readAllBytes(htmlPath);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    String resolveTitle(Document document) {
        Element titleElement = document.selectFirst("title");
        if (titleElement != null) {
            String cleaned = cleanTitle(titleElement.text());
            if (!cleaned.isEmpty()) {
                return cleaned;
            }
        }
        Element h1 = document.selectFirst("h1");
        if (h1 != null) {
            return WHITESPACE.matcher(h1.text()).replaceAll(" ").trim();
        }
        return "";
    }

    static String cleanTitle(String raw) {
        if (raw == null) {
            return "";
        }
        String title = WHITESPACE.matcher(raw).replaceAll(" ").trim();
        for (String prefix : TITLE_PREFIXES) {
            if (title.startsWith(prefix)) {
                title = title.substring(prefix.length());
            }
        }
        for (String separator : TITLE_SUFFIX_SEPARATORS) {
            int idx = title.indexOf(separator);
            if (idx >= 0) {
                title = title.substring(0, idx);
            }
        }
        return title.trim();
    }

    private String visibleText(Document document) {
        document.select(STRIPPED_TAGS).remove();
        List<Element> noisy = new ArrayList<>();
        for (Element element : document.select("[class]")) {
            String className = element.className().toLowerCase(Locale.ROOT);
            for (String noise : NOISE_CLASSES) {
                if (className.contains(noise)) {
                    noisy.add(element);
                    break;
                }
            }
        }
        for (Element element : noisy) {
            if (element.parent() != null) {
                element.remove();
            }
        }

        Element root = document.body() == null ? document : document.body();
        StringBuilder builder = new StringBuilder();
        root.traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                String value = WHITESPACE.matcher(textNode.getWholeText()).replaceAll(" ").trim();
                if (!value.isEmpty()) {
                    if (builder.length() > 0) {
                        builder.append(' ');
                    }
                    builder.append(value);
                }
            }
        });
        return WHITESPACE.matcher(builder).replaceAll(" ").trim();
    }

    private static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
