package com.companyintel.profiles.pipeline.describe;

import com.companyintel.profiles.pipeline.model.Descriptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds short and long descriptions from homepage prose by ranking candidate sentences.
 * Always returns non-empty descriptions; weak input falls back to generic text.
 */
@Component
public class DescriptionSynthesizer {
    public static final String FALLBACK_SHORT = "Company providing business services and solutions.";
    public static final String FALLBACK_LONG = FALLBACK_SHORT
        + " Committed to delivering quality products and professional support to customers.";
    static final String LONG_PADDING = " Committed to delivering quality products and professional support.";

    static final int MIN_SENTENCE_LENGTH = 20;
    static final int MAX_SENTENCE_LENGTH = 200;
    static final double MAX_SPECIAL_CHAR_RATIO = 0.3;
    static final int MIN_SHORT_LENGTH = 20;
    static final int MIN_LONG_LENGTH = 40;
    static final int LONG_SENTENCE_COUNT = 3;

    static final int BUSINESS_PHRASE_SCORE = 15;
    static final int INDUSTRY_TERM_SCORE = 5;
    static final int CALL_TO_ACTION_PENALTY = -20;

    private static final List<Pattern> NOISE_PATTERNS = List.of(
        Pattern.compile("(?i)(home|about|contact|privacy|terms|cookies?|login|sign up|subscribe)\\s*\\|"),
        Pattern.compile("(?i)copyright\\s+©?\\s*\\d{4}"),
        Pattern.compile("(?i)all rights reserved"),
        Pattern.compile("(?i)follow us on"),
        Pattern.compile("(?i)(facebook|twitter|linkedin|instagram|youtube)\\s*:?"),
        Pattern.compile("(?i)skip to (main )?content")
    );

    private static final Pattern SENTENCE_TERMINATORS = Pattern.compile("[.!?]+");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    private static final List<String> BOILERPLATE_KEYWORDS = List.of(
        "cookie",
        "privacy policy",
        "terms of service",
        "login",
        "sign up",
        "subscribe",
        "newsletter",
        "click here",
        "read more"
    );

    private static final List<String> BUSINESS_PHRASES = List.of(
        "we provide", "we offer", "we help", "we are", "we specialize",
        "our company", "our mission", "our service", "our product",
        "leading provider", "established", "founded", "specializes in",
        "delivers", "creates", "develops", "builds", "designs",
        "trusted by", "serving", "dedicated to"
    );

    private static final List<String> INDUSTRY_TERMS = List.of(
        "software", "technology", "services", "solutions", "platform",
        "healthcare", "financial", "consulting", "manufacturing", "retail",
        "education", "enterprise", "business", "professional", "digital",
        "innovative", "comprehensive", "quality", "expert"
    );

    private static final List<String> CALL_TO_ACTION = List.of(
        "click",
        "here",
        "more info",
        "learn more",
        "contact us"
    );

    public Descriptions synthesize(String text) {
        List<String> sentences = candidateSentences(clean(text));
        if (sentences.isEmpty()) {
            return new Descriptions(FALLBACK_SHORT, FALLBACK_LONG);
        }

        List<ScoredSentence> scored = new ArrayList<>();
        for (String sentence : sentences) {
            scored.add(new ScoredSentence(sentence, score(sentence)));
        }
        // stable: equal scores keep document order
        scored.sort(Comparator.comparingInt(ScoredSentence::score).reversed());

        List<String> best = new ArrayList<>();
        for (ScoredSentence candidate : scored) {
            if (candidate.score() > 0) {
                best.add(candidate.sentence());
            }
        }
        if (best.isEmpty()) {
            best = sentences.subList(0, Math.min(LONG_SENTENCE_COUNT, sentences.size()));
        }

        String shortDescription = collapse(withPeriod(best.get(0)));
        String longDescription = collapse(withPeriod(
            String.join(". ", best.subList(0, Math.min(LONG_SENTENCE_COUNT, best.size())))
        ));

        if (shortDescription.length() < MIN_SHORT_LENGTH) {
            shortDescription = FALLBACK_SHORT;
        }
        if (longDescription.length() < MIN_LONG_LENGTH) {
            longDescription = shortDescription + LONG_PADDING;
        }
        return new Descriptions(shortDescription, longDescription);
    }

    static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = text;
        for (Pattern pattern : NOISE_PATTERNS) {
            cleaned = pattern.matcher(cleaned).replaceAll("");
        }
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    static List<String> candidateSentences(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> accepted = new ArrayList<>();
        for (String raw : SENTENCE_TERMINATORS.split(text)) {
            String sentence = raw.trim();
            if (sentence.length() < MIN_SENTENCE_LENGTH || sentence.length() > MAX_SENTENCE_LENGTH) {
                continue;
            }
            if (containsAny(sentence.toLowerCase(Locale.ROOT), BOILERPLATE_KEYWORDS)) {
                continue;
            }
            if (specialCharCount(sentence) > sentence.length() * MAX_SPECIAL_CHAR_RATIO) {
                continue;
            }
            accepted.add(sentence);
        }
        return accepted;
    }

    static int score(String sentence) {
        String lower = sentence.toLowerCase(Locale.ROOT);
        int score = 0;
        for (String phrase : BUSINESS_PHRASES) {
            if (lower.contains(phrase)) {
                score += BUSINESS_PHRASE_SCORE;
            }
        }
        for (String term : INDUSTRY_TERMS) {
            if (lower.contains(term)) {
                score += INDUSTRY_TERM_SCORE;
            }
        }
        for (String word : CALL_TO_ACTION) {
            if (lower.contains(word)) {
                score += CALL_TO_ACTION_PENALTY;
            }
        }
        return score;
    }

    private static int specialCharCount(String sentence) {
        int count = 0;
        for (int i = 0; i < sentence.length(); i++) {
            char c = sentence.charAt(i);
            boolean asciiAlnum = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!asciiAlnum && !Character.isWhitespace(c) && !Character.isSpaceChar(c)) {
                count++;
            }
        }
        return count;
    }

    private static boolean containsAny(String value, List<String> needles) {
        for (String needle : needles) {
            if (value.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static String withPeriod(String value) {
        return value.endsWith(".") ? value : value + ".";
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    private record ScoredSentence(String sentence, int score) {
    }
}
