package com.companyintel.profiles.pipeline.enrich;

import com.companyintel.profiles.pipeline.model.CompanyMetadata;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based metadata heuristics: founding year, company type, team size band and
 * headquarters. Confidence values are fixed per rule.
 */
@Component
public class CompanyMetadataExtractor {
    private static final int MIN_FOUNDED_YEAR = 1900;
    private static final int MAX_HEADQUARTERS_LENGTH = 50;

    private static final List<Pattern> FOUNDED_PATTERNS = List.of(
        Pattern.compile("founded in (\\d{4})"),
        Pattern.compile("established in (\\d{4})"),
        Pattern.compile("since (\\d{4})"),
        Pattern.compile("est\\.?\\s*(\\d{4})")
    );

    private static final List<Pattern> HEADQUARTERS_PATTERNS = List.of(
        Pattern.compile("headquartered in ([A-Za-z\\s,]+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("based in ([A-Za-z\\s,]+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("headquarters:?\\s*([A-Za-z\\s,]+)", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern TEAM_OF = Pattern.compile("team of (\\d{1,6})(?!\\d)");

    private final Clock clock;

    public CompanyMetadataExtractor() {
        this(Clock.systemUTC());
    }

    CompanyMetadataExtractor(Clock clock) {
        this.clock = clock;
    }

    public CompanyMetadata extract(String text) {
        String safeText = text == null ? "" : text;
        String lower = safeText.toLowerCase(Locale.ROOT);
        Map<String, Double> confidence = new LinkedHashMap<>();
        confidence.put("company_type", 0.0);
        confidence.put("founded_year", 0.0);
        confidence.put("employee_count", 0.0);

        Integer foundedYear = foundedYear(lower);
        if (foundedYear != null) {
            confidence.put("founded_year", 0.8);
        }

        String companyType;
        if (containsAny(lower, "startup", "early stage", "seed funded")) {
            companyType = "Startup";
            confidence.put("company_type", 0.7);
        } else if (containsAny(lower, "publicly traded", "nasdaq:", "nyse:")) {
            companyType = "Public";
            confidence.put("company_type", 0.9);
        } else if (containsAny(lower, "enterprise", "fortune 500", "global leader")) {
            companyType = "Enterprise";
            confidence.put("company_type", 0.7);
        } else {
            companyType = "Private";
            confidence.put("company_type", 0.5);
        }

        String employees = null;
        if (containsAny(lower, "small team", "boutique", "family-owned")) {
            employees = "1-10";
            confidence.put("employee_count", 0.4);
        } else {
            Matcher matcher = TEAM_OF.matcher(lower);
            if (matcher.find()) {
                employees = employeeBand(Integer.parseInt(matcher.group(1)));
                confidence.put("employee_count", 0.6);
            }
        }

        return new CompanyMetadata(companyType, foundedYear, employees, headquarters(safeText), confidence);
    }

    private Integer foundedYear(String lower) {
        int currentYear = Year.now(clock).getValue();
        for (Pattern pattern : FOUNDED_PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            if (matcher.find()) {
                int year = Integer.parseInt(matcher.group(1));
                if (year >= MIN_FOUNDED_YEAR && year <= currentYear) {
                    return year;
                }
                return null;
            }
        }
        return null;
    }

    private String headquarters(String text) {
        for (Pattern pattern : HEADQUARTERS_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String value = matcher.group(1).trim();
                return value.length() > MAX_HEADQUARTERS_LENGTH ? value.substring(0, MAX_HEADQUARTERS_LENGTH) : value;
            }
        }
        return null;
    }

    static String employeeBand(int count) {
        if (count < 10) {
            return "1-10";
        }
        if (count < 50) {
            return "11-50";
        }
        if (count < 200) {
            return "51-200";
        }
        return "201-500";
    }

    private static boolean containsAny(String value, String... needles) {
        for (String needle : needles) {
            if (value.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
