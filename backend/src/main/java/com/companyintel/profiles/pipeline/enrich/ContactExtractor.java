package com.companyintel.profiles.pipeline.enrich;

import com.companyintel.profiles.pipeline.model.ContactInfo;
import com.companyintel.profiles.pipeline.model.PostalAddress;
import com.companyintel.profiles.pipeline.model.SocialLinks;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls e-mail, phone, social links and postal address straight from homepage markup.
 */
@Component
public class ContactExtractor {
    private static final Pattern EMAIL = Pattern.compile("\\b[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}\\b");
    private static final List<Pattern> PHONES = List.of(
        Pattern.compile("\\+?\\d{1,3}[-.\\s]?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}"),
        Pattern.compile("\\(\\d{3}\\)\\s*\\d{3}[-.\\s]?\\d{4}")
    );
    private static final Pattern US_ZIP = Pattern.compile("\\b\\d{5}(?:-\\d{4})?\\b");
    private static final List<String> PLACEHOLDER_EMAIL_HINTS = List.of(
        "example.com",
        "yoursite",
        "domain.com",
        "test",
        "sample"
    );
    private static final int FOOTER_ADDRESS_MAX_LENGTH = 200;

    public ContactInfo extract(String html, String text) {
        if (html == null || html.isBlank()) {
            return ContactInfo.EMPTY;
        }
        Document document = Jsoup.parse(html);
        String safeText = text == null ? "" : text;
        return new ContactInfo(
            email(document, safeText),
            phone(document, safeText),
            address(document),
            socialLinks(document)
        );
    }

    private String email(Document document, String text) {
        Element mailto = document.selectFirst("a[href^=mailto:]");
        if (mailto != null) {
            String value = mailto.attr("href").substring("mailto:".length());
            int query = value.indexOf('?');
            return (query >= 0 ? value.substring(0, query) : value).trim();
        }
        Matcher matcher = EMAIL.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group();
            String lower = candidate.toLowerCase(Locale.ROOT);
            if (PLACEHOLDER_EMAIL_HINTS.stream().noneMatch(lower::contains)) {
                return candidate;
            }
        }
        return null;
    }

    private String phone(Document document, String text) {
        Element tel = document.selectFirst("a[href^=tel:]");
        if (tel != null) {
            return tel.attr("href").substring("tel:".length()).trim();
        }
        for (Pattern pattern : PHONES) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return matcher.group().trim();
            }
        }
        return null;
    }

    private SocialLinks socialLinks(Document document) {
        String linkedin = null;
        String twitter = null;
        String github = null;
        String facebook = null;
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href");
            String lower = href.toLowerCase(Locale.ROOT);
            if (lower.contains("linkedin.com/company") && linkedin == null) {
                linkedin = href;
            } else if (lower.contains("twitter.com") && twitter == null) {
                twitter = href;
            } else if (lower.contains("github.com") && github == null) {
                github = href;
            } else if (lower.contains("facebook.com") && facebook == null) {
                facebook = href;
            }
        }
        return new SocialLinks(linkedin, twitter, github, facebook);
    }

    private PostalAddress address(Document document) {
        Element schemaAddress = document.selectFirst("[itemprop=address]");
        if (schemaAddress != null) {
            return new PostalAddress(
                itemText(schemaAddress, "streetAddress"),
                itemText(schemaAddress, "addressLocality"),
                itemText(schemaAddress, "addressCountry")
            );
        }
        Element footer = document.selectFirst("footer");
        if (footer != null) {
            String footerText = footer.text().trim();
            if (US_ZIP.matcher(footerText).find()) {
                String full = footerText.length() > FOOTER_ADDRESS_MAX_LENGTH
                    ? footerText.substring(0, FOOTER_ADDRESS_MAX_LENGTH)
                    : footerText;
                return new PostalAddress(full, null, null);
            }
        }
        return PostalAddress.EMPTY;
    }

    private String itemText(Element scope, String itemprop) {
        Element element = scope.selectFirst("[itemprop=" + itemprop + "]");
        return element == null ? null : element.text().trim();
    }
}
