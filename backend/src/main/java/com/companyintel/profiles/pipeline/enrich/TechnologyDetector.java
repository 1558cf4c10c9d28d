package com.companyintel.profiles.pipeline.enrich;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class TechnologyDetector {
    private static final Map<String, List<String>> SIGNATURES = new LinkedHashMap<>();

    static {
        SIGNATURES.put("React", List.of("react.js", "react.min.js", "_react", "reactdom"));
        SIGNATURES.put("Vue", List.of("vue.js", "vue.min.js", "vuejs"));
        SIGNATURES.put("Angular", List.of("angular.js", "angular.min.js", "@angular"));
        SIGNATURES.put("WordPress", List.of("wp-content", "wp-includes", "wordpress"));
        SIGNATURES.put("Shopify", List.of("shopify.com", "cdn.shopify"));
        SIGNATURES.put("Wix", List.of("wix.com", "parastorage"));
        SIGNATURES.put("Squarespace", List.of("squarespace.com", "sqsp.net"));
        SIGNATURES.put("jQuery", List.of("jquery.js", "jquery.min.js"));
        SIGNATURES.put("Bootstrap", List.of("bootstrap.css", "bootstrap.min.css"));
        SIGNATURES.put("Tailwind", List.of("tailwindcss", "tailwind.min.css"));
        SIGNATURES.put("Google Analytics", List.of("google-analytics.com", "googletagmanager"));
        SIGNATURES.put("Stripe", List.of("stripe.com/v3", "js.stripe.com"));
        SIGNATURES.put("Cloudflare", List.of("cloudflare.com", "cf-ray"));
    }

    /**
     * @return technology names whose signatures appear in the raw HTML, sorted by name
     */
    public List<String> detect(String html) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        String content = html.toLowerCase(Locale.ROOT);
        List<String> detected = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : SIGNATURES.entrySet()) {
            if (entry.getValue().stream().anyMatch(content::contains)) {
                detected.add(entry.getKey());
            }
        }
        detected.sort(null);
        return List.copyOf(detected);
    }
}
