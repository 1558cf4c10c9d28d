package com.companyintel.profiles.pipeline.logo;

import com.companyintel.profiles.config.PipelineProperties;
import com.companyintel.profiles.pipeline.http.ProbeHttpClient;
import com.companyintel.profiles.pipeline.model.HttpProbeResult;
import com.companyintel.profiles.pipeline.util.DomainNames;
import com.companyintel.profiles.pipeline.util.ReasonCodes;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Resolves a logo URL through an ordered chain of tiers:
 * <ol>
 *     <li>icon links and {@code og:image} in the archived HTML</li>
 *     <li>conventional favicon paths on the site (HEAD probe)</li>
 *     <li>logo-by-domain service for the root domain (HEAD probe)</li>
 *     <li>favicon-by-domain service URL, built without any network check</li>
 * </ol>
 * The last tier cannot fail, so {@link #resolve} always returns an absolute http(s) URL.
 */
@Service
public class LogoResolver {
    private static final Logger log = LoggerFactory.getLogger(LogoResolver.class);

    static final List<String> FAVICON_PATHS = List.of(
        "/favicon.ico",
        "/favicon.png",
        "/apple-touch-icon.png",
        "/assets/favicon.ico",
        "/static/favicon.ico"
    );

    private static final List<String> IMAGE_EXTENSIONS = List.of(
        ".ico", ".png", ".jpg", ".jpeg", ".svg", ".gif", ".webp"
    );

    private static final List<Predicate<Element>> ICON_LINK_PRIORITY = List.of(
        link -> hasRelToken(link, "apple-touch-icon"),
        link -> hasRelToken(link, "icon") && "192x192".equalsIgnoreCase(link.attr("sizes").trim()),
        link -> hasRelToken(link, "icon") && "image/png".equalsIgnoreCase(link.attr("type").trim()),
        link -> "shortcut icon".equalsIgnoreCase(link.attr("rel").trim()),
        link -> hasRelToken(link, "icon")
    );

    private final PipelineProperties properties;
    private final ProbeHttpClient probeHttpClient;

    public LogoResolver(PipelineProperties properties, ProbeHttpClient probeHttpClient) {
        this.properties = properties;
        this.probeHttpClient = probeHttpClient;
    }

    public String resolve(String domain, String html) {
        String fromHtml = fromHtml(domain, html);
        if (fromHtml != null) {
            log.debug("Logo for {} from HTML: {}", domain, fromHtml);
            return fromHtml;
        }
        if (properties.getLogo().isNetworkProbesEnabled()) {
            String fromPaths = fromFaviconPaths(domain);
            if (fromPaths != null) {
                log.debug("Logo for {} from favicon path: {}", domain, fromPaths);
                return fromPaths;
            }
            String fromService = fromLogoService(domain);
            if (fromService != null) {
                log.debug("Logo for {} from logo service: {}", domain, fromService);
                return fromService;
            }
        }
        return faviconServiceUrl(domain);
    }

    String fromHtml(String domain, String html) {
        if (html == null || html.isBlank()) {
            return null;
        }
        try {
            Document document = Jsoup.parse(html);
            List<Element> links = document.select("link[rel][href]");
            for (Predicate<Element> tier : ICON_LINK_PRIORITY) {
                Element link = links.stream().filter(tier).findFirst().orElse(null);
                if (link == null) {
                    continue;
                }
                String href = absolutize(domain, link.attr("href"));
                if (href != null && looksLikeImage(href) && isHttpUrl(href)) {
                    return href;
                }
            }
            Element ogImage = document.selectFirst("meta[property=og:image][content]");
            if (ogImage != null) {
                String content = absolutize(domain, ogImage.attr("content"));
                if (content != null && isHttpUrl(content)) {
                    return content;
                }
            }
        } catch (RuntimeException e) {
            log.debug("Icon link parsing failed for {}: {}", domain, e.getMessage());
        }
        return null;
    }

    String fromFaviconPaths(String domain) {
        String base = siteBase(domain);
        for (String path : FAVICON_PATHS) {
            String url = base + path;
            if (exists(url)) {
                return url;
            }
        }
        return null;
    }

    String fromLogoService(String domain) {
        String url = properties.getLogo().getLogoServiceBaseUrl() + DomainNames.rootDomain(domain);
        return exists(url) ? url : null;
    }

    public String faviconServiceUrl(String domain) {
        return properties.getLogo().getFaviconServiceUrl() + DomainNames.rootDomain(domain);
    }

    private boolean exists(String url) {
        HttpProbeResult result = probeHttpClient.head(url);
        if (result.isOk()) {
            return true;
        }
        if (result.errorCode() != null) {
            log.debug("Probe {} failed: {}", url,
                ReasonCodes.fromProbeError(result.errorCode(), result.errorMessage()));
        }
        return false;
    }

    private String siteBase(String domain) {
        return properties.getLogo().getSiteScheme() + "://" + domain.trim();
    }

    private String absolutize(String domain, String href) {
        if (href == null) {
            return null;
        }
        String value = href.trim();
        if (value.isEmpty()) {
            return null;
        }
        if (value.startsWith("//")) {
            return "https:" + value;
        }
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return value;
        }
        if (value.startsWith("/")) {
            return siteBase(domain) + value;
        }
        try {
            return URI.create(siteBase(domain) + "/").resolve(value).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static boolean looksLikeImage(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        for (String extension : IMAGE_EXTENSIONS) {
            if (lower.contains(extension)) {
                return true;
            }
        }
        return false;
    }

    static boolean isHttpUrl(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            return uri.getHost() != null
                && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (Exception e) {
            return false;
        }
    }

    private static boolean hasRelToken(Element link, String token) {
        return Arrays.stream(link.attr("rel").trim().toLowerCase(Locale.ROOT).split("\\s+"))
            .anyMatch(token::equals);
    }
}
