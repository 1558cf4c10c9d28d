package com.companyintel.profiles.pipeline.logo;

import com.companyintel.profiles.config.PipelineProperties;
import com.companyintel.profiles.pipeline.http.ProbeHttpClient;
import com.companyintel.profiles.pipeline.util.DomainNames;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LogoResolverTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PipelineProperties properties;
    private LogoResolver resolver;
    private String domain;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        domain = server.getHostName() + ":" + server.getPort();

        properties = new PipelineProperties();
        properties.setConcurrency(1);
        properties.getLogo().setSiteScheme("http");
        properties.getLogo().setProbeTimeoutSeconds(2);
        properties.getLogo().setLogoServiceBaseUrl(server.url("/logo/").toString());
        properties.getLogo().setFaviconServiceUrl("https://favicons.test/icon?domain=");

        executor = Executors.newFixedThreadPool(2);
        resolver = new LogoResolver(properties, new ProbeHttpClient(properties, executor));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void iconLinkPriorityPrefersAppleTouchIcon() {
        String html = """
            <html><head>
              <link rel="shortcut icon" href="/favicon.ico">
              <link rel="icon" type="image/png" href="/icon.png">
              <link rel="apple-touch-icon" href="/icons/apple.png">
            </head></html>
            """;

        String logo = resolver.resolve(domain, html);

        assertThat(logo).isEqualTo("http://" + domain + "/icons/apple.png");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void nonImageIconLinksAreSkipped() {
        String html = """
            <link rel="apple-touch-icon" href="/manifest.json">
            <link rel="icon" sizes="192x192" href="https://cdn.example.com/icon-192.png">
            """;

        assertThat(resolver.fromHtml(domain, html)).isEqualTo("https://cdn.example.com/icon-192.png");
    }

    @Test
    void openGraphImageIsUsedWhenNoIconLinks() {
        String html = "<meta property=\"og:image\" content=\"//cdn.example.com/share\">";

        assertThat(resolver.fromHtml(domain, html)).isEqualTo("https://cdn.example.com/share");
    }

    @Test
    void probesConventionalFaviconPathsInOrder() {
        server.setDispatcher(respondOkTo(Set.of("/apple-touch-icon.png", "/static/favicon.ico")));

        String logo = resolver.resolve(domain, "<html><body>No icons</body></html>");

        assertThat(logo).isEqualTo("http://" + domain + "/apple-touch-icon.png");
    }

    @Test
    void timedOutProbeFallsThroughToNextPath() {
        properties.getLogo().setProbeTimeoutSeconds(1);
        LogoResolver shortTimeoutResolver = new LogoResolver(properties, new ProbeHttpClient(properties, executor));
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if ("/favicon.ico".equals(request.getPath())) {
                    return new MockResponse().setResponseCode(200).setHeadersDelay(3, TimeUnit.SECONDS);
                }
                return "/favicon.png".equals(request.getPath())
                    ? new MockResponse().setResponseCode(200)
                    : new MockResponse().setResponseCode(404);
            }
        });

        String logo = shortTimeoutResolver.resolve(domain, "<html><body>No icons</body></html>");

        assertThat(logo).isEqualTo("http://" + domain + "/favicon.png");
    }

    @Test
    void fallsBackToLogoServiceForRootDomain() {
        String root = DomainNames.rootDomain(domain);
        server.setDispatcher(respondOkTo(Set.of("/logo/" + root)));

        String logo = resolver.resolve(domain, "");

        assertThat(logo).isEqualTo(server.url("/logo/").toString() + root);
    }

    @Test
    void faviconServiceIsFinalFallback() {
        server.setDispatcher(respondOkTo(Set.of()));

        String logo = resolver.resolve(domain, "<html></html>");

        assertThat(logo).isEqualTo("https://favicons.test/icon?domain=" + DomainNames.rootDomain(domain));
        assertThat(server.getRequestCount()).isEqualTo(LogoResolver.FAVICON_PATHS.size() + 1);
    }

    @Test
    void networkTiersAreSkippedWhenProbesDisabled() {
        properties.getLogo().setNetworkProbesEnabled(false);

        String logo = resolver.resolve("shop.acme.co.uk", "");

        assertThat(logo).isEqualTo("https://favicons.test/icon?domain=acme.co.uk");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void urlHelpers() {
        assertThat(LogoResolver.looksLikeImage("https://acme.com/logo.SVG?v=2")).isTrue();
        assertThat(LogoResolver.looksLikeImage("https://acme.com/site.webmanifest")).isFalse();
        assertThat(LogoResolver.isHttpUrl("ftp://acme.com/logo.png")).isFalse();
        assertThat(LogoResolver.isHttpUrl("https://acme.com/logo.png")).isTrue();
    }

    private static Dispatcher respondOkTo(Set<String> paths) {
        return new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return paths.contains(request.getPath())
                    ? new MockResponse().setResponseCode(200)
                    : new MockResponse().setResponseCode(404);
            }
        };
    }
}
