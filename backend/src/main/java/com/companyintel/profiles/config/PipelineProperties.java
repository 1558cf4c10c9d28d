package com.companyintel.profiles.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT = "company-intel/0.1 (+contact)";

    private String userAgent;
    private String inputDir = "data/input/website_dumps";
    private String outputDir = "data/output";
    private String rawFile = "companies_raw.json";
    private String finalFile = "companies.json";
    private String failedFile = "failed_companies.txt";
    private String detailsDir = "json";
    private int concurrency = 4;
    private Extraction extraction = new Extraction();
    private Logo logo = new Logo();
    private Enrichment enrichment = new Enrichment();
    private Cli cli = new Cli();
    private Directory directory = new Directory();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public String getInputDir() {
        return inputDir;
    }

    public void setInputDir(String inputDir) {
        this.inputDir = inputDir;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getRawFile() {
        return rawFile;
    }

    public void setRawFile(String rawFile) {
        this.rawFile = rawFile;
    }

    public String getFinalFile() {
        return finalFile;
    }

    public void setFinalFile(String finalFile) {
        this.finalFile = finalFile;
    }

    public String getFailedFile() {
        return failedFile;
    }

    public void setFailedFile(String failedFile) {
        this.failedFile = failedFile;
    }

    public String getDetailsDir() {
        return detailsDir;
    }

    public void setDetailsDir(String detailsDir) {
        this.detailsDir = detailsDir;
    }

    public int getConcurrency() {
        return Math.max(1, concurrency);
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = Math.max(1, concurrency);
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Logo getLogo() {
        return logo;
    }

    public void setLogo(Logo logo) {
        this.logo = logo;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Directory getDirectory() {
        return directory;
    }

    public void setDirectory(Directory directory) {
        this.directory = directory;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Extraction {
        private int maxTextLength = 3000;
        private int minTextLength = 50;

        public int getMaxTextLength() {
            return Math.max(1, maxTextLength);
        }

        public void setMaxTextLength(int maxTextLength) {
            this.maxTextLength = Math.max(1, maxTextLength);
        }

        public int getMinTextLength() {
            return Math.max(0, minTextLength);
        }

        public void setMinTextLength(int minTextLength) {
            this.minTextLength = Math.max(0, minTextLength);
        }
    }

    public static class Logo {
        private int probeTimeoutSeconds = 3;
        private String siteScheme = "https";
        private String logoServiceBaseUrl = "https://logo.clearbit.com/";
        private String faviconServiceUrl = "https://www.google.com/s2/favicons?sz=128&domain=";
        private boolean networkProbesEnabled = true;

        public int getProbeTimeoutSeconds() {
            return Math.max(1, probeTimeoutSeconds);
        }

        public void setProbeTimeoutSeconds(int probeTimeoutSeconds) {
            this.probeTimeoutSeconds = Math.max(1, probeTimeoutSeconds);
        }

        public String getSiteScheme() {
            return "http".equalsIgnoreCase(siteScheme) ? "http" : "https";
        }

        public void setSiteScheme(String siteScheme) {
            this.siteScheme = siteScheme;
        }

        public String getLogoServiceBaseUrl() {
            return logoServiceBaseUrl;
        }

        public void setLogoServiceBaseUrl(String logoServiceBaseUrl) {
            this.logoServiceBaseUrl = logoServiceBaseUrl;
        }

        public String getFaviconServiceUrl() {
            return faviconServiceUrl;
        }

        public void setFaviconServiceUrl(String faviconServiceUrl) {
            this.faviconServiceUrl = faviconServiceUrl;
        }

        public boolean isNetworkProbesEnabled() {
            return networkProbesEnabled;
        }

        public void setNetworkProbesEnabled(boolean networkProbesEnabled) {
            this.networkProbesEnabled = networkProbesEnabled;
        }
    }

    public static class Enrichment {
        private boolean detailsEnabled = true;

        public boolean isDetailsEnabled() {
            return detailsEnabled;
        }

        public void setDetailsEnabled(boolean detailsEnabled) {
            this.detailsEnabled = detailsEnabled;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean mergeAfterRun = true;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isMergeAfterRun() {
            return mergeAfterRun;
        }

        public void setMergeAfterRun(boolean mergeAfterRun) {
            this.mergeAfterRun = mergeAfterRun;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Directory {
        private String dataFile = "data/output/companies.json";
        private boolean loadOnStartup = true;

        public String getDataFile() {
            return dataFile;
        }

        public void setDataFile(String dataFile) {
            this.dataFile = dataFile;
        }

        public boolean isLoadOnStartup() {
            return loadOnStartup;
        }

        public void setLoadOnStartup(boolean loadOnStartup) {
            this.loadOnStartup = loadOnStartup;
        }
    }
}
