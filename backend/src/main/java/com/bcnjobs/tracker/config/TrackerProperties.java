package com.bcnjobs.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {
    private static final String DEFAULT_USER_AGENT = "bcn-job-tracker/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 1000;
    private int globalConcurrency = 4;
    private int requestTimeoutSeconds = 30;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private int sourceDelayMs = 2000;
    private int sourceConcurrency = 1;
    private double failureRateWarningThreshold = 0.2;
    private Run run = new Run();
    private Limits limits = new Limits();
    private Registry registry = new Registry();
    private Target target = new Target();
    private SuccessFactors successfactors = new SuccessFactors();
    private Mail mail = new Mail();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public int getSourceDelayMs() {
        return Math.max(0, sourceDelayMs);
    }

    public void setSourceDelayMs(int sourceDelayMs) {
        this.sourceDelayMs = Math.max(0, sourceDelayMs);
    }

    public int getSourceConcurrency() {
        return Math.max(1, sourceConcurrency);
    }

    public void setSourceConcurrency(int sourceConcurrency) {
        this.sourceConcurrency = Math.max(1, sourceConcurrency);
    }

    public double getFailureRateWarningThreshold() {
        return Math.min(1.0, Math.max(0.0, failureRateWarningThreshold));
    }

    public void setFailureRateWarningThreshold(double failureRateWarningThreshold) {
        this.failureRateWarningThreshold = failureRateWarningThreshold;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Limits getLimits() {
        return limits;
    }

    public void setLimits(Limits limits) {
        this.limits = limits;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Target getTarget() {
        return target;
    }

    public void setTarget(Target target) {
        this.target = target;
    }

    public SuccessFactors getSuccessfactors() {
        return successfactors;
    }

    public void setSuccessfactors(SuccessFactors successfactors) {
        this.successfactors = successfactors;
    }

    public Mail getMail() {
        return mail;
    }

    public void setMail(Mail mail) {
        this.mail = mail;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Run {
        private int maxDurationSeconds = 1800;

        public int getMaxDurationSeconds() {
            return Math.max(1, maxDurationSeconds);
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = maxDurationSeconds;
        }
    }

    public static class Limits {
        private int maxPages = 25;
        private int maxDetailRequests = 200;

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getMaxDetailRequests() {
            return Math.max(0, maxDetailRequests);
        }

        public void setMaxDetailRequests(int maxDetailRequests) {
            this.maxDetailRequests = Math.max(0, maxDetailRequests);
        }
    }

    public static class Registry {
        private String companiesCsv = "../data/companies.csv";

        public String getCompaniesCsv() {
            return companiesCsv;
        }

        public void setCompaniesCsv(String companiesCsv) {
            this.companiesCsv = companiesCsv;
        }
    }

    public static class Target {
        private String city = "Barcelona";

        public String getCity() {
            return city == null || city.isBlank() ? "Barcelona" : city.trim();
        }

        public void setCity(String city) {
            this.city = city;
        }
    }

    public static class SuccessFactors {
        private List<String> searchTerms = new ArrayList<>(
            List.of("data", "machine learning", "AI", "analyst", "scientist")
        );

        public List<String> getSearchTerms() {
            return searchTerms;
        }

        public void setSearchTerms(List<String> searchTerms) {
            this.searchTerms = searchTerms == null ? new ArrayList<>() : searchTerms;
        }
    }

    public static class Mail {
        private String host = "imap.gmail.com";
        private int port = 993;
        private String folder = "INBOX";
        private String address;
        private String appPassword;
        private int daysBack = 7;
        private int timeoutMs = 30000;

        public boolean hasCredentials() {
            return address != null && !address.isBlank() && appPassword != null && !appPassword.isBlank();
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getFolder() {
            return folder == null || folder.isBlank() ? "INBOX" : folder;
        }

        public void setFolder(String folder) {
            this.folder = folder;
        }

        public String getAddress() {
            return address;
        }

        public void setAddress(String address) {
            this.address = address;
        }

        public String getAppPassword() {
            return appPassword;
        }

        public void setAppPassword(String appPassword) {
            this.appPassword = appPassword;
        }

        public int getDaysBack() {
            return Math.max(1, daysBack);
        }

        public void setDaysBack(int daysBack) {
            this.daysBack = Math.max(1, daysBack);
        }

        public int getTimeoutMs() {
            return Math.max(1000, timeoutMs);
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class Cli {
        private boolean run = false;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
