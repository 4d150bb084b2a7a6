package com.metbull.sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "sync")
public class SyncProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
            + "Chrome/91.0.4472.124 Safari/537.36";
    private static final String DEFAULT_CATALOG_URL = "https://www.lpi.usra.edu/meteor/metbull.php";

    private String catalogUrl = DEFAULT_CATALOG_URL;
    private String userAgent;
    private int requestTimeoutSeconds = 45;
    private int recordsPerPage = 500;
    private boolean insecureTls = true;
    private int checkpointEveryPages = 10;
    private Data data = new Data();
    private Cli cli = new Cli();
    private Map<String, Profile> profiles = new LinkedHashMap<>();

    public String getCatalogUrl() {
        return catalogUrl == null || catalogUrl.isBlank() ? DEFAULT_CATALOG_URL : catalogUrl.trim();
    }

    public void setCatalogUrl(String catalogUrl) {
        this.catalogUrl = catalogUrl;
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRecordsPerPage() {
        return Math.max(1, recordsPerPage);
    }

    public void setRecordsPerPage(int recordsPerPage) {
        this.recordsPerPage = Math.max(1, recordsPerPage);
    }

    public boolean isInsecureTls() {
        return insecureTls;
    }

    public void setInsecureTls(boolean insecureTls) {
        this.insecureTls = insecureTls;
    }

    public int getCheckpointEveryPages() {
        return Math.max(1, checkpointEveryPages);
    }

    public void setCheckpointEveryPages(int checkpointEveryPages) {
        this.checkpointEveryPages = Math.max(1, checkpointEveryPages);
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Map<String, Profile> getProfiles() {
        return profiles;
    }

    public void setProfiles(Map<String, Profile> profiles) {
        this.profiles = profiles == null ? new LinkedHashMap<>() : profiles;
    }

    public Profile requireProfile(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        Profile profile = profiles.get(key);
        if (profile == null) {
            throw new IllegalArgumentException(
                "unknown run profile '" + name + "', configured profiles: " + profiles.keySet()
            );
        }
        if (profile.getName() == null) {
            profile.setName(key);
        }
        return profile;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Data {
        private String inputCsv = "Meteorite_Landings_Final.csv";
        private String outputCsv;
        private String baseCsv = "Meteorite_Landings_Cleaned.csv";
        private String incrementalCsv = "";
        private String mergedCsv = "Meteorite_Landings_Updated.csv";
        private String checkpointJson;

        public String getInputCsv() {
            return inputCsv;
        }

        public void setInputCsv(String inputCsv) {
            this.inputCsv = inputCsv;
        }

        public String getOutputCsv() {
            return outputCsv == null || outputCsv.isBlank() ? inputCsv : outputCsv;
        }

        public void setOutputCsv(String outputCsv) {
            this.outputCsv = outputCsv;
        }

        public String getBaseCsv() {
            return baseCsv;
        }

        public void setBaseCsv(String baseCsv) {
            this.baseCsv = baseCsv;
        }

        public String getIncrementalCsv() {
            return incrementalCsv;
        }

        public void setIncrementalCsv(String incrementalCsv) {
            this.incrementalCsv = incrementalCsv;
        }

        public String getMergedCsv() {
            return mergedCsv;
        }

        public void setMergedCsv(String mergedCsv) {
            this.mergedCsv = mergedCsv;
        }

        public String getCheckpointJson() {
            if (checkpointJson == null || checkpointJson.isBlank()) {
                return getOutputCsv() + ".checkpoint.json";
            }
            return checkpointJson;
        }

        public void setCheckpointJson(String checkpointJson) {
            this.checkpointJson = checkpointJson;
        }
    }

    public static class Cli {
        private boolean run;
        private String mode = "backfill";
        private String profile = "recent";
        private boolean resume;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getProfile() {
            return profile;
        }

        public void setProfile(String profile) {
            this.profile = profile;
        }

        public boolean isResume() {
            return resume;
        }

        public void setResume(boolean resume) {
            this.resume = resume;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    /**
     * One named crawl configuration. Page bounds are inclusive; a null year floor
     * disables the year-floor stop heuristic.
     */
    public static class Profile {
        private String name;
        private int startPage = 0;
        private int endPage = 24;
        private Integer yearFloor;
        private boolean stopOnEmptyPage = true;
        private int emptyPagesBeforeStop = 1;
        private int pageDelayMs = 1000;

        public Profile() {
        }

        public Profile(String name, int startPage, int endPage) {
            this.name = name;
            setStartPage(startPage);
            setEndPage(endPage);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getStartPage() {
            return startPage;
        }

        public void setStartPage(int startPage) {
            this.startPage = Math.max(0, startPage);
        }

        public int getEndPage() {
            return Math.max(startPage, endPage);
        }

        public void setEndPage(int endPage) {
            this.endPage = Math.max(0, endPage);
        }

        public Integer getYearFloor() {
            return yearFloor;
        }

        public void setYearFloor(Integer yearFloor) {
            this.yearFloor = yearFloor;
        }

        public boolean isStopOnEmptyPage() {
            return stopOnEmptyPage;
        }

        public void setStopOnEmptyPage(boolean stopOnEmptyPage) {
            this.stopOnEmptyPage = stopOnEmptyPage;
        }

        public int getEmptyPagesBeforeStop() {
            return Math.max(1, emptyPagesBeforeStop);
        }

        public void setEmptyPagesBeforeStop(int emptyPagesBeforeStop) {
            this.emptyPagesBeforeStop = Math.max(1, emptyPagesBeforeStop);
        }

        public int getPageDelayMs() {
            return Math.max(0, pageDelayMs);
        }

        public void setPageDelayMs(int pageDelayMs) {
            this.pageDelayMs = Math.max(0, pageDelayMs);
        }
    }
}
