package com.dailyresearch.pipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw, mutable binding of the {@code research.*} configuration tree.
 * Pipeline components never read this directly; see {@link PipelineConfig}.
 */
@Validated
@ConfigurationProperties(prefix = "research")
public class ResearchProperties {
    /** Value expected in the x-admin-key header for run endpoints. */
    private String adminKey;
    private Corpus corpus = new Corpus();
    @Valid
    private Run run = new Run();
    private Tags tags = new Tags();
    private List<Topic> topics = new ArrayList<>();
    private MustFollow mustFollow = new MustFollow();
    @Valid
    private QualityFilters qualityFilters = new QualityFilters();
    private Fetch fetch = new Fetch();
    private Synthesis synthesis = new Synthesis();

    public String getAdminKey() { return adminKey; }
    public void setAdminKey(String adminKey) { this.adminKey = adminKey; }
    public Corpus getCorpus() { return corpus; }
    public void setCorpus(Corpus corpus) { this.corpus = corpus; }
    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }
    public Tags getTags() { return tags; }
    public void setTags(Tags tags) { this.tags = tags; }
    public List<Topic> getTopics() { return topics; }
    public void setTopics(List<Topic> topics) { this.topics = topics; }
    public MustFollow getMustFollow() { return mustFollow; }
    public void setMustFollow(MustFollow mustFollow) { this.mustFollow = mustFollow; }
    public QualityFilters getQualityFilters() { return qualityFilters; }
    public void setQualityFilters(QualityFilters qualityFilters) { this.qualityFilters = qualityFilters; }
    public Fetch getFetch() { return fetch; }
    public void setFetch(Fetch fetch) { this.fetch = fetch; }
    public Synthesis getSynthesis() { return synthesis; }
    public void setSynthesis(Synthesis synthesis) { this.synthesis = synthesis; }

    public static class Corpus {
        /** Filesystem root of the note vault. */
        private String path;
        private String dailiesFolder = "Research/Dailies";
        private String libraryFolder = "Research/Library";
        /**
         * Folders scanned for the history index. Defaults to dailies + library
         * when left empty.
         */
        private List<String> indexFolders = new ArrayList<>();

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public String getDailiesFolder() { return dailiesFolder; }
        public void setDailiesFolder(String dailiesFolder) { this.dailiesFolder = dailiesFolder; }
        public String getLibraryFolder() { return libraryFolder; }
        public void setLibraryFolder(String libraryFolder) { this.libraryFolder = libraryFolder; }
        public List<String> getIndexFolders() { return indexFolders; }
        public void setIndexFolders(List<String> indexFolders) { this.indexFolders = indexFolders; }
    }

    public static class Run {
        @Min(1)
        private int itemsPerTopic = 8;
        @Min(1)
        private int readingListMax = 15;
        private Duration fetchTimeout = Duration.ofSeconds(60);
        /** Concurrent topic fetches; 0 means one worker per topic plus one for must-follow. */
        private int fetchParallelism;
        private String runHistoryDir = "tmp/run-history";
        private String feedbackLogPath = "tmp/feedback.json";
        private String promotionLedgerPath = "tmp/promotions.json";

        public int getItemsPerTopic() { return itemsPerTopic; }
        public void setItemsPerTopic(int itemsPerTopic) { this.itemsPerTopic = itemsPerTopic; }
        public int getReadingListMax() { return readingListMax; }
        public void setReadingListMax(int readingListMax) { this.readingListMax = readingListMax; }
        public Duration getFetchTimeout() { return fetchTimeout; }
        public void setFetchTimeout(Duration fetchTimeout) { this.fetchTimeout = fetchTimeout; }
        public int getFetchParallelism() { return fetchParallelism; }
        public void setFetchParallelism(int fetchParallelism) { this.fetchParallelism = fetchParallelism; }
        public String getRunHistoryDir() { return runHistoryDir; }
        public void setRunHistoryDir(String runHistoryDir) { this.runHistoryDir = runHistoryDir; }
        public String getFeedbackLogPath() { return feedbackLogPath; }
        public void setFeedbackLogPath(String feedbackLogPath) { this.feedbackLogPath = feedbackLogPath; }
        public String getPromotionLedgerPath() { return promotionLedgerPath; }
        public void setPromotionLedgerPath(String promotionLedgerPath) { this.promotionLedgerPath = promotionLedgerPath; }
    }

    /** Tag names without the leading '#'. */
    public static class Tags {
        private String keep = "keep";
        private String kept = "kept";
        private String good = "good";
        private String bad = "bad";
        private String processedSuffix = "-noted";

        public String getKeep() { return keep; }
        public void setKeep(String keep) { this.keep = keep; }
        public String getKept() { return kept; }
        public void setKept(String kept) { this.kept = kept; }
        public String getGood() { return good; }
        public void setGood(String good) { this.good = good; }
        public String getBad() { return bad; }
        public void setBad(String bad) { this.bad = bad; }
        public String getProcessedSuffix() { return processedSuffix; }
        public void setProcessedSuffix(String processedSuffix) { this.processedSuffix = processedSuffix; }
    }

    public static class Topic {
        private String slug;
        private String displayName;
        /** Kept as text so a non-numeric value is reported instead of failing the binder. */
        private String weight = "1.0";
        private List<String> searchQueries = new ArrayList<>();

        public String getSlug() { return slug; }
        public void setSlug(String slug) { this.slug = slug; }
        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }
        public String getWeight() { return weight; }
        public void setWeight(String weight) { this.weight = weight; }
        public List<String> getSearchQueries() { return searchQueries; }
        public void setSearchQueries(List<String> searchQueries) { this.searchQueries = searchQueries; }
    }

    public static class MustFollow {
        private List<Account> accounts = new ArrayList<>();

        public List<Account> getAccounts() { return accounts; }
        public void setAccounts(List<Account> accounts) { this.accounts = accounts; }
    }

    public static class Account {
        private String handle;
        private String label;
        private String group;
        private boolean solo = true;

        public String getHandle() { return handle; }
        public void setHandle(String handle) { this.handle = handle; }
        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }
        public String getGroup() { return group; }
        public void setGroup(String group) { this.group = group; }
        public boolean isSolo() { return solo; }
        public void setSolo(boolean solo) { this.solo = solo; }
    }

    public static class QualityFilters {
        private MinEngagement minEngagement = new MinEngagement();
        private int longFormMinChars = 400;
        private double longFormBonus = 15;
        private double priorityAccountBonus = 10;
        private List<String> articleDomains = new ArrayList<>();
        private PriorityAccounts priorityAccounts = new PriorityAccounts();
        /** Lab name to the handles that speak for it. */
        private Map<String, List<String>> labAccounts = new LinkedHashMap<>();
        private double engagementPointsPerDecade = 10;
        private double engagementPointsMax = 40;
        private double recencyPointsMax = 10;
        private int recencyWindowDays = 7;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double titleSimilarityThreshold = 0.8;
        private SpamDetection spamDetection = new SpamDetection();

        public MinEngagement getMinEngagement() { return minEngagement; }
        public void setMinEngagement(MinEngagement minEngagement) { this.minEngagement = minEngagement; }
        public int getLongFormMinChars() { return longFormMinChars; }
        public void setLongFormMinChars(int longFormMinChars) { this.longFormMinChars = longFormMinChars; }
        public double getLongFormBonus() { return longFormBonus; }
        public void setLongFormBonus(double longFormBonus) { this.longFormBonus = longFormBonus; }
        public double getPriorityAccountBonus() { return priorityAccountBonus; }
        public void setPriorityAccountBonus(double priorityAccountBonus) { this.priorityAccountBonus = priorityAccountBonus; }
        public List<String> getArticleDomains() { return articleDomains; }
        public void setArticleDomains(List<String> articleDomains) { this.articleDomains = articleDomains; }
        public PriorityAccounts getPriorityAccounts() { return priorityAccounts; }
        public void setPriorityAccounts(PriorityAccounts priorityAccounts) { this.priorityAccounts = priorityAccounts; }
        public Map<String, List<String>> getLabAccounts() { return labAccounts; }
        public void setLabAccounts(Map<String, List<String>> labAccounts) { this.labAccounts = labAccounts; }
        public double getEngagementPointsPerDecade() { return engagementPointsPerDecade; }
        public void setEngagementPointsPerDecade(double engagementPointsPerDecade) { this.engagementPointsPerDecade = engagementPointsPerDecade; }
        public double getEngagementPointsMax() { return engagementPointsMax; }
        public void setEngagementPointsMax(double engagementPointsMax) { this.engagementPointsMax = engagementPointsMax; }
        public double getRecencyPointsMax() { return recencyPointsMax; }
        public void setRecencyPointsMax(double recencyPointsMax) { this.recencyPointsMax = recencyPointsMax; }
        public int getRecencyWindowDays() { return recencyWindowDays; }
        public void setRecencyWindowDays(int recencyWindowDays) { this.recencyWindowDays = recencyWindowDays; }
        public double getTitleSimilarityThreshold() { return titleSimilarityThreshold; }
        public void setTitleSimilarityThreshold(double titleSimilarityThreshold) { this.titleSimilarityThreshold = titleSimilarityThreshold; }
        public SpamDetection getSpamDetection() { return spamDetection; }
        public void setSpamDetection(SpamDetection spamDetection) { this.spamDetection = spamDetection; }
    }

    public static class MinEngagement {
        private int redditScore;
        private int xLikes;

        public int getRedditScore() { return redditScore; }
        public void setRedditScore(int redditScore) { this.redditScore = redditScore; }
        public int getXLikes() { return xLikes; }
        public void setXLikes(int xLikes) { this.xLikes = xLikes; }
    }

    public static class PriorityAccounts {
        private List<String> x = new ArrayList<>();
        private List<String> redditSubreddits = new ArrayList<>();

        public List<String> getX() { return x; }
        public void setX(List<String> x) { this.x = x; }
        public List<String> getRedditSubreddits() { return redditSubreddits; }
        public void setRedditSubreddits(List<String> redditSubreddits) { this.redditSubreddits = redditSubreddits; }
    }

    public static class SpamDetection {
        private boolean enabled = true;
        private boolean claimLinkMismatchEnabled = true;
        private boolean lowEffortEnabled = true;
        /** Body length under which an item counts as low effort. */
        private int lowEffortMaxBodyChars = 80;
        private List<ClaimLinkPattern> claimLinkMismatchPatterns = new ArrayList<>();
        private List<String> lowEffortPatterns = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isClaimLinkMismatchEnabled() { return claimLinkMismatchEnabled; }
        public void setClaimLinkMismatchEnabled(boolean claimLinkMismatchEnabled) { this.claimLinkMismatchEnabled = claimLinkMismatchEnabled; }
        public boolean isLowEffortEnabled() { return lowEffortEnabled; }
        public void setLowEffortEnabled(boolean lowEffortEnabled) { this.lowEffortEnabled = lowEffortEnabled; }
        public int getLowEffortMaxBodyChars() { return lowEffortMaxBodyChars; }
        public void setLowEffortMaxBodyChars(int lowEffortMaxBodyChars) { this.lowEffortMaxBodyChars = lowEffortMaxBodyChars; }
        public List<ClaimLinkPattern> getClaimLinkMismatchPatterns() { return claimLinkMismatchPatterns; }
        public void setClaimLinkMismatchPatterns(List<ClaimLinkPattern> claimLinkMismatchPatterns) { this.claimLinkMismatchPatterns = claimLinkMismatchPatterns; }
        public List<String> getLowEffortPatterns() { return lowEffortPatterns; }
        public void setLowEffortPatterns(List<String> lowEffortPatterns) { this.lowEffortPatterns = lowEffortPatterns; }
    }

    public static class ClaimLinkPattern {
        private String claimRegex;
        private List<String> linkMustContain = new ArrayList<>();

        public String getClaimRegex() { return claimRegex; }
        public void setClaimRegex(String claimRegex) { this.claimRegex = claimRegex; }
        public List<String> getLinkMustContain() { return linkMustContain; }
        public void setLinkMustContain(List<String> linkMustContain) { this.linkMustContain = linkMustContain; }
    }

    public static class Fetch {
        private Endpoint reddit = new Endpoint();
        private Endpoint x = new Endpoint();

        public Endpoint getReddit() { return reddit; }
        public void setReddit(Endpoint reddit) { this.reddit = reddit; }
        public Endpoint getX() { return x; }
        public void setX(Endpoint x) { this.x = x; }
    }

    public static class Endpoint {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private String model;
        private String userAgent;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
    }

    public static class Synthesis {
        private String baseUrl = "https://api.openai.com";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private Duration timeout = Duration.ofSeconds(60);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
