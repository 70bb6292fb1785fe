package com.dailyresearch.pipeline.config;

import com.dailyresearch.pipeline.exception.ConfigValidationException;
import com.dailyresearch.pipeline.model.AccountConfig;
import com.dailyresearch.pipeline.model.Source;
import com.dailyresearch.pipeline.model.TopicConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable, validated snapshot of the pipeline configuration. Built once and
 * handed to every component through its constructor.
 *
 * <p>Handles, subreddits and domains are stored lower-cased; regexes are
 * pre-compiled case-insensitively.
 */
public final class PipelineConfig {
    private final List<TopicConfig> topics;
    private final List<AccountConfig> mustFollowAccounts;
    private final int itemsPerTopic;
    private final int readingListMax;
    private final Duration fetchTimeout;
    private final int fetchParallelism;

    private final int redditScoreFloor;
    private final int xLikesFloor;
    private final int longFormMinChars;
    private final double longFormBonus;
    private final double priorityAccountBonus;
    private final List<String> articleDomains;
    private final Set<String> priorityXHandles;
    private final Set<String> prioritySubreddits;
    private final Map<String, List<String>> labAccounts;
    private final Set<String> labHandles;
    private final double engagementPointsPerDecade;
    private final double engagementPointsMax;
    private final double recencyPointsMax;
    private final int recencyWindowDays;
    private final double titleSimilarityThreshold;

    private final boolean spamDetectionEnabled;
    private final boolean claimLinkMismatchEnabled;
    private final boolean lowEffortEnabled;
    private final int lowEffortMaxBodyChars;
    private final List<ClaimLinkRule> claimLinkRules;
    private final List<Pattern> lowEffortPatterns;

    private final String dailiesFolder;
    private final String libraryFolder;
    private final List<String> indexFolders;
    private final String keepTag;
    private final String keptTag;
    private final String goodTag;
    private final String badTag;
    private final String processedSuffix;

    private PipelineConfig(Builder b, List<ClaimLinkRule> claimLinkRules, List<Pattern> lowEffortPatterns) {
        this.topics = List.copyOf(b.topics);
        this.mustFollowAccounts = List.copyOf(b.mustFollowAccounts);
        this.itemsPerTopic = b.itemsPerTopic;
        this.readingListMax = b.readingListMax;
        this.fetchTimeout = b.fetchTimeout;
        this.fetchParallelism = b.fetchParallelism > 0 ? b.fetchParallelism : topics.size() + 1;
        this.redditScoreFloor = b.redditScoreFloor;
        this.xLikesFloor = b.xLikesFloor;
        this.longFormMinChars = b.longFormMinChars;
        this.longFormBonus = b.longFormBonus;
        this.priorityAccountBonus = b.priorityAccountBonus;
        this.articleDomains = lowerAll(b.articleDomains);
        this.priorityXHandles = Collections.unmodifiableSet(new LinkedHashSet<>(lowerAll(stripAt(b.priorityXHandles))));
        this.prioritySubreddits = Collections.unmodifiableSet(new LinkedHashSet<>(lowerAll(stripSubredditPrefix(b.prioritySubreddits))));
        Map<String, List<String>> labs = new LinkedHashMap<>();
        Set<String> flat = new LinkedHashSet<>();
        b.labAccounts.forEach((lab, handles) -> {
            List<String> hs = lowerAll(stripAt(handles));
            labs.put(lab, hs);
            flat.addAll(hs);
        });
        this.labAccounts = Collections.unmodifiableMap(labs);
        this.labHandles = Collections.unmodifiableSet(flat);
        this.engagementPointsPerDecade = b.engagementPointsPerDecade;
        this.engagementPointsMax = b.engagementPointsMax;
        this.recencyPointsMax = b.recencyPointsMax;
        this.recencyWindowDays = b.recencyWindowDays;
        this.titleSimilarityThreshold = b.titleSimilarityThreshold;
        this.spamDetectionEnabled = b.spamDetectionEnabled;
        this.claimLinkMismatchEnabled = b.claimLinkMismatchEnabled;
        this.lowEffortEnabled = b.lowEffortEnabled;
        this.lowEffortMaxBodyChars = b.lowEffortMaxBodyChars;
        this.claimLinkRules = List.copyOf(claimLinkRules);
        this.lowEffortPatterns = List.copyOf(lowEffortPatterns);
        this.dailiesFolder = trimSlashes(b.dailiesFolder);
        this.libraryFolder = trimSlashes(b.libraryFolder);
        List<String> folders = new ArrayList<>();
        for (String f : b.indexFolders) folders.add(trimSlashes(f));
        if (folders.isEmpty()) {
            folders.add(this.dailiesFolder);
            folders.add(this.libraryFolder);
        }
        this.indexFolders = List.copyOf(folders);
        this.keepTag = b.keepTag;
        this.keptTag = b.keptTag;
        this.goodTag = b.goodTag;
        this.badTag = b.badTag;
        this.processedSuffix = b.processedSuffix;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Snapshots and validates the bound properties.
     *
     * @throws ConfigValidationException listing every problem found
     */
    public static PipelineConfig from(ResearchProperties props) {
        Builder b = builder();
        for (ResearchProperties.Topic t : props.getTopics()) {
            String slug = t.getSlug() == null ? "" : t.getSlug().trim();
            double weight;
            try {
                weight = Double.parseDouble(t.getWeight() == null ? "1.0" : t.getWeight().trim());
            } catch (NumberFormatException e) {
                b.problem("topic '" + slug + "': weight '" + t.getWeight() + "' is not a number");
                continue;
            }
            b.topic(new TopicConfig(slug, t.getDisplayName(), weight, t.getSearchQueries()));
        }
        for (ResearchProperties.Account a : props.getMustFollow().getAccounts()) {
            b.mustFollow(new AccountConfig(a.getHandle(), a.getLabel(), a.getGroup(), a.isSolo()));
        }
        ResearchProperties.Run run = props.getRun();
        b.itemsPerTopic(run.getItemsPerTopic())
                .readingListMax(run.getReadingListMax())
                .fetchTimeout(run.getFetchTimeout())
                .fetchParallelism(run.getFetchParallelism());

        ResearchProperties.QualityFilters qf = props.getQualityFilters();
        b.redditScoreFloor(qf.getMinEngagement().getRedditScore())
                .xLikesFloor(qf.getMinEngagement().getXLikes())
                .longFormMinChars(qf.getLongFormMinChars())
                .longFormBonus(qf.getLongFormBonus())
                .priorityAccountBonus(qf.getPriorityAccountBonus())
                .articleDomains(qf.getArticleDomains())
                .priorityXHandles(qf.getPriorityAccounts().getX())
                .prioritySubreddits(qf.getPriorityAccounts().getRedditSubreddits())
                .labAccounts(qf.getLabAccounts())
                .engagementPoints(qf.getEngagementPointsPerDecade(), qf.getEngagementPointsMax())
                .recency(qf.getRecencyPointsMax(), qf.getRecencyWindowDays())
                .titleSimilarityThreshold(qf.getTitleSimilarityThreshold());

        ResearchProperties.SpamDetection sd = qf.getSpamDetection();
        b.spamDetectionEnabled(sd.isEnabled())
                .claimLinkMismatchEnabled(sd.isClaimLinkMismatchEnabled())
                .lowEffortEnabled(sd.isLowEffortEnabled())
                .lowEffortMaxBodyChars(sd.getLowEffortMaxBodyChars())
                .lowEffortPatterns(sd.getLowEffortPatterns());
        for (ResearchProperties.ClaimLinkPattern p : sd.getClaimLinkMismatchPatterns()) {
            b.claimLinkPattern(p.getClaimRegex(), p.getLinkMustContain());
        }

        ResearchProperties.Corpus corpus = props.getCorpus();
        b.dailiesFolder(corpus.getDailiesFolder())
                .libraryFolder(corpus.getLibraryFolder())
                .indexFolders(corpus.getIndexFolders());

        ResearchProperties.Tags tags = props.getTags();
        b.tags(tags.getKeep(), tags.getKept(), tags.getGood(), tags.getBad(), tags.getProcessedSuffix());
        return b.build();
    }

    public List<TopicConfig> getTopics() { return topics; }
    public List<AccountConfig> getMustFollowAccounts() { return mustFollowAccounts; }
    public int getItemsPerTopic() { return itemsPerTopic; }
    public int getReadingListMax() { return readingListMax; }
    public Duration getFetchTimeout() { return fetchTimeout; }
    public int getFetchParallelism() { return fetchParallelism; }
    public int getRedditScoreFloor() { return redditScoreFloor; }
    public int getXLikesFloor() { return xLikesFloor; }
    public int getLongFormMinChars() { return longFormMinChars; }
    public double getLongFormBonus() { return longFormBonus; }
    public double getPriorityAccountBonus() { return priorityAccountBonus; }
    public List<String> getArticleDomains() { return articleDomains; }
    public Set<String> getPriorityXHandles() { return priorityXHandles; }
    public Set<String> getPrioritySubreddits() { return prioritySubreddits; }
    public Map<String, List<String>> getLabAccounts() { return labAccounts; }
    public Set<String> getLabHandles() { return labHandles; }
    public double getEngagementPointsPerDecade() { return engagementPointsPerDecade; }
    public double getEngagementPointsMax() { return engagementPointsMax; }
    public double getRecencyPointsMax() { return recencyPointsMax; }
    public int getRecencyWindowDays() { return recencyWindowDays; }
    public double getTitleSimilarityThreshold() { return titleSimilarityThreshold; }
    public boolean isSpamDetectionEnabled() { return spamDetectionEnabled; }
    public boolean isClaimLinkMismatchEnabled() { return claimLinkMismatchEnabled; }
    public boolean isLowEffortEnabled() { return lowEffortEnabled; }
    public int getLowEffortMaxBodyChars() { return lowEffortMaxBodyChars; }
    public List<ClaimLinkRule> getClaimLinkRules() { return claimLinkRules; }
    public List<Pattern> getLowEffortPatterns() { return lowEffortPatterns; }
    public String getDailiesFolder() { return dailiesFolder; }
    public String getLibraryFolder() { return libraryFolder; }
    public List<String> getIndexFolders() { return indexFolders; }
    public String getKeepTag() { return keepTag; }
    public String getKeptTag() { return keptTag; }
    public String getGoodTag() { return goodTag; }
    public String getBadTag() { return badTag; }
    public String getProcessedSuffix() { return processedSuffix; }

    public Optional<TopicConfig> topicBySlug(String slug) {
        return topics.stream().filter(t -> t.getSlug().equals(slug)).findFirst();
    }

    /** Engagement floor for the source's primary metric; 0 means no floor. */
    public int floorFor(Source source) {
        switch (source) {
            case REDDIT: return redditScoreFloor;
            case X: return xLikesFloor;
            default: return 0;
        }
    }

    private static List<String> lowerAll(List<String> in) {
        List<String> out = new ArrayList<>();
        if (in == null) return out;
        for (String s : in) {
            if (s != null && !s.isBlank()) out.add(s.trim().toLowerCase(Locale.ROOT));
        }
        return Collections.unmodifiableList(out);
    }

    private static List<String> stripAt(List<String> in) {
        List<String> out = new ArrayList<>();
        if (in == null) return out;
        for (String s : in) {
            if (s == null) continue;
            String t = s.trim();
            out.add(t.startsWith("@") ? t.substring(1) : t);
        }
        return out;
    }

    private static List<String> stripSubredditPrefix(List<String> in) {
        List<String> out = new ArrayList<>();
        if (in == null) return out;
        for (String s : in) {
            if (s == null) continue;
            String t = s.trim();
            out.add(t.startsWith("r/") ? t.substring(2) : t);
        }
        return out;
    }

    private static String trimSlashes(String s) {
        if (s == null) return "";
        return s.trim().replace('\\', '/').replaceAll("^/+|/+$", "");
    }

    /** Title claim plus the domains a link must point to for the claim to be believable. */
    public static final class ClaimLinkRule {
        private final Pattern claim;
        private final List<String> allowedDomains;

        public ClaimLinkRule(Pattern claim, List<String> allowedDomains) {
            this.claim = claim;
            this.allowedDomains = lowerAll(allowedDomains);
        }

        public Pattern getClaim() { return claim; }
        public List<String> getAllowedDomains() { return allowedDomains; }
    }

    public static final class Builder {
        private final List<String> problems = new ArrayList<>();
        private List<TopicConfig> topics = new ArrayList<>();
        private List<AccountConfig> mustFollowAccounts = new ArrayList<>();
        private int itemsPerTopic = 8;
        private int readingListMax = 15;
        private Duration fetchTimeout = Duration.ofSeconds(60);
        private int fetchParallelism;
        private int redditScoreFloor;
        private int xLikesFloor;
        private int longFormMinChars = 400;
        private double longFormBonus = 15;
        private double priorityAccountBonus = 10;
        private List<String> articleDomains = new ArrayList<>();
        private List<String> priorityXHandles = new ArrayList<>();
        private List<String> prioritySubreddits = new ArrayList<>();
        private Map<String, List<String>> labAccounts = new LinkedHashMap<>();
        private double engagementPointsPerDecade = 10;
        private double engagementPointsMax = 40;
        private double recencyPointsMax = 10;
        private int recencyWindowDays = 7;
        private double titleSimilarityThreshold = 0.8;
        private boolean spamDetectionEnabled = true;
        private boolean claimLinkMismatchEnabled = true;
        private boolean lowEffortEnabled = true;
        private int lowEffortMaxBodyChars = 80;
        private final List<String> claimLinkRegexes = new ArrayList<>();
        private final List<List<String>> claimLinkDomains = new ArrayList<>();
        private List<String> lowEffortPatterns = new ArrayList<>();
        private String dailiesFolder = "Research/Dailies";
        private String libraryFolder = "Research/Library";
        private List<String> indexFolders = new ArrayList<>();
        private String keepTag = "keep";
        private String keptTag = "kept";
        private String goodTag = "good";
        private String badTag = "bad";
        private String processedSuffix = "-noted";

        private Builder() {}

        Builder problem(String problem) { problems.add(problem); return this; }

        public Builder topic(TopicConfig topic) { this.topics.add(topic); return this; }
        public Builder topics(List<TopicConfig> topics) { this.topics = new ArrayList<>(topics); return this; }
        public Builder mustFollow(AccountConfig account) { this.mustFollowAccounts.add(account); return this; }
        public Builder itemsPerTopic(int n) { this.itemsPerTopic = n; return this; }
        public Builder readingListMax(int n) { this.readingListMax = n; return this; }
        public Builder fetchTimeout(Duration d) { this.fetchTimeout = d; return this; }
        public Builder fetchParallelism(int n) { this.fetchParallelism = n; return this; }
        public Builder redditScoreFloor(int n) { this.redditScoreFloor = n; return this; }
        public Builder xLikesFloor(int n) { this.xLikesFloor = n; return this; }
        public Builder longFormMinChars(int n) { this.longFormMinChars = n; return this; }
        public Builder longFormBonus(double v) { this.longFormBonus = v; return this; }
        public Builder priorityAccountBonus(double v) { this.priorityAccountBonus = v; return this; }
        public Builder articleDomains(List<String> v) { this.articleDomains = copy(v); return this; }
        public Builder priorityXHandles(List<String> v) { this.priorityXHandles = copy(v); return this; }
        public Builder prioritySubreddits(List<String> v) { this.prioritySubreddits = copy(v); return this; }
        public Builder labAccounts(Map<String, List<String>> v) { this.labAccounts = v == null ? new LinkedHashMap<>() : new LinkedHashMap<>(v); return this; }
        public Builder engagementPoints(double perDecade, double max) { this.engagementPointsPerDecade = perDecade; this.engagementPointsMax = max; return this; }
        public Builder recency(double max, int windowDays) { this.recencyPointsMax = max; this.recencyWindowDays = windowDays; return this; }
        public Builder titleSimilarityThreshold(double v) { this.titleSimilarityThreshold = v; return this; }
        public Builder spamDetectionEnabled(boolean v) { this.spamDetectionEnabled = v; return this; }
        public Builder claimLinkMismatchEnabled(boolean v) { this.claimLinkMismatchEnabled = v; return this; }
        public Builder lowEffortEnabled(boolean v) { this.lowEffortEnabled = v; return this; }
        public Builder lowEffortMaxBodyChars(int v) { this.lowEffortMaxBodyChars = v; return this; }
        public Builder lowEffortPatterns(List<String> v) { this.lowEffortPatterns = copy(v); return this; }
        public Builder dailiesFolder(String v) { this.dailiesFolder = v; return this; }
        public Builder libraryFolder(String v) { this.libraryFolder = v; return this; }
        public Builder indexFolders(List<String> v) { this.indexFolders = copy(v); return this; }

        public Builder claimLinkPattern(String claimRegex, List<String> linkMustContain) {
            claimLinkRegexes.add(claimRegex);
            claimLinkDomains.add(copy(linkMustContain));
            return this;
        }

        public Builder tags(String keep, String kept, String good, String bad, String processedSuffix) {
            this.keepTag = stripHash(keep);
            this.keptTag = stripHash(kept);
            this.goodTag = stripHash(good);
            this.badTag = stripHash(bad);
            this.processedSuffix = processedSuffix;
            return this;
        }

        /**
         * @throws ConfigValidationException listing every problem found
         */
        public PipelineConfig build() {
            List<String> errors = new ArrayList<>(problems);
            Set<String> slugs = new LinkedHashSet<>();
            for (TopicConfig t : topics) {
                if (t.getSlug() == null || t.getSlug().isBlank()) {
                    errors.add("topic without slug");
                } else if (!slugs.add(t.getSlug())) {
                    errors.add("duplicate topic slug '" + t.getSlug() + "'");
                }
                if (Double.isNaN(t.getWeight()) || Double.isInfinite(t.getWeight()) || t.getWeight() <= 0) {
                    errors.add("topic '" + t.getSlug() + "': weight must be a positive number");
                }
            }
            for (AccountConfig a : mustFollowAccounts) {
                if (a.getHandle().isBlank()) {
                    errors.add("must-follow account without handle");
                }
            }
            if (itemsPerTopic < 1) errors.add("items-per-topic must be at least 1");
            if (readingListMax < 0) errors.add("reading-list-max must not be negative");
            if (redditScoreFloor < 0) errors.add("min-engagement.reddit-score must not be negative");
            if (xLikesFloor < 0) errors.add("min-engagement.x-likes must not be negative");
            if (fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero()) {
                errors.add("fetch-timeout must be positive");
            }
            if (titleSimilarityThreshold <= 0 || titleSimilarityThreshold > 1) {
                errors.add("title-similarity-threshold must be in (0, 1]");
            }
            if (recencyWindowDays < 1) errors.add("recency-window-days must be at least 1");
            for (String tag : List.of(keepTag, keptTag, goodTag, badTag)) {
                if (tag == null || tag.isBlank()) errors.add("tag names must not be blank");
            }

            List<ClaimLinkRule> rules = new ArrayList<>();
            for (int i = 0; i < claimLinkRegexes.size(); i++) {
                String regex = claimLinkRegexes.get(i);
                Pattern p = compile(regex, "claim-link-mismatch pattern", errors);
                if (p != null) rules.add(new ClaimLinkRule(p, claimLinkDomains.get(i)));
            }
            List<Pattern> lowEffort = new ArrayList<>();
            for (String regex : lowEffortPatterns) {
                Pattern p = compile(regex, "low-effort pattern", errors);
                if (p != null) lowEffort.add(p);
            }

            if (!errors.isEmpty()) {
                throw new ConfigValidationException(errors);
            }
            return new PipelineConfig(this, rules, lowEffort);
        }

        private static Pattern compile(String regex, String what, List<String> errors) {
            if (regex == null || regex.isBlank()) {
                errors.add(what + " is blank");
                return null;
            }
            try {
                return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            } catch (PatternSyntaxException e) {
                errors.add(what + " '" + regex + "' is not a valid regex: " + e.getDescription());
                return null;
            }
        }

        private static List<String> copy(List<String> v) {
            return v == null ? new ArrayList<>() : new ArrayList<>(v);
        }

        private static String stripHash(String tag) {
            if (tag == null) return null;
            String t = tag.trim();
            return t.startsWith("#") ? t.substring(1) : t;
        }
    }
}
