package com.dailyresearch.pipeline.service.note;

import com.dailyresearch.pipeline.config.PipelineConfig;
import com.dailyresearch.pipeline.corpus.CorpusStore;
import com.dailyresearch.pipeline.exception.PipelineException;
import com.dailyresearch.pipeline.exception.PipelineStage;
import com.dailyresearch.pipeline.model.Category;
import com.dailyresearch.pipeline.model.ContentItem;
import com.dailyresearch.pipeline.model.Source;
import com.dailyresearch.pipeline.service.synthesis.ReadingList;
import com.dailyresearch.pipeline.service.synthesis.Synthesis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Renders the daily note and stores it at
 * {@code <dailies>/YYYY/MM/YYYY-MM-DD.md}, or {@code YYYY-MM-DD-2.md} and so on
 * when a note for the day already exists.
 *
 * <p>Reading-list lines are {@code - [ ] [title](url) — summary #topic}, the
 * shape the promotion sweep parses.
 */
public class DailyNoteWriter {
    private static final Logger log = LoggerFactory.getLogger(DailyNoteWriter.class);
    private static final int MAX_SUFFIX = 100;

    private final CorpusStore corpus;
    private final PipelineConfig config;

    public DailyNoteWriter(CorpusStore corpus, PipelineConfig config) {
        this.corpus = corpus;
        this.config = config;
    }

    /**
     * @return corpus path of the new note
     * @throws PipelineException when no path could be created
     */
    public String write(ReadingList list, Synthesis synthesis, LocalDate date) {
        String content = render(list, synthesis, date);
        String base = config.getDailiesFolder() + "/" + date.getYear() + "/"
                + String.format("%02d", date.getMonthValue()) + "/" + date;
        for (int i = 1; i <= MAX_SUFFIX; i++) {
            String path = i == 1 ? base + ".md" : base + "-" + i + ".md";
            if (corpus.exists(path)) continue;
            if (corpus.create(path, content)) {
                log.info("Wrote daily note {}", path);
                return path;
            }
        }
        throw new PipelineException(PipelineStage.NOTE_WRITE, "Could not create a daily note for " + date);
    }

    public String render(ReadingList list, Synthesis synthesis, LocalDate date) {
        List<String> lines = new ArrayList<>();
        lines.add("---");
        lines.add("type: daily-research");
        lines.add("date: " + date);
        lines.add("topics: [" + String.join(", ", list.topicSlugs()) + "]");
        lines.add("---");
        lines.add("");
        lines.add("# Daily Research " + date);
        lines.add("");

        if (!synthesis.getBriefing().isBlank()) {
            lines.add("## Briefing");
            lines.add("");
            lines.add(synthesis.getBriefing());
            lines.add("");
        }

        Map<String, List<ContentItem>> labPulse = list.getByCategory().getOrDefault(Category.LAB_PULSE, Map.of());
        if (!synthesis.getLabPulseSummary().isBlank() || !labPulse.isEmpty()) {
            lines.add("## Lab Pulse");
            lines.add("");
            if (!synthesis.getLabPulseSummary().isBlank()) {
                lines.add(synthesis.getLabPulseSummary());
                lines.add("");
            }
            // Plain bullets: the checkbox line for the same item lives in the reading list.
            for (List<ContentItem> items : labPulse.values()) {
                for (ContentItem item : items) lines.add(referenceLine(item));
            }
            lines.add("");
        }

        if (!list.getMustFollow().isEmpty()) {
            lines.add("## Must-Follow");
            lines.add("");
            for (Map.Entry<String, List<ContentItem>> group : list.getMustFollow().entrySet()) {
                lines.add("### " + group.getKey());
                for (ContentItem item : group.getValue()) lines.add(readingLine(item));
                lines.add("");
            }
        }

        for (String slug : list.topicSlugs()) {
            Synthesis.TopicSummary summary = synthesis.topic(slug);
            if (summary == null) continue;
            lines.add("## " + list.topicName(slug));
            lines.add("");
            if (!summary.getHeadline().isBlank()) {
                lines.add("**" + summary.getHeadline() + "**");
                lines.add("");
            }
            for (String point : summary.getKeyPoints()) lines.add("- " + point);
            lines.add("");
        }

        lines.add("## Reading List");
        lines.add("");
        if (list.getItems().isEmpty()) {
            lines.add("_Nothing new today._");
        }
        for (ContentItem item : list.getItems()) {
            lines.add(readingLine(item));
        }
        lines.add("");
        return String.join("\n", lines);
    }

    String readingLine(ContentItem item) {
        String title = item.getTitle().replace("[", "(").replace("]", ")");
        String topic = item.getTopicSlug().isEmpty() ? "" : " #" + item.getTopicSlug();
        return "- [ ] [" + title + "](" + item.getUrl() + ") — " + summaryOf(item) + topic;
    }

    String referenceLine(ContentItem item) {
        String title = item.getTitle().replace("[", "(").replace("]", ")");
        return "- [" + title + "](" + item.getUrl() + ") — " + summaryOf(item);
    }

    static String summaryOf(ContentItem item) {
        List<String> parts = new ArrayList<>();
        if (item.getSource() == Source.REDDIT && item.getCommunity() != null && !item.getCommunity().isBlank()) {
            parts.add("r/" + item.getCommunity());
        } else if (item.getAuthor() != null && !item.getAuthor().isBlank()) {
            parts.add("@" + item.getAuthor());
        } else {
            parts.add(item.getSource().getSlug());
        }
        OptionalInt metric = item.metric(item.getSource().getPrimaryMetric());
        if (metric.isPresent()) {
            parts.add(metric.getAsInt() + (item.getSource() == Source.REDDIT ? " pts" : " likes"));
        }
        if (item.getCategory() != null && item.getCategory() != Category.GENERAL) {
            parts.add(item.getCategory().getLabel());
        }
        return String.join(" · ", parts);
    }
}
