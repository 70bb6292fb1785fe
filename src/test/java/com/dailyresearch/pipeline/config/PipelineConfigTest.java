package com.dailyresearch.pipeline.config;

import com.dailyresearch.pipeline.exception.ConfigValidationException;
import com.dailyresearch.pipeline.model.Source;
import com.dailyresearch.pipeline.model.TopicConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineConfigTest {

    private static ResearchProperties.Topic topic(String slug, String weight) {
        ResearchProperties.Topic t = new ResearchProperties.Topic();
        t.setSlug(slug);
        t.setDisplayName(slug);
        t.setWeight(weight);
        return t;
    }

    @Test
    public void snapshotsPropertiesAndNormalizesAccounts() {
        ResearchProperties props = new ResearchProperties();
        props.setTopics(List.of(topic("agents", "1.2"), topic("rag", "0.9")));
        props.getQualityFilters().getMinEngagement().setXLikes(50);
        props.getQualityFilters().getPriorityAccounts().setX(List.of("@SimonW"));
        props.getQualityFilters().getPriorityAccounts().setRedditSubreddits(List.of("r/LocalLLaMA"));
        props.getQualityFilters().setLabAccounts(Map.of("anthropic", List.of("AnthropicAI")));

        PipelineConfig config = PipelineConfig.from(props);

        assertEquals(2, config.getTopics().size());
        assertEquals(1.2, config.topicBySlug("agents").orElseThrow().getWeight(), 1e-9);
        assertTrue(config.topicBySlug("nope").isEmpty());
        assertEquals(50, config.floorFor(Source.X));
        assertEquals(0, config.floorFor(Source.WEB));
        assertTrue(config.getPriorityXHandles().contains("simonw"));
        assertTrue(config.getPrioritySubreddits().contains("localllama"));
        assertTrue(config.getLabHandles().contains("anthropicai"));
        assertEquals(List.of("Research/Dailies", "Research/Library"), config.getIndexFolders());
    }

    @Test
    public void reportsEveryProblemAtOnce() {
        ResearchProperties props = new ResearchProperties();
        props.setTopics(List.of(topic("agents", "1.0"), topic("agents", "0"), topic("", "abc")));
        props.getRun().setItemsPerTopic(0);
        props.getQualityFilters().getMinEngagement().setRedditScore(-1);
        ResearchProperties.Account blank = new ResearchProperties.Account();
        blank.setHandle(" ");
        props.getMustFollow().setAccounts(List.of(blank));

        ConfigValidationException e = assertThrows(ConfigValidationException.class, () -> PipelineConfig.from(props));
        List<String> problems = e.getProblems();
        assertTrue(problems.stream().anyMatch(p -> p.contains("duplicate topic slug 'agents'")), problems.toString());
        assertTrue(problems.stream().anyMatch(p -> p.contains("weight must be a positive number")), problems.toString());
        assertTrue(problems.stream().anyMatch(p -> p.contains("is not a number")), problems.toString());
        assertTrue(problems.stream().anyMatch(p -> p.contains("items-per-topic")), problems.toString());
        assertTrue(problems.stream().anyMatch(p -> p.contains("reddit-score")), problems.toString());
        assertTrue(problems.stream().anyMatch(p -> p.contains("without handle")), problems.toString());
    }

    @Test
    public void rejectsNonFiniteWeightAndBadRegex() {
        PipelineConfig.Builder b = PipelineConfig.builder()
                .topic(new TopicConfig("agents", "Agents", Double.POSITIVE_INFINITY, List.of()))
                .lowEffortPatterns(List.of("(unclosed"));
        ConfigValidationException e = assertThrows(ConfigValidationException.class, b::build);
        assertEquals(2, e.getProblems().size(), e.getProblems().toString());
    }
}
