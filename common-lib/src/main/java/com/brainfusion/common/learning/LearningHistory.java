package com.brainfusion.common.learning;

import com.brainfusion.common.model.LearningUpdate;
import com.brainfusion.common.model.QualityLevel;
import com.brainfusion.common.model.ValidationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Append-only record of every learning update that went through the validation gate,
 * with the gate's verdict. Entries older than the retention are pruned on demand.
 */
public class LearningHistory {

    private static final Logger log = LoggerFactory.getLogger(LearningHistory.class);

    public static final int      SUMMARY_LENGTH          = 200;
    public static final Duration RECENT_ACTIVITY_WINDOW  = Duration.ofDays(7);
    public static final Duration DEFAULT_RETENTION       = Duration.ofDays(180);

    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    private final ConcurrentLinkedDeque<Entry> entries = new ConcurrentLinkedDeque<>();
    private final Duration retention;
    private final Clock clock;

    public LearningHistory() {
        this(DEFAULT_RETENTION, Clock.systemUTC());
    }

    public LearningHistory(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock     = clock;
    }

    public void record(LearningUpdate update, ValidationResult result) {
        entries.addLast(new Entry(update, result, clock.instant()));
    }

    public List<LearningUpdate> updates() {
        return entries.stream().map(Entry::update).toList();
    }

    public LearningMetrics metrics(int recentLimit) {
        List<Entry> snapshot = new ArrayList<>(entries);
        long successful = snapshot.stream().filter(e -> e.result().valid()).count();

        Map<QualityLevel, Long> distribution = new EnumMap<>(QualityLevel.class);
        double qualitySum = 0.0;
        for (Entry entry : snapshot) {
            QualityLevel level = entry.result().qualityLevel();
            distribution.merge(level, 1L, Long::sum);
            qualitySum += level.learningValue();
        }
        double averageQuality = snapshot.isEmpty() ? 0.0 : qualitySum / snapshot.size();

        Instant activityCutoff = clock.instant().minus(RECENT_ACTIVITY_WINDOW);
        long recentActivity = snapshot.stream().filter(e -> !e.recordedAt().isBefore(activityCutoff)).count();

        List<LearningMetrics.RecentLearningUpdate> recent = snapshot
            .subList(Math.max(0, snapshot.size() - Math.max(0, recentLimit)), snapshot.size())
            .stream()
            .map(LearningHistory::toRecent)
            .toList();

        return new LearningMetrics(snapshot.size(), successful, snapshot.size() - successful,
            averageQuality, distribution, recentActivity, recent);
    }

    /** Removes entries recorded before the retention window; returns how many were removed. */
    public int prune() {
        Instant cutoff = clock.instant().minus(retention);
        int before = entries.size();
        entries.removeIf(e -> e.recordedAt().isBefore(cutoff));
        int removed = before - entries.size();
        if (removed > 0) {
            log.info("[Learning] History pruned. removed={} retentionDays={}", removed, retention.toDays());
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    static String summarize(Map<String, Object> content) {
        String text;
        try {
            text = MAPPER.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            text = String.valueOf(content);
        }
        return text.length() > SUMMARY_LENGTH ? text.substring(0, SUMMARY_LENGTH) + "..." : text;
    }

    private static LearningMetrics.RecentLearningUpdate toRecent(Entry entry) {
        LearningUpdate u = entry.update();
        return new LearningMetrics.RecentLearningUpdate(u.id(),
            u.learningType().name().toLowerCase(Locale.ROOT), u.sourceBrain(), u.targetBrain(),
            u.validationStatus().name().toLowerCase(Locale.ROOT), summarize(u.content()), u.timestamp());
    }

    private record Entry(LearningUpdate update, ValidationResult result, Instant recordedAt) {}
}
