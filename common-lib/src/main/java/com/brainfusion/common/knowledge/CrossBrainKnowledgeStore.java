package com.brainfusion.common.knowledge;

import com.brainfusion.common.exception.KnowledgeNotFoundException;
import com.brainfusion.common.model.KnowledgeItem;
import com.brainfusion.common.model.KnowledgeRequest;
import com.brainfusion.common.model.KnowledgeTransfer;
import com.brainfusion.common.model.KnowledgeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Knowledge shared between brains: storage, request matching, transfers and activity summaries.
 *
 * <p>Matching returns items of the requested type where at least one applicable context occurs
 * (case-insensitively) inside the request context, ranked by success rate then usage count,
 * both descending, and capped at {@value #MAX_MATCHES}.
 *
 * <p>A transfer bumps the item's usage count and last-used time. The item's success rate is
 * the value given when it was shared and is not recalculated from transfers.
 */
public class CrossBrainKnowledgeStore {

    private static final Logger log = LoggerFactory.getLogger(CrossBrainKnowledgeStore.class);

    public static final int MAX_MATCHES = 10;

    /** Transfers and match requests kept between cleanups; the oldest go first. */
    public static final int MAX_TRACKED_EVENTS = 1000;

    static final Duration SUMMARY_WINDOW  = Duration.ofDays(30);
    static final int      TOP_TYPES       = 3;
    static final int      TOP_RANKED      = 5;
    static final double   MAX_ACTIVITY    = 100.0;

    private static final Comparator<KnowledgeItem> RANKING =
        Comparator.comparingDouble(KnowledgeItem::successRate)
                  .thenComparingInt(KnowledgeItem::usageCount)
                  .reversed();

    private final KnowledgeRepository repository;
    private final Clock clock;
    private final ConcurrentLinkedDeque<KnowledgeTransfer> transfers = new ConcurrentLinkedDeque<>();
    private final ConcurrentLinkedDeque<RequestEntry> requests = new ConcurrentLinkedDeque<>();

    public CrossBrainKnowledgeStore(KnowledgeRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public CrossBrainKnowledgeStore(KnowledgeRepository repository, Clock clock) {
        this.repository = repository;
        this.clock      = clock;
    }

    /**
     * Stores {@code item} as owned by {@code brainId}, overwriting any item with the same id.
     * An item without an id is assigned one.
     */
    public KnowledgeItem share(String brainId, KnowledgeItem item) {
        KnowledgeItem owned = item.withSourceBrain(brainId);
        if (owned.id() == null || owned.id().isBlank()) {
            owned = new KnowledgeItem(brainId + "_" + UUID.randomUUID(), brainId, owned.knowledgeType(),
                owned.title(), owned.description(), owned.applicableContexts(), owned.confidenceImpact(),
                owned.successRate(), owned.usageCount(), owned.createdAt(), owned.lastUsed());
        }
        KnowledgeItem saved = repository.save(owned);
        log.info("[Knowledge] Shared. brain={} id={} type={} title={}",
                 brainId, saved.id(), saved.knowledgeType(), saved.title());
        return saved;
    }

    /** Items relevant to {@code request}, best first. The request is recorded for activity stats. */
    public List<KnowledgeItem> match(KnowledgeRequest request) {
        requests.addLast(new RequestEntry(request.requestingBrain(), clock.instant()));
        trim(requests);
        String context = request.context() == null ? "" : request.context().toLowerCase(Locale.ROOT);
        List<KnowledgeItem> matches = repository.findAll().stream()
            .filter(item -> item.knowledgeType() == request.knowledgeType())
            .filter(item -> item.applicableContexts().stream()
                .anyMatch(c -> c != null && context.contains(c.toLowerCase(Locale.ROOT))))
            .sorted(RANKING)
            .limit(MAX_MATCHES)
            .toList();
        log.info("[Knowledge] Match. brain={} type={} found={}",
                 request.requestingBrain(), request.knowledgeType(), matches.size());
        return matches;
    }

    /**
     * Hands item {@code knowledgeId} to {@code targetBrain}.
     *
     * @throws KnowledgeNotFoundException if no item has that id
     */
    public KnowledgeTransfer transfer(String knowledgeId, String targetBrain) {
        Instant now = clock.instant();
        KnowledgeItem used = repository.update(knowledgeId, item -> item.withUsage(now))
            .orElseThrow(() -> new KnowledgeNotFoundException(knowledgeId));
        KnowledgeTransfer transfer = new KnowledgeTransfer(UUID.randomUUID().toString(), knowledgeId,
            used.sourceBrain(), targetBrain, used.knowledgeType(), now);
        transfers.addLast(transfer);
        trim(transfers);
        log.info("[Knowledge] Transferred. id={} from={} to={} usageCount={}",
                 knowledgeId, used.sourceBrain(), targetBrain, used.usageCount());
        return transfer;
    }

    public List<KnowledgeItem> items() {
        return List.copyOf(repository.findAll());
    }

    public List<KnowledgeTransfer> transfers() {
        return List.copyOf(transfers);
    }

    /**
     * Activity of one brain over the last 30 days.
     * {@code activity = min(100, 2 × (3·shared + 2·received + requests))}
     */
    public BrainLearningSummary summaryFor(String brainId) {
        Instant cutoff = clock.instant().minus(SUMMARY_WINDOW);
        List<KnowledgeItem> shared = repository.findAll().stream()
            .filter(i -> brainId.equals(i.sourceBrain()) && !i.createdAt().isBefore(cutoff))
            .toList();
        int received = (int) transfers.stream()
            .filter(t -> brainId.equals(t.targetBrain()) && !t.transferredAt().isBefore(cutoff))
            .count();
        int requested = (int) requests.stream()
            .filter(r -> brainId.equals(r.brainId()) && !r.at().isBefore(cutoff))
            .count();
        double averageSuccess = shared.stream().mapToDouble(KnowledgeItem::successRate).average().orElse(0.0);

        Map<KnowledgeType, Long> typeCounts = new EnumMap<>(KnowledgeType.class);
        shared.forEach(i -> typeCounts.merge(i.knowledgeType(), 1L, Long::sum));
        List<KnowledgeType> topTypes = typeCounts.entrySet().stream()
            .sorted(Map.Entry.<KnowledgeType, Long>comparingByValue().reversed())
            .limit(TOP_TYPES)
            .map(Map.Entry::getKey)
            .toList();

        return new BrainLearningSummary(brainId, SUMMARY_WINDOW.toDays(), shared.size(), received, requested,
            averageSuccess, topTypes, activityScore(shared.size(), received, requested));
    }

    static double activityScore(int shared, int received, int requested) {
        return Math.min(MAX_ACTIVITY, (shared * 3 + received * 2 + requested) * 2.0);
    }

    public KnowledgeInsights insights() {
        List<KnowledgeItem> all = List.copyOf(repository.findAll());
        Map<String, Long> perBrain = new HashMap<>();
        Map<KnowledgeType, Long> usagePerType = new EnumMap<>(KnowledgeType.class);
        for (KnowledgeItem item : all) {
            perBrain.merge(item.sourceBrain(), 1L, Long::sum);
            usagePerType.merge(item.knowledgeType(), (long) item.usageCount(), Long::sum);
        }
        double averageUsage = all.stream().mapToInt(KnowledgeItem::usageCount).sum() / (double) Math.max(1, all.size());
        return new KnowledgeInsights(all.size(), transfers.size(), requests.size(),
            topRanked(perBrain), topRanked(usagePerType), averageUsage);
    }

    private static <K> Map<K, Long> topRanked(Map<K, Long> counts) {
        Map<K, Long> ranked = new LinkedHashMap<>();
        counts.entrySet().stream()
            .sorted(Map.Entry.<K, Long>comparingByValue().reversed())
            .limit(TOP_RANKED)
            .forEach(e -> ranked.put(e.getKey(), e.getValue()));
        return ranked;
    }

    /**
     * Drops transfers and requests older than {@code retention}, and items older than
     * {@code retention} that were never used.
     *
     * @return number of knowledge items removed
     */
    public int cleanup(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        transfers.removeIf(t -> t.transferredAt().isBefore(cutoff));
        requests.removeIf(r -> r.at().isBefore(cutoff));
        int removed = repository.removeIf(i -> i.createdAt().isBefore(cutoff) && i.usageCount() == 0);
        if (removed > 0) {
            log.info("[Knowledge] Cleanup removed={} retentionDays={}", removed, retention.toDays());
        }
        return removed;
    }

    private record RequestEntry(String brainId, Instant at) {}

    private static void trim(Deque<?> events) {
        while (events.size() > MAX_TRACKED_EVENTS) {
            events.pollFirst();
        }
    }
}
