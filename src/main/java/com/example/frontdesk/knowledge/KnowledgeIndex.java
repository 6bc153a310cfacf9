package com.example.frontdesk.knowledge;

import com.example.frontdesk.config.FrontdeskProperties;
import com.example.frontdesk.domain.KnowledgeEntry;
import com.example.frontdesk.domain.enums.KnowledgeSource;
import com.example.frontdesk.error.UpstreamUnavailableException;
import com.example.frontdesk.error.ValidationException;
import com.example.frontdesk.store.FrontdeskStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process mirror of the learned knowledge, answering "have we been asked this before?".
 *
 * <p>The snapshot is an immutable list behind an {@link AtomicReference}. {@link #refresh()} swaps
 * in a freshly loaded list; {@link #learn} publishes a copy with one more element. Readers always
 * iterate one complete list, and no lock is ever held across store I/O.</p>
 *
 * <p>Usage counts live in the store. Cached entries keep the count they were loaded with until the
 * next refresh, so {@link #promptContext(int)} ranks by the counts as of the last load.</p>
 */
@Slf4j
@Component
public class KnowledgeIndex {

    static final String EMPTY_CONTEXT = "No learned knowledge yet.";

    private final FrontdeskStore store;
    private final Clock clock;
    private final double threshold;
    private final int defaultPromptLimit;

    private final AtomicReference<List<Indexed>> snapshot = new AtomicReference<>(List.of());

    public KnowledgeIndex(FrontdeskStore store, FrontdeskProperties props, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.threshold = props.getKnowledge().getSimilarityThreshold();
        this.defaultPromptLimit = props.getKnowledge().getPromptLimit();
    }

    /** cached entry + its pre-tokenized question */
    private record Indexed(KnowledgeEntry entry, Set<String> tokens) {
        static Indexed of(KnowledgeEntry e) {
            return new Indexed(e, TokenSimilarity.tokens(e.getQuestion()));
        }
    }

    @PostConstruct
    void initialLoad() {
        try {
            refresh();
        } catch (UpstreamUnavailableException e) {
            log.warn("[KNOWLEDGE] initial load failed, starting with an empty snapshot: {}", e.getMessage());
        }
    }

    /**
     * Reloads every entry from the store and replaces the snapshot in one step. Entries a concurrent
     * {@link #learn} appended that the load did not see are carried over.
     *
     * @throws UpstreamUnavailableException when the store cannot be read; the previous snapshot stays active
     */
    public int refresh() {
        List<KnowledgeEntry> loaded = store.listAllKnowledge();
        List<Indexed> fresh = new ArrayList<>(loaded.size());
        Set<Long> loadedIds = new HashSet<>();
        for (KnowledgeEntry e : loaded) {
            if (e == null) continue;
            fresh.add(Indexed.of(e));
            loadedIds.add(e.getId());
        }
        // entries learned while the load was in flight are not in it yet; keep them
        List<Indexed> published = snapshot.updateAndGet(current -> {
            List<Indexed> next = new ArrayList<>(fresh);
            for (Indexed i : current) {
                if (!loadedIds.contains(i.entry().getId())) next.add(i);
            }
            return List.copyOf(next);
        });
        log.info("[KNOWLEDGE] snapshot refreshed size={}", published.size());
        return published.size();
    }

    /**
     * First snapshot entry whose question is similar enough, else the most used text match from the
     * store. A returned entry has had its usage count bumped once in the store.
     *
     * @throws UpstreamUnavailableException when the store text search fails ("lookup failed");
     *                                      callers treat it as no match
     */
    public Optional<KnowledgeEntry> search(String question) {
        if (question == null || question.isBlank()) {
            return Optional.empty();
        }
        Set<String> queryTokens = TokenSimilarity.tokens(question);
        for (Indexed candidate : snapshot.get()) {
            if (TokenSimilarity.jaccard(queryTokens, candidate.tokens()) >= threshold) {
                return Optional.of(recordHit(candidate.entry(), "snapshot"));
            }
        }

        List<KnowledgeEntry> textHits = store.textSearchKnowledge(question);
        if (textHits == null || textHits.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(recordHit(textHits.get(0), "text"));
    }

    /**
     * Stores a supervisor answer as a new entry and makes it visible to {@link #search} immediately.
     * Never merges with an existing entry, however similar.
     */
    public Long learn(String question, String answer, Long helpRequestId) {
        return add(question, answer, KnowledgeSource.SUPERVISOR, helpRequestId);
    }

    /** Bulk-loading counterpart of {@link #learn}, tagged {@link KnowledgeSource#SEED}. */
    public Long seed(String question, String answer) {
        return add(question, answer, KnowledgeSource.SEED, null);
    }

    /**
     * Top {@code limit} entries by usage count rendered for a generation prompt.
     */
    public String promptContext(int limit) {
        List<KnowledgeEntry> top = snapshot.get().stream()
                .map(Indexed::entry)
                .sorted(Comparator.comparingLong(KnowledgeEntry::getUsageCount).reversed())
                .limit(Math.max(0, limit))
                .toList();
        if (top.isEmpty()) {
            return EMPTY_CONTEXT;
        }
        StringBuilder sb = new StringBuilder("Learned Knowledge:\n");
        for (KnowledgeEntry e : top) {
            sb.append("Q: ").append(e.getQuestion()).append('\n');
            sb.append("A: ").append(e.getAnswer()).append('\n');
            sb.append('\n');
        }
        return sb.toString();
    }

    public String promptContext() {
        return promptContext(defaultPromptLimit);
    }

    /**
     * Read-only text lookup for the dashboard: every store entry whose question or answer contains
     * {@code text}, most used first. Unlike {@link #search} it does not count as usage.
     */
    public List<KnowledgeEntry> matching(String text) {
        if (text == null || text.isBlank()) return List.of();
        return store.textSearchKnowledge(text.strip());
    }

    /** Current snapshot, insertion order. */
    public List<KnowledgeEntry> entries() {
        return snapshot.get().stream().map(Indexed::entry).toList();
    }

    public int size() {
        return snapshot.get().size();
    }

    private Long add(String question, String answer, KnowledgeSource source, Long helpRequestId) {
        String q = ValidationException.requireText("question", question);
        String a = ValidationException.requireText("answer", answer);
        LocalDateTime now = LocalDateTime.now(clock);
        KnowledgeEntry entry = KnowledgeEntry.builder()
                .question(q)
                .answer(a)
                .source(source)
                .helpRequestId(helpRequestId)
                .createdAt(now)
                .updatedAt(now)
                .usageCount(0L)
                .build();

        Long id = store.createKnowledgeEntry(entry);
        Indexed indexed = Indexed.of(entry);
        snapshot.updateAndGet(current -> {
            // a refresh that ran after the insert may already have published it
            for (Indexed i : current) {
                if (id.equals(i.entry().getId())) return current;
            }
            List<Indexed> next = new ArrayList<>(current.size() + 1);
            next.addAll(current);
            next.add(indexed);
            return List.copyOf(next);
        });
        log.info("[KNOWLEDGE] learned id={} source={} helpRequest={} question=\"{}\"", id, source, helpRequestId, q);
        return id;
    }

    private KnowledgeEntry recordHit(KnowledgeEntry entry, String via) {
        try {
            store.incrementKnowledgeUsage(entry.getId());
        } catch (UpstreamUnavailableException e) {
            // the answer is still good; only the counter is lost
            log.warn("[KNOWLEDGE] usage increment failed id={}: {}", entry.getId(), e.getMessage());
        }
        log.debug("[KNOWLEDGE] hit id={} via={}", entry.getId(), via);
        return entry;
    }
}
