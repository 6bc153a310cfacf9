package com.example.frontdesk.store;

import com.example.frontdesk.domain.CallLog;
import com.example.frontdesk.domain.HelpRequest;
import com.example.frontdesk.domain.KnowledgeEntry;
import com.example.frontdesk.domain.enums.RequestStatus;
import com.example.frontdesk.error.UpstreamUnavailableException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed store for unit tests. Each capability can be switched "down" to simulate an
 * unreachable database.
 */
public class InMemoryFrontdeskStore implements FrontdeskStore {

    private final AtomicLong seq = new AtomicLong();
    private final Map<Long, HelpRequest> requests = new ConcurrentHashMap<>();
    private final Map<Long, KnowledgeEntry> knowledge = new ConcurrentHashMap<>();
    private final Map<Long, CallLog> calls = new ConcurrentHashMap<>();

    public volatile boolean helpRequestsDown;
    public volatile boolean knowledgeReadDown;
    public volatile boolean knowledgeWriteDown;
    public volatile boolean usageDown;

    @Override
    public Long createHelpRequest(HelpRequest request) {
        check(helpRequestsDown);
        long id = seq.incrementAndGet();
        request.setId(id);
        requests.put(id, request);
        return id;
    }

    @Override
    public Optional<HelpRequest> getHelpRequest(Long id) {
        check(helpRequestsDown);
        return Optional.ofNullable(id == null ? null : requests.get(id));
    }

    @Override
    public List<HelpRequest> listPending() {
        check(helpRequestsDown);
        return requests.values().stream()
                .filter(HelpRequest::isPending)
                .sorted(newestFirst())
                .toList();
    }

    @Override
    public List<HelpRequest> listRecent(int limit) {
        check(helpRequestsDown);
        return requests.values().stream().sorted(newestFirst()).limit(limit).toList();
    }

    @Override
    public synchronized boolean updateHelpRequestResolved(Long id, String answer, String resolver, LocalDateTime resolvedAt) {
        check(helpRequestsDown);
        HelpRequest r = requests.get(id);
        if (r == null || !r.isPending()) return false;
        r.setStatus(RequestStatus.RESOLVED);
        r.setSupervisorAnswer(answer);
        r.setSupervisorName(resolver);
        r.setResolvedAt(resolvedAt);
        return true;
    }

    @Override
    public synchronized boolean updateHelpRequestTimeout(Long id, LocalDateTime resolvedAt) {
        check(helpRequestsDown);
        HelpRequest r = requests.get(id);
        if (r == null || !r.isPending()) return false;
        r.setStatus(RequestStatus.TIMEOUT);
        r.setResolvedAt(resolvedAt);
        return true;
    }

    @Override
    public Long createKnowledgeEntry(KnowledgeEntry entry) {
        check(knowledgeWriteDown);
        long id = seq.incrementAndGet();
        entry.setId(id);
        knowledge.put(id, copy(entry));
        return id;
    }

    @Override
    public List<KnowledgeEntry> listAllKnowledge() {
        check(knowledgeReadDown);
        return knowledge.values().stream()
                .sorted(Comparator.comparing(KnowledgeEntry::getId))
                .map(InMemoryFrontdeskStore::copy)
                .toList();
    }

    @Override
    public void incrementKnowledgeUsage(Long id) {
        check(usageDown);
        KnowledgeEntry e = knowledge.get(id);
        if (e != null) {
            e.setUsageCount(e.getUsageCount() + 1);
        }
    }

    @Override
    public List<KnowledgeEntry> textSearchKnowledge(String query) {
        check(knowledgeReadDown);
        String q = query.toLowerCase(Locale.ROOT);
        return knowledge.values().stream()
                .filter(e -> e.getQuestion().toLowerCase(Locale.ROOT).contains(q)
                        || e.getAnswer().toLowerCase(Locale.ROOT).contains(q))
                .sorted(Comparator.comparingLong(KnowledgeEntry::getUsageCount).reversed()
                        .thenComparing(KnowledgeEntry::getId))
                .map(InMemoryFrontdeskStore::copy)
                .toList();
    }

    @Override
    public long countKnowledge() {
        check(knowledgeReadDown);
        return knowledge.size();
    }

    @Override
    public Long createCallLog(CallLog callLog) {
        long id = seq.incrementAndGet();
        callLog.setId(id);
        calls.put(id, callLog);
        return id;
    }

    @Override
    public void appendCallHelpRequest(Long callId, Long helpRequestId) {
        CallLog c = calls.get(callId);
        if (c == null) return;
        c.getHelpRequestIds().add(helpRequestId);
        c.setResolvedByAi(false);
    }

    @Override
    public void finishCallLog(Long callId, LocalDateTime endedAt, String transcript) {
        CallLog c = calls.get(callId);
        if (c == null) return;
        c.setEndedAt(endedAt);
        c.setTranscript(transcript);
    }

    @Override
    public List<CallLog> listRecentCalls(int limit) {
        return calls.values().stream()
                .sorted(Comparator.comparing(CallLog::getStartedAt).reversed())
                .limit(limit)
                .toList();
    }

    /* ── test helpers ── */

    public long usageOf(Long knowledgeId) {
        return knowledge.get(knowledgeId).getUsageCount();
    }

    public CallLog call(Long callId) {
        return calls.get(callId);
    }

    private static Comparator<HelpRequest> newestFirst() {
        return Comparator.comparing(HelpRequest::getCreatedAt).reversed()
                .thenComparing(HelpRequest::getId, Comparator.reverseOrder());
    }

    private static KnowledgeEntry copy(KnowledgeEntry e) {
        return KnowledgeEntry.builder()
                .id(e.getId())
                .question(e.getQuestion())
                .answer(e.getAnswer())
                .source(e.getSource())
                .helpRequestId(e.getHelpRequestId())
                .createdAt(e.getCreatedAt())
                .updatedAt(e.getUpdatedAt())
                .usageCount(e.getUsageCount())
                .build();
    }

    private static void check(boolean down) {
        if (down) throw new UpstreamUnavailableException("store", "simulated outage");
    }
}
