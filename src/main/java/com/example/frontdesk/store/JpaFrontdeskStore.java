package com.example.frontdesk.store;

import com.example.frontdesk.domain.CallLog;
import com.example.frontdesk.domain.HelpRequest;
import com.example.frontdesk.domain.KnowledgeEntry;
import com.example.frontdesk.domain.enums.RequestStatus;
import com.example.frontdesk.error.NotFoundException;
import com.example.frontdesk.error.UpstreamUnavailableException;
import com.example.frontdesk.repository.CallLogRepository;
import com.example.frontdesk.repository.HelpRequestRepository;
import com.example.frontdesk.repository.KnowledgeEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link FrontdeskStore} over Spring Data JPA. Every {@link DataAccessException} is translated to
 * {@link UpstreamUnavailableException} so callers deal with one failure type.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaFrontdeskStore implements FrontdeskStore {

    private static final String UPSTREAM = "store";

    private final HelpRequestRepository helpRequests;
    private final KnowledgeEntryRepository knowledge;
    private final CallLogRepository callLogs;
    private final Clock clock;

    @Override
    public Long createHelpRequest(HelpRequest request) {
        return call("createHelpRequest", () -> {
            HelpRequest saved = helpRequests.save(request);
            request.setId(saved.getId());
            return saved.getId();
        });
    }

    @Override
    public Optional<HelpRequest> getHelpRequest(Long id) {
        if (id == null) return Optional.empty();
        return call("getHelpRequest", () -> helpRequests.findById(id));
    }

    @Override
    public List<HelpRequest> listPending() {
        return call("listPending", () -> helpRequests.findByStatusOrderByCreatedAtDesc(RequestStatus.PENDING));
    }

    @Override
    public List<HelpRequest> listRecent(int limit) {
        return call("listRecent",
                () -> helpRequests.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, Math.max(1, limit))));
    }

    @Override
    public boolean updateHelpRequestResolved(Long id, String answer, String resolver, LocalDateTime resolvedAt) {
        return call("updateHelpRequestResolved",
                () -> helpRequests.markResolved(id, answer, resolver, resolvedAt) == 1);
    }

    @Override
    public boolean updateHelpRequestTimeout(Long id, LocalDateTime resolvedAt) {
        return call("updateHelpRequestTimeout", () -> helpRequests.markTimeout(id, resolvedAt) == 1);
    }

    @Override
    public Long createKnowledgeEntry(KnowledgeEntry entry) {
        return call("createKnowledgeEntry", () -> {
            KnowledgeEntry saved = knowledge.save(entry);
            entry.setId(saved.getId());
            return saved.getId();
        });
    }

    @Override
    public List<KnowledgeEntry> listAllKnowledge() {
        return call("listAllKnowledge", knowledge::findAllByOrderByIdAsc);
    }

    @Override
    public void incrementKnowledgeUsage(Long id) {
        int rows = call("incrementKnowledgeUsage", () -> knowledge.incrementUsage(id, LocalDateTime.now(clock)));
        if (rows == 0) {
            log.warn("[STORE] usage increment hit no row id={}", id);
        }
    }

    @Override
    public List<KnowledgeEntry> textSearchKnowledge(String query) {
        if (query == null || query.isBlank()) return List.of();
        String pattern = escapeLike(query.toLowerCase(Locale.ROOT));
        return call("textSearchKnowledge", () -> knowledge.searchByText(pattern));
    }

    @Override
    public long countKnowledge() {
        return call("countKnowledge", knowledge::count);
    }

    @Override
    public Long createCallLog(CallLog callLog) {
        return call("createCallLog", () -> {
            CallLog saved = callLogs.save(callLog);
            callLog.setId(saved.getId());
            return saved.getId();
        });
    }

    @Override
    @Transactional
    public void appendCallHelpRequest(Long callId, Long helpRequestId) {
        call("appendCallHelpRequest", () -> {
            CallLog entity = callLogs.findById(callId).orElseThrow(() -> new NotFoundException("call", callId));
            entity.getHelpRequestIds().add(helpRequestId);
            entity.setResolvedByAi(false);
            return callLogs.save(entity);
        });
    }

    @Override
    @Transactional
    public void finishCallLog(Long callId, LocalDateTime endedAt, String transcript) {
        call("finishCallLog", () -> {
            CallLog entity = callLogs.findById(callId).orElseThrow(() -> new NotFoundException("call", callId));
            entity.setEndedAt(endedAt);
            entity.setTranscript(transcript);
            return callLogs.save(entity);
        });
    }

    @Override
    public List<CallLog> listRecentCalls(int limit) {
        return call("listRecentCalls",
                () -> callLogs.findAllByOrderByStartedAtDescIdDesc(PageRequest.of(0, Math.max(1, limit))));
    }

    static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static <T> T call(String op, Supplier<T> body) {
        try {
            return body.get();
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException(UPSTREAM, op + " failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
