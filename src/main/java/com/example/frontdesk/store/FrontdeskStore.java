package com.example.frontdesk.store;

import com.example.frontdesk.domain.CallLog;
import com.example.frontdesk.domain.HelpRequest;
import com.example.frontdesk.domain.KnowledgeEntry;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable persistence contract for help requests, knowledge entries and call logs.
 *
 * <p>Implementations report unreachable storage as
 * {@link com.example.frontdesk.error.UpstreamUnavailableException}. The two status updates are
 * conditional: they succeed only while the request is still PENDING, which is what keeps
 * resolution single-shot across processes.</p>
 */
public interface FrontdeskStore {

    /* ────────── help requests ────────── */

    /** Persists the request and returns the assigned id (also set on {@code request}). */
    Long createHelpRequest(HelpRequest request);

    Optional<HelpRequest> getHelpRequest(Long id);

    /** PENDING requests, newest first. */
    List<HelpRequest> listPending();

    /** Most recent requests of any status, newest first. */
    List<HelpRequest> listRecent(int limit);

    /** PENDING → RESOLVED. False if the request is missing or no longer PENDING. */
    boolean updateHelpRequestResolved(Long id, String answer, String resolver, LocalDateTime resolvedAt);

    /** PENDING → TIMEOUT. False if the request is missing or no longer PENDING. */
    boolean updateHelpRequestTimeout(Long id, LocalDateTime resolvedAt);

    /* ────────── knowledge ────────── */

    /** Persists the entry and returns the assigned id (also set on {@code entry}). */
    Long createKnowledgeEntry(KnowledgeEntry entry);

    /** All entries in insertion order. */
    List<KnowledgeEntry> listAllKnowledge();

    void incrementKnowledgeUsage(Long id);

    /** Case-insensitive substring match over question/answer, usage count descending. */
    List<KnowledgeEntry> textSearchKnowledge(String query);

    long countKnowledge();

    /* ────────── call logs ────────── */

    Long createCallLog(CallLog callLog);

    /** Records an escalation against the call and clears its resolved-by-AI flag. */
    void appendCallHelpRequest(Long callId, Long helpRequestId);

    void finishCallLog(Long callId, LocalDateTime endedAt, String transcript);

    List<CallLog> listRecentCalls(int limit);
}
