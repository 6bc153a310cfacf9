package com.example.frontdesk.session;

import com.example.frontdesk.domain.Turn;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Transient per-call state: who is calling, what was said, which help requests were raised.
 *
 * <p>Turns are only appended by the call's session thread, in receipt order; other threads
 * (dashboard, teardown) may read concurrently.</p>
 */
public class ConversationContext {

    private final Long callId;
    private final String callerId;
    private final String callerContact;
    private final LocalDateTime startedAt;
    private final List<Turn> turns = new CopyOnWriteArrayList<>();
    private final List<Long> helpRequestIds = new CopyOnWriteArrayList<>();

    public ConversationContext(Long callId, String callerId, String callerContact, LocalDateTime startedAt) {
        this.callId = callId;
        this.callerId = callerId;
        this.callerContact = callerContact;
        this.startedAt = startedAt;
    }

    public Long getCallId() {
        return callId;
    }

    public String getCallerId() {
        return callerId;
    }

    public String getCallerContact() {
        return callerContact;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public void append(Turn turn) {
        turns.add(turn);
    }

    public List<Turn> turns() {
        return List.copyOf(turns);
    }

    /** The last {@code n} turns, oldest first. */
    public List<Turn> lastTurns(int n) {
        List<Turn> all = List.copyOf(turns);
        if (n <= 0) return List.of();
        return all.size() <= n ? all : all.subList(all.size() - n, all.size());
    }

    public void linkHelpRequest(Long helpRequestId) {
        helpRequestIds.add(helpRequestId);
    }

    public List<Long> helpRequestIds() {
        return List.copyOf(helpRequestIds);
    }

    public String transcript() {
        return Turn.render(turns);
    }
}
