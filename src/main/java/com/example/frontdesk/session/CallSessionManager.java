package com.example.frontdesk.session;

import com.example.frontdesk.config.FrontdeskProperties;
import com.example.frontdesk.domain.CallLog;
import com.example.frontdesk.error.NotFoundException;
import com.example.frontdesk.error.UpstreamUnavailableException;
import com.example.frontdesk.error.ValidationException;
import com.example.frontdesk.helprequest.HelpRequestLifecycle;
import com.example.frontdesk.knowledge.KnowledgeIndex;
import com.example.frontdesk.oracle.EscalationOracle;
import com.example.frontdesk.prompt.FrontdeskPromptBuilder;
import com.example.frontdesk.store.FrontdeskStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 통화 세션 관리: 통화 시작 시 CallLog 저장 + 세션 스레드 기동, 이벤트 전달, 종료 시 CallLog 마감.
 */
@Slf4j
@Service
public class CallSessionManager {

    private final KnowledgeIndex knowledgeIndex;
    private final EscalationOracle oracle;
    private final HelpRequestLifecycle lifecycle;
    private final FrontdeskPromptBuilder prompts;
    private final FrontdeskStore store;
    private final Clock clock;
    private final Executor callExecutor;
    private final ConversationSession.SessionSettings settings;
    private final Duration replyTimeout;

    private final Map<Long, ActiveCall> active = new ConcurrentHashMap<>();

    private record ActiveCall(ConversationSession session, BlockingQueue<ConversationEvent> events) {
    }

    public CallSessionManager(KnowledgeIndex knowledgeIndex,
                              EscalationOracle oracle,
                              HelpRequestLifecycle lifecycle,
                              FrontdeskPromptBuilder prompts,
                              FrontdeskStore store,
                              Clock clock,
                              @Qualifier("callExecutor") Executor callExecutor,
                              FrontdeskProperties props) {
        this.knowledgeIndex = knowledgeIndex;
        this.oracle = oracle;
        this.lifecycle = lifecycle;
        this.prompts = prompts;
        this.store = store;
        this.clock = clock;
        this.callExecutor = callExecutor;
        this.settings = new ConversationSession.SessionSettings(
                props.getHelpRequest().getContextTurns(),
                props.getCall().getHistoryTurns(),
                props.getCall().getMaxDuration());
        this.replyTimeout = props.getCall().getReplyTimeout();
    }

    /**
     * Persists a call log and starts the call's session loop on the call pool.
     *
     * @return the new call's context (its id is the call log id)
     */
    public ConversationContext startCall(String callerId, String callerContact) {
        String id = ValidationException.requireText("callerId", callerId);
        String contact = ValidationException.requireText("callerContact", callerContact);
        LocalDateTime now = LocalDateTime.now(clock);

        Long callId = store.createCallLog(CallLog.builder()
                .callerId(id)
                .callerContact(contact)
                .startedAt(now)
                .build());

        ConversationContext context = new ConversationContext(callId, id, contact, now);
        ConversationSession session = new ConversationSession(
                context, knowledgeIndex, oracle, lifecycle, prompts, store, clock, settings);
        BlockingQueue<ConversationEvent> events = new LinkedBlockingQueue<>();
        active.put(callId, new ActiveCall(session, events));

        try {
            callExecutor.execute(() -> runAndFinish(session, events));
        } catch (RejectedExecutionException e) {
            active.remove(callId);
            finish(context);
            throw new UpstreamUnavailableException("call-pool", "no capacity for another call");
        }
        log.info("[CALL] started id={} caller={}", callId, contact);
        return context;
    }

    /** Queues an event for the call, in order. */
    public void offer(Long callId, ConversationEvent event) {
        ActiveCall call = active.get(callId);
        if (call == null) {
            throw new NotFoundException("call", callId);
        }
        call.events().add(event);
        // the session may have finished (and drained its queue) between the lookup and the add
        if (active.get(callId) != call && call.events().remove(event)) {
            throw new NotFoundException("call", callId);
        }
    }

    /**
     * Queues a caller utterance and waits for the session's answer to it.
     */
    public TurnOutcome submitUtterance(Long callId, String text) {
        ValidationException.requireText("text", text);
        CompletableFuture<TurnOutcome> reply = new CompletableFuture<>();
        offer(callId, ConversationEvent.utterance(text, reply));
        try {
            return reply.get(replyTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new UpstreamUnavailableException("session", "no reply within " + replyTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("session", "interrupted while waiting for a reply");
        } catch (ExecutionException e) {
            throw new UpstreamUnavailableException("session", "reply failed", e.getCause());
        }
    }

    public void endCall(Long callId) {
        offer(callId, ConversationEvent.endOfCall());
    }

    public List<CallLog> recentCalls(int limit) {
        return store.listRecentCalls(Math.max(1, limit));
    }

    /** Ids of calls whose session loop is still running. */
    public List<Long> activeCallIds() {
        return List.copyOf(active.keySet());
    }

    @PreDestroy
    void shutdown() {
        for (ActiveCall call : active.values()) {
            call.events().add(ConversationEvent.endOfCall());
        }
    }

    private void runAndFinish(ConversationSession session, BlockingQueue<ConversationEvent> events) {
        ConversationContext context = session.context();
        try {
            session.run(events);
        } finally {
            active.remove(context.getCallId());
            finish(context);
            // anyone still waiting on an utterance gets an apology instead of a timeout
            ConversationEvent leftover;
            while ((leftover = events.poll()) != null) {
                if (leftover.replyTo() != null) {
                    leftover.replyTo().complete(TurnOutcome.failed(prompts.apology()));
                }
            }
        }
    }

    private void finish(ConversationContext context) {
        try {
            store.finishCallLog(context.getCallId(), LocalDateTime.now(clock), context.transcript());
            log.info("[CALL] ended id={} turns={} helpRequests={}",
                    context.getCallId(), context.turns().size(), context.helpRequestIds());
        } catch (RuntimeException e) {
            log.warn("[CALL] could not close call log id={}: {}", context.getCallId(), e.getMessage());
        }
    }
}
