package com.example.frontdesk.session;

import com.example.frontdesk.domain.KnowledgeEntry;
import com.example.frontdesk.domain.Turn;
import com.example.frontdesk.error.UpstreamUnavailableException;
import com.example.frontdesk.error.ValidationException;
import com.example.frontdesk.helprequest.HelpRequestLifecycle;
import com.example.frontdesk.knowledge.KnowledgeIndex;
import com.example.frontdesk.oracle.EscalationOracle;
import com.example.frontdesk.oracle.Verdict;
import com.example.frontdesk.prompt.FrontdeskPromptBuilder;
import com.example.frontdesk.store.FrontdeskStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Per-call orchestration: knowledge lookup first, then the oracle, then escalation.
 *
 * <p>{@link #run} is the call's single consumer loop. Events are handled one at a time in queue
 * order, so the context handed to an escalation holds exactly the turns received up to and
 * including the escalating utterance.</p>
 *
 * <p>Ending the call (or hitting the wall-clock cap) never touches help requests raised during it;
 * they stay PENDING until a supervisor answers or the timeout sweep runs.</p>
 */
@Slf4j
public class ConversationSession {

    public static final String MDC_CALL_ID = "callId";

    private final ConversationContext context;
    private final KnowledgeIndex knowledgeIndex;
    private final EscalationOracle oracle;
    private final HelpRequestLifecycle lifecycle;
    private final FrontdeskPromptBuilder prompts;
    private final FrontdeskStore store;
    private final Clock clock;
    private final SessionSettings settings;

    /** Tunables copied out of {@code FrontdeskProperties} when the session is created. */
    public record SessionSettings(int contextTurns, int historyTurns, Duration maxDuration) {
    }

    public ConversationSession(ConversationContext context,
                               KnowledgeIndex knowledgeIndex,
                               EscalationOracle oracle,
                               HelpRequestLifecycle lifecycle,
                               FrontdeskPromptBuilder prompts,
                               FrontdeskStore store,
                               Clock clock,
                               SessionSettings settings) {
        this.context = context;
        this.knowledgeIndex = knowledgeIndex;
        this.oracle = oracle;
        this.lifecycle = lifecycle;
        this.prompts = prompts;
        this.store = store;
        this.clock = clock;
        this.settings = settings;
    }

    public ConversationContext context() {
        return context;
    }

    /**
     * Blocking receive loop. Returns on END_OF_CALL, when the wall-clock cap elapses, or when the
     * thread is interrupted (interrupt status is restored).
     */
    public void run(BlockingQueue<ConversationEvent> events) {
        String previousCallId = MDC.get(MDC_CALL_ID);
        MDC.put(MDC_CALL_ID, String.valueOf(context.getCallId()));
        Instant deadline = clock.instant().plus(settings.maxDuration());
        try {
            while (true) {
                long remainingMs = Duration.between(clock.instant(), deadline).toMillis();
                if (remainingMs <= 0) {
                    log.info("[SESSION] wall-clock cap reached ({}), tearing down", settings.maxDuration());
                    return;
                }
                ConversationEvent event = events.poll(remainingMs, TimeUnit.MILLISECONDS);
                if (event == null) {
                    continue;
                }
                switch (event.type()) {
                    case END_OF_CALL -> {
                        log.info("[SESSION] end of call");
                        return;
                    }
                    case AGENT_REPLY -> context.append(Turn.assistant(event.text()));
                    case CALLER_UTTERANCE -> {
                        TurnOutcome outcome = handleSafely(event.text());
                        if (event.replyTo() != null) {
                            event.replyTo().complete(outcome);
                        }
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[SESSION] interrupted, tearing down");
        } finally {
            if (previousCallId == null) {
                MDC.remove(MDC_CALL_ID);
            } else {
                MDC.put(MDC_CALL_ID, previousCallId);
            }
        }
    }

    /**
     * Handles one caller utterance and appends both the utterance and the agent's reply to the context.
     */
    public TurnOutcome handleUtterance(String text) {
        String question = text == null ? "" : text.strip();
        context.append(Turn.user(question));
        log.info("[SESSION] caller: {}", question);

        TurnOutcome outcome = decide(question);
        context.append(Turn.assistant(outcome.reply()));
        log.info("[SESSION] agent ({}): {}", outcome.kind(), outcome.reply());
        return outcome;
    }

    private TurnOutcome handleSafely(String text) {
        try {
            return handleUtterance(text);
        } catch (RuntimeException e) {
            log.error("[SESSION] utterance handling failed", e);
            return TurnOutcome.failed(prompts.apology());
        }
    }

    private TurnOutcome decide(String question) {
        if (question.isEmpty()) {
            return TurnOutcome.failed(prompts.apology());
        }
        Optional<KnowledgeEntry> hit = lookup(question);
        if (hit.isPresent()) {
            KnowledgeEntry entry = hit.get();
            log.info("[SESSION] knowledge hit id={} question=\"{}\"", entry.getId(), entry.getQuestion());
            return TurnOutcome.knowledgeHit(entry.getAnswer(), entry.getId());
        }

        String systemContext = prompts.systemPrompt(knowledgeIndex.promptContext());
        Verdict verdict;
        try {
            verdict = oracle.classify(systemContext, question);
        } catch (UpstreamUnavailableException e) {
            // fail safe to a human
            log.warn("[SESSION] oracle unavailable, escalating: {}", e.getMessage());
            verdict = Verdict.ESCALATE;
        }

        if (verdict == Verdict.ESCALATE) {
            return escalate(question);
        }
        return answer(systemContext);
    }

    private Optional<KnowledgeEntry> lookup(String question) {
        try {
            return knowledgeIndex.search(question);
        } catch (UpstreamUnavailableException e) {
            log.warn("[SESSION] knowledge lookup failed, treating as miss: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private TurnOutcome escalate(String question) {
        String window = Turn.render(context.lastTurns(settings.contextTurns()));
        Long requestId;
        try {
            requestId = lifecycle.create(context.getCallerId(), context.getCallerContact(), question, window);
        } catch (UpstreamUnavailableException | ValidationException e) {
            log.error("[SESSION] escalation could not be recorded: {}", e.getMessage());
            return TurnOutcome.failed(prompts.apology());
        }
        context.linkHelpRequest(requestId);
        try {
            store.appendCallHelpRequest(context.getCallId(), requestId);
        } catch (RuntimeException e) {
            log.warn("[SESSION] call log not updated with help request {}: {}", requestId, e.getMessage());
        }
        return TurnOutcome.escalated(prompts.escalationPromise(), requestId);
    }

    private TurnOutcome answer(String systemContext) {
        try {
            return TurnOutcome.answered(oracle.generate(systemContext, context.lastTurns(settings.historyTurns())));
        } catch (UpstreamUnavailableException e) {
            log.warn("[SESSION] generation failed: {}", e.getMessage());
            return TurnOutcome.failed(prompts.apology());
        }
    }
}
