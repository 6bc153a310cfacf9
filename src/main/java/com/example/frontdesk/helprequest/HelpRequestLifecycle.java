package com.example.frontdesk.helprequest;

import com.example.frontdesk.config.FrontdeskProperties;
import com.example.frontdesk.domain.HelpRequest;
import com.example.frontdesk.domain.enums.RequestStatus;
import com.example.frontdesk.error.ValidationException;
import com.example.frontdesk.knowledge.KnowledgeIndex;
import com.example.frontdesk.notification.NotificationDispatcher;
import com.example.frontdesk.prompt.FrontdeskPromptBuilder;
import com.example.frontdesk.store.FrontdeskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Help request 상태 머신 (PENDING → RESOLVED | TIMEOUT) 과 전이에 딸린 부수효과를 담당합니다.
 *
 * <pre>
 * PENDING --resolve(answer)-----------> RESOLVED  (terminal)
 * PENDING --timeout(age > threshold)--> TIMEOUT   (terminal)
 * </pre>
 *
 * <p>전이는 항상 저장소의 조건부 UPDATE 가 먼저 성공해야 하고, 알림은 그 다음에만 나갑니다.
 * 따라서 알림을 받은 쪽은 언제나 저장소에서 해당 레코드를 찾을 수 있습니다.</p>
 */
@Slf4j
@Service
public class HelpRequestLifecycle {

    private final FrontdeskStore store;
    private final KnowledgeIndex knowledgeIndex;
    private final NotificationDispatcher notifications;
    private final FrontdeskPromptBuilder prompts;
    private final Clock clock;
    private final int statsWindow;
    private final String defaultResolver;

    public HelpRequestLifecycle(FrontdeskStore store,
                                KnowledgeIndex knowledgeIndex,
                                NotificationDispatcher notifications,
                                FrontdeskPromptBuilder prompts,
                                FrontdeskProperties props,
                                Clock clock) {
        this.store = store;
        this.knowledgeIndex = knowledgeIndex;
        this.notifications = notifications;
        this.prompts = prompts;
        this.clock = clock;
        this.statsWindow = Math.max(1, props.getHelpRequest().getStatsWindow());
        this.defaultResolver = props.getHelpRequest().getDefaultResolverName();
    }

    /**
     * Persists a new PENDING request, then alerts the supervisor.
     *
     * @return the new request id
     * @throws ValidationException when caller id, contact or question is blank
     * @throws com.example.frontdesk.error.UpstreamUnavailableException when the store write fails (no alert is sent)
     */
    public Long create(String callerId, String callerContact, String question, String context) {
        HelpRequest request = HelpRequest.builder()
                .callerId(ValidationException.requireText("callerId", callerId))
                .callerContact(ValidationException.requireText("callerContact", callerContact))
                .question(ValidationException.requireText("question", question))
                .context(context == null || context.isBlank() ? null : context)
                .status(RequestStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build();

        Long id = store.createHelpRequest(request);
        log.info("[HELP_REQUEST] created id={} caller={} question=\"{}\"", id, request.getCallerContact(), request.getQuestion());

        notifications.supervisorAlert(
                prompts.supervisorAlert(request.getQuestion(), request.getCallerContact(), id), id);
        return id;
    }

    /**
     * Boolean form of {@link #resolveDetailed}; a blank answer is reported as {@code false}.
     */
    public boolean resolve(Long requestId, String answer, String resolverName) {
        try {
            return resolveDetailed(requestId, answer, resolverName).succeeded();
        } catch (ValidationException e) {
            log.info("[HELP_REQUEST] resolve rejected id={}: {}", requestId, e.getMessage());
            return false;
        }
    }

    public boolean resolve(Long requestId, String answer) {
        return resolve(requestId, answer, null);
    }

    /**
     * PENDING → RESOLVED, then learn the answer and send the caller a follow-up.
     *
     * <p>Only the first successful call for a request learns and notifies; every later call returns
     * {@link ResolutionResult#INVALID_TRANSITION} without side effects.</p>
     *
     * @throws ValidationException when the answer is blank
     */
    public ResolutionResult resolveDetailed(Long requestId, String answer, String resolverName) {
        String text = ValidationException.requireText("answer", answer);
        String resolver = resolverName == null || resolverName.isBlank() ? defaultResolver : resolverName.trim();

        Optional<HelpRequest> found = store.getHelpRequest(requestId);
        if (found.isEmpty()) {
            log.info("[HELP_REQUEST] resolve: id={} not found", requestId);
            return ResolutionResult.NOT_FOUND;
        }
        HelpRequest request = found.get();
        if (!request.isPending()) {
            log.info("[HELP_REQUEST] resolve: id={} already {}", requestId, request.getStatus());
            return ResolutionResult.INVALID_TRANSITION;
        }

        // another resolver (or the timeout sweep) may have won between the read and this update
        if (!store.updateHelpRequestResolved(requestId, text, resolver, LocalDateTime.now(clock))) {
            log.info("[HELP_REQUEST] resolve: id={} lost the race, no longer PENDING", requestId);
            return ResolutionResult.INVALID_TRANSITION;
        }

        try {
            knowledgeIndex.learn(request.getQuestion(), text, requestId);
        } catch (RuntimeException e) {
            log.error("[HELP_REQUEST] id={} resolved but learning failed: {}", requestId, e.toString());
        }

        notifications.callerFollowUp(request.getCallerContact(), prompts.callerFollowUp(request.getQuestion(), text));

        log.info("[HELP_REQUEST] resolved id={} by={} question=\"{}\"", requestId, resolver, request.getQuestion());
        return ResolutionResult.RESOLVED;
    }

    /**
     * Moves every PENDING request older than {@code maxAgeHours} to TIMEOUT. No notifications.
     *
     * @return number of requests transitioned by this sweep
     */
    public int timeoutStale(long maxAgeHours) {
        LocalDateTime now = LocalDateTime.now(clock);
        Duration maxAge = Duration.ofHours(Math.max(0, maxAgeHours));
        int timedOut = 0;
        for (HelpRequest request : store.listPending()) {
            if (request.getCreatedAt() == null) continue;
            Duration age = Duration.between(request.getCreatedAt(), now);
            if (age.compareTo(maxAge) <= 0) continue;
            if (store.updateHelpRequestTimeout(request.getId(), now)) {
                timedOut++;
                log.info("[HELP_REQUEST] timed out id={} age={}h", request.getId(),
                        String.format("%.1f", age.toMinutes() / 60.0));
            }
        }
        return timedOut;
    }

    public HelpRequestStats stats() {
        List<HelpRequest> window = store.listRecent(statsWindow);
        if (window.isEmpty()) {
            return HelpRequestStats.EMPTY;
        }
        int pending = 0;
        int resolved = 0;
        int timeout = 0;
        double minutesSum = 0.0;
        int minutesCount = 0;
        for (HelpRequest r : window) {
            switch (r.getStatus()) {
                case PENDING -> pending++;
                case RESOLVED -> resolved++;
                case TIMEOUT -> timeout++;
            }
            Double minutes = r.resolutionMinutes();
            if (minutes != null) {
                minutesSum += minutes;
                minutesCount++;
            }
        }
        int total = window.size();
        double avg = minutesCount == 0 ? 0.0 : round1(minutesSum / minutesCount);
        double rate = round1(resolved * 100.0 / total);
        return new HelpRequestStats(total, pending, resolved, timeout, avg, rate);
    }

    public List<HelpRequest> pending() {
        return store.listPending();
    }

    public List<HelpRequest> recent(int limit) {
        return store.listRecent(Math.max(1, limit));
    }

    public Optional<HelpRequest> find(Long requestId) {
        return store.getHelpRequest(requestId);
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
