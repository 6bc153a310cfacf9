package com.example.frontdesk.api;

import com.example.frontdesk.api.dto.ResolveRequest;
import com.example.frontdesk.domain.HelpRequest;
import com.example.frontdesk.domain.enums.RequestStatus;
import com.example.frontdesk.error.InvalidTransitionException;
import com.example.frontdesk.error.NotFoundException;
import com.example.frontdesk.error.ValidationException;
import com.example.frontdesk.helprequest.HelpRequestLifecycle;
import com.example.frontdesk.helprequest.HelpRequestStats;
import com.example.frontdesk.helprequest.ResolutionResult;
import com.example.frontdesk.knowledge.KnowledgeIndex;
import com.example.frontdesk.notification.LoggingNotificationChannel;
import com.example.frontdesk.notification.NotificationRecord;
import com.example.frontdesk.session.CallSessionManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 감독자 대시보드용 REST 컨트롤러
 * - 대기/전체 요청 조회, 요청 해결(답변), 지식 조회/검색, 통계, 통화 기록
 * - 모든 응답은 {"success": true|false, ...} 형태
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SupervisorController {

    private final HelpRequestLifecycle lifecycle;
    private final KnowledgeIndex knowledgeIndex;
    private final CallSessionManager calls;
    private final ObjectProvider<LoggingNotificationChannel> notificationLog;

    @GetMapping("/requests/pending")
    public ResponseEntity<Map<String, Object>> pending() {
        return ok("requests", lifecycle.pending());
    }

    @GetMapping("/requests/all")
    public ResponseEntity<Map<String, Object>> all(@RequestParam(defaultValue = "50") int limit) {
        return ok("requests", lifecycle.recent(limit));
    }

    @GetMapping("/requests/{id}")
    public ResponseEntity<Map<String, Object>> one(@PathVariable Long id) {
        HelpRequest request = lifecycle.find(id).orElseThrow(() -> new NotFoundException("help request", id));
        return ok("request", request);
    }

    /**
     * 요청 해결: 답변 저장 → 지식 학습 → 발신자 후속 메시지
     */
    @PostMapping("/requests/{id}/resolve")
    public ResponseEntity<Map<String, Object>> resolve(@PathVariable Long id, @Valid @RequestBody ResolveRequest body) {
        ResolutionResult result = lifecycle.resolveDetailed(id, body.answer(), body.supervisorName());
        return switch (result) {
            case RESOLVED -> ok("message", "Request resolved successfully");
            case NOT_FOUND -> throw new NotFoundException("help request", id);
            case INVALID_TRANSITION -> {
                RequestStatus current = lifecycle.find(id).map(HelpRequest::getStatus).orElse(null);
                throw new InvalidTransitionException(id, current, RequestStatus.RESOLVED);
            }
        };
    }

    @GetMapping("/knowledge")
    public ResponseEntity<Map<String, Object>> knowledge() {
        return ok("knowledge", knowledgeIndex.entries());
    }

    @GetMapping("/knowledge/search")
    public ResponseEntity<Map<String, Object>> searchKnowledge(@RequestParam(name = "q", required = false) String q) {
        if (q == null || q.isBlank()) {
            throw new ValidationException("q", "Query parameter 'q' is required");
        }
        return ok("results", knowledgeIndex.matching(q));
    }

    @PostMapping("/knowledge/refresh")
    public ResponseEntity<Map<String, Object>> refreshKnowledge() {
        int size = knowledgeIndex.refresh();
        log.info("[DASHBOARD] knowledge snapshot reloaded size={}", size);
        return ok("size", size);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        HelpRequestStats s = lifecycle.stats();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("totalRequests", s.total());
        out.put("pending", s.pending());
        out.put("resolved", s.resolved());
        out.put("timeout", s.timeout());
        out.put("avgResolutionTimeMinutes", s.avgResolutionMinutes());
        out.put("resolutionRate", s.resolutionRatePct());
        out.put("knowledgeEntries", knowledgeIndex.size());
        return ok("stats", out);
    }

    @GetMapping("/calls")
    public ResponseEntity<Map<String, Object>> calls(@RequestParam(defaultValue = "50") int limit) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("calls", calls.recentCalls(limit));
        body.put("activeCallIds", calls.activeCallIds());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/notifications")
    public ResponseEntity<Map<String, Object>> notifications() {
        LoggingNotificationChannel channel = notificationLog.getIfAvailable();
        List<NotificationRecord> records = channel == null ? List.of() : channel.recent();
        return ok("notifications", records);
    }

    private static ResponseEntity<Map<String, Object>> ok(String key, Object value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put(key, value);
        return ResponseEntity.ok(body);
    }
}
