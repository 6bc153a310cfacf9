package com.example.frontdesk.api;

import com.example.frontdesk.api.dto.StartCallRequest;
import com.example.frontdesk.api.dto.UtteranceRequest;
import com.example.frontdesk.session.CallSessionManager;
import com.example.frontdesk.session.ConversationContext;
import com.example.frontdesk.session.ConversationEvent;
import com.example.frontdesk.session.TurnOutcome;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Text-mode call surface: start a call, send caller utterances, end the call.
 * A speech runtime would feed the same {@link CallSessionManager} with transcribed events.
 */
@RestController
@RequestMapping("/api/calls")
@RequiredArgsConstructor
public class CallController {

    static final String GREETING = "Hello! Thank you for calling. How can I help you today?";

    private final CallSessionManager calls;

    @PostMapping
    public ResponseEntity<Map<String, Object>> start(@Valid @RequestBody StartCallRequest body) {
        ConversationContext context = calls.startCall(body.callerId(), body.callerContact());
        calls.offer(context.getCallId(), ConversationEvent.agentReply(GREETING));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("callId", context.getCallId());
        out.put("greeting", GREETING);
        return ResponseEntity.status(HttpStatus.CREATED).body(out);
    }

    @PostMapping("/{callId}/utterances")
    public ResponseEntity<Map<String, Object>> utterance(@PathVariable Long callId,
                                                         @Valid @RequestBody UtteranceRequest body) {
        TurnOutcome outcome = calls.submitUtterance(callId, body.text());
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("outcome", outcome.kind());
        out.put("reply", outcome.reply());
        if (outcome.knowledgeEntryId() != null) out.put("knowledgeEntryId", outcome.knowledgeEntryId());
        if (outcome.helpRequestId() != null) out.put("helpRequestId", outcome.helpRequestId());
        return ResponseEntity.ok(out);
    }

    @PostMapping("/{callId}/end")
    public ResponseEntity<Map<String, Object>> end(@PathVariable Long callId) {
        calls.endCall(callId);
        return ResponseEntity.accepted().body(Map.of("success", true, "callId", callId));
    }
}
