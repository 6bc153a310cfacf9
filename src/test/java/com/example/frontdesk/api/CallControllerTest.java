package com.example.frontdesk.api;

import com.example.frontdesk.error.NotFoundException;
import com.example.frontdesk.session.CallSessionManager;
import com.example.frontdesk.session.ConversationContext;
import com.example.frontdesk.session.ConversationEvent;
import com.example.frontdesk.session.TurnOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

public class CallControllerTest {

    private CallSessionManager calls;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        calls = mock(CallSessionManager.class);
        mvc = MockMvcBuilders.standaloneSetup(new CallController(calls))
                .setControllerAdvice(new ApiExceptionAdvice())
                .build();
    }

    @Test
    void start_createsCallAndQueuesGreeting() throws Exception {
        when(calls.startCall("caller-1", "+15550001"))
                .thenReturn(new ConversationContext(11L, "caller-1", "+15550001", LocalDateTime.now()));

        mvc.perform(post("/api/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"callerId\":\"caller-1\",\"callerContact\":\"+15550001\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.callId").value(11))
                .andExpect(jsonPath("$.greeting").value(CallController.GREETING));

        verify(calls).offer(eq(11L), argThat(e -> e.type() == ConversationEvent.Type.AGENT_REPLY));
    }

    @Test
    void start_missingContact_is400() throws Exception {
        mvc.perform(post("/api/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"callerId\":\"caller-1\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(calls);
    }

    @Test
    void utterance_returnsOutcome() throws Exception {
        when(calls.submitUtterance(11L, "Do you do weddings?"))
                .thenReturn(TurnOutcome.escalated("Let me check with my manager.", 5L));

        mvc.perform(post("/api/calls/11/utterances")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Do you do weddings?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("ESCALATED"))
                .andExpect(jsonPath("$.helpRequestId").value(5))
                .andExpect(jsonPath("$.knowledgeEntryId").doesNotExist());
    }

    @Test
    void end_unknownCall_is404() throws Exception {
        doThrow(new NotFoundException("call", 99L)).when(calls).endCall(99L);

        mvc.perform(post("/api/calls/99/end"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void end_isAccepted() throws Exception {
        mvc.perform(post("/api/calls/11/end"))
                .andExpect(status().isAccepted());
        verify(calls).endCall(11L);
    }
}
