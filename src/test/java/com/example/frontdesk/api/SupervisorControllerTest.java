package com.example.frontdesk.api;

import com.example.frontdesk.domain.HelpRequest;
import com.example.frontdesk.domain.KnowledgeEntry;
import com.example.frontdesk.domain.enums.RequestStatus;
import com.example.frontdesk.error.UpstreamUnavailableException;
import com.example.frontdesk.helprequest.HelpRequestLifecycle;
import com.example.frontdesk.helprequest.HelpRequestStats;
import com.example.frontdesk.helprequest.ResolutionResult;
import com.example.frontdesk.knowledge.KnowledgeIndex;
import com.example.frontdesk.notification.LoggingNotificationChannel;
import com.example.frontdesk.session.CallSessionManager;
import com.example.frontdesk.store.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

public class SupervisorControllerTest {

    private HelpRequestLifecycle lifecycle;
    private KnowledgeIndex knowledge;
    private CallSessionManager calls;
    private LoggingNotificationChannel notificationLog;
    private MockMvc mvc;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        lifecycle = mock(HelpRequestLifecycle.class);
        knowledge = mock(KnowledgeIndex.class);
        calls = mock(CallSessionManager.class);
        notificationLog = new LoggingNotificationChannel(10, new MutableClock(Instant.parse("2026-01-05T10:00:00Z")));
        ObjectProvider<LoggingNotificationChannel> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(notificationLog);

        mvc = MockMvcBuilders.standaloneSetup(new SupervisorController(lifecycle, knowledge, calls, provider))
                .setControllerAdvice(new ApiExceptionAdvice())
                .build();
    }

    private static HelpRequest pending(long id, String question) {
        return HelpRequest.builder().id(id).callerId("c").callerContact("+1").question(question)
                .status(RequestStatus.PENDING).createdAt(LocalDateTime.of(2026, 1, 5, 10, 0)).build();
    }

    @Test
    void pending_listsRequestsInEnvelope() throws Exception {
        when(lifecycle.pending()).thenReturn(List.of(pending(2, "Do you do weddings?")));

        mvc.perform(get("/api/requests/pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.requests[0].id").value(2))
                .andExpect(jsonPath("$.requests[0].question").value("Do you do weddings?"))
                .andExpect(jsonPath("$.requests[0].status").value("PENDING"));
    }

    @Test
    void unknownRequest_is404() throws Exception {
        when(lifecycle.find(9L)).thenReturn(Optional.empty());

        mvc.perform(get("/api/requests/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("not_found"))
                .andExpect(jsonPath("$.path").value("/api/requests/9"));
    }

    @Test
    void resolve_ok() throws Exception {
        when(lifecycle.resolveDetailed(eq(3L), eq("Yes we do."), eq("Alice"))).thenReturn(ResolutionResult.RESOLVED);

        mvc.perform(post("/api/requests/3/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"Yes we do.\",\"supervisorName\":\"Alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Request resolved successfully"));
    }

    @Test
    void resolve_blankAnswer_is400BeforeTouchingTheLifecycle() throws Exception {
        mvc.perform(post("/api/requests/3/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_failed"))
                .andExpect(jsonPath("$.message").value("Answer is required"));
        verifyNoInteractions(lifecycle);
    }

    @Test
    void resolve_secondTime_is409() throws Exception {
        HelpRequest done = pending(3, "Q?");
        done.setStatus(RequestStatus.RESOLVED);
        when(lifecycle.resolveDetailed(eq(3L), anyString(), any())).thenReturn(ResolutionResult.INVALID_TRANSITION);
        when(lifecycle.find(3L)).thenReturn(Optional.of(done));

        mvc.perform(post("/api/requests/3/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"again\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("invalid_transition"))
                .andExpect(jsonPath("$.message").value(containsString("RESOLVED")));
    }

    @Test
    void resolve_unknownId_is404() throws Exception {
        when(lifecycle.resolveDetailed(eq(8L), anyString(), any())).thenReturn(ResolutionResult.NOT_FOUND);

        mvc.perform(post("/api/requests/8/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"x\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void resolve_storeDown_is503() throws Exception {
        when(lifecycle.resolveDetailed(eq(3L), anyString(), any()))
                .thenThrow(new UpstreamUnavailableException("store", "connection refused"));

        mvc.perform(post("/api/requests/3/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"x\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("upstream_unavailable"));
    }

    @Test
    void knowledgeSearch_requiresQuery() throws Exception {
        mvc.perform(get("/api/knowledge/search").param("q", " "))
                .andExpect(status().isBadRequest());

        KnowledgeEntry e = KnowledgeEntry.builder().id(1L).question("Where are you located?").answer("123 Main Street").build();
        when(knowledge.matching("main")).thenReturn(List.of(e));
        mvc.perform(get("/api/knowledge/search").param("q", "main"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results", hasSize(1)))
                .andExpect(jsonPath("$.results[0].answer").value("123 Main Street"));
    }

    @Test
    void stats_includesKnowledgeSize() throws Exception {
        when(lifecycle.stats()).thenReturn(new HelpRequestStats(3, 1, 2, 0, 20.0, 66.7));
        when(knowledge.size()).thenReturn(5);

        mvc.perform(get("/api/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stats.totalRequests").value(3))
                .andExpect(jsonPath("$.stats.resolutionRate").value(66.7))
                .andExpect(jsonPath("$.stats.avgResolutionTimeMinutes").value(20.0))
                .andExpect(jsonPath("$.stats.knowledgeEntries").value(5));
    }

    @Test
    void notifications_newestFirst() throws Exception {
        notificationLog.notifySupervisor("alert one", 1L);
        notificationLog.notifyCaller("+1555", "follow-up");

        mvc.perform(get("/api/notifications"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.notifications", hasSize(2)))
                .andExpect(jsonPath("$.notifications[0].type").value("CALLER_FOLLOWUP"));
    }

    @Test
    void refresh_returnsSize() throws Exception {
        when(knowledge.refresh()).thenReturn(4);
        mvc.perform(post("/api/knowledge/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(4));
    }

    @Test
    void calls_listLogsAndActiveIds() throws Exception {
        when(calls.recentCalls(50)).thenReturn(List.of(com.example.frontdesk.domain.CallLog.builder()
                .id(7L).callerId("c").callerContact("+1").startedAt(LocalDateTime.of(2026, 1, 5, 10, 0)).build()));
        when(calls.activeCallIds()).thenReturn(List.of(7L));

        mvc.perform(get("/api/calls"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.calls[0].id").value(7))
                .andExpect(jsonPath("$.activeCallIds[0]").value(7));
    }
}
