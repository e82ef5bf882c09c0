package com.example.accesslog.http;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.accesslog.models.Identifier;
import com.example.accesslog.models.LogCollection;
import com.example.accesslog.models.LogEntry;
import com.example.accesslog.models.LogFilter;
import com.example.accesslog.models.LogSort;
import com.example.accesslog.models.Pagination;
import com.example.accesslog.models.RemoteOrigins;
import com.example.accesslog.requests.CreateLogServiceRequest;
import com.example.accesslog.service.AccessLogException;
import com.example.accesslog.service.AccessLogService;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = AccessLogController.class)
@Import(RequestIdFilter.class)
class AccessLogControllerTest {

    private static final String LOG_ID = "AAECAwQFBgcICQoLDA0ODw";
    private static final String SUBJECT_ID = "EBESExQVFhcYGRobHB0eHw";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AccessLogService accessLogService;

    private static String readFixture(String path) throws IOException {
        try (InputStream in = AccessLogControllerTest.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Missing test fixture: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static LogEntry entry() {
        return LogEntry.builder()
                .id(Identifier.parse(LOG_ID))
                .creationTime(1725412345L)
                .scope("login")
                .remoteOrigin(RemoteOrigins.parse("1.2.3.4"))
                .subjectId(Identifier.parse(SUBJECT_ID))
                .build();
    }

    @Test
    @DisplayName("POST logs creates an entry from the snake_case payload")
    void createLog() throws Exception {
        when(accessLogService.create(any())).thenReturn(entry());

        mockMvc.perform(MockMvcRequestBuilders.post("/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(readFixture("/fixtures/create_log_request.json")))
                .andExpect(MockMvcResultMatchers.status().isCreated())
                .andExpect(MockMvcResultMatchers.header().string("Location", "/logs/" + LOG_ID))
                .andExpect(MockMvcResultMatchers.header().exists(RequestIdFilter.HEADER))
                .andExpect(MockMvcResultMatchers.jsonPath("$.id", equalTo(LOG_ID)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.remote_origin", equalTo("1.2.3.4")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.object_id", equalTo("AAAAAAAAAAAAAAAAAAAAAA")));

        ArgumentCaptor<CreateLogServiceRequest> captor = ArgumentCaptor.forClass(CreateLogServiceRequest.class);
        verify(accessLogService).create(captor.capture());
        CreateLogServiceRequest request = captor.getValue();
        assertEquals(Identifier.parse(LOG_ID), request.id());
        assertEquals(1725412345L, request.creationTime());
        assertEquals("login", request.scope());
        assertEquals("1.2.3.4", request.remoteOrigin().getHostAddress());
        assertEquals(Identifier.parse(SUBJECT_ID), request.subjectId());
        assertNull(request.objectId());
    }

    @Test
    @DisplayName("POST logs returns 409 when the id is taken")
    void createLogCollision() throws Exception {
        when(accessLogService.create(any())).thenThrow(AccessLogException.logIdCollision(LOG_ID));

        mockMvc.perform(MockMvcRequestBuilders.post("/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"" + LOG_ID + "\"}"))
                .andExpect(MockMvcResultMatchers.status().isConflict())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("LOG_ID_COLLISION")));
    }

    @Test
    @DisplayName("POST logs rejects malformed identifiers, negative times and host names")
    void createLogInvalid() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subject_id\":\"nope\"}"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("INVALID_IDENTIFIER")));

        mockMvc.perform(MockMvcRequestBuilders.post("/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"creation_time\":-1}"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest());

        mockMvc.perform(MockMvcRequestBuilders.post("/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"remote_origin\":\"example.com\"}"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("BAD_REQUEST")));

        verify(accessLogService, never()).create(any());
    }

    @Test
    @DisplayName("POST logs returns 400 when the service rejects the scope length")
    void createLogScopeTooLong() throws Exception {
        when(accessLogService.create(any()))
                .thenThrow(new IllegalArgumentException("scope must be at most 8 characters"));

        mockMvc.perform(MockMvcRequestBuilders.post("/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"ninechars\"}"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("BAD_REQUEST")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.message", equalTo("scope must be at most 8 characters")));

        ArgumentCaptor<CreateLogServiceRequest> captor = ArgumentCaptor.forClass(CreateLogServiceRequest.class);
        verify(accessLogService).create(captor.capture());
        assertEquals("ninechars", captor.getValue().scope());
    }

    @Test
    @DisplayName("GET log by id returns 404 when absent")
    void getLog() throws Exception {
        when(accessLogService.get(Identifier.parse(LOG_ID))).thenReturn(Optional.of(entry()));

        mockMvc.perform(MockMvcRequestBuilders.get("/logs/" + LOG_ID))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.subject_id", equalTo(SUBJECT_ID)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.creation_time", equalTo(1725412345)));

        mockMvc.perform(MockMvcRequestBuilders.get("/logs/" + SUBJECT_ID))
                .andExpect(MockMvcResultMatchers.status().isNotFound());
    }

    @Test
    @DisplayName("GET logs parses filters, sort and pagination")
    void searchLogs() throws Exception {
        when(accessLogService.search(any(), any(), any())).thenReturn(LogCollection.of(List.of(entry())));

        mockMvc.perform(MockMvcRequestBuilders.get("/logs")
                        .param("scopes", "login,logout")
                        .param("remote_origins", "1.2.3.4")
                        .param("created_after", "100")
                        .param("sort", "id")
                        .param("order", "desc")
                        .param("page", "2")
                        .param("per_page", "5"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$", hasSize(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$[0].scope", equalTo("login")));

        ArgumentCaptor<LogFilter> filter = ArgumentCaptor.forClass(LogFilter.class);
        ArgumentCaptor<LogSort> sort = ArgumentCaptor.forClass(LogSort.class);
        ArgumentCaptor<Pagination> pagination = ArgumentCaptor.forClass(Pagination.class);
        verify(accessLogService).search(filter.capture(), sort.capture(), pagination.capture());

        assertEquals(Set.of("login", "logout"), filter.getValue().scopes());
        assertEquals(Set.of(RemoteOrigins.parse("1.2.3.4")), filter.getValue().remoteOrigins());
        assertEquals(100L, filter.getValue().createdAfter());
        assertEquals(new LogSort(LogSort.Field.ID, LogSort.Order.DESC), sort.getValue());
        assertEquals(Pagination.of(2, 5), pagination.getValue());
    }

    @Test
    @DisplayName("GET logs rejects unknown sort fields")
    void searchLogsBadSort() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/logs").param("sort", "scope"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest());
    }

    @Test
    @DisplayName("GET logs/count and logs/scopes")
    void countAndScopes() throws Exception {
        when(accessLogService.count(any())).thenReturn(3L);
        when(accessLogService.uniqueScopes()).thenReturn(new TreeSet<>(List.of("login", "edit")));

        mockMvc.perform(MockMvcRequestBuilders.get("/logs/count").param("subject_ids", SUBJECT_ID))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.count", equalTo(3)));

        mockMvc.perform(MockMvcRequestBuilders.get("/logs/scopes"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$[0]", equalTo("edit")))
                .andExpect(MockMvcResultMatchers.jsonPath("$[1]", equalTo("login")));

        ArgumentCaptor<LogFilter> filter = ArgumentCaptor.forClass(LogFilter.class);
        verify(accessLogService).count(filter.capture());
        assertEquals(Set.of(Identifier.parse(SUBJECT_ID)), filter.getValue().subjectIds());
    }

    @Test
    @DisplayName("DELETE log by id and prune by cutoff")
    void deleteAndPrune() throws Exception {
        when(accessLogService.prune(any())).thenReturn(4);

        mockMvc.perform(MockMvcRequestBuilders.delete("/logs/" + LOG_ID))
                .andExpect(MockMvcResultMatchers.status().isNoContent());
        verify(accessLogService).delete(Identifier.parse(LOG_ID));

        mockMvc.perform(MockMvcRequestBuilders.delete("/logs").param("created_before", "1000"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.pruned", equalTo(4)));
        verify(accessLogService).prune(eq(OptionalLong.of(1000)));
    }
}
