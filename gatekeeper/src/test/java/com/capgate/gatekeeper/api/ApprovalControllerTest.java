package com.capgate.gatekeeper.api;

import com.capgate.gatekeeper.model.*;
import com.capgate.gatekeeper.service.ApprovalException;
import com.capgate.gatekeeper.service.ApprovalGate;
import com.capgate.gatekeeper.service.ApprovalNotFoundException;
import com.capgate.gatekeeper.service.Resolution;
import com.capgate.gatekeeper.workspace.WorkspaceException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for ApprovalController. ApprovalGate is a mock.
 */
@WebMvcTest(ApprovalController.class)
class ApprovalControllerTest {

    @Autowired   MockMvc      mockMvc;
    @MockitoBean ApprovalGate gate;

    // ------------------------------------------------------------------
    // GET /approvals
    // ------------------------------------------------------------------

    @Test
    void list_noFilter_returnsSummariesWithoutPayload() throws Exception {
        ApprovalRecord record = pendingWrite();
        when(gate.list(null)).thenReturn(List.of(record));

        mockMvc.perform(get("/approvals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records.length()").value(1))
                .andExpect(jsonPath("$.records[0].id").value(record.getId().toString()))
                .andExpect(jsonPath("$.records[0].capability").value("write"))
                .andExpect(jsonPath("$.records[0].status").value("pending"))
                .andExpect(jsonPath("$.records[0].payload").doesNotExist());
    }

    @Test
    void list_statusFilter_passedToGate() throws Exception {
        when(gate.list(ApprovalStatus.PENDING)).thenReturn(List.of());

        mockMvc.perform(get("/approvals").param("status", "pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records").isEmpty());

        verify(gate).list(ApprovalStatus.PENDING);
    }

    @Test
    void list_unknownStatus_returns400() throws Exception {
        mockMvc.perform(get("/approvals").param("status", "lost"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("malformed_request"));

        verifyNoInteractions(gate);
    }

    // ------------------------------------------------------------------
    // GET /approvals/{id}
    // ------------------------------------------------------------------

    @Test
    void get_pendingRecord_includesTaggedPayload() throws Exception {
        ApprovalRecord record = pendingWrite();
        when(gate.get(record.getId())).thenReturn(Optional.of(record));

        mockMvc.perform(get("/approvals/{id}", record.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.requestedBy").value("coder"))
                .andExpect(jsonPath("$.payload.kind").value("write"))
                .andExpect(jsonPath("$.payload.message").value("add a"))
                .andExpect(jsonPath("$.payload.diffs[0].path").value("a.txt"))
                .andExpect(jsonPath("$.resolvedAt").doesNotExist());
    }

    @Test
    void get_unknownId_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(gate.get(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/approvals/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void get_invalidUuid_returns400() throws Exception {
        mockMvc.perform(get("/approvals/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // POST /approvals/{id}/approve and /deny
    // ------------------------------------------------------------------

    @Test
    void approve_pending_returnsApprovedRecordWithoutPayload() throws Exception {
        ApprovalRecord record = pendingWrite();
        record.approve("alice");
        when(gate.resolve(record.getId(), Resolution.APPROVE, "alice")).thenReturn(record);

        mockMvc.perform(post("/approvals/{id}/approve", record.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"actor":"alice"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("approved"))
                .andExpect(jsonPath("$.resolvedBy").value("alice"))
                .andExpect(jsonPath("$.resolvedAt").isNotEmpty())
                .andExpect(jsonPath("$.payload").doesNotExist());
    }

    @Test
    void deny_withoutBody_passesNullActor() throws Exception {
        ApprovalRecord record = pendingWrite();
        record.deny("user");
        when(gate.resolve(record.getId(), Resolution.DENY, null)).thenReturn(record);

        mockMvc.perform(post("/approvals/{id}/deny", record.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("denied"))
                .andExpect(jsonPath("$.resolvedBy").value("user"));
    }

    @Test
    void approve_alreadyResolved_returns400NotPending() throws Exception {
        UUID id = UUID.randomUUID();
        when(gate.resolve(any(), any(), any())).thenThrow(new ApprovalException(
                ApprovalException.Kind.NOT_PENDING, "Approval " + id + " is already denied"));

        mockMvc.perform(post("/approvals/{id}/approve", id))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("not_pending"));
    }

    @Test
    void approve_patchNoLongerApplies_returns400PatchRejected() throws Exception {
        UUID id = UUID.randomUUID();
        when(gate.resolve(any(), any(), any())).thenThrow(new WorkspaceException(
                WorkspaceException.Kind.PATCH_REJECTED, "a.txt", "Mismatch at line 1"));

        mockMvc.perform(post("/approvals/{id}/approve", id))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("patch_rejected"))
                .andExpect(jsonPath("$.path").value("a.txt"));
    }

    @Test
    void deny_unknownId_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(gate.resolve(id, Resolution.DENY, null)).thenThrow(new ApprovalNotFoundException(id));

        mockMvc.perform(post("/approvals/{id}/deny", id))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ApprovalRecord pendingWrite() {
        WritePayload payload = new WritePayload(List.of(Diff.of("a.txt", "+hello\n")), "add a");
        return new ApprovalRecord(Capability.WRITE, payload, "coder");
    }
}
