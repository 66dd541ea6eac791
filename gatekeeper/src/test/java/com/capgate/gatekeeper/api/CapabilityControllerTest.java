package com.capgate.gatekeeper.api;

import com.capgate.gatekeeper.model.Capability;
import com.capgate.gatekeeper.model.DecisionOnlyPayload;
import com.capgate.gatekeeper.model.WritePayload;
import com.capgate.gatekeeper.service.ApprovalException;
import com.capgate.gatekeeper.service.ApprovalGate;
import com.capgate.gatekeeper.service.GateOutcome;
import com.capgate.gatekeeper.workspace.WorkspaceException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for CapabilityController.
 *
 * Only the web layer is started; ApprovalGate is a mock.
 */
@WebMvcTest(CapabilityController.class)
class CapabilityControllerTest {

    @Autowired   MockMvc      mockMvc;
    @MockitoBean ApprovalGate gate;

    private static final String APPLY_BODY = """
            {"diffs":[{"path":"a.txt","patch":"+hello\\n","predictedTests":["ATest"]}],
             "message":"add a","requestedBy":"coder"}
            """;

    // ------------------------------------------------------------------
    // POST /diffs/apply
    // ------------------------------------------------------------------

    @Test
    void applyDiffs_autoApproved_returns200WithCommitSha() throws Exception {
        when(gate.request(eq(Capability.WRITE), any(), any()))
                .thenReturn(GateOutcome.applied(Capability.WRITE, "abc123"));

        mockMvc.perform(post("/diffs/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(APPLY_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("applied"))
                .andExpect(jsonPath("$.capability").value("write"))
                .andExpect(jsonPath("$.commitSha").value("abc123"))
                .andExpect(jsonPath("$.approvalId").doesNotExist());

        ArgumentCaptor<WritePayload> captor = ArgumentCaptor.forClass(WritePayload.class);
        verify(gate).request(eq(Capability.WRITE), captor.capture(), eq("coder"));
        assertThat(captor.getValue().message()).isEqualTo("add a");
        assertThat(captor.getValue().diffs()).singleElement().satisfies(d -> {
            assertThat(d.path()).isEqualTo("a.txt");
            assertThat(d.patch()).isEqualTo("+hello\n");
            assertThat(d.predictedTests()).containsExactly("ATest");
        });
    }

    @Test
    void applyDiffs_needsReview_returns200WithApprovalId() throws Exception {
        UUID id = UUID.randomUUID();
        when(gate.request(eq(Capability.WRITE), any(), any()))
                .thenReturn(GateOutcome.pending(Capability.WRITE, id));

        mockMvc.perform(post("/diffs/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(APPLY_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.approvalId").value(id.toString()))
                .andExpect(jsonPath("$.commitSha").doesNotExist());
    }

    @Test
    void applyDiffs_forbidden_returns403() throws Exception {
        when(gate.request(eq(Capability.WRITE), any(), any()))
                .thenReturn(GateOutcome.forbidden(Capability.WRITE));

        mockMvc.perform(post("/diffs/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(APPLY_BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value("forbidden"));
    }

    @Test
    void applyDiffs_pathEscape_returns400WithPath() throws Exception {
        when(gate.request(eq(Capability.WRITE), any(), any())).thenThrow(new WorkspaceException(
                WorkspaceException.Kind.PATH_ESCAPE, "../../etc/passwd", "resolves outside the workspace root"));

        mockMvc.perform(post("/diffs/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(APPLY_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("path_escape"))
                .andExpect(jsonPath("$.path").value("../../etc/passwd"));
    }

    @Test
    void applyDiffs_ioFailure_returns500() throws Exception {
        when(gate.request(eq(Capability.WRITE), any(), any())).thenThrow(new WorkspaceException(
                WorkspaceException.Kind.IO_FAILURE, "a.txt", "disk full"));

        mockMvc.perform(post("/diffs/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(APPLY_BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("io_failure"));
    }

    @Test
    void applyDiffs_malformedPayload_returns400() throws Exception {
        when(gate.request(eq(Capability.WRITE), any(), any())).thenThrow(new ApprovalException(
                ApprovalException.Kind.MALFORMED_PAYLOAD, "Write payload has no diffs"));

        mockMvc.perform(post("/diffs/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"diffs":[],"message":"nothing"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("malformed_payload"));
    }

    @Test
    void applyDiffs_unreadableJson_returns400() throws Exception {
        mockMvc.perform(post("/diffs/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("malformed_request"));

        verifyNoInteractions(gate);
    }

    // ------------------------------------------------------------------
    // POST /capabilities/{capability}/requests
    // ------------------------------------------------------------------

    @Test
    void requestCapability_knownCapability_passesAttributes() throws Exception {
        when(gate.request(eq(Capability.EXEC), any(), any()))
                .thenReturn(GateOutcome.pending(Capability.EXEC, UUID.randomUUID()));

        mockMvc.perform(post("/capabilities/{capability}/requests", "EXEC")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"attributes":{"cmd":"mvn test"},"requestedBy":"tester"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.capability").value("exec"));

        ArgumentCaptor<DecisionOnlyPayload> captor = ArgumentCaptor.forClass(DecisionOnlyPayload.class);
        verify(gate).request(eq(Capability.EXEC), captor.capture(), eq("tester"));
        assertThat(captor.getValue().attributes()).containsEntry("cmd", "mvn test");
    }

    @Test
    void requestCapability_withoutBody_sendsEmptyAttributes() throws Exception {
        when(gate.request(eq(Capability.SECRETS), any(), any()))
                .thenReturn(GateOutcome.forbidden(Capability.SECRETS));

        mockMvc.perform(post("/capabilities/{capability}/requests", "secrets"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value("forbidden"));

        verify(gate).request(Capability.SECRETS, new DecisionOnlyPayload(null), null);
    }

    @Test
    void requestCapability_unknownCapability_returns400() throws Exception {
        mockMvc.perform(post("/capabilities/{capability}/requests", "teleport")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("unknown_capability"));

        verifyNoInteractions(gate);
    }
}
