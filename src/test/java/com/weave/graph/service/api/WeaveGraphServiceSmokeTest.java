package com.weave.graph.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weave.graph.service.api.dto.CreateEdgeRequest;
import com.weave.graph.service.api.dto.RestoreArchiveRequest;
import com.weave.graph.service.api.dto.SaveNodeRequest;
import com.weave.graph.service.api.dto.SuppressErrorRequest;
import com.weave.graph.service.api.dto.UpdateMilestoneRequest;
import com.weave.graph.service.model.EdgeType;
import com.weave.graph.service.model.NodeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Smoke tests for Weave Graph Service.
 *
 * Each test works in its own chat session against the in-memory gateway.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class WeaveGraphServiceSmokeTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String chatId;

    @BeforeEach
    void newChat() {
        chatId = "chat-" + UUID.randomUUID();
    }

    private JsonNode saveNode(NodeType type, String label) throws Exception {
        var request = SaveNodeRequest.builder().type(type).label(label).build();
        var body = mockMvc.perform(post("/sessions/{chatId}/nodes", chatId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).at("/data/node");
    }

    // ==================== Infrastructure ====================

    @Test
    void healthEndpointWorks() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    void swaggerUiAvailable() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }

    // ==================== Nodes ====================

    @Test
    @DisplayName("Saving a similar node returns the synapse created for it")
    void saveNodeCreatesSynapse() throws Exception {
        var first = saveNode(NodeType.CONCEPT, "Kafka consumer groups");

        var request = SaveNodeRequest.builder().type(NodeType.CONCEPT).label("Kafka consumer groups").build();
        mockMvc.perform(post("/sessions/{chatId}/nodes", chatId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.created").value(true))
                .andExpect(jsonPath("$.data.synapses[0].targetId").value(first.get("id").asText()))
                .andExpect(jsonPath("$.data.synapses[0].type").value("RELATES"))
                .andExpect(jsonPath("$.data.synapses[0].metadata.synapse").value(true));
    }

    @Test
    void saveNodeWithExistingIdReturns200() throws Exception {
        var node = saveNode(NodeType.CONCEPT, "Original");
        var request = SaveNodeRequest.builder()
                .id(node.get("id").asText()).type(NodeType.CONCEPT).label("Renamed").build();

        mockMvc.perform(post("/sessions/{chatId}/nodes", chatId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.created").value(false))
                .andExpect(jsonPath("$.data.node.label").value("Renamed"));
    }

    @Test
    void saveNodeWithoutLabelReturns400() throws Exception {
        var request = SaveNodeRequest.builder().type(NodeType.CONCEPT).build();

        mockMvc.perform(post("/sessions/{chatId}/nodes", chatId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void unknownNodeReturns404() throws Exception {
        saveNode(NodeType.CONCEPT, "anything");

        mockMvc.perform(get("/sessions/{chatId}/nodes/{nodeId}", chatId, "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void accessIncrementsFrequency() throws Exception {
        var node = saveNode(NodeType.CONCEPT, "Hot path");

        mockMvc.perform(post("/sessions/{chatId}/nodes/{nodeId}/access", chatId, node.get("id").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.frequency").value(2));
    }

    // ==================== Edges & Queries ====================

    @Test
    void createEdgeAndQueryByType() throws Exception {
        var a = saveNode(NodeType.DECISION, "Adopt gRPC");
        var b = saveNode(NodeType.CODE_ENTITY, "OrderServiceStub");
        var request = CreateEdgeRequest.builder()
                .sourceId(b.get("id").asText())
                .targetId(a.get("id").asText())
                .type(EdgeType.IMPLEMENTS)
                .build();

        mockMvc.perform(post("/sessions/{chatId}/edges", chatId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.weight").value(1.0));

        mockMvc.perform(get("/sessions/{chatId}/edges", chatId).param("type", "IMPLEMENTS"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1));

        mockMvc.perform(get("/sessions/{chatId}/nodes", chatId).param("type", "DECISION"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].label").value("Adopt gRPC"));
    }

    @Test
    void edgeToUnknownNodeReturns404() throws Exception {
        var a = saveNode(NodeType.CONCEPT, "alone");
        var request = CreateEdgeRequest.builder()
                .sourceId(a.get("id").asText()).targetId("ghost").type(EdgeType.CAUSES).build();

        mockMvc.perform(post("/sessions/{chatId}/edges", chatId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isNotFound());
    }

    @Test
    void labelQuery() throws Exception {
        saveNode(NodeType.CONCEPT, "Redis cache");
        saveNode(NodeType.CONCEPT, "Postgres index");

        mockMvc.perform(get("/sessions/{chatId}/query", chatId).param("q", "REDIS"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].label").value("Redis cache"));
    }

    // ==================== Errors ====================

    @Test
    @DisplayName("Suppressing an error records a correction and clears it from the uncorrected list")
    void suppressError() throws Exception {
        var error = saveNode(NodeType.ERROR, "Race in cache warmup");
        var errorId = error.get("id").asText();

        mockMvc.perform(get("/sessions/{chatId}/errors/uncorrected", chatId))
                .andExpect(jsonPath("$.data[*].id", hasItem(errorId)));

        var request = new SuppressErrorRequest("Warm cache under lock", "serialize warmup");
        mockMvc.perform(post("/sessions/{chatId}/errors/{nodeId}/suppress", chatId, errorId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.errorNodeId").value(errorId))
                .andExpect(jsonPath("$.data.suppressed").value(true));

        mockMvc.perform(get("/sessions/{chatId}/errors/uncorrected", chatId))
                .andExpect(jsonPath("$.data.length()").value(0));
        mockMvc.perform(get("/sessions/{chatId}/errors/corrected", chatId))
                .andExpect(jsonPath("$.data[0].errorNodeId").value(errorId))
                .andExpect(jsonPath("$.data[0].correctionNodeIds.length()").value(1));
    }

    @Test
    void suppressingNonErrorReturns409() throws Exception {
        var concept = saveNode(NodeType.CONCEPT, "Not an error");
        var request = new SuppressErrorRequest("fix", "details");

        mockMvc.perform(post("/sessions/{chatId}/errors/{nodeId}/suppress", chatId, concept.get("id").asText())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("POLICY_VIOLATION"));
    }

    // ==================== Milestones ====================

    @Test
    void milestoneProgress() throws Exception {
        var milestone = saveNode(NodeType.MILESTONE, "Ship v1");
        var id = milestone.get("id").asText();

        mockMvc.perform(get("/sessions/{chatId}/milestones/next", chatId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(id));

        var request = new UpdateMilestoneRequest("DONE", 12.0);
        mockMvc.perform(put("/sessions/{chatId}/milestones/{milestoneId}", chatId, id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.metadata.status").value("DONE"))
                .andExpect(jsonPath("$.data.metadata.actual_hours").value(12.0));

        mockMvc.perform(get("/sessions/{chatId}/milestones/next", chatId))
                .andExpect(status().isNotFound());
    }

    // ==================== Sessions & Compression ====================

    @Test
    void sessionContextAndSnapshot() throws Exception {
        saveNode(NodeType.CONCEPT, "Context item");

        mockMvc.perform(get("/sessions/{chatId}", chatId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.chatId").value(chatId))
                .andExpect(jsonPath("$.data.stats.totalNodes").value(1))
                .andExpect(jsonPath("$.data.shouldCompress").value(false));

        var body = mockMvc.perform(get("/sessions/{chatId}/snapshot", chatId))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        var snapshot = objectMapper.readTree(body).get("data");
        assertThat(snapshot.get("nodes").size()).isEqualTo(1);
        assertThat(snapshot.at("/metadata/chatId").asText()).isEqualTo(chatId);

        mockMvc.perform(get("/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[*].chatId", hasItem(chatId)));
    }

    @Test
    void unknownSessionReturns404() throws Exception {
        mockMvc.perform(get("/sessions/{chatId}/stats", "no-such-chat"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/sessions/{chatId}/archive", "no-such-chat"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void deleteSession() throws Exception {
        saveNode(NodeType.CONCEPT, "to be deleted");

        mockMvc.perform(delete("/sessions/{chatId}", chatId))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/sessions/{chatId}", chatId))
                .andExpect(status().isNotFound());
    }

    @Test
    void compressAndRestoreArchive() throws Exception {
        var kept = saveNode(NodeType.CONCEPT, "frequently used");
        mockMvc.perform(post("/sessions/{chatId}/nodes/{nodeId}/access", chatId, kept.get("id").asText()));
        var archived = saveNode(NodeType.ERROR, "transient glitch");
        var archivedId = archived.get("id").asText();

        mockMvc.perform(post("/sessions/{chatId}/compress", chatId).param("targetReduction", "0.5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.archivedNodeCount").value(1));

        mockMvc.perform(get("/sessions/{chatId}/archive", chatId))
                .andExpect(jsonPath("$.data.archivedNodes").value(1))
                .andExpect(jsonPath("$.data.nodeIds[0]").value(archivedId));

        var request = new RestoreArchiveRequest(List.of(archivedId));
        mockMvc.perform(post("/sessions/{chatId}/archive/restore", chatId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.nodes[0].id").value(archivedId));

        mockMvc.perform(get("/sessions/{chatId}/nodes/{nodeId}", chatId, archivedId))
                .andExpect(status().isOk());
    }
}
