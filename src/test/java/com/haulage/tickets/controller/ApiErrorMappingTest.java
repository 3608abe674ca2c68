package com.haulage.tickets.controller;

import com.haulage.tickets.entity.ReviewEntry;
import com.haulage.tickets.entity.ReviewReason;
import com.haulage.tickets.entity.ReviewSeverity;
import com.haulage.tickets.repository.ReviewEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Checks that service exceptions surface with the right HTTP status.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ApiErrorMappingTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ReviewEntryRepository reviewEntryRepository;

    @BeforeEach
    void setUp() {
        reviewEntryRepository.deleteAll();
    }

    @Test
    @DisplayName("Unknown run is 404")
    void unknownRun() throws Exception {
        mockMvc.perform(get("/api/v1/runs/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));

        mockMvc.perform(post("/api/v1/runs/does-not-exist/cancel"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Run without input path is 400")
    void missingInputPath() throws Exception {
        mockMvc.perform(post("/api/v1/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jobId\":\"24-105\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Resolving an unknown entry is 404, an already resolved one 409")
    void resolveErrors() throws Exception {
        // Given
        ReviewEntry resolved = reviewEntryRepository.save(ReviewEntry.builder()
                .pageId("a.pdf#page1")
                .sourceFile("a.pdf")
                .pageNumber(1)
                .reason(ReviewReason.DUPLICATE_TICKET)
                .severity(ReviewSeverity.WARNING)
                .evidence("{}")
                .resolved(true)
                .resolvedBy("reviewer")
                .build());
        String body = "{\"resolvedBy\":\"reviewer\",\"notes\":\"checked\"}";

        // When / Then
        mockMvc.perform(post("/api/v1/review-queue/{id}/resolve", resolved.getId() + 1000)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/v1/review-queue/{id}/resolve", resolved.getId())
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    @DisplayName("Unknown field correction is 400")
    void unknownField() throws Exception {
        mockMvc.perform(put("/api/v1/tickets/{id}/fields/{field}", 1, "colour")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"blue\",\"correctedBy\":\"reviewer\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Queue statistics are available")
    void stats() throws Exception {
        mockMvc.perform(get("/api/v1/review-queue/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.openEntries").value(0));
    }
}
