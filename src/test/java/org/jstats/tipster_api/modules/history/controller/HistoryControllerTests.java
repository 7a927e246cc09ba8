package org.jstats.tipster_api.modules.history.controller;

import org.jstats.tipster_api.core.config.ProblemHandler;
import org.jstats.tipster_api.modules.history.model.HistoricalPrediction;
import org.jstats.tipster_api.modules.history.service.HistoryReconciler;
import org.jstats.tipster_api.modules.prediction.model.AliasSource;
import org.jstats.tipster_api.modules.prediction.model.CanonicalPredictionResult;
import org.jstats.tipster_api.modules.prediction.model.ConfidenceSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class HistoryControllerTests {

    HistoryReconciler reconciler;
    MockMvc mvc;

    @BeforeEach
    void setUp() {
        reconciler = mock(HistoryReconciler.class);
        mvc = MockMvcBuilders.standaloneSetup(new HistoryController(reconciler))
                .setControllerAdvice(new ProblemHandler())
                .build();
    }

    @Test
    void history_requiresABearerToken() throws Exception {
        mvc.perform(get("/api/predictions/history"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(reconciler);
    }

    @Test
    void history_returnsTheReconciledList() throws Exception {
        var result = new CanonicalPredictionResult("Draw", 0.31, null, "Form Cruncher", 3L,
                ConfidenceSource.PROB_DRAW, AliasSource.STORED_MODEL);
        when(reconciler.fetchHistory("tok")).thenReturn(List.of(
                new HistoricalPrediction(result, "Inter", "Milan", "2025-02-09", null, null, null, null)));

        mvc.perform(get("/api/predictions/history").header("Authorization", "Bearer tok"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].result.modelAlias").value("Form Cruncher"))
                .andExpect(jsonPath("$[0].homeTeam").value("Inter"));
    }

    @Test
    void rating_isForwarded() throws Exception {
        mvc.perform(post("/api/predictions/42/rating")
                        .header("Authorization", "Bearer tok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":5}"))
                .andExpect(status().isCreated());

        verify(reconciler).submitRating("tok", 42L, 5);
    }

    @Test
    void ratingOutOfRange_isBadRequest() throws Exception {
        mvc.perform(post("/api/predictions/42/rating")
                        .header("Authorization", "Bearer tok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":9}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(reconciler);
    }

    @Test
    void actualResult_isForwarded() throws Exception {
        mvc.perform(post("/api/predictions/42/result")
                        .header("Authorization", "Bearer tok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actualWinner\":\"Away Win\",\"actualMargin\":1}"))
                .andExpect(status().isCreated());

        verify(reconciler).submitActualResult("tok", 42L, "Away Win", 1);
    }
}
