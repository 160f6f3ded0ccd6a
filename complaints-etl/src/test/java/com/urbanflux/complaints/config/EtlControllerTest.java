package com.urbanflux.complaints.config;

import com.urbanflux.complaints.model.EtlMode;
import com.urbanflux.complaints.model.EtlRun;
import com.urbanflux.complaints.model.EtlStats;
import com.urbanflux.complaints.model.RunStatus;
import com.urbanflux.complaints.model.Watermark;
import com.urbanflux.complaints.output.RunTracker;
import com.urbanflux.complaints.output.ServiceRequestLoader;
import com.urbanflux.complaints.service.EtlPipelineService;
import com.urbanflux.complaints.service.EtlRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EtlController.class)
@Import(EtlProperties.class)
@DisplayName("EtlController Tests")
class EtlControllerTest {

    private static final OffsetDateTime T0 = OffsetDateTime.of(2025, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EtlPipelineService pipelineService;

    @MockBean
    private RunTracker runTracker;

    @MockBean
    private ServiceRequestLoader loader;

    @Test
    @DisplayName("Should accept a run and start it in the background")
    void shouldAcceptRun() throws Exception {
        mockMvc.perform(post("/etl/run")
                .param("mode", "incremental")
                .param("input", "/data/311.csv")
                .param("chunkSize", "500"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.mode").value("incremental"))
            .andExpect(jsonPath("$.input").value("/data/311.csv"));

        ArgumentCaptor<EtlRequest> request = ArgumentCaptor.forClass(EtlRequest.class);
        verify(pipelineService, timeout(2000)).run(request.capture());
        assertThat(request.getValue()).isEqualTo(new EtlRequest(EtlMode.INCREMENTAL, "/data/311.csv", 500, false));
    }

    @Test
    @DisplayName("Should reject an unknown mode")
    void shouldRejectBadMode() throws Exception {
        mockMvc.perform(post("/etl/run").param("mode", "partial").param("input", "/data/311.csv"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value(containsString("partial")));

        verify(pipelineService, never()).run(any());
    }

    @Test
    @DisplayName("Should reject a run without any input configured")
    void shouldRejectMissingInput() throws Exception {
        mockMvc.perform(post("/etl/run").param("mode", "full"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should refuse to start while a run is in progress")
    void shouldConflictWhileRunning() throws Exception {
        when(pipelineService.isRunning()).thenReturn(true);

        mockMvc.perform(post("/etl/run").param("input", "/data/311.csv"))
            .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Should only accept a stop while running")
    void shouldStop() throws Exception {
        mockMvc.perform(post("/etl/stop")).andExpect(status().isConflict());

        when(pipelineService.isRunning()).thenReturn(true);
        mockMvc.perform(post("/etl/stop")).andExpect(status().isAccepted());
        verify(pipelineService).requestStop();
    }

    @Test
    @DisplayName("Should return the latest run or 404")
    void shouldReturnLatestRun() throws Exception {
        mockMvc.perform(get("/etl/runs/latest")).andExpect(status().isNotFound());

        UUID runId = UUID.randomUUID();
        when(runTracker.latestRun()).thenReturn(Optional.of(EtlRun.builder()
            .runId(runId)
            .runMode(EtlMode.FULL)
            .status(RunStatus.COMPLETED)
            .startedAt(T0)
            .stats(EtlStats.builder().rowsInserted(12).build())
            .build()));

        mockMvc.perform(get("/etl/runs/latest"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.runId").value(runId.toString()))
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.stats.rowsInserted").value(12));
    }

    @Test
    @DisplayName("Should return the resume point or 404")
    void shouldReturnWatermark() throws Exception {
        mockMvc.perform(get("/etl/watermark")).andExpect(status().isNotFound());

        when(runTracker.lastWatermark()).thenReturn(Optional.of(
            new Watermark(UUID.randomUUID(), T0, 42L, EtlMode.INCREMENTAL)));

        mockMvc.perform(get("/etl/watermark"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.lastUniqueKey").value(42))
            .andExpect(jsonPath("$.runMode").value("INCREMENTAL"))
            .andExpect(jsonPath("$.bounded").doesNotExist());
    }

    @Test
    @DisplayName("Should report store contents and whether a run is active")
    void shouldReportStatus() throws Exception {
        when(loader.count()).thenReturn(1234L);
        when(loader.latestCreatedAt()).thenReturn(T0);

        mockMvc.perform(get("/etl/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false))
            .andExpect(jsonPath("$.recordsInStore").value(1234));
    }
}
