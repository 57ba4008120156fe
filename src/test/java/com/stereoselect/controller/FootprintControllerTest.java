package com.stereoselect.controller;

import com.stereoselect.loader.FootprintLoader;
import com.stereoselect.loader.source.FootprintSource;
import com.stereoselect.model.result.ApiResponse;
import com.stereoselect.repository.FootprintRepository;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FootprintControllerTest {

    @Mock
    private FootprintLoader footprintLoader;

    @Mock
    private FootprintRepository footprintRepository;

    @InjectMocks
    private FootprintController controller;

    @Test
    void testLoadReportsCounts() throws Exception {
        // Given
        when(footprintLoader.loadFromSource(any(FootprintSource.class))).thenReturn(CompletableFuture.completedFuture(
                new FootprintLoader.LoadResult(true, 3, 2, 15, "Successfully loaded 3 footprints")));

        // When
        ResponseEntity<ApiResponse<Map<String, Object>>> response =
                controller.load(FootprintSource.SourceType.FILE_GEOJSON, "scenes.geojson").get();

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(3L, response.getBody().getData().get("records_loaded"));
        assertEquals(2L, response.getBody().getData().get("records_skipped"));
        assertEquals("15ms", response.getBody().getElapsed());
    }

    @Test
    void testFailedLoadIsBadRequest() throws Exception {
        // Given
        when(footprintLoader.loadFromSource(any(FootprintSource.class))).thenReturn(CompletableFuture.completedFuture(
                FootprintLoader.LoadResult.failure(0, "File not found: scenes.csv")));

        // When
        ResponseEntity<ApiResponse<Map<String, Object>>> response =
                controller.load(FootprintSource.SourceType.FILE_CSV, "scenes.csv").get();

        // Then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertFalse(response.getBody().getOk());
        assertEquals("File not found: scenes.csv", response.getBody().getError());
    }

    @Test
    void testStatsAndFlush() {
        // Given
        when(footprintRepository.count()).thenReturn(4L);
        when(footprintRepository.indexedCount()).thenReturn(3L);

        // When
        ResponseEntity<ApiResponse<Map<String, Object>>> stats = controller.stats();
        ResponseEntity<ApiResponse<Map<String, Object>>> flushed = controller.flush();

        // Then
        assertEquals(4L, stats.getBody().getData().get("footprints"));
        assertEquals(3L, stats.getBody().getData().get("indexed"));
        assertEquals(4L, flushed.getBody().getData().get("removed"));
        verify(footprintRepository).flushAll();
    }

    @Test
    void testUnknownFootprintIsNotFound() {
        when(footprintRepository.get("X")).thenReturn(Optional.empty());

        assertEquals(HttpStatus.NOT_FOUND, controller.get("X").getStatusCode());
    }
}
