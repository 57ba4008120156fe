package com.stereoselect.loader;

import com.stereoselect.loader.impl.FootprintLoaderImpl;
import com.stereoselect.loader.source.FootprintReader;
import com.stereoselect.loader.source.FootprintSource;
import com.stereoselect.loader.source.ReaderFactory;
import com.stereoselect.model.Footprint;
import com.stereoselect.repository.FootprintRepository;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.stereoselect.support.TestFootprints.footprint;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FootprintLoaderTest {

    @Mock
    private FootprintRepository footprintRepository;

    @Mock
    private ReaderFactory readerFactory;

    @Mock
    private FootprintReader footprintReader;

    @InjectMocks
    private FootprintLoaderImpl footprintLoader;

    @TempDir
    Path tempDir;

    @Test
    void testLoadIndexesEveryParsedFootprint() throws Exception {
        // Given
        Path file = Files.writeString(tempDir.resolve("scenes.geojson"), "{}");
        FootprintSource source = FootprintSource.of(FootprintSource.SourceType.FILE_GEOJSON, file.toString());
        List<Footprint> parsed = List.of(footprint("A", 0, 0, 1, 1), footprint("B", 0, 0, 2, 2));

        when(readerFactory.isSupported(FootprintSource.SourceType.FILE_GEOJSON)).thenReturn(true);
        when(readerFactory.getReader(FootprintSource.SourceType.FILE_GEOJSON)).thenReturn(footprintReader);
        when(footprintReader.read(source)).thenReturn(new FootprintReader.ReadResult(parsed, 1));

        // When
        FootprintLoader.LoadResult result = footprintLoader.loadFromSource(source).get();

        // Then
        assertTrue(result.isSuccess());
        assertEquals(2, result.getRecordsLoaded());
        assertEquals(1, result.getRecordsSkipped());
        assertNotNull(result.getMessage());
        verify(footprintRepository, times(1)).bulkIndex(parsed);
    }

    @Test
    void testMissingFileFailsWithoutReading() throws Exception {
        // Given
        FootprintSource source = FootprintSource.of(FootprintSource.SourceType.FILE_CSV,
                tempDir.resolve("missing.csv").toString());
        when(readerFactory.isSupported(FootprintSource.SourceType.FILE_CSV)).thenReturn(true);

        // When
        FootprintLoader.LoadResult result = footprintLoader.loadFromSource(source).get();

        // Then
        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().startsWith("File not found"));
        verify(readerFactory, never()).getReader(any());
        verifyNoInteractions(footprintRepository);
    }

    @Test
    void testUnreadableSourceIsReportedNotThrown() throws Exception {
        // Given
        Path file = Files.writeString(tempDir.resolve("broken.csv"), "id\n");
        FootprintSource source = FootprintSource.of(FootprintSource.SourceType.FILE_CSV, file.toString());

        when(readerFactory.isSupported(FootprintSource.SourceType.FILE_CSV)).thenReturn(true);
        when(readerFactory.getReader(FootprintSource.SourceType.FILE_CSV)).thenReturn(footprintReader);
        when(footprintReader.read(source)).thenThrow(new IOException("CSV has no 'geometry' or 'wkt' column"));

        // When
        FootprintLoader.LoadResult result = footprintLoader.loadFromSource(source).get();

        // Then
        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("geometry"));
        verifyNoInteractions(footprintRepository);
    }

    @Test
    void testUnsupportedTypeIsRejected() throws Exception {
        // Given
        FootprintSource source = FootprintSource.of(FootprintSource.SourceType.FILE_CSV, "scenes.csv");
        when(readerFactory.isSupported(FootprintSource.SourceType.FILE_CSV)).thenReturn(false);

        // When
        FootprintLoader.LoadResult result = footprintLoader.loadFromSource(source).get();

        // Then
        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().startsWith("Unsupported source type"));
    }
}
