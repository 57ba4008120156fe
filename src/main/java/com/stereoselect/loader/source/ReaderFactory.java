package com.stereoselect.loader.source;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Factory selecting the footprint reader for a source type
 */
@Component
public class ReaderFactory {

    private final List<FootprintReader> readers;

    public ReaderFactory(List<FootprintReader> readers) {
        this.readers = readers;
    }

    /**
     * @throws IllegalArgumentException if no reader supports the type
     */
    public FootprintReader getReader(FootprintSource.SourceType type) {
        return readers.stream()
                .filter(reader -> reader.supports(type))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                    "No reader found for footprint source type: " + type));
    }

    public boolean isSupported(FootprintSource.SourceType type) {
        return readers.stream()
                .anyMatch(reader -> reader.supports(type));
    }
}
