package com.stereoselect.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Bean;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKTWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.stereoselect.config.serializer.GeometrySerializer;
import com.stereoselect.config.serializer.GeometryDeserializer;
import com.stereoselect.geometry.GeoJsonGeometries;
import com.stereoselect.model.OutputSchema;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Application configuration for stereo selection
 */
@Configuration
public class StereoSelectConfiguration {

    @Bean
    public GeometryFactory geometryFactory() {
        return new GeometryFactory();
    }

    @Bean
    public WKTWriter wktWriter() {
        return new WKTWriter();
    }

    @Bean
    public GeoJsonGeometries geoJsonGeometries(GeometryFactory geometryFactory) {
        return new GeoJsonGeometries(geometryFactory);
    }

    @Bean
    public OutputSchema outputSchema() {
        return OutputSchema.DEFAULT;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService selectionExecutor(SelectionProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.resolvedThreads(), runnable -> {
            Thread thread = new Thread(runnable, "selection-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ObjectMapper objectMapper(GeometryFactory geometryFactory) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // Register custom serializer and deserializer for Geometry objects
        SimpleModule geometryModule = new SimpleModule();
        geometryModule.addSerializer(Geometry.class, new GeometrySerializer());
        geometryModule.addDeserializer(Geometry.class, new GeometryDeserializer(geometryFactory));
        mapper.registerModule(geometryModule);

        return mapper;
    }
}
