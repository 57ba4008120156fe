package com.stereoselect;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Stereo Select Server
 * Selects stereo pairs and multilook groups from overlapping satellite scene footprints
 */
@SpringBootApplication
public class StereoSelectApplication {
    public static void main(String[] args) {
        SpringApplication.run(StereoSelectApplication.class, args);
    }
}
