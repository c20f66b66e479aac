package com.dcruver.goldenset;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Golden Set Curator.
 *
 * Builds a deterministic, stratified benchmark of application specs: synthesize an
 * oversubscribed candidate pool, remove near duplicates, refill every stratum to
 * quota, enforce topic diversity, split and lock the result.
 *
 * The same configuration and seed always produce byte-identical artifacts.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class GoldenSetCuratorApplication {

    public static void main(String[] args) {
        log.info("Starting Golden Set Curator...");
        SpringApplication.run(GoldenSetCuratorApplication.class, args);
    }
}
