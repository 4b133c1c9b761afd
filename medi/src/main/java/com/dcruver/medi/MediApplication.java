package com.dcruver.medi;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Main application class for medi.
 *
 * A local markdown note manager: notes and tasks live in an embedded key-value store,
 * and a Lucene index derived from it provides full-text search. Commands run through
 * Spring Shell, either interactively or as one-shot arguments ({@code medi search rust}).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class MediApplication {

    public static void main(String[] args) {
        log.debug("Starting medi...");
        SpringApplication.run(MediApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
