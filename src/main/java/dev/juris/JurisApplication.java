package dev.juris;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Juris retrieval core.
 *
 * <p>Runs without a web server; hosts drive {@code ChunkingService} and {@code HybridSearchService}
 * in-process.
 */
@SpringBootApplication
public class JurisApplication {
    public static void main(String[] args) {
        SpringApplication.run(JurisApplication.class, args);
    }
}
