package com.cred.freestyle.salesdata.config;

import com.cred.freestyle.salesdata.service.GenerationSummary;
import com.cred.freestyle.salesdata.service.SalesDataGenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Generates sales history once at startup when salesdata.generator.run-on-startup is set.
 * A failed run is logged; the application keeps running.
 *
 * @author Sales Data Team
 */
@Component
public class GenerationStartupRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(GenerationStartupRunner.class);

    private final SalesDataGenerationService generationService;
    private final SalesDataProperties properties;

    public GenerationStartupRunner(SalesDataGenerationService generationService, SalesDataProperties properties) {
        this.generationService = generationService;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        SalesDataProperties.Generator settings = properties.getGenerator();
        if (!settings.isRunOnStartup()) {
            logger.debug("Startup generation disabled");
            return;
        }

        logger.info("=== Generating sales history on startup (clearExisting: {}) ===", settings.isClearOnStartup());
        try {
            GenerationSummary summary = generationService.generate(settings.isClearOnStartup());
            logger.info("=== Startup generation done: {} ===", summary);
        } catch (RuntimeException e) {
            logger.error("Startup generation failed", e);
        }
    }
}
