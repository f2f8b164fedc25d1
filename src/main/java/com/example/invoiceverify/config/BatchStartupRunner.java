package com.example.invoiceverify.config;

import com.example.invoiceverify.application.service.InvoiceProcessingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the whole batch once the context is ready when {@code invoice.batch.run-on-startup=true}.
 */
@Component
@ConditionalOnProperty(prefix = "invoice.batch", name = "run-on-startup", havingValue = "true")
public class BatchStartupRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchStartupRunner.class);

    private final InvoiceProcessingService processingService;

    public BatchStartupRunner(InvoiceProcessingService processingService) {
        this.processingService = processingService;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Running invoice batch on startup");
        processingService.runBatch();
    }
}
