package com.example.metaindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Enabled with --reindex.on-startup=true: deletes the directory and origin metadata of the
 * current detector tool and reschedules every known origin.
 */
@Component
@ConditionalOnProperty(name = "reindex.on-startup", havingValue = "true")
public class ReindexRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ReindexRunner.class);

    @Autowired
    private ReindexService reindexService;

    @Override
    public void run(String... args) {
        log.info("ReindexRunner: starting full reindex");
        try {
            ReindexService.ReindexReport report = reindexService.reindexOrigins();
            log.info("ReindexRunner: scheduled {} origins with tool {}", report.runs().size(), report.toolId());
        } catch (RuntimeException e) {
            log.error("ReindexRunner: reindex failed: {}", e.getMessage(), e);
            throw e;
        }
    }
}
