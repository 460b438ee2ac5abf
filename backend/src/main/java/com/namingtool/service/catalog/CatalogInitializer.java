package com.namingtool.service.catalog;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Makes sure every built-in component exists once the application has started.
 */
@Slf4j
@Component
public class CatalogInitializer implements ApplicationRunner {

    private final ComponentCatalogService catalogService;

    public CatalogInitializer(ComponentCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @Override
    public void run(ApplicationArguments args) {
        int added = catalogService.ensureBuiltInComponents().size();
        if (added > 0) {
            log.info("Component catalog initialized, {} built-in component(s) added", added);
        }
    }
}
