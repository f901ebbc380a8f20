package com.chainwright.core.config;

import com.chainwright.core.catalog.ChainCatalog;
import com.chainwright.core.catalog.ChainCatalogLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogConfig {

    @Bean
    public ChainCatalog chainCatalog(ChainCatalogLoader loader, ChainwrightProperties properties) {
        return loader.load(properties.getCatalog().getLocation());
    }
}
