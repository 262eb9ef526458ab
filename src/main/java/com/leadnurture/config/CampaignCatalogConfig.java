package com.leadnurture.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadnurture.service.CampaignCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;

@Configuration
public class CampaignCatalogConfig {

    /**
     * Loads the campaign table once; a malformed catalog stops the application
     * from starting rather than sending the wrong sequence.
     */
    @Bean
    public CampaignCatalog campaignCatalog(ObjectMapper objectMapper, NurtureProperties properties) throws IOException {
        ClassPathResource resource = new ClassPathResource(properties.getCampaign().getCatalog());
        try (InputStream in = resource.getInputStream()) {
            return CampaignCatalog.load(in, objectMapper);
        }
    }
}
