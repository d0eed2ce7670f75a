package com.flagship.mpesa_bridge.audit;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Notion database that mirrors completed transactions. Mirroring is off while
 * either the API key or the database id is blank.
 */
@Data
@Component
@ConfigurationProperties(prefix = "notion")
public class NotionProperties {

    private String apiKey;

    private String databaseId;

    private String baseUrl = "https://api.notion.com/v1";

    /**
     * Value of the Notion-Version header.
     */
    private String version = "2022-06-28";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(30);

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank() && databaseId != null && !databaseId.isBlank();
    }
}
