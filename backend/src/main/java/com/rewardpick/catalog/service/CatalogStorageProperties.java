package com.rewardpick.catalog.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "catalog.storage")
public class CatalogStorageProperties {

    /**
     * Directory holding the single current catalog file
     */
    private String dataDir = "./data";

    /**
     * Directory holding prior catalog versions
     */
    private String backupDir = "./backups";

    /**
     * Number of prior versions kept; the oldest is evicted first
     */
    private int maxBackups = 30;

    /**
     * File name prefix, followed by the creation timestamp
     */
    private String filePrefix = "cards";

    /**
     * Classpath catalog served until a version has been promoted
     */
    private String bundledResource = "catalog/default-cards.csv";
}
