package com.rewardpick.catalog.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "catalog.remote")
public class RemoteCatalogProperties {

    private boolean enabled = false;

    /**
     * Spreadsheet or Drive file id of the shared catalog
     */
    private String fileId = "";

    private String sheetsBaseUrl = "https://docs.google.com/spreadsheets/d";

    private String driveBaseUrl = "https://drive.google.com/uc";

    private int connectTimeoutMs = 5000;

    private int readTimeoutMs = 30000;
}
