package com.rewardpick.refresh.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "catalog.refresh")
public class RefreshSchedulerProperties {

    /**
     * Build the index once after the application has started
     */
    private boolean startupEnabled = true;

    /**
     * Try the remote source during the startup refresh
     */
    private boolean startupFetch = false;

    /**
     * Periodic refresh with a remote fetch
     */
    private boolean scheduledEnabled = false;

    /**
     * 6-field spring cron (second minute hour day month weekday)
     */
    private String cron = "0 0 4 * * *";

    /**
     * Cron timezone
     */
    private String zone = "Asia/Taipei";
}
