package com.rewardpick.refresh.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final RefreshOrchestrator refreshOrchestrator;
    private final RefreshSchedulerProperties properties;

    public RefreshScheduler(RefreshOrchestrator refreshOrchestrator, RefreshSchedulerProperties properties) {
        this.refreshOrchestrator = refreshOrchestrator;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void runAtStartup() {
        if (!properties.isStartupEnabled()) {
            log.info("Startup catalog refresh skipped (startupEnabled=false)");
            return;
        }
        runRefresh("startup", properties.isStartupFetch());
    }

    @Scheduled(cron = "#{@refreshSchedulerProperties.cron}", zone = "#{@refreshSchedulerProperties.zone}")
    public void runBySchedule() {
        if (!properties.isScheduledEnabled()) {
            return;
        }
        runRefresh("scheduled", true);
    }

    void runRefresh(String trigger, boolean fetchRemote) {
        try {
            refreshOrchestrator.refresh(trigger, fetchRemote);
        } catch (RefreshInProgressException exception) {
            log.warn("Catalog refresh skipped because a previous refresh is still running (trigger={})", trigger);
        } catch (Exception exception) {
            log.warn("Catalog refresh failed (trigger={}): {}", trigger, exception.getMessage());
        }
    }
}
