package com.rewardpick.refresh.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rewardpick.catalog.service.MalformedCatalogException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RefreshSchedulerTest {

    @Mock
    private RefreshOrchestrator refreshOrchestrator;

    private RefreshSchedulerProperties properties;
    private RefreshScheduler refreshScheduler;

    @BeforeEach
    void setUp() {
        properties = new RefreshSchedulerProperties();
        refreshScheduler = new RefreshScheduler(refreshOrchestrator, properties);
    }

    @Test
    void startup_should_refresh_without_fetch_by_default() {
        refreshScheduler.runAtStartup();

        verify(refreshOrchestrator).refresh("startup", false);
    }

    @Test
    void startup_should_be_skipped_when_disabled() {
        properties.setStartupEnabled(false);

        refreshScheduler.runAtStartup();

        verify(refreshOrchestrator, never()).refresh(anyString(), anyBoolean());
    }

    @Test
    void schedule_should_fetch_remote_only_when_enabled() {
        refreshScheduler.runBySchedule();
        verify(refreshOrchestrator, never()).refresh(anyString(), anyBoolean());

        properties.setScheduledEnabled(true);
        refreshScheduler.runBySchedule();
        verify(refreshOrchestrator).refresh("scheduled", true);
    }

    @Test
    void failed_or_overlapping_runs_should_not_escape_the_scheduler() {
        properties.setScheduledEnabled(true);
        when(refreshOrchestrator.refresh("scheduled", true))
            .thenThrow(new RefreshInProgressException("scheduled"))
            .thenThrow(new MalformedCatalogException(3, "rate 'lots' is not a number"));

        assertThatCode(refreshScheduler::runBySchedule).doesNotThrowAnyException();
        assertThatCode(refreshScheduler::runBySchedule).doesNotThrowAnyException();
    }
}
