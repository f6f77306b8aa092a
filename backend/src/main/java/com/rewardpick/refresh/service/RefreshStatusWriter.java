package com.rewardpick.refresh.service;

import com.rewardpick.refresh.entity.RefreshStatusEntity;
import com.rewardpick.refresh.repository.RefreshStatusRepository;
import java.time.OffsetDateTime;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RefreshStatusWriter {

    private final RefreshStatusRepository refreshStatusRepository;

    public RefreshStatusWriter(RefreshStatusRepository refreshStatusRepository) {
        this.refreshStatusRepository = refreshStatusRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markSuccess(
        String trigger,
        String message,
        String versionId,
        int documentCount,
        int expiredCount,
        long durationMs,
        OffsetDateTime runAt
    ) {
        RefreshStatusEntity status = loadOrCreate(trigger);
        status.markSuccess(message, versionId, documentCount, expiredCount, durationMs, runAt);
        refreshStatusRepository.save(status);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailure(String trigger, String message, long durationMs, OffsetDateTime runAt) {
        RefreshStatusEntity status = loadOrCreate(trigger);
        status.markFailure(message, durationMs, runAt);
        refreshStatusRepository.save(status);
    }

    private RefreshStatusEntity loadOrCreate(String trigger) {
        return refreshStatusRepository.findById(trigger)
            .orElseGet(() -> new RefreshStatusEntity(trigger));
    }
}
