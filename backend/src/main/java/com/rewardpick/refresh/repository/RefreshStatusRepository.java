package com.rewardpick.refresh.repository;

import com.rewardpick.refresh.entity.RefreshStatusEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RefreshStatusRepository extends JpaRepository<RefreshStatusEntity, String> {

    Optional<RefreshStatusEntity> findFirstByLastRunAtIsNotNullOrderByLastRunAtDesc();
}
