package com.rewardpick.wallet.repository;

import com.rewardpick.wallet.entity.UserCardEntity;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserCardRepository extends JpaRepository<UserCardEntity, UUID> {

    List<UserCardEntity> findByUserIdOrderByAddedAtAscCardNameAsc(String userId);

    Optional<UserCardEntity> findByUserIdAndCardName(String userId, String cardName);

    long deleteByUserId(String userId);
}
