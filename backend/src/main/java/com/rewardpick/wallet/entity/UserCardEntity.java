package com.rewardpick.wallet.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.OffsetDateTime;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Entity
@Table(
    name = "user_card",
    uniqueConstraints = @UniqueConstraint(name = "uk_user_card", columnNames = {"user_id", "card_name"})
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserCardEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "card_name", nullable = false, length = 200)
    private String cardName;

    @Column(name = "added_at", nullable = false)
    private OffsetDateTime addedAt;

    public UserCardEntity(String userId, String cardName, OffsetDateTime addedAt) {
        this.userId = userId;
        this.cardName = cardName;
        this.addedAt = addedAt;
    }
}
