package com.rewardpick.wallet.dto;

import java.util.List;

public record WalletDetailResponse(
    String userId,
    List<WalletCardDetail> cards,
    String catalogVersionId
) {
}
