package com.rewardpick.wallet.dto;

import java.util.List;

public record WalletResponse(
    String userId,
    List<String> cards,
    String message
) {
}
