package com.rewardpick.wallet.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AddCardRequest(
    @NotBlank @Size(max = 200)
    String cardName
) {
}
