package com.rewardpick.wallet.controller;

import com.rewardpick.wallet.dto.AddCardRequest;
import com.rewardpick.wallet.dto.WalletDetailResponse;
import com.rewardpick.wallet.dto.WalletResponse;
import com.rewardpick.wallet.service.HeldCardService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users/{userId}/cards")
public class WalletController {

    private final HeldCardService heldCardService;

    public WalletController(HeldCardService heldCardService) {
        this.heldCardService = heldCardService;
    }

    @GetMapping
    public WalletResponse getCards(@PathVariable String userId) {
        return heldCardService.getWallet(userId);
    }

    @GetMapping(params = "details=true")
    public WalletDetailResponse getCardDetails(@PathVariable String userId) {
        return heldCardService.getWalletDetails(userId);
    }

    @PostMapping
    public WalletResponse addCard(@PathVariable String userId, @Valid @RequestBody AddCardRequest request) {
        return heldCardService.addCard(userId, request.cardName());
    }

    @DeleteMapping("/{cardName}")
    public WalletResponse removeCard(@PathVariable String userId, @PathVariable String cardName) {
        return heldCardService.removeCard(userId, cardName);
    }

    @DeleteMapping
    public WalletResponse clearCards(@PathVariable String userId) {
        return heldCardService.clearCards(userId);
    }
}
