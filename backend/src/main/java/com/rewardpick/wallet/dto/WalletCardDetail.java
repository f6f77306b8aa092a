package com.rewardpick.wallet.dto;

import java.time.LocalDate;
import java.util.Map;

/**
 * A held card joined with its catalog entry. {@code inCatalog} is false for cards that were
 * dropped from the catalog after being added; every catalog field is empty then.
 */
public record WalletCardDetail(
    String name,
    boolean inCatalog,
    String issuer,
    Map<String, Double> rewards,
    String bestCategory,
    Double bestRate,
    boolean activationRequired,
    LocalDate validUntil,
    boolean expired,
    String conditions,
    String annualFee
) {

    public static WalletCardDetail missing(String name) {
        return new WalletCardDetail(name, false, "", Map.of(), null, null, false, null, false, "", "");
    }
}
