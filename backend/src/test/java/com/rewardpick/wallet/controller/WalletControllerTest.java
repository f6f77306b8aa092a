package com.rewardpick.wallet.controller;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.rewardpick.config.SecurityConfig;
import com.rewardpick.wallet.dto.WalletCardDetail;
import com.rewardpick.wallet.dto.WalletDetailResponse;
import com.rewardpick.wallet.dto.WalletResponse;
import com.rewardpick.wallet.service.HeldCardService;
import com.rewardpick.wallet.service.UnknownCardException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = WalletController.class)
@Import(SecurityConfig.class)
class WalletControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HeldCardService heldCardService;

    @Test
    void add_card_should_return_updated_wallet() throws Exception {
        when(heldCardService.addCard("u1", "road saver"))
            .thenReturn(new WalletResponse("u1", List.of("Road Saver"), "Added 'Road Saver'"));

        mockMvc.perform(post("/api/users/u1/cards")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cardName\":\"road saver\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cards[0]").value("Road Saver"))
            .andExpect(jsonPath("$.message").value("Added 'Road Saver'"));
    }

    @Test
    void add_unknown_card_should_return_not_found_with_suggestions() throws Exception {
        when(heldCardService.addCard("u1", "Road Savr"))
            .thenThrow(new UnknownCardException("Road Savr", List.of("Road Saver")));

        mockMvc.perform(post("/api/users/u1/cards")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cardName\":\"Road Savr\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value(
                "Card 'Road Savr' is not in the catalog. Use the full card name. Did you mean: Road Saver?"
            ));
    }

    @Test
    void clear_should_report_removed_count() throws Exception {
        when(heldCardService.clearCards("u1")).thenReturn(new WalletResponse("u1", List.of(), "Removed 2 card(s)"));

        mockMvc.perform(delete("/api/users/u1/cards"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Removed 2 card(s)"));
    }

    @Test
    void get_cards_with_details_should_return_catalog_view() throws Exception {
        WalletCardDetail detail = new WalletCardDetail(
            "Road Saver", true, "Harbor Bank", Map.of("fuel", 3.0), "fuel", 3.0, true, LocalDate.of(2027, 6, 30), false, "", "NT$0"
        );
        when(heldCardService.getWalletDetails("u1"))
            .thenReturn(new WalletDetailResponse("u1", List.of(detail), "cards_v7.csv"));

        mockMvc.perform(get("/api/users/u1/cards").param("details", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.catalogVersionId").value("cards_v7.csv"))
            .andExpect(jsonPath("$.cards[0].name").value("Road Saver"))
            .andExpect(jsonPath("$.cards[0].bestCategory").value("fuel"))
            .andExpect(jsonPath("$.cards[0].rewards.fuel").value(3.0))
            .andExpect(jsonPath("$.cards[0].validUntil").value("2027-06-30"));
    }

    @Test
    void get_cards_without_details_should_return_names_only() throws Exception {
        when(heldCardService.getWallet("u1")).thenReturn(new WalletResponse("u1", List.of("Road Saver"), null));

        mockMvc.perform(get("/api/users/u1/cards"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cards[0]").value("Road Saver"));

        verify(heldCardService, never()).getWalletDetails("u1");
    }
}
