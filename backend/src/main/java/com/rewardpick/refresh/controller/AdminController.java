package com.rewardpick.refresh.controller;

import com.rewardpick.catalog.dto.CatalogVersionResponse;
import com.rewardpick.catalog.service.CatalogVersionStore;
import com.rewardpick.refresh.dto.RefreshReport;
import com.rewardpick.refresh.dto.SystemStatusResponse;
import com.rewardpick.refresh.service.RefreshOrchestrator;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final RefreshOrchestrator refreshOrchestrator;
    private final CatalogVersionStore catalogVersionStore;

    public AdminController(RefreshOrchestrator refreshOrchestrator, CatalogVersionStore catalogVersionStore) {
        this.refreshOrchestrator = refreshOrchestrator;
        this.catalogVersionStore = catalogVersionStore;
    }

    @PostMapping("/refresh")
    public RefreshReport refresh(@RequestParam(name = "fetch", defaultValue = "true") boolean fetch) {
        return refreshOrchestrator.refresh("admin-api", fetch);
    }

    @GetMapping("/status")
    public SystemStatusResponse getStatus() {
        return refreshOrchestrator.status();
    }

    @GetMapping("/catalog/versions")
    public List<CatalogVersionResponse> getVersions() {
        return catalogVersionStore.history();
    }
}
