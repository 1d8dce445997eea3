package com.pixshare.controller;

import com.pixshare.model.Album;
import com.pixshare.service.DashboardService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/dashboard")
public class DashboardApiController {

    private final DashboardService dashboardService;

    public DashboardApiController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping("/storage")
    public ResponseEntity<DashboardService.StorageUsage> storage(HttpServletRequest request) {
        return ResponseEntity.ok(dashboardService.storageUsage(RequestCredentials.from(request)));
    }

    @GetMapping("/recent-albums")
    public ResponseEntity<List<Album>> recentAlbums(HttpServletRequest request) {
        return ResponseEntity.ok(dashboardService.recentAlbums(RequestCredentials.from(request)));
    }
}
