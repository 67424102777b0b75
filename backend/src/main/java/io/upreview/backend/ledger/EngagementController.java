package io.upreview.backend.ledger;

import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EngagementController {

  private final EngagementStatisticsService statisticsService;

  public EngagementController(EngagementStatisticsService statisticsService) {
    this.statisticsService = statisticsService;
  }

  @GetMapping("/api/businesses/{businessId}/engagement")
  public ResponseEntity<EngagementStatistics> getEngagement(@PathVariable UUID businessId) {
    return ResponseEntity.ok(statisticsService.getStatistics(businessId));
  }
}
