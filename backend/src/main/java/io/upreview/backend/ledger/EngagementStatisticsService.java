package io.upreview.backend.ledger;

import io.upreview.backend.business.BusinessAccessService;
import io.upreview.backend.multitenancy.TenantSessionContext;
import io.upreview.backend.security.CurrentPrincipal;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class EngagementStatisticsService {

  private final BusinessAccessService businessAccessService;
  private final TenantSessionContext tenantSessionContext;
  private final EngagementStatisticsRepository statisticsRepository;

  public EngagementStatisticsService(
      BusinessAccessService businessAccessService,
      TenantSessionContext tenantSessionContext,
      EngagementStatisticsRepository statisticsRepository) {
    this.businessAccessService = businessAccessService;
    this.tenantSessionContext = tenantSessionContext;
    this.statisticsRepository = statisticsRepository;
  }

  /** Owner-only view of the invitation funnel. */
  @Transactional(readOnly = true)
  public EngagementStatistics getStatistics(UUID businessId) {
    String actorId = CurrentPrincipal.requireId();
    tenantSessionContext.bindActor(actorId);
    businessAccessService.requireOwned(businessId, actorId);
    return statisticsRepository.load(businessId);
  }
}
