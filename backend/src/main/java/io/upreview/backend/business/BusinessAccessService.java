package io.upreview.backend.business;

import io.upreview.backend.exception.ReviewFlowError;
import io.upreview.backend.exception.ReviewFlowException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Ownership checks for the authenticated business endpoints. */
@Service
public class BusinessAccessService {

  private static final Logger log = LoggerFactory.getLogger(BusinessAccessService.class);

  private final BusinessRepository businessRepository;
  private final EmailTemplateRepository emailTemplateRepository;

  public BusinessAccessService(
      BusinessRepository businessRepository, EmailTemplateRepository emailTemplateRepository) {
    this.businessRepository = businessRepository;
    this.emailTemplateRepository = emailTemplateRepository;
  }

  /**
   * @throws ReviewFlowException NOT_FOUND if the business does not exist, ACCESS_DENIED if the
   *     principal does not own it
   */
  @Transactional(readOnly = true)
  public Business requireOwned(UUID businessId, String principalId) {
    Business business =
        businessRepository
            .findById(businessId)
            .orElseThrow(
                () -> new ReviewFlowException(ReviewFlowError.NOT_FOUND, "Business not found."));
    if (!business.isOwnedBy(principalId)) {
      log.warn("Principal {} denied access to business {}", principalId, businessId);
      throw new ReviewFlowException(ReviewFlowError.ACCESS_DENIED);
    }
    return business;
  }

  /** Stored template, or the default wording when the business never saved one. */
  @Transactional(readOnly = true)
  public EmailTemplate templateFor(UUID businessId) {
    return emailTemplateRepository
        .findById(businessId)
        .orElseGet(() -> EmailTemplate.defaults(businessId));
  }
}
