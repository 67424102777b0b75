package io.upreview.backend.invitation;

import io.upreview.backend.business.Business;
import io.upreview.backend.business.BusinessAccessService;
import io.upreview.backend.business.EmailTemplate;
import io.upreview.backend.exception.ReviewFlowError;
import io.upreview.backend.exception.ReviewFlowException;
import io.upreview.backend.integration.email.EmailMessage;
import io.upreview.backend.integration.email.EmailProvider;
import io.upreview.backend.integration.email.SendResult;
import io.upreview.backend.invitation.DispatchReport.Failed;
import io.upreview.backend.invitation.DispatchReport.Outcome;
import io.upreview.backend.invitation.DispatchReport.Sent;
import io.upreview.backend.ledger.RecipientActionLedger;
import io.upreview.backend.multitenancy.TenantSessionContext;
import io.upreview.backend.recipient.Recipient;
import io.upreview.backend.recipient.RecipientRepository;
import io.upreview.backend.security.CurrentPrincipal;
import io.upreview.backend.token.PreviewRecipient;
import io.upreview.backend.token.ReviewLinkProperties;
import io.upreview.backend.token.ReviewLinkTokenCodec;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Sends review invitations to a batch of recipients. Each recipient gets a freshly minted token and
 * its own email. An {@code INVITED} ledger event is written only after the provider accepted the
 * message, so a recipient whose email failed can never click through.
 */
@Service
public class InvitationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(InvitationDispatcher.class);
  static final String NO_EMAIL_REASON = "Recipient has no email address";
  static final String NOT_ACCEPTED_REASON = "Email provider did not accept the send request";
  static final String PROVIDER_ERROR_REASON = "Email provider request failed";
  static final String NOT_RECORDED_REASON = "Invitation could not be recorded";
  static final String NOT_PREPARED_REASON = "Invitation could not be prepared";

  private final BusinessAccessService businessAccessService;
  private final TenantSessionContext tenantSessionContext;
  private final RecipientRepository recipientRepository;
  private final ReviewLinkTokenCodec tokenCodec;
  private final ReviewLinkBuilder linkBuilder;
  private final InvitationEmailComposer composer;
  private final SenderAddressResolver senderAddressResolver;
  private final EmailProvider emailProvider;
  private final RecipientActionLedger ledger;
  private final ReviewLinkProperties properties;
  private final DispatchExecutor executor;
  private final TransactionOperations transactions;
  private final Clock clock;

  public InvitationDispatcher(
      BusinessAccessService businessAccessService,
      TenantSessionContext tenantSessionContext,
      RecipientRepository recipientRepository,
      ReviewLinkTokenCodec tokenCodec,
      ReviewLinkBuilder linkBuilder,
      InvitationEmailComposer composer,
      SenderAddressResolver senderAddressResolver,
      EmailProvider emailProvider,
      RecipientActionLedger ledger,
      ReviewLinkProperties properties,
      DispatchExecutor executor,
      TransactionOperations transactions,
      Clock clock) {
    this.businessAccessService = businessAccessService;
    this.tenantSessionContext = tenantSessionContext;
    this.recipientRepository = recipientRepository;
    this.tokenCodec = tokenCodec;
    this.linkBuilder = linkBuilder;
    this.composer = composer;
    this.senderAddressResolver = senderAddressResolver;
    this.emailProvider = emailProvider;
    this.ledger = ledger;
    this.properties = properties;
    this.executor = executor;
    this.transactions = transactions;
    this.clock = clock;
  }

  /**
   * Invites every requested recipient of the business. Per-recipient failures are reported, never
   * thrown.
   *
   * @throws ReviewFlowException NOT_FOUND or ACCESS_DENIED if the caller does not own the business
   */
  public DispatchReport dispatchBatch(UUID businessId, List<UUID> recipientIds) {
    String actorId = CurrentPrincipal.requireId();
    List<UUID> requested = List.copyOf(new LinkedHashSet<>(recipientIds));

    BatchContext batch =
        transactions.execute(
            status -> {
              tenantSessionContext.bindActor(actorId);
              Business business = businessAccessService.requireOwned(businessId, actorId);
              Map<UUID, Recipient> found =
                  recipientRepository.findByBusinessIdAndIdIn(businessId, requested).stream()
                      .collect(Collectors.toMap(Recipient::getId, Function.identity()));
              return new BatchContext(
                  business,
                  businessAccessService.templateFor(businessId),
                  senderAddressResolver.resolve(business),
                  found);
            });

    List<UUID> missing = new ArrayList<>();
    Queue<Recipient> queue = new ConcurrentLinkedQueue<>();
    for (UUID id : requested) {
      Recipient recipient = batch.recipients().get(id);
      if (recipient == null) {
        missing.add(id);
      } else {
        queue.add(recipient);
      }
    }

    Map<UUID, Outcome> outcomes = new ConcurrentHashMap<>();
    int workers = Math.min(properties.dispatchConcurrency(), queue.size());
    List<Future<?>> futures = new ArrayList<>(workers);
    for (int i = 0; i < workers; i++) {
      futures.add(
          executor.submit(
              () -> {
                Recipient recipient;
                while ((recipient = queue.poll()) != null) {
                  outcomes.put(recipient.getId(), deliver(batch, recipient, actorId));
                }
              }));
    }
    awaitAll(futures);

    List<Sent> sent = new ArrayList<>();
    List<Failed> failed = new ArrayList<>();
    for (UUID id : requested) {
      Outcome outcome = outcomes.get(id);
      if (outcome instanceof Sent s) {
        sent.add(s);
      } else if (outcome instanceof Failed f) {
        failed.add(f);
      }
    }

    log.info(
        "Invitation batch for business={}: sent={} failed={} missing={}",
        businessId,
        sent.size(),
        failed.size(),
        missing.size());
    return new DispatchReport(sent, failed, missing, batch.sender().header());
  }

  /**
   * Sends the business's template to an arbitrary address with a preview link. Writes nothing to
   * the ledger.
   *
   * @throws ReviewFlowException DELIVERY_FAILED if the provider rejects the message
   */
  public PreviewResult sendPreview(UUID businessId, String toEmail) {
    String actorId = CurrentPrincipal.requireId();
    BatchContext context =
        transactions.execute(
            status -> {
              tenantSessionContext.bindActor(actorId);
              Business business = businessAccessService.requireOwned(businessId, actorId);
              return new BatchContext(
                  business,
                  businessAccessService.templateFor(businessId),
                  senderAddressResolver.resolve(business),
                  Map.of());
            });

    String token = tokenCodec.mint(businessId, PreviewRecipient.ID, properties.ttl());
    ReviewLinks links = linkBuilder.build(businessId, PreviewRecipient.ID, token);
    ComposedEmail email =
        composer.compose(
            context.sender().name(),
            InvitationEmailComposer.DEFAULT_CUSTOMER_NAME,
            context.template(),
            links);

    SendResult result =
        emailProvider.sendEmail(
            toMessage(context.sender(), toEmail, email, businessId, PreviewRecipient.ID));
    if (!result.success()) {
      log.error(
          "Preview email for business={} via {} failed: {}",
          businessId,
          emailProvider.providerId(),
          result.errorMessage());
      throw new ReviewFlowException(ReviewFlowError.DELIVERY_FAILED);
    }
    log.info("Preview email for business={} sent", businessId);
    return new PreviewResult(result.providerMessageId(), context.sender().header());
  }

  private Outcome deliver(BatchContext batch, Recipient recipient, String actorId) {
    UUID businessId = batch.business().getId();
    UUID recipientId = recipient.getId();
    try {
      if (!recipient.hasEmail()) {
        return new Failed(recipientId, NO_EMAIL_REASON);
      }
      Instant expiresAt = clock.instant().plus(properties.ttl());
      String token = tokenCodec.mintUntil(businessId, recipientId.toString(), expiresAt);
      ReviewLinks links = linkBuilder.build(businessId, recipientId.toString(), token);
      ComposedEmail email =
          composer.compose(
              batch.sender().name(), recipient.getDisplayName(), batch.template(), links);

      SendResult result;
      try {
        result =
            emailProvider.sendEmail(
                toMessage(
                    batch.sender(),
                    recipient.getEmail(),
                    email,
                    businessId,
                    recipientId.toString()));
      } catch (RuntimeException e) {
        log.warn("Email provider failed for recipient={}", recipientId, e);
        return new Failed(recipientId, PROVIDER_ERROR_REASON);
      }
      // a send without a provider message id is not treated as delivered
      if (!result.success() || result.providerMessageId() == null) {
        String reason = result.errorMessage() != null ? result.errorMessage() : NOT_ACCEPTED_REASON;
        log.warn("Invitation to recipient={} not delivered: {}", recipientId, reason);
        return new Failed(recipientId, reason);
      }

      Map<String, Object> meta = new HashMap<>();
      meta.put("email", recipient.getEmail());
      meta.put("subject", email.subject());
      meta.put("expiresAt", expiresAt.toEpochMilli());
      meta.put("messageId", result.providerMessageId());
      try {
        transactions.executeWithoutResult(
            status -> {
              tenantSessionContext.bindActor(actorId);
              ledger.recordInvitation(businessId, recipientId, actorId, meta);
            });
      } catch (RuntimeException e) {
        log.warn(
            "Invitation to recipient={} sent as {} but not recorded",
            recipientId,
            result.providerMessageId(),
            e);
        return new Failed(recipientId, NOT_RECORDED_REASON);
      }
      return new Sent(recipientId, recipient.getEmail());
    } catch (RuntimeException e) {
      log.warn("Invitation to recipient={} failed", recipientId, e);
      return new Failed(recipientId, NOT_PREPARED_REASON);
    }
  }

  private static EmailMessage toMessage(
      SenderAddress sender, String to, ComposedEmail email, UUID businessId, String recipientId) {
    return new EmailMessage(
        sender.name(),
        sender.address(),
        to,
        email.subject(),
        email.htmlBody(),
        email.plainTextBody(),
        Map.of("businessId", businessId.toString(), "recipientId", recipientId));
  }

  private static void awaitAll(List<Future<?>> futures) {
    for (Future<?> future : futures) {
      try {
        future.get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while dispatching invitations", e);
      } catch (ExecutionException e) {
        throw new IllegalStateException("Invitation worker failed", e.getCause());
      }
    }
  }

  private record BatchContext(
      Business business,
      EmailTemplate template,
      SenderAddress sender,
      Map<UUID, Recipient> recipients) {}
}
