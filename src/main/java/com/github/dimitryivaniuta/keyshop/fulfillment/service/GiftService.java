package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Credential;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.CredentialOrigin;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.FulfillmentStep.StepType;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.OriginSource;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PendingGift;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PendingGiftStatus;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Plan;
import com.github.dimitryivaniuta.keyshop.fulfillment.notification.NotificationSink;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningErrorCode;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningException;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.PendingGiftRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.PlanRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.GiftDelivery;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.StepOutcome;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.interceptor.TransactionAspectSupport;

/**
 * Gifts: paid now, provisioned once the payer names a recipient.
 *
 * <p>The gift row is locked for the whole delivery, so two concurrent deliveries of one gift cannot both
 * provision. The credential belongs to the payer; the recipient's handle becomes its identity.</p>
 */
@Slf4j
@Service
public class GiftService {

    private final PendingGiftRepository repository;
    private final PlanRepository planRepository;
    private final CredentialService credentialService;
    private final ProvisioningErrorClassifier classifier;
    private final FulfillmentStepRecorder stepRecorder;
    private final NotificationSink notificationSink;
    private final Clock clock;

    public GiftService(
            PendingGiftRepository repository,
            PlanRepository planRepository,
            CredentialService credentialService,
            ProvisioningErrorClassifier classifier,
            FulfillmentStepRecorder stepRecorder,
            NotificationSink notificationSink,
            Clock clock
    ) {
        this.repository = repository;
        this.planRepository = planRepository;
        this.credentialService = credentialService;
        this.classifier = classifier;
        this.stepRecorder = stepRecorder;
        this.notificationSink = notificationSink;
        this.clock = clock;
    }

    /**
     * Stores a paid gift until a recipient is named. Holding the same payment twice changes nothing.
     *
     * @param md       gift order
     * @param days     days to grant
     * @param planName plan name at purchase time
     * @return true when a new gift was stored
     */
    @Transactional
    public boolean hold(OrderMetadata md, int days, String planName) {
        if (repository.existsById(md.paymentId())) {
            return false;
        }
        repository.save(PendingGift.awaiting(md.paymentId(), md.ownerId(), md.hostName(), md.planId(), planName,
                days, md.paymentMethod(), clock.instant()));
        return true;
    }

    /**
     * Provisions a held gift for the named recipient.
     *
     * @param paymentId       gift payment id
     * @param recipientHandle handle the credential will be issued under
     * @return delivery result
     */
    @Transactional
    public GiftDelivery deliver(String paymentId, String recipientHandle) {
        Optional<PendingGift> found = repository.findForUpdate(paymentId);
        if (found.isEmpty()) {
            return new GiftDelivery(paymentId, GiftDelivery.Status.NOT_FOUND, null, null);
        }
        PendingGift gift = found.get();
        if (gift.getStatus() == PendingGiftStatus.DELIVERED) {
            return new GiftDelivery(paymentId, GiftDelivery.Status.ALREADY_DELIVERED, gift.getCredentialId(), null);
        }

        Plan plan = gift.getPlanId() != null ? planRepository.findById(gift.getPlanId()).orElse(null) : null;
        CredentialOrigin origin = CredentialOrigin.of(OriginSource.GIFT, gift.getPlanId(), gift.getPlanName(), gift.getDays());
        try {
            Credential credential = credentialService.issue(gift.getPayerId(), gift.getHostName(), recipientHandle,
                    gift.getDays(), plan, origin);
            gift.markDelivered(credential.getId(), clock.instant());
            repository.save(gift);

            stepRecorder.record(paymentId, StepOutcome.applied(StepType.PROVISION,
                    "gift credential=" + credential.getId() + " identity=" + credential.getUniqueIdentity()));
            notificationSink.notifyPayer(gift.getPayerId(), "Gift key for " + credential.getUniqueIdentity()
                    + " is ready, valid until " + credential.getExpiresAt() + ".\n" + nullToEmpty(credential.getConnectionInfo()));
            log.info("Gift delivered paymentId={} credential={}", paymentId, credential.getId());
            return new GiftDelivery(paymentId, GiftDelivery.Status.DELIVERED, credential.getId(), null);
        } catch (ProvisioningException e) {
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
            ProvisioningErrorCode code = classifier.classify(e);
            log.warn("Gift delivery failed paymentId={} code={} detail={}", paymentId, code, e.getMessage());
            stepRecorder.record(paymentId, StepOutcome.failed(StepType.PROVISION, "gift " + code + ": " + e.getMessage()));
            notificationSink.notifyPayer(gift.getPayerId(), "Could not issue the gift key (" + code + "). "
                    + "The gift is still waiting; try another recipient.");
            notificationSink.notifyOperators("Gift delivery failed payment=" + paymentId + " payer=" + gift.getPayerId()
                    + " host=" + gift.getHostName() + " code=" + code + " detail=" + e.getMessage());
            return new GiftDelivery(paymentId, GiftDelivery.Status.FAILED, null, code.name());
        }
    }

    @Transactional(readOnly = true)
    public List<PendingGift> awaitingFor(long payerId) {
        return repository.findByPayerIdAndStatusOrderByCreatedAt(payerId, PendingGiftStatus.AWAITING_RECIPIENT);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
