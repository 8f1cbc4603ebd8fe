package com.flagship.card_autopay.webhook;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProcessedWebhookRepository extends JpaRepository<ProcessedWebhookEntity, String> {

    /** Audit trail of the callbacks that touched a payment. */
    List<ProcessedWebhookEntity> findByPaymentIdOrderByProcessedAtAsc(UUID paymentId);
}
