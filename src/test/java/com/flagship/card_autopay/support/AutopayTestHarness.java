package com.flagship.card_autopay.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.card_autopay.automation.AutomationRuleEvaluator;
import com.flagship.card_autopay.automation.AutomationService;
import com.flagship.card_autopay.card.Card;
import com.flagship.card_autopay.card.CardRegistry;
import com.flagship.card_autopay.card.CardSnapshot;
import com.flagship.card_autopay.card.PaymentPreference;
import com.flagship.card_autopay.common.concurrency.EntityLockRegistry;
import com.flagship.card_autopay.common.concurrency.ExternalCallGuard;
import com.flagship.card_autopay.observability.AutopayMetrics;
import com.flagship.card_autopay.payment.PaymentLifecycleService;
import com.flagship.card_autopay.schedule.PaymentScheduler;
import com.flagship.card_autopay.sync.SyncCoordinator;
import com.flagship.card_autopay.webhook.ProcessedWebhookEntity;
import com.flagship.card_autopay.webhook.ProcessedWebhookRepository;
import com.flagship.card_autopay.webhook.WebhookDeduplicator;
import com.flagship.card_autopay.webhook.WebhookEventParser;
import com.flagship.card_autopay.webhook.WebhookReconciler;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Wires the real services over in-memory stores and stub adapters, the way the Spring context
 * wires them over JPA and the simulated adapters.
 */
public class AutopayTestHarness implements AutoCloseable {

    public static final Duration EXTERNAL_TIMEOUT = Duration.ofMillis(500);
    public static final Duration STUCK_THRESHOLD = Duration.ofMinutes(5);

    public final MutableClock clock;
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final AutopayMetrics metrics = new AutopayMetrics(meterRegistry);
    public final InMemoryCardStore cardStore = new InMemoryCardStore();
    public final InMemoryPaymentStore paymentStore = new InMemoryPaymentStore();
    public final InMemoryScheduledPaymentStore scheduleStore = new InMemoryScheduledPaymentStore();
    public final RecordingNotificationDispatcher notifications = new RecordingNotificationDispatcher();
    public final StubBankDataProvider bank = new StubBankDataProvider();
    public final StubPaymentGatewayClient gateway = new StubPaymentGatewayClient();
    public final EntityLockRegistry locks = new EntityLockRegistry(Duration.ofSeconds(5));
    public final ExternalCallGuard externalCalls;
    public final ObjectMapper objectMapper;

    public final CardRegistry cardRegistry;
    public final AutomationRuleEvaluator ruleEvaluator = new AutomationRuleEvaluator();
    public final PaymentLifecycleService lifecycle;
    public final PaymentScheduler scheduler;
    public final SyncCoordinator syncCoordinator;
    public final AutomationService automation;
    public final ProcessedWebhookRepository processedWebhooks;
    public final WebhookDeduplicator deduplicator;
    public final WebhookReconciler reconciler;

    private final ExecutorService syncExecutor = Executors.newFixedThreadPool(4);
    private final Map<String, ProcessedWebhookEntity> processedRows = new ConcurrentHashMap<>();

    public AutopayTestHarness(Instant now) {
        this.clock = new MutableClock(now);

        TimeLimiterConfig limits = TimeLimiterConfig.custom()
            .timeoutDuration(EXTERNAL_TIMEOUT)
            .cancelRunningFuture(true)
            .build();
        this.externalCalls = new ExternalCallGuard(TimeLimiterRegistry.of(limits), Executors.newCachedThreadPool());

        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        this.cardRegistry = new CardRegistry(cardStore, locks, clock);
        this.lifecycle = new PaymentLifecycleService(paymentStore, cardRegistry, ruleEvaluator, gateway,
            externalCalls, locks, notifications, metrics, clock);
        this.scheduler = new PaymentScheduler(scheduleStore, paymentStore, cardRegistry, ruleEvaluator,
            lifecycle, locks, notifications, metrics, clock);
        this.syncCoordinator = new SyncCoordinator(cardRegistry, bank, externalCalls, scheduler,
            notifications, metrics, syncExecutor, clock, STUCK_THRESHOLD);
        this.automation = new AutomationService(cardRegistry, scheduler);

        this.processedWebhooks = inMemoryProcessedWebhooks();
        this.deduplicator = new WebhookDeduplicator(processedWebhooks, Optional.empty(), metrics, Duration.ofHours(24));
        this.reconciler = new WebhookReconciler(new WebhookEventParser(objectMapper), deduplicator,
            lifecycle, cardRegistry, metrics);
    }

    /**
     * Registers a card and syncs it once with the given dues.
     */
    public Card connectedCard(BigDecimal minimumDue, BigDecimal totalDue, Instant dueDate) {
        Card card = cardRegistry.addCard("HDFC", "VISA", "4242", new BigDecimal("100000.00"), null, null);
        bank.willReturn(card.getId(), snapshot(minimumDue, totalDue, dueDate, clock.instant()));
        syncCoordinator.requestSync(card.getId());
        return cardRegistry.getCard(card.getId());
    }

    public Card automatedCard(BigDecimal minimumDue, BigDecimal totalDue, Instant dueDate,
                              PaymentPreference preference, int bufferHours) {
        Card card = connectedCard(minimumDue, totalDue, dueDate);
        automation.enable(card.getId(), preference, null, bufferHours);
        return cardRegistry.getCard(card.getId());
    }

    public static CardSnapshot snapshot(BigDecimal minimumDue, BigDecimal totalDue, Instant dueDate, Instant asOf) {
        return CardSnapshot.builder()
            .currentBalance(totalDue)
            .minimumDue(minimumDue)
            .totalDue(totalDue)
            .paymentDueDate(dueDate)
            .asOf(asOf)
            .build();
    }

    public double counter(String name, String... tags) {
        var counter = meterRegistry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0.0;
    }

    private ProcessedWebhookRepository inMemoryProcessedWebhooks() {
        ProcessedWebhookRepository repository = mock(ProcessedWebhookRepository.class);
        when(repository.existsById(anyString()))
            .thenAnswer(invocation -> processedRows.containsKey(invocation.<String>getArgument(0)));
        when(repository.saveAndFlush(any(ProcessedWebhookEntity.class))).thenAnswer(invocation -> {
            ProcessedWebhookEntity row = invocation.getArgument(0);
            if (processedRows.putIfAbsent(row.getEventId(), row) != null) {
                throw new DataIntegrityViolationException("duplicate event " + row.getEventId());
            }
            return row;
        });
        when(repository.findByPaymentIdOrderByProcessedAtAsc(any(UUID.class))).thenAnswer(invocation ->
            processedRows.values().stream()
                .filter(row -> invocation.getArgument(0).equals(row.getPaymentId()))
                .toList());
        return repository;
    }

    @Override
    public void close() {
        externalCalls.shutdown();
        syncExecutor.shutdownNow();
    }
}
