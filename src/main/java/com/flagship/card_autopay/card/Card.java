package com.flagship.card_autopay.card;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A linked credit card: bank-sourced balance facts, automation config and connection state.
 *
 * Immutable. Every state change goes through a transition method that validates against
 * {@link ConnectionStatus#canTransitionTo} and returns a new instance; nothing else may
 * change the balance fields.
 */
@Value
@Builder(toBuilder = true)
public class Card {

    public static final BigDecimal DEFAULT_INTEREST_RATE = new BigDecimal("42.00");
    public static final BigDecimal DEFAULT_LATE_FEE = new BigDecimal("500.00");
    public static final int MAX_BUFFER_HOURS = 720;

    UUID id;
    String issuingBank;
    String networkBrand;
    String last4;

    BigDecimal creditLimit;
    BigDecimal currentBalance;
    BigDecimal minimumDue;
    BigDecimal totalDue;
    Instant paymentDueDate;
    /** Annual percentage rate, e.g. 42.00 for 42% p.a. */
    BigDecimal interestRate;
    BigDecimal lateFeeAmount;

    boolean automationEnabled;
    PaymentPreference paymentPreference;
    BigDecimal customAmount;
    int bufferHours;

    ConnectionStatus connectionStatus;
    Instant lastSync;
    Instant syncStartedAt;
    String lastSyncError;

    Long version;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a newly linked card in DISCONNECTED status with automation off.
     * It has no bank data until the first sync.
     *
     * @param interestRate annual rate; the default rate is used when null
     * @param lateFeeAmount late fee; the default fee is used when null
     * @return New Card instance with DISCONNECTED status
     * @throws IllegalArgumentException if last4 is not exactly four digits
     */
    public static Card register(UUID id, String issuingBank, String networkBrand, String last4,
                                BigDecimal creditLimit, BigDecimal interestRate, BigDecimal lateFeeAmount) {
        if (last4 == null || !last4.matches("\\d{4}")) {
            throw new IllegalArgumentException("last4 must be exactly four digits");
        }
        return Card.builder()
            .id(id)
            .issuingBank(issuingBank)
            .networkBrand(networkBrand)
            .last4(last4)
            .creditLimit(creditLimit)
            .currentBalance(BigDecimal.ZERO)
            .minimumDue(BigDecimal.ZERO)
            .totalDue(BigDecimal.ZERO)
            .interestRate(interestRate != null ? interestRate : DEFAULT_INTEREST_RATE)
            .lateFeeAmount(lateFeeAmount != null ? lateFeeAmount : DEFAULT_LATE_FEE)
            .automationEnabled(false)
            .paymentPreference(PaymentPreference.MINIMUM_DUE)
            .bufferHours(0)
            .connectionStatus(ConnectionStatus.DISCONNECTED)
            .build();
    }

    /**
     * Transitions card to SYNCING status.
     * Valid from DISCONNECTED, CONNECTED and ERROR status.
     *
     * @param now start of the sync, used to detect stuck syncs
     * @return New Card instance with SYNCING status
     * @throws AlreadySyncingException if a sync is already in flight
     */
    public Card beginSync(Instant now) {
        if (connectionStatus == ConnectionStatus.SYNCING) {
            throw new AlreadySyncingException(id);
        }
        requireTransition(ConnectionStatus.SYNCING);
        return toBuilder()
            .connectionStatus(ConnectionStatus.SYNCING)
            .syncStartedAt(now)
            .build();
    }

    /**
     * Transitions card to CONNECTED status, resolving an in-flight sync.
     * Only valid from SYNCING status. Balance facts are overwritten only when the
     * snapshot is newer than what the card already holds; a snapshot without
     * {@code asOf} is taken as of {@code now}.
     *
     * @return New Card instance with CONNECTED status
     * @throws IllegalStateException if transition is not allowed
     */
    public Card completeSync(CardSnapshot snapshot, Instant now) {
        requireTransition(ConnectionStatus.CONNECTED);
        CardSnapshot effective = snapshot.getAsOf() != null
            ? snapshot
            : snapshot.toBuilder().asOf(now).build();
        Card base = isNewerThanLastSync(effective.getAsOf()) ? withFacts(effective) : this;
        return base.toBuilder()
            .connectionStatus(ConnectionStatus.CONNECTED)
            .syncStartedAt(null)
            .lastSyncError(null)
            .build();
    }

    /**
     * Transitions card to ERROR status, resolving an in-flight sync as failed.
     * Only valid from SYNCING status. Balance facts are preserved.
     *
     * @param reason why the sync failed, shown as the card's last sync error
     * @return New Card instance with ERROR status
     * @throws IllegalStateException if transition is not allowed
     */
    public Card failSync(String reason) {
        requireTransition(ConnectionStatus.ERROR);
        return toBuilder()
            .connectionStatus(ConnectionStatus.ERROR)
            .syncStartedAt(null)
            .lastSyncError(reason)
            .build();
    }

    /**
     * Folds in balance facts from outside a sync (webhook metadata). The connection status is
     * left alone.
     *
     * @return the updated card, or this instance when the snapshot is not newer
     */
    public Card applySnapshot(CardSnapshot snapshot) {
        if (snapshot.getAsOf() == null || !isNewerThanLastSync(snapshot.getAsOf())) {
            return this;
        }
        return withFacts(snapshot);
    }

    public boolean isNewerThanLastSync(Instant asOf) {
        return lastSync == null || (asOf != null && asOf.isAfter(lastSync));
    }

    /**
     * Turns automatic payment on with the given preference and buffer.
     *
     * @param customAmount required and positive for CUSTOM_AMOUNT, ignored otherwise
     * @param bufferHours hours before the due date to pay, at most {@value #MAX_BUFFER_HOURS}
     * @return New Card instance with automation enabled
     * @throws InvalidPreferenceException if the settings are out of range
     */
    public Card enableAutomation(PaymentPreference preference, BigDecimal customAmount, int bufferHours) {
        if (preference == null) {
            throw new InvalidPreferenceException("Payment preference is required");
        }
        if (preference == PaymentPreference.CUSTOM_AMOUNT
                && (customAmount == null || customAmount.signum() <= 0)) {
            throw new InvalidPreferenceException("CUSTOM_AMOUNT requires a custom amount greater than zero");
        }
        if (bufferHours < 0 || bufferHours > MAX_BUFFER_HOURS) {
            throw new InvalidPreferenceException(
                "Buffer hours must be between 0 and " + MAX_BUFFER_HOURS + ", got " + bufferHours);
        }
        return toBuilder()
            .automationEnabled(true)
            .paymentPreference(preference)
            .customAmount(preference == PaymentPreference.CUSTOM_AMOUNT ? customAmount : null)
            .bufferHours(bufferHours)
            .build();
    }

    /**
     * Turns automatic payment off. The stored preference is kept for the next enable.
     *
     * @return New Card instance with automation disabled
     */
    public Card disableAutomation() {
        return toBuilder().automationEnabled(false).build();
    }

    private Card withFacts(CardSnapshot snapshot) {
        if (isNegative(snapshot.getMinimumDue()) || isNegative(snapshot.getTotalDue())) {
            throw new IllegalArgumentException("Snapshot for card " + id + " reports a negative due amount");
        }
        return toBuilder()
            .creditLimit(snapshot.getCreditLimit() != null ? snapshot.getCreditLimit() : creditLimit)
            .currentBalance(snapshot.getCurrentBalance() != null ? snapshot.getCurrentBalance() : currentBalance)
            .minimumDue(snapshot.getMinimumDue() != null ? snapshot.getMinimumDue() : minimumDue)
            .totalDue(snapshot.getTotalDue() != null ? snapshot.getTotalDue() : totalDue)
            .paymentDueDate(snapshot.getPaymentDueDate() != null ? snapshot.getPaymentDueDate() : paymentDueDate)
            .lastSync(snapshot.getAsOf())
            .build();
    }

    private void requireTransition(ConnectionStatus target) {
        if (!connectionStatus.canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                "Card %s cannot move from %s to %s", id, connectionStatus, target));
        }
    }

    private static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }
}
