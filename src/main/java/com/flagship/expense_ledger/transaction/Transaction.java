package com.flagship.expense_ledger.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Transaction aggregate.
 *
 * Key principles:
 * - Immutable: every change (revise, delete) returns a new instance
 * - The activity log only grows; every create, update and delete appends one entry
 * - Deletion is soft: {@code deletedAt} is set and the row is kept as a tombstone
 */
@Value
@Builder(toBuilder = true)
public class Transaction {
    UUID id;
    UUID userId;
    TransactionType type;
    BigDecimal amount;
    PaymentMode paymentMode;
    String description;
    Instant date;
    Category category;
    List<Payer> payers;
    SplitDetails splitDetails;
    List<ActivityLogEntry> activityLog;
    Instant createdAt;
    Instant updatedAt;
    Instant deletedAt;

    /**
     * Creates a new transaction owned by {@code creator} from a validated draft.
     */
    public static Transaction create(UUID id, UUID creator, String creatorName,
                                     TransactionDraft draft, Instant now) {
        ActivityLogEntry created = new ActivityLogEntry(
            ActivityLogEntry.Action.CREATED, creator, creatorName, now);
        return Transaction.builder()
            .id(id)
            .userId(creator)
            .type(draft.getType())
            .amount(draft.getAmount())
            .paymentMode(draft.getPaymentMode())
            .description(draft.getDescription())
            .date(draft.getDate())
            .category(draft.getCategory())
            .payers(List.copyOf(draft.getPayers()))
            .splitDetails(draft.getSplitDetails())
            .activityLog(List.of(created))
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Applies an edit. Creator and id never change.
     *
     * @throws IllegalStateException if the transaction is already deleted
     */
    public Transaction revise(TransactionDraft draft, UUID actor, String actorName, Instant now) {
        if (isDeleted()) {
            throw new IllegalStateException(
                String.format("Cannot update transaction %s: it was deleted at %s", id, deletedAt));
        }
        return toBuilder()
            .type(draft.getType())
            .amount(draft.getAmount())
            .paymentMode(draft.getPaymentMode())
            .description(draft.getDescription())
            .date(draft.getDate())
            .category(draft.getCategory())
            .payers(List.copyOf(draft.getPayers()))
            .splitDetails(draft.getSplitDetails())
            .activityLog(appended(ActivityLogEntry.Action.UPDATED, actor, actorName, now))
            .updatedAt(now)
            .build();
    }

    /**
     * Soft-deletes the transaction. Deleting twice returns the same instance.
     */
    public Transaction markDeleted(UUID actor, String actorName, Instant now) {
        if (isDeleted()) {
            return this;
        }
        return toBuilder()
            .activityLog(appended(ActivityLogEntry.Action.DELETED, actor, actorName, now))
            .updatedAt(now)
            .deletedAt(now)
            .build();
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isShared() {
        return type == TransactionType.SHARED;
    }

    public Optional<SettlementTag> settlementTag() {
        return SettlementTag.parse(description);
    }

    /**
     * A settlement is a tagged personal/revenue transaction whose split names the counterparty.
     */
    public boolean isSettlement() {
        return type != TransactionType.SHARED
            && settlementTag().isPresent()
            && splitDetails != null
            && splitDetails.method() == SplitMethod.SETTLEMENT;
    }

    public Optional<UUID> settlementCounterparty() {
        if (!isSettlement() || splitDetails.participants().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(splitDetails.participants().get(0).userId());
    }

    /**
     * Creator, payers and split participants, in that order, without duplicates.
     */
    public Set<UUID> involvedUserIds() {
        Set<UUID> ids = new LinkedHashSet<>();
        ids.add(userId);
        getPayers().forEach(payer -> ids.add(payer.userId()));
        if (splitDetails != null) {
            splitDetails.participants().forEach(p -> ids.add(p.userId()));
        }
        return ids;
    }

    /**
     * Only the creator, a payer or a split participant may edit or delete.
     */
    public boolean isEditableBy(UUID actor) {
        return actor != null && involvedUserIds().contains(actor);
    }

    /**
     * Sum of what {@code user} paid towards this transaction.
     */
    public BigDecimal amountPaidBy(UUID user) {
        return getPayers().stream()
            .filter(payer -> payer.userId().equals(user))
            .map(Payer::amountPaid)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public List<Payer> getPayers() {
        return payers == null ? List.of() : payers;
    }

    public List<ActivityLogEntry> getActivityLog() {
        return activityLog == null ? List.of() : activityLog;
    }

    private List<ActivityLogEntry> appended(ActivityLogEntry.Action action, UUID actor,
                                            String actorName, Instant now) {
        List<ActivityLogEntry> entries = new ArrayList<>(getActivityLog());
        entries.add(new ActivityLogEntry(action, actor, actorName, now));
        return Collections.unmodifiableList(entries);
    }
}
