package com.priceintel.backend.service;

import com.mongodb.MongoException;
import com.priceintel.backend.config.PriceIntelProperties;
import com.priceintel.backend.exception.LedgerWriteFailedException;
import com.priceintel.backend.model.CreditAccount;
import com.priceintel.backend.model.CreditLedgerEntry;
import com.priceintel.backend.model.LedgerReason;
import com.priceintel.backend.model.SubscriptionStatus;
import com.priceintel.backend.model.SubscriptionTier;
import com.priceintel.backend.repository.CreditAccountRepository;
import com.priceintel.backend.repository.CreditLedgerEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Append-only credit ledger with a per-owner account holding the denormalized balance,
 * the subscription period and in-flight quota reservations.
 */
@Service
public class CreditLedgerService {

    private static final Logger log = LoggerFactory.getLogger(CreditLedgerService.class);

    private static final String TRANSIENT_TRANSACTION_ERROR = "TransientTransactionError";
    private static final String UNKNOWN_COMMIT_RESULT = "UnknownTransactionCommitResult";

    private final CreditAccountRepository accountRepository;
    private final CreditLedgerEntryRepository ledgerRepository;
    private final SubscriptionTierCatalog tierCatalog;
    private final PriceIntelProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public CreditLedgerService(CreditAccountRepository accountRepository,
            CreditLedgerEntryRepository ledgerRepository,
            SubscriptionTierCatalog tierCatalog,
            PriceIntelProperties properties,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.accountRepository = accountRepository;
        this.ledgerRepository = ledgerRepository;
        this.tierCatalog = tierCatalog;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Whether the owner may consume one unit now: credits left, or tier allowance left.
     * Read-only, and not serialized with debits; submissions go through {@link #reserve}.
     */
    public boolean canConsume(String ownerId) {
        CreditAccount account = loadAccount(ownerId);
        return account.getBalance() > 0 || periodUsage(account) < tierFor(account).monthlyAnalysisLimit();
    }

    /**
     * Atomically claim one unit of headroom for a job about to be submitted.
     *
     * @return false when every unit of headroom is already consumed or claimed
     */
    public boolean reserve(String ownerId, String jobId) {
        requireId(ownerId, "ownerId");
        requireId(jobId, "jobId");

        return withWriteRetry("reserve credit", ownerId, () -> {
            Instant now = now();
            CreditAccount account = loadAccount(ownerId);
            account.getReservations().values().removeIf(expiry -> !expiry.isAfter(now));

            if (account.getReservations().containsKey(jobId)) {
                return true;
            }

            long headroom = Math.max(account.getBalance(),
                    tierFor(account).monthlyAnalysisLimit() - periodUsage(account));
            if (account.liveReservations(now) >= headroom) {
                log.warn("[LEDGER] Quota refused for owner: {} | Balance: {} | Headroom: {} | In flight: {}",
                        ownerId, account.getBalance(), headroom, account.getReservations().size());
                return false;
            }

            account.getReservations().put(jobId, now.plus(properties.getCredits().getReservationTtl()));
            account.setUpdatedAt(now);
            accountRepository.save(account);
            log.debug("[LEDGER] Reserved credit for job: {} owner: {}", jobId, ownerId);
            return true;
        });
    }

    /**
     * Drop a job's reservation. No-op when there is none.
     */
    public void release(String ownerId, String jobId) {
        withWriteRetry("release reservation", ownerId, () -> {
            CreditAccount account = accountRepository.findById(ownerId).orElse(null);
            if (account == null || account.getReservations().remove(jobId) == null) {
                return null;
            }
            account.setUpdatedAt(now());
            accountRepository.save(account);
            log.debug("[LEDGER] Released reservation for job: {} owner: {}", jobId, ownerId);
            return null;
        });
    }

    public CreditLedgerEntry debit(String ownerId, int amount, String jobId) {
        return debit(ownerId, amount, jobId, () -> {
        });
    }

    /**
     * Record the analysis debit for a completed job. {@code sameTransactionWrite} runs inside the
     * ledger transaction so the caller's own write commits or rolls back with the entry; it may run
     * more than once when the write is retried.
     *
     * @return the debit entry; the existing one if the job was already debited
     * @throws LedgerWriteFailedException when the entry cannot be written
     */
    public CreditLedgerEntry debit(String ownerId, int amount, String jobId, Runnable sameTransactionWrite) {
        requireId(ownerId, "ownerId");
        requireId(jobId, "jobId");
        if (amount <= 0) {
            throw new IllegalArgumentException("Debit amount must be positive: " + amount);
        }

        String entryId = CreditLedgerEntry.debitIdFor(jobId);

        return withWriteRetry("debit", ownerId, () -> transactionTemplate.execute(status -> {
            var existing = ledgerRepository.findById(entryId);
            if (existing.isPresent()) {
                log.info("[LEDGER] Job: {} already debited, skipping", jobId);
                return existing.get();
            }

            sameTransactionWrite.run();

            Instant now = now();
            CreditAccount account = loadAccount(ownerId);
            // Allowance-covered analyses are recorded with a zero delta so the balance never goes negative
            int delta = -Math.min(amount, Math.max(account.getBalance(), 0));
            int newBalance = account.getBalance() + delta;

            account.setBalance(newBalance);
            account.getReservations().remove(jobId);
            account.setUpdatedAt(now);
            accountRepository.save(account);

            CreditLedgerEntry entry = ledgerRepository.insert(CreditLedgerEntry.builder()
                    .id(entryId)
                    .ownerId(ownerId)
                    .amountDelta(delta)
                    .reason(LedgerReason.ANALYSIS_DEBIT)
                    .relatedJobId(jobId)
                    .balanceAfter(newBalance)
                    .timestamp(now)
                    .build());

            log.info("[LEDGER] Debit | Owner: {} | Job: {} | Delta: {} | Balance: {}",
                    ownerId, jobId, delta, newBalance);
            return entry;
        }));
    }

    /**
     * Add credits. Never subject to quota checks.
     */
    public CreditLedgerEntry grant(String ownerId, int amount, LedgerReason reason, String adminId) {
        requireId(ownerId, "ownerId");
        if (amount <= 0) {
            throw new IllegalArgumentException("Grant amount must be positive: " + amount);
        }
        if (reason == null || reason == LedgerReason.ANALYSIS_DEBIT) {
            throw new IllegalArgumentException("Invalid grant reason: " + reason);
        }

        return withWriteRetry("grant", ownerId, () -> transactionTemplate.execute(status -> {
            Instant now = now();
            CreditAccount account = loadAccount(ownerId);
            int newBalance = account.getBalance() + amount;
            account.setBalance(newBalance);
            account.setUpdatedAt(now);
            accountRepository.save(account);

            CreditLedgerEntry entry = ledgerRepository.insert(CreditLedgerEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .ownerId(ownerId)
                    .amountDelta(amount)
                    .reason(reason)
                    .adminId(adminId)
                    .balanceAfter(newBalance)
                    .timestamp(now)
                    .build());

            log.info("[LEDGER] Grant | Owner: {} | Amount: {} | Reason: {} | Admin: {} | Balance: {}",
                    ownerId, amount, reason, adminId, newBalance);
            return entry;
        }));
    }

    /**
     * Assign a tier. Activating starts a fresh monthly period with the balance set to the tier limit.
     */
    public CreditAccount assignSubscription(String ownerId, String tierId, SubscriptionStatus status) {
        requireId(ownerId, "ownerId");
        SubscriptionTier tier = tierCatalog.findById(tierId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown subscription tier: " + tierId));
        SubscriptionStatus newStatus = status != null ? status : SubscriptionStatus.ACTIVE;

        return withWriteRetry("assign subscription", ownerId, () -> transactionTemplate.execute(txStatus -> {
            Instant now = now();
            CreditAccount account = loadAccount(ownerId);
            account.setTierId(tier.id());
            account.setSubscriptionStatus(newStatus);

            if (newStatus == SubscriptionStatus.ACTIVE) {
                account.setPeriodStart(now);
                account.setPeriodEnd(plusOneMonth(now));
                resetBalanceToLimit(account, tier, now);
            }

            account.setUpdatedAt(now);
            CreditAccount saved = accountRepository.save(account);
            log.info("[LEDGER] Subscription | Owner: {} | Tier: {} | Status: {}", ownerId, tier.id(), newStatus);
            return saved;
        }));
    }

    /**
     * Roll every ended period forward. Active subscriptions get their balance set back to the tier limit.
     * Meant to be triggered by an external scheduler.
     *
     * @return number of accounts rolled over
     */
    public int periodicReset() {
        Instant now = now();
        List<CreditAccount> due = accountRepository.findByPeriodEndLessThanEqual(now);
        int reset = 0;
        LedgerWriteFailedException firstFailure = null;

        for (CreditAccount candidate : due) {
            try {
                if (resetAccount(candidate.getId(), now)) {
                    reset++;
                }
            } catch (LedgerWriteFailedException e) {
                log.error("[LEDGER] Periodic reset failed for owner: {}", candidate.getId(), e);
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        log.info("[LEDGER] Periodic reset rolled {} of {} due accounts", reset, due.size());
        if (firstFailure != null) {
            throw firstFailure;
        }
        return reset;
    }

    private boolean resetAccount(String ownerId, Instant now) {
        return withWriteRetry("periodic reset", ownerId, () -> transactionTemplate.execute(status -> {
            CreditAccount account = accountRepository.findById(ownerId).orElse(null);
            if (account == null || account.getPeriodEnd() == null || account.getPeriodEnd().isAfter(now)) {
                return false;
            }

            while (!account.getPeriodEnd().isAfter(now)) {
                account.setPeriodStart(account.getPeriodEnd());
                account.setPeriodEnd(plusOneMonth(account.getPeriodEnd()));
            }

            if (account.hasActiveSubscription()) {
                resetBalanceToLimit(account, tierFor(account), now);
            }

            account.setUpdatedAt(now);
            accountRepository.save(account);
            return true;
        }));
    }

    private void resetBalanceToLimit(CreditAccount account, SubscriptionTier tier, Instant now) {
        int delta = tier.monthlyAnalysisLimit() - account.getBalance();
        if (delta == 0) {
            return;
        }
        account.setBalance(tier.monthlyAnalysisLimit());
        ledgerRepository.insert(CreditLedgerEntry.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(account.getId())
                .amountDelta(delta)
                .reason(LedgerReason.SUBSCRIPTION_RESET)
                .balanceAfter(account.getBalance())
                .timestamp(now)
                .build());
    }

    public int getBalance(String ownerId) {
        return loadAccount(ownerId).getBalance();
    }

    /**
     * Compare the account's balance with the fold of its ledger entries.
     */
    public BalanceCheck verifyBalance(String ownerId) {
        int recorded = getBalance(ownerId);
        int folded = ledgerRepository.sumAmountDeltaByOwnerId(ownerId);
        if (recorded != folded) {
            log.error("[LEDGER] Balance drift for owner: {} | Account: {} | Ledger: {}", ownerId, recorded, folded);
        }
        return new BalanceCheck(ownerId, recorded, folded, recorded == folded);
    }

    public List<CreditLedgerEntry> getHistory(String ownerId) {
        return ledgerRepository.findTop100ByOwnerIdOrderByTimestampDesc(ownerId);
    }

    /**
     * The persisted account, or a fresh unsaved one on the default tier for the current month.
     */
    public CreditAccount loadAccount(String ownerId) {
        return accountRepository.findById(ownerId).orElseGet(() -> openAccount(ownerId));
    }

    public SubscriptionTier tierFor(CreditAccount account) {
        return account.hasActiveSubscription()
                ? tierCatalog.resolve(account.getTierId())
                : tierCatalog.getDefaultTier();
    }

    /**
     * Analysis debits recorded since the start of the period that contains now.
     */
    public long periodUsage(CreditAccount account) {
        return ledgerRepository.countByOwnerIdAndReasonAndTimestampGreaterThanEqual(
                account.getId(), LedgerReason.ANALYSIS_DEBIT, currentPeriod(account).start());
    }

    /**
     * The account's period that contains now. A stored period that has ended is rolled
     * forward by whole months here without being saved; {@link #periodicReset} persists it.
     */
    public BillingPeriod currentPeriod(CreditAccount account) {
        Instant now = now();
        Instant start = account.getPeriodStart();
        Instant end = account.getPeriodEnd();
        while (!end.isAfter(now)) {
            start = end;
            end = plusOneMonth(end);
        }
        return new BillingPeriod(start, end);
    }

    private CreditAccount openAccount(String ownerId) {
        Instant periodStart = now().atZone(ZoneOffset.UTC)
                .withDayOfMonth(1)
                .truncatedTo(ChronoUnit.DAYS)
                .toInstant();
        return CreditAccount.builder()
                .id(ownerId)
                .tierId(tierCatalog.getDefaultTier().id())
                .subscriptionStatus(SubscriptionStatus.NONE)
                .balance(0)
                .periodStart(periodStart)
                .periodEnd(plusOneMonth(periodStart))
                .build();
    }

    private <T> T withWriteRetry(String operation, String ownerId, Supplier<T> write) {
        int maxAttempts = Math.max(1, properties.getCredits().getMaxWriteAttempts());
        RuntimeException lastConflict = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return write.get();
            } catch (DuplicateKeyException | TransientDataAccessException e) {
                lastConflict = e;
            } catch (DataAccessException | TransactionException e) {
                if (!isTransientMongoFailure(e)) {
                    log.error("[LEDGER] Failed to {} for owner: {}", operation, ownerId, e);
                    throw new LedgerWriteFailedException("Failed to " + operation + " for owner " + ownerId, e);
                }
                lastConflict = e;
            }
            log.debug("[LEDGER] Write conflict on {} for owner: {} (attempt {}/{})",
                    operation, ownerId, attempt, maxAttempts);
        }

        log.error("[LEDGER] Gave up on {} for owner: {} after {} attempts", operation, ownerId, maxAttempts);
        throw new LedgerWriteFailedException(
                "Concurrent updates prevented " + operation + " for owner " + ownerId, lastConflict);
    }

    private static boolean isTransientMongoFailure(Throwable failure) {
        for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
            if (cause instanceof MongoException) {
                MongoException mongoException = (MongoException) cause;
                if (mongoException.hasErrorLabel(TRANSIENT_TRANSACTION_ERROR)
                        || mongoException.hasErrorLabel(UNKNOWN_COMMIT_RESULT)) {
                    return true;
                }
            }
        }
        return false;
    }

    private Instant now() {
        // Mongo stores millisecond precision
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static Instant plusOneMonth(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).plusMonths(1).toInstant();
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    public record BillingPeriod(Instant start, Instant end) {
    }

    public record BalanceCheck(String ownerId, int accountBalance, int ledgerBalance, boolean consistent) {
    }
}
