package org.consultation.delegation;

import org.consultation.bc.Transaction;
import org.consultation.bc.TransactionType;
import org.consultation.chain.Account;
import org.consultation.chain.Clock;
import org.consultation.chain.PresenceVerifier;
import org.consultation.chain.ReplayGuard;
import org.consultation.constants.ConfigKey;
import org.consultation.constants.Limits;
import org.consultation.db.KeyValueStore;
import org.consultation.db.StoreTransaction;
import org.consultation.errors.*;
import org.consultation.event.EventSink;
import org.consultation.event.EventType;
import org.consultation.event.GovernanceEvent;
import org.consultation.util.ConversionUtil;
import org.consultation.util.KeyedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.*;
import java.util.function.Supplier;

/**
 * Vote delegation registry.
 * <p>
 * Keeps two views of the same facts:
 * - DELEGATIONS:&lt;delegator&gt; holds the delegator's list of {@link Delegation}s (primary).
 * - DELEGATEE:&lt;delegatee&gt;:&lt;delegator&gt; holds the delegated fraction (reverse index).
 * <p>
 * Both are only ever written together by {@link #writeDelegation}, inside one store
 * transaction and under the delegator's lock. Expired entries are not swept; they
 * stop counting toward the cap and stay listed until replaced or removed.
 */
public class DelegationRegistry {

    private static final Logger log = LoggerFactory.getLogger(DelegationRegistry.class);

    private static final int MAX_FRACTION_SCALE = 18;

    private final KeyValueStore store;
    private final Clock clock;
    private final PresenceVerifier presenceVerifier;
    private final EventSink eventSink;
    private final KeyedLocks locks = new KeyedLocks();

    public DelegationRegistry(KeyValueStore store, Clock clock, PresenceVerifier presenceVerifier, EventSink eventSink) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.presenceVerifier = Objects.requireNonNull(presenceVerifier, "presenceVerifier must not be null");
        this.eventSink = eventSink == null ? EventSink.NONE : eventSink;
    }

    // ---- API: Mutations ----

    /**
     * Delegates {@code fraction} of the delegator's weight to {@code delegatee} until
     * {@code validUntil}, replacing any existing delegation to the same delegatee.
     *
     * @throws NotAuthorizedException delegator not proven present, or the transaction was already used
     * @throws ValidationException    fraction outside (0, 1], self delegation, validUntil not in
     *                                the future, or the delegator already holds the maximum number of entries
     * @throws CapExceededException   currently valid delegations plus {@code fraction} would exceed 1
     */
    public void makeDelegation(Transaction transaction, Account delegator, Account delegatee,
                               BigDecimal fraction, long validUntil) {
        guarded("makeDelegation", () -> {
            presenceVerifier.requirePresence(transaction, delegator, TransactionType.MAKE_DELEGATION);
            validateFraction(fraction);
            if (delegatee == null) {
                throw new ValidationException("Delegatee must not be null");
            }
            if (delegator.equals(delegatee)) {
                throw new ValidationException("Cannot delegate to yourself");
            }
            final long now = clock.now();
            if (validUntil <= now) {
                throw new ValidationException("Delegation must be valid for some time in the future");
            }

            boolean replaced = locks.withLocks(() -> store.inTransaction(tx -> {
                ReplayGuard.consume(tx, transaction);
                List<Delegation> delegations = loadDelegations(tx, delegator);

                BigDecimal committed = BigDecimal.ZERO;
                for (Delegation d : delegations) {
                    // the entry to the same delegatee is being replaced, not added to
                    if (d.isValidAt(now) && !d.getDelegatee().equals(delegatee)) {
                        committed = committed.add(d.getFraction());
                    }
                }
                if (committed.add(fraction).compareTo(BigDecimal.ONE) > 0) {
                    throw new CapExceededException("Total delegation cannot exceed 100% (already delegating "
                            + committed.toPlainString() + ")");
                }

                boolean existed = delegations.removeIf(d -> d.getDelegatee().equals(delegatee));
                if (!existed && delegations.size() >= Limits.MAX_DELEGATIONS) {
                    throw new ValidationException("Too many delegations (max " + Limits.MAX_DELEGATIONS + ")");
                }
                delegations.add(new Delegation(delegatee, fraction, validUntil));
                writeDelegation(tx, delegator, delegations, delegatee, fraction);
                return existed;
            }), ConfigKey.DELEGATIONS.key(delegator.getAddress()), ReplayGuard.lockKey(transaction));

            log.info("[DelegationRegistry] {} delegates {} to {} until {}{}", delegator, fraction.toPlainString(),
                    delegatee, validUntil, replaced ? " (replacing previous)" : "");
            publish(GovernanceEvent.builder(EventType.DELEGATION_CREATED, now)
                    .with("delegator", delegator)
                    .with("delegatee", delegatee)
                    .with("fraction", fraction.toPlainString())
                    .with("valid_until", validUntil)
                    .with("replaced", replaced)
                    .build());
            return null;
        });
    }

    /**
     * Removes the delegation from {@code delegator} to {@code delegatee}.
     *
     * @throws NotAuthorizedException delegator not proven present, or the transaction was already used
     * @throws NotFoundException      delegator has no delegations, or none to {@code delegatee}
     */
    public void removeDelegation(Transaction transaction, Account delegator, Account delegatee) {
        guarded("removeDelegation", () -> {
            presenceVerifier.requirePresence(transaction, delegator, TransactionType.REMOVE_DELEGATION);
            if (delegatee == null) {
                throw new ValidationException("Delegatee must not be null");
            }
            final long now = clock.now();

            locks.runWithLocks(() -> store.inTransaction(tx -> {
                ReplayGuard.consume(tx, transaction);
                List<Delegation> delegations = loadDelegations(tx, delegator);
                if (delegations.isEmpty()) {
                    throw new NotFoundException("No delegations found for this account");
                }
                if (!delegations.removeIf(d -> d.getDelegatee().equals(delegatee))) {
                    throw new NotFoundException("No delegation found to the specified delegatee");
                }
                writeDelegation(tx, delegator, delegations, delegatee, null);
                return null;
            }), ConfigKey.DELEGATIONS.key(delegator.getAddress()), ReplayGuard.lockKey(transaction));

            log.info("[DelegationRegistry] {} removed delegation to {}", delegator, delegatee);
            publish(GovernanceEvent.builder(EventType.DELEGATION_REMOVED, now)
                    .with("delegator", delegator)
                    .with("delegatee", delegatee)
                    .build());
            return null;
        });
    }

    // ---- API: Reads ----

    /**
     * Snapshot of every stored delegation of {@code delegator}, expired ones included,
     * in the order they were made. Empty if there are none.
     */
    public List<Delegation> getDelegations(Account delegator) {
        return store.read(tx -> loadDelegations(tx, delegator));
    }

    /**
     * Fraction delegated to {@code delegatee} by {@code delegator}, if recorded.
     */
    public Optional<BigDecimal> getDelegateeDelegators(Account delegatee, Account delegator) {
        return store.read(tx -> Optional.ofNullable(
                        tx.get(ConfigKey.DELEGATEE.key(delegatee.getAddress(), delegator.getAddress())))
                .map(BigDecimal::new));
    }

    /**
     * Every delegator of {@code delegatee} with the fraction it delegated.
     */
    public SortedMap<Account, BigDecimal> getDelegateeDelegators(Account delegatee) {
        return store.read(tx -> {
            String prefix = ConfigKey.DELEGATEE.prefix(delegatee.getAddress());
            SortedMap<Account, BigDecimal> delegators = new TreeMap<>();
            tx.scan(prefix).forEach((key, value) ->
                    delegators.put(Account.of(key.substring(prefix.length())), new BigDecimal(value)));
            return delegators;
        });
    }

    /**
     * Sum of the delegator's fractions that are still valid at the current time.
     */
    public BigDecimal getCommittedFraction(Account delegator) {
        final long now = clock.now();
        return getDelegations(delegator).stream()
                .filter(d -> d.isValidAt(now))
                .map(Delegation::getFraction)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    // ---- Helpers ----

    /**
     * The only writer of both views. Stores the delegator's new list (deleting the key
     * when empty) and sets, or with a {@code null} fraction deletes, the reverse entry.
     */
    private void writeDelegation(StoreTransaction tx, Account delegator, List<Delegation> delegations,
                                 Account delegatee, BigDecimal fraction) {
        String listKey = ConfigKey.DELEGATIONS.key(delegator.getAddress());
        if (delegations.isEmpty()) {
            tx.delete(listKey);
        } else {
            tx.put(listKey, ConversionUtil.toJson(delegations));
        }

        String reverseKey = ConfigKey.DELEGATEE.key(delegatee.getAddress(), delegator.getAddress());
        if (fraction == null) {
            tx.delete(reverseKey);
        } else {
            tx.put(reverseKey, fraction.toPlainString());
        }
    }

    private static List<Delegation> loadDelegations(StoreTransaction tx, Account delegator) {
        List<Delegation> list = ConversionUtil.jsonToList(
                tx.get(ConfigKey.DELEGATIONS.key(delegator.getAddress())), Delegation.class);
        return list != null ? new ArrayList<>(list) : new ArrayList<>();
    }

    private static void validateFraction(BigDecimal fraction) {
        if (fraction == null || fraction.signum() <= 0 || fraction.compareTo(BigDecimal.ONE) > 0) {
            throw new ValidationException("Fraction must be between 0 (exclusive) and 1 (inclusive)");
        }
        if (fraction.stripTrailingZeros().scale() > MAX_FRACTION_SCALE) {
            throw new ValidationException("Fraction supports at most " + MAX_FRACTION_SCALE + " decimal places");
        }
    }

    private <T> T guarded(String operation, Supplier<T> body) {
        try {
            return body.get();
        } catch (StorageException e) {
            log.error("[DelegationRegistry] {} failed: {}", operation, e.getMessage());
            throw e;
        } catch (ConsultationException e) {
            log.warn("[DelegationRegistry] {} rejected ({}): {}", operation, e.getKind(), e.getMessage());
            throw e;
        }
    }

    private void publish(GovernanceEvent event) {
        try {
            eventSink.publish(event);
        } catch (RuntimeException e) {
            log.warn("[DelegationRegistry] Event sink failed for {}: {}", event.getType(), e.getMessage());
        }
    }
}
