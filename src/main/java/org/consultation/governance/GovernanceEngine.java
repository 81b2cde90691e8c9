package org.consultation.governance;

import org.consultation.bc.Transaction;
import org.consultation.bc.TransactionType;
import org.consultation.chain.Account;
import org.consultation.chain.Clock;
import org.consultation.chain.PresenceVerifier;
import org.consultation.chain.PrivilegedCallGate;
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
import org.consultation.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/**
 * Temperature check and proposal lifecycle.
 * <p>
 * Responsibilities:
 * - Creates temperature checks from drafts, snapshotting the temperature-check tier parameters.
 * - Records exactly one For/Against vote per account while a check is open.
 * - Elevates a temperature check to a proposal at most once (owner only).
 * - Records exactly one option-set vote per account while a proposal is open.
 * - Holds the live parameter set used for future ballots (owner updates only).
 * <p>
 * Every public mutation is one store transaction run under the per-ballot lock,
 * so the "already voted" and "already elevated" checks always see the latest
 * committed state. Storage keys are listed in {@link ConfigKey}.
 */
public class GovernanceEngine {

    private static final Logger log = LoggerFactory.getLogger(GovernanceEngine.class);

    private final KeyValueStore store;
    private final Clock clock;
    private final PresenceVerifier presenceVerifier;
    private final PrivilegedCallGate privilegedCallGate;
    private final EventSink eventSink;
    private final KeyedLocks locks = new KeyedLocks();

    // ---- Construction ----

    /**
     * Seeds the store with {@code initialParameters} and zero counters when it holds
     * none yet; an existing parameter set is kept.
     */
    public GovernanceEngine(KeyValueStore store,
                            GovernanceParameters initialParameters,
                            Clock clock,
                            PresenceVerifier presenceVerifier,
                            PrivilegedCallGate privilegedCallGate,
                            EventSink eventSink) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.presenceVerifier = Objects.requireNonNull(presenceVerifier, "presenceVerifier must not be null");
        this.privilegedCallGate = Objects.requireNonNull(privilegedCallGate, "privilegedCallGate must not be null");
        this.eventSink = eventSink == null ? EventSink.NONE : eventSink;

        Objects.requireNonNull(initialParameters, "initialParameters must not be null").validate();
        store.inTransaction(tx -> {
            if (tx.get(ConfigKey.GOVERNANCE_PARAMETERS.key()) == null) {
                tx.put(ConfigKey.GOVERNANCE_PARAMETERS.key(), ConversionUtil.toJson(initialParameters));
            }
            if (tx.get(ConfigKey.TEMPERATURE_CHECK_COUNT.key()) == null) {
                tx.put(ConfigKey.TEMPERATURE_CHECK_COUNT.key(), "0");
            }
            if (tx.get(ConfigKey.PROPOSAL_COUNT.key()) == null) {
                tx.put(ConfigKey.PROPOSAL_COUNT.key(), "0");
            }
            return null;
        });
    }

    // ---- API: Temperature checks ----

    /**
     * Creates a temperature check opening now and closing after the configured
     * number of temperature-check days.
     *
     * @return the new, sequentially assigned id (first is 0)
     * @throws ValidationException if the draft is malformed
     */
    public long makeTemperatureCheck(TemperatureCheckDraft draft) {
        return guarded("makeTemperatureCheck", () -> {
            validateDraft(draft);
            final long now = clock.now();

            TemperatureCheck created = locks.withLocks(() -> store.inTransaction(tx -> {
                long id = readCounter(tx, ConfigKey.TEMPERATURE_CHECK_COUNT);
                GovernanceParameters params = readParameters(tx);
                long deadline = deadlineAfter(now, params.getTemperatureCheckDays());

                TemperatureCheck tc = new TemperatureCheck(id, draft,
                        params.getTemperatureCheckQuorum(),
                        params.getTemperatureCheckApprovalThreshold(),
                        now, deadline);

                tx.put(ConfigKey.TEMPERATURE_CHECK.key(id), ConversionUtil.toJson(tc));
                tx.put(ConfigKey.TEMPERATURE_CHECK_COUNT.key(), Long.toString(id + 1));
                return tc;
            }), ConfigKey.TEMPERATURE_CHECK_COUNT.key());

            log.info("[GovernanceEngine] Temperature check {} created, open until {}", created.getId(), created.getDeadline());
            publish(GovernanceEvent.builder(EventType.TEMPERATURE_CHECK_CREATED, now)
                    .with("temperature_check_id", created.getId())
                    .with("title", created.getTitle())
                    .with("start", created.getStart())
                    .with("deadline", created.getDeadline())
                    .with("quorum", created.getQuorum().toPlainString())
                    .with("approval_threshold", created.getApprovalThreshold().toPlainString())
                    .build());
            return created.getId();
        });
    }

    /**
     * Records {@code vote} for {@code account}, which must be proven present by {@code transaction}.
     *
     * @throws NotAuthorizedException    presence proof missing, invalid or already used
     * @throws NotFoundException         unknown temperature check
     * @throws WindowClosedException     before start or at/after deadline
     * @throws AlreadyRecordedException  account has already voted on this check
     */
    public void voteOnTemperatureCheck(Transaction transaction, Account account,
                                       long temperatureCheckId, TemperatureCheckVote vote) {
        guarded("voteOnTemperatureCheck", () -> {
            presenceVerifier.requirePresence(transaction, account, TransactionType.VOTE_ON_TEMPERATURE_CHECK);
            if (vote == null) {
                throw new ValidationException("Vote must be FOR or AGAINST");
            }
            final long now = clock.now();

            locks.runWithLocks(() -> store.inTransaction(tx -> {
                ReplayGuard.consume(tx, transaction);
                TemperatureCheck tc = loadTemperatureCheck(tx, temperatureCheckId);
                requireOpen(tc, now);

                String voteKey = ConfigKey.TEMPERATURE_CHECK_VOTE.key(temperatureCheckId, account.getAddress());
                if (tx.get(voteKey) != null) {
                    throw new AlreadyRecordedException("Account has already voted on this temperature check");
                }
                tx.put(voteKey, vote.name());
                return null;
            }), ConfigKey.TEMPERATURE_CHECK.key(temperatureCheckId), ReplayGuard.lockKey(transaction));

            log.info("[GovernanceEngine] {} voted {} on temperature check {}", account, vote, temperatureCheckId);
            publish(GovernanceEvent.builder(EventType.TEMPERATURE_CHECK_VOTED, now)
                    .with("temperature_check_id", temperatureCheckId)
                    .with("account", account)
                    .with("vote", vote)
                    .build());
            return null;
        });
    }

    // ---- API: Elevation ----

    /**
     * Elevates a temperature check to a proposal. Owner only.
     * <p>
     * The proposal copies the check's content, snapshots the proposal-tier
     * parameters and opens now for the configured proposal length. The check's
     * forward reference and the new proposal are written in the same transaction.
     *
     * @return the new proposal id
     * @throws NotAuthorizedException   caller is not the owner
     * @throws NotFoundException        unknown temperature check
     * @throws AlreadyRecordedException check was already elevated
     */
    public long elevate(Transaction transaction, long temperatureCheckId) {
        return guarded("elevate", () -> {
            privilegedCallGate.requirePrivileged(transaction, TransactionType.ELEVATE_TEMPERATURE_CHECK);
            final long now = clock.now();

            Proposal proposal = locks.withLocks(() -> store.inTransaction(tx -> {
                ReplayGuard.consume(tx, transaction);
                TemperatureCheck tc = loadTemperatureCheck(tx, temperatureCheckId);
                if (tc.isElevated()) {
                    throw new AlreadyRecordedException("Temperature check " + temperatureCheckId
                            + " has already been elevated to proposal " + tc.getElevatedProposalId());
                }

                long proposalId = readCounter(tx, ConfigKey.PROPOSAL_COUNT);
                GovernanceParameters params = readParameters(tx);
                long deadline = deadlineAfter(now, params.getProposalLengthDays());

                Proposal p = new Proposal(proposalId, tc,
                        params.getProposalQuorum(),
                        params.getProposalApprovalThreshold(),
                        now, deadline);

                tc.markElevated(proposalId);
                tx.put(ConfigKey.TEMPERATURE_CHECK.key(temperatureCheckId), ConversionUtil.toJson(tc));
                tx.put(ConfigKey.PROPOSAL.key(proposalId), ConversionUtil.toJson(p));
                tx.put(ConfigKey.PROPOSAL_COUNT.key(), Long.toString(proposalId + 1));
                return p;
            }), ConfigKey.TEMPERATURE_CHECK.key(temperatureCheckId), ConfigKey.PROPOSAL_COUNT.key(),
                    ReplayGuard.lockKey(transaction));

            log.info("[GovernanceEngine] Temperature check {} elevated to proposal {}", temperatureCheckId, proposal.getId());
            publish(GovernanceEvent.builder(EventType.PROPOSAL_CREATED, now)
                    .with("proposal_id", proposal.getId())
                    .with("temperature_check_id", temperatureCheckId)
                    .with("start", proposal.getStart())
                    .with("deadline", proposal.getDeadline())
                    .with("quorum", proposal.getQuorum().toPlainString())
                    .with("approval_threshold", proposal.getApprovalThreshold().toPlainString())
                    .build());
            return proposal.getId();
        });
    }

    // ---- API: Proposals ----

    /**
     * Records the option set chosen by {@code account} on a proposal.
     * <p>
     * The selection must name between 1 and {@link Ballot#selectionLimit()} distinct
     * option ids, all present on the proposal.
     *
     * @throws NotAuthorizedException    presence proof missing, invalid or already used
     * @throws NotFoundException         unknown proposal
     * @throws WindowClosedException     before start or at/after deadline
     * @throws ValidationException       empty, duplicate, unknown or too many options
     * @throws AlreadyRecordedException  account has already voted on this proposal
     */
    public void voteOnProposal(Transaction transaction, Account account, long proposalId, List<Long> selectedOptionIds) {
        guarded("voteOnProposal", () -> {
            presenceVerifier.requirePresence(transaction, account, TransactionType.VOTE_ON_PROPOSAL);
            final long now = clock.now();

            SortedSet<Long> recorded = locks.withLocks(() -> store.inTransaction(tx -> {
                ReplayGuard.consume(tx, transaction);
                Proposal proposal = loadProposal(tx, proposalId);
                requireOpen(proposal, now);
                SortedSet<Long> selection = validateSelection(proposal, selectedOptionIds);

                String voteKey = ConfigKey.PROPOSAL_VOTE.key(proposalId, account.getAddress());
                if (tx.get(voteKey) != null) {
                    throw new AlreadyRecordedException("Account has already voted on this proposal");
                }
                tx.put(voteKey, ConversionUtil.toJson(new ArrayList<>(selection)));
                return selection;
            }), ConfigKey.PROPOSAL.key(proposalId), ReplayGuard.lockKey(transaction));

            log.info("[GovernanceEngine] {} voted {} on proposal {}", account, recorded, proposalId);
            publish(GovernanceEvent.builder(EventType.PROPOSAL_VOTED, now)
                    .with("proposal_id", proposalId)
                    .with("account", account)
                    .with("options", recorded)
                    .build());
            return null;
        });
    }

    /**
     * Single-choice convenience for {@link #voteOnProposal(Transaction, Account, long, List)}.
     */
    public void voteOnProposal(Transaction transaction, Account account, long proposalId, long optionId) {
        voteOnProposal(transaction, account, proposalId, List.of(optionId));
    }

    // ---- API: Parameters ----

    /**
     * Replaces the parameter set used for ballots created from now on. Owner only.
     */
    public void updateGovernanceParameters(Transaction transaction, GovernanceParameters newParameters) {
        guarded("updateGovernanceParameters", () -> {
            privilegedCallGate.requirePrivileged(transaction, TransactionType.UPDATE_GOVERNANCE_PARAMETERS);
            if (newParameters == null) {
                throw new ValidationException("Governance parameters must not be null");
            }
            newParameters.validate();
            final long now = clock.now();

            locks.runWithLocks(() -> store.inTransaction(tx -> {
                ReplayGuard.consume(tx, transaction);
                tx.put(ConfigKey.GOVERNANCE_PARAMETERS.key(), ConversionUtil.toJson(newParameters));
                return null;
            }), ConfigKey.GOVERNANCE_PARAMETERS.key(), ReplayGuard.lockKey(transaction));

            log.info("[GovernanceEngine] Governance parameters updated: {}", newParameters);
            publish(GovernanceEvent.builder(EventType.GOVERNANCE_PARAMETERS_UPDATED, now)
                    .with("temperature_check_days", newParameters.getTemperatureCheckDays())
                    .with("temperature_check_quorum", newParameters.getTemperatureCheckQuorum().toPlainString())
                    .with("temperature_check_approval_threshold", newParameters.getTemperatureCheckApprovalThreshold().toPlainString())
                    .with("temperature_check_propose_threshold", newParameters.getTemperatureCheckProposeThreshold().toPlainString())
                    .with("proposal_length_days", newParameters.getProposalLengthDays())
                    .with("proposal_quorum", newParameters.getProposalQuorum().toPlainString())
                    .with("proposal_approval_threshold", newParameters.getProposalApprovalThreshold().toPlainString())
                    .build());
            return null;
        });
    }

    // ---- API: Reads ----

    public GovernanceParameters getGovernanceParameters() {
        return store.read(this::readParameters);
    }

    public long getTemperatureCheckCount() {
        return store.read(tx -> readCounter(tx, ConfigKey.TEMPERATURE_CHECK_COUNT));
    }

    public long getProposalCount() {
        return store.read(tx -> readCounter(tx, ConfigKey.PROPOSAL_COUNT));
    }

    public Optional<TemperatureCheck> getTemperatureCheck(long temperatureCheckId) {
        return store.read(tx -> Optional.ofNullable(ConversionUtil.fromJson(
                tx.get(ConfigKey.TEMPERATURE_CHECK.key(temperatureCheckId)), TemperatureCheck.class)));
    }

    public Optional<Proposal> getProposal(long proposalId) {
        return store.read(tx -> Optional.ofNullable(ConversionUtil.fromJson(
                tx.get(ConfigKey.PROPOSAL.key(proposalId)), Proposal.class)));
    }

    public Optional<TemperatureCheckVote> getTemperatureCheckVote(long temperatureCheckId, Account account) {
        return store.read(tx -> Optional.ofNullable(
                        tx.get(ConfigKey.TEMPERATURE_CHECK_VOTE.key(temperatureCheckId, account.getAddress())))
                .map(TemperatureCheckVote::valueOf));
    }

    public Optional<SortedSet<Long>> getProposalVote(long proposalId, Account account) {
        return store.read(tx -> Optional.ofNullable(
                        tx.get(ConfigKey.PROPOSAL_VOTE.key(proposalId, account.getAddress())))
                .map(GovernanceEngine::toSelection));
    }

    /**
     * Every vote recorded on a temperature check, by voter address.
     *
     * @throws NotFoundException unknown temperature check
     */
    public SortedMap<Account, TemperatureCheckVote> getTemperatureCheckVotes(long temperatureCheckId) {
        return store.read(tx -> {
            loadTemperatureCheck(tx, temperatureCheckId);
            String prefix = ConfigKey.TEMPERATURE_CHECK_VOTE.prefix(temperatureCheckId);
            SortedMap<Account, TemperatureCheckVote> votes = new TreeMap<>();
            tx.scan(prefix).forEach((key, value) ->
                    votes.put(Account.of(key.substring(prefix.length())), TemperatureCheckVote.valueOf(value)));
            return votes;
        });
    }

    /**
     * Every option set recorded on a proposal, by voter address.
     *
     * @throws NotFoundException unknown proposal
     */
    public SortedMap<Account, SortedSet<Long>> getProposalVotes(long proposalId) {
        return store.read(tx -> {
            loadProposal(tx, proposalId);
            String prefix = ConfigKey.PROPOSAL_VOTE.prefix(proposalId);
            SortedMap<Account, SortedSet<Long>> votes = new TreeMap<>();
            tx.scan(prefix).forEach((key, value) ->
                    votes.put(Account.of(key.substring(prefix.length())), toSelection(value)));
            return votes;
        });
    }

    // ---- Helpers: validation ----

    private static void validateDraft(TemperatureCheckDraft draft) {
        if (draft == null) {
            throw new ValidationException("Temperature check draft must not be null");
        }
        if (draft.getTitle() == null || draft.getTitle().isEmpty()) {
            throw new ValidationException("Temperature check title cannot be empty");
        }
        if (draft.getDescription() == null || draft.getDescription().isEmpty()) {
            throw new ValidationException("Temperature check description cannot be empty");
        }
        List<VoteOption> options = draft.getVoteOptions();
        if (options == null || options.isEmpty()) {
            throw new ValidationException("Temperature check must have at least one vote option");
        }
        if (options.size() > Limits.MAX_VOTE_OPTIONS) {
            throw new ValidationException("Too many vote options (max " + Limits.MAX_VOTE_OPTIONS + ")");
        }
        if (options.contains(null)) {
            throw new ValidationException("Vote options must not contain null entries");
        }
        for (VoteOption option : options) {
            if (option.getId() < 0 || option.getId() > Limits.MAX_VOTE_OPTION_ID) {
                throw new ValidationException("Vote option id " + option.getId()
                        + " out of range (0.." + Limits.MAX_VOTE_OPTION_ID + ")");
            }
        }
        List<FileReference> attachments = draft.getAttachments();
        if (attachments == null) {
            throw new ValidationException("Attachment list must not be null");
        }
        if (attachments.size() > Limits.MAX_ATTACHMENTS) {
            throw new ValidationException("Too many attachments (max " + Limits.MAX_ATTACHMENTS + ")");
        }
        if (attachments.contains(null)) {
            throw new ValidationException("Attachments must not contain null entries");
        }
        if (draft.getRfcUrl() == null) {
            throw new ValidationException("RFC url must not be null");
        }
        Integer maxSelections = draft.getMaxSelections();
        if (maxSelections != null && (maxSelections < 1 || maxSelections > options.size())) {
            throw new ValidationException("maxSelections must be between 1 and " + options.size());
        }
    }

    private static SortedSet<Long> validateSelection(Proposal proposal, List<Long> selectedOptionIds) {
        if (selectedOptionIds == null || selectedOptionIds.isEmpty()) {
            throw new ValidationException("At least one vote option must be selected");
        }
        if (selectedOptionIds.contains(null)) {
            throw new ValidationException("Selected option ids must not be null");
        }
        SortedSet<Long> selection = new TreeSet<>(selectedOptionIds);
        if (selection.size() != selectedOptionIds.size()) {
            throw new ValidationException("Selection contains duplicate option ids");
        }
        for (Long optionId : selection) {
            if (!proposal.hasOption(optionId)) {
                throw new ValidationException("Invalid vote option " + optionId);
            }
        }
        if (selection.size() > proposal.selectionLimit()) {
            throw new ValidationException("Too many options selected (max " + proposal.selectionLimit() + ")");
        }
        return selection;
    }

    private static void requireOpen(Ballot ballot, long now) {
        if (now < ballot.getStart()) {
            throw new WindowClosedException("Voting has not started yet");
        }
        if (!TimeUtil.isWithinWindow(now, ballot.getStart(), ballot.getDeadline())) {
            throw new WindowClosedException("Voting has ended");
        }
    }

    private static long deadlineAfter(long start, int days) {
        try {
            return TimeUtil.addDays(start, days);
        } catch (ArithmeticException e) {
            throw new ValidationException("Deadline overflows the ledger clock");
        }
    }

    // ---- Helpers: storage ----

    private TemperatureCheck loadTemperatureCheck(StoreTransaction tx, long id) {
        TemperatureCheck tc = ConversionUtil.fromJson(tx.get(ConfigKey.TEMPERATURE_CHECK.key(id)), TemperatureCheck.class);
        if (tc == null) {
            throw new NotFoundException("Temperature check not found: " + id);
        }
        return tc;
    }

    private Proposal loadProposal(StoreTransaction tx, long id) {
        Proposal proposal = ConversionUtil.fromJson(tx.get(ConfigKey.PROPOSAL.key(id)), Proposal.class);
        if (proposal == null) {
            throw new NotFoundException("Proposal not found: " + id);
        }
        return proposal;
    }

    private GovernanceParameters readParameters(StoreTransaction tx) {
        GovernanceParameters params = ConversionUtil.fromJson(
                tx.get(ConfigKey.GOVERNANCE_PARAMETERS.key()), GovernanceParameters.class);
        if (params == null) {
            throw new IllegalStateException("Governance parameters missing from store");
        }
        return params;
    }

    private static long readCounter(StoreTransaction tx, ConfigKey counter) {
        String value = tx.get(counter.key());
        return value == null ? 0L : Long.parseLong(value);
    }

    private static SortedSet<Long> toSelection(String json) {
        List<Long> ids = ConversionUtil.jsonToList(json, Long.class);
        return Collections.unmodifiableSortedSet(new TreeSet<>(ids == null ? List.of() : ids));
    }

    // ---- Helpers: reporting ----

    private <T> T guarded(String operation, Supplier<T> body) {
        try {
            return body.get();
        } catch (StorageException e) {
            log.error("[GovernanceEngine] {} failed: {}", operation, e.getMessage());
            throw e;
        } catch (ConsultationException e) {
            log.warn("[GovernanceEngine] {} rejected ({}): {}", operation, e.getKind(), e.getMessage());
            throw e;
        }
    }

    private void publish(GovernanceEvent event) {
        try {
            eventSink.publish(event);
        } catch (RuntimeException e) {
            log.warn("[GovernanceEngine] Event sink failed for {}: {}", event.getType(), e.getMessage());
        }
    }
}
