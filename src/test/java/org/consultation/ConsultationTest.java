package org.consultation;

import org.consultation.bc.TransactionType;
import org.consultation.chain.ManualClock;
import org.consultation.chain.Wallet;
import org.consultation.event.EventType;
import org.consultation.event.GovernanceEvent;
import org.consultation.governance.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ConsultationTest {

    @TempDir
    Path tempDir;

    private static TemperatureCheckDraft draft() {
        return new TemperatureCheckDraft("Treasury grant", "Grant 10k to the docs team",
                List.of(new VoteOption(0, "Yes"), new VoteOption(1, "No")),
                List.of(), "https://radixtalk.com/t/42", null);
    }

    @Test
    public void testEndToEndOnSqliteAndReopen() {
        Path dataDir = tempDir.resolve("data");
        ManualClock clock = new ManualClock(1_700_000_000L);
        Wallet owner = new Wallet();
        Wallet voter = new Wallet();
        Wallet friend = new Wallet();

        long proposalId;
        try (Consultation consultation = Consultation.open(dataDir, owner.getPublicKey(),
                GovernanceParameters.defaults(), clock)) {
            GovernanceEngine governance = consultation.governance();

            long tcId = governance.makeTemperatureCheck(draft());
            governance.voteOnTemperatureCheck(voter.sign(TransactionType.VOTE_ON_TEMPERATURE_CHECK, Map.of(), clock.now()),
                    voter.getAccount(), tcId, TemperatureCheckVote.FOR);
            proposalId = governance.elevate(owner.sign(TransactionType.ELEVATE_TEMPERATURE_CHECK, Map.of(), clock.now()), tcId);
            governance.voteOnProposal(voter.sign(TransactionType.VOTE_ON_PROPOSAL, Map.of(), clock.now()),
                    voter.getAccount(), proposalId, 0L);
            consultation.delegation().makeDelegation(voter.sign(TransactionType.MAKE_DELEGATION, Map.of(), clock.now()),
                    voter.getAccount(), friend.getAccount(), new BigDecimal("0.25"), clock.now() + 3600);
        }

        assertTrue(Files.exists(dataDir.resolve("governance.db")));
        assertTrue(Files.exists(dataDir.resolve("delegation.db")));

        GovernanceParameters ignored = new GovernanceParameters(1, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE,
                1, BigDecimal.ONE, BigDecimal.ONE);
        try (Consultation reopened = Consultation.open(dataDir, owner.getPublicKey(), ignored, clock)) {
            GovernanceEngine governance = reopened.governance();

            assertEquals(GovernanceParameters.defaults(), governance.getGovernanceParameters());
            assertEquals(1, governance.getTemperatureCheckCount());
            assertEquals(1, governance.getProposalCount());
            assertEquals(Optional.of(TemperatureCheckVote.FOR), governance.getTemperatureCheckVote(0, voter.getAccount()));
            assertEquals(List.of(0L), List.copyOf(governance.getProposalVote(proposalId, voter.getAccount()).orElseThrow()));
            assertEquals(Long.valueOf(proposalId), governance.getTemperatureCheck(0).orElseThrow().getElevatedProposalId());
            assertEquals(1, reopened.delegation().getDelegations(voter.getAccount()).size());
            assertEquals(0, new BigDecimal("0.25").compareTo(
                    reopened.delegation().getDelegateeDelegators(friend.getAccount()).get(voter.getAccount())));

            List<EventType> recorded = reopened.eventLog().readAll().stream().map(GovernanceEvent::getType).toList();
            assertEquals(List.of(
                    EventType.TEMPERATURE_CHECK_CREATED,
                    EventType.TEMPERATURE_CHECK_VOTED,
                    EventType.PROPOSAL_CREATED,
                    EventType.PROPOSAL_VOTED,
                    EventType.DELEGATION_CREATED), recorded);
        }
    }
}
