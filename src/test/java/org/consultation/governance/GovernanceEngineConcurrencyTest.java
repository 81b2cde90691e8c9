package org.consultation.governance;

import org.consultation.bc.TransactionType;
import org.consultation.chain.ManualClock;
import org.consultation.chain.OwnerKeyGate;
import org.consultation.chain.SignaturePresenceVerifier;
import org.consultation.chain.Wallet;
import org.consultation.db.InMemoryKeyValueStore;
import org.consultation.errors.AlreadyRecordedException;
import org.consultation.event.EventSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class GovernanceEngineConcurrencyTest {

    private static final int THREADS = 8;

    private ManualClock clock;
    private Wallet owner;
    private GovernanceEngine engine;

    @BeforeEach
    public void setup() {
        clock = new ManualClock(1_700_000_000L);
        owner = new Wallet();
        engine = new GovernanceEngine(new InMemoryKeyValueStore(), GovernanceParameters.defaults(), clock,
                new SignaturePresenceVerifier(), new OwnerKeyGate(owner.getPublicKey()), EventSink.NONE);
    }

    private static TemperatureCheckDraft draft() {
        return new TemperatureCheckDraft("Concurrent", "Raced from many threads",
                List.of(new VoteOption(0, "For"), new VoteOption(1, "Against")), List.of(), "https://x", null);
    }

    /**
     * Runs {@code attempt} on all threads at once and returns how many finished
     * without {@link AlreadyRecordedException}.
     */
    private int race(Callable<Void> attempt) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger rejections = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < THREADS; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    try {
                        attempt.call();
                        successes.incrementAndGet();
                    } catch (AlreadyRecordedException e) {
                        rejections.incrementAndGet();
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(THREADS, successes.get() + rejections.get());
        return successes.get();
    }

    @Test
    public void testConcurrentVotesFromOneAccountRecordOnce() throws Exception {
        long id = engine.makeTemperatureCheck(draft());
        Wallet voter = new Wallet();

        int successes = race(() -> {
            engine.voteOnTemperatureCheck(voter.sign(TransactionType.VOTE_ON_TEMPERATURE_CHECK, Map.of(), clock.now()),
                    voter.getAccount(), id, TemperatureCheckVote.FOR);
            return null;
        });

        assertEquals(1, successes);
        assertEquals(1, engine.getTemperatureCheckVotes(id).size());
    }

    @Test
    public void testConcurrentElevationsCreateOneProposal() throws Exception {
        long id = engine.makeTemperatureCheck(draft());

        int successes = race(() -> {
            engine.elevate(owner.sign(TransactionType.ELEVATE_TEMPERATURE_CHECK, Map.of(), clock.now()), id);
            return null;
        });

        assertEquals(1, successes);
        assertEquals(1, engine.getProposalCount());
        assertEquals(Long.valueOf(0), engine.getTemperatureCheck(id).orElseThrow().getElevatedProposalId());
    }

    @Test
    public void testConcurrentCreationsGetDistinctIds() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        List<Future<Long>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 40; i++) {
                futures.add(pool.submit(() -> engine.makeTemperatureCheck(draft())));
            }
            ConcurrentSkipListSet<Long> ids = new ConcurrentSkipListSet<>();
            for (Future<Long> f : futures) {
                ids.add(f.get(30, TimeUnit.SECONDS));
            }
            assertEquals(40, ids.size());
            assertEquals(0L, ids.first());
            assertEquals(39L, ids.last());
        } finally {
            pool.shutdownNow();
        }
        assertEquals(40, engine.getTemperatureCheckCount());
    }

    @Test
    public void testDistinctVotersAllRecorded() throws Exception {
        long id = engine.makeTemperatureCheck(draft());
        List<Wallet> voters = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            voters.add(new Wallet());
        }

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Wallet voter : voters) {
                futures.add(pool.submit(() -> engine.voteOnTemperatureCheck(
                        voter.sign(TransactionType.VOTE_ON_TEMPERATURE_CHECK, Map.of(), clock.now()),
                        voter.getAccount(), id, TemperatureCheckVote.AGAINST)));
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(20, engine.getTemperatureCheckVotes(id).size());
        assertTrue(engine.getTemperatureCheckVotes(id).values().stream().allMatch(v -> v == TemperatureCheckVote.AGAINST));
    }
}
