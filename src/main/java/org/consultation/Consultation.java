package org.consultation;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.consultation.chain.OwnerKeyGate;
import org.consultation.chain.SignaturePresenceVerifier;
import org.consultation.chain.Clock;
import org.consultation.chain.SystemClock;
import org.consultation.constants.FileNames;
import org.consultation.db.KeyValueStore;
import org.consultation.db.SqliteKeyValueStore;
import org.consultation.delegation.DelegationRegistry;
import org.consultation.event.EventSink;
import org.consultation.event.LoggingEventSink;
import org.consultation.event.SqliteEventLog;
import org.consultation.governance.GovernanceEngine;
import org.consultation.governance.GovernanceParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PublicKey;
import java.security.Security;

/**
 * Wires the governance engine and the delegation registry onto SQLite files in a
 * data directory. The two components never share a store.
 */
public class Consultation implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Consultation.class);

    private final KeyValueStore governanceStore;
    private final KeyValueStore delegationStore;
    private final SqliteEventLog eventLog;
    private final GovernanceEngine governance;
    private final DelegationRegistry delegation;

    private Consultation(KeyValueStore governanceStore, KeyValueStore delegationStore, SqliteEventLog eventLog,
                         GovernanceEngine governance, DelegationRegistry delegation) {
        this.governanceStore = governanceStore;
        this.delegationStore = delegationStore;
        this.eventLog = eventLog;
        this.governance = governance;
        this.delegation = delegation;
    }

    public static Consultation open(Path dataDir, PublicKey ownerKey, GovernanceParameters initialParameters) {
        return open(dataDir, ownerKey, initialParameters, new SystemClock());
    }

    /**
     * @param initialParameters used only when the data directory holds no parameter set yet
     */
    public static Consultation open(Path dataDir, PublicKey ownerKey, GovernanceParameters initialParameters,
                                    Clock clock) {
        if (Security.getProvider("BC") == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create data directory " + dataDir, e);
        }

        KeyValueStore governanceStore = new SqliteKeyValueStore(dataDir.resolve(FileNames.GOVERNANCE_DB).toString());
        KeyValueStore delegationStore = new SqliteKeyValueStore(dataDir.resolve(FileNames.DELEGATION_DB).toString());
        SqliteEventLog eventLog = new SqliteEventLog(dataDir.resolve(FileNames.EVENT_LOG_DB).toString());
        EventSink sink = eventLog.andThen(new LoggingEventSink());
        SignaturePresenceVerifier presenceVerifier = new SignaturePresenceVerifier();

        GovernanceEngine governance = new GovernanceEngine(governanceStore, initialParameters, clock,
                presenceVerifier, new OwnerKeyGate(ownerKey), sink);
        DelegationRegistry delegation = new DelegationRegistry(delegationStore, clock, presenceVerifier, sink);

        log.info("[Consultation] Opened data directory {}", dataDir.toAbsolutePath());
        return new Consultation(governanceStore, delegationStore, eventLog, governance, delegation);
    }

    public GovernanceEngine governance() {
        return governance;
    }

    public DelegationRegistry delegation() {
        return delegation;
    }

    public SqliteEventLog eventLog() {
        return eventLog;
    }

    @Override
    public void close() {
        governanceStore.close();
        delegationStore.close();
    }
}
