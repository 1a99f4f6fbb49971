package com.ads.guardian;

import com.ads.guardian.persistence.*;
import com.ads.guardian.platform.InMemoryAdsPlatform;
import com.ads.guardian.platform.TestPlatformConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

/**
 * Base class for integration tests.
 * Uses H2 in-memory database, test profile and the in-memory ads platform.
 */
@SpringBootTest
@ActiveProfiles("test")
@TestPropertySource(locations = "classpath:application-test.properties")
@Import(TestPlatformConfig.class)
public abstract class BaseIntegrationTest {

    @Autowired
    protected InMemoryAdsPlatform platform;

    @Autowired
    protected ManagedEntityRepository entityRepository;

    @Autowired
    protected EntityStateRepository stateRepository;

    @Autowired
    protected GuardianDecisionRepository decisionRepository;

    @Autowired
    protected MetricsSnapshotRepository snapshotRepository;

    @Autowired
    protected LossLedgerRepository ledgerRepository;

    @Autowired
    protected LossLedgerEntryRepository ledgerEntryRepository;

    @Autowired
    protected TickRecordRepository tickRecordRepository;

    @Autowired
    protected OperatorAlertRepository alertRepository;

    /**
     * Empty every table and reset the fake platform.
     */
    protected void resetGuardian() {
        decisionRepository.deleteAll();
        stateRepository.deleteAll();
        snapshotRepository.deleteAll();
        ledgerEntryRepository.deleteAll();
        ledgerRepository.deleteAll();
        tickRecordRepository.deleteAll();
        alertRepository.deleteAll();
        entityRepository.deleteAll();
        platform.reset();
    }
}
