package com.di.indexer.support;

import com.di.indexer.metadata.CheckpointRepository;
import com.di.indexer.metadata.ScanRecordRepository;
import com.di.indexer.metadata.SubmissionRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Fresh in-memory H2 database with {@code schema.sql} applied, plus the
 * repositories over it. Each instance gets its own database.
 */
public final class H2Store implements AutoCloseable {

    private final EmbeddedDatabase     db;
    private final JdbcTemplate         jdbc;
    private final TransactionTemplate  tx;
    private final SubmissionRepository submissions;
    private final ScanRecordRepository records;
    private final CheckpointRepository checkpoints;

    public H2Store() {
        this.db = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("classpath:schema.sql")
                .build();
        this.jdbc        = new JdbcTemplate(db);
        this.tx          = new TransactionTemplate(new DataSourceTransactionManager(db));
        this.submissions = new SubmissionRepository(jdbc);
        this.records     = new ScanRecordRepository(jdbc);
        this.checkpoints = new CheckpointRepository(jdbc);
    }

    public JdbcTemplate jdbc() {
        return jdbc;
    }

    public TransactionTemplate tx() {
        return tx;
    }

    public SubmissionRepository submissions() {
        return submissions;
    }

    public ScanRecordRepository records() {
        return records;
    }

    public CheckpointRepository checkpoints() {
        return checkpoints;
    }

    @Override
    public void close() {
        db.shutdown();
    }
}
