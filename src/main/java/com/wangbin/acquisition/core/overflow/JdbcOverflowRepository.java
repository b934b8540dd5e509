package com.wangbin.acquisition.core.overflow;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 SQLite 的溢出记录存储
 */
@Slf4j
public class JdbcOverflowRepository implements OverflowRepository {

    private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS overflow_record ("
            + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
            + "device_id TEXT, "
            + "measurement TEXT NOT NULL, "
            + "payload TEXT NOT NULL, "
            + "point_time INTEGER NOT NULL, "
            + "enqueued_at INTEGER NOT NULL, "
            + "attempts INTEGER NOT NULL DEFAULT 0)";
    private static final String CREATE_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_overflow_enqueued_at ON overflow_record (enqueued_at)";

    private static final RowMapper<OverflowRecord> ROW_MAPPER = (rs, rowNum) -> OverflowRecord.builder()
            .id(rs.getLong("id"))
            .deviceId(rs.getString("device_id"))
            .measurement(rs.getString("measurement"))
            .payload(rs.getString("payload"))
            .pointTime(rs.getLong("point_time"))
            .enqueuedAt(rs.getLong("enqueued_at"))
            .attempts(rs.getInt("attempts"))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcOverflowRepository(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        initSchema();
    }

    private void initSchema() {
        jdbcTemplate.execute(CREATE_TABLE);
        jdbcTemplate.execute(CREATE_INDEX);
        log.info("溢出缓存表初始化完成，当前记录数: {}", count());
    }

    @Override
    public void appendAll(List<OverflowRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        List<Object[]> args = new ArrayList<>(records.size());
        for (OverflowRecord record : records) {
            args.add(new Object[]{record.getDeviceId(), record.getMeasurement(), record.getPayload(),
                    record.getPointTime(), record.getEnqueuedAt(), record.getAttempts()});
        }
        transactionTemplate.executeWithoutResult(status -> jdbcTemplate.batchUpdate(
                "INSERT INTO overflow_record (device_id, measurement, payload, point_time, enqueued_at, attempts) "
                        + "VALUES (?, ?, ?, ?, ?, ?)", args));
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM overflow_record", Long.class);
        return count == null ? 0 : count;
    }

    @Override
    public List<OverflowRecord> findOldest(int limit) {
        return jdbcTemplate.query("SELECT * FROM overflow_record ORDER BY id ASC LIMIT ?", ROW_MAPPER, limit);
    }

    @Override
    public int deleteByIds(List<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        List<Object[]> args = ids.stream().map(id -> new Object[]{id}).toList();
        int[] counts = transactionTemplate.execute(status ->
                jdbcTemplate.batchUpdate("DELETE FROM overflow_record WHERE id = ?", args));
        int deleted = 0;
        if (counts != null) {
            for (int c : counts) {
                deleted += Math.max(c, 0);
            }
        }
        return deleted;
    }

    @Override
    public void incrementAttempts(List<Long> ids) {
        if (ids.isEmpty()) {
            return;
        }
        List<Object[]> args = ids.stream().map(id -> new Object[]{id}).toList();
        transactionTemplate.executeWithoutResult(status -> jdbcTemplate.batchUpdate(
                "UPDATE overflow_record SET attempts = attempts + 1 WHERE id = ?", args));
    }

    @Override
    public int evictOldest(long count) {
        if (count <= 0) {
            return 0;
        }
        return jdbcTemplate.update("DELETE FROM overflow_record WHERE id IN "
                + "(SELECT id FROM overflow_record ORDER BY id ASC LIMIT ?)", count);
    }

    @Override
    public int deleteOlderThan(long enqueuedBefore) {
        return jdbcTemplate.update("DELETE FROM overflow_record WHERE enqueued_at < ?", enqueuedBefore);
    }
}
