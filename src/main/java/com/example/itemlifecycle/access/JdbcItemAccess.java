package com.example.itemlifecycle.access;

import com.example.itemlifecycle.models.Item;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

/**
 * {@link ItemAccess} backed by the {@code items} table of the embedded relational database.
 * The table lives only as long as the datasource, so nothing survives a restart.
 */
@Repository
public class JdbcItemAccess implements ItemAccess {

    private static final String SELECT_COLUMNS = "SELECT id, name, created_at FROM items";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final ReentrantLock insertLock = new ReentrantLock();

    public JdbcItemAccess(NamedParameterJdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public Item insert(String name) {
        final String sql = "INSERT INTO items (name, created_at) VALUES (:name, :createdAt)";
        KeyHolder keyHolder = new GeneratedKeyHolder();
        // Stamping and inserting under one lock keeps created_at non-decreasing in id order.
        insertLock.lock();
        try {
            final MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("name", name)
                    .addValue("createdAt", toTimestamp(Instant.now(clock)));
            jdbcTemplate.update(sql, params, keyHolder);
        } finally {
            insertLock.unlock();
        }

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new InvalidDataAccessResourceUsageException("Insert into items returned no generated id");
        }
        long id = key.longValue();
        // Read the row back so the returned created_at carries the column's precision.
        return findById(id)
                .orElseThrow(() -> new EmptyResultDataAccessException("Inserted item " + id + " is missing", 1));
    }

    @Override
    public List<Item> findAll() {
        final String sql = SELECT_COLUMNS + " ORDER BY created_at DESC, id DESC";
        return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
    }

    @Override
    public Optional<Item> findById(long id) {
        final String sql = SELECT_COLUMNS + " WHERE id = :id";
        final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
        return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
    }

    @Override
    public int deleteById(long id) {
        final String sql = "DELETE FROM items WHERE id = :id";
        final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
        return jdbcTemplate.update(sql, params);
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM items", new MapSqlParameterSource(), Long.class);
        return count == null ? 0L : count;
    }

    private Item mapRow(ResultSet rs, int rowNum) throws SQLException {
        return Item.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .build();
    }

    // Bind Instants as Timestamp explicitly rather than relying on driver type inference.
    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
