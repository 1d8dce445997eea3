package com.pixshare.repository;

import com.pixshare.model.Guest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class GuestRepository {

    private final JdbcTemplate jdbc;
    private final SimpleJdbcInsert insert;

    private static final RowMapper<Guest> GUEST_MAPPER = (rs, rowNum) -> new Guest(
        rs.getLong("id"),
        rs.getLong("share_id"),
        rs.getString("guest_key"),
        rs.getString("display_name"),
        rs.getTimestamp("created_at").toLocalDateTime(),
        rs.getTimestamp("last_seen_at").toLocalDateTime()
    );

    public GuestRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.insert = new SimpleJdbcInsert(jdbc)
            .withTableName("guests")
            .usingColumns("share_id", "guest_key", "display_name")
            .usingGeneratedKeyColumns("id")
            .withoutTableColumnMetaDataAccess();
    }

    public Optional<Guest> findByKey(String guestKey) {
        List<Guest> results = jdbc.query("SELECT * FROM guests WHERE guest_key = ?", GUEST_MAPPER, guestKey);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<Guest> findById(long id) {
        List<Guest> results = jdbc.query("SELECT * FROM guests WHERE id = ?", GUEST_MAPPER, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(long shareId, String guestKey, String displayName) {
        Map<String, Object> row = new HashMap<>();
        row.put("share_id", shareId);
        row.put("guest_key", guestKey);
        row.put("display_name", displayName);
        return insert.executeAndReturnKey(row).longValue();
    }

    public void touch(long id, LocalDateTime seenAt) {
        jdbc.update("UPDATE guests SET last_seen_at = ? WHERE id = ?", Timestamp.valueOf(seenAt), id);
    }
}
