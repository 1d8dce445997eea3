package com.pixshare.repository;

import com.pixshare.model.Album;
import com.pixshare.model.AlbumId;
import com.pixshare.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class AlbumRepository {

    private final JdbcTemplate jdbc;
    private final SimpleJdbcInsert insert;

    static final RowMapper<Album> ALBUM_MAPPER = (rs, rowNum) -> new Album(
        AlbumId.of(rs.getLong("id")),
        rs.getString("title"),
        rs.getString("description"),
        UserId.of(rs.getLong("user_id")),
        rs.getTimestamp("created_at").toLocalDateTime(),
        rs.getInt("photo_count")
    );

    private static final String SELECT_WITH_COUNT = """
        SELECT a.*, COALESCE(p.cnt, 0) AS photo_count FROM albums a
        LEFT JOIN (SELECT album_id, COUNT(*) AS cnt FROM photos GROUP BY album_id) p
        ON a.id = p.album_id
        """;

    public AlbumRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.insert = new SimpleJdbcInsert(jdbc)
            .withTableName("albums")
            .usingColumns("title", "description", "user_id")
            .usingGeneratedKeyColumns("id")
            .withoutTableColumnMetaDataAccess();
    }

    public Optional<Album> findById(AlbumId id) {
        List<Album> results = jdbc.query(SELECT_WITH_COUNT + " WHERE a.id = ?", ALBUM_MAPPER, id.value());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<UserId> findOwner(AlbumId id) {
        List<UserId> results = jdbc.query(
            "SELECT user_id FROM albums WHERE id = ?",
            (rs, rowNum) -> UserId.of(rs.getLong("user_id")),
            id.value()
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Album> findByOwner(UserId ownerId) {
        return jdbc.query(
            SELECT_WITH_COUNT + " WHERE a.user_id = ? ORDER BY a.created_at DESC, a.id DESC",
            ALBUM_MAPPER, ownerId.value()
        );
    }

    public List<Album> findRecentByOwner(UserId ownerId, int limit) {
        return jdbc.query(
            SELECT_WITH_COUNT + " WHERE a.user_id = ? ORDER BY a.created_at DESC, a.id DESC LIMIT ?",
            ALBUM_MAPPER, ownerId.value(), limit
        );
    }

    public AlbumId save(String title, String description, UserId ownerId) {
        Map<String, Object> row = new HashMap<>();
        row.put("title", title);
        row.put("description", description);
        row.put("user_id", ownerId.value());
        return AlbumId.of(insert.executeAndReturnKey(row).longValue());
    }

    public void delete(AlbumId id) {
        jdbc.update("DELETE FROM albums WHERE id = ?", id.value());
    }
}
