package com.pixshare.repository;

import com.pixshare.model.Capabilities;
import com.pixshare.model.EventId;
import com.pixshare.model.ResourceKind;
import com.pixshare.model.ResourceRef;
import com.pixshare.model.Share;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class ShareRepository {

    private final JdbcTemplate jdbc;
    private final SimpleJdbcInsert insert;

    private static final RowMapper<Share> SHARE_MAPPER = (rs, rowNum) -> {
        Timestamp expiresAt = rs.getTimestamp("expires_at");
        return new Share(
            rs.getLong("id"),
            rs.getString("token"),
            scopeOf(rs),
            new Capabilities(
                rs.getBoolean("can_comment"),
                rs.getBoolean("can_react"),
                rs.getBoolean("can_upload"),
                rs.getBoolean("can_curate")
            ),
            expiresAt != null ? expiresAt.toLocalDateTime() : null,
            rs.getObject("max_upload_bytes") != null ? rs.getLong("max_upload_bytes") : null,
            rs.getObject("max_files_per_guest") != null ? rs.getInt("max_files_per_guest") : null,
            rs.getTimestamp("created_at").toLocalDateTime()
        );
    };

    public ShareRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.insert = new SimpleJdbcInsert(jdbc)
            .withTableName("shares")
            .usingColumns("token", "album_id", "photo_id", "event_id",
                "can_comment", "can_react", "can_upload", "can_curate",
                "expires_at", "max_upload_bytes", "max_files_per_guest")
            .usingGeneratedKeyColumns("id")
            .withoutTableColumnMetaDataAccess();
    }

    // A row with no scope column set maps to a null scope and authorizes nothing
    private static ResourceRef scopeOf(ResultSet rs) throws SQLException {
        if (rs.getObject("album_id") != null) {
            return ResourceRef.album(rs.getLong("album_id"));
        }
        if (rs.getObject("photo_id") != null) {
            return ResourceRef.photo(rs.getLong("photo_id"));
        }
        if (rs.getObject("event_id") != null) {
            return ResourceRef.event(rs.getLong("event_id"));
        }
        return null;
    }

    private static String scopeColumn(ResourceKind kind) {
        return switch (kind) {
            case ALBUM -> "album_id";
            case PHOTO -> "photo_id";
            case EVENT -> "event_id";
        };
    }

    public Optional<Share> findByToken(String token) {
        List<Share> results = jdbc.query("SELECT * FROM shares WHERE token = ?", SHARE_MAPPER, token);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<Share> findById(long id) {
        List<Share> results = jdbc.query("SELECT * FROM shares WHERE id = ?", SHARE_MAPPER, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Share> findByScope(ResourceRef scope) {
        return jdbc.query(
            "SELECT * FROM shares WHERE " + scopeColumn(scope.kind()) + " = ? ORDER BY created_at, id",
            SHARE_MAPPER, scope.id()
        );
    }

    public boolean tokenExists(String token) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM shares WHERE token = ?", Integer.class, token);
        return count != null && count > 0;
    }

    public long save(ResourceRef scope, String token, Capabilities capabilities,
                     LocalDateTime expiresAt, Long maxUploadBytes, Integer maxFilesPerGuest) {
        Map<String, Object> row = new HashMap<>();
        row.put("token", token);
        row.put("album_id", scope.kind() == ResourceKind.ALBUM ? scope.id() : null);
        row.put("photo_id", scope.kind() == ResourceKind.PHOTO ? scope.id() : null);
        row.put("event_id", scope.kind() == ResourceKind.EVENT ? scope.id() : null);
        row.put("can_comment", capabilities.canComment());
        row.put("can_react", capabilities.canReact());
        row.put("can_upload", capabilities.canUpload());
        row.put("can_curate", capabilities.canCurate());
        row.put("expires_at", expiresAt != null ? Timestamp.valueOf(expiresAt) : null);
        row.put("max_upload_bytes", maxUploadBytes);
        row.put("max_files_per_guest", maxFilesPerGuest);
        return insert.executeAndReturnKey(row).longValue();
    }

    public boolean delete(long id) {
        return jdbc.update("DELETE FROM shares WHERE id = ?", id) > 0;
    }

    public int deleteExpired(ResourceRef scope, LocalDateTime now) {
        return jdbc.update(
            "DELETE FROM shares WHERE " + scopeColumn(scope.kind()) + " = ? AND expires_at IS NOT NULL AND expires_at <= ?",
            scope.id(), Timestamp.valueOf(now)
        );
    }

    public int deleteByScope(ResourceRef scope) {
        return jdbc.update("DELETE FROM shares WHERE " + scopeColumn(scope.kind()) + " = ?", scope.id());
    }

    public int deleteByEvent(EventId eventId) {
        return deleteByScope(ResourceRef.event(eventId.value()));
    }
}
