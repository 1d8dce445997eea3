package com.pixshare.repository;

import com.pixshare.model.Album;
import com.pixshare.model.AlbumId;
import com.pixshare.model.Event;
import com.pixshare.model.EventId;
import com.pixshare.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Events and the single {@code event_albums} relation between events and albums.
 */
@Repository
public class EventRepository {

    private final JdbcTemplate jdbc;
    private final SimpleJdbcInsert insert;

    private static final RowMapper<Event> EVENT_MAPPER = (rs, rowNum) -> {
        Date date = rs.getDate("event_date");
        return new Event(
            EventId.of(rs.getLong("id")),
            UserId.of(rs.getLong("user_id")),
            rs.getString("title"),
            rs.getString("description"),
            date != null ? date.toLocalDate() : null,
            rs.getTimestamp("created_at").toLocalDateTime()
        );
    };

    public EventRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.insert = new SimpleJdbcInsert(jdbc)
            .withTableName("events")
            .usingColumns("title", "description", "event_date", "user_id")
            .usingGeneratedKeyColumns("id")
            .withoutTableColumnMetaDataAccess();
    }

    public Optional<Event> findById(EventId id) {
        List<Event> results = jdbc.query("SELECT * FROM events WHERE id = ?", EVENT_MAPPER, id.value());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<UserId> findOwner(EventId id) {
        List<UserId> results = jdbc.query(
            "SELECT user_id FROM events WHERE id = ?",
            (rs, rowNum) -> UserId.of(rs.getLong("user_id")),
            id.value()
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Event> findByOwner(UserId ownerId) {
        return jdbc.query(
            "SELECT * FROM events WHERE user_id = ? ORDER BY created_at DESC, id DESC",
            EVENT_MAPPER, ownerId.value()
        );
    }

    public EventId save(String title, String description, LocalDate date, UserId ownerId) {
        Map<String, Object> row = new HashMap<>();
        row.put("title", title);
        row.put("description", description);
        row.put("event_date", date != null ? Date.valueOf(date) : null);
        row.put("user_id", ownerId.value());
        return EventId.of(insert.executeAndReturnKey(row).longValue());
    }

    public void update(EventId id, String title, String description, LocalDate date) {
        jdbc.update(
            "UPDATE events SET title = ?, description = ?, event_date = ? WHERE id = ?",
            title, description, date != null ? Date.valueOf(date) : null, id.value()
        );
    }

    public void delete(EventId id) {
        jdbc.update("DELETE FROM events WHERE id = ?", id.value());
    }

    public boolean attachAlbum(EventId eventId, AlbumId albumId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM event_albums WHERE event_id = ? AND album_id = ?",
            Integer.class, eventId.value(), albumId.value()
        );
        if (count != null && count > 0) {
            return false;
        }
        jdbc.update("INSERT INTO event_albums (event_id, album_id) VALUES (?, ?)",
            eventId.value(), albumId.value());
        return true;
    }

    public boolean detachAlbum(EventId eventId, AlbumId albumId) {
        return jdbc.update("DELETE FROM event_albums WHERE event_id = ? AND album_id = ?",
            eventId.value(), albumId.value()) > 0;
    }

    public Set<AlbumId> findAlbumIds(EventId eventId) {
        return new LinkedHashSet<>(jdbc.query(
            "SELECT album_id FROM event_albums WHERE event_id = ? ORDER BY album_id",
            (rs, rowNum) -> AlbumId.of(rs.getLong("album_id")),
            eventId.value()
        ));
    }

    public Set<EventId> findEventIdsForAlbum(AlbumId albumId) {
        return new LinkedHashSet<>(jdbc.query(
            "SELECT event_id FROM event_albums WHERE album_id = ? ORDER BY event_id",
            (rs, rowNum) -> EventId.of(rs.getLong("event_id")),
            albumId.value()
        ));
    }

    public List<Album> findAlbums(EventId eventId) {
        return jdbc.query("""
            SELECT a.*, COALESCE(p.cnt, 0) AS photo_count FROM albums a
            JOIN event_albums ea ON ea.album_id = a.id
            LEFT JOIN (SELECT album_id, COUNT(*) AS cnt FROM photos GROUP BY album_id) p
            ON a.id = p.album_id
            WHERE ea.event_id = ?
            ORDER BY a.created_at, a.id
            """,
            AlbumRepository.ALBUM_MAPPER, eventId.value()
        );
    }
}
