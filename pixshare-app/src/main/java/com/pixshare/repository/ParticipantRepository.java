package com.pixshare.repository;

import com.pixshare.model.Capabilities;
import com.pixshare.model.EventId;
import com.pixshare.model.Participant;
import com.pixshare.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class ParticipantRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Participant> PARTICIPANT_MAPPER = (rs, rowNum) -> new Participant(
        rs.getLong("id"),
        EventId.of(rs.getLong("event_id")),
        UserId.of(rs.getLong("user_id")),
        rs.getString("share_token"),
        new Capabilities(
            rs.getBoolean("can_comment"),
            rs.getBoolean("can_react"),
            rs.getBoolean("can_upload"),
            rs.getBoolean("can_curate")
        ),
        rs.getTimestamp("joined_at").toLocalDateTime()
    );

    public ParticipantRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Participant> find(EventId eventId, UserId userId) {
        List<Participant> results = jdbc.query(
            "SELECT * FROM event_participants WHERE event_id = ? AND user_id = ?",
            PARTICIPANT_MAPPER, eventId.value(), userId.value()
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Participant> findByEvent(EventId eventId) {
        return jdbc.query(
            "SELECT * FROM event_participants WHERE event_id = ? ORDER BY joined_at, id",
            PARTICIPANT_MAPPER, eventId.value()
        );
    }

    public void save(EventId eventId, UserId userId, String shareToken, Capabilities capabilities) {
        jdbc.update("""
            INSERT INTO event_participants
                (event_id, user_id, share_token, can_comment, can_react, can_upload, can_curate)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
            eventId.value(), userId.value(), shareToken,
            capabilities.canComment(), capabilities.canReact(),
            capabilities.canUpload(), capabilities.canCurate()
        );
    }

    public boolean delete(EventId eventId, UserId userId) {
        return jdbc.update("DELETE FROM event_participants WHERE event_id = ? AND user_id = ?",
            eventId.value(), userId.value()) > 0;
    }
}
