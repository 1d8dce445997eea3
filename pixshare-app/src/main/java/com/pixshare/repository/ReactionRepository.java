package com.pixshare.repository;

import com.pixshare.model.PhotoId;
import com.pixshare.model.Reaction;
import com.pixshare.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class ReactionRepository {

    private final JdbcTemplate jdbc;

    public ReactionRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<Reaction> countByPhoto(PhotoId photoId) {
        return jdbc.query("""
            SELECT photo_id, emoji, COUNT(*) AS cnt FROM photo_reactions
            WHERE photo_id = ?
            GROUP BY photo_id, emoji
            ORDER BY cnt DESC, emoji
            """,
            (rs, rowNum) -> new Reaction(PhotoId.of(rs.getLong("photo_id")), rs.getString("emoji"), rs.getInt("cnt")),
            photoId.value()
        );
    }

    /**
     * Adds the reaction unless this user or guest already left the same emoji.
     * Exactly one of {@code userId} and {@code guestId} is set.
     */
    public boolean add(PhotoId photoId, String emoji, UserId userId, Long guestId, Long shareId) {
        if (exists(photoId, emoji, userId, guestId)) {
            return false;
        }
        jdbc.update(
            "INSERT INTO photo_reactions (photo_id, emoji, user_id, guest_id, share_id) VALUES (?, ?, ?, ?, ?)",
            photoId.value(), emoji, userId != null ? userId.value() : null, guestId, shareId
        );
        return true;
    }

    public boolean remove(PhotoId photoId, String emoji, UserId userId, Long guestId) {
        if (userId != null) {
            return jdbc.update("DELETE FROM photo_reactions WHERE photo_id = ? AND emoji = ? AND user_id = ?",
                photoId.value(), emoji, userId.value()) > 0;
        }
        return jdbc.update("DELETE FROM photo_reactions WHERE photo_id = ? AND emoji = ? AND guest_id = ?",
            photoId.value(), emoji, guestId) > 0;
    }

    private boolean exists(PhotoId photoId, String emoji, UserId userId, Long guestId) {
        Integer count = userId != null
            ? jdbc.queryForObject(
                "SELECT COUNT(*) FROM photo_reactions WHERE photo_id = ? AND emoji = ? AND user_id = ?",
                Integer.class, photoId.value(), emoji, userId.value())
            : jdbc.queryForObject(
                "SELECT COUNT(*) FROM photo_reactions WHERE photo_id = ? AND emoji = ? AND guest_id = ?",
                Integer.class, photoId.value(), emoji, guestId);
        return count != null && count > 0;
    }
}
