package com.pixshare.repository;

import com.pixshare.model.Comment;
import com.pixshare.model.PhotoId;
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
public class CommentRepository {

    private final JdbcTemplate jdbc;
    private final SimpleJdbcInsert insert;

    private static final RowMapper<Comment> COMMENT_MAPPER = (rs, rowNum) -> new Comment(
        rs.getLong("id"),
        PhotoId.of(rs.getLong("photo_id")),
        rs.getString("content"),
        rs.getObject("user_id") != null ? UserId.of(rs.getLong("user_id")) : null,
        rs.getObject("guest_id") != null ? rs.getLong("guest_id") : null,
        rs.getObject("share_id") != null ? rs.getLong("share_id") : null,
        rs.getString("author"),
        rs.getTimestamp("created_at").toLocalDateTime()
    );

    private static final String SELECT_WITH_AUTHOR = """
        SELECT c.*, COALESCE(u.full_name, g.display_name, 'Guest') AS author FROM comments c
        LEFT JOIN users u ON u.id = c.user_id
        LEFT JOIN guests g ON g.id = c.guest_id
        """;

    public CommentRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.insert = new SimpleJdbcInsert(jdbc)
            .withTableName("comments")
            .usingColumns("photo_id", "content", "user_id", "guest_id", "share_id")
            .usingGeneratedKeyColumns("id")
            .withoutTableColumnMetaDataAccess();
    }

    public List<Comment> findByPhoto(PhotoId photoId) {
        return jdbc.query(
            SELECT_WITH_AUTHOR + " WHERE c.photo_id = ? ORDER BY c.created_at, c.id",
            COMMENT_MAPPER, photoId.value()
        );
    }

    public Optional<Comment> findById(long id) {
        List<Comment> results = jdbc.query(SELECT_WITH_AUTHOR + " WHERE c.id = ?", COMMENT_MAPPER, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(PhotoId photoId, String content, UserId userId, Long guestId, Long shareId) {
        Map<String, Object> row = new HashMap<>();
        row.put("photo_id", photoId.value());
        row.put("content", content);
        row.put("user_id", userId != null ? userId.value() : null);
        row.put("guest_id", guestId);
        row.put("share_id", shareId);
        return insert.executeAndReturnKey(row).longValue();
    }

    public void delete(long id) {
        jdbc.update("DELETE FROM comments WHERE id = ?", id);
    }
}
