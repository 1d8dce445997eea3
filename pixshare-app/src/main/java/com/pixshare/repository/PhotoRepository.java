package com.pixshare.repository;

import com.pixshare.model.AlbumId;
import com.pixshare.model.Photo;
import com.pixshare.model.PhotoId;
import com.pixshare.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class PhotoRepository {

    private final JdbcTemplate jdbc;
    private final SimpleJdbcInsert insert;

    private static final RowMapper<Photo> PHOTO_MAPPER = (rs, rowNum) -> new Photo(
        PhotoId.of(rs.getLong("id")),
        AlbumId.of(rs.getLong("album_id")),
        UserId.of(rs.getLong("user_id")),
        rs.getString("filename"),
        rs.getString("filepath"),
        rs.getLong("size"),
        rs.getTimestamp("uploaded_at").toLocalDateTime(),
        rs.getObject("uploaded_via_share_id") != null ? rs.getLong("uploaded_via_share_id") : null,
        rs.getObject("uploaded_by_guest_id") != null ? rs.getLong("uploaded_by_guest_id") : null
    );

    public PhotoRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.insert = new SimpleJdbcInsert(jdbc)
            .withTableName("photos")
            .usingColumns("album_id", "user_id", "filename", "filepath", "size",
                "uploaded_via_share_id", "uploaded_by_guest_id")
            .usingGeneratedKeyColumns("id")
            .withoutTableColumnMetaDataAccess();
    }

    public Optional<Photo> findById(PhotoId id) {
        List<Photo> results = jdbc.query("SELECT * FROM photos WHERE id = ?", PHOTO_MAPPER, id.value());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Photo> findByAlbum(AlbumId albumId) {
        return jdbc.query(
            "SELECT * FROM photos WHERE album_id = ? ORDER BY uploaded_at, id",
            PHOTO_MAPPER, albumId.value()
        );
    }

    public List<Photo> findByAlbums(Collection<AlbumId> albumIds) {
        if (albumIds.isEmpty()) {
            return List.of();
        }
        String placeholders = albumIds.stream().map(id -> "?").collect(Collectors.joining(", "));
        return jdbc.query(
            "SELECT * FROM photos WHERE album_id IN (" + placeholders + ") ORDER BY uploaded_at, id",
            PHOTO_MAPPER,
            albumIds.stream().map(AlbumId::value).toArray()
        );
    }

    public int countByGuest(long shareId, long guestId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM photos WHERE uploaded_via_share_id = ? AND uploaded_by_guest_id = ?",
            Integer.class, shareId, guestId
        );
        return count != null ? count : 0;
    }

    public long sumSizeByOwner(UserId ownerId) {
        Long total = jdbc.queryForObject(
            "SELECT COALESCE(SUM(size), 0) FROM photos WHERE user_id = ?", Long.class, ownerId.value()
        );
        return total != null ? total : 0L;
    }

    public boolean existsByPath(String storagePath) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM photos WHERE filepath = ?", Integer.class, storagePath
        );
        return count != null && count > 0;
    }

    public PhotoId save(AlbumId albumId, UserId ownerId, String filename, String storagePath, long size,
                        Long uploadedViaShareId, Long uploadedByGuestId) {
        Map<String, Object> row = new HashMap<>();
        row.put("album_id", albumId.value());
        row.put("user_id", ownerId.value());
        row.put("filename", filename);
        row.put("filepath", storagePath);
        row.put("size", size);
        row.put("uploaded_via_share_id", uploadedViaShareId);
        row.put("uploaded_by_guest_id", uploadedByGuestId);
        return PhotoId.of(insert.executeAndReturnKey(row).longValue());
    }

    public void delete(PhotoId id) {
        jdbc.update("DELETE FROM photos WHERE id = ?", id.value());
    }

    public void deleteByAlbum(AlbumId albumId) {
        jdbc.update("DELETE FROM photos WHERE album_id = ?", albumId.value());
    }
}
