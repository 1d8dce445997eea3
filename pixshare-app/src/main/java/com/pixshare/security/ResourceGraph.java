package com.pixshare.security;

import com.pixshare.model.AlbumId;
import com.pixshare.model.EventId;
import com.pixshare.model.Participant;
import com.pixshare.model.Photo;
import com.pixshare.model.PhotoId;
import com.pixshare.model.UserId;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only facts about ownership, event attachment and membership that access
 * decisions are made from.
 */
public interface ResourceGraph {

    Optional<UserId> findAlbumOwner(AlbumId albumId);

    Optional<Photo> findPhoto(PhotoId photoId);

    Optional<UserId> findEventOwner(EventId eventId);

    Set<AlbumId> findAlbumsForEvent(EventId eventId);

    Set<EventId> findEventsForAlbum(AlbumId albumId);

    Optional<Participant> findParticipant(EventId eventId, UserId userId);

    default boolean isParticipant(EventId eventId, UserId userId) {
        return findParticipant(eventId, userId).isPresent();
    }
}
