package com.pixshare.repository;

import com.pixshare.model.AlbumId;
import com.pixshare.model.EventId;
import com.pixshare.model.Participant;
import com.pixshare.model.Photo;
import com.pixshare.model.PhotoId;
import com.pixshare.model.UserId;
import com.pixshare.security.ResourceGraph;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

@Component
public class JdbcResourceGraph implements ResourceGraph {

    private final AlbumRepository albumRepository;
    private final PhotoRepository photoRepository;
    private final EventRepository eventRepository;
    private final ParticipantRepository participantRepository;

    public JdbcResourceGraph(AlbumRepository albumRepository,
                             PhotoRepository photoRepository,
                             EventRepository eventRepository,
                             ParticipantRepository participantRepository) {
        this.albumRepository = albumRepository;
        this.photoRepository = photoRepository;
        this.eventRepository = eventRepository;
        this.participantRepository = participantRepository;
    }

    @Override
    public Optional<UserId> findAlbumOwner(AlbumId albumId) {
        return albumRepository.findOwner(albumId);
    }

    @Override
    public Optional<Photo> findPhoto(PhotoId photoId) {
        return photoRepository.findById(photoId);
    }

    @Override
    public Optional<UserId> findEventOwner(EventId eventId) {
        return eventRepository.findOwner(eventId);
    }

    @Override
    public Set<AlbumId> findAlbumsForEvent(EventId eventId) {
        return eventRepository.findAlbumIds(eventId);
    }

    @Override
    public Set<EventId> findEventsForAlbum(AlbumId albumId) {
        return eventRepository.findEventIdsForAlbum(albumId);
    }

    @Override
    public Optional<Participant> findParticipant(EventId eventId, UserId userId) {
        return participantRepository.find(eventId, userId);
    }
}
