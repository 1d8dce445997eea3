package com.pixshare.service;

import com.pixshare.model.Album;
import com.pixshare.model.AlbumId;
import com.pixshare.model.Event;
import com.pixshare.model.EventId;
import com.pixshare.model.ResourceRef;
import com.pixshare.model.Share;
import com.pixshare.model.UserId;
import com.pixshare.repository.EventRepository;
import com.pixshare.repository.ShareRepository;
import com.pixshare.security.AuthorizationEngine;
import com.pixshare.security.AuthorizationException;
import com.pixshare.security.Credentials;
import com.pixshare.security.Operation;
import com.pixshare.security.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Service
public class EventService {

    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final EventRepository eventRepository;
    private final ShareRepository shareRepository;
    private final ShareService shareService;
    private final AuthorizationEngine engine;

    public EventService(EventRepository eventRepository,
                        ShareRepository shareRepository,
                        ShareService shareService,
                        AuthorizationEngine engine) {
        this.eventRepository = eventRepository;
        this.shareRepository = shareRepository;
        this.shareService = shareService;
        this.engine = engine;
    }

    public record EventDetails(Event event, List<Album> albums, Verdict access) {}

    public record EventWithLink(Event event, Share share) {}

    /**
     * Creates an event together with its first, view-only share link.
     */
    @Transactional
    public EventWithLink createEvent(String title, String description, LocalDate date, Credentials credentials) {
        UserId owner = engine.requireUser(credentials);
        String name = requireTitle(title);
        EventId id = eventRepository.save(name, description, date, owner);
        Share share = shareService.insert(ResourceRef.event(id.value()), ShareService.ShareRequest.viewOnly());
        log.info("User {} created event {}", owner, id);
        return new EventWithLink(eventRepository.findById(id).orElseThrow(), share);
    }

    public List<Event> listOwnEvents(Credentials credentials) {
        return eventRepository.findByOwner(engine.requireUser(credentials));
    }

    public EventDetails getEvent(EventId id, Credentials credentials) {
        Verdict access = engine.requireConcealed(Operation.VIEW_EVENT, ref(id), credentials);
        Event event = eventRepository.findById(id)
            .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));
        return new EventDetails(event, eventRepository.findAlbums(id), access);
    }

    @Transactional
    public Event updateEvent(EventId id, String title, String description, LocalDate date, Credentials credentials) {
        engine.requireConcealed(Operation.EDIT_EVENT, ref(id), credentials);
        Event current = eventRepository.findById(id)
            .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));
        String newTitle = title != null && !title.isBlank() ? title.trim() : current.title();
        String newDescription = description != null ? description : current.description();
        LocalDate newDate = date != null ? date : current.date();
        eventRepository.update(id, newTitle, newDescription, newDate);
        return eventRepository.findById(id).orElseThrow();
    }

    /**
     * Deletes the event with its shares. Album links and participants go with it.
     */
    @Transactional
    public void deleteEvent(EventId id, Credentials credentials) {
        engine.requireConcealed(Operation.EDIT_EVENT, ref(id), credentials);
        int shares = shareRepository.deleteByEvent(id);
        eventRepository.delete(id);
        log.info("Deleted event {} and {} shares", id, shares);
    }

    /**
     * Issues a new view-only link, optionally revoking every existing link first.
     */
    @Transactional
    public Share rotateLink(EventId id, boolean revokeOld, Credentials credentials) {
        engine.requireConcealed(Operation.MANAGE, ref(id), credentials);
        if (revokeOld) {
            int revoked = shareRepository.deleteByEvent(id);
            log.info("Revoked {} shares of event {}", revoked, id);
        }
        return shareService.insert(ref(id), ShareService.ShareRequest.viewOnly());
    }

    /**
     * Links an album to an event. The caller must be able to edit the event's
     * links and must own the album itself.
     */
    @Transactional
    public boolean attachAlbum(EventId eventId, AlbumId albumId, Credentials credentials) {
        Verdict eventAccess = engine.requireConcealed(Operation.LINK_ALBUM, ref(eventId), credentials);
        engine.requireConcealed(Operation.MANAGE, ResourceRef.album(albumId.value()), credentials);
        boolean attached = eventRepository.attachAlbum(eventId, albumId);
        if (attached) {
            log.info("User {} attached album {} to event {}", eventAccess.userId(), albumId, eventId);
        }
        return attached;
    }

    @Transactional
    public boolean detachAlbum(EventId eventId, AlbumId albumId, Credentials credentials) {
        engine.requireConcealed(Operation.LINK_ALBUM, ref(eventId), credentials);
        return eventRepository.detachAlbum(eventId, albumId);
    }

    private static ResourceRef ref(EventId id) {
        return ResourceRef.event(id.value());
    }

    private static String requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Event name is required");
        }
        String trimmed = title.trim();
        if (trimmed.length() > 120) {
            throw new IllegalArgumentException("Event name must be at most 120 characters");
        }
        return trimmed;
    }
}
