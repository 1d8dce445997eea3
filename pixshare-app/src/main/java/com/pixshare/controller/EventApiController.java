package com.pixshare.controller;

import com.pixshare.model.AlbumId;
import com.pixshare.model.Event;
import com.pixshare.model.EventId;
import com.pixshare.model.Participant;
import com.pixshare.model.Share;
import com.pixshare.model.UserId;
import com.pixshare.security.Credentials;
import com.pixshare.service.EventService;
import com.pixshare.service.ParticipantService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/events")
public class EventApiController {

    private final EventService eventService;
    private final ParticipantService participantService;

    public EventApiController(EventService eventService, ParticipantService participantService) {
        this.eventService = eventService;
        this.participantService = participantService;
    }

    @GetMapping
    public ResponseEntity<List<Event>> listEvents(HttpServletRequest request) {
        return ResponseEntity.ok(eventService.listOwnEvents(RequestCredentials.from(request)));
    }

    @PostMapping
    public ResponseEntity<?> createEvent(@RequestBody Map<String, Object> body, HttpServletRequest request) {
        EventService.EventWithLink created = eventService.createEvent(
            (String) body.get("name"),
            (String) body.get("description"),
            parseDate(body.get("date")),
            RequestCredentials.from(request));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("event", created.event());
        response.put("share", created.share());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getEvent(@PathVariable long id, HttpServletRequest request) {
        EventService.EventDetails details = eventService.getEvent(EventId.of(id), RequestCredentials.from(request));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("event", details.event());
        response.put("albums", details.albums());
        response.put("access", details.access().basis());
        response.put("capabilities", details.access().capabilities());
        return ResponseEntity.ok(response);
    }

    @PutMapping("/{id}")
    public ResponseEntity<Event> updateEvent(@PathVariable long id,
                                             @RequestBody Map<String, Object> body,
                                             HttpServletRequest request) {
        Object name = body.get("name") != null ? body.get("name") : body.get("title");
        Event event = eventService.updateEvent(EventId.of(id), (String) name,
            (String) body.get("description"), parseDate(body.get("date")), RequestCredentials.from(request));
        return ResponseEntity.ok(event);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteEvent(@PathVariable long id, HttpServletRequest request) {
        eventService.deleteEvent(EventId.of(id), RequestCredentials.from(request));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/rotate-link")
    public ResponseEntity<Share> rotateLink(@PathVariable long id,
                                            @RequestBody(required = false) Map<String, Object> body,
                                            HttpServletRequest request) {
        boolean revokeOld = body != null && Boolean.TRUE.equals(body.get("revoke_old"));
        return ResponseEntity.ok(eventService.rotateLink(EventId.of(id), revokeOld, RequestCredentials.from(request)));
    }

    @PostMapping("/{id}/albums/{albumId}")
    public ResponseEntity<?> attachAlbum(@PathVariable long id, @PathVariable long albumId, HttpServletRequest request) {
        if (!eventService.attachAlbum(EventId.of(id), AlbumId.of(albumId), RequestCredentials.from(request))) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "Album is already linked to this event"));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("eventId", id, "albumId", albumId));
    }

    @DeleteMapping("/{id}/albums/{albumId}")
    public ResponseEntity<Void> detachAlbum(@PathVariable long id, @PathVariable long albumId, HttpServletRequest request) {
        if (!eventService.detachAlbum(EventId.of(id), AlbumId.of(albumId), RequestCredentials.from(request))) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/join")
    public ResponseEntity<?> join(@PathVariable long id, HttpServletRequest request) {
        Credentials credentials = RequestCredentials.from(request);
        Optional<Participant> participant = participantService.join(EventId.of(id), credentials);
        return participant
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.ok(Map.of("owner", true)));
    }

    @PostMapping("/{id}/leave")
    public ResponseEntity<Void> leave(@PathVariable long id, HttpServletRequest request) {
        participantService.leave(EventId.of(id), RequestCredentials.from(request));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/participants")
    public ResponseEntity<List<Participant>> listParticipants(@PathVariable long id, HttpServletRequest request) {
        return ResponseEntity.ok(participantService.listParticipants(EventId.of(id), RequestCredentials.from(request)));
    }

    @DeleteMapping("/{id}/participants/{userId}")
    public ResponseEntity<Void> removeParticipant(@PathVariable long id,
                                                  @PathVariable long userId,
                                                  HttpServletRequest request) {
        participantService.remove(EventId.of(id), UserId.of(userId), RequestCredentials.from(request));
        return ResponseEntity.noContent().build();
    }

    private static LocalDate parseDate(Object value) {
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.toString());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date, expected YYYY-MM-DD: " + value);
        }
    }
}
