package com.pixshare.service;

import com.pixshare.model.EventId;
import com.pixshare.model.Participant;
import com.pixshare.model.ResourceRef;
import com.pixshare.model.Share;
import com.pixshare.model.UserId;
import com.pixshare.repository.ParticipantRepository;
import com.pixshare.security.AuthorizationEngine;
import com.pixshare.security.AuthorizationException;
import com.pixshare.security.Credentials;
import com.pixshare.security.Operation;
import com.pixshare.security.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Event membership. A user joins by redeeming an event share while signed in;
 * the share's flags are copied onto the participant row and stay as they were
 * even if the share is later changed or revoked.
 */
@Service
public class ParticipantService {

    private static final Logger log = LoggerFactory.getLogger(ParticipantService.class);

    private final ParticipantRepository participantRepository;
    private final AuthorizationEngine engine;

    public ParticipantService(ParticipantRepository participantRepository, AuthorizationEngine engine) {
        this.participantRepository = participantRepository;
        this.engine = engine;
    }

    /**
     * @return the participant row, or empty when the caller owns the event
     */
    @Transactional
    public Optional<Participant> join(EventId eventId, Credentials credentials) {
        Verdict verdict = engine.require(Operation.JOIN_EVENT, ResourceRef.event(eventId.value()), credentials);
        UserId userId = verdict.userId();
        switch (verdict.basis()) {
            case OWNER:
                return Optional.empty();
            case PARTICIPANT:
                return participantRepository.find(eventId, userId);
            default:
                break;
        }

        Share share = verdict.share();
        try {
            participantRepository.save(eventId, userId, share.token(), share.capabilities());
            log.info("User {} joined event {} via share {}", userId, eventId, share.id());
        } catch (DuplicateKeyException e) {
            log.debug("User {} already joined event {}", userId, eventId);
        }
        return participantRepository.find(eventId, userId);
    }

    @Transactional
    public void leave(EventId eventId, Credentials credentials) {
        Verdict verdict = engine.requireConcealed(Operation.LEAVE_EVENT, ResourceRef.event(eventId.value()), credentials);
        if (verdict.basis() == Verdict.Basis.OWNER) {
            throw new IllegalArgumentException("The event owner cannot leave the event");
        }
        participantRepository.delete(eventId, verdict.userId());
        log.info("User {} left event {}", verdict.userId(), eventId);
    }

    @Transactional
    public void remove(EventId eventId, UserId participant, Credentials credentials) {
        engine.requireConcealed(Operation.EDIT_EVENT, ResourceRef.event(eventId.value()), credentials);
        if (!participantRepository.delete(eventId, participant)) {
            throw new AuthorizationException(Verdict.notFound());
        }
        log.info("Removed user {} from event {}", participant, eventId);
    }

    public List<Participant> listParticipants(EventId eventId, Credentials credentials) {
        engine.requireConcealed(Operation.EDIT_EVENT, ResourceRef.event(eventId.value()), credentials);
        return participantRepository.findByEvent(eventId);
    }
}
