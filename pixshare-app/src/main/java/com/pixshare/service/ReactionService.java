package com.pixshare.service;

import com.pixshare.model.Guest;
import com.pixshare.model.PhotoId;
import com.pixshare.model.Reaction;
import com.pixshare.model.ResourceRef;
import com.pixshare.repository.ReactionRepository;
import com.pixshare.security.AuthorizationEngine;
import com.pixshare.security.Credentials;
import com.pixshare.security.Operation;
import com.pixshare.security.Verdict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Emoji reactions. Each user, or guest, holds at most one of each emoji per photo.
 */
@Service
public class ReactionService {

    static final int MAX_EMOJI_LENGTH = 16;

    private final ReactionRepository reactionRepository;
    private final GuestService guestService;
    private final AuthorizationEngine engine;

    public ReactionService(ReactionRepository reactionRepository, GuestService guestService, AuthorizationEngine engine) {
        this.reactionRepository = reactionRepository;
        this.guestService = guestService;
        this.engine = engine;
    }

    public List<Reaction> listReactions(PhotoId photoId, Credentials credentials) {
        engine.requireConcealed(Operation.VIEW_PHOTO, ResourceRef.photo(photoId.value()), credentials);
        return reactionRepository.countByPhoto(photoId);
    }

    @Transactional
    public List<Reaction> addReaction(PhotoId photoId, String emoji, String guestKey, Credentials credentials) {
        Verdict verdict = engine.require(Operation.REACT, ResourceRef.photo(photoId.value()), credentials);
        String value = checkEmoji(emoji);
        Long shareId = verdict.share() != null ? verdict.share().id() : null;
        reactionRepository.add(photoId, value, verdict.userId(), guestOf(verdict, guestKey), shareId);
        return reactionRepository.countByPhoto(photoId);
    }

    @Transactional
    public List<Reaction> removeReaction(PhotoId photoId, String emoji, String guestKey, Credentials credentials) {
        Verdict verdict = engine.require(Operation.REACT, ResourceRef.photo(photoId.value()), credentials);
        reactionRepository.remove(photoId, checkEmoji(emoji), verdict.userId(), guestOf(verdict, guestKey));
        return reactionRepository.countByPhoto(photoId);
    }

    private Long guestOf(Verdict verdict, String guestKey) {
        if (verdict.userId() != null) {
            return null;
        }
        return guestService.resolve(verdict.share(), guestKey)
            .map(Guest::id)
            .orElseThrow(() -> new IllegalArgumentException("Register a display name before reacting"));
    }

    private static String checkEmoji(String emoji) {
        if (emoji == null || emoji.isBlank() || emoji.length() > MAX_EMOJI_LENGTH) {
            throw new IllegalArgumentException("Invalid emoji");
        }
        return emoji.trim();
    }
}
