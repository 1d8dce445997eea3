package com.pixshare.service;

import com.pixshare.model.Comment;
import com.pixshare.model.Guest;
import com.pixshare.model.PhotoId;
import com.pixshare.model.ResourceRef;
import com.pixshare.repository.CommentRepository;
import com.pixshare.security.AuthorizationEngine;
import com.pixshare.security.AuthorizationException;
import com.pixshare.security.Credentials;
import com.pixshare.security.Operation;
import com.pixshare.security.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class CommentService {

    private static final Logger log = LoggerFactory.getLogger(CommentService.class);

    static final int MAX_LENGTH = 2000;

    private final CommentRepository commentRepository;
    private final GuestService guestService;
    private final AuthorizationEngine engine;

    public CommentService(CommentRepository commentRepository, GuestService guestService, AuthorizationEngine engine) {
        this.commentRepository = commentRepository;
        this.guestService = guestService;
        this.engine = engine;
    }

    public List<Comment> listComments(PhotoId photoId, Credentials credentials) {
        engine.requireConcealed(Operation.VIEW_PHOTO, ResourceRef.photo(photoId.value()), credentials);
        return commentRepository.findByPhoto(photoId);
    }

    /**
     * Posts a comment as the signed-in user or, on a share link without a
     * session, as the registered guest.
     */
    @Transactional
    public Comment postComment(PhotoId photoId, String content, String guestKey, Credentials credentials) {
        Verdict verdict = engine.require(Operation.COMMENT, ResourceRef.photo(photoId.value()), credentials);
        String text = content == null ? "" : content.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Comment cannot be empty");
        }
        if (text.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Comment must be at most " + MAX_LENGTH + " characters");
        }

        Long shareId = verdict.share() != null ? verdict.share().id() : null;
        Long guestId = null;
        if (verdict.userId() == null) {
            guestId = guestService.resolve(verdict.share(), guestKey)
                .map(Guest::id)
                .orElseThrow(() -> new IllegalArgumentException("Register a display name before commenting"));
        }
        long id = commentRepository.save(photoId, text, verdict.userId(), guestId, shareId);
        log.debug("Comment {} on photo {} by user {} guest {}", id, photoId, verdict.userId(), guestId);
        return commentRepository.findById(id).orElseThrow();
    }

    /**
     * The author may delete their own comment, and the photo's owner any comment on it.
     */
    @Transactional
    public void deleteComment(PhotoId photoId, long commentId, String guestKey, Credentials credentials) {
        Comment comment = commentRepository.findById(commentId)
            .filter(c -> c.photoId().equals(photoId))
            .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));
        ResourceRef photo = ResourceRef.photo(comment.photoId().value());
        Verdict verdict = engine.requireConcealed(Operation.VIEW_PHOTO, photo, credentials);

        if (!isAuthor(comment, verdict, guestKey)
                && !engine.authorize(Operation.MANAGE, photo, credentials).isGranted()) {
            throw new AuthorizationException(Verdict.forbidden("Only the author or the photo owner can delete this comment"));
        }
        commentRepository.delete(commentId);
        log.debug("Deleted comment {}", commentId);
    }

    private boolean isAuthor(Comment comment, Verdict verdict, String guestKey) {
        if (comment.userId() != null) {
            return comment.userId().equals(verdict.userId());
        }
        if (comment.guestId() == null) {
            return false;
        }
        Optional<Guest> guest = guestService.resolve(verdict.share(), guestKey);
        return guest.isPresent() && guest.get().id().equals(comment.guestId());
    }
}
