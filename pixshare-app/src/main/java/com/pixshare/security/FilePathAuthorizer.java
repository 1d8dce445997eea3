package com.pixshare.security;

import com.pixshare.model.AlbumId;
import com.pixshare.model.Capabilities;
import com.pixshare.model.EventId;
import com.pixshare.model.Photo;
import com.pixshare.model.ResourceRef;
import com.pixshare.model.Share;
import com.pixshare.model.StoragePath;
import com.pixshare.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Authorizes reads of raw uploaded files addressed by their storage-relative path.
 * <p>
 * The path is parsed into owner and album segments before anything else; a
 * path that does not parse is refused without a single lookup. Only then is
 * membership checked: the owner segment against the session identity, the
 * album against the caller's events, or the album (or exact file, for photo
 * links) against the share's scope.
 */
@Service
public class FilePathAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(FilePathAuthorizer.class);

    private final IdentityResolver identityResolver;
    private final ShareResolver shareResolver;
    private final ResourceGraph graph;
    private final Clock clock;

    public FilePathAuthorizer(IdentityResolver identityResolver,
                              ShareResolver shareResolver,
                              ResourceGraph graph,
                              Clock clock) {
        this.identityResolver = identityResolver;
        this.shareResolver = shareResolver;
        this.graph = graph;
        this.clock = clock;
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Verdict authorize(String path, Credentials credentials) {
        Optional<StoragePath> parsed = StoragePath.parse(path);
        if (parsed.isEmpty()) {
            log.debug("Refusing malformed file path");
            return Verdict.forbidden("Invalid file path");
        }
        Credentials creds = credentials != null ? credentials : Credentials.none();
        if (creds.isEmpty()) {
            return Verdict.authenticationRequired();
        }

        try {
            return decide(parsed.get(), path, creds);
        } catch (RuntimeException e) {
            log.warn("Denying file {}: lookup failed", path, e);
            return Verdict.forbidden("Access could not be verified");
        }
    }

    private Verdict decide(StoragePath file, String path, Credentials creds) {
        Optional<UserId> user = creds.hasSession()
            ? identityResolver.resolve(creds.session())
            : Optional.empty();

        if (user.isPresent()) {
            UserId userId = user.get();
            if (userId.equals(file.ownerId())) {
                return Verdict.granted(Verdict.Basis.OWNER, Capabilities.ALL, userId, null);
            }
            Optional<Verdict> viaEvent = viaEvent(userId, file);
            if (viaEvent.isPresent()) {
                return viaEvent.get();
            }
        }

        if (creds.hasShareToken()) {
            Optional<Share> resolved = shareResolver.resolve(creds.shareToken());
            if (resolved.isEmpty() || !resolved.get().isUsableAt(LocalDateTime.now(clock))) {
                return Verdict.notFound();
            }
            Share share = resolved.get();
            if (shareCovers(share.scope(), file, path)) {
                return Verdict.granted(Verdict.Basis.SHARE, share.capabilities(), user.orElse(null), share);
            }
            return Verdict.forbidden("This link does not cover the requested file");
        }

        return user.isPresent()
            ? Verdict.forbidden("Not permitted to read this file")
            : Verdict.authenticationRequired();
    }

    /**
     * Grants when the album really belongs to the owner named in the path and is
     * attached to an event the user owns or has joined.
     */
    private Optional<Verdict> viaEvent(UserId userId, StoragePath file) {
        if (!albumBelongsToPathOwner(file)) {
            return Optional.empty();
        }
        for (EventId eventId : graph.findEventsForAlbum(file.albumId())) {
            if (graph.findEventOwner(eventId).filter(userId::equals).isPresent()) {
                return Optional.of(Verdict.granted(Verdict.Basis.OWNER, Capabilities.ALL, userId, null));
            }
            if (graph.isParticipant(eventId, userId)) {
                return Optional.of(Verdict.granted(Verdict.Basis.PARTICIPANT, Capabilities.NONE, userId, null));
            }
        }
        return Optional.empty();
    }

    private boolean shareCovers(ResourceRef scope, StoragePath file, String path) {
        AlbumId albumId = file.albumId();
        return switch (scope.kind()) {
            case ALBUM -> scope.albumId().equals(albumId) && albumBelongsToPathOwner(file);
            case EVENT -> graph.findAlbumsForEvent(scope.eventId()).contains(albumId)
                && albumBelongsToPathOwner(file);
            case PHOTO -> graph.findPhoto(scope.photoId())
                .filter(photo -> photo.albumId().equals(albumId))
                .filter(photo -> isFileOf(photo, path))
                .isPresent();
        };
    }

    private static boolean isFileOf(Photo photo, String path) {
        return path.equals(photo.storagePath()) || path.equals(photo.thumbnailPath());
    }

    private boolean albumBelongsToPathOwner(StoragePath file) {
        return graph.findAlbumOwner(file.albumId()).filter(file.ownerId()::equals).isPresent();
    }
}
