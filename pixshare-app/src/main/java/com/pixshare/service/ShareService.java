package com.pixshare.service;

import com.pixshare.model.Album;
import com.pixshare.model.Capabilities;
import com.pixshare.model.Event;
import com.pixshare.model.Photo;
import com.pixshare.model.ResourceKind;
import com.pixshare.model.ResourceRef;
import com.pixshare.model.Share;
import com.pixshare.repository.AlbumRepository;
import com.pixshare.repository.EventRepository;
import com.pixshare.repository.PhotoRepository;
import com.pixshare.repository.ShareRepository;
import com.pixshare.security.AuthorizationEngine;
import com.pixshare.security.AuthorizationException;
import com.pixshare.security.Credentials;
import com.pixshare.security.Operation;
import com.pixshare.security.ShareResolver;
import com.pixshare.security.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
public class ShareService {

    private static final Logger log = LoggerFactory.getLogger(ShareService.class);

    private final ShareRepository shareRepository;
    private final AlbumRepository albumRepository;
    private final PhotoRepository photoRepository;
    private final EventRepository eventRepository;
    private final ShareResolver shareResolver;
    private final AuthorizationEngine engine;
    private final Clock clock;

    public ShareService(ShareRepository shareRepository,
                        AlbumRepository albumRepository,
                        PhotoRepository photoRepository,
                        EventRepository eventRepository,
                        ShareResolver shareResolver,
                        AuthorizationEngine engine,
                        Clock clock) {
        this.shareRepository = shareRepository;
        this.albumRepository = albumRepository;
        this.photoRepository = photoRepository;
        this.eventRepository = eventRepository;
        this.shareResolver = shareResolver;
        this.engine = engine;
        this.clock = clock;
    }

    /**
     * Options for a new share. Null limits mean unlimited, a null expiry never expires.
     */
    public record ShareRequest(
        Capabilities capabilities,
        LocalDateTime expiresAt,
        Long maxUploadBytes,
        Integer maxFilesPerGuest
    ) {
        public static ShareRequest viewOnly() {
            return new ShareRequest(Capabilities.NONE, null, null, null);
        }
    }

    /**
     * What an opened share link shows: the event (event links only), the albums
     * and the photos within its scope.
     */
    public record SharedView(Share share, Event event, List<Album> albums, List<Photo> photos) {}

    @Transactional
    public Share createShare(ResourceRef scope, ShareRequest request, Credentials credentials) {
        engine.requireConcealed(Operation.MANAGE, scope, credentials);
        validate(request);
        Share share = insert(scope, request);
        log.info("Created {} share {} for {}", scope.kind(), share.id(), scope);
        return share;
    }

    /**
     * Deletes a share. Expired shares on the same resource are swept at the same time.
     */
    @Transactional
    public void revoke(long shareId, Credentials credentials) {
        Share share = shareRepository.findById(shareId)
            .filter(s -> s.scope() != null)
            .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));
        engine.requireConcealed(Operation.MANAGE, share.scope(), credentials);
        shareRepository.delete(shareId);
        int swept = shareRepository.deleteExpired(share.scope(), LocalDateTime.now(clock));
        log.info("Revoked share {} on {} ({} expired swept)", shareId, share.scope(), swept);
    }

    public List<Share> listShares(ResourceRef scope, Credentials credentials) {
        engine.requireConcealed(Operation.MANAGE, scope, credentials);
        return shareRepository.findByScope(scope);
    }

    /**
     * Opens a share link of the expected kind and returns everything it lets an
     * anonymous visitor see.
     */
    @Transactional(readOnly = true)
    public SharedView open(String token, ResourceKind expectedKind) {
        Share share = shareResolver.resolve(token)
            .filter(s -> s.isUsableAt(LocalDateTime.now(clock)))
            .filter(s -> s.scope().kind() == expectedKind)
            .orElseThrow(() -> new AuthorizationException(Verdict.invalidShare()));
        ResourceRef scope = share.scope();
        Credentials credentials = Credentials.ofShare(token);

        return switch (expectedKind) {
            case ALBUM -> {
                engine.require(Operation.VIEW_ALBUM, scope, credentials);
                Album album = albumRepository.findById(scope.albumId())
                    .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));
                yield new SharedView(share, null, List.of(album), photoRepository.findByAlbum(album.id()));
            }
            case PHOTO -> {
                engine.require(Operation.VIEW_PHOTO, scope, credentials);
                Photo photo = photoRepository.findById(scope.photoId())
                    .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));
                yield new SharedView(share, null, List.of(), List.of(photo));
            }
            case EVENT -> {
                engine.require(Operation.VIEW_EVENT, scope, credentials);
                Event event = eventRepository.findById(scope.eventId())
                    .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));
                List<Album> albums = eventRepository.findAlbums(event.id());
                List<Photo> photos = photoRepository.findByAlbums(albums.stream().map(Album::id).toList());
                yield new SharedView(share, event, albums, photos);
            }
        };
    }

    Share insert(ResourceRef scope, ShareRequest request) {
        String token = Tokens.newToken();
        while (shareRepository.tokenExists(token)) {
            token = Tokens.newToken();
        }
        long id = shareRepository.save(scope, token, request.capabilities(),
            request.expiresAt(), request.maxUploadBytes(), request.maxFilesPerGuest());
        return shareRepository.findById(id).orElseThrow();
    }

    private void validate(ShareRequest request) {
        if (request.capabilities() == null) {
            throw new IllegalArgumentException("Capabilities are required");
        }
        if (request.expiresAt() != null && !request.expiresAt().isAfter(LocalDateTime.now(clock))) {
            throw new IllegalArgumentException("Expiry must be in the future");
        }
        if (request.maxUploadBytes() != null && request.maxUploadBytes() <= 0) {
            throw new IllegalArgumentException("max_upload_bytes must be positive");
        }
        if (request.maxFilesPerGuest() != null && request.maxFilesPerGuest() <= 0) {
            throw new IllegalArgumentException("max_files_per_guest must be positive");
        }
    }
}
