package com.pixshare.security;

import com.pixshare.model.AlbumId;
import com.pixshare.model.Capabilities;
import com.pixshare.model.EventId;
import com.pixshare.model.Participant;
import com.pixshare.model.ResourceKind;
import com.pixshare.model.ResourceRef;
import com.pixshare.model.Share;
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
 * Decides whether a set of credentials may perform an operation on an album,
 * photo or event.
 * <p>
 * Rules are evaluated in a fixed order and the first one that grants wins:
 * <ol>
 *   <li>owner of the resource, or of an event the album is attached to</li>
 *   <li>participant of an event that is or contains the resource</li>
 *   <li>share token whose scope contains the resource</li>
 * </ol>
 * Without a session identity and without a share token the answer is
 * {@code AUTHENTICATION_REQUIRED} before anything is looked up. A share that
 * does not resolve, has expired, or is of the wrong class is refused before the
 * target is looked up, so the answer is the same whether or not it exists. Any
 * failure of a collaborator denies with {@code FORBIDDEN}.
 */
@Service
public class AuthorizationEngine {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationEngine.class);

    private final IdentityResolver identityResolver;
    private final ShareResolver shareResolver;
    private final ResourceGraph graph;
    private final Clock clock;

    public AuthorizationEngine(IdentityResolver identityResolver,
                               ShareResolver shareResolver,
                               ResourceGraph graph,
                               Clock clock) {
        this.identityResolver = identityResolver;
        this.shareResolver = shareResolver;
        this.graph = graph;
        this.clock = clock;
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Verdict authorize(Operation operation, ResourceRef target, Credentials credentials) {
        if (!operation.appliesTo(target.kind())) {
            throw new IllegalArgumentException(operation + " does not apply to " + target);
        }
        Credentials creds = credentials != null ? credentials : Credentials.none();
        if (creds.isEmpty()) {
            return Verdict.authenticationRequired();
        }

        Verdict verdict;
        try {
            verdict = decide(operation, target, new Decision(creds));
        } catch (RuntimeException e) {
            log.warn("Denying {} on {}: lookup failed", operation, target, e);
            verdict = Verdict.forbidden("Access could not be verified");
        }
        if (!verdict.isGranted()) {
            log.debug("{} on {} denied: {} ({})", operation, target, verdict.status(), verdict.reason());
        }
        return verdict;
    }

    /**
     * Like {@link #authorize} but throws {@link AuthorizationException} unless granted.
     * A refusal is reported as {@code FORBIDDEN} only when it rests on the caller's
     * own share or event membership; any other refusal is {@code NOT_FOUND}.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Verdict require(Operation operation, ResourceRef target, Credentials credentials) {
        Verdict verdict = authorize(operation, target, credentials);
        if (!verdict.isGranted()) {
            throw new AuthorizationException(verdict.concealedUnlessClaimed());
        }
        return verdict;
    }

    /**
     * Like {@link #require} but reports {@code FORBIDDEN} as {@code NOT_FOUND}, for
     * endpoints that must not confirm the resource exists.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Verdict requireConcealed(Operation operation, ResourceRef target, Credentials credentials) {
        Verdict verdict = authorize(operation, target, credentials).concealed();
        if (!verdict.isGranted()) {
            throw new AuthorizationException(verdict);
        }
        return verdict;
    }

    /**
     * Resolves the session identity for operations that act on the caller's own
     * account rather than on an existing resource (listing or creating albums).
     */
    public UserId requireUser(Credentials credentials) {
        if (credentials == null || !credentials.hasSession()) {
            throw new AuthorizationException(Verdict.authenticationRequired());
        }
        return identityResolver.resolve(credentials.session())
            .orElseThrow(() -> new AuthorizationException(Verdict.authenticationRequired()));
    }

    private Verdict decide(Operation operation, ResourceRef target, Decision decision) {
        Optional<UserId> user = decision.identity();
        boolean viaShare = decision.credentials.hasShareToken() && operation.grantableViaShare();
        if (user.isEmpty() && (operation.requiresIdentity() || !viaShare)) {
            return Verdict.authenticationRequired();
        }

        // a share-only caller learns nothing about the target until the share itself holds up
        if (user.isEmpty()) {
            Optional<Verdict> refused = checkShare(target, decision);
            if (refused.isPresent()) {
                return refused.get();
            }
        }

        Optional<Located> found = locate(target);
        if (found.isEmpty()) {
            return viaShare ? checkShare(target, decision).orElse(Verdict.notFound()) : Verdict.notFound();
        }
        Located resource = found.get();

        Verdict refusal = Verdict.forbidden("Not permitted to " + describe(operation));
        if (user.isPresent()) {
            UserId userId = user.get();
            if (isOwner(userId, resource)) {
                return Verdict.granted(Verdict.Basis.OWNER, Capabilities.ALL, userId, null);
            }
            if (operation.grantableViaParticipant()) {
                Optional<Capabilities> membership = participation(userId, resource);
                if (membership.isPresent()) {
                    if (membership.get().allows(operation.capability())) {
                        return Verdict.granted(Verdict.Basis.PARTICIPANT, membership.get(), userId, null);
                    }
                    refusal = Verdict.forbidden(Verdict.Basis.PARTICIPANT,
                        "Participants of this event may not " + describe(operation));
                }
            }
        }

        if (viaShare) {
            Verdict shared = applyShare(operation, resource, decision, user.orElse(null));
            if (shared.isGranted() || refusal.basis() == null) {
                return shared;
            }
        }
        return refusal;
    }

    /**
     * Checks that can be answered from the share alone: it must resolve, be
     * usable now, and be of a class that can reach the target's kind.
     */
    private Optional<Verdict> checkShare(ResourceRef target, Decision decision) {
        Optional<Share> resolved = decision.share();
        if (resolved.isEmpty() || !resolved.get().isUsableAt(LocalDateTime.now(clock))) {
            return Optional.of(Verdict.invalidShare());
        }
        if (!scopeClassCovers(resolved.get().scope().kind(), target.kind())) {
            return Optional.of(Verdict.forbidden(Verdict.Basis.SHARE, "This link is not valid for this resource"));
        }
        return Optional.empty();
    }

    private Verdict applyShare(Operation operation, Located resource, Decision decision, UserId userId) {
        Optional<Verdict> refused = checkShare(resource.ref, decision);
        if (refused.isPresent()) {
            return refused.get();
        }
        Share share = decision.share().get();

        if (!scopeContains(share.scope(), resource)) {
            return Verdict.notFound();
        }
        if (!share.capabilities().allows(operation.capability())) {
            return Verdict.forbidden(Verdict.Basis.SHARE, "This link does not allow " + describe(operation));
        }
        return Verdict.granted(Verdict.Basis.SHARE, share.capabilities(), userId, share);
    }

    /**
     * Whether a share of one class can ever reach a target of another. Answered
     * from the share alone, so a mismatch may be reported as forbidden without
     * revealing anything about the target.
     */
    private static boolean scopeClassCovers(ResourceKind scope, ResourceKind target) {
        return switch (scope) {
            case EVENT -> true;
            case ALBUM -> target != ResourceKind.EVENT;
            case PHOTO -> target == ResourceKind.PHOTO;
        };
    }

    private boolean scopeContains(ResourceRef scope, Located resource) {
        ResourceRef target = resource.ref;
        return switch (scope.kind()) {
            case PHOTO -> scope.equals(target);
            case ALBUM -> resource.albumId != null && resource.albumId.equals(scope.albumId());
            case EVENT -> target.kind() == ResourceKind.EVENT
                ? scope.equals(target)
                : graph.findAlbumsForEvent(scope.eventId()).contains(resource.albumId);
        };
    }

    private Optional<Located> locate(ResourceRef target) {
        return switch (target.kind()) {
            case ALBUM -> graph.findAlbumOwner(target.albumId())
                .map(owner -> new Located(target, owner, target.albumId()));
            case PHOTO -> graph.findPhoto(target.photoId())
                .map(photo -> new Located(target, photo.ownerId(), photo.albumId()));
            case EVENT -> graph.findEventOwner(target.eventId())
                .map(owner -> new Located(target, owner, null));
        };
    }

    private boolean isOwner(UserId userId, Located resource) {
        if (userId.equals(resource.owner)) {
            return true;
        }
        if (resource.albumId == null) {
            return false;
        }
        for (EventId eventId : graph.findEventsForAlbum(resource.albumId)) {
            if (graph.findEventOwner(eventId).filter(userId::equals).isPresent()) {
                return true;
            }
        }
        return false;
    }

    private Optional<Capabilities> participation(UserId userId, Located resource) {
        if (resource.ref.kind() == ResourceKind.EVENT) {
            return graph.findParticipant(resource.ref.eventId(), userId).map(Participant::capabilities);
        }
        Capabilities combined = null;
        for (EventId eventId : graph.findEventsForAlbum(resource.albumId)) {
            Optional<Participant> participant = graph.findParticipant(eventId, userId);
            if (participant.isPresent()) {
                Capabilities caps = participant.get().capabilities();
                combined = combined == null ? caps : combined.union(caps);
            }
        }
        return Optional.ofNullable(combined);
    }

    private static String describe(Operation operation) {
        return operation.name().toLowerCase().replace('_', ' ');
    }

    /**
     * Resource facts needed by every rule. {@code albumId} is null for events.
     */
    private record Located(ResourceRef ref, UserId owner, AlbumId albumId) {}

    /**
     * Per-call memo, so that identity and share are each resolved at most once
     * for one decision.
     */
    private final class Decision {

        private final Credentials credentials;
        private Optional<UserId> identity;
        private Optional<Share> share;

        Decision(Credentials credentials) {
            this.credentials = credentials;
        }

        Optional<UserId> identity() {
            if (identity == null) {
                identity = credentials.hasSession()
                    ? identityResolver.resolve(credentials.session())
                    : Optional.empty();
            }
            return identity;
        }

        Optional<Share> share() {
            if (share == null) {
                share = credentials.hasShareToken()
                    ? shareResolver.resolve(credentials.shareToken())
                    : Optional.empty();
            }
            return share;
        }
    }
}
