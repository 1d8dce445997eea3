package com.pixshare.security;

import com.pixshare.model.AlbumId;
import com.pixshare.model.Capabilities;
import com.pixshare.model.EventId;
import com.pixshare.model.Participant;
import com.pixshare.model.Photo;
import com.pixshare.model.PhotoId;
import com.pixshare.model.ResourceRef;
import com.pixshare.model.Share;
import com.pixshare.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AuthorizationEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    private static final UserId OWNER = UserId.of(1);
    private static final UserId GUEST_USER = UserId.of(2);
    private static final UserId EVENT_HOST = UserId.of(9);

    private static final AlbumId A1 = AlbumId.of(10);
    private static final AlbumId A2 = AlbumId.of(11);
    private static final AlbumId A3 = AlbumId.of(12);
    private static final EventId EVENT = EventId.of(50);

    private static final Photo P1 = photo(100, A1);
    private static final Photo P_A2 = photo(101, A2);
    private static final Photo P_A3 = photo(102, A3);

    private IdentityResolver identityResolver;
    private ShareResolver shareResolver;
    private ResourceGraph graph;
    private AuthorizationEngine engine;

    @BeforeEach
    void setUp() {
        identityResolver = mock(IdentityResolver.class);
        shareResolver = mock(ShareResolver.class);
        graph = mock(ResourceGraph.class);
        engine = new AuthorizationEngine(identityResolver, shareResolver, graph, CLOCK);

        when(identityResolver.resolve("owner-session")).thenReturn(Optional.of(OWNER));
        when(identityResolver.resolve("guest-session")).thenReturn(Optional.of(GUEST_USER));
        when(identityResolver.resolve("host-session")).thenReturn(Optional.of(EVENT_HOST));

        when(graph.findAlbumOwner(A1)).thenReturn(Optional.of(OWNER));
        when(graph.findAlbumOwner(A2)).thenReturn(Optional.of(OWNER));
        when(graph.findAlbumOwner(A3)).thenReturn(Optional.of(OWNER));
        when(graph.findPhoto(P1.id())).thenReturn(Optional.of(P1));
        when(graph.findPhoto(P_A2.id())).thenReturn(Optional.of(P_A2));
        when(graph.findPhoto(P_A3.id())).thenReturn(Optional.of(P_A3));
        when(graph.findEventOwner(EVENT)).thenReturn(Optional.of(EVENT_HOST));
        when(graph.findAlbumsForEvent(EVENT)).thenReturn(Set.of(A1, A2));
        when(graph.findEventsForAlbum(A1)).thenReturn(Set.of(EVENT));
        when(graph.findEventsForAlbum(A2)).thenReturn(Set.of(EVENT));
        when(graph.findEventsForAlbum(A3)).thenReturn(Set.of());
    }

    private static Photo photo(long id, AlbumId albumId) {
        return new Photo(PhotoId.of(id), albumId, OWNER, "p" + id + ".jpg",
            "photos/1/" + albumId.value() + "/p" + id + ".jpg", 10, NOW, null, null);
    }

    private Share share(String token, ResourceRef scope, Capabilities caps, LocalDateTime expiresAt) {
        Share share = new Share(7L, token, scope, caps, expiresAt, null, null, NOW.minusDays(1));
        when(shareResolver.resolve(token)).thenReturn(Optional.of(share));
        return share;
    }

    private void joinEvent(UserId userId, Capabilities caps) {
        when(graph.findParticipant(EVENT, userId))
            .thenReturn(Optional.of(new Participant(1L, EVENT, userId, "eventTok", caps, NOW)));
    }

    private static ResourceRef ref(Photo photo) {
        return ResourceRef.photo(photo.id().value());
    }

    @Nested
    @DisplayName("credentials")
    class CredentialChecks {

        @Test
        void emptyCredentialsRequireAuthenticationWithoutLookups() {
            Verdict verdict = engine.authorize(Operation.VIEW_ALBUM, ResourceRef.album(10), Credentials.none());

            assertThat(verdict.status()).isEqualTo(Verdict.Status.AUTHENTICATION_REQUIRED);
            assertThat(verdict.httpStatus().value()).isEqualTo(401);
            verifyNoInteractions(identityResolver, shareResolver, graph);
        }

        @Test
        void nullCredentialsCountAsEmpty() {
            assertThat(engine.authorize(Operation.VIEW_PHOTO, ref(P1), null).status())
                .isEqualTo(Verdict.Status.AUTHENTICATION_REQUIRED);
        }

        @Test
        void unknownSessionWithoutShareRequiresAuthentication() {
            Verdict verdict = engine.authorize(Operation.VIEW_ALBUM, ResourceRef.album(10),
                Credentials.ofSession("forged"));

            assertThat(verdict.status()).isEqualTo(Verdict.Status.AUTHENTICATION_REQUIRED);
            verifyNoInteractions(graph);
        }

        @Test
        void identityOnlyOperationRejectsBareShare() {
            share("eventTok", ResourceRef.event(50), Capabilities.ALL, null);

            Verdict verdict = engine.authorize(Operation.JOIN_EVENT, ResourceRef.event(50),
                Credentials.ofShare("eventTok"));

            assertThat(verdict.status()).isEqualTo(Verdict.Status.AUTHENTICATION_REQUIRED);
        }

        @Test
        void missingTargetIsNotFound() {
            Verdict verdict = engine.authorize(Operation.VIEW_ALBUM, ResourceRef.album(999),
                Credentials.ofSession("owner-session"));

            assertThat(verdict.status()).isEqualTo(Verdict.Status.NOT_FOUND);
        }

        @Test
        void rejectsOperationOnWrongKind() {
            assertThatThrownBy(() -> engine.authorize(Operation.UPLOAD_PHOTO, ref(P1),
                Credentials.ofSession("owner-session")))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("owner rule")
    class OwnerRule {

        @Test
        void ownerIsGrantedEveryOperationOnOwnAlbumAndPhotos() {
            Credentials creds = Credentials.ofSession("owner-session");
            for (Operation op : Operation.values()) {
                if (op.appliesTo(ResourceRef.album(10).kind())) {
                    assertThat(engine.authorize(op, ResourceRef.album(10), creds).basis())
                        .as(op.name()).isEqualTo(Verdict.Basis.OWNER);
                }
                if (op.appliesTo(ref(P1).kind())) {
                    assertThat(engine.authorize(op, ref(P1), creds).basis())
                        .as(op.name()).isEqualTo(Verdict.Basis.OWNER);
                }
            }
        }

        @Test
        void eventOwnerOwnsAttachedAlbumsAndTheirPhotos() {
            Credentials creds = Credentials.ofSession("host-session");

            assertThat(engine.authorize(Operation.CURATE, ResourceRef.album(10), creds).basis())
                .isEqualTo(Verdict.Basis.OWNER);
            assertThat(engine.authorize(Operation.COMMENT, ref(P_A2), creds).basis())
                .isEqualTo(Verdict.Basis.OWNER);
            assertThat(engine.authorize(Operation.EDIT_EVENT, ResourceRef.event(50), creds).isGranted())
                .isTrue();
        }

        @Test
        void eventOwnerHasNoClaimOnUnattachedAlbum() {
            Verdict verdict = engine.authorize(Operation.VIEW_ALBUM, ResourceRef.album(12),
                Credentials.ofSession("host-session"));

            assertThat(verdict.status()).isEqualTo(Verdict.Status.FORBIDDEN);
        }

        @Test
        void shareNeverDowngradesOwner() {
            share("viewOnly", ResourceRef.album(10), Capabilities.NONE, null);

            Verdict verdict = engine.authorize(Operation.UPLOAD_PHOTO, ResourceRef.album(10),
                new Credentials("owner-session", "viewOnly"));

            assertThat(verdict.basis()).isEqualTo(Verdict.Basis.OWNER);
            verifyNoInteractions(shareResolver);
        }
    }

    @Nested
    @DisplayName("share rule")
    class ShareRule {

        @Test
        void albumShareCoversItsPhotosOnly() {
            share("albumTok", ResourceRef.album(10), Capabilities.NONE, null);
            Credentials creds = Credentials.ofShare("albumTok");

            assertThat(engine.authorize(Operation.VIEW_PHOTO, ref(P1), creds).isGranted()).isTrue();
            Verdict other = engine.authorize(Operation.VIEW_PHOTO, ref(P_A3), creds);
            assertThat(other.isGranted()).isFalse();
            assertThat(other.status()).isIn(Verdict.Status.FORBIDDEN, Verdict.Status.NOT_FOUND);
        }

        @Test
        void albumShareForAnotherAlbumIsNotFound() {
            share("albumTok", ResourceRef.album(10), Capabilities.ALL, null);

            Verdict verdict = engine.authorize(Operation.VIEW_ALBUM, ResourceRef.album(12),
                Credentials.ofShare("albumTok"));

            assertThat(verdict.status()).isEqualTo(Verdict.Status.NOT_FOUND);
        }

        @Test
        void photoShareNeverGrantsAlbumOperations() {
            share("photoTok", ref(P1), Capabilities.ALL, null);
            Credentials creds = Credentials.ofShare("photoTok");

            for (Operation op : Operation.values()) {
                if (op.appliesTo(ResourceRef.album(10).kind()) && !op.requiresIdentity()) {
                    assertThat(engine.authorize(op, ResourceRef.album(10), creds).isGranted())
                        .as(op.name()).isFalse();
                }
            }
            assertThat(engine.authorize(Operation.VIEW_ALBUM, ResourceRef.album(10), creds).status())
                .isEqualTo(Verdict.Status.FORBIDDEN);
        }

        @Test
        void photoShareGrantsExactlyThatPhoto() {
            share("photoTok", ref(P1), Capabilities.NONE, null);
            Credentials creds = Credentials.ofShare("photoTok");

            assertThat(engine.authorize(Operation.VIEW_PHOTO, ref(P1), creds).isGranted()).isTrue();
            assertThat(engine.authorize(Operation.VIEW_PHOTO, ref(P_A2), creds).status())
                .isEqualTo(Verdict.Status.NOT_FOUND);
        }

        @Test
        void expiredShareIsInvalid() {
            share("oldTok", ResourceRef.album(10), Capabilities.ALL, NOW.minusMinutes(1));

            Verdict verdict = engine.authorize(Operation.VIEW_ALBUM, ResourceRef.album(10),
                Credentials.ofShare("oldTok"));

            assertThat(verdict.status()).isEqualTo(Verdict.Status.INVALID_SHARE);
            assertThat(verdict.httpStatus().value()).isEqualTo(404);
        }

        @Test
        void shareExpiringExactlyNowIsInvalid() {
            share("edgeTok", ResourceRef.album(10), Capabilities.ALL, NOW);

            assertThat(engine.authorize(Operation.VIEW_ALBUM, ResourceRef.album(10),
                Credentials.ofShare("edgeTok")).status()).isEqualTo(Verdict.Status.INVALID_SHARE);
        }

        @Test
        void unknownTokenIsInvalid() {
            when(shareResolver.resolve(anyString())).thenReturn(Optional.empty());

            assertThat(engine.authorize(Operation.VIEW_ALBUM, ResourceRef.album(10),
                Credentials.ofShare("nope-nope")).status()).isEqualTo(Verdict.Status.INVALID_SHARE);
        }

        @Test
        void unscopedShareIsInvalid() {
            share("orphanTok", null, Capabilities.ALL, null);

            assertThat(engine.authorize(Operation.VIEW_ALBUM, ResourceRef.album(10),
                Credentials.ofShare("orphanTok")).status()).isEqualTo(Verdict.Status.INVALID_SHARE);
        }

        @Test
        void missingCapabilityFlagIsForbidden() {
            share("viewTok", ResourceRef.album(10), new Capabilities(true, false, false, false), null);
            Credentials creds = Credentials.ofShare("viewTok");

            assertThat(engine.authorize(Operation.COMMENT, ref(P1), creds).isGranted()).isTrue();
            Verdict upload = engine.authorize(Operation.UPLOAD_PHOTO, ResourceRef.album(10), creds);
            assertThat(upload.status()).isEqualTo(Verdict.Status.FORBIDDEN);
        }

        @Test
        void eventShareCoversAttachedAlbumsAndEvent() {
            share("eventTok", ResourceRef.event(50), Capabilities.NONE, null);
            Credentials creds = Credentials.ofShare("eventTok");

            assertThat(engine.authorize(Operation.VIEW_EVENT, ResourceRef.event(50), creds).isGranted()).isTrue();
            assertThat(engine.authorize(Operation.VIEW_PHOTO, ref(P_A2), creds).isGranted()).isTrue();
            assertThat(engine.authorize(Operation.VIEW_PHOTO, ref(P_A3), creds).status())
                .isEqualTo(Verdict.Status.NOT_FOUND);
        }

        @Test
        void shareCannotManageOrEdit() {
            share("allTok", ResourceRef.event(50), Capabilities.ALL, null);

            Verdict verdict = engine.authorize(Operation.EDIT_EVENT, ResourceRef.event(50),
                new Credentials("guest-session", "allTok"));

            assertThat(verdict.status()).isEqualTo(Verdict.Status.FORBIDDEN);
        }

        @Test
        void grantedShareCarriesShareAndIdentity() {
            Share share = share("albumTok", ResourceRef.album(10), Capabilities.NONE, null);

            Verdict verdict = engine.authorize(Operation.VIEW_ALBUM, ResourceRef.album(10),
                new Credentials("guest-session", "albumTok"));

            assertThat(verdict.basis()).isEqualTo(Verdict.Basis.SHARE);
            assertThat(verdict.share()).isEqualTo(share);
            assertThat(verdict.userId()).isEqualTo(GUEST_USER);
        }

        @Test
        void resolvesShareOnceAndReturnsSameCapabilities() {
            Capabilities caps = new Capabilities(true, true, false, false);
            share("albumTok", ResourceRef.album(10), caps, null);
            Credentials creds = Credentials.ofShare("albumTok");

            Verdict first = engine.authorize(Operation.REACT, ref(P1), creds);
            Verdict second = engine.authorize(Operation.REACT, ref(P1), creds);

            assertThat(first.capabilities()).isEqualTo(caps).isEqualTo(second.capabilities());
            verify(shareResolver, times(2)).resolve("albumTok");
        }

        @Test
        void oneDecisionResolvesShareAtMostOnce() {
            share("albumTok", ResourceRef.album(10), Capabilities.NONE, null);

            engine.authorize(Operation.VIEW_PHOTO, ref(P1), new Credentials("guest-session", "albumTok"));

            verify(shareResolver, times(1)).resolve("albumTok");
            verify(identityResolver, times(1)).resolve("guest-session");
        }
    }

    @Nested
    @DisplayName("participant rule")
    class ParticipantRule {

        @Test
        void participantReadsAttachedAlbumsButNotOthers() {
            joinEvent(GUEST_USER, Capabilities.NONE);
            Credentials creds = Credentials.ofSession("guest-session");

            assertThat(engine.authorize(Operation.VIEW_PHOTO, ref(P1), creds).basis())
                .isEqualTo(Verdict.Basis.PARTICIPANT);
            assertThat(engine.authorize(Operation.VIEW_PHOTO, ref(P_A2), creds).isGranted()).isTrue();
            assertThat(engine.authorize(Operation.VIEW_PHOTO, ref(P_A3), creds).status())
                .isEqualTo(Verdict.Status.FORBIDDEN);
            assertThat(engine.authorize(Operation.VIEW_EVENT, ResourceRef.event(50), creds).isGranted()).isTrue();
        }

        @Test
        void participantWritesOnlyWithCapturedCapability() {
            joinEvent(GUEST_USER, new Capabilities(true, false, false, false));
            Credentials creds = Credentials.ofSession("guest-session");

            assertThat(engine.authorize(Operation.COMMENT, ref(P1), creds).isGranted()).isTrue();
            assertThat(engine.authorize(Operation.UPLOAD_PHOTO, ResourceRef.album(10), creds).status())
                .isEqualTo(Verdict.Status.FORBIDDEN);
        }

        @Test
        void participantCannotEditEvent() {
            joinEvent(GUEST_USER, Capabilities.ALL);

            assertThat(engine.authorize(Operation.EDIT_EVENT, ResourceRef.event(50),
                Credentials.ofSession("guest-session")).status()).isEqualTo(Verdict.Status.FORBIDDEN);
        }

        @Test
        void leavingEventRevokesAccess() {
            Credentials creds = Credentials.ofSession("guest-session");
            joinEvent(GUEST_USER, Capabilities.NONE);
            assertThat(engine.authorize(Operation.VIEW_PHOTO, ref(P1), creds).isGranted()).isTrue();

            when(graph.findParticipant(EVENT, GUEST_USER)).thenReturn(Optional.empty());

            assertThat(engine.authorize(Operation.VIEW_PHOTO, ref(P1), creds).status())
                .isEqualTo(Verdict.Status.FORBIDDEN);
        }

        @Test
        void joinViaEventShareIsGrantedForSignedInUser() {
            Share share = share("eventTok", ResourceRef.event(50), new Capabilities(true, true, false, false), null);

            Verdict verdict = engine.authorize(Operation.JOIN_EVENT, ResourceRef.event(50),
                new Credentials("guest-session", "eventTok"));

            assertThat(verdict.basis()).isEqualTo(Verdict.Basis.SHARE);
            assertThat(verdict.share()).isEqualTo(share);
        }

        @Test
        void leaveIsNotGrantedByShare() {
            share("eventTok", ResourceRef.event(50), Capabilities.ALL, null);

            Verdict verdict = engine.authorize(Operation.LEAVE_EVENT, ResourceRef.event(50),
                new Credentials("guest-session", "eventTok"));

            assertThat(verdict.status()).isEqualTo(Verdict.Status.FORBIDDEN);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void lookupFailureDeniesAsForbidden() {
            when(graph.findAlbumOwner(any())).thenThrow(new IllegalStateException("connection reset"));

            Verdict verdict = engine.authorize(Operation.VIEW_ALBUM, ResourceRef.album(10),
                Credentials.ofSession("owner-session"));

            assertThat(verdict.status()).isEqualTo(Verdict.Status.FORBIDDEN);
        }

        @Test
        void requireKeepsForbiddenForParticipantMissingCapability() {
            joinEvent(GUEST_USER, Capabilities.NONE);

            assertThatThrownBy(() -> engine.require(Operation.UPLOAD_PHOTO, ResourceRef.album(10),
                Credentials.ofSession("guest-session")))
                .isInstanceOf(AuthorizationException.class)
                .satisfies(e -> assertThat(((AuthorizationException) e).verdict().status())
                    .isEqualTo(Verdict.Status.FORBIDDEN));
        }

        @Test
        void requireReportsStrangerAsNotFound() {
            assertThatThrownBy(() -> engine.require(Operation.VIEW_ALBUM, ResourceRef.album(12),
                Credentials.ofSession("host-session")))
                .isInstanceOf(AuthorizationException.class)
                .satisfies(e -> assertThat(((AuthorizationException) e).verdict().status())
                    .isEqualTo(Verdict.Status.NOT_FOUND));
        }

        @Test
        void requireConcealedReportsForbiddenAsNotFound() {
            assertThatThrownBy(() -> engine.requireConcealed(Operation.VIEW_ALBUM, ResourceRef.album(12),
                Credentials.ofSession("host-session")))
                .isInstanceOf(AuthorizationException.class)
                .satisfies(e -> assertThat(((AuthorizationException) e).verdict().status())
                    .isEqualTo(Verdict.Status.NOT_FOUND));
        }

        @Test
        void requireUserRejectsShareOnlyCredentials() {
            assertThatThrownBy(() -> engine.requireUser(Credentials.ofShare("albumTok")))
                .isInstanceOf(AuthorizationException.class);
            assertThat(engine.requireUser(Credentials.ofSession("owner-session"))).isEqualTo(OWNER);
        }
    }

    @Nested
    @DisplayName("existing and missing targets answer alike")
    class ExistenceHiding {

        private final ResourceRef missingAlbum = ResourceRef.album(99);
        private final ResourceRef missingPhoto = ResourceRef.photo(999);

        @BeforeEach
        void missingTargets() {
            when(graph.findAlbumOwner(AlbumId.of(99))).thenReturn(Optional.empty());
            when(graph.findPhoto(PhotoId.of(999))).thenReturn(Optional.empty());
        }

        @Test
        void unknownTokenIsInvalidBeforeAnyLookup() {
            when(shareResolver.resolve(anyString())).thenReturn(Optional.empty());
            Credentials creds = Credentials.ofShare("junk-token");

            Verdict existing = engine.authorize(Operation.UPLOAD_PHOTO, ResourceRef.album(10), creds);
            Verdict missing = engine.authorize(Operation.UPLOAD_PHOTO, missingAlbum, creds);

            assertThat(existing).isEqualTo(missing);
            assertThat(existing.status()).isEqualTo(Verdict.Status.INVALID_SHARE);
            verifyNoInteractions(graph);
        }

        @Test
        void unknownTokenWithSessionIsInvalidEitherWay() {
            when(shareResolver.resolve(anyString())).thenReturn(Optional.empty());
            Credentials creds = new Credentials("guest-session", "junk-token");

            assertThat(engine.authorize(Operation.UPLOAD_PHOTO, ResourceRef.album(10), creds).status())
                .isEqualTo(Verdict.Status.INVALID_SHARE);
            assertThat(engine.authorize(Operation.UPLOAD_PHOTO, missingAlbum, creds).status())
                .isEqualTo(Verdict.Status.INVALID_SHARE);
        }

        @Test
        void photoShareOnAlbumIsForbiddenBeforeAnyLookup() {
            share("photoTok", ref(P1), Capabilities.ALL, null);
            Credentials creds = Credentials.ofShare("photoTok");

            Verdict existing = engine.authorize(Operation.UPLOAD_PHOTO, ResourceRef.album(10), creds);
            Verdict missing = engine.authorize(Operation.UPLOAD_PHOTO, missingAlbum, creds);

            assertThat(existing).isEqualTo(missing);
            assertThat(existing.status()).isEqualTo(Verdict.Status.FORBIDDEN);
            verifyNoInteractions(graph);
        }

        @Test
        void strangerIsNotFoundThroughRequire() {
            Credentials creds = Credentials.ofSession("guest-session");

            Verdict existing = denial(() -> engine.require(Operation.COMMENT, ref(P_A3), creds));
            Verdict missing = denial(() -> engine.require(Operation.COMMENT, missingPhoto, creds));

            assertThat(existing.status()).isEqualTo(Verdict.Status.NOT_FOUND);
            assertThat(existing).isEqualTo(missing);
        }

        @Test
        void strangerStillSeesForbiddenFromAuthorize() {
            assertThat(engine.authorize(Operation.COMMENT, ref(P_A3), Credentials.ofSession("guest-session"))
                .status()).isEqualTo(Verdict.Status.FORBIDDEN);
        }

        private Verdict denial(Runnable call) {
            try {
                call.run();
            } catch (AuthorizationException e) {
                return e.verdict();
            }
            throw new AssertionError("expected access to be denied");
        }
    }
}
