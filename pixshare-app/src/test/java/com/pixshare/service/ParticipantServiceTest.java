package com.pixshare.service;

import com.pixshare.model.EventId;
import com.pixshare.model.Participant;
import com.pixshare.model.ResourceRef;
import com.pixshare.model.UserId;
import com.pixshare.security.AuthorizationEngine;
import com.pixshare.security.AuthorizationException;
import com.pixshare.security.Credentials;
import com.pixshare.security.JwtIdentityResolver;
import com.pixshare.security.Operation;
import com.pixshare.security.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Sql(scripts = "/pixshare-fixture.sql", executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
@Transactional
class ParticipantServiceTest {

    @Autowired
    private ParticipantService participantService;

    @Autowired
    private AuthorizationEngine engine;

    @Autowired
    private JwtIdentityResolver sessions;

    @Autowired
    private JdbcTemplate jdbc;

    // Test data IDs from pixshare-fixture.sql
    private static final long ALICE = 100L;
    private static final long BOB = 101L;
    private static final long DAVE = 103L;
    private static final EventId WEDDING = EventId.of(400L);
    private static final ResourceRef VOWS_PHOTO = ResourceRef.photo(300L);
    private static final ResourceRef PRIVATE_PHOTO = ResourceRef.photo(301L);

    private String token(long userId) {
        return sessions.issueToken(UserId.of(userId));
    }

    private Verdict.Status statusOf(Runnable call) {
        try {
            call.run();
            return Verdict.Status.GRANTED;
        } catch (AuthorizationException e) {
            return e.verdict().status();
        }
    }

    @Nested
    @DisplayName("join")
    class Join {

        @Test
        void joiningCapturesShareFlags() {
            Optional<Participant> joined = participantService.join(WEDDING, new Credentials(token(BOB), "eventTok400"));

            assertThat(joined).isPresent();
            assertThat(joined.get().userId()).isEqualTo(UserId.of(BOB));
            assertThat(joined.get().capabilities().canComment()).isTrue();
            assertThat(joined.get().capabilities().canUpload()).isTrue();
            assertThat(joined.get().shareToken()).isEqualTo("eventTok400");
        }

        @Test
        void participantReadsAttachedAlbumWithSessionAlone() {
            Credentials bob = Credentials.ofSession(token(BOB));
            assertThat(engine.authorize(Operation.VIEW_PHOTO, VOWS_PHOTO, bob).isGranted()).isFalse();

            participantService.join(WEDDING, new Credentials(token(BOB), "eventTok400"));

            Verdict verdict = engine.authorize(Operation.VIEW_PHOTO, VOWS_PHOTO, bob);
            assertThat(verdict.basis()).isEqualTo(Verdict.Basis.PARTICIPANT);
            assertThat(engine.authorize(Operation.VIEW_PHOTO, PRIVATE_PHOTO, bob).status())
                .isEqualTo(Verdict.Status.FORBIDDEN);
        }

        @Test
        void joiningTwiceKeepsOneRow() {
            Credentials creds = new Credentials(token(BOB), "eventTok400");
            Participant first = participantService.join(WEDDING, creds).orElseThrow();
            Participant second = participantService.join(WEDDING, creds).orElseThrow();

            assertThat(second.id()).isEqualTo(first.id());
            assertThat(participantService.listParticipants(WEDDING, Credentials.ofSession(token(ALICE))))
                .extracting(Participant::userId)
                .containsExactlyInAnyOrder(UserId.of(DAVE), UserId.of(BOB));
        }

        @Test
        void capabilitiesStayAsCapturedWhenShareChanges() {
            participantService.join(WEDDING, new Credentials(token(BOB), "eventTok400"));
            jdbc.update("UPDATE shares SET can_comment = FALSE WHERE token = 'eventTok400'");

            Verdict verdict = engine.authorize(Operation.COMMENT, VOWS_PHOTO, Credentials.ofSession(token(BOB)));

            assertThat(verdict.isGranted()).isTrue();
        }

        @Test
        void ownerJoinIsNoOp() {
            assertThat(participantService.join(WEDDING, new Credentials(token(ALICE), "eventTok400"))).isEmpty();
        }

        @Test
        void tokenOfAnotherEventIsRejected() {
            assertThat(statusOf(() -> participantService.join(WEDDING, new Credentials(token(BOB), "eventTok401"))))
                .isEqualTo(Verdict.Status.NOT_FOUND);
        }

        @Test
        void anonymousCannotJoin() {
            assertThat(statusOf(() -> participantService.join(WEDDING, Credentials.ofShare("eventTok400"))))
                .isEqualTo(Verdict.Status.AUTHENTICATION_REQUIRED);
        }

        @Test
        void albumShareCannotJoinEvent() {
            assertThat(statusOf(() -> participantService.join(WEDDING, new Credentials(token(BOB), "albumTok200"))))
                .isEqualTo(Verdict.Status.FORBIDDEN);
        }
    }

    @Nested
    @DisplayName("leave and remove")
    class LeaveAndRemove {

        @Test
        void leavingRevokesAccess() {
            Credentials dave = Credentials.ofSession(token(DAVE));
            assertThat(engine.authorize(Operation.VIEW_PHOTO, VOWS_PHOTO, dave).isGranted()).isTrue();

            participantService.leave(WEDDING, dave);

            assertThat(engine.authorize(Operation.VIEW_PHOTO, VOWS_PHOTO, dave).status())
                .isEqualTo(Verdict.Status.FORBIDDEN);
        }

        @Test
        void ownerCannotLeave() {
            assertThatThrownBy(() -> participantService.leave(WEDDING, Credentials.ofSession(token(ALICE))))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void nonParticipantCannotLeave() {
            assertThat(statusOf(() -> participantService.leave(WEDDING, Credentials.ofSession(token(BOB)))))
                .isEqualTo(Verdict.Status.NOT_FOUND);
        }

        @Test
        void ownerRemovesParticipant() {
            participantService.remove(WEDDING, UserId.of(DAVE), Credentials.ofSession(token(ALICE)));

            assertThat(participantService.listParticipants(WEDDING, Credentials.ofSession(token(ALICE)))).isEmpty();
        }

        @Test
        void participantCannotListOthers() {
            assertThat(statusOf(() -> participantService.listParticipants(WEDDING, Credentials.ofSession(token(DAVE)))))
                .isEqualTo(Verdict.Status.NOT_FOUND);
        }
    }
}
