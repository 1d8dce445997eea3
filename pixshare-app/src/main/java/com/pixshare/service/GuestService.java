package com.pixshare.service;

import com.pixshare.model.Guest;
import com.pixshare.model.Share;
import com.pixshare.repository.GuestRepository;
import com.pixshare.security.AuthorizationException;
import com.pixshare.security.ShareResolver;
import com.pixshare.security.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Anonymous visitors who put a name to themselves on a share link. A guest is
 * bound to the share it registered on and is identified by an opaque key the
 * browser keeps.
 */
@Service
public class GuestService {

    private static final Logger log = LoggerFactory.getLogger(GuestService.class);

    static final int MAX_NAME_LENGTH = 60;

    private final GuestRepository guestRepository;
    private final ShareResolver shareResolver;
    private final Clock clock;

    public GuestService(GuestRepository guestRepository, ShareResolver shareResolver, Clock clock) {
        this.guestRepository = guestRepository;
        this.shareResolver = shareResolver;
        this.clock = clock;
    }

    @Transactional
    public Guest register(String shareToken, String displayName) {
        Share share = shareResolver.resolve(shareToken)
            .filter(s -> s.isUsableAt(LocalDateTime.now(clock)))
            .orElseThrow(() -> new AuthorizationException(Verdict.invalidShare()));
        String name = displayName == null ? "" : displayName.trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Display name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            name = name.substring(0, MAX_NAME_LENGTH);
        }
        long id = guestRepository.save(share.id(), Tokens.newToken(), name);
        log.info("Guest {} registered on share {}", id, share.id());
        return guestRepository.findById(id).orElseThrow();
    }

    /**
     * Looks up the guest behind a key, provided it was registered on the given share.
     */
    @Transactional
    public Optional<Guest> resolve(Share share, String guestKey) {
        if (share == null || guestKey == null || guestKey.isBlank()) {
            return Optional.empty();
        }
        Optional<Guest> guest = guestRepository.findByKey(guestKey.trim())
            .filter(g -> share.id().equals(g.shareId()));
        guest.ifPresent(g -> guestRepository.touch(g.id(), LocalDateTime.now(clock)));
        return guest;
    }
}
