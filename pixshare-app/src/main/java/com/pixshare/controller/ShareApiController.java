package com.pixshare.controller;

import com.pixshare.model.Capabilities;
import com.pixshare.model.Guest;
import com.pixshare.model.ResourceKind;
import com.pixshare.model.ResourceRef;
import com.pixshare.model.Share;
import com.pixshare.service.GuestService;
import com.pixshare.service.ShareService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Share links: managing them ({@code /api/share/...}, owner only) and opening
 * them ({@code /api/s/{token}/...}, anyone holding the token).
 */
@RestController
@RequestMapping("/api")
public class ShareApiController {

    private final ShareService shareService;
    private final GuestService guestService;

    public ShareApiController(ShareService shareService, GuestService guestService) {
        this.shareService = shareService;
        this.guestService = guestService;
    }

    @PostMapping("/share/{kind}/{id}")
    public ResponseEntity<Share> createShare(@PathVariable String kind,
                                             @PathVariable long id,
                                             @RequestBody(required = false) Map<String, Object> body,
                                             HttpServletRequest request) {
        Map<String, Object> options = body != null ? body : Map.of();
        Share share = shareService.createShare(scope(kind, id), toRequest(options), RequestCredentials.from(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(share);
    }

    @GetMapping("/share/{kind}/{id}")
    public ResponseEntity<List<Share>> listShares(@PathVariable String kind,
                                                  @PathVariable long id,
                                                  HttpServletRequest request) {
        return ResponseEntity.ok(shareService.listShares(scope(kind, id), RequestCredentials.from(request)));
    }

    @DeleteMapping("/share/{shareId}")
    public ResponseEntity<Void> revokeShare(@PathVariable long shareId, HttpServletRequest request) {
        shareService.revoke(shareId, RequestCredentials.from(request));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/s/{token}/album")
    public ResponseEntity<?> openAlbum(@PathVariable String token) {
        ShareService.SharedView view = shareService.open(token, ResourceKind.ALBUM);
        Map<String, Object> response = sharedResponse(view);
        response.put("album", view.albums().get(0));
        response.put("photos", view.photos());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/s/{token}/photo")
    public ResponseEntity<?> openPhoto(@PathVariable String token) {
        ShareService.SharedView view = shareService.open(token, ResourceKind.PHOTO);
        Map<String, Object> response = sharedResponse(view);
        response.put("photo", view.photos().get(0));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/s/{token}/event")
    public ResponseEntity<?> openEvent(@PathVariable String token) {
        ShareService.SharedView view = shareService.open(token, ResourceKind.EVENT);
        Map<String, Object> response = sharedResponse(view);
        response.put("event", view.event());
        response.put("albums", view.albums());
        response.put("photos", view.photos());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/s/{token}/guests")
    public ResponseEntity<?> registerGuest(@PathVariable String token, @RequestBody Map<String, Object> body) {
        Guest guest = guestService.register(token, (String) body.get("display_name"));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("id", guest.id());
        response.put("displayName", guest.displayName());
        response.put("guestKey", guest.guestKey());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    private static Map<String, Object> sharedResponse(ShareService.SharedView view) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("capabilities", view.share().capabilities());
        response.put("expiresAt", view.share().expiresAt());
        return response;
    }

    private static ResourceRef scope(String kind, long id) {
        return switch (kind) {
            case "album" -> ResourceRef.album(id);
            case "photo" -> ResourceRef.photo(id);
            case "event" -> ResourceRef.event(id);
            default -> throw new IllegalArgumentException("Unknown share kind: " + kind);
        };
    }

    private static ShareService.ShareRequest toRequest(Map<String, Object> body) {
        Capabilities capabilities = new Capabilities(
            flag(body, "can_comment"),
            flag(body, "can_react"),
            flag(body, "can_upload"),
            flag(body, "can_curate")
        );
        LocalDateTime expiresAt = null;
        Object expires = body.get("expires_at");
        if (expires != null && !expires.toString().isBlank()) {
            try {
                expiresAt = LocalDateTime.parse(expires.toString());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid expires_at: " + expires);
            }
        }
        Long maxUploadBytes = wholeNumber(body, "max_upload_bytes", Long.MAX_VALUE);
        Long maxFiles = wholeNumber(body, "max_files_per_guest", Integer.MAX_VALUE);
        Integer maxFilesPerGuest = maxFiles != null ? maxFiles.intValue() : null;
        return new ShareService.ShareRequest(capabilities, expiresAt, maxUploadBytes, maxFilesPerGuest);
    }

    /**
     * Reads an optional JSON integer. Strings, fractions and values above {@code max}
     * are rejected rather than coerced.
     */
    private static Long wholeNumber(Map<String, Object> body, String name, long max) {
        Object value = body.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Integer || value instanceof Long || value instanceof BigInteger)) {
            throw new IllegalArgumentException(name + " must be a whole number");
        }
        BigInteger number = new BigInteger(value.toString());
        if (number.compareTo(BigInteger.valueOf(max)) > 0) {
            throw new IllegalArgumentException(name + " must be at most " + max);
        }
        return number.longValue();
    }

    private static boolean flag(Map<String, Object> body, String name) {
        return Boolean.TRUE.equals(body.get(name));
    }
}
