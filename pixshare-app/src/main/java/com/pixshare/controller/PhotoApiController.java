package com.pixshare.controller;

import com.pixshare.model.Comment;
import com.pixshare.model.Photo;
import com.pixshare.model.PhotoId;
import com.pixshare.model.Reaction;
import com.pixshare.security.Credentials;
import com.pixshare.service.CommentService;
import com.pixshare.service.PhotoService;
import com.pixshare.service.ReactionService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/photos")
public class PhotoApiController {

    private final PhotoService photoService;
    private final CommentService commentService;
    private final ReactionService reactionService;

    public PhotoApiController(PhotoService photoService,
                              CommentService commentService,
                              ReactionService reactionService) {
        this.photoService = photoService;
        this.commentService = commentService;
        this.reactionService = reactionService;
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getPhoto(@PathVariable long id, HttpServletRequest request) {
        Credentials credentials = RequestCredentials.from(request);
        Photo photo = photoService.getPhoto(PhotoId.of(id), credentials);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("photo", photo);
        response.put("reactions", reactionService.listReactions(photo.id(), credentials));
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePhoto(@PathVariable long id, HttpServletRequest request) {
        photoService.deletePhoto(PhotoId.of(id), RequestCredentials.from(request));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/image/{variant}")
    public ResponseEntity<Resource> getImage(@PathVariable long id,
                                             @PathVariable String variant,
                                             HttpServletRequest request) {
        if (!variant.equals("original") && !variant.equals("thumb")) {
            return ResponseEntity.badRequest().build();
        }
        Resource file = photoService.openPhotoFile(PhotoId.of(id), variant.equals("thumb"),
            RequestCredentials.from(request));
        return ResponseEntity.ok()
            .contentType(MediaTypeFactory.getMediaType(file).orElse(MediaType.APPLICATION_OCTET_STREAM))
            .body(file);
    }

    @GetMapping("/{id}/comments")
    public ResponseEntity<List<Comment>> listComments(@PathVariable long id, HttpServletRequest request) {
        return ResponseEntity.ok(commentService.listComments(PhotoId.of(id), RequestCredentials.from(request)));
    }

    @PostMapping("/{id}/comments")
    public ResponseEntity<Comment> postComment(@PathVariable long id,
                                               @RequestBody Map<String, Object> body,
                                               HttpServletRequest request) {
        Comment comment = commentService.postComment(PhotoId.of(id), (String) body.get("content"),
            RequestCredentials.guestKey(request), RequestCredentials.from(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(comment);
    }

    @DeleteMapping("/{id}/comments/{commentId}")
    public ResponseEntity<Void> deleteComment(@PathVariable long id,
                                              @PathVariable long commentId,
                                              HttpServletRequest request) {
        commentService.deleteComment(PhotoId.of(id), commentId,
            RequestCredentials.guestKey(request), RequestCredentials.from(request));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/reactions")
    public ResponseEntity<List<Reaction>> listReactions(@PathVariable long id, HttpServletRequest request) {
        return ResponseEntity.ok(reactionService.listReactions(PhotoId.of(id), RequestCredentials.from(request)));
    }

    @PostMapping("/{id}/reactions")
    public ResponseEntity<List<Reaction>> addReaction(@PathVariable long id,
                                                      @RequestBody Map<String, Object> body,
                                                      HttpServletRequest request) {
        return ResponseEntity.ok(reactionService.addReaction(PhotoId.of(id), (String) body.get("emoji"),
            RequestCredentials.guestKey(request), RequestCredentials.from(request)));
    }

    @DeleteMapping("/{id}/reactions/{emoji}")
    public ResponseEntity<List<Reaction>> removeReaction(@PathVariable long id,
                                                         @PathVariable String emoji,
                                                         HttpServletRequest request) {
        return ResponseEntity.ok(reactionService.removeReaction(PhotoId.of(id), emoji,
            RequestCredentials.guestKey(request), RequestCredentials.from(request)));
    }
}
