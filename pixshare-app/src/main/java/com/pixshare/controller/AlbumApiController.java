package com.pixshare.controller;

import com.pixshare.model.Album;
import com.pixshare.model.AlbumId;
import com.pixshare.model.Photo;
import com.pixshare.service.AlbumService;
import com.pixshare.service.PhotoService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/albums")
public class AlbumApiController {

    private final AlbumService albumService;
    private final PhotoService photoService;

    public AlbumApiController(AlbumService albumService, PhotoService photoService) {
        this.albumService = albumService;
        this.photoService = photoService;
    }

    @GetMapping
    public ResponseEntity<List<Album>> listAlbums(HttpServletRequest request) {
        return ResponseEntity.ok(albumService.listOwnAlbums(RequestCredentials.from(request)));
    }

    @PostMapping
    public ResponseEntity<Album> createAlbum(@RequestBody Map<String, Object> body, HttpServletRequest request) {
        String title = (String) body.get("title");
        String description = (String) body.get("description");
        Album album = albumService.createAlbum(title, description, RequestCredentials.from(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(album);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Album> getAlbum(@PathVariable long id, HttpServletRequest request) {
        return ResponseEntity.ok(albumService.getAlbum(AlbumId.of(id), RequestCredentials.from(request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAlbum(@PathVariable long id, HttpServletRequest request) {
        albumService.deleteAlbum(AlbumId.of(id), RequestCredentials.from(request));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/photos")
    public ResponseEntity<List<Photo>> listPhotos(@PathVariable long id, HttpServletRequest request) {
        return ResponseEntity.ok(albumService.listPhotos(AlbumId.of(id), RequestCredentials.from(request)));
    }

    @PostMapping("/{id}/photos")
    public ResponseEntity<?> uploadPhotos(
            @PathVariable long id,
            @RequestParam("photos") List<MultipartFile> files,
            HttpServletRequest request) throws IOException {
        if (files.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "No files uploaded"));
        }
        List<Photo> uploaded = new ArrayList<>();
        for (MultipartFile file : files) {
            uploaded.add(photoService.uploadPhoto(AlbumId.of(id), file,
                RequestCredentials.guestKey(request), RequestCredentials.from(request)));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("uploaded", uploaded.size());
        response.put("photos", uploaded);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
