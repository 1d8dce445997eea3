package com.pixshare.service;

import com.pixshare.model.Album;
import com.pixshare.model.AlbumId;
import com.pixshare.model.Photo;
import com.pixshare.model.ResourceRef;
import com.pixshare.model.UserId;
import com.pixshare.repository.AlbumRepository;
import com.pixshare.repository.PhotoRepository;
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

@Service
public class AlbumService {

    private static final Logger log = LoggerFactory.getLogger(AlbumService.class);

    private final AlbumRepository albumRepository;
    private final PhotoRepository photoRepository;
    private final PhotoStorage storage;
    private final AuthorizationEngine engine;

    public AlbumService(AlbumRepository albumRepository,
                        PhotoRepository photoRepository,
                        PhotoStorage storage,
                        AuthorizationEngine engine) {
        this.albumRepository = albumRepository;
        this.photoRepository = photoRepository;
        this.storage = storage;
        this.engine = engine;
    }

    @Transactional
    public Album createAlbum(String title, String description, Credentials credentials) {
        UserId owner = engine.requireUser(credentials);
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Album title is required");
        }
        AlbumId id = albumRepository.save(title.trim(), description, owner);
        log.info("User {} created album {}", owner, id);
        return albumRepository.findById(id).orElseThrow();
    }

    public List<Album> listOwnAlbums(Credentials credentials) {
        return albumRepository.findByOwner(engine.requireUser(credentials));
    }

    public Album getAlbum(AlbumId id, Credentials credentials) {
        engine.requireConcealed(Operation.VIEW_ALBUM, ResourceRef.album(id.value()), credentials);
        return albumRepository.findById(id)
            .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));
    }

    public List<Photo> listPhotos(AlbumId id, Credentials credentials) {
        engine.requireConcealed(Operation.VIEW_ALBUM, ResourceRef.album(id.value()), credentials);
        return photoRepository.findByAlbum(id);
    }

    /**
     * Deletes the album with its photos and their files. Shares, comments,
     * reactions and event links go with the rows.
     */
    @Transactional
    public void deleteAlbum(AlbumId id, Credentials credentials) {
        ResourceRef ref = ResourceRef.album(id.value());
        engine.requireConcealed(Operation.MANAGE, ref, credentials);
        List<Photo> photos = photoRepository.findByAlbum(id);
        photoRepository.deleteByAlbum(id);
        albumRepository.delete(id);
        photos.forEach(storage::deleteFiles);
        log.info("Deleted album {} with {} photos", id, photos.size());
    }
}
