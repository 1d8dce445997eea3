package com.pixshare.service;

import com.pixshare.model.Album;
import com.pixshare.model.AlbumId;
import com.pixshare.model.Guest;
import com.pixshare.model.Photo;
import com.pixshare.model.PhotoId;
import com.pixshare.model.ResourceRef;
import com.pixshare.model.Share;
import com.pixshare.model.StoragePath;
import com.pixshare.repository.AlbumRepository;
import com.pixshare.repository.PhotoRepository;
import com.pixshare.security.AuthorizationEngine;
import com.pixshare.security.AuthorizationException;
import com.pixshare.security.Credentials;
import com.pixshare.security.FilePathAuthorizer;
import com.pixshare.security.Operation;
import com.pixshare.security.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;

@Service
public class PhotoService {

    private static final Logger log = LoggerFactory.getLogger(PhotoService.class);

    private static final Map<String, String> EXTENSIONS = Map.of(
        "image/jpeg", "jpg",
        "image/png", "png"
    );

    private final PhotoRepository photoRepository;
    private final AlbumRepository albumRepository;
    private final PhotoStorage storage;
    private final GuestService guestService;
    private final AuthorizationEngine engine;
    private final FilePathAuthorizer filePathAuthorizer;

    public PhotoService(PhotoRepository photoRepository,
                        AlbumRepository albumRepository,
                        PhotoStorage storage,
                        GuestService guestService,
                        AuthorizationEngine engine,
                        FilePathAuthorizer filePathAuthorizer) {
        this.photoRepository = photoRepository;
        this.albumRepository = albumRepository;
        this.storage = storage;
        this.guestService = guestService;
        this.engine = engine;
        this.filePathAuthorizer = filePathAuthorizer;
    }

    /**
     * Stores an upload in the album owner's directory, whoever uploads it.
     * Uploads through a share link are attributed to the share and, when a
     * guest key is given, to the guest, and are held to the link's quotas.
     */
    @Transactional
    public Photo uploadPhoto(AlbumId albumId, MultipartFile file, String guestKey, Credentials credentials)
            throws IOException {
        Verdict verdict = engine.require(Operation.UPLOAD_PHOTO, ResourceRef.album(albumId.value()), credentials);

        String contentType = file.getContentType();
        String extension = contentType != null ? EXTENSIONS.get(contentType) : null;
        if (extension == null) {
            throw new IllegalArgumentException("Only JPEG and PNG images are supported");
        }
        if (file.isEmpty()) {
            throw new IllegalArgumentException("File is empty");
        }
        Album album = albumRepository.findById(albumId)
            .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));

        Long shareId = null;
        Long guestId = null;
        if (verdict.basis() == Verdict.Basis.SHARE) {
            Share share = verdict.share();
            shareId = share.id();
            guestId = guestService.resolve(share, guestKey).map(Guest::id).orElse(null);
            checkQuota(share, guestId, file.getSize());
        }

        String original = file.getOriginalFilename() != null ? file.getOriginalFilename() : "photo";
        if (original.length() > 200) {
            original = original.substring(original.length() - 200);
        }
        StoragePath path = uniquePath(album, withExtension(StoragePath.safeFilename(original), extension));

        PhotoId id = photoRepository.save(albumId, album.ownerId(), original, path.toString(),
            file.getSize(), shareId, guestId);
        try {
            storage.write(path, file);
        } catch (IOException e) {
            log.error("Failed to store upload {} for album {}", path, albumId, e);
            photoRepository.delete(id);
            throw e;
        }
        log.info("Stored photo {} at {} ({} bytes, basis {})", id, path, file.getSize(), verdict.basis());
        return photoRepository.findById(id).orElseThrow();
    }

    public Photo getPhoto(PhotoId id, Credentials credentials) {
        engine.requireConcealed(Operation.VIEW_PHOTO, ResourceRef.photo(id.value()), credentials);
        return photoRepository.findById(id)
            .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));
    }

    @Transactional
    public void deletePhoto(PhotoId id, Credentials credentials) {
        engine.requireConcealed(Operation.CURATE, ResourceRef.photo(id.value()), credentials);
        Photo photo = photoRepository.findById(id)
            .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));
        photoRepository.delete(id);
        storage.deleteFiles(photo);
        log.info("Deleted photo {}", id);
    }

    /**
     * Serves a stored file by its storage path once the caller's access to it
     * has been established. Any denial other than a missing login is reported
     * as not found.
     */
    public Resource openFile(String storagePath, Credentials credentials) {
        Verdict verdict = filePathAuthorizer.authorize(storagePath, credentials).concealed();
        if (!verdict.isGranted()) {
            throw new AuthorizationException(verdict);
        }
        return storage.open(storagePath)
            .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));
    }

    /**
     * Serves the original or the thumbnail of a photo by id.
     */
    public Resource openPhotoFile(PhotoId id, boolean thumbnail, Credentials credentials) {
        engine.requireConcealed(Operation.FETCH_FILE, ResourceRef.photo(id.value()), credentials);
        Photo photo = photoRepository.findById(id)
            .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));
        String path = thumbnail ? photo.thumbnailPath() : photo.storagePath();
        if (path == null) {
            throw new AuthorizationException(Verdict.notFound());
        }
        return storage.open(path)
            .orElseThrow(() -> new AuthorizationException(Verdict.notFound()));
    }

    private void checkQuota(Share share, Long guestId, long size) {
        if (share.maxUploadBytes() != null && size > share.maxUploadBytes()) {
            throw new UploadLimitException("File exceeds the " + share.maxUploadBytes() + " byte limit of this link");
        }
        if (share.maxFilesPerGuest() != null) {
            if (guestId == null) {
                throw new IllegalArgumentException("Register a display name before uploading through this link");
            }
            if (photoRepository.countByGuest(share.id(), guestId) >= share.maxFilesPerGuest()) {
                throw new UploadLimitException("Upload limit of " + share.maxFilesPerGuest() + " files reached");
            }
        }
    }

    private StoragePath uniquePath(Album album, String filename) {
        StoragePath path = StoragePath.of(album.ownerId(), album.id(), filename);
        while (photoRepository.existsByPath(path.toString()) || storage.exists(path)) {
            path = StoragePath.of(album.ownerId(), album.id(), Tokens.random(6) + "_" + filename);
        }
        return path;
    }

    private static String withExtension(String filename, String extension) {
        int dot = filename.lastIndexOf('.');
        String base = dot > 0 ? filename.substring(0, dot) : filename;
        String candidate = base + "." + extension;
        // keep room for the uniquifying prefix
        return candidate.length() > 180 ? candidate.substring(candidate.length() - 180) : candidate;
    }
}
