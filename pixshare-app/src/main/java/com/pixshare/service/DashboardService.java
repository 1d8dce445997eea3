package com.pixshare.service;

import com.pixshare.config.StorageConfig;
import com.pixshare.model.Album;
import com.pixshare.model.UserId;
import com.pixshare.repository.AlbumRepository;
import com.pixshare.repository.PhotoRepository;
import com.pixshare.security.AuthorizationEngine;
import com.pixshare.security.Credentials;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Summaries for the signed-in user's home page.
 */
@Service
public class DashboardService {

    static final int RECENT_ALBUMS = 3;
    private static final double BYTES_PER_GB = 1024.0 * 1024 * 1024;

    private final AlbumRepository albumRepository;
    private final PhotoRepository photoRepository;
    private final StorageConfig storageConfig;
    private final AuthorizationEngine engine;

    public record StorageUsage(long usedBytes, double usedGb, int limitGb) {}

    public DashboardService(AlbumRepository albumRepository,
                            PhotoRepository photoRepository,
                            StorageConfig storageConfig,
                            AuthorizationEngine engine) {
        this.albumRepository = albumRepository;
        this.photoRepository = photoRepository;
        this.storageConfig = storageConfig;
        this.engine = engine;
    }

    /**
     * Space taken by the photos the user owns, including those guests uploaded
     * to the user's albums.
     */
    public StorageUsage storageUsage(Credentials credentials) {
        UserId user = engine.requireUser(credentials);
        long used = photoRepository.sumSizeByOwner(user);
        double usedGb = Math.round(used / BYTES_PER_GB * 100) / 100.0;
        return new StorageUsage(used, usedGb, storageConfig.getQuotaGb());
    }

    public List<Album> recentAlbums(Credentials credentials) {
        return albumRepository.findRecentByOwner(engine.requireUser(credentials), RECENT_ALBUMS);
    }
}
