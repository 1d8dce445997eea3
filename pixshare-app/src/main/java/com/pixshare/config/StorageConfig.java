package com.pixshare.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "pixshare.storage")
public class StorageConfig {

    // Root directory that storage paths (photos/<user>/<album>/<file>) are relative to
    private String root = "uploads";
    private int thumbnailSize = 200;
    // Shown on the dashboard next to the space used; not enforced on upload
    private int quotaGb = 10;

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public int getThumbnailSize() {
        return thumbnailSize;
    }

    public void setThumbnailSize(int thumbnailSize) {
        this.thumbnailSize = thumbnailSize;
    }

    public int getQuotaGb() {
        return quotaGb;
    }

    public void setQuotaGb(int quotaGb) {
        this.quotaGb = quotaGb;
    }
}
