package com.pixshare.controller;

import com.pixshare.service.PhotoService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.io.Resource;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Raw uploaded files, addressed by storage path:
 * {@code /api/uploads/photos/<owner>/<album>/<file>}.
 */
@RestController
public class UploadsController {

    private static final AntPathMatcher MATCHER = new AntPathMatcher();

    private final PhotoService photoService;

    public UploadsController(PhotoService photoService) {
        this.photoService = photoService;
    }

    @GetMapping("/api/uploads/**")
    public ResponseEntity<Resource> getFile(HttpServletRequest request) {
        String path = (String) request.getAttribute(HandlerMapping.PATH_WITHIN_HANDLER_MAPPING_ATTRIBUTE);
        String pattern = (String) request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        String storagePath = MATCHER.extractPathWithinPattern(pattern, path);

        Resource file = photoService.openFile(storagePath, RequestCredentials.from(request));
        return ResponseEntity.ok()
            .contentType(MediaTypeFactory.getMediaType(file).orElse(MediaType.APPLICATION_OCTET_STREAM))
            .cacheControl(CacheControl.noStore())
            .body(file);
    }
}
