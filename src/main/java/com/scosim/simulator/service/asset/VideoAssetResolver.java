package com.scosim.simulator.service.asset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Makes sure the clip exists locally, downloading it once when a download URL is configured.
 */
public class VideoAssetResolver {

    private static final Logger logger = LoggerFactory.getLogger(VideoAssetResolver.class);

    private static final Pattern DRIVE_FILE_PATH = Pattern.compile("/file/d/([a-zA-Z0-9_-]+)");
    private static final Pattern DRIVE_ID_PARAM = Pattern.compile("[?&]id=([a-zA-Z0-9_-]+)");
    private static final String DRIVE_DOWNLOAD = "https://drive.google.com/uc?export=download&id=";

    private final RestTemplate restTemplate;

    public VideoAssetResolver(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * @return the path of the clip, which exists when this returns
     * @throws IllegalStateException if the clip is missing and cannot be downloaded
     */
    public Path ensureAvailable(String videoPath, String downloadUrl) {
        Path target = Paths.get(videoPath);
        if (Files.isRegularFile(target)) {
            logger.info("Using video {} ({} MB)", target, sizeInMb(target));
            return target;
        }
        if (downloadUrl == null || downloadUrl.isBlank()) {
            throw new IllegalStateException("Video not found: " + target.toAbsolutePath());
        }

        String url = toDirectDownloadUrl(downloadUrl);
        logger.info("Video {} not found, downloading from {}", target, url);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path partial = target.resolveSibling(target.getFileName() + ".part");
            restTemplate.execute(url, HttpMethod.GET, null, response -> {
                try (InputStream body = response.getBody()) {
                    Files.copy(body, partial, StandardCopyOption.REPLACE_EXISTING);
                }
                return partial;
            });
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot save video to " + target, e);
        } catch (RestClientException e) {
            throw new IllegalStateException("Video download failed: " + e.getMessage(), e);
        }
        logger.info("Downloaded {} ({} MB)", target, sizeInMb(target));
        return target;
    }

    /**
     * Rewrites Google Drive share links to their direct-download form. Other URLs are returned unchanged.
     */
    public static String toDirectDownloadUrl(String url) {
        if (!url.contains("drive.google.com")) {
            return url;
        }
        Matcher m = DRIVE_FILE_PATH.matcher(url);
        if (m.find()) {
            return DRIVE_DOWNLOAD + m.group(1);
        }
        m = DRIVE_ID_PARAM.matcher(url);
        if (m.find()) {
            return DRIVE_DOWNLOAD + m.group(1);
        }
        throw new IllegalArgumentException("Could not extract file id from URL: " + url);
    }

    private static String sizeInMb(Path path) {
        try {
            return String.format("%.2f", Files.size(path) / (1024.0 * 1024.0));
        } catch (IOException e) {
            return "?";
        }
    }
}
