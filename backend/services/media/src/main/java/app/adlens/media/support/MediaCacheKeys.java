package app.adlens.media.support;

import app.adlens.media.service.exception.InvalidMediaInputException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Cache identity of a media URL: lowercase hex MD5 of its UTF-8 bytes. The URL is hashed as given;
 * callers trim user input before it gets here.
 */
public final class MediaCacheKeys {
    private MediaCacheKeys() {
    }

    public static String identify(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidMediaInputException("url is required");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest(url.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 not available", ex);
        }
    }
}
