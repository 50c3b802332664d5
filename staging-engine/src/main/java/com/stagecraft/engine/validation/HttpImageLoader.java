package com.stagecraft.engine.validation;

import com.stagecraft.engine.model.ImageRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;

/**
 * Loads images from http(s) URLs or inline {@code data:} URIs and decodes
 * them with ImageIO (JPEG, PNG, GIF, BMP).
 */
@Component
public class HttpImageLoader implements ImageLoader {

    private static final Logger log = LoggerFactory.getLogger(HttpImageLoader.class);

    private final HttpClient http;
    private final Duration   timeout;

    public HttpImageLoader(@Value("${stagecraft.validation.fetch-timeout:30s}") Duration timeout) {
        this.timeout = timeout;
        this.http    = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public BufferedImage load(ImageRef image) {
        String url = image.url();
        byte[] bytes = url.startsWith("data:") ? decodeDataUri(url) : fetch(url);
        try {
            BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(bytes));
            if (decoded == null) {
                throw new ImageLoadException("Unsupported image format at " + abbreviate(url));
            }
            return decoded;
        } catch (IOException e) {
            throw new ImageLoadException("Failed to decode image at " + abbreviate(url), e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private byte[] fetch(String url) {
        log.debug("Fetching image {}", abbreviate(url));
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .GET()
                    .build();
            HttpResponse<byte[]> resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ImageLoadException("Image fetch failed: HTTP " + resp.statusCode()
                        + " for " + abbreviate(url));
            }
            return resp.body();
        } catch (ImageLoadException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImageLoadException("Image fetch interrupted for " + abbreviate(url), e);
        } catch (Exception e) {
            throw new ImageLoadException("Image fetch failed for " + abbreviate(url), e);
        }
    }

    static byte[] decodeDataUri(String uri) {
        int comma = uri.indexOf(',');
        if (comma < 0 || !uri.substring(0, comma).endsWith(";base64")) {
            throw new ImageLoadException("Only base64 data URIs are supported");
        }
        try {
            return Base64.getDecoder().decode(uri.substring(comma + 1));
        } catch (IllegalArgumentException e) {
            throw new ImageLoadException("Malformed base64 payload in data URI", e);
        }
    }

    private static String abbreviate(String url) {
        return url.length() > 120 ? url.substring(0, 117) + "..." : url;
    }
}
