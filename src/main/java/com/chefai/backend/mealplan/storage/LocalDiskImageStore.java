package com.chefai.backend.mealplan.storage;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestClient;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

@Slf4j
@Getter
@Service
public class LocalDiskImageStore implements ImageStore {

    /** 圖片大小上限（provider 產圖一般 < 5MB） */
    static final int MAX_BYTES = 10 * 1024 * 1024;

    private static final List<String> EXTS = List.of("png", "jpg", "webp", "gif");
    private static final DefaultResponseErrorHandler ERRORS = new DefaultResponseErrorHandler();

    private final Path baseDir;
    private final String publicPrefix;
    private final RestClient http;

    public LocalDiskImageStore(
            @Value("${app.storage.images.base-dir:./data/images}") String baseDir,
            @Value("${app.storage.images.public-prefix:/media/}") String publicPrefix,
            @Value("${app.storage.images.download-timeout:PT15S}") Duration downloadTimeout
    ) {
        this.baseDir = Paths.get(baseDir).toAbsolutePath().normalize();
        this.publicPrefix = publicPrefix.endsWith("/") ? publicPrefix : publicPrefix + "/";

        var rf = new SimpleClientHttpRequestFactory();
        rf.setConnectTimeout((int) downloadTimeout.toMillis());
        rf.setReadTimeout((int) downloadTimeout.toMillis());
        this.http = RestClient.builder().requestFactory(rf).build();
    }

    @Override
    public String storeDurable(String transientUrl, String recordId) throws Exception {
        if (transientUrl == null || transientUrl.isBlank()) return null;
        if (recordId == null || recordId.isBlank()) return null;

        Downloaded img = download(transientUrl, recordId);
        if (img == null) return null;

        String ext = extOf(img.contentType());
        String objectKey = objectKey(recordId, ext);
        write(objectKey, img.body());

        return publicPrefix + objectKey;
    }

    @Override
    public void delete(String recordId) throws Exception {
        if (recordId == null || recordId.isBlank()) return;
        int removed = 0;
        for (String ext : EXTS) {
            Path path = resolve(objectKey(recordId, ext));
            if (Files.deleteIfExists(path)) removed++;
            Files.deleteIfExists(path.resolveSibling(path.getFileName() + ".part"));
        }
        if (removed > 0) {
            log.debug("image_deleted recordId={} files={}", recordId, removed);
        }
    }

    /** 邊讀邊算大小，超過上限就放棄，不會整包吃進記憶體 */
    private Downloaded download(String transientUrl, String recordId) {
        return http.get()
                .uri(transientUrl)
                .exchange((req, resp) -> {
                    if (resp.getStatusCode().isError()) {
                        // 沿用 retrieve() 的 4xx/5xx 例外
                        ERRORS.handleError(resp);
                    }

                    long declared = resp.getHeaders().getContentLength();
                    if (declared > MAX_BYTES) {
                        log.warn("image_download_too_large recordId={} bytes={}", recordId, declared);
                        return null;
                    }

                    byte[] body;
                    try (InputStream in = resp.getBody()) {
                        body = in.readNBytes(MAX_BYTES + 1);
                    }
                    if (body.length == 0) {
                        log.warn("image_download_empty recordId={}", recordId);
                        return null;
                    }
                    if (body.length > MAX_BYTES) {
                        log.warn("image_download_too_large recordId={} bytes>{}", recordId, MAX_BYTES);
                        return null;
                    }
                    return new Downloaded(body, resp.getHeaders().getContentType());
                });
    }

    private static String objectKey(String recordId, String ext) {
        return "recipes/" + recordId + "." + ext;
    }

    private void write(String objectKey, byte[] bytes) throws Exception {
        Path path = resolve(objectKey);
        Files.createDirectories(path.getParent());

        // 先寫 tmp 再 move，避免讀到半個檔
        Path tmp = path.resolveSibling(path.getFileName() + ".part");
        try (OutputStream out = Files.newOutputStream(tmp, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            out.write(bytes);
        }
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    }

    static String extOf(MediaType ct) {
        if (ct == null) return "png";
        String sub = ct.getSubtype().toLowerCase(Locale.ROOT);
        return switch (sub) {
            case "jpeg", "jpg" -> "jpg";
            case "webp" -> "webp";
            case "gif" -> "gif";
            default -> "png";
        };
    }

    private record Downloaded(byte[] body, MediaType contentType) {}

    private Path resolve(String objectKey) {
        Path p = baseDir.resolve(objectKey).normalize();
        if (!p.startsWith(baseDir)) throw new SecurityException("Invalid objectKey");
        return p;
    }
}
