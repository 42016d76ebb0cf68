package work.enamap.mapper.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.enamap.mapper.shared.CatalogDates;

/**
 * Catalog and kernel services of the data access API, over {@link HttpClient}.
 */
public final class HttpDataAccessClient implements ScienceCatalog, KernelCatalog {
    private static final Logger LOG = LoggerFactory.getLogger(HttpDataAccessClient.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Pattern FILE_NAME_TAG = Pattern.compile("imap_[a-z0-9]+_(.+?)_\\d{8}(?:_\\d{8})?_v\\d+\\.\\w+");

    private final String baseUrl;
    private final String apiKey;
    private final DataLayout layout;
    private final HttpClient httpClient;

    public HttpDataAccessClient(String baseUrl, String apiKey, DataLayout layout) {
        this(baseUrl, apiKey, layout, HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build());
    }

    public HttpDataAccessClient(String baseUrl, String apiKey, DataLayout layout, HttpClient httpClient) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.layout = Objects.requireNonNull(layout, "layout");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public List<CatalogFileRecord> query(String instrument, String dataLevel, String descriptorTag, String startDate, String endDate) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("instrument", instrument);
        params.put("data_level", dataLevel);
        params.put("descriptor", descriptorTag);
        params.put("start_date", startDate);
        params.put("end_date", endDate);
        return toRecords(getJson(endpoint("query", params)), descriptorTag);
    }

    @Override
    public List<CatalogFileRecord> queryAncillary(String instrument) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("table", "ancillary");
        params.put("instrument", instrument);
        return toRecords(getJson(endpoint("query", params)), null);
    }

    @Override
    public Path download(String fileName) {
        return fetch(layout.relativeSciencePath(fileName));
    }

    @Override
    public List<KernelWindow> windows(KernelCategory category) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("type", category.queryType());
        params.put("start_time", "0");
        JsonNode root = getJson(endpoint("spice-query", params));
        List<KernelWindow> windows = new ArrayList<>();
        for (JsonNode node : root) {
            windows.add(new KernelWindow(
                category,
                node.path("file_name").asText(),
                CatalogDates.parseKernelDateTime(node.path("min_date_datetime").asText()),
                CatalogDates.parseKernelDateTime(node.path("max_date_datetime").asText())
            ));
        }
        return windows;
    }

    @Override
    public Path download(KernelWindow kernel) {
        return fetch(layout.relativeKernelPath(kernel.fileName()));
    }

    private Path fetch(String relativePath) {
        Path target = layout.dataDir().resolve(relativePath);
        if (Files.isRegularFile(target)) {
            LOG.debug("Using cached {}", target);
            return target;
        }
        URI uri = URI.create(baseUrl + "/download/" + relativePath);
        LOG.debug("Downloading {}", uri);
        HttpResponse<InputStream> response = send(uri);
        try (InputStream body = response.body()) {
            Files.createDirectories(target.getParent());
            Path partial = target.resolveSibling(target.getFileName() + ".part");
            try {
                Files.copy(body, partial, StandardCopyOption.REPLACE_EXISTING);
                Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(partial);
            }
        } catch (IOException ex) {
            throw new ExternalServiceException(uri, "Failed to store download", ex);
        }
        return target;
    }

    private JsonNode getJson(URI uri) {
        HttpResponse<InputStream> response = send(uri);
        try (InputStream body = response.body()) {
            JsonNode root = JSON.readTree(body);
            if (root == null || !root.isArray()) {
                throw new ExternalServiceException(uri, "Expected a JSON array", null);
            }
            return root;
        } catch (IOException ex) {
            throw new ExternalServiceException(uri, "Unreadable response", ex);
        }
    }

    private HttpResponse<InputStream> send(URI uri) {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri).GET();
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(uri, "Interrupted while calling", ex);
        } catch (IOException ex) {
            throw new ExternalServiceException(uri, "Request failed", ex);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            try (InputStream body = response.body()) {
                body.transferTo(OutputStream.nullOutputStream());
            } catch (IOException ex) {
                throw new ExternalServiceException(uri, "Request failed with HTTP " + status, ex);
            }
            throw new ExternalServiceException(uri, status);
        }
        return response;
    }

    private URI endpoint(String path, Map<String, String> params) {
        StringBuilder url = new StringBuilder(baseUrl).append('/').append(path);
        char separator = '?';
        for (Map.Entry<String, String> entry : params.entrySet()) {
            url.append(separator)
                .append(entry.getKey())
                .append('=')
                .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
            separator = '&';
        }
        return URI.create(url.toString());
    }

    private static List<CatalogFileRecord> toRecords(JsonNode root, String fallbackTag) {
        List<CatalogFileRecord> records = new ArrayList<>();
        for (JsonNode node : root) {
            String filePath = node.path("file_path").asText();
            String tag;
            if (node.hasNonNull("descriptor")) {
                tag = node.get("descriptor").asText();
            } else {
                tag = fallbackTag != null ? fallbackTag : tagFromFileName(filePath);
            }
            records.add(new CatalogFileRecord(
                filePath,
                tag,
                node.path("start_date").asText(),
                node.path("version").asText()
            ));
        }
        return records;
    }

    /**
     * Tag of {@code imap_<inst>_<tag>_<yyyyMMdd>[_<yyyyMMdd>]_v<NNN>.<ext>}, or empty when the name has another shape.
     */
    static String tagFromFileName(String filePath) {
        String fileName = filePath.substring(filePath.lastIndexOf('/') + 1);
        Matcher matcher = FILE_NAME_TAG.matcher(fileName);
        return matcher.matches() ? matcher.group(1) : "";
    }
}
