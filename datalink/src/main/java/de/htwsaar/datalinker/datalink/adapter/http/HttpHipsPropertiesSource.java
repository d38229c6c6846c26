package de.htwsaar.datalinker.datalink.adapter.http;

import de.htwsaar.datalinker.datalink.hips.CollectionListing;
import de.htwsaar.datalinker.datalink.hips.CollectionRecord;
import de.htwsaar.datalinker.datalink.hips.CollectionSource;
import de.htwsaar.datalinker.datalink.hips.HipsPropertiesFormat;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Liest die {@code properties}-Dateien aller HiPS-Bäume eines Datensatzes
 * ({@code <baseUrl>/<path>/properties}) und ergänzt jeweils {@code hips_service_url}.
 *
 * <p>Einzelne fehlgeschlagene Pfade werden geloggt und als nicht verfügbar gemeldet.</p>
 */
public final class HttpHipsPropertiesSource implements CollectionSource {

    private static final Logger log = LoggerFactory.getLogger(HttpHipsPropertiesSource.class);

    private final RestTemplate restTemplate;
    private final String dataset;
    private final String baseUrl;
    private final List<String> paths;
    private final String token;

    /**
     * @param restTemplate HTTP-Client
     * @param dataset      Datensatzname (nur für Logs)
     * @param baseUrl      Basis-URL des HiPS-Servers
     * @param paths        HiPS-Pfade relativ zur Basis-URL
     * @param token        Bearer-Token oder {@code null}
     */
    public HttpHipsPropertiesSource(
            RestTemplate restTemplate, String dataset, String baseUrl, List<String> paths, String token) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.dataset = Objects.requireNonNull(dataset, "dataset must not be null");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl must not be null"));
        this.paths = List.copyOf(paths);
        this.token = token;
    }

    @Override
    public CollectionListing listCollections() {
        List<CollectionRecord> records = new ArrayList<>();
        Set<String> unavailable = new LinkedHashSet<>();

        for (String path : paths) {
            String url = baseUrl + "/" + path;
            try {
                ResponseEntity<String> resp =
                        restTemplate.exchange(url + "/properties", HttpMethod.GET, requestEntity(), String.class);
                String text = HipsPropertiesFormat.insertServiceUrl(resp.getBody(), url);
                records.add(new CollectionRecord(path, url, HipsPropertiesFormat.parse(text), text));
            } catch (HttpStatusCodeException e) {
                log.warn(
                        "Unable to get HiPS properties for dataset {} url={} status={} error={}",
                        dataset,
                        url,
                        e.getStatusCode().value(),
                        e.getStatusText());
                unavailable.add(path);
            } catch (RestClientException e) {
                log.warn("Unable to get HiPS properties for dataset {} url={} error={}", dataset, url, e.getMessage());
                unavailable.add(path);
            }
        }
        return new CollectionListing(records, unavailable);
    }

    private HttpEntity<Void> requestEntity() {
        HttpHeaders headers = new HttpHeaders();
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
        }
        return new HttpEntity<>(headers);
    }

    private static String stripTrailingSlash(String url) {
        String u = url.trim();
        while (u.endsWith("/")) u = u.substring(0, u.length() - 1);
        return u;
    }
}
