package de.htwsaar.datalinker.datalink;

import de.htwsaar.datalinker.datalink.adapter.config.ConfiguredCutoutLocator;
import de.htwsaar.datalinker.datalink.adapter.http.HttpDatasetRegistryClient;
import de.htwsaar.datalinker.datalink.adapter.http.HttpHipsPropertiesSource;
import de.htwsaar.datalinker.datalink.config.CutoutProperties;
import de.htwsaar.datalinker.datalink.config.HipsProperties;
import de.htwsaar.datalinker.datalink.domain.StorageResolver;
import de.htwsaar.datalinker.datalink.domain.UrlSigner;
import de.htwsaar.datalinker.datalink.hips.CollectionListCache;
import de.htwsaar.datalinker.datalink.hips.HipsListRefresher;
import de.htwsaar.datalinker.datalink.hips.HipsListRegistry;
import de.htwsaar.datalinker.datalink.identifier.IdentifierResolver;
import de.htwsaar.datalinker.datalink.link.Capability;
import de.htwsaar.datalinker.datalink.link.CutoutLinkProvider;
import de.htwsaar.datalinker.datalink.link.LinkAssembler;
import de.htwsaar.datalinker.datalink.render.LinksCachePolicy;
import de.htwsaar.datalinker.datalink.render.VoTableRenderer;
import de.htwsaar.datalinker.datalink.service.DataLinkService;
import de.htwsaar.datalinker.datalink.signing.ExpiryAwareSigner;
import de.htwsaar.datalinker.datalink.signing.GatewayHmacSigner;
import de.htwsaar.datalinker.datalink.signing.PassThroughSigner;
import de.htwsaar.datalinker.datalink.signing.SchemeRoutingSigner;
import de.htwsaar.datalinker.datalink.tap.TapColumnMetadata;
import de.htwsaar.datalinker.datalink.tap.TapRedirectService;
import de.htwsaar.datalinker.datalink.web.ServiceMetadata;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

/**
 * Zentrale Spring-Verdrahtung des DataLink-Dienstes.
 *
 * <p>Schichtung: Controller → Service → Domain/Ports → Adapter</p>
 */
@Configuration
@EnableConfigurationProperties({HipsProperties.class, CutoutProperties.class})
public class DatalinkBeans {

    private static final Logger log = LoggerFactory.getLogger(DatalinkBeans.class);

    /**
     * Systemuhr für den gesamten Kontext.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * HTTP-Client für Registry und HiPS-Server, mit festem Timeout pro Aufruf.
     *
     * @param timeoutMs Connect- und Read-Timeout in ms
     * @return RestTemplate
     */
    @Bean
    public RestTemplate restTemplate(@Value("${datalinker.registry.timeout-ms:5000}") int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Bean
    public IdentifierResolver identifierResolver() {
        return new IdentifierResolver();
    }

    /**
     * Signierer je URI-Schema. {@code s3}/{@code gs} nur, wenn Gateway und Schlüssel konfiguriert sind.
     */
    @Bean
    public UrlSigner urlSigner(
            Clock clock,
            @Value("${datalinker.storage.gateway-url:}") String gatewayUrl,
            @Value("${datalinker.storage.signing-key:}") String signingKey) {
        Map<String, UrlSigner> signers = new LinkedHashMap<>();
        PassThroughSigner passThrough = new PassThroughSigner(clock);
        signers.put("http", passThrough);
        signers.put("https", passThrough);
        if (!gatewayUrl.isBlank() && !signingKey.isBlank()) {
            GatewayHmacSigner gateway = new GatewayHmacSigner(URI.create(gatewayUrl.trim()), signingKey, clock);
            signers.put("s3", gateway);
            signers.put("gs", gateway);
        } else {
            log.info("No storage gateway configured, s3/gs references cannot be signed");
        }
        return new SchemeRoutingSigner(signers);
    }

    @Bean
    public ExpiryAwareSigner expiryAwareSigner(
            UrlSigner urlSigner, @Value("${datalinker.links.lifetime:PT1H}") Duration lifetime) {
        return new ExpiryAwareSigner(urlSigner, lifetime);
    }

    @Bean
    public VoTableRenderer voTableRenderer(Clock clock, @Value("${datalinker.links.lifetime:PT1H}") Duration lifetime) {
        return new VoTableRenderer(new LinksCachePolicy(clock, lifetime));
    }

    @Bean
    public ConfiguredCutoutLocator cutoutLocator(CutoutProperties cutout) {
        URI defaultEndpoint =
                cutout.syncUrl() == null || cutout.syncUrl().isBlank() ? null : URI.create(cutout.syncUrl().trim());
        Map<String, URI> overrides = new LinkedHashMap<>();
        cutout.endpoints().forEach((label, url) -> overrides.put(label, URI.create(url.trim())));
        return new ConfiguredCutoutLocator(defaultEndpoint, overrides);
    }

    /**
     * Adapter-Implementierung des {@link StorageResolver}-Ports via HTTP.
     */
    @Bean
    public StorageResolver storageResolver(
            RestTemplate rt, @Value("${datalinker.registry.base-url:http://localhost:8085}") String registryBaseUrl) {
        return new HttpDatasetRegistryClient(rt, URI.create(registryBaseUrl));
    }

    @Bean
    public LinkAssembler linkAssembler(
            StorageResolver storageResolver, ExpiryAwareSigner signer, ConfiguredCutoutLocator cutoutLocator) {
        return new LinkAssembler(storageResolver, signer, List.of(new CutoutLinkProvider(cutoutLocator)));
    }

    /**
     * Cutouts sind deploymentweit aktiv, sobald irgendein Endpunkt konfiguriert ist.
     */
    @Bean
    public DataLinkService dataLinkService(
            IdentifierResolver resolver,
            LinkAssembler assembler,
            VoTableRenderer renderer,
            ConfiguredCutoutLocator cutoutLocator) {
        EnumSet<Capability> capabilities = EnumSet.noneOf(Capability.class);
        if (cutoutLocator.isConfigured()) {
            capabilities.add(Capability.CUTOUT);
        }
        log.info("DataLink capabilities enabled: {}", capabilities);
        return new DataLinkService(resolver, assembler, renderer, capabilities);
    }

    @Bean
    public TapRedirectService tapRedirectService(
            @Value("${datalinker.tap.sync-url:/api/tap/sync}") String tapSyncUrl,
            @Value("${datalinker.tap.metadata-dir:}") String metadataDir) {
        Path dir = metadataDir.isBlank() ? null : Path.of(metadataDir.trim());
        return new TapRedirectService(tapSyncUrl, new TapColumnMetadata(dir));
    }

    @Bean
    public ServiceMetadata serviceMetadata(
            @Value("${datalinker.name:datalinker}") String name,
            @Value("${datalinker.version:0.0.0}") String version,
            @Value("${datalinker.description:IVOA DataLink service}") String description,
            @Value("${datalinker.repository-url:}") String repositoryUrl,
            @Value("${datalinker.documentation-url:}") String documentationUrl) {
        return new ServiceMetadata(name, version, description, repositoryUrl, documentationUrl);
    }

    /**
     * Executor für von Lesern angestoßene HiPS-Refreshs; Refreshs sind pro Cache serialisiert.
     */
    @Bean
    public ThreadPoolTaskExecutor hipsRefreshExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(8);
        executor.setThreadNamePrefix("hips-refresh-");
        executor.initialize();
        return executor;
    }

    @Bean
    public HipsListRegistry hipsListRegistry(
            HipsProperties hips, RestTemplate rt, Clock clock, ThreadPoolTaskExecutor hipsRefreshExecutor) {
        Map<String, CollectionListCache> caches = new LinkedHashMap<>();
        hips.datasets().forEach((name, dataset) -> {
            HttpHipsPropertiesSource source =
                    new HttpHipsPropertiesSource(rt, name, dataset.url(), dataset.paths(), hips.token());
            caches.put(name, new CollectionListCache(name, source, clock, hips.ttl(), hipsRefreshExecutor));
        });
        log.info("Configured HiPS datasets: {} (default: {})", caches.keySet(), hips.defaultDataset());
        return new HipsListRegistry(caches, hips.defaultDataset());
    }

    @Bean
    public HipsListRefresher hipsListRefresher(HipsListRegistry registry) {
        return new HipsListRefresher(registry);
    }
}
