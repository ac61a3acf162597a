package net.wizeops.tiercache.factory;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.api.CacheProvider;
import net.wizeops.tiercache.api.RemoteStore;
import net.wizeops.tiercache.api.RemoteStoreConnector;
import net.wizeops.tiercache.config.CacheConfig;
import net.wizeops.tiercache.config.CacheStrategy;
import net.wizeops.tiercache.exceptions.ConfigurationException;
import net.wizeops.tiercache.exceptions.InfrastructureException;
import net.wizeops.tiercache.monitoring.PerformanceMonitor;
import net.wizeops.tiercache.providers.ai.AiResponseCache;
import net.wizeops.tiercache.providers.memory.MemoryCacheProvider;
import net.wizeops.tiercache.providers.tiered.TwoTierCacheProvider;
import net.wizeops.tiercache.security.SecurityManager;
import net.wizeops.tiercache.security.SecurityValidationResult;

import java.util.Map;

/**
 * Builds cache instances from configuration.
 * <p>
 * Every call returns a new, independently closable instance; sharing goes through
 * {@link net.wizeops.tiercache.manager.CacheRegistry}. When the remote tier cannot be
 * reached the factory returns a memory-only cache, unless the configuration sets
 * {@code failOnConnectionError}.
 */
@Slf4j
public class CacheFactory {
    @Getter
    private final PerformanceMonitor monitor;
    private final RemoteStoreConnector connector;

    public CacheFactory() {
        this(null, new ReflectiveRemoteStoreConnector());
    }

    public CacheFactory(PerformanceMonitor monitor) {
        this(monitor, new ReflectiveRemoteStoreConnector());
    }

    public CacheFactory(PerformanceMonitor monitor, RemoteStoreConnector connector) {
        this.monitor = PerformanceMonitor.orNoop(monitor);
        this.connector = connector;
    }

    /**
     * @throws ConfigurationException  when the configuration is invalid, before any connection attempt
     * @throws InfrastructureException when the remote tier is unreachable and
     *                                 {@code failOnConnectionError} is set
     */
    public CacheProvider createCache(CacheConfig config) {
        if (config == null) {
            throw new ConfigurationException("config: required");
        }
        config.validateOrThrow();
        applySecurityPolicy(config);

        CacheProvider cache = config.hasRemote() ? connectOrFallback(config) : memoryOnly(config);
        if (config.isEnableAiFeatures() || config.getStrategy() == CacheStrategy.AI_OPTIMIZED) {
            return new AiResponseCache(cache, config, monitor);
        }
        return cache;
    }

    /**
     * Two-tier cache with generic web defaults.
     */
    public CacheProvider forWebApp(String remoteUrl) {
        return createCache(CacheConfig.forStrategy(CacheStrategy.BALANCED).remoteUrl(remoteUrl).build());
    }

    /**
     * AI-optimized cache with per-operation TTLs.
     */
    public AiResponseCache forAiApp(String remoteUrl) {
        return (AiResponseCache) createCache(CacheConfig.forStrategy(CacheStrategy.AI_OPTIMIZED).remoteUrl(remoteUrl).build());
    }

    /**
     * Isolated memory-only cache; never touches the network.
     */
    public CacheProvider forTesting() {
        return createCache(CacheConfig.forStrategy(CacheStrategy.FAST).build());
    }

    public CacheProvider forTesting(int memoryCacheSize) {
        return createCache(CacheConfig.forStrategy(CacheStrategy.FAST).memoryCacheSize(memoryCacheSize).build());
    }

    /**
     * Builds from a structured map, e.g. parsed JSON from a dynamic configuration source.
     */
    public CacheProvider createCacheFromMap(Map<String, ?> configMap) {
        return createCache(CacheConfig.fromMap(configMap));
    }

    private CacheProvider connectOrFallback(CacheConfig config) {
        try {
            RemoteStore store = connector.connect(config);
            log.info("Created two-tier cache backed by {}", store.getDescription());
            return new TwoTierCacheProvider(config, store, monitor);
        } catch (RuntimeException e) {
            if (config.isFailOnConnectionError()) {
                log.error("Remote tier unavailable and failOnConnectionError is set", e);
                throw e instanceof InfrastructureException
                        ? (InfrastructureException) e
                        : new InfrastructureException("Remote tier unavailable: " + e.getMessage(), e);
            }
            log.warn("Remote tier unavailable ({}), falling back to memory-only cache", e.getMessage());
            log.debug("Remote connection failure", e);
            return memoryOnly(config);
        }
    }

    private CacheProvider memoryOnly(CacheConfig config) {
        return new MemoryCacheProvider(config, monitor);
    }

    private void applySecurityPolicy(CacheConfig config) {
        if (!config.hasRemote()) {
            return;
        }
        SecurityManager securityManager = new SecurityManager(config.getSecurityConfig());
        SecurityValidationResult assessment = securityManager.validateConfiguredSecurity(config.getRemoteUrl());
        if (!assessment.isSecure()) {
            log.warn("Remote tier security level {} (score {}): {}", assessment.getLevel(), assessment.getScore(),
                    assessment.getVulnerabilities());
        } else {
            log.debug("Remote tier security level {} (score {})", assessment.getLevel(), assessment.getScore());
        }
    }
}
