package net.wizeops.tiercache.api;

import net.wizeops.tiercache.config.CacheConfig;

/**
 * Opens a {@link RemoteStore} for a configuration, applying its security settings.
 */
@FunctionalInterface
public interface RemoteStoreConnector {

    /**
     * @throws net.wizeops.tiercache.exceptions.InfrastructureException when the store cannot
     *                                                                  be reached or rejects the handshake
     */
    RemoteStore connect(CacheConfig config);
}
