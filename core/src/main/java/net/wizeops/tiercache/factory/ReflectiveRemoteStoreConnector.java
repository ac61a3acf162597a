package net.wizeops.tiercache.factory;

import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.api.RemoteStore;
import net.wizeops.tiercache.api.RemoteStoreConnector;
import net.wizeops.tiercache.config.CacheConfig;
import net.wizeops.tiercache.exceptions.CacheException;
import net.wizeops.tiercache.exceptions.InfrastructureException;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Loads a {@link RemoteStore} implementation by class name so that the core module does not
 * depend on any client library. The class needs a public constructor taking a
 * {@link CacheConfig}.
 */
@Slf4j
public class ReflectiveRemoteStoreConnector implements RemoteStoreConnector {
    public static final String REDIS_STORE_CLASS = "net.wizeops.tiercache.providers.redis.RedisRemoteStore";

    private final String className;

    public ReflectiveRemoteStoreConnector() {
        this(REDIS_STORE_CLASS);
    }

    public ReflectiveRemoteStoreConnector(String className) {
        this.className = className;
    }

    @Override
    public RemoteStore connect(CacheConfig config) {
        try {
            Class<?> storeClass = Class.forName(className);
            Constructor<?> constructor = storeClass.getConstructor(CacheConfig.class);
            return (RemoteStore) constructor.newInstance(config);
        } catch (ClassNotFoundException e) {
            log.error("Remote store class not found: {}. Make sure the corresponding module is added as a dependency.", className);
            throw new InfrastructureException("Remote store not available: " + className.substring(className.lastIndexOf('.') + 1), e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CacheException) {
                throw (CacheException) cause;
            }
            throw new InfrastructureException("Failed to connect remote store: " + cause.getMessage(), cause);
        } catch (ReflectiveOperationException | ClassCastException e) {
            log.error("Failed to instantiate remote store class: {}", className, e);
            throw new InfrastructureException("Failed to instantiate remote store " + className, e);
        }
    }
}
