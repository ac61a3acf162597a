package net.wizeops.tiercache.annotations;

import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.providers.ai.AiResponseCache;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Aspect
public class CachedOperationAspect {
    private final AiResponseCache cache;

    public CachedOperationAspect(AiResponseCache cache) {
        this.cache = cache;
    }

    @Around("@annotation(cachedOperation)")
    public Object cachedOperation(ProceedingJoinPoint joinPoint, CachedOperation cachedOperation) throws Throwable {
        Object[] args = joinPoint.getArgs();
        if (args == null || args.length == 0 || !(args[0] instanceof String)) {
            log.debug("Skipping cache for {}: first argument is not text", joinPoint.getSignature().getName());
            return joinPoint.proceed();
        }
        String text = (String) args[0];
        String operation = cachedOperation.operation();
        Map<String, ?> options = findOptions(args);
        String question = questionArgument(args, cachedOperation.questionArgument());

        Optional<Object> cached = cache.getCachedResponse(text, operation, options, question);
        if (cached.isPresent()) {
            log.debug("Cache hit for operation: {}", operation);
            return cached.get();
        }

        log.debug("Cache miss for operation: {}", operation);
        Object result = joinPoint.proceed();

        if (result != null) {
            if (cachedOperation.ttlSeconds() > 0) {
                cache.set(cache.buildKey(text, operation, options, question), result,
                        Duration.ofSeconds(cachedOperation.ttlSeconds()));
            } else {
                cache.cacheResponse(text, operation, options, result, question);
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> findOptions(Object[] args) {
        for (int i = 1; i < args.length; i++) {
            if (args[i] instanceof Map) {
                return (Map<String, ?>) args[i];
            }
        }
        return Map.of();
    }

    private static String questionArgument(Object[] args, int index) {
        if (index < 0 || index >= args.length || args[index] == null) {
            return null;
        }
        return String.valueOf(args[index]);
    }
}
