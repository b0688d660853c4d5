package dk.trustworks.staffing.services;

import dk.trustworks.staffing.model.StaffingSnapshot;
import io.quarkus.cache.CacheKeyGenerator;
import io.quarkus.cache.CompositeCacheKey;
import jakarta.enterprise.context.ApplicationScoped;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;

/**
 * Keys a rollup on the snapshot's version and content fingerprint instead of the snapshot
 * itself, together with the remaining arguments.
 */
@ApplicationScoped
public class RollupCacheKeyGenerator implements CacheKeyGenerator {

    @Override
    public Object generate(Method method, Object... methodParams) {
        StaffingSnapshot snapshot = (StaffingSnapshot) methodParams[0];
        Object[] key = new Object[methodParams.length + 1];
        key[0] = snapshot.getVersion();
        key[1] = snapshot.getFingerprint();
        for (int i = 1; i < methodParams.length; i++) {
            Object param = methodParams[i];
            key[i + 1] = param instanceof List<?> list ? new ArrayList<>(list) : param;
        }
        return new CompositeCacheKey(key);
    }
}
