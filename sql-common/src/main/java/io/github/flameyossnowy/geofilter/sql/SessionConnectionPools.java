package io.github.flameyossnowy.geofilter.sql;

import io.github.flameyossnowy.geofilter.api.session.FilterSession;
import io.github.flameyossnowy.geofilter.api.session.SessionResource;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * One connection provider per store, owned by a filter session and closed with it.
 */
public final class SessionConnectionPools implements SessionResource {
    private final Map<String, SQLConnectionProvider> providers = new ConcurrentHashMap<>();

    public static SessionConnectionPools of(@NotNull FilterSession session) {
        return session.resource(SessionConnectionPools.class, SessionConnectionPools::new);
    }

    public SQLConnectionProvider provider(@NotNull String storeKey, @NotNull Supplier<SQLConnectionProvider> factory) {
        return providers.computeIfAbsent(storeKey, key -> {
            Logging.info(() -> "Creating connection provider for " + key);
            return factory.get();
        });
    }

    public int size() {
        return providers.size();
    }

    @Override
    public void close() {
        List<SQLConnectionProvider> open = new ArrayList<>(providers.values());
        providers.clear();

        RuntimeException failure = null;
        for (SQLConnectionProvider provider : open) {
            try {
                provider.close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }

        if (failure != null) {
            throw failure;
        }
    }
}
