package warden.adapter.out.storage.redis;

import java.util.stream.Collectors;

import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Uni;

/**
 * Namespaced key removal.
 *
 * <p>Keys are found with {@code SCAN ... MATCH} and deleted in batches. The
 * pattern must always carry this service's prefix; there is no operation here
 * that touches keys outside of it.
 */
public final class RedisKeyspace {

    private static final int SCAN_COUNT = 1000;
    private static final int DELETE_BATCH = 100;

    private RedisKeyspace() {}

    /**
     * Delete every key matching a namespaced pattern.
     *
     * @param keyCommands key commands
     * @param pattern a glob pattern that starts with the service prefix
     * @return the number of keys deleted
     */
    public static Uni<Long> deleteMatching(ReactiveKeyCommands<String> keyCommands, String pattern) {
        if (pattern == null || pattern.isBlank() || pattern.startsWith("*")) {
            return Uni.createFrom().failure(new IllegalArgumentException("Refusing unscoped key pattern: " + pattern));
        }

        final var args = new KeyScanArgs().match(pattern).count(SCAN_COUNT);
        return keyCommands
                .scan(args)
                .toMulti()
                .group()
                .intoLists()
                .of(DELETE_BATCH)
                .onItem()
                .transformToUniAndConcatenate(batch -> keyCommands.del(batch.toArray(new String[0])))
                .collect()
                .with(Collectors.summingLong(Integer::longValue));
    }
}
