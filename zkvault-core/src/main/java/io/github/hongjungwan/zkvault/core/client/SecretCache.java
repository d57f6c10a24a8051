package io.github.hongjungwan.zkvault.core.client;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * stale-while-revalidate 캐시. (project, environment)마다 복호화된 시크릿 맵 보관.
 *
 * <ul>
 *   <li>FRESH (나이 &lt; ttl): I/O 없이 반환</li>
 *   <li>STALE (ttl &le; 나이 &lt; ttl + swr): 캐시 값 반환, 키당 최대 1개의 백그라운드 갱신</li>
 *   <li>EXPIRED/EMPTY: 동기 로드</li>
 * </ul>
 */
@Slf4j
public class SecretCache {

    public enum State { EMPTY, FRESH, STALE, EXPIRED }

    /** 캐시 키 */
    public record Key(String project, String environment) {
        @Override
        public String toString() {
            return environment + ":" + project;
        }
    }

    private final LoadingCache<Key, Map<String, String>> cache;
    // Caffeine은 만료된 항목을 노출하지 않으므로 상태 계산용 로드 시각을 따로 보관
    private final Map<Key, Long> loadedAtNanos = new ConcurrentHashMap<>();
    private final Ticker ticker;
    private final long ttlNanos;
    private final long expireNanos;

    public SecretCache(Duration ttl, Duration staleWhileRevalidate, Executor executor, Ticker ticker,
                       Function<Key, Map<String, String>> loader) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache ttl must be positive");
        }
        if (staleWhileRevalidate.isNegative()) {
            throw new IllegalArgumentException("Stale-while-revalidate window must not be negative");
        }
        this.ticker = ticker;
        this.ttlNanos = ttl.toNanos();
        this.expireNanos = ttl.plus(staleWhileRevalidate).toNanos();
        this.cache = Caffeine.newBuilder()
                .ticker(ticker)
                .executor(executor)
                .refreshAfterWrite(ttl)
                .expireAfterWrite(ttl.plus(staleWhileRevalidate))
                .build(key -> {
                    log.debug("Loading secrets for {}", key);
                    Map<String, String> values = Map.copyOf(loader.apply(key));
                    loadedAtNanos.put(key, ticker.read());
                    return values;
                });
    }

    /** 상태에 따라 캐시 값 반환 또는 로드 */
    public Map<String, String> get(Key key) {
        return cache.get(key);
    }

    public void invalidate(Key key) {
        cache.invalidate(key);
        loadedAtNanos.remove(key);
    }

    /** 진단용 현재 상태 (갱신을 유발하지 않음) */
    public State state(Key key) {
        Long loadedAt = loadedAtNanos.get(key);
        if (loadedAt == null) {
            return State.EMPTY;
        }
        long age = ticker.read() - loadedAt;
        if (age < expireNanos && cache.policy().getIfPresentQuietly(key) == null) {
            // 무효화 도중 끝난 갱신이 남긴 시각
            loadedAtNanos.remove(key, loadedAt);
            return State.EMPTY;
        }
        if (age < ttlNanos) {
            return State.FRESH;
        }
        return age < expireNanos ? State.STALE : State.EXPIRED;
    }
}
