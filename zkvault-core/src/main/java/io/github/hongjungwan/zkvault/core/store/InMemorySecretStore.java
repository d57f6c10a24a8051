package io.github.hongjungwan.zkvault.core.store;

import io.github.hongjungwan.zkvault.spi.SecretStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 단일 프로세스/테스트용 저장소. 필드 만료는 주입된 Clock 기준으로 조회 시점에 적용.
 * 해시 단위 연산은 ConcurrentHashMap.compute로 원자적으로 수행.
 */
public class InMemorySecretStore implements SecretStore {

    private final ConcurrentHashMap<String, Map<String, FieldValue>> hashes = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySecretStore() {
        this(Clock.systemUTC());
    }

    public InMemorySecretStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> hget(String key, String field) {
        Map<String, FieldValue> hash = hashes.get(key);
        if (hash == null) {
            return Optional.empty();
        }
        synchronized (hash) {
            FieldValue value = hash.get(field);
            if (value == null || value.isExpired(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(value.value());
        }
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        Map<String, FieldValue> hash = hashes.get(key);
        if (hash == null) {
            return Map.of();
        }
        Instant now = clock.instant();
        Map<String, String> result = new LinkedHashMap<>();
        synchronized (hash) {
            hash.forEach((field, value) -> {
                if (!value.isExpired(now)) {
                    result.put(field, value.value());
                }
            });
        }
        return result;
    }

    @Override
    public void hset(String key, Map<String, String> fields) {
        hashes.compute(key, (k, hash) -> {
            Map<String, FieldValue> target = hash == null ? new LinkedHashMap<>() : hash;
            synchronized (target) {
                fields.forEach((field, value) -> target.put(field, new FieldValue(value, null)));
            }
            return target;
        });
    }

    @Override
    public long hdel(String key, String... fields) {
        long[] removed = {0};
        hashes.computeIfPresent(key, (k, hash) -> {
            synchronized (hash) {
                Instant now = clock.instant();
                for (String field : fields) {
                    FieldValue value = hash.remove(field);
                    if (value != null && !value.isExpired(now)) {
                        removed[0]++;
                    }
                }
                return liveOrNull(hash, now);
            }
        });
        return removed[0];
    }

    @Override
    public boolean del(String key) {
        return hashes.remove(key) != null;
    }

    @Override
    public boolean exists(String key) {
        return !hgetAll(key).isEmpty();
    }

    @Override
    public void expireField(String key, String field, Duration ttl) {
        Instant expiresAt = clock.instant().plus(ttl);
        hashes.computeIfPresent(key, (k, hash) -> {
            synchronized (hash) {
                FieldValue value = hash.get(field);
                if (value != null) {
                    hash.put(field, new FieldValue(value.value(), expiresAt));
                }
            }
            return hash;
        });
    }

    @Override
    public boolean compareAndSetField(String key, String field, String expected, String value) {
        boolean[] swapped = {false};
        hashes.compute(key, (k, hash) -> {
            Map<String, FieldValue> target = hash == null ? new LinkedHashMap<>() : hash;
            synchronized (target) {
                FieldValue current = target.get(field);
                String currentValue = current == null || current.isExpired(clock.instant()) ? null : current.value();
                if (Objects.equals(currentValue, expected)) {
                    target.put(field, new FieldValue(value, null));
                    swapped[0] = true;
                }
            }
            return target.isEmpty() ? null : target;
        });
        return swapped[0];
    }

    @Override
    public List<String> scan(String pattern) {
        Pattern regex = globToRegex(pattern);
        List<String> keys = new ArrayList<>();
        for (String key : hashes.keySet()) {
            if (regex.matcher(key).matches() && exists(key)) {
                keys.add(key);
            }
        }
        return keys;
    }

    @Override
    public boolean ping() {
        return true;
    }

    private Map<String, FieldValue> liveOrNull(Map<String, FieldValue> hash, Instant now) {
        hash.values().removeIf(value -> value.isExpired(now));
        return hash.isEmpty() ? null : hash;
    }

    /** Redis glob 중 '*', '?'만 지원 */
    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private record FieldValue(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
