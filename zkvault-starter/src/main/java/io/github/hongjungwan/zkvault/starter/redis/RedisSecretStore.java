package io.github.hongjungwan.zkvault.starter.redis;

import io.github.hongjungwan.zkvault.api.exception.SecretStoreException;
import io.github.hongjungwan.zkvault.spi.SecretStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Redis 해시 기반 {@link SecretStore}. 필드 만료는 HPEXPIRE(Redis 7.4+)에 위임.
 */
@Slf4j
public class RedisSecretStore implements SecretStore {

    static final int SCAN_COUNT = 100;

    // ARGV: field, expected, expectAbsent(1|0), value
    static final RedisScript<Long> COMPARE_AND_SET = new DefaultRedisScript<>(
            "local current = redis.call('HGET', KEYS[1], ARGV[1])\n"
                    + "if ARGV[3] == '1' then\n"
                    + "  if current then return 0 end\n"
                    + "elseif current ~= ARGV[2] then\n"
                    + "  return 0\n"
                    + "end\n"
                    + "redis.call('HSET', KEYS[1], ARGV[1], ARGV[4])\n"
                    + "return 1",
            Long.class);

    // ARGV: ttlMillis, field. 필드가 없으면 -2
    static final RedisScript<Long> EXPIRE_FIELD = new DefaultRedisScript<>(
            "local result = redis.call('HPEXPIRE', KEYS[1], ARGV[1], 'FIELDS', 1, ARGV[2])\n"
                    + "return result[1]",
            Long.class);

    private final StringRedisTemplate template;
    private final HashOperations<String, String, String> hashes;

    public RedisSecretStore(StringRedisTemplate template) {
        this.template = template;
        this.hashes = template.opsForHash();
    }

    @Override
    public Optional<String> hget(String key, String field) {
        return call("HGET " + key, () -> Optional.ofNullable(hashes.get(key, field)));
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        return call("HGETALL " + key, () -> {
            Map<String, String> entries = hashes.entries(key);
            return entries == null ? Map.of() : new LinkedHashMap<>(entries);
        });
    }

    @Override
    public void hset(String key, Map<String, String> fields) {
        call("HSET " + key, () -> {
            hashes.putAll(key, fields);
            return null;
        });
    }

    @Override
    public long hdel(String key, String... fields) {
        return call("HDEL " + key, () -> {
            Long removed = hashes.delete(key, (Object[]) fields);
            return removed == null ? 0L : removed;
        });
    }

    @Override
    public boolean del(String key) {
        return call("DEL " + key, () -> Boolean.TRUE.equals(template.delete(key)));
    }

    @Override
    public boolean exists(String key) {
        return call("EXISTS " + key, () -> Boolean.TRUE.equals(template.hasKey(key)));
    }

    @Override
    public void expireField(String key, String field, Duration ttl) {
        long millis = Math.max(1, ttl.toMillis());
        Long result = call("HPEXPIRE " + key,
                () -> template.execute(EXPIRE_FIELD, List.of(key), Long.toString(millis), field));
        if (result != null && result == -2L) {
            log.debug("Field {} of {} not found, expiry not set", field, key);
        }
    }

    @Override
    public boolean compareAndSetField(String key, String field, String expected, String value) {
        return call("CAS " + key, () -> {
            Long swapped = template.execute(COMPARE_AND_SET, List.of(key),
                    field,
                    expected == null ? "" : expected,
                    expected == null ? "1" : "0",
                    value);
            return swapped != null && swapped == 1L;
        });
    }

    @Override
    public List<String> scan(String pattern) {
        return call("SCAN " + pattern, () -> {
            List<String> keys = new ArrayList<>();
            ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_COUNT).build();
            try (Cursor<String> cursor = template.scan(options)) {
                cursor.forEachRemaining(keys::add);
            }
            return keys;
        });
    }

    @Override
    public boolean ping() {
        return call("PING", () -> "PONG".equalsIgnoreCase(
                template.execute((RedisCallback<String>) RedisConnection::ping)));
    }

    private <T> T call(String operation, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException e) {
            log.debug("Redis command failed: {}", operation, e);
            throw new SecretStoreException("Redis command failed: " + operation, e);
        }
    }
}
