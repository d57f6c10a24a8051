package io.github.hongjungwan.zkvault.core.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.zkvault.api.domain.ServiceToken;
import io.github.hongjungwan.zkvault.api.exception.InvalidFormatException;
import io.github.hongjungwan.zkvault.core.internal.VaultJson;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code serviceTokens} JSON 맵과 {@code ephemeral:*} 레코드 코덱.
 */
public class ServiceTokenCodec {

    private static final TypeReference<LinkedHashMap<String, ServiceToken>> TOKEN_MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ServiceTokenCodec() {
        this(VaultJson.createObjectMapper());
    }

    public ServiceTokenCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** publicId가 채워진 토큰 맵. null/빈 값은 빈 맵 */
    public Map<String, ServiceToken> decodeMap(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, ServiceToken> raw = objectMapper.readValue(json, TOKEN_MAP_TYPE);
            Map<String, ServiceToken> tokens = new LinkedHashMap<>();
            if (raw != null) {
                raw.forEach((publicId, token) -> tokens.put(publicId, token.withPublicId(publicId)));
            }
            return tokens;
        } catch (JsonProcessingException e) {
            throw new InvalidFormatException("Stored service token map is not valid JSON", e);
        }
    }

    public String encodeMap(Map<String, ServiceToken> tokens) {
        try {
            return objectMapper.writeValueAsString(tokens);
        } catch (JsonProcessingException e) {
            throw new InvalidFormatException("Failed to serialize service token map", e);
        }
    }

    public ServiceToken decode(String publicId, String json) {
        try {
            return objectMapper.readValue(json, ServiceToken.class).withPublicId(publicId);
        } catch (JsonProcessingException e) {
            throw new InvalidFormatException("Stored token record is not valid JSON", e);
        }
    }

    public String encode(ServiceToken token) {
        try {
            return objectMapper.writeValueAsString(token);
        } catch (JsonProcessingException e) {
            throw new InvalidFormatException("Failed to serialize token record", e);
        }
    }
}
