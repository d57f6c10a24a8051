package io.github.hongjungwan.zkvault.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.zkvault.api.domain.SecretVersion;
import io.github.hongjungwan.zkvault.api.exception.InvalidFormatException;
import io.github.hongjungwan.zkvault.core.internal.VaultJson;

import java.util.List;

/**
 * 시크릿 히스토리 JSON 배열 코덱. 저장소 경계에서 한 번만 디코딩.
 */
public class SecretHistoryCodec {

    private static final TypeReference<List<SecretVersion>> HISTORY_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public SecretHistoryCodec() {
        this(VaultJson.createObjectMapper());
    }

    public SecretHistoryCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** 최신 버전이 앞에 오는 목록. null/빈 값은 빈 목록 */
    public List<SecretVersion> decode(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<SecretVersion> history = objectMapper.readValue(json, HISTORY_TYPE);
            return history == null ? List.of() : history;
        } catch (JsonProcessingException e) {
            throw new InvalidFormatException("Stored secret history is not valid JSON", e);
        }
    }

    public String encode(List<SecretVersion> history) {
        try {
            return objectMapper.writeValueAsString(history);
        } catch (JsonProcessingException e) {
            throw new InvalidFormatException("Failed to serialize secret history", e);
        }
    }
}
