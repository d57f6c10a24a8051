package io.github.hongjungwan.zkvault.api.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * 토큰 레코드. 토큰 시크릿으로 파생한 키로 래핑된 PEK 사본을 보관하며 시크릿 자체는 저장하지 않음.
 * 임시 토큰은 {@code expiresAt}을 가짐.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = ServiceToken.ServiceTokenBuilder.class)
public class ServiceToken {

    /** 맵 키와 동일한 publicId (저장 시 생략) */
    @JsonIgnore
    private final String publicId;

    @JsonProperty("encryptedPEK")
    private final String encryptedPek;

    /** KDF salt (hex) */
    private final String salt;

    private final String name;

    private final String description;

    private final Instant createdAt;

    private final Instant expiresAt;

    @JsonIgnore
    public boolean isEphemeral() {
        return expiresAt != null;
    }

    /** 맵에서 읽은 레코드에 publicId 지정 */
    public ServiceToken withPublicId(String publicId) {
        return ServiceToken.builder()
                .publicId(publicId)
                .encryptedPek(encryptedPek)
                .salt(salt)
                .name(name)
                .description(description)
                .createdAt(createdAt)
                .expiresAt(expiresAt)
                .build();
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServiceTokenBuilder {

        @JsonProperty("encryptedPEK")
        public ServiceTokenBuilder encryptedPek(String encryptedPek) {
            this.encryptedPek = encryptedPek;
            return this;
        }
    }
}
