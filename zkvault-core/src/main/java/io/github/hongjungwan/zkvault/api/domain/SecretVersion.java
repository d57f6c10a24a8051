package io.github.hongjungwan.zkvault.api.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * 시크릿 버전 하나. 히스토리는 최신 버전이 앞에 오는 JSON 배열로 저장.
 */
@Getter
@Builder
@JsonDeserialize(builder = SecretVersion.SecretVersionBuilder.class)
public class SecretVersion {

    /** 1부터 시작하여 쓰기마다 1씩 증가 (재사용 없음) */
    private final int version;

    /** 와이어 포맷 암호문 ({@code hex(iv).hex(ciphertext)}) */
    @JsonProperty("value")
    private final String ciphertext;

    /** 작성자 감사 식별자 */
    @JsonProperty("user")
    private final String author;

    private final Instant createdAt;

    @Override
    public String toString() {
        return "SecretVersion{version=" + version + ", author=" + author + ", createdAt=" + createdAt + "}";
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SecretVersionBuilder {

        @JsonProperty("value")
        public SecretVersionBuilder ciphertext(String ciphertext) {
            this.ciphertext = ciphertext;
            return this;
        }

        @JsonProperty("user")
        public SecretVersionBuilder author(String author) {
            this.author = author;
            return this;
        }
    }
}
