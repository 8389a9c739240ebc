package io.github.hongjungwan.ledger.api.domain;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 업로드 문서 메타데이터. 정해진 필드 외 확장 데이터는 attributes에 보관.
 */
@Getter
@Builder
public class DocumentMetadata {

    public static final String UNKNOWN = "unknown";
    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    /** 원본 파일명 */
    @Builder.Default
    private final String fileName = UNKNOWN;

    /** MIME 타입 */
    @Builder.Default
    private final String mimeType = DEFAULT_MIME_TYPE;

    /** 업로드 사용자 */
    @Builder.Default
    private final String userId = UNKNOWN;

    /** 확장 속성 */
    @Builder.Default
    private final Map<String, String> attributes = Map.of();

    // 빌더에 null을 명시하면 @Builder.Default가 적용되지 않으므로 조회 시 기본값으로 대체

    public String getFileName() {
        return fileName == null ? UNKNOWN : fileName;
    }

    public String getMimeType() {
        return mimeType == null ? DEFAULT_MIME_TYPE : mimeType;
    }

    public String getUserId() {
        return userId == null ? UNKNOWN : userId;
    }

    public Map<String, String> getAttributes() {
        return attributes == null ? Map.of() : attributes;
    }

    /** 해시 레코드 metadataJson 직렬화용 평탄화 맵 (확장 속성 우선순위 낮음) */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(getAttributes());
        map.put("file_name", getFileName());
        map.put("mime_type", getMimeType());
        map.put("user_id", getUserId());
        return Collections.unmodifiableMap(map);
    }

    public static DocumentMetadata empty() {
        return DocumentMetadata.builder().build();
    }
}
