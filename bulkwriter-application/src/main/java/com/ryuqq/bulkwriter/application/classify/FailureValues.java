package com.ryuqq.bulkwriter.application.classify;

import com.ryuqq.bulkwriter.core.model.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 원격 실패 페이로드에서 식별자를 꺼내는 도우미.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
final class FailureValues {

    private static final Logger log = LoggerFactory.getLogger(FailureValues.class);

    private static final Pattern ID_PATTERN = Pattern.compile("-?\\d{1,19}");

    private FailureValues() {
    }

    /**
     * 각 맵의 숫자 필드를 내부 ID로 읽습니다. 숫자가 아닌 값은 무시합니다.
     */
    static List<Identity> internalIds(List<Map<String, Object>> entries, String field) {
        List<Identity> ids = new ArrayList<>();
        for (Map<String, Object> entry : entries) {
            Object value = entry.get(field);
            if (value instanceof Number number) {
                ids.add(Identity.of(number.longValue()));
            }
        }
        return ids;
    }

    /**
     * 각 맵의 문자열 필드를 외부 ID 형태 식별자로 읽습니다. 문자열이 아닌 값은 무시합니다.
     */
    static List<Identity> stringIds(List<Map<String, Object>> entries, String field) {
        List<Identity> ids = new ArrayList<>();
        for (Map<String, Object> entry : entries) {
            Object value = entry.get(field);
            if (value instanceof String text) {
                ids.add(Identity.of(text));
            }
        }
        return ids;
    }

    /**
     * space/externalId 쌍을 인스턴스 식별자로 읽습니다.
     */
    static List<Identity> instanceIds(List<Map<String, Object>> entries) {
        List<Identity> ids = new ArrayList<>();
        for (Map<String, Object> entry : entries) {
            if (entry.get("space") instanceof String space && entry.get("externalId") instanceof String externalId) {
                ids.add(Identity.instance(space, externalId));
            }
        }
        return ids;
    }

    /**
     * "1, 2, 3" 형태의 ID 목록을 파싱합니다. 숫자가 아니거나 long 범위를 벗어난 조각은 건너뜁니다.
     */
    static List<Identity> parseIdString(String idString) {
        List<Identity> ids = new ArrayList<>();
        for (String part : idString.split(",")) {
            String trimmed = part.trim();
            if (!ID_PATTERN.matcher(trimmed).matches()) {
                continue;
            }
            try {
                ids.add(Identity.of(Long.parseLong(trimmed)));
            } catch (NumberFormatException e) {
                log.debug("Ignoring id out of long range: {}", trimmed);
            }
        }
        return ids;
    }

    /**
     * 접두어 뒤의 나머지 문자열.
     */
    static String after(String message, String prefix) {
        String rest = message.substring(prefix.length());
        if (rest.startsWith(": ")) {
            return rest.substring(2);
        }
        return rest.startsWith(" ") ? rest.substring(1) : rest;
    }

    static boolean startsWithIgnoreCase(String message, String prefix) {
        return message.regionMatches(true, 0, prefix, 0, prefix.length());
    }
}
