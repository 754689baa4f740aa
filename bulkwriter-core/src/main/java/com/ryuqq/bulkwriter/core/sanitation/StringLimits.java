package com.ryuqq.bulkwriter.core.sanitation;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 문자열/메타데이터 길이 제한 유틸리티.
 *
 * <p>원격 API의 필드 한도에 맞게 값을 자르거나(sanitize) 한도를 만족하는지 확인(verify)합니다.
 * 모든 메서드는 null 입력을 허용하며 null이면 그대로 반환하거나 통과로 간주합니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public final class StringLimits {

    /**
     * 외부 ID 최대 길이.
     */
    public static final int EXTERNAL_ID_MAX = 255;

    private StringLimits() {
    }

    /**
     * 최대 문자 수로 자르기.
     *
     * @param value 원본 (null 허용)
     * @param maxLength 최대 길이
     * @return 잘린 문자열, 필요 없으면 원본
     */
    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    /**
     * @return null 또는 빈 문자열이거나 길이가 maxLength 이하이면 true
     */
    public static boolean checkLength(String value, int maxLength) {
        return value == null || value.length() <= maxLength;
    }

    /**
     * UTF-8 바이트 수로 자르기. 멀티바이트 문자 중간에서 자르지 않습니다.
     *
     * @param value 원본 (null 허용)
     * @param maxBytes 최대 바이트 수
     * @return 잘린 문자열, 필요 없으면 원본
     */
    public static String limitUtf8ByteCount(String value, int maxBytes) {
        if (utf8Length(value) <= maxBytes) {
            return value;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        int n = Math.max(maxBytes, 0);
        // continuation bytes are 10xxxxxx
        while (n > 0 && (bytes[n] & 0xC0) == 0x80) {
            n--;
        }
        return new String(bytes, 0, n, StandardCharsets.UTF_8);
    }

    public static int utf8Length(String value) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        return value.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * 메타데이터를 키/값/전체 바이트와 쌍 개수 한도에 맞게 자릅니다.
     *
     * <p>순서대로 순회하며 한도를 넘는 첫 쌍에서 멈춥니다. null 키는 버리고 null 값은 빈 문자열로 바꿉니다.</p>
     *
     * @return 잘린 새 맵, 입력이 null이거나 비어있으면 입력 그대로
     */
    public static Map<String, String> sanitizeMetadata(Map<String, String> data,
                                                       int maxPerKey, int maxPairs,
                                                       int maxPerValue, int maxBytes) {
        if (data == null || data.isEmpty()) {
            return data;
        }
        Map<String, String> result = new LinkedHashMap<>();
        int count = 0;
        int byteCount = 0;
        for (Map.Entry<String, String> entry : data.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            String key = limitUtf8ByteCount(entry.getKey(), maxPerKey);
            String value = entry.getValue() == null ? "" : limitUtf8ByteCount(entry.getValue(), maxPerValue);
            count++;
            int pairBytes = utf8Length(key) + utf8Length(value);
            if (count > maxPairs || byteCount + pairBytes > maxBytes) {
                break;
            }
            byteCount += pairBytes;
            result.put(key, value);
        }
        return result;
    }

    /**
     * 메타데이터가 한도를 만족하는지 확인합니다. null 값이 있으면 실패입니다.
     */
    public static boolean verifyMetadata(Map<String, String> data,
                                         int maxPerKey, int maxPairs,
                                         int maxPerValue, int maxBytes) {
        if (data == null || data.isEmpty()) {
            return true;
        }
        int count = 0;
        int byteCount = 0;
        for (Map.Entry<String, String> entry : data.entrySet()) {
            if (entry.getValue() == null) {
                return false;
            }
            int valueBytes = utf8Length(entry.getValue());
            if (valueBytes > maxPerValue) {
                return false;
            }
            int keyBytes = utf8Length(entry.getKey());
            if (keyBytes > maxPerKey) {
                return false;
            }
            count++;
            if (byteCount + keyBytes + valueBytes > maxBytes || count > maxPairs) {
                return false;
            }
            byteCount += keyBytes + valueBytes;
        }
        return true;
    }
}
