package com.ryuqq.bulkwriter.application.resource.instance;

import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.sanitation.StringLimits;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InstanceSanitizer 유닛 테스트.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
class InstanceSanitizerTest {

    private final InstanceSanitizer sanitizer = new InstanceSanitizer();

    @Test
    void externalId는_UTF8_바이트_기준으로_자름() {
        // given: 3 bytes per character
        InstanceWrite instance = InstanceWrite.of("sp", "가".repeat(100), Map.of());

        // when
        InstanceWrite sanitized = sanitizer.sanitize(instance);

        // then
        assertThat(sanitized.externalId().getBytes(StandardCharsets.UTF_8).length)
            .isLessThanOrEqualTo(StringLimits.EXTERNAL_ID_MAX);
        assertThat(sanitized.externalId()).isEqualTo("가".repeat(85));
    }

    @Test
    void space를_한도까지_자름() {
        assertThat(sanitizer.sanitize(InstanceWrite.of("s".repeat(50), "n", Map.of())).space())
            .hasSize(InstanceSanitizer.SPACE_MAX);
    }

    @Test
    void verify() {
        assertThat(sanitizer.verify(InstanceWrite.of("sp", "n", Map.of()))).isNull();
        assertThat(sanitizer.verify(InstanceWrite.of(null, "n", Map.of()))).isEqualTo(ResourceTag.SPACE_ID);
        assertThat(sanitizer.verify(InstanceWrite.of("sp", "x".repeat(256), Map.of())))
            .isEqualTo(ResourceTag.EXTERNAL_ID);
        assertThat(sanitizer.verify(InstanceWrite.of("sp", "가".repeat(100), Map.of())))
            .isEqualTo(ResourceTag.INSTANCE_ID);
    }
}
