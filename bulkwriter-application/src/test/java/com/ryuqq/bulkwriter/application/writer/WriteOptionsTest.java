package com.ryuqq.bulkwriter.application.writer;

import com.ryuqq.bulkwriter.core.policy.RetryMode;
import com.ryuqq.bulkwriter.core.policy.SanitationMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WriteOptions 유닛 테스트.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
class WriteOptionsTest {

    @Test
    void 기본값() {
        // when
        WriteOptions options = new WriteOptions();

        // then
        assertThat(options.chunkSize()).isEqualTo(1000);
        assertThat(options.throttleSize()).isEqualTo(4);
        assertThat(options.retryMode()).isEqualTo(RetryMode.ON_ERROR);
        assertThat(options.sanitationMode()).isEqualTo(SanitationMode.CLEAN);
        assertThat(options.progressListener()).isSameAs(ProgressListener.NONE);
        assertThat(options.maxDuplicateRounds()).isEqualTo(8);
        assertThat(options.maxIncompleteStalls()).isEqualTo(3);
    }

    @Test
    void with_메서드는_해당_값만_변경() {
        // when
        WriteOptions options = new WriteOptions()
            .withChunkSize(10)
            .withThrottleSize(2)
            .withRetryMode(RetryMode.ON_FATAL)
            .withSanitationMode(SanitationMode.REMOVE);

        // then
        assertThat(options.chunkSize()).isEqualTo(10);
        assertThat(options.throttleSize()).isEqualTo(2);
        assertThat(options.retryMode()).isEqualTo(RetryMode.ON_FATAL);
        assertThat(options.sanitationMode()).isEqualTo(SanitationMode.REMOVE);
        assertThat(options.maxDuplicateRounds()).isEqualTo(8);
    }

    @Test
    void progressListener가_null이면_NONE() {
        assertThat(new WriteOptions().withProgressListener(null).progressListener()).isSameAs(ProgressListener.NONE);
    }

    @Test
    void 잘못된_값은_거부() {
        assertThatThrownBy(() -> new WriteOptions().withChunkSize(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("chunkSize must be positive (current: 0)");
        assertThatThrownBy(() -> new WriteOptions().withThrottleSize(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("throttleSize");
        assertThatThrownBy(() -> new WriteOptions().withRetryMode(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("retryMode cannot be null");
        assertThatThrownBy(() -> new WriteOptions().withMaxIncompleteStalls(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WriteOptions().withMaxDuplicateRounds(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void retryMode_판단_메서드() {
        assertThat(RetryMode.NONE.cleansBatch()).isFalse();
        assertThat(RetryMode.ON_ERROR.retriesFatal()).isFalse();
        assertThat(RetryMode.ON_FATAL.retriesFatal()).isTrue();
        assertThat(RetryMode.ON_ERROR_KEEP_DUPLICATES.keepsDuplicates()).isTrue();
        assertThat(RetryMode.ON_FATAL_KEEP_DUPLICATES.retriesFatal()).isTrue();
        assertThat(RetryMode.ON_FATAL.keepsDuplicates()).isFalse();
    }
}
