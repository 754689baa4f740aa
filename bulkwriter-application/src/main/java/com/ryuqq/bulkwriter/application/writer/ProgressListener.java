package com.ryuqq.bulkwriter.application.writer;

/**
 * 청크 완료 알림. 진단 로깅 용도이며 결과의 정확성과는 무관합니다.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (completed, total) -> { };

    /**
     * @param completedChunks 지금까지 완료된 청크 수
     * @param totalChunks 전체 청크 수
     */
    void onChunkCompleted(int completedChunks, int totalChunks);
}
