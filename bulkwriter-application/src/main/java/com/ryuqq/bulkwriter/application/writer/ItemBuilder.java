package com.ryuqq.bulkwriter.application.writer;

import com.ryuqq.bulkwriter.core.model.Identity;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * get-or-create에서 없는 식별자에 대한 쓰기 항목을 만드는 호출자 함수.
 *
 * @param <T> 쓰기 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ItemBuilder<T> {

    /**
     * @param missing 원격에 없는 식별자
     * @return 생성할 항목
     */
    CompletionStage<List<T>> build(List<Identity> missing);

    /**
     * 동기 함수를 ItemBuilder로 감쌉니다. 함수가 던진 예외는 실패한 CompletionStage가 됩니다.
     */
    static <T> ItemBuilder<T> sync(Function<List<Identity>, List<T>> builder) {
        if (builder == null) {
            throw new IllegalArgumentException("builder cannot be null");
        }
        return missing -> {
            try {
                return CompletableFuture.completedFuture(builder.apply(missing));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }
}
