package com.ryuqq.bulkwriter.adapter.runner;

import com.ryuqq.bulkwriter.application.classify.ErrorClassifier;
import com.ryuqq.bulkwriter.application.resource.event.Event;
import com.ryuqq.bulkwriter.application.resource.event.EventResources;
import com.ryuqq.bulkwriter.application.resource.event.EventWrite;
import com.ryuqq.bulkwriter.application.writer.WriteOptions;
import com.ryuqq.bulkwriter.core.cancel.CancellationToken;
import com.ryuqq.bulkwriter.core.error.ClassifiedError;
import com.ryuqq.bulkwriter.core.model.ErrorKind;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.policy.RetryMode;
import com.ryuqq.bulkwriter.core.result.BatchResult;
import com.ryuqq.bulkwriter.core.spi.CreateCapable;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ChunkedRetryOrchestrator 유닛 테스트.
 *
 * <p>원격 리소스는 Mockito로 대체하고 재시도 대기는 0으로 둡니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ChunkedRetryOrchestratorTest {

    @Mock
    private CreateCapable<EventWrite, Event> resource;

    private ChunkedRetryOrchestrator orchestrator;

    private final AtomicLong ids = new AtomicLong(1);

    @BeforeEach
    void setUp() {
        orchestrator = new ChunkedRetryOrchestrator(new ErrorClassifier(), new BackoffCalculator(0, 0));
    }

    private List<Event> echo(InvocationOnMock invocation) {
        List<EventWrite> writes = invocation.getArgument(0);
        List<Event> created = new ArrayList<>();
        for (EventWrite write : writes) {
            created.add(Event.from(ids.getAndIncrement(), write));
        }
        return created;
    }

    private static List<EventWrite> events(String... externalIds) {
        List<EventWrite> events = new ArrayList<>();
        for (String externalId : externalIds) {
            events.add(EventWrite.of(externalId));
        }
        return events;
    }

    // ==================== 정상 흐름 ====================

    @Test
    void 청크_순서대로_결과_병합() {
        // given
        when(resource.create(anyList(), any())).thenAnswer(this::echo);
        WriteOptions options = new WriteOptions().withChunkSize(2).withThrottleSize(1);

        // when
        BatchResult<Event, EventWrite> result = orchestrator.ensureExists(
            events("e1", "e2", "e3", "e4", "e5"), EventResources.binding(), resource, options, CancellationToken.NONE);

        // then
        assertThat(result.isAllGood()).isTrue();
        assertThat(result.results()).extracting(Event::externalId).containsExactly("e1", "e2", "e3", "e4", "e5");
        verify(resource, times(3)).create(anyList(), any());
    }

    @Test
    void 청크마다_진행_상황_보고() {
        // given
        when(resource.create(anyList(), any())).thenAnswer(this::echo);
        List<String> progress = new CopyOnWriteArrayList<>();
        WriteOptions options = new WriteOptions().withChunkSize(1).withThrottleSize(1)
            .withProgressListener((completed, total) -> progress.add(completed + "/" + total));

        // when
        orchestrator.ensureExists(events("a", "b", "c"), EventResources.binding(), resource, options,
            CancellationToken.NONE);

        // then
        assertThat(progress).containsExactly("1/3", "2/3", "3/3");
    }

    @Test
    void 빈_입력은_원격_호출_없음() {
        // when
        BatchResult<Event, EventWrite> result = orchestrator.ensureExists(
            List.of(), EventResources.binding(), resource, new WriteOptions(), CancellationToken.NONE);

        // then
        assertThat(result.results()).isEmpty();
        assertThat(result.errors()).isEmpty();
        verify(resource, never()).create(anyList(), any());
    }

    // ==================== 재시도 모드 ====================

    @Test
    void NONE_모드는_오류_기록_후_중단() {
        // given
        when(resource.create(anyList(), any())).thenThrow(new RemoteFailure(503, "Service Unavailable"));
        WriteOptions options = new WriteOptions().withRetryMode(RetryMode.NONE);

        // when
        BatchResult<Event, EventWrite> result = orchestrator.ensureExists(
            events("e1", "e2"), EventResources.binding(), resource, options, CancellationToken.NONE);

        // then
        assertThat(result.results()).isEmpty();
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.kind()).isEqualTo(ErrorKind.FATAL_FAILURE);
            assertThat(error.status()).isEqualTo(503);
        });
        verify(resource, times(1)).create(anyList(), any());
    }

    @Test
    void ON_FATAL_모드는_치명_오류를_같은_배치로_재시도() {
        // given
        when(resource.create(anyList(), any()))
            .thenThrow(new RemoteFailure(503, "Service Unavailable"))
            .thenThrow(new IllegalStateException("connection reset"))
            .thenAnswer(this::echo);
        WriteOptions options = new WriteOptions().withRetryMode(RetryMode.ON_FATAL);

        // when
        BatchResult<Event, EventWrite> result = orchestrator.ensureExists(
            events("e1", "e2"), EventResources.binding(), resource, options, CancellationToken.NONE);

        // then
        assertThat(result.isAllGood()).isTrue();
        assertThat(result.results()).hasSize(2);
        verify(resource, times(3)).create(anyList(), any());
    }

    @Test
    void ON_ERROR_모드는_중복_항목을_빼고_다시_쓰기() {
        // given
        RemoteFailure duplicated = RemoteFailure.duplicated(409, "Duplicated",
            List.of(Map.of("externalId", "e2")));
        when(resource.create(anyList(), any()))
            .thenThrow(duplicated)
            .thenAnswer(this::echo);

        // when
        BatchResult<Event, EventWrite> result = orchestrator.ensureExists(
            events("e1", "e2", "e3"), EventResources.binding(), resource, new WriteOptions(), CancellationToken.NONE);

        // then
        assertThat(result.results()).extracting(Event::externalId).containsExactly("e1", "e3");
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.kind()).isEqualTo(ErrorKind.ITEM_EXISTS);
            assertThat(error.tag()).isEqualTo(ResourceTag.EXTERNAL_ID);
            assertThat(error.values()).containsExactly(Identity.of("e2"));
            assertThat(error.skipped()).extracting(EventWrite::externalId).containsExactly("e2");
        });
    }

    @Test
    void ON_ERROR_모드에서_치명_오류는_배치_전체를_건너뜀() {
        // given
        when(resource.create(anyList(), any())).thenThrow(new RemoteFailure(500, "Internal Server Error"));

        // when
        BatchResult<Event, EventWrite> result = orchestrator.ensureExists(
            events("e1", "e2"), EventResources.binding(), resource, new WriteOptions(), CancellationToken.NONE);

        // then
        assertThat(result.results()).isEmpty();
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.isFatal()).isTrue();
            assertThat(error.skipped()).hasSize(2);
        });
        assertThatThrownBy(result::throwOnFatal).hasMessageContaining("Internal Server Error");
    }

    // ==================== 인자 검증 ====================

    @Test
    void null_인자는_거부() {
        assertThatThrownBy(() -> new ChunkedRetryOrchestrator(null, new BackoffCalculator()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("classifier cannot be null");
        assertThatThrownBy(() -> orchestrator.ensureExists(null, EventResources.binding(), resource,
            new WriteOptions(), CancellationToken.NONE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("items cannot be null");
        assertThatThrownBy(() -> orchestrator.ensureExists(events("e1"), EventResources.binding(), resource,
            new WriteOptions(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("token cannot be null");
        assertThatThrownBy(() -> orchestrator.ensureExists(events("e1"), null, resource,
            new WriteOptions(), CancellationToken.NONE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("binding cannot be null");
    }

    @Test
    void 분류된_오류는_ClassifiedError로_노출() {
        // given
        when(resource.create(anyList(), any())).thenThrow(new RemoteFailure(503, "busy"));

        // when
        BatchResult<Event, EventWrite> result = orchestrator.ensureExists(events("e1"), EventResources.binding(),
            resource, new WriteOptions().withRetryMode(RetryMode.NONE), CancellationToken.NONE);

        // then
        ClassifiedError<EventWrite> error = result.errors().get(0);
        assertThat(error.cause()).isInstanceOf(RemoteFailure.class);
        assertThat(error.message()).isEqualTo("busy");
    }
}
