package com.ryuqq.bulkwriter.adapter.runner;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * 입력을 청크로 나누는 유틸리티.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public final class Chunking {

    private Chunking() {
    }

    /**
     * 고정 크기 청크로 분할. 마지막 청크는 더 작을 수 있습니다.
     *
     * <p>청크 수는 ceil(size / maxSize)이며 청크를 순서대로 이어붙이면 입력과 같습니다.</p>
     *
     * @param input 입력
     * @param maxSize 청크 최대 크기 (1 이상)
     * @return 청크 목록 (입력이 비어있으면 빈 목록)
     */
    public static <T> List<List<T>> chunkBy(List<T> input, int maxSize) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive (current: " + maxSize + ")");
        }
        List<List<T>> chunks = new ArrayList<>((input.size() + maxSize - 1) / maxSize);
        for (int from = 0; from < input.size(); from += maxSize) {
            chunks.add(List.copyOf(input.subList(from, Math.min(from + maxSize, input.size()))));
        }
        return chunks;
    }

    /**
     * 트리 구조 입력을 부모가 자식보다 먼저 오도록 레벨 단위로 분할.
     *
     * <p>부모가 없거나 부모가 입력에 없는 항목이 첫 레벨이고, 그 자식이 다음 레벨입니다.
     * 인접한 레벨은 합쳐도 maxSize를 넘지 않는 한 하나의 청크로 합칩니다.
     * 한 레벨이 maxSize보다 크면 그 레벨은 나누지 않고 하나의 청크가 됩니다.</p>
     *
     * @param input 입력
     * @param maxSize 청크 최대 크기 (1 이하이면 레벨을 합치지 않음)
     * @param idSelector 항목 → ID
     * @param parentIdSelector 항목 → 부모 ID (루트면 null)
     * @return 레벨 순서의 청크 목록
     * @throws IllegalStateException 입력이 트리가 아닌 경우 (ID 중복 등)
     */
    public static <T, K> List<List<T>> chunkByHierarchy(List<T> input, int maxSize,
                                                        Function<T, K> idSelector,
                                                        Function<T, K> parentIdSelector) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        if (idSelector == null) {
            throw new IllegalArgumentException("idSelector cannot be null");
        }
        if (parentIdSelector == null) {
            throw new IllegalArgumentException("parentIdSelector cannot be null");
        }
        if (input.isEmpty()) {
            return List.of();
        }

        Set<K> nodeSet = new LinkedHashSet<>();
        for (T item : input) {
            nodeSet.add(idSelector.apply(item));
        }

        List<T> layer = new ArrayList<>();
        Map<K, List<T>> children = new HashMap<>();
        for (T item : input) {
            K parentId = parentIdSelector.apply(item);
            if (parentId == null || !nodeSet.contains(parentId)) {
                layer.add(item);
                continue;
            }
            children.computeIfAbsent(parentId, k -> new ArrayList<>()).add(item);
        }

        List<List<T>> levels = new ArrayList<>();
        while (!layer.isEmpty()) {
            levels.add(layer);
            List<T> nextLayer = new ArrayList<>();
            for (T item : layer) {
                K id = idSelector.apply(item);
                if (!nodeSet.remove(id)) {
                    throw new IllegalStateException("Input is not a tree");
                }
                nextLayer.addAll(children.getOrDefault(id, List.of()));
            }
            layer = nextLayer;
        }
        return conservativeMerge(levels, maxSize);
    }

    /**
     * 순서를 유지하면서 인접 청크를 maxSize 이내로 합칩니다. 청크 자체는 나누지 않습니다.
     */
    static <T> List<List<T>> conservativeMerge(List<List<T>> input, int maxSize) {
        if (maxSize <= 1) {
            return input.stream().map(List::copyOf).toList();
        }
        List<List<T>> merged = new ArrayList<>();
        List<T> current = new ArrayList<>();
        for (List<T> chunk : input) {
            Objects.requireNonNull(chunk, "chunk");
            if (current.size() + chunk.size() <= maxSize) {
                current.addAll(chunk);
            } else if (current.isEmpty()) {
                merged.add(List.copyOf(chunk));
            } else {
                merged.add(List.copyOf(current));
                current = new ArrayList<>(chunk);
            }
        }
        if (!current.isEmpty()) {
            merged.add(List.copyOf(current));
        }
        return merged;
    }
}
