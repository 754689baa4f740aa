package com.ryuqq.bulkwriter.core.sanitation;

import com.ryuqq.bulkwriter.core.error.ClassifiedError;
import com.ryuqq.bulkwriter.core.model.ErrorKind;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.policy.SanitationMode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RequestCleaner 테스트.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
class RequestCleanerTest {

    private record Item(String externalId, String name) {
    }

    private static final Sanitizer<Item> NAME_LIMIT = new Sanitizer<>() {
        @Override
        public Item sanitize(Item item) {
            return new Item(item.externalId(), StringLimits.truncate(item.name(), 3));
        }

        @Override
        public ResourceTag verify(Item item) {
            return StringLimits.checkLength(item.name(), 3) ? null : ResourceTag.NAME;
        }
    };

    private final RequestCleaner<Item> cleaner = new RequestCleaner<>(NAME_LIMIT, List.of(
        new DistinctRule<>("Duplicate external ids", ResourceTag.EXTERNAL_ID,
            item -> item.externalId() == null ? null : Identity.of(item.externalId()))
    ));

    @Test
    void clean_NoneMode_ReturnsInputUntouched() {
        // Given
        List<Item> items = List.of(new Item("a", "toolong"), new Item("a", "x"));

        // When
        SanitationResult<Item> result = cleaner.clean(items, SanitationMode.NONE);

        // Then
        assertEquals(items, result.items());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void clean_CleanMode_TruncatesFields() {
        // When
        SanitationResult<Item> result = cleaner.clean(List.of(new Item("a", "toolong")), SanitationMode.CLEAN);

        // Then
        assertEquals(List.of(new Item("a", "too")), result.items());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void clean_RemoveMode_DropsInvalidItemsGroupedByTag() {
        // Given
        Item bad1 = new Item("a", "toolong");
        Item bad2 = new Item("b", "alsolong");
        Item good = new Item("c", "ok");

        // When
        SanitationResult<Item> result = cleaner.clean(List.of(bad1, good, bad2), SanitationMode.REMOVE);

        // Then
        assertEquals(List.of(good), result.items());
        assertEquals(1, result.errors().size());
        ClassifiedError<Item> error = result.errors().get(0);
        assertEquals(ErrorKind.SANITATION_FAILED, error.kind());
        assertEquals(ResourceTag.NAME, error.tag());
        assertEquals(400, error.status());
        assertEquals(List.of(bad1, bad2), error.skipped());
    }

    @Test
    void clean_DuplicatedExternalId_KeepsFirstAndReportsConflict() {
        // Given
        Item first = new Item("dup", "1");
        Item second = new Item("dup", "2");
        Item other = new Item("x", "3");

        // When
        SanitationResult<Item> result = cleaner.clean(List.of(first, other, second), SanitationMode.CLEAN);

        // Then
        assertEquals(List.of(first, other), result.items());
        ClassifiedError<Item> error = result.errors().get(0);
        assertEquals(ErrorKind.ITEM_DUPLICATED, error.kind());
        assertEquals(ResourceTag.EXTERNAL_ID, error.tag());
        assertEquals(409, error.status());
        assertEquals(Set.of(Identity.of("dup")), error.values());
    }

    @Test
    void clean_NullExternalIds_NotTreatedAsDuplicates() {
        // When
        SanitationResult<Item> result = cleaner.clean(List.of(new Item(null, "a"), new Item(null, "b")),
            SanitationMode.CLEAN);

        // Then
        assertEquals(2, result.items().size());
        assertTrue(result.errors().isEmpty());
    }
}
