package chronokms.core.model.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Page")
class PageTest {

    private static final List<String> ITEMS = List.of("a", "b", "c");

    @Test
    @DisplayName("should return the remainder when limit plus offset exceeds the int range")
    void shouldClampHugeLimit() {
        Page<String> page = Page.of(ITEMS, Integer.MAX_VALUE, 1);

        assertEquals(List.of("b", "c"), page.items());
        assertEquals(3, page.total());
    }

    @Test
    @DisplayName("should return an empty page for an offset beyond the end")
    void shouldReturnEmptyPastEnd() {
        Page<String> page = Page.of(ITEMS, 10, 5);

        assertTrue(page.items().isEmpty());
        assertEquals(3, page.total());
    }

    @Test
    @DisplayName("should return an empty page for a zero or negative limit")
    void shouldReturnEmptyForNonPositiveLimit() {
        assertTrue(Page.of(ITEMS, 0, 0).items().isEmpty());
        assertTrue(Page.of(ITEMS, -1, 0).items().isEmpty());
    }

    @Test
    @DisplayName("should treat a negative offset as zero")
    void shouldClampNegativeOffset() {
        assertEquals(List.of("a", "b"), Page.of(ITEMS, 2, -3).items());
    }
}
