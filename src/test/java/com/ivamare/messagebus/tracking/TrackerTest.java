package com.ivamare.messagebus.tracking;

import com.ivamare.messagebus.fixtures.Order;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("Tracker")
class TrackerTest {

    private Tracker<Object> tracker;

    @BeforeEach
    void setUp() {
        tracker = new Tracker<>();
    }

    @Test
    @DisplayName("should start with an empty seen set")
    void shouldStartWithEmptySeenSet() {
        assertThat(tracker.seen()).isEmpty();
    }

    @Test
    @DisplayName("should record added, fetched, listed and removed objects once each")
    void shouldRecordObjectsOnceEach() {
        Order added = new Order("a");
        Order fetched = new Order("b");
        Order listed = new Order("c");
        Order removed = new Order("d");

        tracker.onAdd(added);
        tracker.onFetch(fetched);
        tracker.onList(List.of(listed, added));
        tracker.onRemove(removed);

        assertThat(tracker.seen()).containsExactly(added, fetched, listed, removed);
    }

    @Test
    @DisplayName("should ignore absent fetch and list results")
    void shouldIgnoreAbsentResults() {
        tracker.onFetch(null);
        tracker.onList(null);

        assertThat(tracker.seen()).isEmpty();
    }

    @Test
    @DisplayName("should skip objects that cannot be hashed")
    void shouldSkipObjectsThatCannotBeHashed() {
        Order kept = new Order("kept");
        Object unhashable = new Object() {
            @Override
            public int hashCode() {
                throw new UnsupportedOperationException("unhashable");
            }
        };

        assertThatCode(() -> tracker.onList(Arrays.asList(unhashable, kept))).doesNotThrowAnyException();
        assertThat(tracker.seen()).containsExactly(kept);
    }
}
