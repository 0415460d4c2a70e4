package com.ivamare.messagebus.repository;

import com.ivamare.messagebus.fixtures.Order;
import com.ivamare.messagebus.fixtures.TestMessages.OrderCreated;
import com.ivamare.messagebus.fixtures.TestMessages.OrderShipped;
import com.ivamare.messagebus.model.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.ivamare.messagebus.fixtures.TestMessages.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("TrackingRepository")
class TrackingRepositoryTest {

    private InMemoryRepository<Order, String> store;
    private TrackingRepository<Order, String> repository;

    @BeforeEach
    void setUp() {
        store = new InMemoryRepository<>(Order::getId);
        repository = new TrackingRepository<>(store);
    }

    @Nested
    @DisplayName("tracking")
    class TrackingTests {

        @Test
        @DisplayName("should track objects passing through every operation")
        void shouldTrackObjectsPassingThroughEveryOperation() {
            Order added = new Order("o-1");
            Order stored = new Order("o-2");
            store.add(stored);

            repository.add(added);
            repository.get("o-2");
            repository.list();

            assertThat(repository.seen()).containsExactlyInAnyOrder(added, stored);
        }

        @Test
        @DisplayName("should not track a missing fetch")
        void shouldNotTrackMissingFetch() {
            repository.get("missing");

            assertThat(repository.seen()).isEmpty();
        }

        @Test
        @DisplayName("should not track when the underlying operation fails")
        @SuppressWarnings("unchecked")
        void shouldNotTrackWhenUnderlyingOperationFails() {
            Repository<Order, String> failing = mock(Repository.class);
            doThrow(new IllegalStateException("down")).when(failing).add(any());
            TrackingRepository<Order, String> tracking = new TrackingRepository<>(failing);

            assertThatThrownBy(() -> tracking.add(new Order("o-1")))
                .isInstanceOf(IllegalStateException.class);
            assertThat(tracking.seen()).isEmpty();
        }

        @Test
        @DisplayName("should track removed objects")
        void shouldTrackRemovedObjects() {
            Order order = new Order("o-1");
            store.add(order);

            repository.remove(order);

            assertThat(repository.seen()).containsExactly(order);
            assertThat(store.size()).isZero();
        }

        @Test
        @DisplayName("should delegate commit and rollback")
        @SuppressWarnings("unchecked")
        void shouldDelegateCommitAndRollback() {
            Repository<Order, String> delegate = mock(Repository.class);
            TrackingRepository<Order, String> tracking = new TrackingRepository<>(delegate);

            tracking.commit();
            tracking.rollback();

            verify(delegate).commit();
            verify(delegate).rollback();
        }
    }

    @Nested
    @DisplayName("event collection")
    class EventCollectionTests {

        @Test
        @DisplayName("should merge events of three seen objects in time order and empty them")
        void shouldMergeEventsOfSeenObjectsInTimeOrder() {
            Order first = Order.create("o-1", at(1));
            first.raise(new OrderShipped("o-1", at(4)));
            Order second = Order.create("o-2", at(3));
            Order third = Order.create("o-3", at(2));
            repository.add(first);
            repository.add(second);
            repository.add(third);

            List<Event> collected = new ArrayList<>();
            repository.collectEvents().forEachRemaining(collected::add);

            assertThat(collected).extracting(Event::getCreatedAt)
                .containsExactly(at(1), at(2), at(3), at(4));
            assertThat(first.events().isEmpty()).isTrue();
            assertThat(second.events().isEmpty()).isTrue();
            assertThat(third.events().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("should include events buffered on the repository itself")
        void shouldIncludeEventsBufferedOnRepository() {
            Order order = Order.create("o-1", at(2));
            repository.add(order);
            Event local = new OrderCreated("local", at(1));
            repository.events().append(local);

            List<Event> collected = new ArrayList<>();
            repository.collectEvents().forEachRemaining(collected::add);

            assertThat(collected).hasSize(2);
            assertThat(collected.get(0)).isSameAs(local);
            assertThat(repository.events().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("should yield nothing on a second collection")
        void shouldYieldNothingOnSecondCollection() {
            repository.add(Order.create("o-1"));
            repository.collectEvents().forEachRemaining(event -> { });

            assertThat(repository.collectEvents().hasNext()).isFalse();
        }
    }
}
