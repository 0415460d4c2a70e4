package com.ivamare.messagebus.model;

import com.ivamare.messagebus.exception.InvalidMessageTypeException;
import com.ivamare.messagebus.fixtures.TestMessages.CreateOrder;
import com.ivamare.messagebus.fixtures.TestMessages.OrderCreated;
import com.ivamare.messagebus.fixtures.TestMessages.OrderShipped;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;

import static com.ivamare.messagebus.fixtures.TestMessages.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MessageQueue")
class MessageQueueTest {

    private MessageQueue<Message> queue;

    @BeforeEach
    void setUp() {
        queue = MessageQueue.ofMessages();
    }

    @Nested
    @DisplayName("ordering")
    class OrderingTests {

        @Test
        @DisplayName("should keep messages sorted after each append")
        void shouldKeepMessagesSortedAfterEachAppend() {
            Message third = new OrderCreated("c", at(3));
            Message first = new OrderCreated("a", at(1));
            Message second = new CreateOrder("b", at(2));

            queue.append(third);
            queue.append(first);
            assertThat(queue.snapshot()).containsExactly(first, third);

            queue.append(second);
            assertThat(queue.snapshot()).containsExactly(first, second, third);
        }

        @Test
        @DisplayName("should yield non-decreasing timestamps for any insertion order")
        void shouldYieldNonDecreasingTimestampsForAnyInsertionOrder() {
            List<Message> messages = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                messages.add(new OrderCreated("o-" + i, at(i % 7)));
            }
            Collections.shuffle(messages, new Random(42));

            for (Message message : messages.subList(0, 20)) {
                queue.append(message);
            }
            queue.extend(messages.subList(20, 50));

            Instant previous = Instant.MIN;
            int count = 0;
            for (Message message : queue) {
                assertThat(message.getCreatedAt()).isAfterOrEqualTo(previous);
                previous = message.getCreatedAt();
                count++;
            }
            assertThat(count).isEqualTo(50);
        }

        @Test
        @DisplayName("should break timestamp ties by insertion order")
        void shouldBreakTimestampTiesByInsertionOrder() {
            Message a = new OrderCreated("a", at(5));
            Message b = new OrderShipped("b", at(5));
            Message c = new CreateOrder("c", at(5));
            Message earlier = new OrderCreated("earlier", at(1));

            queue.append(a);
            queue.append(b);
            queue.extend(List.of(earlier, c));

            assertThat(queue.drain()).containsExactly(earlier, a, b, c);
        }

        @Test
        @DisplayName("should sort messages given at construction")
        void shouldSortMessagesGivenAtConstruction() {
            Message late = new OrderCreated("late", at(9));
            Message early = new OrderCreated("early", at(1));

            MessageQueue<Message> constructed = new MessageQueue<>(Message.class, List.of(late, early));

            assertThat(constructed.snapshot()).containsExactly(early, late);
        }

        @Test
        @DisplayName("should allow duplicates")
        void shouldAllowDuplicates() {
            Message message = new OrderCreated("a", at(1));

            queue.append(message);
            queue.append(message);

            assertThat(queue.size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("type checks")
    class TypeCheckTests {

        @Test
        @DisplayName("should reject non-message on append and leave queue unchanged")
        void shouldRejectNonMessageOnAppend() {
            Message existing = new OrderCreated("a", at(1));
            queue.append(existing);

            assertThatThrownBy(() -> queue.append("not a message"))
                .isInstanceOf(InvalidMessageTypeException.class)
                .hasMessageContaining("java.lang.String");

            assertThat(queue.snapshot()).containsExactly(existing);
        }

        @Test
        @DisplayName("should reject null on append")
        void shouldRejectNullOnAppend() {
            assertThatThrownBy(() -> queue.append(null))
                .isInstanceOf(InvalidMessageTypeException.class);
            assertThat(queue.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("should reject null on extend and leave queue unchanged")
        void shouldRejectNullOnExtend() {
            Message existing = new OrderCreated("a", at(1));
            queue.append(existing);

            assertThatThrownBy(() -> queue.extend(null))
                .isInstanceOf(InvalidMessageTypeException.class);

            assertThat(queue.snapshot()).containsExactly(existing);
        }

        @Test
        @DisplayName("should validate every element before extending")
        void shouldValidateEveryElementBeforeExtending() {
            Message existing = new OrderCreated("a", at(1));
            queue.append(existing);

            List<Object> mixed = Arrays.asList(new OrderCreated("b", at(0)), 42, new OrderCreated("c", at(2)));

            assertThatThrownBy(() -> queue.extend(mixed))
                .isInstanceOf(InvalidMessageTypeException.class)
                .satisfies(e -> assertThat(((InvalidMessageTypeException) e).getActualType())
                    .isEqualTo(Integer.class));

            assertThat(queue.snapshot()).containsExactly(existing);
        }

        @Test
        @DisplayName("should reject commands in an event queue")
        void shouldRejectCommandsInEventQueue() {
            MessageQueue<Event> events = MessageQueue.ofEvents();

            assertThatThrownBy(() -> events.append(new CreateOrder("a")))
                .isInstanceOf(InvalidMessageTypeException.class)
                .satisfies(e -> assertThat(((InvalidMessageTypeException) e).getExpectedType())
                    .isEqualTo(Event.class));
        }

        @Test
        @DisplayName("should reject null iterable at construction")
        void shouldRejectNullIterableAtConstruction() {
            assertThatThrownBy(() -> new MessageQueue<>(Message.class, null))
                .isInstanceOf(InvalidMessageTypeException.class);
        }
    }

    @Nested
    @DisplayName("consumption")
    class ConsumptionTests {

        @Test
        @DisplayName("should pop earliest message first")
        void shouldPopEarliestMessageFirst() {
            Message late = new OrderCreated("late", at(2));
            Message early = new OrderCreated("early", at(1));
            queue.extend(List.of(late, early));

            assertThat(queue.popLeft()).isSameAs(early);
            assertThat(queue.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should fail to pop from an empty queue")
        void shouldFailToPopFromEmptyQueue() {
            assertThatThrownBy(() -> queue.popLeft())
                .isInstanceOf(NoSuchElementException.class);
        }

        @Test
        @DisplayName("should drain while iterating")
        void shouldDrainWhileIterating() {
            queue.extend(List.of(new OrderCreated("a", at(1)), new OrderCreated("b", at(2))));

            List<Message> seen = new ArrayList<>();
            queue.forEach(seen::add);

            assertThat(seen).hasSize(2);
            assertThat(queue.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("should pick up messages appended during iteration")
        void shouldPickUpMessagesAppendedDuringIteration() {
            Message first = new OrderCreated("a", at(1));
            Message appended = new OrderCreated("b", at(2));
            queue.append(first);

            List<Message> seen = new ArrayList<>();
            for (Message message : queue) {
                seen.add(message);
                if (message == first) {
                    queue.append(appended);
                }
            }

            assertThat(seen).containsExactly(first, appended);
        }

        @Test
        @DisplayName("should clear without side effects")
        void shouldClearWithoutSideEffects() {
            queue.append(new OrderCreated("a", at(1)));

            queue.clear();

            assertThat(queue.isEmpty()).isTrue();
            assertThat(queue.peek()).isNull();
        }
    }
}
