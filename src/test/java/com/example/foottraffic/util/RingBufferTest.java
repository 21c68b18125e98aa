package com.example.foottraffic.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RingBufferTest {

    @Test
    void evictsOldestWhenFull() {
        RingBuffer<Integer> buffer = new RingBuffer<>(3);
        for (int i = 1; i <= 5; i++) {
            buffer.add(i);
        }

        assertThat(buffer.size()).isEqualTo(3);
        assertThat(buffer.toList()).containsExactly(3, 4, 5);
        assertThat(buffer.last()).isEqualTo(5);
        assertThat(buffer.fromEnd(2)).isEqualTo(4);
    }

    @Test
    void clearEmptiesBuffer() {
        RingBuffer<String> buffer = new RingBuffer<>(2);
        buffer.add("a");
        buffer.add("b");
        buffer.clear();

        assertThat(buffer.isEmpty()).isTrue();
        buffer.add("c");
        assertThat(buffer.toList()).containsExactly("c");
    }

    @Test
    void rejectsInvalidCapacityAndIndex() {
        assertThatThrownBy(() -> new RingBuffer<>(0)).isInstanceOf(IllegalArgumentException.class);

        RingBuffer<Integer> buffer = new RingBuffer<>(2);
        buffer.add(1);
        assertThatThrownBy(() -> buffer.get(1)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
