package net.wizeops.tiercache.utils;

import net.wizeops.tiercache.exceptions.CacheException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CacheUtilTest {

    @Test
    void shouldRestoreSerializedValues() {
        // Given
        List<String> value = new ArrayList<>(List.of("a", "b"));

        // When
        Object restored = CacheUtil.deserialize(CacheUtil.serialize(value));

        // Then
        assertThat(restored).isEqualTo(value);
    }

    @Test
    void shouldRejectNonSerializableValues() {
        assertThatThrownBy(() -> CacheUtil.serialize(new Object()))
                .isInstanceOf(CacheException.class);
    }

    @Test
    void shouldEstimateSizes() {
        assertThat(CacheUtil.estimateObjectSize(new byte[100])).isEqualTo(100);
        assertThat(CacheUtil.estimateObjectSize("abcd")).isEqualTo(32);
        assertThat(CacheUtil.estimateObjectSize(12345L)).isPositive();
    }
}
