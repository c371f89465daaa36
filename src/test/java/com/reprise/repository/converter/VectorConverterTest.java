package com.reprise.repository.converter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VectorConverter.
 */
class VectorConverterTest {

    private final VectorConverter converter = new VectorConverter();

    @Test
    void testToDatabaseColumn() {
        assertEquals("[1.0,2.0,3.0]", converter.convertToDatabaseColumn(new float[]{1f, 2f, 3f}));
        assertEquals("[1.0,2.0,3.0]", VectorConverter.toVectorString(new float[]{1f, 2f, 3f}));
    }

    @Test
    void testToEntityAttribute() {
        assertArrayEquals(new float[]{0.5f, -1f}, converter.convertToEntityAttribute("[0.5,-1]"));
    }

    @Test
    void testNullsPassThrough() {
        assertNull(converter.convertToDatabaseColumn(null));
        assertNull(converter.convertToEntityAttribute(null));
    }
}
