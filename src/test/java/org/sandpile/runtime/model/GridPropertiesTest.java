package org.sandpile.runtime.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class GridPropertiesTest {

    @Test
    void testNeighbors_Interior() {
        GridProperties props = new GridProperties(3);

        assertEquals(java.util.List.of(new Cell(0, 1), new Cell(1, 0), new Cell(1, 2), new Cell(2, 1)), props.neighbors(1, 1));
    }

    @Test
    void testNeighbors_CornerAndEdge() {
        GridProperties props = new GridProperties(3);

        assertEquals(java.util.List.of(new Cell(0, 1), new Cell(1, 0)), props.neighbors(0, 0));
        assertEquals(java.util.List.of(new Cell(1, 2), new Cell(2, 1)), props.neighbors(2, 2));
        assertEquals(3, props.neighbors(0, 1).size());
    }

    @Test
    void testNeighbors_SingleCellHasNone() {
        assertTrue(new GridProperties(1).neighbors(0, 0).isEmpty());
    }

    @Test
    void testNeighbors_Unmodifiable() {
        GridProperties props = new GridProperties(3);

        assertThrows(UnsupportedOperationException.class, () -> props.neighbors(1, 1).add(new Cell(0, 0)));
    }

    @Test
    void testFlatIndexRoundTrip() {
        GridProperties props = new GridProperties(5);

        assertEquals(0, props.toFlatIndex(0, 0));
        assertEquals(7, props.toFlatIndex(1, 2));
        assertEquals(24, props.toFlatIndex(4, 4));
        assertEquals(new Cell(1, 2), props.flatIndexToCell(7));
    }

    @Test
    void testFlatIndex_OutOfRangeThrows() {
        GridProperties props = new GridProperties(5);

        assertThrows(IndexOutOfBoundsException.class, () -> props.toFlatIndex(5, 0));
        IllegalArgumentException negative = assertThrows(IllegalArgumentException.class, () -> props.flatIndexToCell(-1));
        assertTrue(negative.getMessage().contains("non-negative"));
        assertThrows(IllegalArgumentException.class, () -> props.flatIndexToCell(25));
    }

    @Test
    void testInvalidSizeThrows() {
        assertThrows(IllegalArgumentException.class, () -> new GridProperties(0));
    }

    @Test
    void testJsonSerialization() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        GridProperties props = new GridProperties(30);

        String json = mapper.writeValueAsString(props);

        assertEquals(30, mapper.readTree(json).get("gridSize").asInt());
        assertEquals(4, mapper.readTree(json).get("toppleThreshold").asInt());
        assertFalse(mapper.readTree(json).has("cellCount"));
        assertEquals(props, mapper.readValue(json, GridProperties.class));
    }
}
