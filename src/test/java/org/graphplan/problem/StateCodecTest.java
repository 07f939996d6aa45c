package org.graphplan.problem;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StateCodecTest {

    private static final List<String> MAP = List.of("P", "Q", "R");

    @Test
    void decode_splitsFluentsByPosition() {
        FluentState state = StateCodec.decode("TFT", MAP);

        assertEquals(List.of("P", "R"), state.getPos());
        assertEquals(List.of("Q"), state.getNeg());
    }

    @Test
    void decode_isCaseInsensitive() {
        FluentState state = StateCodec.decode("tfF", MAP);

        assertEquals(List.of("P"), state.getPos());
        assertEquals(List.of("Q", "R"), state.getNeg());
    }

    @Test
    void decode_lengthMismatch_isError() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> StateCodec.decode("TF", MAP));
        assertTrue(e.getMessage().contains("Lunghezza"), e.getMessage());
    }

    @Test
    void decode_invalidCharacter_isError() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> StateCodec.decode("TXF", MAP));
        assertTrue(e.getMessage().contains("posizione 1"), e.getMessage());
    }

    @Test
    void toLiterals_positivesFirst() {
        List<Literal> literals = StateCodec.decode("FTF", MAP).toLiterals();

        assertEquals(List.of(Literal.positive("Q"), Literal.negative("P"), Literal.negative("R")), literals);
    }

    @Test
    void encode_marksMissingFluentsFalse() {
        FluentState state = new FluentState(List.of("R"), List.of());

        assertEquals("FFT", StateCodec.encode(state, MAP));
    }
}
