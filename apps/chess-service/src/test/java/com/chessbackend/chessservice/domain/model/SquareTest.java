package com.chessbackend.chessservice.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SquareTest {

    @Test
    void shouldParseAlgebraicToRowAndColumn() {
        assertEquals(Square.of(6, 4), Square.parse("e2"));
        assertEquals(Square.of(0, 0), Square.parse("a8"));
        assertEquals(Square.of(7, 7), Square.parse("h1"));
        assertEquals(Square.of(4, 3), Square.parse("d4"));
    }

    @Test
    void shouldIgnoreFileCase() {
        assertEquals(Square.parse("e2"), Square.parse("E2"));
    }

    @Test
    void shouldRejectMalformedSquares() {
        for (String bad : new String[]{"", "e", "e22", "i1", "a0", "a9", "2e", "ee", " e2", "e 2"}) {
            assertEquals(Optional.empty(), Square.tryParse(bad), bad);
        }
        assertEquals(Optional.empty(), Square.tryParse(null));
        assertThrows(IllegalArgumentException.class, () -> Square.parse("z9"));
    }

    @Test
    void shouldFormatLowercaseAlgebraic() {
        assertEquals("e2", Square.of(6, 4).toAlgebraic());
        assertEquals("a8", Square.of(0, 0).toAlgebraic());
        assertEquals("h1", Square.of(7, 7).toString());
    }

    @Test
    void shouldRejectIndicesOffTheBoard() {
        assertThrows(IndexOutOfBoundsException.class, () -> Square.of(8, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> Square.of(0, -1));
    }

    @Test
    void roundTripIsStableForEverySquare() {
        int seen = 0;
        for (char file = 'a'; file <= 'h'; file++) {
            for (char rank = '1'; rank <= '8'; rank++) {
                String text = "" + file + rank;
                Square sq = Square.parse(text);
                assertEquals(text, sq.toAlgebraic());
                assertEquals(sq, Square.parse(sq.toAlgebraic()));
                seen++;
            }
        }
        assertEquals(64, seen);
    }
}
