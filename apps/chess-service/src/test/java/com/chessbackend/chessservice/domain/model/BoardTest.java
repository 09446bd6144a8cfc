package com.chessbackend.chessservice.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoardTest {

    @Test
    void standardSetupHasThirtyTwoPiecesInPlace() {
        Board b = new Board();
        b.setupStandard();

        assertEquals(32, b.pieceCount());
        assertEquals(Piece.white(PieceType.KING), b.get(Square.parse("e1")));
        assertEquals(Piece.white(PieceType.QUEEN), b.get(Square.parse("d1")));
        assertEquals(Piece.black(PieceType.KING), b.get(Square.parse("e8")));
        assertEquals(Piece.black(PieceType.QUEEN), b.get(Square.parse("d8")));
        assertEquals(Piece.white(PieceType.KNIGHT), b.get(Square.parse("g1")));
        assertEquals(Piece.black(PieceType.BISHOP), b.get(Square.parse("c8")));
        for (char file = 'a'; file <= 'h'; file++) {
            assertEquals(Piece.white(PieceType.PAWN), b.get(Square.parse(file + "2")));
            assertEquals(Piece.black(PieceType.PAWN), b.get(Square.parse(file + "7")));
            for (char rank = '3'; rank <= '6'; rank++) {
                assertTrue(b.isEmpty(Square.parse("" + file + rank)));
            }
        }
    }

    @Test
    void occupiedListsSquaresFromA8ToH1() {
        Board b = new Board();
        b.setupStandard();

        List<BoardItem> items = b.occupied();
        assertEquals(32, items.size());
        assertEquals(new BoardItem("a8", Piece.black(PieceType.ROOK)), items.get(0));
        assertEquals(new BoardItem("a7", Piece.black(PieceType.PAWN)), items.get(8));
        assertEquals(new BoardItem("h1", Piece.white(PieceType.ROOK)), items.get(31));
    }

    @Test
    void removeReturnsPreviousOccupant() {
        Board b = new Board();
        Square e4 = Square.parse("e4");
        b.put(e4, Piece.white(PieceType.KNIGHT));

        assertEquals(Piece.white(PieceType.KNIGHT), b.remove(e4));
        assertNull(b.get(e4));
        assertEquals(0, b.pieceCount());
    }

    @Test
    void lastRankIsRowZeroOrSeven() {
        assertTrue(Board.isLastRank(0));
        assertTrue(Board.isLastRank(7));
        assertFalse(Board.isLastRank(3));
    }
}
