package com.ches.chessservice.games.chess.domain.model;

import org.junit.jupiter.api.Test;

import static com.ches.chessservice.games.chess.domain.model.TestBoards.put;
import static com.ches.chessservice.games.chess.domain.model.TestBoards.sq;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BoardTest {

    @Test
    void shouldStartEmpty() {
        Board b = Board.empty();
        assertThat(b.pieces()).isEmpty();
        assertThat(b.occupantAt(sq("e4"))).isEmpty();
    }

    @Test
    void shouldLayOutStandardOpening() {
        Board b = Board.standardSetup();
        assertThat(b.pieces()).hasSize(32);
        assertThat(b.get(sq("a1")).is(PieceKind.ROOK, PieceColor.LIGHT)).isTrue();
        assertThat(b.get(sq("b1")).is(PieceKind.KNIGHT, PieceColor.LIGHT)).isTrue();
        assertThat(b.get(sq("c1")).is(PieceKind.BISHOP, PieceColor.LIGHT)).isTrue();
        assertThat(b.get(sq("d1")).is(PieceKind.QUEEN, PieceColor.LIGHT)).isTrue();
        assertThat(b.get(sq("e1")).is(PieceKind.KING, PieceColor.LIGHT)).isTrue();
        assertThat(b.get(sq("e7")).is(PieceKind.PAWN, PieceColor.DARK)).isTrue();
        assertThat(b.get(sq("d8")).is(PieceKind.QUEEN, PieceColor.DARK)).isTrue();
        assertThat(b.get(sq("h8")).is(PieceKind.ROOK, PieceColor.DARK)).isTrue();
        assertThat(b.pieces()).allMatch(p -> p.isNotMoved() && !p.isEnPassantTarget());
        for (int f = 0; f < Board.SIZE; f++) {
            for (int r = 2; r <= 5; r++) {
                assertThat(b.get(f, r)).isNull();
            }
        }
    }

    @Test
    void snapshotShouldShareNoMutableState() {
        Board original = Board.standardSetup();
        Board copy = original.snapshot();
        assertThat(copy).isEqualTo(original);

        Piece pawn = copy.get(sq("e2"));
        pawn.setEnPassantTarget(true);
        copy.relocate(pawn, sq("e4"));

        assertThat(original.get(sq("e2"))).isNotNull();
        assertThat(original.get(sq("e2")).isEnPassantTarget()).isFalse();
        assertThat(original.get(sq("e4"))).isNull();
        assertThat(copy).isNotEqualTo(original);
    }

    @Test
    void occupantAtShouldNotFailOffBoard() {
        Board b = Board.standardSetup();
        assertThat(b.occupantAt(Coordinate.of(8, 0))).isEmpty();
        assertThat(b.occupantAt(Coordinate.of(-1, 3))).isEmpty();
    }

    @Test
    void shouldRefuseSecondPieceOnSquare() {
        Board b = Board.empty();
        put(b, PieceKind.KING, PieceColor.LIGHT, "e1");
        assertThrows(IllegalStateException.class, () -> put(b, PieceKind.QUEEN, PieceColor.DARK, "e1"));
    }

    @Test
    void pathClearShouldLookOnlyStrictlyBetween() {
        Board b = Board.empty();
        put(b, PieceKind.ROOK, PieceColor.LIGHT, "a1");
        put(b, PieceKind.ROOK, PieceColor.DARK, "a8");
        assertThat(b.isPathClear(sq("a1"), sq("a8"))).isTrue();

        put(b, PieceKind.PAWN, PieceColor.LIGHT, "a4");
        assertThat(b.isPathClear(sq("a1"), sq("a8"))).isFalse();
        assertThat(b.isPathClear(sq("a1"), sq("a4"))).isTrue();
    }

    @Test
    void shouldFindKingOrNothing() {
        Board b = Board.empty();
        assertThat(b.findKing(PieceColor.DARK)).isEmpty();
        Piece k = put(b, PieceKind.KING, PieceColor.DARK, "e8");
        assertThat(b.findKing(PieceColor.DARK)).containsSame(k);
    }

    @Test
    void toStringShouldDrawLightInUpperCase() {
        String[] rows = Board.standardSetup().toString().split("\n");
        assertThat(rows[0]).isEqualTo("rnbqkbnr");
        assertThat(rows[7]).isEqualTo("RNBQKBNR");
        assertThat(rows[3]).isEqualTo("........");
    }
}
