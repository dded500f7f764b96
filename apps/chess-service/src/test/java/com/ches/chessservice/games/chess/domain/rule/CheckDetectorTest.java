package com.ches.chessservice.games.chess.domain.rule;

import com.ches.chessservice.games.chess.domain.model.Board;
import com.ches.chessservice.games.chess.domain.model.PieceColor;
import com.ches.chessservice.games.chess.domain.model.PieceKind;
import org.junit.jupiter.api.Test;

import static com.ches.chessservice.games.chess.domain.model.PieceColor.DARK;
import static com.ches.chessservice.games.chess.domain.model.PieceColor.LIGHT;
import static com.ches.chessservice.games.chess.domain.model.TestBoards.put;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckDetectorTest {

    @Test
    void rookOnOpenFileGivesCheckUntilBlocked() {
        Board b = Board.empty();
        put(b, PieceKind.KING, DARK, "e8");
        put(b, PieceKind.ROOK, LIGHT, "e1");
        assertTrue(CheckDetector.isInCheck(b, DARK));

        put(b, PieceKind.KNIGHT, DARK, "e4");
        assertFalse(CheckDetector.isInCheck(b, DARK));
    }

    @Test
    void blockerOfEitherColorStopsTheAttack() {
        Board b = Board.empty();
        put(b, PieceKind.KING, DARK, "e8");
        put(b, PieceKind.ROOK, LIGHT, "e1");
        put(b, PieceKind.PAWN, LIGHT, "e4");
        assertFalse(CheckDetector.isInCheck(b, DARK));
    }

    @Test
    void missingKingIsNeverInCheck() {
        Board b = Board.empty();
        put(b, PieceKind.QUEEN, LIGHT, "d1");
        assertFalse(CheckDetector.isInCheck(b, DARK));
        assertFalse(CheckDetector.isInCheck(b, LIGHT));
    }

    @Test
    void standardOpeningHasNoCheck() {
        Board b = Board.standardSetup();
        assertFalse(CheckDetector.isInCheck(b, LIGHT));
        assertFalse(CheckDetector.isInCheck(b, DARK));
    }

    @Test
    void pawnsAttackOnlyDiagonallyForward() {
        Board b = Board.empty();
        put(b, PieceKind.KING, DARK, "e8");
        put(b, PieceKind.PAWN, LIGHT, "e7");
        assertFalse(CheckDetector.isInCheck(b, DARK), "straight ahead is not an attack");

        put(b, PieceKind.PAWN, LIGHT, "d7");
        assertTrue(CheckDetector.isInCheck(b, DARK));
    }

    @Test
    void darkPawnsAttackTowardLowerRanks() {
        Board b = Board.empty();
        put(b, PieceKind.KING, LIGHT, "e1");
        put(b, PieceKind.PAWN, DARK, "d2");
        assertTrue(CheckDetector.isInCheck(b, LIGHT));

        Board behind = Board.empty();
        put(behind, PieceKind.KING, LIGHT, "e3");
        put(behind, PieceKind.PAWN, DARK, "d2");
        assertFalse(CheckDetector.isInCheck(behind, LIGHT), "a pawn does not attack backwards");
    }

    @Test
    void knightJumpsOverPieces() {
        Board b = Board.empty();
        put(b, PieceKind.KING, LIGHT, "e1");
        put(b, PieceKind.PAWN, LIGHT, "e2");
        put(b, PieceKind.PAWN, LIGHT, "f2");
        put(b, PieceKind.KNIGHT, DARK, "f3");
        assertTrue(CheckDetector.isInCheck(b, LIGHT));
    }

    @Test
    void bishopAttackNeedsClearDiagonal() {
        Board b = Board.empty();
        put(b, PieceKind.KING, DARK, "e8");
        put(b, PieceKind.BISHOP, LIGHT, "a4");
        assertTrue(CheckDetector.isInCheck(b, DARK));

        put(b, PieceKind.PAWN, DARK, "d7");
        assertFalse(CheckDetector.isInCheck(b, DARK));
    }

    @Test
    void queenAttacksAlongLinesAndDiagonals() {
        Board diag = Board.empty();
        put(diag, PieceKind.KING, LIGHT, "a1");
        put(diag, PieceKind.QUEEN, DARK, "h8");
        assertTrue(CheckDetector.isInCheck(diag, LIGHT));

        Board rank = Board.empty();
        put(rank, PieceKind.KING, LIGHT, "a1");
        put(rank, PieceKind.QUEEN, DARK, "h1");
        assertTrue(CheckDetector.isInCheck(rank, LIGHT));

        Board offLine = Board.empty();
        put(offLine, PieceKind.KING, LIGHT, "a1");
        put(offLine, PieceKind.QUEEN, DARK, "b3");
        assertFalse(CheckDetector.isInCheck(offLine, LIGHT));
    }

    @Test
    void adjacentKingsAttackEachOther() {
        Board b = Board.empty();
        put(b, PieceKind.KING, LIGHT, "e4");
        put(b, PieceKind.KING, DARK, "f5");
        assertTrue(CheckDetector.isInCheck(b, LIGHT));
        assertTrue(CheckDetector.isInCheck(b, DARK));
    }

    @Test
    void ownPiecesNeverGiveCheck() {
        Board b = Board.empty();
        put(b, PieceKind.KING, PieceColor.LIGHT, "e1");
        put(b, PieceKind.ROOK, PieceColor.LIGHT, "e8");
        assertFalse(CheckDetector.isInCheck(b, LIGHT));
    }
}
