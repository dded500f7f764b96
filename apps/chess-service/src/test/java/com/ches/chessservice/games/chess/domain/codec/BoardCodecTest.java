package com.ches.chessservice.games.chess.domain.codec;

import com.ches.chessservice.games.chess.domain.model.Board;
import com.ches.chessservice.games.chess.domain.model.Piece;
import com.ches.chessservice.games.chess.domain.model.PieceColor;
import com.ches.chessservice.games.chess.domain.model.PieceKind;
import com.ches.chessservice.games.chess.domain.rule.MoveApplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.ches.chessservice.games.chess.domain.model.TestBoards.sq;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BoardCodecTest {

    @Test
    void shouldEncodeFileMajorWithSixCharRecords() {
        String enc = BoardCodec.encode(Board.standardSetup());
        assertEquals(32 * BoardCodec.RECORD_LENGTH, enc.length());
        // a 列：a1 车、a2 兵、a7 兵、a8 车
        assertThat(enc).startsWith("r0a101p0a201p1a701r1a801n0b101");
        assertThat(enc).endsWith("r1h801");
    }

    @Test
    void shouldEncodeEmptyBoardAsEmptyString() {
        assertEquals("", BoardCodec.encode(Board.empty()));
        assertThat(BoardCodec.decode("").pieces()).isEmpty();
    }

    @Test
    void shouldRoundTripFlagsAfterMoves() {
        Board b = Board.standardSetup();
        MoveApplier.apply(b, b.get(sq("g1")), sq("f3"));
        MoveApplier.apply(b, b.get(sq("d7")), sq("d5"));

        String enc = BoardCodec.encode(b);
        Board back = BoardCodec.decode(enc);

        assertEquals(b, back);
        Piece pawn = back.get(sq("d5"));
        assertThat(pawn.isEnPassantTarget()).isTrue();
        assertThat(pawn.isNotMoved()).isFalse();
        assertThat(back.get(sq("f3")).isNotMoved()).isFalse();
        assertThat(enc).contains("p1d510").contains("n0f300");
    }

    @Test
    void decodeShouldNotDependOnRecordOrder() {
        Board b = Board.standardSetup();
        String enc = BoardCodec.encode(b);
        List<String> records = new ArrayList<>();
        for (int i = 0; i < enc.length(); i += BoardCodec.RECORD_LENGTH) {
            records.add(enc.substring(i, i + BoardCodec.RECORD_LENGTH));
        }
        Collections.reverse(records);

        assertEquals(b, BoardCodec.decode(String.join("", records)));
    }

    @Test
    void shouldRejectLengthNotMultipleOfSix() {
        BoardDecodeException e = assertThrows(BoardDecodeException.class, () -> BoardCodec.decode("r0a1011"));
        assertEquals(-1, e.getRecordIndex());
        assertThat(e.getMessage()).startsWith("BAD_LENGTH");
    }

    @ParameterizedTest
    @CsvSource({
            "x0a101, BAD_KIND",
            "R0a101, BAD_KIND",
            "r2a101, BAD_COLOR",
            "r0i101, BAD_FILE",
            "r0a901, BAD_RANK",
            "r0a021, BAD_RANK",
            "r0a121, BAD_ENPASSANT",
            "r0a10x, BAD_NOTMOVED"
    })
    void shouldRejectUnknownFieldValues(String record, String expected) {
        BoardDecodeException e = assertThrows(BoardDecodeException.class, () -> BoardCodec.decode(record));
        assertThat(e.getMessage()).startsWith(expected);
        assertEquals(0, e.getRecordIndex());
    }

    @Test
    void shouldRejectTwoPiecesOnOneSquare() {
        BoardDecodeException e = assertThrows(BoardDecodeException.class,
                () -> BoardCodec.decode("k0e101q1e101"));
        assertEquals(1, e.getRecordIndex());
    }

    @Test
    void tryDecodeShouldReportInsteadOfThrowing() {
        DecodeResult bad = BoardCodec.tryDecode("z0a101");
        assertThat(bad.ok()).isFalse();
        assertThat(bad.error()).contains("BAD_KIND");

        DecodeResult good = BoardCodec.tryDecode("k1e801");
        assertThat(good.ok()).isTrue();
        assertThat(good.board().get(sq("e8")).is(PieceKind.KING, PieceColor.DARK)).isTrue();
    }
}
