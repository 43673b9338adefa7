package io.github.yok.lvmlink.parser;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.lvmlink.model.FileHeader;
import io.github.yok.lvmlink.model.Segment;
import io.github.yok.lvmlink.model.SegmentHeader;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SegmentDataReaderTest {

    private final SegmentDataReader reader = new SegmentDataReader();

    private static LineCursor lines(String... lines) {
        return LineCursor.fromText(String.join("\n", lines) + "\n");
    }

    private static FileHeader fileHeader(String xColumns, String decimalSeparator) {
        Map<String, Object> values = HeaderSchema.defaults(HeaderSchema.FILE_HEADERS);
        values.put("Separator", "\t");
        values.put("Decimal_Separator", decimalSeparator);
        values.put("X_Columns", xColumns);
        values.put("Writer_Version", 2.0d);
        values.put("Reader_Version", 2.0d);
        values.put("Date", LocalDate.of(2013, 2, 13));
        values.put("Time", LocalTime.of(9, 51, 40));
        return new FileHeader(values);
    }

    private static SegmentHeader segmentHeader(int channels, Object samples, Object x0,
            Object deltaX) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("Channels", channels);
        values.put("Samples", samples);
        values.put("Date", LocalDate.of(2013, 2, 13));
        values.put("Time", LocalTime.of(9, 51, 40));
        values.put("X0", x0);
        values.put("Delta_X", deltaX);
        List<String> labels = new ArrayList<>();
        for (int ch = 0; ch < channels; ch++) {
            labels.add("Ch" + ch);
        }
        List<String> columns = new ArrayList<>();
        columns.add("X_Value");
        columns.addAll(labels);
        columns.add("Comment");
        return new SegmentHeader(values, columns, labels);
    }

    @Test
    void read_正常ケース_X列が1つ_共有X列とY列が読まれること() throws Exception {
        LineCursor cursor = lines("0\t1.0", "1\t2.0", "2\t3.0");

        Segment segment = reader.read(cursor, fileHeader("One", "."),
                segmentHeader(1, 3, 0L, 1L), null).get();

        assertArrayEquals(new double[] {0, 1, 2}, segment.getChannels().get(0).getX());
        assertArrayEquals(new double[] {1, 2, 3}, segment.getChannels().get(0).getY());
        assertEquals(List.of("", "", ""), segment.getComments());
        assertEquals(3, segment.getRowCount());
        assertFalse(cursor.hasNext());
    }

    @Test
    void read_正常ケース_X列なし_X0とDelta_XからXが計算されること() throws Exception {
        Segment segment = reader.read(lines("\t1", "\t2", "\t3"), fileHeader("No", "."),
                segmentHeader(1, 3, 10L, 5L), null).get();

        assertArrayEquals(new double[] {10, 15, 20}, segment.getChannels().get(0).getX());
        assertArrayEquals(new double[] {1, 2, 3}, segment.getChannels().get(0).getY());
    }

    @Test
    void read_正常ケース_X列なしで開始値を上書きする_上書き値から計算されること() throws Exception {
        Segment segment = reader.read(lines("\t4", "\t5"), fileHeader("No", "."),
                segmentHeader(1, 2, 0L, 0.5d), new double[] {100d}).get();

        assertArrayEquals(new double[] {100, 100.5}, segment.getChannels().get(0).getX());
    }

    @Test
    void read_正常ケース_開始値の上書きがチャネル数より短い_不足分はX0が使われること() throws Exception {
        Segment segment = reader.read(lines("\t1\t5", "\t2\t6"), fileHeader("No", "."),
                segmentHeader(2, 2, List.of(0L, 50L), 1L), new double[] {10d}).get();

        assertArrayEquals(new double[] {10, 11}, segment.getChannels().get(0).getX());
        assertArrayEquals(new double[] {50, 51}, segment.getChannels().get(1).getX());
    }

    @Test
    void read_正常ケース_巨大なサンプル数を宣言し空行で終わる_宣言数分の領域を確保せず読めること() throws Exception {
        LineCursor cursor = lines("0\t1", "1\t2", "", "Channels\t1");

        Segment segment = reader.read(cursor, fileHeader("One", "."),
                segmentHeader(2, List.of(1_500_000_000, 1_500_000_000), 0L, 1L), null).get();

        assertEquals(2, segment.getRowCount());
        assertArrayEquals(new double[] {0, 1}, segment.getChannels().get(0).getX());
        assertArrayEquals(new double[] {1, 2}, segment.getChannels().get(0).getY());
        assertTrue(segment.getChannels().get(1).isEmpty());
        assertEquals("Channels\t1", cursor.next());
    }

    @Test
    void read_正常ケース_初期容量を超える行数_全行が読まれること() throws Exception {
        String[] rows = new String[3000];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = i + "\t" + (i * 2);
        }

        Segment segment = reader.read(lines(rows), fileHeader("One", "."),
                segmentHeader(1, rows.length, 0L, 1L), null).get();

        assertEquals(3000, segment.getChannels().get(0).size());
        assertEquals(2999d, segment.getChannels().get(0).getX(2999));
        assertEquals(5998d, segment.getChannels().get(0).getY(2999));
    }

    @Test
    void read_正常ケース_X列が複数_チャネルごとのXとコメント列が読まれること() throws Exception {
        LineCursor cursor = lines("0\t1\t10\t2\tfirst", "1\t3\t11\t4", "2\t5\t12\t6\tthird");

        Segment segment = reader.read(cursor, fileHeader("Multi", "."),
                segmentHeader(2, List.of(3, 3), 0L, 1L), null).get();

        assertArrayEquals(new double[] {0, 1, 2}, segment.getChannels().get(0).getX());
        assertArrayEquals(new double[] {1, 3, 5}, segment.getChannels().get(0).getY());
        assertArrayEquals(new double[] {10, 11, 12}, segment.getChannels().get(1).getX());
        assertArrayEquals(new double[] {2, 4, 6}, segment.getChannels().get(1).getY());
        assertEquals(List.of("first", "", "third"), segment.getComments());
    }

    @Test
    void read_正常ケース_Y値が空_そのチャネルのみ早期に終了すること() throws Exception {
        LineCursor cursor = lines("0\t1\t5", "1\t\t6", "2\t\t7");

        Segment segment = reader.read(cursor, fileHeader("One", "."),
                segmentHeader(2, List.of(1, 3), 0L, 1L), null).get();

        assertEquals(1, segment.getChannels().get(0).size());
        assertArrayEquals(new double[] {0}, segment.getChannels().get(0).getX());
        assertEquals(3, segment.getChannels().get(1).size());
        assertArrayEquals(new double[] {5, 6, 7}, segment.getChannels().get(1).getY());
        assertEquals(3, segment.getRowCount());
    }

    @Test
    void read_正常ケース_空行で途中終了する_空行の次に位置すること() throws Exception {
        LineCursor cursor = lines("0\t1", "1\t2", "", "Channels\t1");

        Segment segment = reader.read(cursor, fileHeader("One", "."),
                segmentHeader(1, 5, 0L, 1L), null).get();

        assertEquals(2, segment.getRowCount());
        assertEquals("Channels\t1", cursor.next());
    }

    @Test
    void read_正常ケース_全行読了後の空行_区切りとして消費されること() throws Exception {
        LineCursor cursor = lines("0\t1", "", "0\t9");

        reader.read(cursor, fileHeader("One", "."), segmentHeader(1, 1, 0L, 1L), null);

        assertEquals("0\t9", cursor.next());
    }

    @Test
    void read_正常ケース_全行読了後が空行でない_消費されないこと() throws Exception {
        LineCursor cursor = lines("0\t1", "0\t9");

        reader.read(cursor, fileHeader("One", "."), segmentHeader(1, 1, 0L, 1L), null);

        assertEquals("0\t9", cursor.next());
    }

    @Test
    void read_正常ケース_X値が空_NaNが格納されること() throws Exception {
        Segment segment = reader.read(lines("\t1"), fileHeader("One", "."),
                segmentHeader(1, 1, 0L, 1L), null).get();

        assertTrue(Double.isNaN(segment.getChannels().get(0).getX(0)));
        assertEquals(1d, segment.getChannels().get(0).getY(0));
    }

    @Test
    void read_正常ケース_小数点カンマ_小数として解釈されること() throws Exception {
        Segment segment = reader.read(lines("0,5\t1,25"), fileHeader("One", ","),
                segmentHeader(1, 1, 0L, 1L), null).get();

        assertEquals(0.5d, segment.getChannels().get(0).getX(0));
        assertEquals(1.25d, segment.getChannels().get(0).getY(0));
    }

    @Test
    void read_正常ケース_コメントはエスケープ解除されないこと() throws Exception {
        Segment segment = reader.read(lines("0\t1\tnote\\09here"), fileHeader("One", "."),
                segmentHeader(1, 1, 0L, 1L), null).get();

        assertEquals("note\\09here", segment.getComments().get(0));
    }

    @Test
    void read_正常ケース_サンプル数0_1行消費して空のセグメントが返ること() throws Exception {
        LineCursor cursor = lines("", "0\t1");

        Segment segment = reader.read(cursor, fileHeader("One", "."),
                segmentHeader(1, 0, 0L, 1L), null).get();

        assertEquals(0, segment.getRowCount());
        assertTrue(segment.getChannels().get(0).isEmpty());
        assertEquals(1, cursor.position());
    }

    @Test
    void read_正常ケース_データが残っていない_値なしが返ること() throws Exception {
        assertFalse(reader.read(lines("", ""), fileHeader("One", "."),
                segmentHeader(1, 3, 0L, 1L), null).isPresent());
        assertFalse(reader.read(LineCursor.fromText(""), fileHeader("One", "."),
                segmentHeader(1, 3, 0L, 1L), null).isPresent());
    }

    @Test
    void read_異常ケース_宣言行数の前に入力が終わる_TRUNCATED_SEGMENT_DATAが送出されること() {
        LvmFormatException ex = assertThrows(LvmFormatException.class,
                () -> reader.read(lines("0\t1", "1\t2"), fileHeader("One", "."),
                        segmentHeader(1, 5, 0L, 1L), null));
        assertEquals(ErrorKind.TRUNCATED_SEGMENT_DATA, ex.getKind());
        assertEquals("EOF before finished segment: read 2 of 5 rows", ex.getMessage());
    }
}
