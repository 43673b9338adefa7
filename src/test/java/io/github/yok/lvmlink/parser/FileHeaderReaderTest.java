package io.github.yok.lvmlink.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.lvmlink.model.FileHeader;
import io.github.yok.lvmlink.model.XColumns;
import java.time.LocalDate;
import java.time.LocalTime;
import org.junit.jupiter.api.Test;

class FileHeaderReaderTest {

    private final FileHeaderReader reader = new FileHeaderReader();

    private static LineCursor lines(String... lines) {
        return LineCursor.fromText(String.join("\n", lines) + "\n");
    }

    @Test
    void read_正常ケース_タブ区切りのヘッダを指定する_全項目が型変換されること() throws Exception {
        LineCursor cursor = lines("LabVIEW Measurement\t", "Writer_Version\t2",
                "Reader_Version\t1.5", "Separator\tTab", "Decimal_Separator\t.",
                "Multi_Headings\tYes", "X_Columns\tMulti", "Time_Pref\tAbsolute", "Operator\tJanko",
                "Date\t2013/02/13", "Time\t09:51:40.1309127569198608398", "***End_of_Header***\t",
                "", "Channels\t1");

        FileHeader header = reader.read(cursor);

        assertEquals('\t', header.getSeparator());
        assertEquals("\t", header.get("Separator"));
        assertEquals(".", header.getDecimalSeparator());
        assertEquals(2.0d, header.getWriterVersion());
        assertEquals(1.5d, header.getReaderVersion());
        assertTrue(header.isMultiHeadings());
        assertEquals(XColumns.MULTI, header.getXColumns());
        assertEquals("Absolute", header.get("Time_Pref"));
        assertEquals("Janko", header.get("Operator"));
        assertEquals(LocalDate.of(2013, 2, 13), header.getDate());
        assertEquals(LocalTime.of(9, 51, 40, 130912000), header.getTime());
        // 終了マーカーの次の行に位置している
        assertEquals("", cursor.next());
        assertEquals("Channels\t1", cursor.next());
    }

    @Test
    void read_正常ケース_Separator宣言がない_タブが既定値として使われること() throws Exception {
        LineCursor cursor = lines("LabVIEW Measurement", "Writer_Version\t2", "Date\t2020/01/02",
                "Time\t10:00:00", "***End_of_Header***");

        FileHeader header = reader.read(cursor);

        assertEquals('\t', header.getSeparator());
        assertFalse(header.isMultiHeadings());
        assertEquals(XColumns.ONE, header.getXColumns());
        assertEquals(",", header.getDecimalSeparator());
        assertFalse(cursor.hasNext());
    }

    @Test
    void read_正常ケース_カンマ区切りのヘッダを指定する_エスケープが解除されること() throws Exception {
        LineCursor cursor = lines("LabVIEW Measurement,", "Writer_Version,2,5", "Separator,Comma",
                "Description,a\\2Cb", "Date,2020/01/02", "Time,10:00:00", "***End_of_Header***,");

        LvmFormatException ex = assertThrows(LvmFormatException.class, () -> reader.read(cursor));
        // 値にカンマを含む行はキーと値の組として解釈できない
        assertEquals(ErrorKind.FIELD_COERCION_FAILURE, ex.getKind());
        assertEquals("Writer_Version", ex.getField());

        FileHeader header = reader.read(lines("LabVIEW Measurement,", "Writer_Version,2",
                "Separator,Comma", "Description,a\\2Cb", "Date,2020/01/02", "Time,10:00:00",
                "***End_of_Header***,"));
        assertEquals(',', header.getSeparator());
        assertEquals("a,b", header.get("Description"));
    }

    @Test
    void read_正常ケース_Reader_Versionがない_Writer_Versionが使われること() throws Exception {
        FileHeader header = reader.read(lines("LabVIEW Measurement", "Writer_Version\t0.92",
                "Separator\tTab", "Date\t2020/01/02", "Time\t10:00:00", "***End_of_Header***"));
        assertEquals(0.92d, header.getReaderVersion());
        assertEquals(0.92d, header.getWriterVersion());
    }

    @Test
    void read_正常ケース_既定の小数点カンマでバージョンを指定する_小数として解釈されること() throws Exception {
        FileHeader header = reader.read(lines("LabVIEW Measurement", "Writer_Version\t2,5",
                "Separator\tTab", "Date\t2020/01/02", "Time\t10:00:00", "***End_of_Header***"));
        assertEquals(2.5d, header.getWriterVersion());
    }

    @Test
    void read_正常ケース_特殊ブロックと空行を含む_読み飛ばされること() throws Exception {
        FileHeader header = reader.read(lines("LabVIEW Measurement", "Writer_Version\t2",
                "***Start_Special***", "Unknown_Key\tvalue\textra", "***End_Special***", "",
                "\tindented", "Separator\tTab", "Date\t2020/01/02", "Time\t10:00:00",
                "***End_of_Header***"));
        assertEquals(2.0d, header.getWriterVersion());
    }

    @Test
    void read_異常ケース_識別子が不一致_MAGIC_MISMATCHが送出されること() {
        LvmFormatException ex = assertThrows(LvmFormatException.class,
                () -> reader.read(lines("Not LabVIEW", "Separator\tTab", "***End_of_Header***")));
        assertEquals(ErrorKind.MAGIC_MISMATCH, ex.getKind());
        assertEquals("Not LabVIEW", ex.getRawValue());
    }

    @Test
    void read_異常ケース_Separatorも終了マーカーもない_MISSING_DELIMITER_DECLARATIONが送出されること() {
        LvmFormatException ex = assertThrows(LvmFormatException.class,
                () -> reader.read(lines("LabVIEW Measurement", "Writer_Version\t2")));
        assertEquals(ErrorKind.MISSING_DELIMITER_DECLARATION, ex.getKind());
    }

    @Test
    void read_異常ケース_空入力を指定する_MISSING_DELIMITER_DECLARATIONが送出されること() {
        LvmFormatException ex = assertThrows(LvmFormatException.class,
                () -> reader.read(LineCursor.fromText("")));
        assertEquals(ErrorKind.MISSING_DELIMITER_DECLARATION, ex.getKind());
    }

    @Test
    void read_異常ケース_未知のキーを指定する_UNKNOWN_FIELDが送出されること() {
        LvmFormatException ex = assertThrows(LvmFormatException.class,
                () -> reader.read(lines("LabVIEW Measurement", "Separator\tTab",
                        "Writer_Version\t2", "Foo\tbar", "***End_of_Header***")));
        assertEquals(ErrorKind.UNKNOWN_FIELD, ex.getKind());
        assertEquals("Foo", ex.getField());
        assertEquals("Invalid File Header: Foo", ex.getMessage());
    }

    @Test
    void read_異常ケース_Writer_Versionが欠落_MISSING_REQUIRED_FIELDが送出されること() {
        LvmFormatException ex = assertThrows(LvmFormatException.class,
                () -> reader.read(lines("LabVIEW Measurement", "Separator\tTab",
                        "Date\t2020/01/02", "Time\t10:00:00", "***End_of_Header***")));
        assertEquals(ErrorKind.MISSING_REQUIRED_FIELD, ex.getKind());
        assertEquals("Writer_Version", ex.getField());
    }

    @Test
    void read_異常ケース_X_Columnsに未定義の選択肢_INVALID_OPTIONが送出されること() {
        LvmFormatException ex = assertThrows(LvmFormatException.class,
                () -> reader.read(lines("LabVIEW Measurement", "Separator\tTab",
                        "Writer_Version\t2", "X_Columns\tTwo", "Date\t2020/01/02",
                        "Time\t10:00:00", "***End_of_Header***")));
        assertEquals(ErrorKind.INVALID_OPTION, ex.getKind());
        assertEquals("X_Columns", ex.getField());
    }

    @Test
    void read_異常ケース_真偽値が不正_FIELD_COERCION_FAILUREが送出されること() {
        LvmFormatException ex = assertThrows(LvmFormatException.class,
                () -> reader.read(lines("LabVIEW Measurement", "Separator\tTab",
                        "Multi_Headings\tMaybe", "***End_of_Header***")));
        assertEquals(ErrorKind.FIELD_COERCION_FAILURE, ex.getKind());
        assertEquals("Multi_Headings", ex.getField());
        assertEquals("Maybe", ex.getRawValue());
    }

    @Test
    void read_異常ケース_数値でないバージョン_FIELD_COERCION_FAILUREが送出されること() {
        LvmFormatException ex = assertThrows(LvmFormatException.class,
                () -> reader.read(lines("LabVIEW Measurement", "Separator\tTab",
                        "Writer_Version\t", "***End_of_Header***")));
        assertEquals(ErrorKind.FIELD_COERCION_FAILURE, ex.getKind());
        assertEquals("Writer_Version", ex.getField());
    }

    @Test
    void read_異常ケース_終了マーカー前に入力が終わる_TRUNCATED_FILE_HEADERが送出されること() {
        LvmFormatException ex = assertThrows(LvmFormatException.class,
                () -> reader.read(lines("LabVIEW Measurement", "Separator\tTab",
                        "Writer_Version\t2")));
        assertEquals(ErrorKind.TRUNCATED_FILE_HEADER, ex.getKind());
    }

    @Test
    void findSeparator_正常ケース_先読みする_カーソルが進まないこと() throws Exception {
        LineCursor cursor = lines("LabVIEW Measurement,", "Separator,Comma",
                "***End_of_Header***,");
        assertEquals(',', reader.findSeparator(cursor));
        assertEquals(0, cursor.position());
    }
}
