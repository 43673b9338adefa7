package io.github.yok.lvmlink.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LogPathUtilTest {

    @Test
    void コンストラクタ_異常ケース_リフレクションで生成する_AssertionErrorが送出されること() throws Exception {
        Constructor<LogPathUtil> constructor = LogPathUtil.class.getDeclaredConstructor();
        constructor.setAccessible(true);
        InvocationTargetException ex =
                assertThrows(InvocationTargetException.class, constructor::newInstance);
        assertInstanceOf(AssertionError.class, ex.getCause());
    }

    @Test
    void renderPathForLog_正常ケース_作業ディレクトリ配下_相対パスが返ること() {
        Path base = Paths.get(System.getProperty("user.dir"));
        assertEquals(Paths.get("data", "run.lvm").toString(),
                LogPathUtil.renderPathForLog(base.resolve("data").resolve("run.lvm")));
    }

    @Test
    void renderPathForLog_正常ケース_作業ディレクトリ外_絶対パスが返ること(@TempDir Path tmp) {
        Path file = tmp.resolve("x").resolve("..").resolve("run.lvm");
        Path expected = tmp.resolve("run.lvm").toAbsolutePath().normalize();
        if (expected.startsWith(Paths.get(System.getProperty("user.dir")).toAbsolutePath())) {
            return;
        }
        assertEquals(expected.toString(), LogPathUtil.renderPathForLog(file));
    }

    @Test
    void renderPathForLog_異常ケース_nullを指定する_NullPointerExceptionが送出されること() {
        NullPointerException ex = assertThrows(NullPointerException.class,
                () -> LogPathUtil.renderPathForLog(null));
        assertEquals("path must not be null", ex.getMessage());
    }
}
