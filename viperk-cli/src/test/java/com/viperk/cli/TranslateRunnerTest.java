package com.viperk.cli;

import com.viperk.ir.translate.TranslateOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 翻译执行器测试
 */
class TranslateRunnerTest {

    private static final String SOURCE = "total: public(num)\n\n@public\ndef get() -> num:\n    return self.total\n";
    private static final String IR = "%pgm(,\n  %svdecl(total, %num, %public), ,"
            + "\n  %fdecl(%@public, get, , %num,\n    %return(%svar(total)))\n)";

    @TempDir
    Path dir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private TranslateRunner runner;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        runner = new TranslateRunner(new TranslateOptions(),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("成功时 IR 写到标准输出")
    void testSuccessToStdout() throws IOException {
        Path file = write("c.v.py", SOURCE);
        assertEquals(TranslateRunner.EXIT_OK, runner.translateFile(file.toString(), null));
        assertEquals(IR + System.lineSeparator(), stdout());
        assertEquals("", stderr());
    }

    @Test
    @DisplayName("成功时 IR 写到输出文件")
    void testSuccessToFile() throws IOException {
        Path file = write("c.v.py", SOURCE);
        Path target = dir.resolve("c.k");
        assertEquals(TranslateRunner.EXIT_OK, runner.translateFile(file.toString(), target.toString()));
        assertEquals(IR + "\n", new String(Files.readAllBytes(target), StandardCharsets.UTF_8));
        assertEquals("", stdout());
    }

    @Test
    @DisplayName("文件不存在")
    void testMissingFile() {
        assertEquals(TranslateRunner.EXIT_FAILURE, runner.translateFile(dir.resolve("none.v.py").toString(), null));
        assertThat(stderr()).contains("文件不存在");
        assertEquals("", stdout());
    }

    @Test
    @DisplayName("语法错误不输出 IR")
    void testSyntaxError() throws IOException {
        Path file = write("bad.v.py", "def f(:\n    pass\n");
        assertEquals(TranslateRunner.EXIT_FAILURE, runner.translateFile(file.toString(), null));
        assertThat(stderr()).contains("语法错误").contains("bad.v.py");
        assertEquals("", stdout());
    }

    @Test
    @DisplayName("不支持的构造不输出 IR")
    void testUnsupportedConstruct() throws IOException {
        Path file = write("loop.v.py", "def f():\n    while True:\n        pass\n");
        Path target = dir.resolve("loop.k");
        assertEquals(TranslateRunner.EXIT_FAILURE, runner.translateFile(file.toString(), target.toString()));
        assertThat(stderr()).contains("翻译错误").contains("while").contains("line 2");
        assertThat(target).doesNotExist();
    }

    @Test
    @DisplayName("关闭折叠选项生效")
    void testNoFold() throws IOException {
        Path file = write("n.v.py", "def f():\n    x = -1\n");
        TranslateOptions options = new TranslateOptions();
        options.setFoldNegativeLiterals(false);
        TranslateRunner noFold = new TranslateRunner(options,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        assertEquals(TranslateRunner.EXIT_OK, noFold.translateFile(file.toString(), null));
        assertThat(stdout()).contains("%assign(%var(x), %unaryop(%neg, 1))");
    }
}
