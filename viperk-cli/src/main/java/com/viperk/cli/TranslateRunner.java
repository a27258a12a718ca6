package com.viperk.cli;

import com.viperk.compiler.parser.ParseException;
import com.viperk.ir.ViperIrCompiler;
import com.viperk.ir.translate.TranslateOptions;
import com.viperk.ir.translate.UnsupportedConstructException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * 翻译执行器：读取源文件、翻译、输出 IR。失败时不输出任何 IR，返回退出码 1。
 */
public class TranslateRunner {

    private static final Logger LOG = Logger.getLogger(TranslateRunner.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final TranslateOptions options;
    private final PrintStream out;
    private final PrintStream err;

    public TranslateRunner(TranslateOptions options, PrintStream out, PrintStream err) {
        this.options = options;
        this.out = out;
        this.err = err;
    }

    /**
     * 翻译文件
     *
     * @param filePath   源文件
     * @param outputPath 输出文件；为 null 时写到标准输出
     * @return 退出码
     */
    public int translateFile(String filePath, String outputPath) {
        Path path = Paths.get(filePath);
        if (!Files.isRegularFile(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return EXIT_FAILURE;
        }

        String ir;
        try {
            String source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            ViperIrCompiler compiler = new ViperIrCompiler(options);
            compiler.setErr(err);
            ir = compiler.translate(source, path.getFileName().toString());
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + filePath + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (ParseException e) {
            err.println("语法错误: " + path.getFileName() + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (UnsupportedConstructException e) {
            err.println("翻译错误: " + path.getFileName() + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        if (outputPath == null) {
            out.println(ir);
            return EXIT_OK;
        }
        try {
            Path target = Paths.get(outputPath);
            Files.write(target, (ir + "\n").getBytes(StandardCharsets.UTF_8));
            LOG.fine("Wrote " + target.toAbsolutePath());
            return EXIT_OK;
        } catch (IOException e) {
            err.println("错误: 无法写入输出文件 - " + outputPath + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
