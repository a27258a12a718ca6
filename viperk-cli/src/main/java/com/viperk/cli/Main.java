package com.viperk.cli;

import com.viperk.ir.translate.TranslateOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * viperk CLI 入口点（picocli）：把一个 Viper 源文件翻译为 K 前缀 IR
 */
@Command(name = "viperk", version = "viperk v0.1.0",
         mixinStandardHelpOptions = true,
         description = "将 Viper 合约源码翻译为 K 前缀中间表示")
public class Main implements Callable<Integer> {

    @Parameters(index = "0", arity = "1", description = "Viper 源码文件路径")
    String file;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认输出到标准输出）")
    String output;

    @Option(names = "--no-fold", description = "不折叠负数字面量")
    boolean noFold;

    @Option(names = {"-v", "--verbose"}, description = "输出详细日志")
    boolean verbose;

    @Override
    public Integer call() {
        configureLogging(verbose);

        TranslateOptions options = new TranslateOptions();
        options.setFoldNegativeLiterals(!noFold);
        return new TranslateRunner(options, System.out, System.err).translateFile(file, output);
    }

    /**
     * 日志输出到 stderr，不干扰标准输出上的 IR
     */
    static void configureLogging(boolean verbose) {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        Level level = verbose ? Level.FINE : Level.WARNING;
        stderrHandler.setLevel(level);
        rootLogger.addHandler(stderrHandler);
        Logger.getLogger("com.viperk").setLevel(level);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
