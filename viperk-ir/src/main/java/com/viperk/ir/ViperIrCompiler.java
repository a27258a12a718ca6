package com.viperk.ir;

import com.viperk.compiler.ast.decl.Program;
import com.viperk.compiler.lexer.Lexer;
import com.viperk.compiler.parser.Parser;
import com.viperk.compiler.pass.AstPass;
import com.viperk.compiler.pass.NegativeLiteralFolder;
import com.viperk.ir.term.ProgramTerm;
import com.viperk.ir.translate.ProgramTranslator;
import com.viperk.ir.translate.SourceLines;
import com.viperk.ir.translate.TranslateOptions;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Viper → K 前缀 IR 翻译器门面。
 * 管线：源码 → Lexer → Parser → 语法树 → 预处理 pass → IR 项 → 文本。
 *
 * <p>任何语法错误（{@link com.viperk.compiler.parser.ParseException}）或不支持的构造
 * （{@link com.viperk.ir.translate.UnsupportedConstructException}）都会直接抛出，不返回部分结果。</p>
 */
public class ViperIrCompiler {

    private static final Logger LOG = Logger.getLogger(ViperIrCompiler.class.getName());

    private final TranslateOptions options;
    private PrintStream err = System.err;

    public ViperIrCompiler() {
        this(new TranslateOptions());
    }

    public ViperIrCompiler(TranslateOptions options) {
        this.options = options;
    }

    /**
     * 词法错误的输出流
     */
    public void setErr(PrintStream err) {
        this.err = err;
    }

    /**
     * 解析源代码并执行预处理 pass
     */
    public Program parse(String source, String fileName) {
        Lexer lexer = new Lexer(source, fileName, err);
        Parser parser = new Parser(lexer, fileName);
        Program program = parser.parse();
        LOG.fine("Parsed " + fileName + ": " + program.getBody().size() + " top level statements");

        for (AstPass pass : createPasses(source)) {
            program = pass.run(program);
            LOG.fine("Ran pass " + pass.getName());
        }
        return program;
    }

    private List<AstPass> createPasses(String source) {
        List<AstPass> passes = new ArrayList<AstPass>();
        if (options.isFoldNegativeLiterals()) {
            passes.add(new NegativeLiteralFolder(source));
        }
        return passes;
    }

    /**
     * 翻译为 IR 项树
     */
    public ProgramTerm translateToTerm(String source, String fileName) {
        Program program = parse(source, fileName);
        ProgramTerm term = new ProgramTranslator(new SourceLines(source)).translate(program);
        LOG.fine("Translated " + fileName + ": " + term.getEvents().size() + " events, "
                + term.getGlobals().size() + " globals, "
                + (term.getInit().size() + term.getFunctions().size()) + " functions");
        return term;
    }

    /**
     * 翻译源代码。
     *
     * @param source   源代码
     * @param fileName 文件名（仅用于错误位置）
     * @return IR 文本
     */
    public String translate(String source, String fileName) {
        return translateToTerm(source, fileName).render();
    }

    /**
     * 翻译文件（UTF-8）。
     */
    public String translateFile(File file) throws IOException {
        String source = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
        return translate(source, file.getName());
    }
}
