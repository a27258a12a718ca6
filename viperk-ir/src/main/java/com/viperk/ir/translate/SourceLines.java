package com.viperk.ir.translate;

import com.viperk.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 按行索引的只读源码表，用于从原文恢复十六进制字面量的写法。
 */
public final class SourceLines {

    private static final String HEX_PREFIX = "0x";
    private static final String HEX_DIGITS = "0123456789abcdefABCDEF";

    private final List<String> lines;

    public SourceLines(String source) {
        this.lines = split(source != null ? source : "");
    }

    // 与词法分析器一致，只以 '\n' 分行
    private static List<String> split(String source) {
        List<String> result = new ArrayList<String>();
        int start = 0;
        int end;
        while ((end = source.indexOf('\n', start)) >= 0) {
            result.add(source.substring(start, end));
            start = end + 1;
        }
        result.add(source.substring(start));
        return result;
    }

    public int getLineCount() {
        return lines.size();
    }

    /**
     * 第 line 行（1 基）内容，越界时返回空串
     */
    public String line(int line) {
        if (line < 1 || line > lines.size()) {
            return "";
        }
        return lines.get(line - 1);
    }

    /**
     * 若该位置以 {@code 0x} 开头，返回其后连续的十六进制数字（原样保留大小写），否则返回 null
     */
    public String hexDigitsAt(SourceLocation location) {
        if (location == null || !location.isKnown()) {
            return null;
        }
        String text = line(location.getLine());
        int col = location.getColumnOffset();
        if (col < 0 || !text.startsWith(HEX_PREFIX, col)) {
            return null;
        }
        int begin = col + HEX_PREFIX.length();
        int end = begin;
        while (end < text.length() && HEX_DIGITS.indexOf(text.charAt(end)) >= 0) {
            end++;
        }
        return text.substring(begin, end);
    }
}
