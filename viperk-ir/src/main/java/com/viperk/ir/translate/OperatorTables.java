package com.viperk.ir.translate;

import com.viperk.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.viperk.compiler.ast.expr.BoolOpExpr.BoolOp;
import com.viperk.compiler.ast.expr.CompareExpr.CompareOp;
import com.viperk.compiler.ast.expr.UnaryExpr.UnaryOp;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 运算符与保留名称到 IR 符号的固定映射。
 *
 * <p>查不到的运算符返回 null，由调用方报告为不支持的细节。</p>
 */
public final class OperatorTables {

    private OperatorTables() {
    }

    /** 事件声明的标记函数名：{@code Transfer: __log__({...})} */
    public static final String EVENT_MARKER = "__log__";

    /** 构造函数名 */
    public static final String CONSTRUCTOR = "__init__";

    /** 事件参数的索引标记 */
    public static final String INDEXED = "indexed";

    /** 单位类型中表示位置参数的尾部标记 */
    public static final String POSITIONAL = "positional";

    public static final String WEI_VALUE = "as_wei_value";

    private static final Map<BinaryOp, String> BINARY = new EnumMap<BinaryOp, String>(BinaryOp.class);
    private static final Map<CompareOp, String> COMPARE = new EnumMap<CompareOp, String>(CompareOp.class);
    private static final Map<BoolOp, String> BOOL = new EnumMap<BoolOp, String>(BoolOp.class);
    private static final Map<UnaryOp, String> UNARY = new EnumMap<UnaryOp, String>(UnaryOp.class);
    private static final Map<String, Set<String>> RESERVED_PROPERTIES = new HashMap<String, Set<String>>();
    private static final Set<String> VISIBILITY_WRAPPERS = new HashSet<String>(Arrays.asList("public", "private"));
    private static final Set<String> UNIT_BASE_TYPES = new HashSet<String>(Arrays.asList("num", "decimal"));

    static {
        BINARY.put(BinaryOp.ADD, "+");
        BINARY.put(BinaryOp.SUB, "-");
        BINARY.put(BinaryOp.MUL, "*");
        BINARY.put(BinaryOp.DIV, "/");
        BINARY.put(BinaryOp.FLOOR_DIV, "//");
        BINARY.put(BinaryOp.MOD, "%");
        BINARY.put(BinaryOp.POW, "**");
        BINARY.put(BinaryOp.BIT_AND, "&");
        BINARY.put(BinaryOp.BIT_OR, "|");
        BINARY.put(BinaryOp.BIT_XOR, "^");
        BINARY.put(BinaryOp.LSHIFT, "<<");
        BINARY.put(BinaryOp.RSHIFT, ">>");
        BINARY.put(BinaryOp.MATMUL, "@");

        COMPARE.put(CompareOp.LT, "%lt");
        COMPARE.put(CompareOp.LE, "%le");
        COMPARE.put(CompareOp.GT, "%gt");
        COMPARE.put(CompareOp.GE, "%ge");
        COMPARE.put(CompareOp.EQ, "%eq");
        COMPARE.put(CompareOp.NE, "%ne");
        COMPARE.put(CompareOp.IN, "%in");

        BOOL.put(BoolOp.AND, "%and");
        BOOL.put(BoolOp.OR, "%or");

        UNARY.put(UnaryOp.NOT, "%not");
        UNARY.put(UnaryOp.NEG, "%neg");

        RESERVED_PROPERTIES.put("msg", new HashSet<String>(Arrays.asList("sender", "value", "gas")));
        RESERVED_PROPERTIES.put("block", new HashSet<String>(Arrays.asList(
                "difficulty", "timestamp", "coinbase", "number", "prevhash")));
        RESERVED_PROPERTIES.put("tx", Collections.singleton("origin"));
    }

    public static String binarySymbol(BinaryOp op) {
        return BINARY.get(op);
    }

    /** 增强赋值符号：{@code +=}、{@code //=} 等 */
    public static String augAssignSymbol(BinaryOp op) {
        String symbol = BINARY.get(op);
        return symbol != null ? symbol + "=" : null;
    }

    public static String compareSymbol(CompareOp op) {
        return COMPARE.get(op);
    }

    public static String boolSymbol(BoolOp op) {
        return BOOL.get(op);
    }

    public static String unarySymbol(UnaryOp op) {
        return UNARY.get(op);
    }

    /**
     * 是否为保留属性，如 msg.sender、block.timestamp、tx.origin
     */
    public static boolean isReservedProperty(String object, String property) {
        Set<String> properties = RESERVED_PROPERTIES.get(object);
        return properties != null && properties.contains(property);
    }

    public static boolean isVisibilityWrapper(String name) {
        return VISIBILITY_WRAPPERS.contains(name);
    }

    /** 可携带单位的纯数值类型 */
    public static boolean isUnitBaseType(String name) {
        return UNIT_BASE_TYPES.contains(name);
    }
}
