package com.viperk.compiler.pass;

import com.viperk.compiler.ast.AstNode;
import com.viperk.compiler.ast.decl.Program;
import com.viperk.compiler.ast.expr.Literal;
import com.viperk.compiler.ast.expr.Literal.LiteralKind;
import com.viperk.compiler.ast.expr.UnaryExpr;
import com.viperk.compiler.ast.expr.UnaryExpr.UnaryOp;

/**
 * 负数字面量折叠：{@code -<数值字面量>} → 单个负值字面量，位置取数值本身。
 *
 * <p>以 {@code 0x} 书写的字面量不折叠：其输出直接取自源码文本，折叠后会丢失符号。</p>
 *
 * <p>一元表达式是遍历的终点：不折叠时原样返回，不再进入操作数，
 * 因此 {@code -(-5)}、{@code not -5}、{@code -(a + -1)} 内部都保持原状。</p>
 */
public class NegativeLiteralFolder extends AstTransformer implements AstPass {

    private final String source;

    /**
     * @param source 原始源码；为 null 时无法识别十六进制写法，全部折叠
     */
    public NegativeLiteralFolder(String source) {
        this.source = source;
    }

    @Override
    public String getName() {
        return "NegativeLiteralFolder";
    }

    @Override
    public Program run(Program program) {
        return transform(program);
    }

    @Override
    public AstNode visitUnaryExpr(UnaryExpr node, Void ctx) {
        if (node.getOperator() == UnaryOp.NEG && node.getOperand() instanceof Literal) {
            Literal lit = (Literal) node.getOperand();
            if (lit.getKind() == LiteralKind.INT && !isHexWritten(lit)) {
                return new Literal(lit.getLocation(), lit.intValue().negate(), LiteralKind.INT);
            }
            if (lit.getKind() == LiteralKind.DECIMAL) {
                return new Literal(lit.getLocation(), lit.decimalValue().negate(), LiteralKind.DECIMAL);
            }
        }
        return node;
    }

    private boolean isHexWritten(Literal lit) {
        if (source == null || !lit.getLocation().isKnown()) return false;
        return source.startsWith("0x", lit.getLocation().getOffset());
    }
}
