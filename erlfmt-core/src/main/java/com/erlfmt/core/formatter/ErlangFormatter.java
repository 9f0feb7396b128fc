package com.erlfmt.core.formatter;

import com.erlfmt.algebra.Document;
import com.erlfmt.algebra.DocumentRenderer;
import com.erlfmt.core.ast.AstPrinter;
import com.erlfmt.core.ast.expr.Expression;
import com.erlfmt.core.lexer.Lexer;
import com.erlfmt.core.parser.Form;
import com.erlfmt.core.parser.Parser;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 源码格式化入口
 *
 * <p>逐个格式化顶层形式。某个形式格式化失败时原样输出其源码，不影响其他形式。
 * 实例只持有不可变配置，可在线程间共享。</p>
 *
 * <p>语法树不含注释节点：成功格式化的形式中的 {@code %} 注释会丢失，
 * 例如 {@code A = "x" % c} 换行 {@code "y".} 输出为 {@code A = "x" "y".}。
 * 只有格式化失败而原样输出的形式保留注释。</p>
 */
public class ErlangFormatter {
    private static final Logger LOG = Logger.getLogger(ErlangFormatter.class.getName());

    private final FormatConfig config;
    private final ExprFormatter exprFormatter;
    private final DocumentRenderer renderer;

    public ErlangFormatter(FormatConfig config) {
        this.config = config;
        this.exprFormatter = new ExprFormatter(config);
        this.renderer = new DocumentRenderer(config.getMaxLineWidth());
    }

    public ErlangFormatter() {
        this(new FormatConfig());
    }

    public FormatConfig getConfig() {
        return config;
    }

    /**
     * 格式化源码
     *
     * @throws com.erlfmt.core.parser.ParseException 源码有语法错误
     */
    public String format(String source) {
        return format(source, "<input>");
    }

    public String format(String source, String fileName) {
        return formatForms(new Parser(new Lexer(source, fileName), fileName).parseForms());
    }

    /**
     * 形式之间空一行，输出以换行结束
     */
    String formatForms(List<Form> forms) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < forms.size(); i++) {
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append(formatForm(forms.get(i)));
        }
        if (!forms.isEmpty()) {
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * 格式化单个顶层形式，失败时返回其源码原文
     */
    String formatForm(Form form) {
        Expression expression = form.getExpression();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("格式化 " + form.getLocation() + ": " + new AstPrinter().print(expression));
        }
        try {
            return render(expression) + ".";
        } catch (FormatException e) {
            LOG.log(Level.WARNING, "无法格式化 " + form.getLocation() + "，保留原文", e);
            return form.getSourceText();
        }
    }

    /**
     * 格式化单个表达式（不带结尾的点）
     *
     * @throws FormatException 表达式无法格式化
     */
    public String formatExpression(String source) {
        return render(Parser.parse(source));
    }

    private String render(Expression expression) {
        Document document = exprFormatter.exprToDocument(expression);
        return renderer.render(document);
    }
}
