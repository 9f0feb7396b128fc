package com.erlfmt.core.formatter;

import java.util.*;

/**
 * 运算符优先级表
 *
 * <p>二元运算符为 (左, 运算符, 右) 三元组，前缀运算符为 (运算符, 操作数) 二元组。
 * 数值越大结合越紧。左结合运算符的运算符优先级等于左槽位，右结合的等于右槽位，
 * 两者都不等时不可结合。</p>
 */
public final class OperatorTable {

    private static final Map<String, BinaryPrecedence> BINARY;
    private static final Map<String, PrefixPrecedence> PREFIX;

    /** 嵌套任何运算符表达式都加括号 */
    private static final Set<String> REQUIRE_PARENS = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList("bor", "band", "bxor", "bsl", "bsr", "++", "--")));

    /** 两两混用时加括号的布尔运算符 */
    private static final Set<String> MIXED_REQUIRE_PARENS = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList("or", "and", "andalso", "orelse")));

    /** 以单词书写、与操作数之间需要空格的前缀运算符 */
    private static final Set<String> WORD_PREFIX = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList("not", "bnot", "catch")));

    static {
        Map<String, BinaryPrecedence> binary = new HashMap<>();
        binary(binary, 150, 100, 100, "=", "!");
        binary(binary, 160, 150, 150, "orelse");
        binary(binary, 200, 160, 160, "andalso");
        binary(binary, 300, 200, 300, "==", "/=", "=<", "<", ">=", ">", "=:=", "=/=");
        binary(binary, 400, 300, 300, "++", "--");
        binary(binary, 400, 400, 500, "+", "-", "bor", "bxor", "bsl", "bsr", "or", "xor");
        binary(binary, 500, 500, 600, "*", "/", "div", "rem", "band", "and");
        BINARY = Collections.unmodifiableMap(binary);

        Map<String, PrefixPrecedence> prefix = new HashMap<>();
        prefix.put("catch", new PrefixPrecedence(0, 100));
        for (String op : new String[]{"+", "-", "bnot", "not"}) {
            prefix.put(op, new PrefixPrecedence(600, 700));
        }
        PREFIX = Collections.unmodifiableMap(prefix);
    }

    private OperatorTable() {}

    private static void binary(Map<String, BinaryPrecedence> table, int left, int op, int right,
                               String... symbols) {
        BinaryPrecedence precedence = new BinaryPrecedence(left, op, right);
        for (String symbol : symbols) {
            table.put(symbol, precedence);
        }
    }

    /**
     * 查询二元运算符的优先级三元组
     *
     * @throws UnknownOperatorException 运算符不在表中
     */
    public static BinaryPrecedence binary(String operator) {
        BinaryPrecedence precedence = BINARY.get(operator);
        if (precedence == null) {
            throw new UnknownOperatorException(operator, "binary");
        }
        return precedence;
    }

    /**
     * 查询前缀运算符的优先级
     *
     * @throws UnknownOperatorException 运算符不在表中
     */
    public static PrefixPrecedence prefix(String operator) {
        PrefixPrecedence precedence = PREFIX.get(operator);
        if (precedence == null) {
            throw new UnknownOperatorException(operator, "prefix");
        }
        return precedence;
    }

    public static boolean requiresParens(String operator) {
        return REQUIRE_PARENS.contains(operator);
    }

    public static boolean isMixedBoolean(String operator) {
        return MIXED_REQUIRE_PARENS.contains(operator);
    }

    public static boolean isWordPrefix(String operator) {
        return WORD_PREFIX.contains(operator);
    }

    /**
     * 二元运算符优先级三元组
     */
    public static final class BinaryPrecedence {
        private final int left;
        private final int operator;
        private final int right;

        BinaryPrecedence(int left, int operator, int right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        public int getLeft() {
            return left;
        }

        public int getOperator() {
            return operator;
        }

        public int getRight() {
            return right;
        }

        /** 同一运算符出现在优先级为 slot 的槽位上时是否无需括号 */
        public boolean chainsAt(int slot) {
            return (left == slot && operator == slot) || (operator == slot && right == slot);
        }

        @Override
        public String toString() {
            return "(" + left + ", " + operator + ", " + right + ")";
        }
    }

    /**
     * 前缀运算符优先级
     */
    public static final class PrefixPrecedence {
        private final int operator;
        private final int operand;

        PrefixPrecedence(int operator, int operand) {
            this.operator = operator;
            this.operand = operand;
        }

        public int getOperator() {
            return operator;
        }

        public int getOperand() {
            return operand;
        }

        @Override
        public String toString() {
            return "(" + operator + ", " + operand + ")";
        }
    }
}
