package com.statuta.verify.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 从 get-model 的输出中提取常量赋值
 *
 * <p>只保留无参数的 {@code define-fun}；带参数的定义（求解器生成的辅助函数）被忽略。
 * {@code (- 1)} 还原为 {@code -1}，{@code (/ 1.0 3.0)} 还原为 {@code 1.0/3.0}。</p>
 */
public final class CounterexampleExtractor {

    public static final String NO_ASSIGNMENTS = "No assignments were found in the solver model";

    public Counterexample extract(String model) {
        List<Counterexample.Assignment> assignments = new ArrayList<>();
        SExprReader reader = new SExprReader(model == null ? "" : model);
        Object form;
        while ((form = reader.next()) != null) {
            collect(form, assignments);
        }
        return new Counterexample(assignments, assignments.isEmpty() ? NO_ASSIGNMENTS : "", false);
    }

    @SuppressWarnings("unchecked")
    private void collect(Object form, List<Counterexample.Assignment> out) {
        if (!(form instanceof List)) return;
        List<Object> list = (List<Object>) form;
        if (list.size() == 5 && "define-fun".equals(list.get(0)) && list.get(1) instanceof String) {
            Object params = list.get(2);
            if (params instanceof List && ((List<Object>) params).isEmpty()) {
                out.add(new Counterexample.Assignment(unquote((String) list.get(1)), render(list.get(4))));
            }
            return;
        }
        // (model ...) 或裸括号包裹的定义列表
        for (Object child : list) {
            collect(child, out);
        }
    }

    @SuppressWarnings("unchecked")
    static String render(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        List<Object> list = (List<Object>) value;
        if (list.size() == 2 && "-".equals(list.get(0))) {
            return "-" + render(list.get(1));
        }
        if (list.size() == 3 && "/".equals(list.get(0))) {
            return render(list.get(1)) + "/" + render(list.get(2));
        }
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(render(list.get(i)));
        }
        return sb.append(')').toString();
    }

    private static String unquote(String symbol) {
        if (symbol.length() >= 2 && symbol.startsWith("|") && symbol.endsWith("|")) {
            return symbol.substring(1, symbol.length() - 1);
        }
        return symbol;
    }

    /**
     * 最小的 S 表达式读取器：原子为 String，列表为 List
     */
    static final class SExprReader {
        private final String text;
        private int pos;

        SExprReader(String text) {
            this.text = text;
        }

        /** 读取下一个顶层表达式，输入结束时返回 null */
        Object next() {
            skipSpace();
            if (pos >= text.length()) return null;
            return read();
        }

        private Object read() {
            skipSpace();
            if (pos >= text.length()) {
                throw new IllegalArgumentException("Unbalanced parentheses in solver model");
            }
            char c = text.charAt(pos);
            if (c == '(') {
                pos++;
                List<Object> list = new ArrayList<>();
                while (true) {
                    skipSpace();
                    if (pos >= text.length()) {
                        throw new IllegalArgumentException("Unbalanced parentheses in solver model");
                    }
                    if (text.charAt(pos) == ')') {
                        pos++;
                        return list;
                    }
                    list.add(read());
                }
            }
            if (c == ')') {
                throw new IllegalArgumentException("Unexpected ')' at offset " + pos + " in solver model");
            }
            return atom();
        }

        private String atom() {
            int start = pos;
            char c = text.charAt(pos);
            if (c == '"') {
                pos++;
                while (pos < text.length()) {
                    if (text.charAt(pos) == '"') {
                        // "" 是字符串内的引号
                        if (pos + 1 < text.length() && text.charAt(pos + 1) == '"') {
                            pos += 2;
                            continue;
                        }
                        pos++;
                        break;
                    }
                    pos++;
                }
                return text.substring(start, pos);
            }
            if (c == '|') {
                int end = text.indexOf('|', pos + 1);
                pos = end < 0 ? text.length() : end + 1;
                return text.substring(start, pos);
            }
            while (pos < text.length()) {
                char d = text.charAt(pos);
                if (Character.isWhitespace(d) || d == '(' || d == ')') break;
                pos++;
            }
            return text.substring(start, pos);
        }

        private void skipSpace() {
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == ';') {
                    while (pos < text.length() && text.charAt(pos) != '\n') pos++;
                } else if (Character.isWhitespace(c)) {
                    pos++;
                } else {
                    break;
                }
            }
        }
    }
}
