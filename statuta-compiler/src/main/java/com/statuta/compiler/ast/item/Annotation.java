package com.statuta.compiler.ast.item;

import com.statuta.compiler.ast.AstNode;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * 注解，如 {@code @hierarchy(level = Section, subordinate_to = Act.title)}
 */
public class Annotation extends AstNode {
    private final String name;
    private final List<Argument> arguments;

    public Annotation(SourceLocation location, String name, List<Argument> arguments) {
        super(location);
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Argument> getArguments() {
        return arguments;
    }

    /** 按名称查找命名参数，不存在时返回 null */
    public Expression getArgument(String argName) {
        for (Argument arg : arguments) {
            if (argName.equals(arg.getName())) {
                return arg.getValue();
            }
        }
        return null;
    }

    /** 第 index 个位置参数，不存在时返回 null */
    public Expression getPositional(int index) {
        int i = 0;
        for (Argument arg : arguments) {
            if (arg.getName() == null) {
                if (i == index) return arg.getValue();
                i++;
            }
        }
        return null;
    }

    /**
     * 注解参数：位置参数的 name 为 null
     */
    public static final class Argument {
        private final String name;
        private final Expression value;

        public Argument(String name, Expression value) {
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }
    }
}
