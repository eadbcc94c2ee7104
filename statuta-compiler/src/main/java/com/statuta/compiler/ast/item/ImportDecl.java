package com.statuta.compiler.ast.item;

import com.statuta.compiler.ast.AstNode;
import com.statuta.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 导入：{@code referencing A, B from penal/definitions} 或 {@code referencing * from mod}
 */
public class ImportDecl extends AstNode {
    private final List<String> names;
    private final boolean wildcard;
    private final String modulePath;

    public ImportDecl(SourceLocation location, List<String> names, boolean wildcard, String modulePath) {
        super(location);
        this.names = Collections.unmodifiableList(names);
        this.wildcard = wildcard;
        this.modulePath = modulePath;
    }

    public List<String> getNames() {
        return names;
    }

    public boolean isWildcard() {
        return wildcard;
    }

    public String getModulePath() {
        return modulePath;
    }
}
