package com.statuta.compiler.ast;

import com.statuta.compiler.ast.item.ImportDecl;
import com.statuta.compiler.ast.item.Item;

import java.util.Collections;
import java.util.List;

/**
 * 程序（编译单元根节点）
 */
public class Program extends AstNode {
    private final String fileName;
    private final List<ImportDecl> imports;
    private final List<Item> items;

    public Program(SourceLocation location, String fileName, List<ImportDecl> imports, List<Item> items) {
        super(location);
        this.fileName = fileName;
        this.imports = Collections.unmodifiableList(imports);
        this.items = Collections.unmodifiableList(items);
    }

    public String getFileName() {
        return fileName;
    }

    public List<ImportDecl> getImports() {
        return imports;
    }

    /** 按源码顺序排列的顶层条目 */
    public List<Item> getItems() {
        return items;
    }

    public boolean isEmpty() {
        return imports.isEmpty() && items.isEmpty();
    }
}
