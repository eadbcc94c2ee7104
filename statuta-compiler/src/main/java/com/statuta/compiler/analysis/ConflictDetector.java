package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.Program;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.item.EnumDecl;
import com.statuta.compiler.ast.item.FieldDecl;
import com.statuta.compiler.ast.item.Item;
import com.statuta.compiler.ast.item.LegalTestDecl;
import com.statuta.compiler.ast.item.Parameter;
import com.statuta.compiler.ast.item.ScopeDecl;
import com.statuta.compiler.ast.item.StructDecl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 跨文件冲突检测
 *
 * <p>比较两个程序中限定名相同的枚举、结构体与 legal_test：枚举成员、结构体字段或
 * requires 条目的名称序列不同即为冲突。定义完全相同的不报告。只比较语法树，
 * 不要求两个程序能通过解析或检查。</p>
 */
public final class ConflictDetector {

    private static final Logger LOG = Logger.getLogger(ConflictDetector.class.getName());

    /**
     * 按第一个程序中的声明顺序列出冲突
     */
    public List<DefinitionConflict> detect(Program first, Program second) {
        Definitions a = new Definitions();
        Definitions b = new Definitions();
        a.collect(first.getItems(), "");
        b.collect(second.getItems(), "");

        List<DefinitionConflict> conflicts = new ArrayList<>();
        compare(a.enums, b.enums, conflicts, DefinitionConflict.Kind.ENUM_VARIANTS);
        compare(a.structs, b.structs, conflicts, DefinitionConflict.Kind.STRUCT_FIELDS);
        compare(a.legalTests, b.legalTests, conflicts, DefinitionConflict.Kind.LEGAL_TEST_REQUIREMENTS);

        LOG.log(Level.FINE, "Compared {0} with {1}: {2} conflicts",
                new Object[]{first.getFileName(), second.getFileName(), conflicts.size()});
        return conflicts;
    }

    private void compare(Map<String, Definition> first, Map<String, Definition> second,
                         List<DefinitionConflict> out, DefinitionConflict.Kind kind) {
        for (Map.Entry<String, Definition> entry : first.entrySet()) {
            Definition other = second.get(entry.getKey());
            if (other == null || other.members.equals(entry.getValue().members)) {
                continue;
            }
            out.add(new DefinitionConflict(kind, entry.getKey(),
                    message(kind, entry.getKey(), entry.getValue().members, other.members),
                    entry.getValue().location, other.location));
        }
    }

    private static String message(DefinitionConflict.Kind kind, String name, List<String> first, List<String> second) {
        switch (kind) {
            case ENUM_VARIANTS:
                return "Enum '" + name + "' has conflicting variants: " + first + " vs " + second;
            case STRUCT_FIELDS:
                return "Struct '" + name + "' has conflicting fields: " + first + " vs " + second;
            default:
                return "Legal test '" + name + "' has conflicting requirements: " + first + " vs " + second;
        }
    }

    /** 定义的位置与成员名序列 */
    private static final class Definition {
        final SourceLocation location;
        final List<String> members;

        Definition(SourceLocation location, List<String> members) {
            this.location = location;
            this.members = members;
        }
    }

    /** 一个程序中按限定名登记的定义；同名重复时保留首个 */
    private static final class Definitions {
        final Map<String, Definition> enums = new LinkedHashMap<>();
        final Map<String, Definition> structs = new LinkedHashMap<>();
        final Map<String, Definition> legalTests = new LinkedHashMap<>();

        void collect(List<Item> items, String scopePath) {
            for (Item item : items) {
                String name = scopePath.isEmpty() ? item.getName() : scopePath + "." + item.getName();
                if (item instanceof ScopeDecl) {
                    collect(((ScopeDecl) item).getItems(), name);
                } else if (item instanceof EnumDecl) {
                    enums.putIfAbsent(name, new Definition(item.getLocation(),
                            ((EnumDecl) item).getVariantNames()));
                } else if (item instanceof StructDecl) {
                    List<String> fields = new ArrayList<>();
                    for (FieldDecl field : ((StructDecl) item).getFields()) {
                        fields.add(field.getName());
                    }
                    structs.putIfAbsent(name, new Definition(item.getLocation(), fields));
                } else if (item instanceof LegalTestDecl) {
                    List<String> requirements = new ArrayList<>();
                    for (Parameter p : ((LegalTestDecl) item).getRequirements()) {
                        requirements.add(p.getName());
                    }
                    legalTests.putIfAbsent(name, new Definition(item.getLocation(), requirements));
                }
            }
        }
    }
}
