package com.statuta.compiler.pipeline;

import com.statuta.compiler.analysis.ResolveException;
import com.statuta.compiler.ast.Program;
import com.statuta.compiler.ast.item.ImportDecl;
import com.statuta.compiler.ast.item.Item;
import com.statuta.compiler.ast.item.StructDecl;
import com.statuta.compiler.parser.Parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 模块加载器：处理 {@code referencing A, B from path} 导入
 *
 * <p>路径先相对导入方所在目录查找，再依次查找配置的搜索目录；没有扩展名时补 {@code .sta}。
 * 已加载的模块按规范化路径缓存在本实例中，加载链上重复出现同一模块即为循环导入。</p>
 */
public final class ModuleLoader {

    private static final Logger LOG = Logger.getLogger(ModuleLoader.class.getName());

    public static final String EXTENSION = ".sta";

    private final List<Path> searchPaths;
    private final Map<Path, Module> cache = new HashMap<>();
    private final Deque<Path> loading = new ArrayDeque<>();

    public ModuleLoader(List<Path> searchPaths) {
        this.searchPaths = new ArrayList<>(searchPaths);
    }

    /**
     * 加载程序的全部导入，返回按导入顺序排列的外部条目
     *
     * @param baseDir 导入方所在目录，可为 null
     */
    public List<Item> loadImports(Program program, Path baseDir) {
        Map<String, Item> imported = new LinkedHashMap<>();
        for (ImportDecl decl : program.getImports()) {
            Module module = load(decl, baseDir);
            if (decl.isWildcard()) {
                for (Item item : module.visible.values()) {
                    imported.put(item.getName(), item);
                }
                continue;
            }
            for (String name : decl.getNames()) {
                Item item = module.visible.get(name);
                if (item == null) {
                    throw new ResolveException(ResolveException.Kind.UNRESOLVED_IMPORT, name,
                            "Module '" + decl.getModulePath() + "' has no item '" + name + "'", decl.getLocation());
                }
                imported.put(name, item);
                // 导入结构体时一并带入其祖先，保证展开字段时能找到父结构体
                Item cur = item;
                while (cur instanceof StructDecl && ((StructDecl) cur).hasParent()) {
                    String parent = ((StructDecl) cur).getExtendsName();
                    cur = module.visible.get(parent);
                    if (cur == null || imported.containsKey(parent)) break;
                    imported.put(parent, cur);
                }
            }
        }
        return new ArrayList<>(imported.values());
    }

    private Module load(ImportDecl decl, Path baseDir) {
        Path path = locate(decl, baseDir);
        Module cached = cache.get(path);
        if (cached != null) {
            return cached;
        }
        if (loading.contains(path)) {
            StringBuilder chain = new StringBuilder();
            boolean inCycle = false;
            for (Iterator<Path> it = loading.descendingIterator(); it.hasNext(); ) {
                Path p = it.next();
                if (p.equals(path)) inCycle = true;
                if (inCycle) chain.append(p.getFileName()).append(" -> ");
            }
            chain.append(path.getFileName());
            throw new ResolveException(ResolveException.Kind.IMPORT_CYCLE, decl.getModulePath(),
                    "Import cycle: " + chain, decl.getLocation());
        }

        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ResolveException(ResolveException.Kind.UNRESOLVED_IMPORT, decl.getModulePath(),
                    "Cannot read module '" + decl.getModulePath() + "': " + e.getMessage(), decl.getLocation(), e);
        }

        loading.push(path);
        try {
            LOG.log(Level.FINE, "Loading module {0}", path);
            Program program = Parser.forSource(source, path.toString()).parse();
            Map<String, Item> visible = new LinkedHashMap<>();
            for (Item item : loadImports(program, path.getParent())) {
                visible.put(item.getName(), item);
            }
            for (Item item : program.getItems()) {
                visible.put(item.getName(), item);
            }
            Module module = new Module(visible);
            cache.put(path, module);
            return module;
        } finally {
            loading.pop();
        }
    }

    private Path locate(ImportDecl decl, Path baseDir) {
        String name = decl.getModulePath();
        if (!name.endsWith(EXTENSION)) {
            name = name + EXTENSION;
        }
        List<Path> candidates = new ArrayList<>();
        if (baseDir != null) {
            candidates.add(baseDir.resolve(name));
        }
        for (Path dir : searchPaths) {
            candidates.add(dir.resolve(name));
        }
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                return candidate.toAbsolutePath().normalize();
            }
        }
        throw new ResolveException(ResolveException.Kind.UNRESOLVED_IMPORT, decl.getModulePath(),
                "Module '" + decl.getModulePath() + "' not found (searched " + candidates + ")", decl.getLocation());
    }

    /** 已加载的模块的可见条目（自身条目覆盖同名导入） */
    private static final class Module {
        final Map<String, Item> visible;

        Module(Map<String, Item> visible) {
            this.visible = visible;
        }
    }
}
