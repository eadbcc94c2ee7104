package com.statuta.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 各子命令共用的选项
 */
public class CommonOptions {

    @Option(names = "--config", description = "配置文件（默认查找当前目录下的 statuta.json）")
    Path config;

    @Option(names = {"-v", "--verbose"}, description = "输出 FINE 级别日志")
    boolean verbose;

    @Option(names = "--reference-date", paramLabel = "DD-MM-YYYY", description = "时效检查的参考日期（默认今天）")
    String referenceDate;

    @Option(names = {"-I", "--search-path"}, paramLabel = "DIR", description = "导入模块的搜索目录，可重复")
    List<String> searchPaths;

    @Option(names = "--json", description = "以 JSON 输出")
    boolean json;

    /** 配置文件与环境变量合并后，再叠加命令行参数 */
    StatutaConfig loadConfig(Map<String, String> env, Path workingDir) {
        return StatutaConfig.load(config != null ? workingDir.resolve(config) : null, workingDir, env)
                .overrideReferenceDate(referenceDate)
                .addSearchPaths(searchPaths, workingDir);
    }
}
