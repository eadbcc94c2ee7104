package com.statuta.cli;

/**
 * 配置文件、环境变量或命令行参数无效
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
