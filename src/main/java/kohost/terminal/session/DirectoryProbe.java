package kohost.terminal.session;

/**
 * 在执行环境内部检查逻辑路径是否为目录
 */
@FunctionalInterface
public interface DirectoryProbe {

    boolean isDirectory(String logicalPath);
}
