package com.filefinder.action;

import com.filefinder.catalog.FileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * 通过平台命令（explorer / open / xdg-open）打开条目。
 */
public class DesktopEntryOpener implements EntryOpener {
    private static final Logger logger = LoggerFactory.getLogger(DesktopEntryOpener.class);

    private static final String WINDOWS_EXPLORER = "explorer.exe";
    private static final long LAUNCH_TIMEOUT_SECONDS = 3;

    private final String osName;

    public DesktopEntryOpener() {
        this(System.getProperty("os.name", ""));
    }

    DesktopEntryOpener(String osName) {
        this.osName = osName.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean open(FileEntry entry) {
        Path target = Path.of(entry.path());
        if (!Files.exists(target)) {
            logger.warn("打开失败，目标不存在: {}", entry.path());
            return false;
        }
        List<String> command = buildCommand(entry);
        try {
            Process process = startProcess(command);
            // 超时仍在运行视为已交给系统处理；explorer.exe 成功时也返回 1，不看退出码
            if (process.waitFor(LAUNCH_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                && process.exitValue() != 0
                && !command.get(0).equals(WINDOWS_EXPLORER)) {
                logger.warn("打开失败 {}: {} 退出码 {}", entry.path(), command.get(0), process.exitValue());
                return false;
            }
            logger.info("已打开 {}: {}", entry.kind().columnValue(), entry.path());
            return true;
        } catch (IOException | SecurityException exception) {
            logger.warn("打开失败 {}: {}", entry.path(), exception.getMessage());
            return false;
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            logger.warn("等待打开命令时被中断: {}", entry.path());
            return false;
        }
    }

    Process startProcess(List<String> command) throws IOException {
        return new ProcessBuilder(command).start();
    }

    List<String> buildCommand(FileEntry entry) {
        if (isWindows()) {
            if (entry.isFolder()) {
                return List.of(WINDOWS_EXPLORER, entry.path());
            }
            return List.of("cmd", "/c", "start", "\"\"", entry.path());
        }
        if (isMac()) {
            return List.of("open", entry.path());
        }
        return List.of("xdg-open", entry.path());
    }

    private boolean isWindows() {
        return osName.startsWith("windows");
    }

    private boolean isMac() {
        return osName.contains("mac") || osName.contains("darwin");
    }
}
