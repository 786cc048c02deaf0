package de.bsommerfeld.retronews.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Locates the per-user directory holding {@code config.toml}, the flag
 * database and the log files. Nothing here touches the file system; callers
 * create directories as needed.
 *
 * <pre>
 *   macOS    ~/Library/Application Support/{app}
 *   Windows  %APPDATA%\{app}          (or ~/AppData/Roaming/{app})
 *   other    $XDG_DATA_HOME/{app}     (or ~/.local/share/{app})
 * </pre>
 */
public final class StorageUtils {

    public static final String APP_NAME = "retronews";

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ROOT);
        String home = System.getProperty("user.home");

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(home, "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(home, "AppData", "Roaming", appName);
        }

        String xdgData = System.getenv("XDG_DATA_HOME");
        return xdgData != null && !xdgData.isEmpty()
                ? Paths.get(xdgData, appName)
                : Paths.get(home, ".local", "share", appName);
    }

    /** {@code {appDataDir}/logs}, the value handed to Logback as {@code LOG_DIR}. */
    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }

    public static Path getConfigFile(String appName) {
        return getAppDataDir(appName).resolve("config.toml");
    }
}
