package de.bsommerfeld.retronews.reader;

import com.google.inject.AbstractModule;
import de.bsommerfeld.retronews.core.config.ApplicationMode;
import de.bsommerfeld.retronews.core.config.ConfigLoader;
import de.bsommerfeld.retronews.core.config.DatabaseConfig;
import de.bsommerfeld.retronews.core.config.GlobalConfig;
import de.bsommerfeld.retronews.core.config.HackerNewsConfig;
import de.bsommerfeld.retronews.core.config.ReaderConfig;
import de.bsommerfeld.retronews.core.util.StorageUtils;
import de.bsommerfeld.retronews.db.DatabaseService;
import de.bsommerfeld.retronews.db.SqlDatabaseService;
import de.bsommerfeld.retronews.db.TestDatabaseService;
import de.bsommerfeld.retronews.hn.HackerNewsClient;
import de.bsommerfeld.retronews.hn.TestHackerNewsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice wiring of the reader. Binds the configuration and its sections, and
 * picks the database and the Hacker News client according to the
 * {@link ApplicationMode}: TEST mode uses the in-memory store and generated
 * threads, so nothing touches the network or the user's data.
 */
public class ReaderModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ReaderModule.class);

    private final GlobalConfig config;
    private final ApplicationMode mode;

    public ReaderModule(GlobalConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    /** Loads {@code config.toml} from the app data directory. */
    public static GlobalConfig loadConfig() {
        Path configPath = StorageUtils.getConfigFile(StorageUtils.APP_NAME);
        LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
        return ConfigLoader.load(configPath);
    }

    @Override
    protected void configure() {
        bind(GlobalConfig.class).toInstance(config);
        bind(ReaderConfig.class).toInstance(config.getReader());
        bind(HackerNewsConfig.class).toInstance(config.getHackerNews());
        bind(DatabaseConfig.class).toInstance(config.getDatabase());

        LOG.info("Application mode: {}", mode);
        if (mode == ApplicationMode.TEST) {
            bind(DatabaseService.class).to(TestDatabaseService.class);
            bind(HackerNewsClient.class).to(TestHackerNewsClient.class);
        } else {
            bind(DatabaseService.class).to(SqlDatabaseService.class);
            // HackerNewsClient binds to itself (@Singleton on class)
        }
    }
}
