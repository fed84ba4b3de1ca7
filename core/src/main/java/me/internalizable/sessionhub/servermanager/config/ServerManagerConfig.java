package me.internalizable.sessionhub.servermanager.config;

import me.internalizable.sessionhub.servermanager.registry.ServerDescriptor;
import me.internalizable.sessionhub.servermanager.registry.ServerKind;
import me.internalizable.sessionhub.servermanager.registry.ServerUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.TypeDescription;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the server manager.
 *
 * <p>Loaded from {@code sessionhub/servers.yml} and lists the servers the
 * user configured, plus the status refresh settings.</p>
 *
 * <pre>
 * localServers:
 *   - url: http://localhost:10000
 *     consoleType: python
 * remoteServers:
 *   - url: https://gateway.example.com:8123
 *     label: Prod
 * statusPollIntervalMillis: 10000
 * probeTimeoutMillis: 5000
 * </pre>
 */
public class ServerManagerConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerManagerConfig.class);

    private List<ServerEntry> localServers = new ArrayList<>();
    private List<ServerEntry> remoteServers = new ArrayList<>();
    private long statusPollIntervalMillis = 10_000;
    private long probeTimeoutMillis = 5_000;

    public ServerManagerConfig() {
    }

    /**
     * Create the configuration written when no file exists: a single local
     * server on the default port.
     *
     * @return default configuration
     */
    @Nonnull
    public static ServerManagerConfig defaults() {
        ServerManagerConfig config = new ServerManagerConfig();
        config.localServers.add(new ServerEntry("http://localhost:10000/", null, null));
        return config;
    }

    /**
     * Load configuration from file, creating default if not exists.
     *
     * @param path path to config file
     * @return loaded configuration
     * @throws IOException if loading fails
     */
    @Nonnull
    public static ServerManagerConfig load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            ServerManagerConfig config = defaults();
            config.save(path);
            return config;
        }

        try (InputStream is = Files.newInputStream(path)) {
            ServerManagerConfig config = newYaml().load(is);
            return config != null ? config : new ServerManagerConfig();
        }
    }

    /**
     * Load configuration from a reader.
     *
     * @param reader YAML source
     * @return loaded configuration, empty if the document is empty
     */
    @Nonnull
    public static ServerManagerConfig load(@Nonnull Reader reader) {
        ServerManagerConfig config = newYaml().load(reader);
        return config != null ? config : new ServerManagerConfig();
    }

    /**
     * Save configuration to file.
     *
     * @param path path to save to
     * @throws IOException if saving fails
     */
    public void save(@Nonnull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Representer representer = new Representer(options);
        representer.addClassTag(ServerEntry.class, Tag.MAP);
        Yaml yaml = new Yaml(representer, options);
        try (Writer writer = Files.newBufferedWriter(path)) {
            // Plain map root so the file loads without a global tag
            writer.write(yaml.dumpAs(this, Tag.MAP, null));
        }
    }

    /**
     * Turn the configured entries into server descriptors: local servers
     * first, then remote ones. Entries with an invalid URL are logged and skipped.
     *
     * @return descriptors in configuration order
     */
    @Nonnull
    public List<ServerDescriptor> toServerDescriptors() {
        List<ServerDescriptor> descriptors = new ArrayList<>();
        addDescriptors(descriptors, localServers, ServerKind.LOCAL);
        addDescriptors(descriptors, remoteServers, ServerKind.REMOTE);
        return descriptors;
    }

    private static void addDescriptors(List<ServerDescriptor> target, List<ServerEntry> entries, ServerKind kind) {
        if (entries == null) {
            return;
        }

        for (ServerEntry entry : entries) {
            if (entry == null || !ServerUrls.isValid(entry.getUrl())) {
                LOGGER.warn("Skipping {} server with invalid URL: {}",
                        kind.name().toLowerCase(), entry != null ? entry.getUrl() : null);
                continue;
            }
            target.add(ServerDescriptor.configured(
                    ServerUrls.parse(entry.getUrl()), kind, entry.getLabel(), entry.getConsoleType()));
        }
    }

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        Constructor constructor = new Constructor(ServerManagerConfig.class, options);

        TypeDescription description = new TypeDescription(ServerManagerConfig.class);
        description.addPropertyParameters("localServers", ServerEntry.class);
        description.addPropertyParameters("remoteServers", ServerEntry.class);
        constructor.addTypeDescription(description);

        return new Yaml(constructor);
    }

    // Getters and Setters

    public List<ServerEntry> getLocalServers() {
        return localServers;
    }

    public void setLocalServers(List<ServerEntry> localServers) {
        this.localServers = localServers;
    }

    public List<ServerEntry> getRemoteServers() {
        return remoteServers;
    }

    public void setRemoteServers(List<ServerEntry> remoteServers) {
        this.remoteServers = remoteServers;
    }

    public long getStatusPollIntervalMillis() {
        return statusPollIntervalMillis;
    }

    public void setStatusPollIntervalMillis(long statusPollIntervalMillis) {
        this.statusPollIntervalMillis = statusPollIntervalMillis;
    }

    public long getProbeTimeoutMillis() {
        return probeTimeoutMillis;
    }

    public void setProbeTimeoutMillis(long probeTimeoutMillis) {
        this.probeTimeoutMillis = probeTimeoutMillis;
    }

    /**
     * A configured server.
     */
    public static class ServerEntry {
        private String url;
        private String label;
        private String consoleType;

        public ServerEntry() {
        }

        public ServerEntry(String url, String label, String consoleType) {
            this.url = url;
            this.label = label;
            this.consoleType = consoleType;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getLabel() {
            return label;
        }

        public void setLabel(String label) {
            this.label = label;
        }

        public String getConsoleType() {
            return consoleType;
        }

        public void setConsoleType(String consoleType) {
            this.consoleType = consoleType;
        }
    }
}
