package main;

import ch.qos.logback.classic.Level;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.extensions.java6.auth.oauth2.AuthorizationCodeInstalledApp;
import com.google.api.client.extensions.jetty.auth.oauth2.LocalServerReceiver;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeFlow;
import com.google.api.client.googleapis.auth.oauth2.GoogleClientSecrets;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.client.util.store.FileDataStoreFactory;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.DriveScopes;
import migrator.Config;
import migrator.ConfigException;
import migrator.cache.CacheKeys;
import migrator.cache.ResponseCache;
import migrator.discovery.EnumerationException;
import migrator.discovery.TreeEnumerator;
import migrator.discovery.TreePrinter;
import migrator.governor.RateGovernor;
import migrator.progress.LoggingProgressListener;
import migrator.remote.DriveRemoteService;
import migrator.remote.RemoteNode;
import migrator.remote.RemoteService;
import migrator.remote.RemoteServiceException;
import migrator.sync.SyncEngine;
import migrator.sync.SyncResult;
import migrator.validation.ComparisonReport;
import migrator.validation.ComparisonReportPrinter;
import migrator.validation.TreeComparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "drive-migrator", mixinStandardHelpOptions = true, version = "drive-migrator 1.0",
        description = "Copies a Drive folder tree into another folder, skipping what is already there.")
public class Main implements Callable<Integer> {
    /**
     * Application name.
     */
    private static final String APPLICATION_NAME = "DriveMigrator/1.0";

    /**
     * Global instance of the JSON factory.
     */
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();

    /**
     * Global instance of the scopes required by this application.
     * <p>
     * If modifying these scopes, delete your previously saved credentials from the configured token directory.
     */
    private static final List<String> SCOPES = Collections.singletonList(DriveScopes.DRIVE);

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    @Option(names = "--config", defaultValue = "config.json", description = "Configuration file (default: ${DEFAULT-VALUE})")
    private Path configFile;

    @Option(names = "--compare", description = "Compare source and destination without copying anything")
    private boolean compare;

    @Option(names = "--detailed", description = "Include per-file details in the comparison report")
    private boolean detailed;

    @Option(names = "--print-structure", description = "Print the source and destination trees and exit")
    private boolean printStructure;

    @Option(names = "--log-level", description = "Root log level, overrides the configuration (TRACE, DEBUG, INFO, WARN, ERROR)")
    private String logLevel;

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }

    @Override
    public Integer call() {
        Config config;
        try {
            config = Config.load(configFile);
        } catch (ConfigException e) {
            System.err.println(e.getMessage());
            return 1;
        }
        setLogLevel(logLevel != null ? logLevel : config.getLogLevel());
        logger.debug("Starting up with {}", config);

        RemoteService remote;
        try {
            remote = new DriveRemoteService(getDriveService(config));
        } catch (IOException | GeneralSecurityException e) {
            logger.error("Couldn't build an authorized Drive client", e);
            return 1;
        }
        RateGovernor governor = new RateGovernor(config.getRateLimit(), config.getTimeWindow(), config.getMaxRetries());
        ResponseCache cache = new ResponseCache();

        try {
            if (printStructure) {
                printStructure(config, remote, governor, cache);
                return 0;
            }
            if (compare) {
                TreeComparator comparator = new TreeComparator(new TreeEnumerator(remote, governor, cache));
                ComparisonReport report = comparator.compare(config.getSourceFolderId(), config.getDestinationFolderId(), detailed);
                new ComparisonReportPrinter(System.out).print(report);
                return report.isIdentical() ? 0 : 1;
            }
        } catch (EnumerationException e) {
            logger.error("Couldn't enumerate folders", e);
            return 1;
        }

        SyncResult result = new SyncEngine(remote, governor, cache, config, new LoggingProgressListener(config.getBatchSize())).run();
        System.out.println(result);
        return result.isSuccess() ? 0 : 1;
    }

    private void printStructure(Config config, RemoteService remote, RateGovernor governor, ResponseCache cache) throws EnumerationException {
        TreeEnumerator enumerator = new TreeEnumerator(remote, governor, cache);
        TreePrinter printer = new TreePrinter();
        for (String folderId : new String[]{config.getSourceFolderId(), config.getDestinationFolderId()}) {
            String name = folderName(folderId, remote, governor, cache);
            System.out.println(printer.render(enumerator.enumerate(folderId), name));
        }
    }

    private String folderName(String folderId, RemoteService remote, RateGovernor governor, ResponseCache cache) {
        String key = CacheKeys.folderDetails(folderId);
        Optional<RemoteNode> folder = cache.get(key, RemoteNode.class);
        if (!folder.isPresent()) {
            try {
                folder = governor.executeWithRetry(() -> remote.getMetadata(folderId));
                folder.ifPresent(node -> cache.set(key, node));
            } catch (RemoteServiceException e) {
                logger.warn("Couldn't fetch details of folder {}", folderId, e);
            }
        }
        return folder.map(RemoteNode::getName).orElse(folderId);
    }

    private static void setLogLevel(String level) {
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(level, Level.INFO));
    }

    /**
     * Creates an authorized Credential object.
     *
     * @return an authorized Credential object.
     * @throws IOException If the client secrets can't be read.
     */
    private static Credential authorize(Config config, HttpTransport httpTransport) throws IOException {
        // Load client secrets.
        Path secretsPath = config.getClientSecretsPath();
        if (!Files.exists(secretsPath)) {
            throw new IOException("Client secrets file " + secretsPath.toAbsolutePath() + " not found");
        }
        GoogleClientSecrets clientSecrets;
        try (Reader in = Files.newBufferedReader(secretsPath, StandardCharsets.UTF_8)) {
            clientSecrets = GoogleClientSecrets.load(JSON_FACTORY, in);
        }

        // Build flow and trigger user authorization request.
        FileDataStoreFactory dataStoreFactory = new FileDataStoreFactory(config.getTokenDirectory().toFile());
        GoogleAuthorizationCodeFlow flow =
                new GoogleAuthorizationCodeFlow.Builder(
                        httpTransport, JSON_FACTORY, clientSecrets, SCOPES)
                        .setDataStoreFactory(dataStoreFactory)
                        .setAccessType("offline")
                        .build();
        Credential credential = new AuthorizationCodeInstalledApp(
                flow, new LocalServerReceiver()).authorize("user");
        logger.debug("Credentials saved to {}", config.getTokenDirectory().toAbsolutePath());
        return credential;
    }

    /**
     * Build and return an authorized Drive client service.
     *
     * @return an authorized Drive client service
     */
    private static Drive getDriveService(Config config) throws IOException, GeneralSecurityException {
        HttpTransport httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        Credential credential = authorize(config, httpTransport);
        return new Drive.Builder(
                httpTransport, JSON_FACTORY, credential)
                .setApplicationName(APPLICATION_NAME)
                // Increase timeout, https://stackoverflow.com/a/23717324/2333689
                .setHttpRequestInitializer(request -> {
                    credential.initialize(request);
                    request.setConnectTimeout(Config.TIMEOUT);
                    request.setReadTimeout(Config.TIMEOUT);
                })
                .build();
    }
}
