package org.drinkmap.driver.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.ServerApi;
import com.mongodb.ServerApiVersion;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.typesafe.config.Config;
import org.drinkmap.driver.DriverConfigurationException;
import org.drinkmap.driver.IDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Produces the shared {@link MongoDatabaseClient}.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code connection-string}: full URI; takes precedence over the discrete options</li>
 *   <li>{@code host} (default {@code localhost}), {@code port} (default 27017),
 *       {@code username}, {@code password}</li>
 *   <li>{@code database}: default database; required unless the connection string names one</li>
 *   <li>{@code server-api}: stable API version, default {@code "1"}</li>
 *   <li>{@code connect-timeout-ms}, {@code socket-timeout-ms}: default 120000</li>
 * </ul>
 * The connection is verified with a {@code ping} before the client is handed out.
 */
public class MongoDriver implements IDriver<MongoDatabaseClient> {

    public static final String NAME = "mongo";

    private static final Logger LOGGER = LoggerFactory.getLogger(MongoDriver.class);

    static final String DEFAULT_HOST = "localhost";
    static final int DEFAULT_PORT = 27017;
    static final String DEFAULT_SERVER_API = "1";
    static final int DEFAULT_TIMEOUT_MS = 120_000;
    private static final String ATLAS_DOMAIN = "mongodb.net";

    private final Function<MongoClientSettings, MongoClient> clientFactory;

    public MongoDriver() {
        this(MongoClients::create);
    }

    /**
     * @param clientFactory Creates the underlying client from the resolved settings.
     */
    public MongoDriver(final Function<MongoClientSettings, MongoClient> clientFactory) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    }

    @Override
    public MongoDatabaseClient initialize(final Config options) {
        final String uri = buildConnectionString(options);
        final ConnectionString connectionString;
        try {
            connectionString = new ConnectionString(uri);
        } catch (final IllegalArgumentException e) {
            throw new DriverConfigurationException(NAME, "Invalid connection string: " + e.getMessage());
        }

        final String database = optionalString(options, "database") != null
            ? optionalString(options, "database")
            : connectionString.getDatabase();
        if (database == null) {
            throw new DriverConfigurationException(NAME, "Either database or connection-string must be configured");
        }

        final MongoClientSettings settings = buildSettings(options, connectionString);
        LOGGER.debug("Connecting to MongoDB database '{}'", database);
        final MongoClient client = clientFactory.apply(settings);
        final MongoDatabaseClient databaseClient = new MongoDatabaseClient(client, database);
        try {
            databaseClient.ping();
        } catch (final MongoException e) {
            client.close();
            throw e;
        }
        LOGGER.debug("MongoDB connection to '{}' verified", database);
        return databaseClient;
    }

    @Override
    public void cleanup(final MongoDatabaseClient instance) {
        instance.close();
    }

    @Override
    public boolean healthCheck(final MongoDatabaseClient instance) {
        try {
            instance.ping();
            return true;
        } catch (final MongoException e) {
            LOGGER.warn("MongoDB health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Resolves the connection URI. An explicit {@code connection-string} wins; otherwise an
     * Atlas host with credentials gets an SRV URI, any other host with credentials a plain URI
     * with credentials, and a host without credentials a plain URI.
     *
     * @param options The driver options.
     * @return The URI.
     * @throws DriverConfigurationException if neither a database nor a connection string is configured.
     */
    static String buildConnectionString(final Config options) {
        final String explicit = optionalString(options, "connection-string");
        if (explicit == null && optionalString(options, "database") == null) {
            throw new DriverConfigurationException(NAME, "Either database or connection-string must be configured");
        }
        if (explicit != null) {
            return explicit;
        }

        final String host = options.hasPath("host") ? options.getString("host") : DEFAULT_HOST;
        final int port = options.hasPath("port") ? options.getInt("port") : DEFAULT_PORT;
        final String username = optionalString(options, "username");
        final String password = optionalString(options, "password");

        if (username != null && password != null) {
            final String credentials = escape(username) + ":" + escape(password);
            if (host.contains(ATLAS_DOMAIN)) {
                return "mongodb+srv://" + credentials + "@" + host;
            }
            return "mongodb://" + credentials + "@" + host + ":" + port;
        }
        return "mongodb://" + host + ":" + port;
    }

    // Credentials are percent-encoded, as ConnectionString decodes the user info.
    private static String escape(final String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static MongoClientSettings buildSettings(final Config options, final ConnectionString connectionString) {
        final String serverApi = options.hasPath("server-api") ? options.getString("server-api") : DEFAULT_SERVER_API;
        final int connectTimeout = options.hasPath("connect-timeout-ms")
            ? options.getInt("connect-timeout-ms")
            : DEFAULT_TIMEOUT_MS;
        final int socketTimeout = options.hasPath("socket-timeout-ms")
            ? options.getInt("socket-timeout-ms")
            : DEFAULT_TIMEOUT_MS;

        final ServerApiVersion version;
        try {
            version = ServerApiVersion.findByValue(serverApi);
        } catch (final MongoException | IllegalArgumentException e) {
            throw new DriverConfigurationException(NAME, "Unsupported server-api version: " + serverApi);
        }

        return MongoClientSettings.builder()
            .applyConnectionString(connectionString)
            .serverApi(ServerApi.builder().version(version).build())
            .applyToSocketSettings(socket -> socket
                .connectTimeout(connectTimeout, TimeUnit.MILLISECONDS)
                .readTimeout(socketTimeout, TimeUnit.MILLISECONDS))
            .build();
    }

    private static String optionalString(final Config options, final String path) {
        if (!options.hasPath(path)) {
            return null;
        }
        final String value = options.getString(path);
        return value.isBlank() ? null : value;
    }
}
