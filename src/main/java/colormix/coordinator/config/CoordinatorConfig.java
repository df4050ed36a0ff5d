package colormix.coordinator.config;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/colormix;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // MQTT settings
    private String mqttHost = "localhost";
    private int mqttPort = 8883;
    private String mqttUsername = null;
    private String mqttPassword = null;
    private boolean mqttTls = true;
    private String mqttClientId = "colormix-coordinator";
    private int mqttKeepAliveSeconds = 60;

    // Topics
    private String deviceCommandTopic = "command/ot2OT2CEP20240218R0/pipette";
    private String sensorCommandTopic = "command/picow/e66130100f89513/as7341/read";
    private String deviceStatusTopic = "status/ot2OT2CEP20240218R0/complete";
    private String sensorDataTopic = "color-mixing/picow/e66130100f89513/as7341";

    // Queue settings
    private Duration taskTimeout = Duration.ofSeconds(165);
    private Duration pollInterval = Duration.ofSeconds(1);
    private int maxComponentVolume = 300;
    private int maxTotalVolume = 300;
    private int maxConcurrentStreams = 3;
    private int defaultQuota = 10;

    // Plate layout
    private String plateRows = "ABCDEFGH";
    private int plateColumns = 12;

    // Simulator
    private Duration simulatedDeviceDelay = Duration.ofSeconds(2);

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    /**
     * Load settings from an INI file on top of the defaults.
     */
    public static CoordinatorConfig fromIni(File file) throws IOException {
        return IniLoader.load(file);
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        // Override from environment variables
        String dbUrl = System.getenv("COLORMIX_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("COLORMIX_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String broker = System.getenv("MQTT_BROKER");
        if (broker != null && !broker.isBlank()) {
            config.mqttHost = broker;
        }

        String mqttPort = System.getenv("MQTT_PORT");
        if (mqttPort != null && !mqttPort.isBlank()) {
            config.mqttPort = Integer.parseInt(mqttPort);
        }

        String username = System.getenv("MQTT_USERNAME");
        if (username != null && !username.isBlank()) {
            config.mqttUsername = username;
        }

        String password = System.getenv("MQTT_PASSWORD");
        if (password != null && !password.isBlank()) {
            config.mqttPassword = password;
        }

        String timeout = System.getenv("COLORMIX_TASK_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            config.taskTimeout = Duration.ofSeconds(Long.parseLong(timeout));
        }

        String quota = System.getenv("COLORMIX_DEFAULT_QUOTA");
        if (quota != null && !quota.isBlank()) {
            config.defaultQuota = Integer.parseInt(quota);
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String mqttHost() {
        return mqttHost;
    }

    public int mqttPort() {
        return mqttPort;
    }

    public String mqttUsername() {
        return mqttUsername;
    }

    public String mqttPassword() {
        return mqttPassword;
    }

    public boolean mqttTls() {
        return mqttTls;
    }

    public String mqttClientId() {
        return mqttClientId;
    }

    public int mqttKeepAliveSeconds() {
        return mqttKeepAliveSeconds;
    }

    public String deviceCommandTopic() {
        return deviceCommandTopic;
    }

    public String sensorCommandTopic() {
        return sensorCommandTopic;
    }

    public String deviceStatusTopic() {
        return deviceStatusTopic;
    }

    public String sensorDataTopic() {
        return sensorDataTopic;
    }

    /** Topics the coordinator subscribes to. */
    public List<String> inboundTopics() {
        return List.of(deviceStatusTopic, sensorDataTopic);
    }

    public Duration taskTimeout() {
        return taskTimeout;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int maxComponentVolume() {
        return maxComponentVolume;
    }

    public int maxTotalVolume() {
        return maxTotalVolume;
    }

    public int maxConcurrentStreams() {
        return maxConcurrentStreams;
    }

    public int defaultQuota() {
        return defaultQuota;
    }

    public String plateRows() {
        return plateRows;
    }

    public int plateColumns() {
        return plateColumns;
    }

    public Duration simulatedDeviceDelay() {
        return simulatedDeviceDelay;
    }

    public boolean hasMqttCredentials() {
        return mqttUsername != null && !mqttUsername.isBlank();
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withMqttBroker(String host, int port) {
        this.mqttHost = host;
        this.mqttPort = port;
        return this;
    }

    public CoordinatorConfig withMqttCredentials(String username, String password) {
        this.mqttUsername = username;
        this.mqttPassword = password;
        return this;
    }

    public CoordinatorConfig withMqttTls(boolean tls) {
        this.mqttTls = tls;
        return this;
    }

    public CoordinatorConfig withMqttClientId(String clientId) {
        this.mqttClientId = clientId;
        return this;
    }

    public CoordinatorConfig withMqttKeepAliveSeconds(int seconds) {
        this.mqttKeepAliveSeconds = seconds;
        return this;
    }

    public CoordinatorConfig withDeviceCommandTopic(String topic) {
        this.deviceCommandTopic = topic;
        return this;
    }

    public CoordinatorConfig withSensorCommandTopic(String topic) {
        this.sensorCommandTopic = topic;
        return this;
    }

    public CoordinatorConfig withDeviceStatusTopic(String topic) {
        this.deviceStatusTopic = topic;
        return this;
    }

    public CoordinatorConfig withSensorDataTopic(String topic) {
        this.sensorDataTopic = topic;
        return this;
    }

    public CoordinatorConfig withTaskTimeout(Duration timeout) {
        this.taskTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public CoordinatorConfig withVolumeLimits(int maxComponent, int maxTotal) {
        this.maxComponentVolume = maxComponent;
        this.maxTotalVolume = maxTotal;
        return this;
    }

    public CoordinatorConfig withMaxConcurrentStreams(int streams) {
        this.maxConcurrentStreams = streams;
        return this;
    }

    public CoordinatorConfig withDefaultQuota(int quota) {
        this.defaultQuota = quota;
        return this;
    }

    public CoordinatorConfig withPlate(String rows, int columns) {
        this.plateRows = rows;
        this.plateColumns = columns;
        return this;
    }

    public CoordinatorConfig withSimulatedDeviceDelay(Duration delay) {
        this.simulatedDeviceDelay = delay;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", mqtt=" + mqttHost + ":" + mqttPort +
                ", tls=" + mqttTls +
                ", taskTimeout=" + taskTimeout +
                ", pollInterval=" + pollInterval +
                ", maxConcurrentStreams=" + maxConcurrentStreams +
                ", credentialsSet=" + hasMqttCredentials() +
                '}';
    }
}
