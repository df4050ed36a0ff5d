package colormix.coordinator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

/**
 * Loads coordinator settings from an INI file on top of the defaults.
 * Supported sections: [SERVER], [DATABASE], [MQTT], [TOPICS], [QUEUE], [PLATE],
 * [SIMULATION].
 * Every section and key is optional.
 */
public final class IniLoader {

    private IniLoader() {
    }

    public static CoordinatorConfig load(File file) throws IOException {
        return apply(new Ini(file), CoordinatorConfig.defaults());
    }

    static CoordinatorConfig apply(Ini ini, CoordinatorConfig cfg) {
        Profile.Section server = ini.get("SERVER");
        if (server != null) {
            String host = opt(server, "host");
            if (host != null) cfg.withServerHost(host);
            String port = opt(server, "port");
            if (port != null) cfg.withServerPort(Integer.parseInt(port));
        }

        Profile.Section db = ini.get("DATABASE");
        if (db != null) {
            String url = opt(db, "url");
            if (url != null) cfg.withDatabaseUrl(url);
            String pool = opt(db, "pool_size");
            if (pool != null) cfg.withDatabasePoolSize(Integer.parseInt(pool));
        }

        Profile.Section mqtt = ini.get("MQTT");
        if (mqtt != null) {
            String host = opt(mqtt, "broker", cfg.mqttHost());
            int port = Integer.parseInt(opt(mqtt, "port", String.valueOf(cfg.mqttPort())));
            cfg.withMqttBroker(host, port);

            String user = opt(mqtt, "username");
            if (user != null) cfg.withMqttCredentials(user, opt(mqtt, "password"));

            String tls = opt(mqtt, "tls");
            if (tls != null) cfg.withMqttTls(Boolean.parseBoolean(tls));

            String clientId = opt(mqtt, "client_id");
            if (clientId != null) cfg.withMqttClientId(clientId);

            String keepAlive = opt(mqtt, "keep_alive_seconds");
            if (keepAlive != null) cfg.withMqttKeepAliveSeconds(Integer.parseInt(keepAlive));
        }

        Profile.Section topics = ini.get("TOPICS");
        if (topics != null) {
            String t = opt(topics, "device_command");
            if (t != null) cfg.withDeviceCommandTopic(t);
            t = opt(topics, "sensor_command");
            if (t != null) cfg.withSensorCommandTopic(t);
            t = opt(topics, "device_status");
            if (t != null) cfg.withDeviceStatusTopic(t);
            t = opt(topics, "sensor_data");
            if (t != null) cfg.withSensorDataTopic(t);
        }

        Profile.Section queue = ini.get("QUEUE");
        if (queue != null) {
            String timeout = opt(queue, "task_timeout_seconds");
            if (timeout != null) cfg.withTaskTimeout(Duration.ofSeconds(Long.parseLong(timeout)));

            String poll = opt(queue, "poll_interval_ms");
            if (poll != null) cfg.withPollInterval(Duration.ofMillis(Long.parseLong(poll)));

            int maxComponent = Integer.parseInt(
                    opt(queue, "max_component_volume", String.valueOf(cfg.maxComponentVolume())));
            int maxTotal = Integer.parseInt(
                    opt(queue, "max_total_volume", String.valueOf(cfg.maxTotalVolume())));
            cfg.withVolumeLimits(maxComponent, maxTotal);

            String streams = opt(queue, "max_concurrent_streams");
            if (streams != null) cfg.withMaxConcurrentStreams(Integer.parseInt(streams));

            String quota = opt(queue, "default_quota");
            if (quota != null) cfg.withDefaultQuota(Integer.parseInt(quota));
        }

        Profile.Section plate = ini.get("PLATE");
        if (plate != null) {
            String rows = opt(plate, "rows", cfg.plateRows());
            int columns = Integer.parseInt(opt(plate, "columns", String.valueOf(cfg.plateColumns())));
            cfg.withPlate(rows, columns);
        }

        Profile.Section sim = ini.get("SIMULATION");
        if (sim != null) {
            String delay = opt(sim, "device_delay_ms");
            if (delay != null) cfg.withSimulatedDeviceDelay(Duration.ofMillis(Long.parseLong(delay)));
        }

        return cfg;
    }

    private static String opt(Profile.Section s, String key) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v == null ? def : v;
    }
}
