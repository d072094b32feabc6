package com.packagegraph.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.packagegraph.PackageGraphException;
import com.packagegraph.PackageGraphException.Reason;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigReader {

    public static final String CONFIG_FILE = "package_graph.json";

    private static final Gson GSON = new Gson();

    /**
     * Reads {@value #CONFIG_FILE} from {@code rootDir}. A missing file yields an empty config.
     *
     * @throws PackageGraphException INVALID_CONFIG if the file is empty, unreadable or not JSON
     */
    public GraphConfig read(Path rootDir) {
        Path configPath = rootDir.resolve(CONFIG_FILE);
        if (!Files.exists(configPath)) {
            return new GraphConfig();
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            GraphConfig config = GSON.fromJson(reader, GraphConfig.class);
            if (config == null) {
                throw new PackageGraphException(Reason.INVALID_CONFIG, configPath.toString(),
                        "Config file is empty or invalid JSON: " + configPath);
            }
            return config;
        } catch (JsonParseException e) {
            throw new PackageGraphException(Reason.INVALID_CONFIG, configPath.toString(),
                    "Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new PackageGraphException(Reason.INVALID_CONFIG, configPath.toString(),
                    "Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }
}
