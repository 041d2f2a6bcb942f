package com.vesmooth.server.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.InputStream;

public class DataPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(DataPathResolver.class);

    public static final String DATA_DIR_PROPERTY = "vesmooth.data.dir";
    public static final String DEFAULT_DB_FILE = "smoothing_cache.db";

    public static String resolveDataDirectory() {
        // 1. Check System Property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Check Config File
        try {
            ObjectMapper mapper = new ObjectMapper();
            try (InputStream is = DataPathResolver.class.getResourceAsStream("/smoothing_config.json")) {
                if (is != null) {
                    JsonNode root = mapper.readTree(is);
                    if (root.has("smoothing_data_directory")) {
                        String configDir = root.get("smoothing_data_directory").asText();
                        if (configDir != null && !configDir.isEmpty()) {
                            return configDir;
                        }
                    }
                }
            }
        } catch (Exception e) {
            logger.warn("Failed to read smoothing_data_directory from config: {}", e.getMessage());
        }

        // 3. Default
        return ".";
    }

    public static String resolveDbPath(String dbFileName) {
        String name = (dbFileName != null && !dbFileName.isEmpty()) ? dbFileName : DEFAULT_DB_FILE;
        return resolveDataDirectory() + File.separator + name;
    }
}
